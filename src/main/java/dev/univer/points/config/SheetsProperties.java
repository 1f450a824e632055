package dev.univer.points.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
@ConfigurationProperties(prefix = "sheets")
@Getter @Setter
public class SheetsProperties {
    private boolean enabled = true;
    private String spreadsheetId;
    private String credentialsPath;
    private String applicationName = "points-ledger-bot";
    // timestamps in the sheet are local to this zone
    private String zoneId = "UTC";
    // tab used when no group is given
    private String legacySheetName = "Sheet1";

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}
