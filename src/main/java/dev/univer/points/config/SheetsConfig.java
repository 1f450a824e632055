package dev.univer.points.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.SheetsScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.List;

@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "sheets", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SheetsConfig {

    private final SheetsProperties props;

    @Bean
    public Sheets sheetsService() throws IOException, GeneralSecurityException {
        if (props.getCredentialsPath() == null || props.getCredentialsPath().isBlank()) {
            throw new IllegalStateException("sheets.credentials-path must point to a service account key");
        }
        GoogleCredentials credentials;
        try (InputStream in = new FileInputStream(props.getCredentialsPath())) {
            credentials = GoogleCredentials.fromStream(in).createScoped(List.of(SheetsScopes.SPREADSHEETS));
        }
        log.info("Google Sheets client ready for spreadsheet {}", props.getSpreadsheetId());
        return new Sheets.Builder(GoogleNetHttpTransport.newTrustedTransport(),
                                  GsonFactory.getDefaultInstance(),
                                  new HttpCredentialsAdapter(credentials))
                .setApplicationName(props.getApplicationName())
                .build();
    }
}
