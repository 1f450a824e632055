package dev.univer.points.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "sync")
@Getter @Setter
public class SyncProperties {
    /** Run an initial pass over every partition at startup and start the loop if enabled in settings. */
    private boolean autoStart = true;
    private int defaultInterval = 10;
    private int minInterval = 5;
    private int maxInterval = 3600;
    /** Timestamps closer than this count as equal, and equal means the ledger wins. */
    private Duration timestampTolerance = Duration.ZERO;
    /** Treat one vanished tab plus one new tab as a rename. */
    private boolean renameDetection = true;
    /** Delay before the next tick after a tick threw. */
    private Duration errorBackoff = Duration.ofSeconds(5);
}
