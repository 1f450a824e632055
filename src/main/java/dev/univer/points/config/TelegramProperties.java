package dev.univer.points.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "bot")
@Getter @Setter
public class TelegramProperties {
    private boolean enabled;
    private String username;
    private String token;
    // code a teacher sends with /teacher to register
    private String teacherCode;
}
