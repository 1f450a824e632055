package dev.univer.points.config;

import dev.univer.points.sheets.InMemorySpreadsheetAdapter;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

@TestConfiguration
public class TestSheetsConfig {

    @Bean
    public InMemorySpreadsheetAdapter spreadsheetAdapter() {
        return new InMemorySpreadsheetAdapter();
    }
}
