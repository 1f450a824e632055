package dev.univer.points.service;

import dev.univer.points.config.TestSheetsConfig;
import dev.univer.points.model.Account;
import dev.univer.points.model.AccountRole;
import dev.univer.points.model.AccountStatus;
import dev.univer.points.repo.AccountRepository;
import dev.univer.points.repo.TxLogRepository;
import dev.univer.points.service.ComparisonService.ComparisonReport;
import dev.univer.points.sheets.InMemorySpreadsheetAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestSheetsConfig.class)
class ComparisonServiceTest {

    @Autowired private ComparisonService comparisonService;
    @Autowired private InMemorySpreadsheetAdapter sheet;
    @Autowired private AccountRepository accountRepository;
    @Autowired private TxLogRepository txLogRepository;

    @BeforeEach
    void setUp() {
        txLogRepository.deleteAll();
        accountRepository.deleteAll();
        sheet.reset();
        sheet.addTab("10A");
    }

    private void student(String id, int balance) {
        accountRepository.save(Account.builder()
                                      .id(id)
                                      .fullName("Student " + id)
                                      .balance(balance)
                                      .role(AccountRole.STUDENT)
                                      .status(AccountStatus.ACTIVE)
                                      .groupId("10A")
                                      .createdAt(Instant.now())
                                      .build());
    }

    @Test
    void reportsDifferencesWithoutWriting() {
        student("1", 10);
        student("2", 20);
        student("3", 30);
        sheet.putRaw("10A", "1", "Student 1", "", "", "10", "");
        sheet.putRaw("10A", "2", "Student 2", "", "", "25", "");
        sheet.putRaw("10A", "9", "Someone", "", "", "1", "");

        ComparisonReport report = comparisonService.compare("10A");

        assertThat(report.sheet()).isEqualTo("10A");
        assertThat(report.common()).isEqualTo(2);
        assertThat(report.onlyInLedger()).containsExactly("3");
        assertThat(report.onlyInSheet()).containsExactly("9");
        assertThat(report.mismatches()).singleElement().satisfies(m -> {
            assertThat(m.accountId()).isEqualTo("2");
            assertThat(m.ledgerBalance()).isEqualTo(20);
            assertThat(m.sheetBalance()).isEqualTo(25);
        });
        assertThat(report.inSync()).isFalse();
        assertThat(sheet.writeCount()).isZero();
        assertThat(accountRepository.findById("9")).isEmpty();
    }

    @Test
    void matchingDataIsInSync() {
        student("1", 10);
        sheet.putRaw("10A", "1", "Student 1", "", "", "10", "");

        assertThat(comparisonService.compare("10A").inSync()).isTrue();
    }
}
