package dev.univer.points.service;

import dev.univer.points.config.TestSheetsConfig;
import dev.univer.points.exception.MutationError;
import dev.univer.points.model.*;
import dev.univer.points.repo.AccountRepository;
import dev.univer.points.repo.BotSettingsRepository;
import dev.univer.points.repo.TxLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestSheetsConfig.class)
class TransferServiceTest {

    @Autowired private TransferService transferService;
    @Autowired private LedgerService ledgerService;
    @Autowired private AccountRepository accountRepository;
    @Autowired private TxLogRepository txLogRepository;
    @Autowired private BotSettingsRepository settingsRepository;
    @Autowired private BotSettingsService settingsService;

    @BeforeEach
    void setUp() {
        txLogRepository.deleteAll();
        accountRepository.deleteAll();
        settingsRepository.deleteAll();
    }

    private Account student(String id, int balance, AccountStatus status) {
        return ledgerService.createAccount(Account.builder()
                                                  .id(id)
                                                  .fullName("Student " + id)
                                                  .balance(balance)
                                                  .role(AccountRole.STUDENT)
                                                  .status(status)
                                                  .lastModified(Instant.parse("2025-01-01T00:00:00Z"))
                                                  .build());
    }

    @Test
    @DisplayName("a transfer debits amount plus commission and credits the amount")
    void transferDebitsAmountAndCommission() {
        student("s", 100, AccountStatus.ACTIVE);
        student("r", 0, AccountStatus.ACTIVE);

        MutationResult result = transferService.transferPoints("s", "r", 50, 5);

        assertThat(result.success()).isTrue();
        assertThat(result.balance()).isEqualTo(45);
        assertThat(result.counterpartBalance()).isEqualTo(50);
        assertThat(ledgerService.getAccount("s").getBalance()).isEqualTo(45);
        assertThat(ledgerService.getAccount("r").getBalance()).isEqualTo(50);
        assertThat(ledgerService.getAccount("s").getLastModified()).isAfter(Instant.parse("2025-01-01T00:00:00Z"));

        List<TxLogEntry> logs = ledgerService.recentLogs(10, TxType.TRANSFER);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getCommission()).isEqualTo(5);
        assertThat(logs.get(0).getSenderId()).isEqualTo("s");
    }

    @Test
    @DisplayName("an insufficient balance leaves both accounts untouched")
    void insufficientBalance() {
        student("s", 40, AccountStatus.ACTIVE);
        student("r", 7, AccountStatus.ACTIVE);

        MutationResult result = transferService.transferPoints("s", "r", 50, 5);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(MutationError.INSUFFICIENT_BALANCE);
        assertThat(ledgerService.getAccount("s").getBalance()).isEqualTo(40);
        assertThat(ledgerService.getAccount("r").getBalance()).isEqualTo(7);
        assertThat(txLogRepository.count()).isZero();
    }

    @Test
    void inactiveAccountsCannotTransfer() {
        student("s", 100, AccountStatus.ACTIVE);
        student("r", 0, AccountStatus.PENDING);

        MutationResult result = transferService.transferPoints("s", "r", 10, 1);

        assertThat(result.error()).isEqualTo(MutationError.INACTIVE_ACCOUNT);
        assertThat(ledgerService.getAccount("s").getBalance()).isEqualTo(100);
    }

    @Test
    void unknownAccount() {
        student("s", 100, AccountStatus.ACTIVE);

        assertThat(transferService.transferPoints("s", "ghost", 10, 1).error()).isEqualTo(MutationError.NOT_FOUND);
        assertThat(transferService.adjustBalance("ghost", 5).error()).isEqualTo(MutationError.NOT_FOUND);
    }

    @Test
    void invalidArguments() {
        student("s", 100, AccountStatus.ACTIVE);
        student("r", 0, AccountStatus.ACTIVE);

        assertThat(transferService.transferPoints("s", "s", 10, 1).error()).isEqualTo(MutationError.INVALID_ARGUMENT);
        assertThat(transferService.transferPoints("s", "r", 0, 0).error()).isEqualTo(MutationError.INVALID_ARGUMENT);
        assertThat(transferService.transferPoints("s", "r", 10, -1).error()).isEqualTo(MutationError.INVALID_ARGUMENT);
        assertThat(ledgerService.getAccount("s").getBalance()).isEqualTo(100);
    }

    @Test
    @DisplayName("transfer takes the commission rate from settings, rounded down")
    void commissionFromSettings() {
        student("s", 100, AccountStatus.ACTIVE);
        student("r", 0, AccountStatus.ACTIVE);
        settingsService.update(SettingsPatch.builder().commissionRate(0.10).build());

        MutationResult result = transferService.transfer("s", "r", 55);

        assertThat(result.success()).isTrue();
        assertThat(ledgerService.getAccount("s").getBalance()).isEqualTo(100 - 55 - 5);
        assertThat(ledgerService.getAccount("r").getBalance()).isEqualTo(55);
    }

    @Test
    void teacherAdjustmentsAreLogged() {
        student("s", 10, AccountStatus.ACTIVE);

        assertThat(transferService.addPoints("t", "s", 15, "quiz").balance()).isEqualTo(25);
        assertThat(transferService.subtractPoints("t", "s", 5, null).balance()).isEqualTo(20);

        List<TxLogEntry> history = ledgerService.history("s", 10);
        assertThat(history).extracting(TxLogEntry::getType).containsExactlyInAnyOrder(TxType.ADD, TxType.SUBTRACT);
        assertThat(history).allSatisfy(e -> assertThat(e.getActorId()).isEqualTo("t"));
        assertThat(ledgerService.recentLogs(10, TxType.SUBTRACT).get(0).getReason()).isEqualTo("No reason provided");
    }
}
