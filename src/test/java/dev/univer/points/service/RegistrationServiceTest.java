package dev.univer.points.service;

import dev.univer.points.config.TestSheetsConfig;
import dev.univer.points.exception.AccountNotFoundException;
import dev.univer.points.model.AccountRole;
import dev.univer.points.model.AccountStatus;
import dev.univer.points.model.PartitionGroup;
import dev.univer.points.model.GroupStatus;
import dev.univer.points.repo.AccountRepository;
import dev.univer.points.repo.PartitionGroupRepository;
import dev.univer.points.repo.TxLogRepository;
import dev.univer.points.service.RegistrationService.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestSheetsConfig.class)
class RegistrationServiceTest {

    @Autowired private RegistrationService registrationService;
    @Autowired private LedgerService ledgerService;
    @Autowired private AccountRepository accountRepository;
    @Autowired private PartitionGroupRepository groupRepository;
    @Autowired private TxLogRepository txLogRepository;

    @BeforeEach
    void setUp() {
        txLogRepository.deleteAll();
        accountRepository.deleteAll();
        groupRepository.deleteAll();
        groupRepository.save(PartitionGroup.builder()
                                           .name("10A")
                                           .displayName("10A")
                                           .status(GroupStatus.ACTIVE)
                                           .createdAt(Instant.now())
                                           .build());
    }

    @Test
    @DisplayName("a student goes pending, active, removed, pending restore and back to active")
    void studentLifecycle() {
        var reg = registrationService.registerStudent("42", " Ann Lee ", "+1", "ann", "10A");
        assertThat(reg.outcome()).isEqualTo(Outcome.REGISTERED);
        assertThat(reg.account().getFullName()).isEqualTo("Ann Lee");
        assertThat(registrationService.pendingApprovals()).extracting("id").containsExactly("42");

        registrationService.approve("42");
        assertThat(ledgerService.getAccount("42").getStatus()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(registrationService.registerStudent("42", "Ann Lee", null, null, "10A").outcome())
                .isEqualTo(Outcome.ALREADY_ACTIVE);

        registrationService.remove("42");
        assertThat(ledgerService.getAccount("42").getStatus()).isEqualTo(AccountStatus.DELETED);

        assertThat(registrationService.registerStudent("42", "Ann Lee", null, null, "10A").outcome())
                .isEqualTo(Outcome.RESTORE_REQUESTED);
        assertThat(ledgerService.getAccount("42").getStatus()).isEqualTo(AccountStatus.PENDING_RESTORE);
        assertThat(registrationService.registerStudent("42", "Ann Lee", null, null, "10A").outcome())
                .isEqualTo(Outcome.ALREADY_PENDING);

        registrationService.approveRestore("42");
        assertThat(ledgerService.getAccount("42").getStatus()).isEqualTo(AccountStatus.ACTIVE);
    }

    @Test
    void rejectedRegistrationIsDeleted() {
        registrationService.registerStudent("42", "Ann Lee", null, null, "10A");

        registrationService.reject("42");

        assertThat(accountRepository.findById("42")).isEmpty();
        assertThatThrownBy(() -> registrationService.reject("42")).isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void rejectedRestoreBansTheAccount() {
        registrationService.registerStudent("42", "Ann Lee", null, null, "10A");
        registrationService.approve("42");
        registrationService.remove("42");
        registrationService.requestRestore("42");

        registrationService.rejectRestore("42");

        assertThat(ledgerService.getAccount("42").getStatus()).isEqualTo(AccountStatus.BANNED);
        assertThat(registrationService.registerStudent("42", "Ann Lee", null, null, "10A").outcome())
                .isEqualTo(Outcome.BANNED);
    }

    @Test
    void transitionsOutOfOrderAreRefused() {
        registrationService.registerStudent("42", "Ann Lee", null, null, "10A");

        assertThatThrownBy(() -> registrationService.remove("42")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registrationService.approveRestore("42")).isInstanceOf(IllegalStateException.class);
        registrationService.approve("42");
        assertThatThrownBy(() -> registrationService.reject("42")).isInstanceOf(IllegalStateException.class);
        assertThat(ledgerService.getAccount("42").getStatus()).isEqualTo(AccountStatus.ACTIVE);
    }

    @Test
    void registrationNeedsNameAndKnownGroup() {
        assertThatThrownBy(() -> registrationService.registerStudent("1", " ", null, null, "10A"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registrationService.registerStudent("1", "Bo", null, null, "10Z"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(accountRepository.findById("1")).isEmpty();
    }

    @Test
    void teacherNeedsTheCode() {
        assertThatThrownBy(() -> registrationService.registerTeacher("7", "Mr T", "t", "guess"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registrationService.isTeacher("7")).isFalse();

        var teacher = registrationService.registerTeacher("7", "Mr T", "t", "let-me-in");

        assertThat(teacher.getRole()).isEqualTo(AccountRole.TEACHER);
        assertThat(teacher.getStatus()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(registrationService.isTeacher("7")).isTrue();
    }
}
