package dev.univer.points.repo;

import dev.univer.points.model.Account;
import dev.univer.points.model.AccountRole;
import dev.univer.points.model.AccountStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface AccountRepository extends JpaRepository<Account, String> {
    List<Account> findAllByRoleAndStatusOrderByBalanceDesc(AccountRole role, AccountStatus status);
    List<Account> findAllByRoleAndStatusAndGroupIdOrderByBalanceDesc(AccountRole role, AccountStatus status, String groupId);
    List<Account> findAllByRoleAndStatusAndGroupIdIsNullOrderByBalanceDesc(AccountRole role, AccountStatus status);
    List<Account> findAllByStatusIn(Collection<AccountStatus> statuses);
    List<Account> findAllByStatusAndGroupIdIsNotNull(AccountStatus status);

    @Query("select a from Account a where (:role is null or a.role = :role) " +
           "and (:status is null or a.status = :status) " +
           "and (:groupId is null or a.groupId = :groupId) order by a.id")
    List<Account> search(@Param("role") AccountRole role,
                         @Param("status") AccountStatus status,
                         @Param("groupId") String groupId);

    /**
     * Writes a balance only if nobody touched the row since {@code expectedVersion} was read.
     *
     * @return 1 when applied, 0 when the row moved on in the meantime
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.balance = :balance, a.lastModified = :now, a.version = a.version + 1 " +
           "where a.id = :id and a.version = :expectedVersion")
    int compareAndSetBalance(@Param("id") String id,
                             @Param("expectedVersion") Long expectedVersion,
                             @Param("balance") int balance,
                             @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.fullName = :fullName, a.phone = :phone, a.username = :username, " +
           "a.version = a.version + 1 where a.id = :id")
    int updateContactInfo(@Param("id") String id,
                          @Param("fullName") String fullName,
                          @Param("phone") String phone,
                          @Param("username") String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.groupId = :newGroup, a.version = a.version + 1 where a.groupId = :oldGroup")
    int regroup(@Param("oldGroup") String oldGroup, @Param("newGroup") String newGroup);
}
