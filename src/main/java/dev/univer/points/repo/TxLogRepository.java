package dev.univer.points.repo;

import dev.univer.points.model.TxLogEntry;
import dev.univer.points.model.TxType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TxLogRepository extends JpaRepository<TxLogEntry, Long> {
    List<TxLogEntry> findAllByOrderByCreatedAtDescIdDesc(Pageable page);
    List<TxLogEntry> findAllByTypeOrderByCreatedAtDescIdDesc(TxType type, Pageable page);

    @Query("select t from TxLogEntry t where t.senderId = :accountId or t.recipientId = :accountId " +
           "order by t.createdAt desc, t.id desc")
    List<TxLogEntry> findHistory(@Param("accountId") String accountId, Pageable page);
}
