package dev.univer.points.repo;

import dev.univer.points.model.GroupStatus;
import dev.univer.points.model.PartitionGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PartitionGroupRepository extends JpaRepository<PartitionGroup, String> {
    List<PartitionGroup> findAllByStatusOrderByNameAsc(GroupStatus status);
}
