package io.hhplus.checkout.infrastructure.persistence.reconciliation;

import io.hhplus.checkout.domain.reconciliation.ReconciliationTask;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTask.TaskStatus;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTaskRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaReconciliationTaskRepository
        extends JpaRepository<ReconciliationTask, Long>, ReconciliationTaskRepository {

    @Override
    ReconciliationTask save(ReconciliationTask task);

    @Override
    Optional<ReconciliationTask> findById(Long id);

    @Override
    default List<ReconciliationTask> findRetryable(LocalDateTime now, int limit) {
        return findByStatusAndNextRetryAtBefore(TaskStatus.PENDING, now, PageRequest.of(0, limit));
    }

    @Query("SELECT t FROM ReconciliationTask t " +
           "WHERE t.status = :status AND t.nextRetryAt <= :now " +
           "ORDER BY t.nextRetryAt ASC")
    List<ReconciliationTask> findByStatusAndNextRetryAtBefore(@Param("status") TaskStatus status,
                                                              @Param("now") LocalDateTime now,
                                                              Pageable pageable);

    @Override
    default List<ReconciliationTask> findOperatorQueue() {
        return findByStatusInOrderByCreatedAtAsc(List.of(TaskStatus.AWAITING_OPERATOR, TaskStatus.FAILED));
    }

    List<ReconciliationTask> findByStatusInOrderByCreatedAtAsc(Collection<TaskStatus> statuses);

    @Override
    List<ReconciliationTask> findByRawWebhookId(Long rawWebhookId);

    @Override
    long countByStatus(TaskStatus status);
}
