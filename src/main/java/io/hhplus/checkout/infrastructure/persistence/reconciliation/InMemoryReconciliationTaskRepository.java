package io.hhplus.checkout.infrastructure.persistence.reconciliation;

import io.hhplus.checkout.domain.reconciliation.ReconciliationTask;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTask.TaskStatus;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTaskRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryReconciliationTaskRepository implements ReconciliationTaskRepository {

    private final Map<Long, ReconciliationTask> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public ReconciliationTask save(ReconciliationTask task) {
        if (task.getId() == null) {
            try {
                var idField = ReconciliationTask.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(task, idGenerator.getAndIncrement());
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(task.getId(), task);
        return task;
    }

    @Override
    public Optional<ReconciliationTask> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<ReconciliationTask> findRetryable(LocalDateTime now, int limit) {
        return storage.values().stream()
                .filter(task -> task.getStatus() == TaskStatus.PENDING
                        && task.getNextRetryAt() != null
                        && !task.getNextRetryAt().isAfter(now))
                .sorted(Comparator.comparing(ReconciliationTask::getNextRetryAt))
                .limit(limit)
                .toList();
    }

    @Override
    public List<ReconciliationTask> findOperatorQueue() {
        return storage.values().stream()
                .filter(ReconciliationTask::needsOperator)
                .sorted(Comparator.comparing(ReconciliationTask::getId))
                .toList();
    }

    @Override
    public List<ReconciliationTask> findByRawWebhookId(Long rawWebhookId) {
        return storage.values().stream()
                .filter(task -> task.getRawWebhookId().equals(rawWebhookId))
                .sorted(Comparator.comparing(ReconciliationTask::getId))
                .toList();
    }

    @Override
    public long countByStatus(TaskStatus status) {
        return storage.values().stream().filter(task -> task.getStatus() == status).count();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
