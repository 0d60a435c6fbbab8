package com.flowgrid.orchestrator.repository;

import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Postgres-backed store; the default unless {@code flowgrid.grid.store=memory}. */
@Component
@ConditionalOnProperty(name = "flowgrid.grid.store", havingValue = "jpa", matchIfMissing = true)
public class JpaGridJobStore implements GridJobStore {

    private final GridJobRepository repository;

    public JpaGridJobStore(GridJobRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void insert(GridJob job) {
        repository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GridJob> findById(UUID id) {
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GridJob> findPending(int limit) {
        return repository.findByStatusOrderByCreatedAtAsc(
                GridJobStatus.PENDING, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<GridJob> findChildren(UUID parentJobId) {
        return repository.findByParentJobIdOrderByCreatedAtAsc(parentJobId);
    }

    @Override
    @Transactional
    public boolean claim(UUID id, String workerId) {
        return repository.claim(id, workerId, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public boolean complete(UUID id, String resultJson) {
        return repository.complete(id, resultJson, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public boolean fail(UUID id, String error) {
        return repository.fail(id, error, Instant.now()) == 1;
    }
}
