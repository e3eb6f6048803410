package org.audioshelf.service.resolver;

import lombok.extern.slf4j.Slf4j;
import org.audioshelf.config.TaskExecutorConfig;
import org.audioshelf.model.dto.BatchResult;
import org.audioshelf.model.dto.BookEntity;
import org.audioshelf.service.store.ApprovalStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolves many entities on the bounded resolution pool. Each finished entity is written to the
 * store as soon as it is done, so cancelling a batch keeps everything resolved so far.
 */
@Slf4j
@Service
public class ResolutionBatchService {

    private final CascadeResolver cascadeResolver;
    private final ApprovalStore approvalStore;
    private final AsyncTaskExecutor resolutionExecutor;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile List<Future<Outcome>> activeBatch = List.of();

    public ResolutionBatchService(CascadeResolver cascadeResolver, ApprovalStore approvalStore,
                                  @Qualifier(TaskExecutorConfig.RESOLUTION_EXECUTOR) AsyncTaskExecutor resolutionExecutor) {
        this.cascadeResolver = cascadeResolver;
        this.approvalStore = approvalStore;
        this.resolutionExecutor = resolutionExecutor;
    }

    public BookEntity resolveOne(String id) {
        BookEntity entity = approvalStore.getOrThrow(id);
        return approvalStore.updateFields(cascadeResolver.resolve(entity));
    }

    public synchronized BatchResult resolveAll(Collection<String> ids) {
        cancelRequested.set(false);
        List<Future<Outcome>> futures = new CopyOnWriteArrayList<>();
        activeBatch = futures;
        for (String id : ids) {
            futures.add(resolutionExecutor.submit(() -> resolveQuietly(id)));
        }
        log.info("Resolving {} entities", futures.size());

        int resolved = 0;
        int incomplete = 0;
        int failed = 0;
        for (Future<Outcome> future : futures) {
            try {
                switch (future.get()) {
                    case COMPLETE -> resolved++;
                    case INCOMPLETE -> incomplete++;
                    case FAILED -> failed++;
                    case SKIPPED -> {
                        // cancelled before it started
                    }
                }
            } catch (CancellationException e) {
                log.debug("Resolution task cancelled");
            } catch (ExecutionException e) {
                failed++;
                log.error("Resolution task failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelBatch();
                break;
            }
        }
        activeBatch = List.of();

        BatchResult result = BatchResult.builder()
                .total(futures.size())
                .resolved(resolved)
                .incomplete(incomplete)
                .failed(failed)
                .cancelled(cancelRequested.get())
                .build();
        log.info("Resolution batch finished: {} complete, {} incomplete, {} failed of {}{}",
                resolved, incomplete, failed, futures.size(), result.isCancelled() ? " (cancelled)" : "");
        return result;
    }

    /**
     * Stops the running batch. Entities already resolved stay in the store; the others keep
     * whatever fields they had and can be resolved again later.
     *
     * @return whether a batch was running
     */
    public boolean cancelBatch() {
        List<Future<Outcome>> running = activeBatch;
        cancelRequested.set(true);
        running.forEach(f -> f.cancel(true));
        if (!running.isEmpty()) {
            log.info("Cancelling resolution batch of {} entities", running.size());
        }
        return !running.isEmpty();
    }

    private Outcome resolveQuietly(String id) {
        if (cancelRequested.get()) {
            return Outcome.SKIPPED;
        }
        Optional<BookEntity> entity = approvalStore.get(id);
        if (entity.isEmpty()) {
            log.warn("Entity {} disappeared before resolution", id);
            return Outcome.FAILED;
        }
        try {
            BookEntity resolved = cascadeResolver.resolve(entity.get());
            approvalStore.updateFields(resolved);
            return resolved.isComplete() ? Outcome.COMPLETE : Outcome.INCOMPLETE;
        } catch (CancellationException e) {
            return Outcome.SKIPPED;
        } catch (RuntimeException e) {
            log.error("Failed to resolve entity {}", id, e);
            return Outcome.FAILED;
        }
    }

    private enum Outcome {
        COMPLETE, INCOMPLETE, FAILED, SKIPPED
    }
}
