package com.openforge.writecrew.usage;

import com.openforge.writecrew.domain.UsageLedgerEntry;
import com.openforge.writecrew.repository.UsageLedgerRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;

/**
 * Appends committed usage to the usage_ledger table off the caller's thread.
 *
 * Call graph:
 *
 *   append(entry)
 *     └─ collaborationExecutor
 *           └─ usageLedger circuit breaker + retry
 *                 └─ repository.save(entry)
 *                       ↓ (retries exhausted or breaker open)
 *     └─ parked in the backlog; reconcile() drains it on a fixed delay
 *
 * The returned future never completes exceptionally: a ledger failure must
 * not fail an action whose edit is already in the document.
 */
@Slf4j
@Component
public class UsageLedgerWriter {

    private final UsageLedgerRepository     repository;
    private final ExecutorService           executor;
    private final CircuitBreaker            circuitBreaker;
    private final Retry                     retry;
    private final Queue<UsageLedgerEntry>   backlog = new ConcurrentLinkedQueue<>();

    public UsageLedgerWriter(UsageLedgerRepository repository,
                             @Qualifier("collaborationExecutor") ExecutorService executor,
                             CircuitBreaker usageLedgerCircuitBreaker,
                             Retry usageLedgerRetry) {
        this.repository     = repository;
        this.executor       = executor;
        this.circuitBreaker = usageLedgerCircuitBreaker;
        this.retry          = usageLedgerRetry;
    }

    public CompletableFuture<Void> append(UsageLedgerEntry entry) {
        return CompletableFuture.runAsync(() -> write(entry), executor)
                .exceptionally(e -> {
                    log.warn("[Usage] Ledger append failed for agent={} action={}, parked for reconciliation: {}",
                            entry.getAgentInstanceId(), entry.getActionId(), e.getMessage());
                    backlog.add(entry);
                    return null;
                });
    }

    /**
     * Retries parked entries.  Stops at the first failure so a dead database
     * costs one attempt per sweep.
     *
     * @return number of entries written
     */
    @Scheduled(fixedDelayString = "${writecrew.collaboration.ledger-reconcile-interval:PT60S}")
    public int reconcile() {
        int written = 0;
        UsageLedgerEntry entry;
        while ((entry = backlog.peek()) != null) {
            try {
                write(entry);
            } catch (Exception e) {
                log.warn("[Usage] Ledger reconciliation stalled with {} entries pending: {}",
                        backlog.size(), e.getMessage());
                break;
            }
            backlog.poll();
            written++;
        }
        if (written > 0) {
            log.info("[Usage] Reconciled {} ledger entries", written);
        }
        return written;
    }

    public int backlogSize() {
        return backlog.size();
    }

    private void write(UsageLedgerEntry entry) {
        Runnable decorated = CircuitBreaker.decorateRunnable(circuitBreaker,
                Retry.decorateRunnable(retry, () -> repository.save(entry)));
        decorated.run();
    }
}
