package com.openforge.writecrew.usage;

import com.openforge.writecrew.domain.UsageLedgerEntry;
import com.openforge.writecrew.repository.UsageLedgerRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class UsageLedgerWriterTest {

    private UsageLedgerRepository repository;
    private ExecutorService executor;
    private UsageLedgerWriter writer;

    @BeforeEach
    void setUp() {
        repository = mock(UsageLedgerRepository.class);
        executor = Executors.newSingleThreadExecutor();
        Retry retry = Retry.of("test-ledger", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        writer = new UsageLedgerWriter(repository, executor, CircuitBreaker.ofDefaults("test-ledger"), retry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static UsageLedgerEntry entry(String actionId) {
        return UsageLedgerEntry.builder()
                .agentInstanceId("agent-1")
                .actionId(actionId)
                .words(120)
                .recordedAt(Instant.parse("2026-03-02T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("a healthy append writes once")
    void appendWrites() {
        UsageLedgerEntry e = entry("a-1");

        writer.append(e).join();

        verify(repository).save(e);
        assertThat(writer.backlogSize()).isZero();
    }

    @Test
    @DisplayName("a failing store retries, parks the entry, and the append still completes normally")
    void failedAppendIsParked() {
        doThrow(new DataAccessResourceFailureException("db down")).when(repository).save(any(UsageLedgerEntry.class));

        writer.append(entry("a-1")).join();

        verify(repository, times(2)).save(any(UsageLedgerEntry.class));
        assertThat(writer.backlogSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("reconcile drains parked entries once the store is back")
    void reconcileDrainsBacklog() {
        doThrow(new DataAccessResourceFailureException("db down")).when(repository).save(any(UsageLedgerEntry.class));
        writer.append(entry("a-1")).join();
        writer.append(entry("a-2")).join();

        assertThat(writer.reconcile()).isZero();
        assertThat(writer.backlogSize()).isEqualTo(2);

        doAnswer(inv -> inv.getArgument(0)).when(repository).save(any(UsageLedgerEntry.class));

        assertThat(writer.reconcile()).isEqualTo(2);
        assertThat(writer.backlogSize()).isZero();
    }
}
