package com.openforge.writecrew.usage;

import com.openforge.writecrew.domain.UsageLedgerEntry;
import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.PermissionProperties;
import com.openforge.writecrew.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UsageTrackerTest {

    private static final String AGENT = "agent-1";

    private MutableClock clock;
    private UsageLedgerWriter ledger;
    private UsageTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        ledger = mock(UsageLedgerWriter.class);
        when(ledger.append(any())).thenReturn(CompletableFuture.completedFuture(null));
        tracker = new UsageTracker(clock, PermissionProperties.defaults(), ledger);
    }

    private static AgentAction write(int words, long costMicros) {
        return AgentAction.builder().type(ActionType.WRITE).estimatedWords(words).estimatedCostMicros(costMicros).build();
    }

    private static UsageLimits sessionWords(int max) {
        return new UsageLimits(max, null, null, null);
    }

    @Test
    @DisplayName("commit swaps the estimate for the actual usage and writes the ledger")
    void commitReplacesEstimate() {
        AgentAction action = write(300, 1_000);
        UsageReservation reservation = tracker.reserve(AGENT, "s1", null, action, UsageLimits.unlimited());
        assertThat(tracker.snapshot(AGENT).sessionWords()).isEqualTo(300);

        tracker.commit(reservation, action, new ActualUsage(250, 400, 900, "openai"));

        UsageReport report = tracker.snapshot(AGENT);
        assertThat(report.sessionWords()).isEqualTo(250);
        assertThat(report.dailyWords()).isEqualTo(250);
        assertThat(report.sessionCostMicros()).isEqualTo(900);
        assertThat(report.sessionTokens()).isEqualTo(400);

        ArgumentCaptor<UsageLedgerEntry> entry = ArgumentCaptor.forClass(UsageLedgerEntry.class);
        verify(ledger).append(entry.capture());
        assertThat(entry.getValue().getWords()).isEqualTo(250);
        assertThat(entry.getValue().getProvider()).isEqualTo("openai");
        assertThat(entry.getValue().getActionId()).isEqualTo(action.actionId());
    }

    @Test
    @DisplayName("a refused reservation leaves the counters untouched")
    void breachRollsBack() {
        tracker.reserve(AGENT, "s1", null, write(900, 0), sessionWords(1000));

        assertThatThrownBy(() -> tracker.reserve(AGENT, "s1", null, write(200, 0), sessionWords(1000)))
                .isInstanceOf(UsageLimitExceededException.class)
                .satisfies(e -> {
                    UsageLimitExceededException ex = (UsageLimitExceededException) e;
                    assertThat(ex.getLimitType()).isEqualTo("session_words");
                    assertThat(ex.getRemaining()).isEqualTo(100);
                    assertThat(ex.getRetryAfter()).isEqualTo(Duration.ofHours(8));
                    assertThat(ex.isCostLimit()).isFalse();
                });
        assertThat(tracker.snapshot(AGENT).sessionWords()).isEqualTo(900);
    }

    @Test
    @DisplayName("daily cost cap trips once session caps pass")
    void dailyCostBreach() {
        UsageLimits limits = new UsageLimits(null, null, null, 5_000L);
        tracker.reserve(AGENT, "s1", null, write(10, 4_000), limits);

        assertThatThrownBy(() -> tracker.reserve(AGENT, "s2", null, write(10, 2_000), limits))
                .isInstanceOf(UsageLimitExceededException.class)
                .satisfies(e -> assertThat(((UsageLimitExceededException) e).isCostLimit()).isTrue());
    }

    @Test
    @DisplayName("concurrent reservations never overshoot the cap")
    void concurrentReservationsRespectCap() throws Exception {
        int threads = 20;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    start.await();
                    try {
                        tracker.reserve(AGENT, "s1", null, write(100, 0), sessionWords(1000));
                        granted.incrementAndGet();
                    } catch (UsageLimitExceededException e) {
                        refused.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(granted.get()).isEqualTo(10);
        assertThat(refused.get()).isEqualTo(10);
        assertThat(tracker.snapshot(AGENT).sessionWords()).isEqualTo(1000);
    }

    @Test
    @DisplayName("release gives the budget back and settles only once")
    void releaseOnce() {
        AgentAction action = write(400, 0);
        UsageReservation reservation = tracker.reserve(AGENT, "s1", null, action, UsageLimits.unlimited());

        tracker.release(reservation);
        tracker.release(reservation);
        tracker.commit(reservation, action, new ActualUsage(400, 0, 0, null));

        assertThat(reservation.isSettled()).isTrue();
        assertThat(tracker.snapshot(AGENT).sessionWords()).isZero();
        verify(ledger, times(0)).append(any());
    }

    @Test
    @DisplayName("a new session id starts a fresh session window but keeps the day")
    void newSessionResetsSessionOnly() {
        tracker.record(AGENT, "s1", write(300, 0), new ActualUsage(300, 0, 0, null));

        tracker.record(AGENT, "s2", write(50, 0), new ActualUsage(50, 0, 0, null));

        UsageReport report = tracker.snapshot(AGENT);
        assertThat(report.sessionId()).isEqualTo("s2");
        assertThat(report.sessionWords()).isEqualTo(50);
        assertThat(report.dailyWords()).isEqualTo(350);
    }

    @Test
    @DisplayName("the session window expires after the configured length")
    void sessionWindowExpires() {
        tracker.record(AGENT, "s1", write(300, 0), new ActualUsage(300, 0, 0, null));

        clock.advance(Duration.ofHours(8));

        assertThat(tracker.snapshot(AGENT).sessionWords()).isZero();
        assertThat(tracker.snapshot(AGENT).dailyWords()).isEqualTo(300);
    }

    @Test
    @DisplayName("the daily counters reset at the reset hour")
    void dayRollsAtResetHour() {
        tracker.record(AGENT, "s1", write(300, 0), new ActualUsage(300, 0, 0, null));

        clock.set(Instant.parse("2026-03-02T23:59:59Z"));
        assertThat(tracker.snapshot(AGENT).dailyWords()).isEqualTo(300);

        clock.set(Instant.parse("2026-03-03T00:00:00Z"));
        assertThat(tracker.snapshot(AGENT).dailyWords()).isZero();
    }

    @Test
    @DisplayName("work committed after midnight is charged in full to the new day")
    void commitAcrossMidnight() {
        clock.set(Instant.parse("2026-03-02T23:59:00Z"));
        AgentAction action = write(200, 0);
        UsageReservation reservation = tracker.reserve(AGENT, "s1", null, action, UsageLimits.unlimited());

        clock.set(Instant.parse("2026-03-03T00:01:00Z"));
        tracker.commit(reservation, action, new ActualUsage(180, 0, 0, null));

        UsageReport report = tracker.snapshot(AGENT);
        assertThat(report.dailyWords()).isEqualTo(180);
        assertThat(report.sessionWords()).isEqualTo(180);
    }

    @Test
    @DisplayName("the caller's counters are used when they are higher than the tracked ones")
    void checkLimitsTakesHigherCounter() {
        tracker.record(AGENT, "s1", write(100, 0), new ActualUsage(100, 0, 0, null));
        ActionContext context = ActionContext.builder().sessionId("s1").sessionWordsSoFar(400).dailyWordsSoFar(50).build();

        UsageReport report = tracker.checkLimits(AGENT, context, write(30, 0));

        assertThat(report.sessionWords()).isEqualTo(400);
        assertThat(report.dailyWords()).isEqualTo(100);
        assertThat(report.projectedSessionWords()).isEqualTo(430);
    }

    @Test
    @DisplayName("the day key honours a non-midnight reset hour")
    void resetHourShiftsDay() {
        PermissionProperties sixAm = new PermissionProperties(Duration.ofMinutes(5), 50, 500, 6,
                Duration.ofHours(8), 5, 3);
        UsageTracker shifted = new UsageTracker(clock, sixAm, ledger);

        assertThat(shifted.dayKey(Instant.parse("2026-03-03T05:00:00Z"))).isEqualTo("2026-03-02");
        assertThat(shifted.dayKey(Instant.parse("2026-03-03T06:00:00Z"))).isEqualTo("2026-03-03");
        assertThat(shifted.nextDailyReset(Instant.parse("2026-03-03T05:00:00Z")))
                .isEqualTo(Instant.parse("2026-03-03T06:00:00Z"));
    }
}
