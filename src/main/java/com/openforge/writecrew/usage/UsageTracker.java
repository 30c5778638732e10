package com.openforge.writecrew.usage;

import com.openforge.writecrew.domain.UsageLedgerEntry;
import com.openforge.writecrew.permission.ActionContext;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.PermissionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling usage counters per agent instance.
 *
 * Two windows per agent:
 *   session → resets on a new session id, or once sessionWindow has elapsed
 *   daily   → resets at dailyResetHourUtc
 *
 * {@link #checkLimits} is read-only.  The write path is either
 * {@link #reserve} → {@link #commit} / {@link #release} (used by the
 * coordinator, closes the check-then-act race) or a direct
 * {@link #record} after execution.
 */
@Slf4j
@Service
public class UsageTracker {

    private final Clock                        clock;
    private final PermissionProperties         properties;
    private final UsageLedgerWriter            ledger;
    private final Map<String, UsageCounters>   counters = new ConcurrentHashMap<>();

    public UsageTracker(Clock clock, PermissionProperties properties, UsageLedgerWriter ledger) {
        this.clock      = clock;
        this.properties = properties;
        this.ledger     = ledger;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /**
     * Current counters for the context's session, never lower than what the
     * caller says it has used so far, with the action's estimate as the
     * pending amount.
     */
    public UsageReport checkLimits(String agentInstanceId, ActionContext context, AgentAction action) {
        Instant now = context.now() != null ? context.now() : clock.instant();
        UsageCounters c = counters.get(agentInstanceId);
        UsageReport tracked = c == null
                ? emptyReport(agentInstanceId, context.sessionId(), context.sessionStartedAt(), now)
                : c.view(agentInstanceId, context.sessionId(), context.sessionStartedAt(), now);

        return new UsageReport(
                agentInstanceId,
                context.sessionId(),
                Math.max(tracked.sessionWords(), context.sessionWordsSoFar()),
                Math.max(tracked.sessionCostMicros(), context.sessionCostSoFarMicros()),
                tracked.sessionTokens(),
                Math.max(tracked.dailyWords(), context.dailyWordsSoFar()),
                Math.max(tracked.dailyCostMicros(), context.dailyCostSoFarMicros()),
                tracked.dailyTokens(),
                action.estimatedWords(),
                action.estimatedCostMicros(),
                tracked.sessionStartedAt(),
                tracked.sessionResetsAt(),
                tracked.dailyResetsAt(),
                now);
    }

    /** Counters as of now, for the usage endpoint. */
    public UsageReport snapshot(String agentInstanceId) {
        Instant now = clock.instant();
        UsageCounters c = counters.get(agentInstanceId);
        if (c == null) {
            return emptyReport(agentInstanceId, null, null, now);
        }
        return c.view(agentInstanceId, null, null, now);
    }

    // ── Write ────────────────────────────────────────────────────────────────

    /**
     * Atomically adds the estimate to both windows and checks the caps.
     * On a breach the increment is rolled back before the exception leaves.
     *
     * @throws UsageLimitExceededException naming the first cap that tripped
     */
    public UsageReservation reserve(String agentInstanceId, String sessionId, Instant sessionStartedAt,
                                    AgentAction action, UsageLimits limits) {
        UsageCounters c = counters.computeIfAbsent(agentInstanceId, id -> new UsageCounters());
        UsageReservation reservation = c.reserve(agentInstanceId, sessionId, sessionStartedAt,
                action.estimatedWords(), action.estimatedTokens(), action.estimatedCostMicros(),
                limits, clock.instant());
        log.debug("[Usage] Reserved agent={} words={} costMicros={}",
                agentInstanceId, reservation.words(), reservation.costMicros());
        return reservation;
    }

    /**
     * Replaces the reserved estimate with the actual usage and appends the
     * actual usage to the ledger.  A reservation settles once; later calls
     * are ignored.
     */
    public void commit(UsageReservation reservation, AgentAction action, ActualUsage actual) {
        if (!reservation.settle()) {
            log.warn("[Usage] Reservation for agent={} already settled, commit ignored",
                    reservation.agentInstanceId());
            return;
        }
        Instant now = clock.instant();
        counters.get(reservation.agentInstanceId()).commit(reservation, actual, now);
        ledger.append(ledgerEntry(reservation.agentInstanceId(), reservation.sessionId(), action, actual, now));
    }

    /** Gives the reserved budget back.  No-op once settled. */
    public void release(UsageReservation reservation) {
        if (!reservation.settle()) {
            return;
        }
        counters.get(reservation.agentInstanceId()).release(reservation, clock.instant());
        log.debug("[Usage] Released reservation agent={} words={}",
                reservation.agentInstanceId(), reservation.words());
    }

    /** Adds executed usage directly, without a prior reservation. */
    public void record(String agentInstanceId, String sessionId, AgentAction action, ActualUsage actual) {
        Instant now = clock.instant();
        counters.computeIfAbsent(agentInstanceId, id -> new UsageCounters())
                .add(sessionId, actual, now);
        ledger.append(ledgerEntry(agentInstanceId, sessionId, action, actual, now));
    }

    // ── Windows ──────────────────────────────────────────────────────────────

    String dayKey(Instant now) {
        return LocalDate.ofInstant(now.minus(properties.dailyResetHourUtc(), ChronoUnit.HOURS), ZoneOffset.UTC)
                .toString();
    }

    Instant nextDailyReset(Instant now) {
        Instant todayReset = now.atZone(ZoneOffset.UTC)
                .toLocalDate()
                .atTime(properties.dailyResetHourUtc(), 0)
                .toInstant(ZoneOffset.UTC);
        return todayReset.isAfter(now) ? todayReset : todayReset.plus(1, ChronoUnit.DAYS);
    }

    private Duration sessionWindow() {
        return properties.sessionWindow();
    }

    private Instant effectiveSessionStart(Instant hint, Instant now) {
        if (hint != null && !hint.isAfter(now) && hint.plus(sessionWindow()).isAfter(now)) {
            return hint;
        }
        return now;
    }

    private UsageReport emptyReport(String agentInstanceId, String sessionId, Instant sessionStartHint, Instant now) {
        Instant start = effectiveSessionStart(sessionStartHint, now);
        return new UsageReport(agentInstanceId, sessionId, 0, 0, 0, 0, 0, 0, 0, 0,
                start, start.plus(sessionWindow()), nextDailyReset(now), now);
    }

    private static UsageLedgerEntry ledgerEntry(String agentInstanceId, String sessionId, AgentAction action,
                                                ActualUsage actual, Instant now) {
        return UsageLedgerEntry.builder()
                .agentInstanceId(agentInstanceId)
                .sessionId(sessionId)
                .actionId(action == null ? null : action.actionId())
                .actionType(action == null ? null : action.type())
                .words(actual.words())
                .tokens(actual.tokens())
                .costMicros(actual.costMicros())
                .provider(actual.provider())
                .recordedAt(now)
                .build();
    }

    /**
     * Mutable counters for one agent.  Every method is synchronized on the
     * instance; contention is per agent only.
     */
    private final class UsageCounters {

        private String  sessionId;
        private Instant sessionStart;
        private long    sessionWords;
        private long    sessionCost;
        private long    sessionTokens;

        private String  day;
        private long    dailyWords;
        private long    dailyCost;
        private long    dailyTokens;

        synchronized UsageReport view(String agentInstanceId, String requestedSession, Instant sessionStartHint, Instant now) {
            boolean sameDay = dayKey(now).equals(day);
            boolean sameSession = sessionStart != null
                    && (requestedSession == null || requestedSession.equals(sessionId))
                    && sessionStart.plus(sessionWindow()).isAfter(now);
            Instant start = sameSession ? sessionStart : effectiveSessionStart(sessionStartHint, now);
            return new UsageReport(
                    agentInstanceId,
                    sameSession ? sessionId : requestedSession,
                    sameSession ? sessionWords : 0,
                    sameSession ? sessionCost : 0,
                    sameSession ? sessionTokens : 0,
                    sameDay ? dailyWords : 0,
                    sameDay ? dailyCost : 0,
                    sameDay ? dailyTokens : 0,
                    0, 0,
                    start,
                    start.plus(sessionWindow()),
                    nextDailyReset(now),
                    now);
        }

        synchronized UsageReservation reserve(String agentInstanceId, String session, Instant sessionStartHint,
                                              int words, long tokens, long cost, UsageLimits limits, Instant now) {
            roll(session, sessionStartHint, now);

            sessionWords += words;
            dailyWords += words;
            sessionCost += cost;
            dailyCost += cost;
            sessionTokens += tokens;
            dailyTokens += tokens;

            String breached = null;
            long limit = 0;
            long total = 0;
            if (exceeds(sessionWords, limits.maxWordsPerSession())) {
                breached = "session_words";
                limit = limits.maxWordsPerSession();
                total = sessionWords;
            } else if (exceeds(dailyWords, limits.maxWordsPerDay())) {
                breached = "daily_words";
                limit = limits.maxWordsPerDay();
                total = dailyWords;
            } else if (exceeds(sessionCost, limits.maxCostPerSessionMicros())) {
                breached = "session_cost";
                limit = limits.maxCostPerSessionMicros();
                total = sessionCost;
            } else if (exceeds(dailyCost, limits.maxCostPerDayMicros())) {
                breached = "daily_cost";
                limit = limits.maxCostPerDayMicros();
                total = dailyCost;
            }

            if (breached != null) {
                sessionWords -= words;
                dailyWords -= words;
                sessionCost -= cost;
                dailyCost -= cost;
                sessionTokens -= tokens;
                dailyTokens -= tokens;
                long amount = breached.endsWith("_words") ? words : cost;
                long remaining = Math.max(0, limit - (total - amount));
                Duration retryAfter = breached.startsWith("session")
                        ? Duration.between(now, sessionStart.plus(sessionWindow()))
                        : Duration.between(now, nextDailyReset(now));
                log.info("[Usage] Reservation refused agent={} limit={} remaining={}",
                        agentInstanceId, breached, remaining);
                throw new UsageLimitExceededException(breached, remaining, retryAfter);
            }
            return new UsageReservation(agentInstanceId, sessionId, sessionStart, day, words, tokens, cost);
        }

        /**
         * Same window: swap the estimate for the actual figures.  Rolled
         * session: the old session is gone, leave the new one alone.  Rolled
         * day: the work finished today, so today carries it in full.
         */
        synchronized void commit(UsageReservation r, ActualUsage actual, Instant now) {
            rollDay(now);
            if (sameSession(r)) {
                sessionWords = Math.max(0, sessionWords - r.words() + actual.words());
                sessionCost = Math.max(0, sessionCost - r.costMicros() + actual.costMicros());
                sessionTokens = Math.max(0, sessionTokens - r.tokens() + actual.tokens());
            }
            if (r.dayKey().equals(day)) {
                dailyWords = Math.max(0, dailyWords - r.words() + actual.words());
                dailyCost = Math.max(0, dailyCost - r.costMicros() + actual.costMicros());
                dailyTokens = Math.max(0, dailyTokens - r.tokens() + actual.tokens());
            } else {
                dailyWords += actual.words();
                dailyCost += actual.costMicros();
                dailyTokens += actual.tokens();
            }
        }

        synchronized void release(UsageReservation r, Instant now) {
            rollDay(now);
            if (sameSession(r)) {
                sessionWords = Math.max(0, sessionWords - r.words());
                sessionCost = Math.max(0, sessionCost - r.costMicros());
                sessionTokens = Math.max(0, sessionTokens - r.tokens());
            }
            if (r.dayKey().equals(day)) {
                dailyWords = Math.max(0, dailyWords - r.words());
                dailyCost = Math.max(0, dailyCost - r.costMicros());
                dailyTokens = Math.max(0, dailyTokens - r.tokens());
            }
        }

        synchronized void add(String session, ActualUsage actual, Instant now) {
            roll(session, null, now);
            sessionWords += actual.words();
            sessionCost += actual.costMicros();
            sessionTokens += actual.tokens();
            dailyWords += actual.words();
            dailyCost += actual.costMicros();
            dailyTokens += actual.tokens();
        }

        private boolean sameSession(UsageReservation r) {
            return r.sessionStartedAt().equals(sessionStart)
                    && (r.sessionId() == null ? sessionId == null : r.sessionId().equals(sessionId));
        }

        private void roll(String session, Instant sessionStartHint, Instant now) {
            rollDay(now);
            boolean expired = sessionStart == null || !sessionStart.plus(sessionWindow()).isAfter(now);
            boolean switched = session != null && !session.equals(sessionId);
            if (expired || switched) {
                sessionId = session;
                sessionStart = effectiveSessionStart(sessionStartHint, now);
                sessionWords = 0;
                sessionCost = 0;
                sessionTokens = 0;
            }
        }

        private void rollDay(Instant now) {
            String today = dayKey(now);
            if (!today.equals(day)) {
                day = today;
                dailyWords = 0;
                dailyCost = 0;
                dailyTokens = 0;
            }
        }

        private boolean exceeds(long value, Number cap) {
            return cap != null && value > cap.longValue();
        }
    }
}
