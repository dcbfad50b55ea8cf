package io.jobwarden.engine;

import io.jobwarden.core.AutomationJob;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.core.PerformAction;
import io.jobwarden.core.RunSummary;
import io.jobwarden.core.Timeplan;
import io.jobwarden.engine.InMemoryRecords.JobStoreStub;
import io.jobwarden.engine.InMemoryRecords.MapRecord;
import io.jobwarden.engine.InMemoryRecords.RecordStoreStub;
import io.jobwarden.engine.operator.BuiltinOperators;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRunnerTest {

    // Wednesday, bucket 10:20
    private static final Instant NOW = Instant.parse("2026-01-07T10:23:00Z");

    private static final String NEW = "1";
    private static final String OPEN = "2";
    private static final String CLOSED = "4";

    private JobStoreStub jobs;
    private RecordStoreStub records;
    private JobRunner runner;

    @BeforeEach
    void setUp() {
        jobs = new JobStoreStub();
        records = new RecordStoreStub();
        runner = new JobRunner(
                jobs,
                records,
                new TimeWindowMatcher(ZoneOffset.UTC),
                new ConditionEvaluator(BuiltinOperators.registry()),
                new ActionApplier(records, List.of()),
                RunnerOptions.defaults()
        );
    }

    @Test
    void closesOnlyStaleOpenTicketsOnceJobIsInWindow() {
        MapRecord t1 = records.add(ticket("t1", 1, NOW.minus(Duration.ofDays(3))));
        MapRecord t2 = records.add(ticket("t2", 1, NOW.minus(Duration.ofDays(1))));
        MapRecord t3 = records.add(ticket("t3", 2, NOW.minus(Duration.ofDays(1))));
        MapRecord t4 = records.add(ticket("t4", 4, NOW.minus(Duration.ofDays(3))));
        MapRecord t5 = records.add(ticket("t5", 2, NOW.minus(Duration.ofDays(3))));

        AutomationJob job = closeJob(Timeplan.never(), null, NOW);
        jobs.put(job);

        // freshly edited
        assertFalse(runner.isExecutable(job, NOW));
        assertFalse(runner.isExecutable(job.withLastRunAt(NOW.minus(Duration.ofMinutes(15))), NOW));

        job = closeJob(Timeplan.never(), null, NOW.minus(Duration.ofMinutes(15)));
        jobs.put(job);
        assertTrue(runner.isExecutable(job, NOW));
        assertFalse(runner.inTimeplan(job, NOW));

        assertFalse(runner.inTimeplan(closeJob(Timeplan.builder().day(DayOfWeek.WEDNESDAY).build(), null, job.updatedAt()), NOW));
        assertFalse(runner.inTimeplan(closeJob(Timeplan.builder().day(DayOfWeek.WEDNESDAY).hour(10).build(), null, job.updatedAt()), NOW));

        RunSummary idle = runner.runPass(NOW, "1");
        assertEquals(0, idle.jobsExecuted());
        assertEquals(0, records.saves());

        Timeplan wednesdayMorning = Timeplan.builder().day(DayOfWeek.WEDNESDAY).hour(10).minute(20).build();
        job = closeJob(wednesdayMorning, null, NOW.minus(Duration.ofMinutes(15)));
        jobs.put(job);
        assertTrue(runner.inTimeplan(job, NOW));

        RunSummary summary = runner.runPass(NOW, "1");

        assertEquals(1, summary.jobsExecuted());
        assertEquals(2, summary.recordsMatched());
        assertEquals(2, summary.recordsChanged());
        assertEquals(CLOSED, t1.field("state_id"));
        assertEquals(1, t2.field("state_id"));
        assertEquals(2, t3.field("state_id"));
        assertEquals(4, t4.field("state_id"));
        assertEquals(CLOSED, t5.field("state_id"));
        assertEquals(NOW, t1.field("updated_at"));
        assertEquals("1", t1.field("updated_by_id"));
        assertNull(t2.field("updated_at"));
        assertEquals(NOW, jobs.get("job-1").lastRunAt());
    }

    @Test
    void emptyHourAndMinuteMapsKeepJobOutOfWindow() {
        MapRecord t1 = records.add(ticket("t1", 1, NOW.minus(Duration.ofDays(3))));

        Timeplan daysOnly = Timeplan.fromMaps(
                Map.of("Mon", true, "Tue", true, "Wed", true, "Thu", true, "Fri", true, "Sat", true, "Sun", true),
                Map.of(),
                Map.of());
        jobs.put(new AutomationJob("job-2", "all days, no hours", daysOnly,
                List.of(ConditionPredicate.of("ticket.state_id", "is", "")),
                List.of(new PerformAction("ticket.state_id", CLOSED)),
                true, true, null, NOW.minus(Duration.ofHours(1))));

        RunSummary summary = runner.runPass(NOW, "1");

        assertEquals(1, summary.jobsConsidered());
        assertEquals(0, summary.jobsExecuted());
        assertEquals(1, t1.field("state_id"));
        assertNull(jobs.get("job-2").lastRunAt());
    }

    @Test
    void secondPassWithinCooldownChangesNothing() {
        records.add(ticket("t1", 1, NOW.minus(Duration.ofDays(3))));
        jobs.put(closeJob(Timeplan.always(), null, NOW.minus(Duration.ofHours(1))));

        assertEquals(1, runner.runPass(NOW, "1").recordsChanged());
        assertEquals(0, runner.runPass(NOW.plus(Duration.ofMinutes(5)), "1").jobsExecuted());
        assertEquals(NOW, jobs.get("job-1").lastRunAt());
    }

    @Test
    void rerunAfterCooldownIsIdempotent() {
        records.add(ticket("t1", 1, NOW.minus(Duration.ofDays(3))));
        jobs.put(closeJob(Timeplan.always(), null, NOW.minus(Duration.ofHours(1))));

        runner.runPass(NOW, "1");
        Instant later = NOW.plus(Duration.ofMinutes(15));
        RunSummary second = runner.runPass(later, "1");

        assertEquals(1, second.jobsExecuted());
        assertEquals(0, second.recordsMatched());
        assertEquals(0, second.recordsChanged());
        assertEquals(1, records.saves());
        assertEquals(later, jobs.get("job-1").lastRunAt());
    }

    @Test
    void tickJitterDoesNotSkipTheNextBucket() {
        AutomationJob job = closeJob(Timeplan.always(),
                Instant.parse("2026-01-07T10:20:00.005Z"), NOW.minus(Duration.ofHours(1)));

        assertTrue(runner.isExecutable(job, Instant.parse("2026-01-07T10:30:00.003Z")));
        assertFalse(runner.isExecutable(job, Instant.parse("2026-01-07T10:29:59.999Z")));
    }

    @Test
    void editedJobStillWaitsTheFullCooldown() {
        AutomationJob job = closeJob(Timeplan.always(), null, Instant.parse("2026-01-07T10:25:00Z"));

        assertFalse(runner.isExecutable(job, Instant.parse("2026-01-07T10:30:00Z")));
        assertTrue(runner.isExecutable(job, Instant.parse("2026-01-07T10:35:00Z")));
    }

    @Test
    void matchingRecordAlreadyHoldingTargetValueIsNotWritten() {
        MapRecord t1 = records.add(ticket("t1", 2, NOW.minus(Duration.ofDays(3))));
        jobs.put(new AutomationJob("job-4", "move stale tickets to group 1", Timeplan.always(),
                List.of(new ConditionPredicate("ticket.created_at", "before (relative)", "2", "day")),
                List.of(new PerformAction("ticket.group_id", "1")),
                true, true, null, NOW.minus(Duration.ofHours(1))));

        RunSummary first = runner.runPass(NOW, "1");
        Instant later = NOW.plus(Duration.ofMinutes(10));
        RunSummary second = runner.runPass(later, "1");

        assertEquals(1, first.recordsMatched());
        assertEquals(0, first.recordsChanged());
        assertEquals(1, second.jobsExecuted());
        assertEquals(1, second.recordsMatched());
        assertEquals(0, second.recordsChanged());
        assertEquals(0, records.saves());
        assertNull(t1.field("updated_at"));
        assertEquals(later, jobs.get("job-4").lastRunAt());
    }

    @Test
    void inactiveJobIsNeverExecutable() {
        AutomationJob job = new AutomationJob("job-3", "off", Timeplan.always(), List.of(), List.of(),
                false, true, null, NOW.minus(Duration.ofDays(1)));
        assertFalse(runner.isExecutable(job, NOW));
    }

    @Test
    void misconfiguredJobIsSkippedAndOthersStillRun() {
        MapRecord t1 = records.add(ticket("t1", 1, NOW.minus(Duration.ofDays(3))));
        jobs.put(new AutomationJob("job-bad", "bad operator", Timeplan.always(),
                List.of(ConditionPredicate.of("ticket.state_id", "resembles", "1")),
                List.of(new PerformAction("ticket.state_id", "3")),
                true, true, null, NOW.minus(Duration.ofHours(1))));
        jobs.put(closeJob(Timeplan.always(), null, NOW.minus(Duration.ofHours(1))));

        RunSummary summary = runner.runPass(NOW, "1");

        assertEquals(2, summary.jobsConsidered());
        assertEquals(1, summary.jobsExecuted());
        assertEquals(CLOSED, t1.field("state_id"));
        assertNull(jobs.get("job-bad").lastRunAt());
    }

    @Test
    void failingRecordIsSkippedWithoutStoppingTheJob() {
        MapRecord broken = records.add(new MapRecord("t0", "ticket")
                .with("state_id", 1)
                .with("created_at", "not a timestamp"));
        MapRecord t1 = records.add(ticket("t1", 2, NOW.minus(Duration.ofDays(3))));
        jobs.put(closeJob(Timeplan.always(), null, NOW.minus(Duration.ofHours(1))));

        RunSummary summary = runner.runPass(NOW, "1");

        assertEquals(1, summary.recordFailures());
        assertEquals(1, summary.recordsChanged());
        assertEquals(1, broken.field("state_id"));
        assertEquals(CLOSED, t1.field("state_id"));
        assertEquals(NOW, jobs.get("job-1").lastRunAt());
    }

    private static MapRecord ticket(String id, int stateId, Instant createdAt) {
        return new MapRecord(id, "ticket")
                .with("state_id", stateId)
                .with("group_id", 1)
                .with("created_at", createdAt);
    }

    private static AutomationJob closeJob(Timeplan timeplan, Instant lastRunAt, Instant updatedAt) {
        return new AutomationJob("job-1", "close stale tickets", timeplan,
                List.of(
                        ConditionPredicate.of("ticket.state_id", "is", List.of(NEW, OPEN)),
                        new ConditionPredicate("ticket.created_at", "before (relative)", "2", "day")
                ),
                List.of(new PerformAction("ticket.state_id", CLOSED)),
                true, true, lastRunAt, updatedAt);
    }
}
