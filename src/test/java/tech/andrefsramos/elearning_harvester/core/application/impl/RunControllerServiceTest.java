package tech.andrefsramos.elearning_harvester.core.application.impl;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.elearning_harvester.core.application.AdapterRegistry;
import tech.andrefsramos.elearning_harvester.core.application.CancellationSignal;
import tech.andrefsramos.elearning_harvester.core.application.StubAdapter;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.OutcomeStatus;
import tech.andrefsramos.elearning_harvester.core.domain.RunReport;
import tech.andrefsramos.elearning_harvester.core.domain.SourceOutcome;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.RenderUnavailableException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.UnknownSourceException;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class RunControllerServiceTest {

    private static RunControllerService controller(int concurrency, long graceMs, StubAdapter... adapters) {
        return new RunControllerService(AdapterRegistry.of(List.of(adapters)), concurrency, graceMs);
    }

    private static List<OutcomeStatus> statuses(RunReport report) {
        return report.outcomes().stream().map(SourceOutcome::status).toList();
    }

    private static void pause(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void run_all_isolates_a_failing_adapter() {
        StubAdapter a = StubAdapter.yielding("a", 2);
        StubAdapter b = StubAdapter.failing("b", new AdapterException("b", "base page unreachable"));
        StubAdapter c = StubAdapter.yielding("c", 0);

        RunReport report = controller(1, 1_000, a, b, c).runAll(new CancellationSignal());

        assertEquals(List.of("a-1", "a-2"), StubAdapter.ids(report.records()));
        assertEquals(List.of(OutcomeStatus.SUCCEEDED, OutcomeStatus.FAILED, OutcomeStatus.SUCCEEDED), statuses(report));
        assertTrue(report.outcomes().get(1).error().contains("base page unreachable"));
        assertEquals(1, report.count(OutcomeStatus.FAILED));
        assertEquals(1, c.invocations.get());
    }

    @Test
    void unexpected_runtime_errors_are_isolated_too() {
        StubAdapter boom = StubAdapter.failing("boom", new NullPointerException("npe"));
        StubAdapter render = StubAdapter.failing("render", new RenderUnavailableException("sem navegador"));
        StubAdapter ok = StubAdapter.yielding("ok", 1);

        RunReport report = controller(1, 1_000, boom, render, ok).runAll(null);

        assertEquals(List.of(OutcomeStatus.FAILED, OutcomeStatus.FAILED, OutcomeStatus.SUCCEEDED), statuses(report));
        assertEquals(List.of("ok-1"), StubAdapter.ids(report.records()));
    }

    @Test
    void aggregation_keeps_duplicates_across_sources() {
        StubAdapter x = new StubAdapter("x", "X", true, () -> Stream.of(StubAdapter.record("Shared", "same")));
        StubAdapter y = new StubAdapter("y", "Y", true, () -> Stream.of(StubAdapter.record("Shared", "same")));

        RunReport report = controller(1, 1_000, x, y).runAll(new CancellationSignal());

        assertEquals(List.of("same", "same"), StubAdapter.ids(report.records()));
    }

    @Test
    void not_allowed_adapters_are_skipped_without_running() {
        StubAdapter off = new StubAdapter("off", "Off", false, () -> Stream.of(StubAdapter.record("Off", "x")));
        StubAdapter on = StubAdapter.yielding("on", 1);

        RunReport report = controller(1, 1_000, off, on).runAll(new CancellationSignal());

        assertEquals(List.of(OutcomeStatus.SKIPPED, OutcomeStatus.SUCCEEDED), statuses(report));
        assertEquals(0, off.invocations.get());
    }

    @Test
    void concurrent_run_still_aggregates_in_registration_order() {
        StubAdapter slow = new StubAdapter("slow", "Slow", true, () -> {
            pause(300);
            return Stream.of(StubAdapter.record("Slow", "slow-1"));
        });
        StubAdapter mid = new StubAdapter("mid", "Mid", true, () -> {
            pause(100);
            return Stream.of(StubAdapter.record("Mid", "mid-1"), StubAdapter.record("Mid", "mid-2"));
        });
        StubAdapter fast = StubAdapter.yielding("fast", 1);

        RunReport report = controller(1, 1_000, slow, mid, fast).runAll(new CancellationSignal(), 3);

        assertEquals(List.of("slow-1", "mid-1", "mid-2", "fast-1"), StubAdapter.ids(report.records()));
    }

    @Test
    void cancellation_before_start_runs_nothing() {
        StubAdapter a = StubAdapter.yielding("a", 2);
        StubAdapter b = StubAdapter.yielding("b", 2);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel("teste");

        RunReport report = controller(2, 1_000, a, b).runAll(signal);

        assertEquals(List.of(OutcomeStatus.CANCELLED, OutcomeStatus.CANCELLED), statuses(report));
        assertTrue(report.records().isEmpty());
        assertEquals(0, a.invocations.get() + b.invocations.get());
    }

    @Test
    void in_flight_adapter_finishing_within_grace_keeps_its_records() {
        CancellationSignal signal = new CancellationSignal();
        StubAdapter first = new StubAdapter("first", "First", true, () -> {
            signal.cancel("ctrl-c");
            pause(50);
            return Stream.of(StubAdapter.record("First", "first-1"));
        });
        StubAdapter second = StubAdapter.yielding("second", 3);

        RunReport report = controller(1, 5_000, first, second).runAll(signal);

        assertEquals(List.of(OutcomeStatus.SUCCEEDED, OutcomeStatus.CANCELLED), statuses(report));
        assertEquals(List.of("first-1"), StubAdapter.ids(report.records()));
        assertEquals(0, second.invocations.get());
    }

    @Test
    void in_flight_adapter_past_grace_is_abandoned() {
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch never = new CountDownLatch(1);
        StubAdapter stuck = new StubAdapter("stuck", "Stuck", true, () -> {
            signal.cancel("ctrl-c");
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrompido", e);
            }
            return Stream.of(StubAdapter.record("Stuck", "late"));
        });
        StubAdapter next = StubAdapter.yielding("next", 1);

        long t0 = System.nanoTime();
        RunReport report = controller(1, 100, stuck, next).runAll(signal);
        long tookMs = (System.nanoTime() - t0) / 1_000_000;

        assertEquals(List.of(OutcomeStatus.ABANDONED, OutcomeStatus.CANCELLED), statuses(report));
        assertTrue(report.records().isEmpty());
        assertEquals(0, next.invocations.get());
        assertTrue(tookMs < 5_000, "took " + tookMs + "ms");
    }

    @Test
    void run_one_returns_all_records_of_the_adapter() {
        SourceOutcome outcome = controller(1, 1_000, StubAdapter.yielding("a", 3)).runOne("a");

        assertEquals(OutcomeStatus.SUCCEEDED, outcome.status());
        assertEquals(List.of("a-1", "a-2", "a-3"), StubAdapter.ids(outcome.records()));
    }

    @Test
    void run_one_unknown_key() {
        RunControllerService c = controller(1, 1_000, StubAdapter.yielding("a", 1));

        UnknownSourceException ex = assertThrows(UnknownSourceException.class, () -> c.runOne("nope"));
        assertEquals("nope", ex.key());
        assertTrue(ex.getMessage().contains("--list-sites"));
    }

    @Test
    void run_one_propagates_adapter_failure() {
        AdapterException original = new AdapterException("b", "down");
        RunControllerService c = controller(1, 1_000, StubAdapter.failing("b", original));

        assertSame(original, assertThrows(AdapterException.class, () -> c.runOne("b")));
    }

    @Test
    void run_one_wraps_unexpected_errors_keeping_the_cause() {
        IllegalStateException cause = new IllegalStateException("parser quebrou");
        RunControllerService c = controller(1, 1_000, StubAdapter.failing("b", cause));

        AdapterException ex = assertThrows(AdapterException.class, () -> c.runOne("b"));
        assertSame(cause, ex.getCause());
        assertEquals("b", ex.sourceKey());
    }

    @Test
    void run_one_skips_not_allowed_adapter() {
        StubAdapter off = new StubAdapter("off", "Off", false, Stream::<CourseRecord>empty);

        SourceOutcome outcome = controller(1, 1_000, off).runOne("off");

        assertEquals(OutcomeStatus.SKIPPED, outcome.status());
        assertTrue(outcome.records().isEmpty());
        assertEquals(0, off.invocations.get());
    }

    @Test
    void lists_sources_in_registration_order() {
        RunControllerService c = controller(1, 1_000, StubAdapter.yielding("b", 0), StubAdapter.yielding("a", 0));

        assertEquals(List.of("b", "a"), c.listSources().stream().map(s -> s.key()).toList());
    }
}
