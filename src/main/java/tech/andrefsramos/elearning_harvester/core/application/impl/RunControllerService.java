package tech.andrefsramos.elearning_harvester.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.application.AdapterRegistry;
import tech.andrefsramos.elearning_harvester.core.application.CancellationSignal;
import tech.andrefsramos.elearning_harvester.core.application.RunCoursesUseCase;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.OutcomeStatus;
import tech.andrefsramos.elearning_harvester.core.domain.RunReport;
import tech.andrefsramos.elearning_harvester.core.domain.SourceInfo;
import tech.andrefsramos.elearning_harvester.core.domain.SourceOutcome;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.ConfigurationException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.UnknownSourceException;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/*
 * Finalidade

 * Orquestra a execução dos adapters registrados:
 *  1) runOne: resolve a key no {@link AdapterRegistry}, respeita isAllowed() e materializa
 *     toda a saída do adapter. Falhas sobem como {@link AdapterException}.
 *  2) runAll: executa todos os adapters na ordem de registro, cada um dentro de uma fronteira
 *     de isolamento (exceção -> log + zero registros), com concorrência limitada opcional.
 *  3) Agrega os registros preservando a ordem de registro entre fontes e a ordem interna de
 *     cada adapter, sem deduplicação.

 * Cancelamento
 * - Com o sinal ativo nenhum adapter novo é iniciado (CANCELLED).
 * - Os que estão em andamento têm gracePeriodMs para terminar; depois são interrompidos e
 *   contam como ABANDONED (zero registros).
 */
public class RunControllerService implements RunCoursesUseCase {
    private static final Logger log = LoggerFactory.getLogger(RunControllerService.class);

    private static final long POLL_MS = 200;

    private final AdapterRegistry registry;
    private final int concurrency;
    private final long gracePeriodMs;

    public RunControllerService(AdapterRegistry registry, int concurrency, long gracePeriodMs) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.concurrency = Math.max(concurrency, 1);
        this.gracePeriodMs = Math.max(gracePeriodMs, 0);
    }

    @Override
    public List<SourceInfo> listSources() {
        return registry.list();
    }

    @Override
    public SourceOutcome runOne(String key) {
        final long t0 = System.nanoTime();
        final SourceAdapter adapter = registry.get(key)
                .orElseThrow(() -> new UnknownSourceException(key));

        log.info("[Run] Iniciando coleta source={} ({})", adapter.key(), adapter.displayName());

        try {
            if (!adapter.isAllowed()) {
                log.info("[Run] source={} não permitida (isAllowed=false). SKIPPED.", adapter.key());
                return SourceOutcome.skipped(adapter.key(), adapter.displayName());
            }
            List<CourseRecord> records = materialize(adapter);
            long tookMs = durMs(t0, System.nanoTime());
            log.info("[Run] FIM source={} registros={} ({} ms)", adapter.key(), records.size(), tookMs);
            return SourceOutcome.succeeded(adapter.key(), adapter.displayName(), records, tookMs);
        } catch (AdapterException | ConfigurationException e) {
            log.error("[Run] Falha na source={} ({}). Causa={}", adapter.key(), adapter.displayName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[Run] Exceção inesperada na source={} ({}). Causa={}",
                    adapter.key(), adapter.displayName(), e.getMessage(), e);
            throw new AdapterException(adapter.key(), String.valueOf(e.getMessage()), e);
        }
    }

    @Override
    public RunReport runAll(CancellationSignal signal) {
        return runAll(signal, concurrency);
    }

    @Override
    public RunReport runAll(CancellationSignal signal, int requestedConcurrency) {
        final long t0 = System.nanoTime();
        final CancellationSignal cancel = signal != null ? signal : new CancellationSignal();
        final List<SourceAdapter> adapters = registry.adapters();

        if (adapters.isEmpty()) {
            log.warn("[RunAll] Nenhum adapter registrado. Nada a executar.");
            return new RunReport(List.of(), 0);
        }

        final int workers = Math.min(Math.max(requestedConcurrency, 1), adapters.size());
        log.info("[RunAll] Iniciando coleta para {} fontes (concorrência={}, graceMs={})",
                adapters.size(), workers, gracePeriodMs);

        final ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        final List<SourceOutcome> outcomes = new ArrayList<>(adapters.size());
        try {
            final List<Future<SourceOutcome>> futures = new ArrayList<>(adapters.size());
            final List<AtomicBoolean> started = new ArrayList<>(adapters.size());
            for (SourceAdapter adapter : adapters) {
                final AtomicBoolean flag = new AtomicBoolean();
                started.add(flag);
                futures.add(pool.submit(() -> isolate(adapter, cancel, flag)));
            }
            for (int i = 0; i < adapters.size(); i++) {
                SourceOutcome outcome = await(futures.get(i), started.get(i), adapters.get(i), cancel, t0);
                outcomes.add(outcome);
                log.info("[RunAll] Fonte processada={} status={} registros={} em {} ms",
                        outcome.key(), outcome.status(), outcome.records().size(), outcome.elapsedMs());
            }
        } finally {
            pool.shutdownNow();
        }

        final RunReport report = new RunReport(outcomes, durMs(t0, System.nanoTime()));
        final List<String> failures = outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.FAILED)
                .map(o -> o.displayName() + " (" + o.error() + ")")
                .toList();

        log.info("[RunAll] FIM: ok={}, fail={}, skipped={}, cancelled={}, abandoned={}, registros={}, falhas={}, duração={} ms",
                report.count(OutcomeStatus.SUCCEEDED), report.count(OutcomeStatus.FAILED),
                report.count(OutcomeStatus.SKIPPED), report.count(OutcomeStatus.CANCELLED),
                report.count(OutcomeStatus.ABANDONED), report.records().size(), failures, report.elapsedMs());
        return report;
    }

    private SourceOutcome isolate(SourceAdapter adapter, CancellationSignal cancel, AtomicBoolean started) {
        if (cancel.isCancelled()) {
            log.info("[RunAll] Cancelamento ativo — source={} não será iniciada.", adapter.key());
            return SourceOutcome.cancelled(adapter.key(), adapter.displayName());
        }
        started.set(true);

        final long ti = System.nanoTime();
        try {
            if (!adapter.isAllowed()) {
                log.info("[RunAll] source={} não permitida (isAllowed=false). SKIPPED.", adapter.key());
                return SourceOutcome.skipped(adapter.key(), adapter.displayName());
            }
            List<CourseRecord> records = materialize(adapter);
            return SourceOutcome.succeeded(adapter.key(), adapter.displayName(), records, durMs(ti, System.nanoTime()));
        } catch (RuntimeException e) {
            log.error("[RunAll] Falha ao coletar {}: {}", adapter.displayName(), e.getMessage(), e);
            return SourceOutcome.failed(adapter.key(), adapter.displayName(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), durMs(ti, System.nanoTime()));
        }
    }

    private SourceOutcome await(Future<SourceOutcome> future, AtomicBoolean started, SourceAdapter adapter,
                                CancellationSignal cancel, long runStart) {
        final long graceNanos = TimeUnit.MILLISECONDS.toNanos(gracePeriodMs);
        while (true) {
            try {
                if (cancel.isCancelled()) {
                    long remaining = cancel.cancelledAtNanos() + graceNanos - System.nanoTime();
                    if (remaining <= 0 && !future.isDone()) {
                        if (!started.get()) {
                            // ainda na fila do pool: nunca chegou a executar
                            future.cancel(false);
                            log.info("[RunAll] source={} não iniciada antes do cancelamento. CANCELLED.", adapter.key());
                            return SourceOutcome.cancelled(adapter.key(), adapter.displayName());
                        }
                        future.cancel(true);
                        log.warn("[RunAll] source={} excedeu o período de graça ({} ms). ABANDONED.",
                                adapter.key(), gracePeriodMs);
                        return SourceOutcome.abandoned(adapter.key(), adapter.displayName(), durMs(runStart, System.nanoTime()));
                    }
                    return future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
                }
                return future.get(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException te) {
                log.trace("[RunAll] aguardando source={}", adapter.key());
            } catch (CancellationException ce) {
                if (!started.get()) {
                    return SourceOutcome.cancelled(adapter.key(), adapter.displayName());
                }
                return SourceOutcome.abandoned(adapter.key(), adapter.displayName(), durMs(runStart, System.nanoTime()));
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
                log.error("[RunAll] Erro fatal em {}: {}", adapter.displayName(), cause.toString(), cause);
                return SourceOutcome.failed(adapter.key(), adapter.displayName(), cause.toString(), durMs(runStart, System.nanoTime()));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cancel.cancel("thread do controlador interrompida");
                future.cancel(true);
                return SourceOutcome.abandoned(adapter.key(), adapter.displayName(), durMs(runStart, System.nanoTime()));
            }
        }
    }

    private static List<CourseRecord> materialize(SourceAdapter adapter) {
        try (Stream<CourseRecord> stream = adapter.iterCourses()) {
            if (stream == null) {
                return List.of();
            }
            return stream.filter(Objects::nonNull).toList();
        }
    }

    private static ThreadFactory workerThreads() {
        final AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "harvest-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
