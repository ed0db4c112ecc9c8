package tech.andrefsramos.elearning_harvester.adapters.inbound.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.andrefsramos.elearning_harvester.core.application.CancellationSignal;
import tech.andrefsramos.elearning_harvester.core.application.RunCoursesUseCase;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.OutcomeStatus;
import tech.andrefsramos.elearning_harvester.core.domain.RunReport;
import tech.andrefsramos.elearning_harvester.core.domain.SourceInfo;
import tech.andrefsramos.elearning_harvester.core.domain.SourceOutcome;
import tech.andrefsramos.elearning_harvester.core.domain.errors.HarvestException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.UnknownSourceException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.UsageException;
import tech.andrefsramos.elearning_harvester.core.ports.CourseSink;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * HarvestCommand

 * Descrição geral:
 * - Interface de linha de comando da coleta: lista as fontes, executa uma fonte (--site) ou
 *   todas (--all) e grava o resultado agregado em CSV (--out).

 * Códigos de saída:
 * - 0: sucesso (inclusive rodadas --all com falhas isoladas).
 * - 1: falha do adapter em modo --site ou falha de I/O ao gravar.
 * - 2: uso incorreto (flags conflitantes, ausentes ou inválidas), antes de qualquer acesso à rede.
 * - 3: fonte desconhecida.

 * Em qualquer condição fatal uma linha é escrita em stderr e nenhum arquivo é gerado.
 * Um shutdown hook (Ctrl-C) ativa o {@link CancellationSignal} da rodada --all e aguarda, por até
 * {@code shutdownWaitMs}, que os registros já coletados sejam gravados (ver {@link ShutdownGate}).
 */
@Command(
        name = "elearning-harvester",
        mixinStandardHelpOptions = true,
        description = "Coleta cursos das plataformas de e-learning registradas e grava um CSV unificado."
)
public class HarvestCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HarvestCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_UNKNOWN_SOURCE = 3;

    @Spec
    CommandSpec spec;

    @Option(names = "--site", paramLabel = "<key>", description = "Executa uma única fonte (veja --list-sites).")
    String site;

    @Option(names = "--all", description = "Executa todas as fontes registradas.")
    boolean all;

    @Option(names = "--out", paramLabel = "<path>", description = "Arquivo CSV de saída (padrão: app.output.default-path).")
    Path out;

    @Option(names = "--list-sites", description = "Lista as fontes disponíveis e sai.")
    boolean listSites;

    @Option(names = "--concurrency", paramLabel = "<n>", description = "Fontes executadas em paralelo no modo --all (padrão: app.run.concurrency).")
    Integer concurrency;

    private final RunCoursesUseCase runner;
    private final CourseSink sink;
    private final Path defaultOut;
    private final int defaultConcurrency;
    private final long shutdownWaitMs;

    public HarvestCommand(RunCoursesUseCase runner, CourseSink sink, Path defaultOut,
                          int defaultConcurrency, long shutdownWaitMs) {
        this.runner = Objects.requireNonNull(runner, "runner is required");
        this.sink = Objects.requireNonNull(sink, "sink is required");
        this.defaultOut = Objects.requireNonNull(defaultOut, "defaultOut is required");
        this.defaultConcurrency = Math.max(defaultConcurrency, 1);
        this.shutdownWaitMs = Math.max(shutdownWaitMs, 0);
    }

    @Override
    public Integer call() {
        final PrintWriter stdout = spec.commandLine().getOut();
        final PrintWriter stderr = spec.commandLine().getErr();

        if (listSites) {
            printSites(stdout);
            return EXIT_OK;
        }

        final long start = System.nanoTime();
        try {
            validate();
            if (site != null) {
                return write(runSingle(), stdout, start);
            }
            final ShutdownGate gate = new ShutdownGate(shutdownWaitMs);
            final Thread hook = new Thread(gate::onShutdown, "harvest-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                return write(runEverything(gate.signal()), stdout, start);
            } finally {
                gate.release();
                removeHook(hook);
            }
        } catch (UsageException e) {
            return fatal(stderr, EXIT_USAGE, "Uso incorreto: " + e.getMessage());
        } catch (UnknownSourceException e) {
            return fatal(stderr, EXIT_UNKNOWN_SOURCE, e.getMessage());
        } catch (HarvestException e) {
            return fatal(stderr, EXIT_FAILURE, "Falha na coleta: " + e.getMessage());
        } catch (IOException | UncheckedIOException e) {
            return fatal(stderr, EXIT_FAILURE, "Falha ao gravar o CSV: " + e.getMessage());
        }
    }

    private void validate() {
        if (site != null && all) {
            throw new UsageException("use --site <key> ou --all, não ambos.");
        }
        if (site == null && !all) {
            throw new UsageException("informe --site <key> ou --all. Use --list-sites para ver as fontes.");
        }
        if (concurrency != null && concurrency < 1) {
            throw new UsageException("--concurrency deve ser >= 1 (recebido " + concurrency + ").");
        }
    }

    private List<CourseRecord> runSingle() {
        SourceOutcome outcome = runner.runOne(site);
        if (outcome.status() == OutcomeStatus.SKIPPED) {
            log.warn("HarvestCommand: fonte {} não permitida (desligada ou sem URL configurada). Nenhum registro coletado.",
                    outcome.key());
        }
        return outcome.records();
    }

    private List<CourseRecord> runEverything(CancellationSignal signal) {
        RunReport report = runner.runAll(signal, concurrency != null ? concurrency : defaultConcurrency);
        return report.records();
    }

    private int write(List<CourseRecord> records, PrintWriter stdout, long start) throws IOException {
        final Path target = (out != null) ? out : defaultOut;
        int written = sink.write(records, target);
        stdout.println("Wrote " + written + " rows -> " + target);
        stdout.flush();
        log.info("HarvestCommand: concluído linhas={} arquivo={} elapsedMs={}ms",
                written, target, (System.nanoTime() - start) / 1_000_000);
        return EXIT_OK;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("HarvestCommand: JVM já em shutdown, hook mantido.");
        }
    }

    private void printSites(PrintWriter stdout) {
        stdout.println("Available site keys:");
        for (SourceInfo s : runner.listSources()) {
            stdout.println(String.format("  %-20s -> %s", s.key(), s.displayName()));
        }
        stdout.flush();
    }

    private static int fatal(PrintWriter stderr, int code, String message) {
        stderr.println(message);
        stderr.flush();
        log.error("HarvestCommand: encerrando com exitCode={} causa={}", code, message);
        return code;
    }
}
