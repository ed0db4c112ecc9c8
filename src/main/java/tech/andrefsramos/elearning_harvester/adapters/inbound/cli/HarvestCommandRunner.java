package tech.andrefsramos.elearning_harvester.adapters.inbound.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Executa o {@link HarvestCommand} com os argumentos da aplicação e expõe o código de saída
 * para o SpringApplication.exit.
 */
@Component
public class HarvestCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HarvestCommandRunner.class);

    private final HarvestCommand command;
    private int exitCode;

    public HarvestCommandRunner(HarvestCommand command) {this.command = command;}

    @Override
    public void run(String... args) {
        long start = System.nanoTime();
        exitCode = new CommandLine(command).execute(args);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        log.info("HarvestCommandRunner: execução finalizada exitCode={} elapsedMs={}ms", exitCode, elapsedMs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
