package tech.andrefsramos.elearning_harvester.adapters.inbound.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.application.CancellationSignal;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Ponte entre o shutdown hook da JVM (Ctrl-C) e a rodada --all. O hook ativa o
 * {@link CancellationSignal} e fica bloqueado até a rodada liberar o portão (depois de gravar
 * o CSV) ou até {@code maxWaitMs}. Sem essa espera a JVM pararia assim que o hook retornasse,
 * antes do período de graça e da gravação dos registros já coletados.
 */
final class ShutdownGate {

    private static final Logger log = LoggerFactory.getLogger(ShutdownGate.class);

    private final CancellationSignal signal = new CancellationSignal();
    private final CountDownLatch done = new CountDownLatch(1);
    private final long maxWaitMs;

    ShutdownGate(long maxWaitMs) {
        this.maxWaitMs = Math.max(maxWaitMs, 0);
    }

    CancellationSignal signal() {
        return signal;
    }

    /** Corpo do shutdown hook. */
    void onShutdown() {
        signal.cancel("shutdown da JVM");
        log.info("[Shutdown] Aguardando a rodada encerrar e gravar o CSV (até {}ms).", maxWaitMs);
        try {
            if (!done.await(maxWaitMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Shutdown] Rodada não terminou em {}ms — encerrando sem aguardar a gravação.", maxWaitMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Shutdown] Espera interrompida.");
        }
    }

    void release() {
        done.countDown();
    }

    boolean isReleased() {
        return done.getCount() == 0;
    }
}
