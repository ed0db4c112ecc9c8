package tech.andrefsramos.elearning_harvester.core.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * Finalidade

 * Sinal externo de cancelamento, de disparo único e thread-safe. Depois de ativado, o
 * controlador de execução não inicia novos adapters e concede aos que estão em andamento
 * um período de graça contado a partir de {@link #cancelledAtNanos()}.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private volatile Long cancelledAtNanos;

    public synchronized void cancel(String reason) {
        if (cancelledAtNanos != null) {
            return;
        }
        cancelledAtNanos = System.nanoTime();
        log.warn("[Cancel] Sinal de cancelamento ativado. motivo={}", reason);
    }

    public boolean isCancelled() {
        return cancelledAtNanos != null;
    }

    /** Instante (System.nanoTime) do cancelamento; só válido quando isCancelled() == true. */
    public long cancelledAtNanos() {
        Long at = cancelledAtNanos;
        if (at == null) {
            throw new IllegalStateException("signal not cancelled");
        }
        return at;
    }
}
