package tech.andrefsramos.elearning_harvester.core.domain.errors;

/**
 * Raiz da taxonomia de erros da coleta. Todas as subclasses são unchecked: o tratamento
 * acontece nas fronteiras (item, adapter, CLI) e não em cada chamada intermediária.
 */
public class HarvestException extends RuntimeException {

    public HarvestException(String message) {
        super(message);
    }

    public HarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
