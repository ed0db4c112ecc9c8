package tech.andrefsramos.elearning_harvester.core.domain.errors;

/**
 * Falha terminal do fetch HTTP, após esgotar as tentativas (ou por interrupção).
 */
public class FetchException extends HarvestException {

    private final String url;
    private final int attempts;
    private final Integer lastStatus;

    public FetchException(String url, int attempts, Integer lastStatus, String reason, Throwable cause) {
        super("GET " + url + " falhou após " + attempts + " tentativa(s): " + reason, cause);
        this.url = url;
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public String url() {
        return url;
    }

    public int attempts() {
        return attempts;
    }

    /** Último status HTTP recebido, ou null quando nenhuma resposta chegou. */
    public Integer lastStatus() {
        return lastStatus;
    }
}
