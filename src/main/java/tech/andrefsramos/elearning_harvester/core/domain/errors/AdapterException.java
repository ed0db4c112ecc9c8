package tech.andrefsramos.elearning_harvester.core.domain.errors;

/**
 * Falha integral de um adapter (ex.: página base inacessível após os retries).
 */
public class AdapterException extends HarvestException {

    private final String sourceKey;

    public AdapterException(String sourceKey, String message) {
        super(sourceKey + ": " + message);
        this.sourceKey = sourceKey;
    }

    public AdapterException(String sourceKey, String message, Throwable cause) {
        super(sourceKey + ": " + message, cause);
        this.sourceKey = sourceKey;
    }

    public String sourceKey() {
        return sourceKey;
    }
}
