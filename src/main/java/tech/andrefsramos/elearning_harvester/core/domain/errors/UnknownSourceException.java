package tech.andrefsramos.elearning_harvester.core.domain.errors;

public class UnknownSourceException extends HarvestException {

    private final String key;

    public UnknownSourceException(String key) {
        super("Fonte desconhecida: " + key + ". Use --list-sites para ver as opções.");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
