package tech.andrefsramos.elearning_harvester.core.domain.errors;

/**
 * A estrutura esperada de uma única página não foi encontrada. Isolada por item.
 */
public class ExtractionException extends HarvestException {

    private final String url;

    public ExtractionException(String url, String message) {
        super(message + " (url=" + url + ")");
        this.url = url;
    }

    public ExtractionException(String url, String message, Throwable cause) {
        super(message + " (url=" + url + ")", cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
