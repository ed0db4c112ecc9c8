package tech.andrefsramos.elearning_harvester.core.domain.errors;

/**
 * O colaborador de renderização (navegador headless) não está disponível.
 */
public class RenderUnavailableException extends ConfigurationException {

    public RenderUnavailableException(String message) {
        super(message);
    }

    public RenderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
