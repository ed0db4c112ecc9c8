package tech.andrefsramos.elearning_harvester.core.domain.errors;

/**
 * Configuração inválida ou colaborador externo ausente.
 */
public class ConfigurationException extends HarvestException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
