package tech.andrefsramos.elearning_harvester.core.domain.errors;

public class UsageException extends HarvestException {

    public UsageException(String message) {
        super(message);
    }
}
