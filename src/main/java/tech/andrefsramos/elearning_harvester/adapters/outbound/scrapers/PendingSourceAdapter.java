package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.util.stream.Stream;

/**
 * Plataforma conhecida sem catálogo público (app mobile, lista de espera, página de iniciativa).
 * Fica registrada para aparecer em --list-sites, mas não produz registros.
 */
public class PendingSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(PendingSourceAdapter.class);

    private final SourceDescriptor source;
    private final String reason;

    public PendingSourceAdapter(SourceDescriptor source, String reason) {
        this.source = source;
        this.reason = reason;
    }

    @Override
    public String key() {
        return source.key();
    }

    @Override
    public String displayName() {
        return source.displayName();
    }

    @Override
    public String baseUrl() {
        return source.baseUrl();
    }

    @Override
    public boolean isAllowed() {
        return source.allowed();
    }

    @Override
    public Stream<CourseRecord> iterCourses() {
        log.info("[{}] sem catálogo público ({}). Nenhum registro.", source.displayName(), reason);
        return Stream.empty();
    }
}
