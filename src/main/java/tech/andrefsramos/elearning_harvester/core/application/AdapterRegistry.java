package tech.andrefsramos.elearning_harvester.core.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.SourceInfo;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Mapa somente-leitura de key -> adapter, montado uma única vez na inicialização a partir de
 * uma lista explícita. A ordem de registro é preservada para listagem e para a execução --all.

 * Regras
 * - Keys precisam ser minúsculas ([a-z0-9_-]); a key reservada "base" é rejeitada.
 * - Key duplicada falha imediatamente (IllegalStateException) em vez de sobrescrever.
 */
public final class AdapterRegistry {

    public static final String RESERVED_KEY = "base";

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);
    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    private final Map<String, SourceAdapter> adapters;

    private AdapterRegistry(Map<String, SourceAdapter> adapters) {
        this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(adapters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AdapterRegistry of(List<? extends SourceAdapter> adapters) {
        Builder b = builder();
        adapters.forEach(b::register);
        return b.build();
    }

    public Optional<SourceAdapter> get(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(adapters.get(key.trim()));
    }

    public List<SourceInfo> list() {
        return adapters.values().stream()
                .map(a -> new SourceInfo(a.key(), a.displayName()))
                .toList();
    }

    public List<SourceAdapter> adapters() {
        return List.copyOf(adapters.values());
    }

    public int size() {
        return adapters.size();
    }

    public static final class Builder {
        private final Map<String, SourceAdapter> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(SourceAdapter adapter) {
            if (adapter == null) {
                throw new IllegalArgumentException("adapter is required");
            }
            final String key = adapter.key() == null ? "" : adapter.key().trim();
            if (!KEY_PATTERN.matcher(key).matches()) {
                throw new IllegalArgumentException("Invalid adapter key '" + adapter.key() + "' (" + adapter.getClass().getSimpleName() + ")");
            }
            if (RESERVED_KEY.equals(key)) {
                throw new IllegalArgumentException("Adapter key '" + RESERVED_KEY + "' is reserved");
            }
            if (entries.containsKey(key)) {
                throw new IllegalStateException("Duplicate adapter key '" + key + "': "
                        + entries.get(key).getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
            entries.put(key, adapter);
            log.debug("[Registry] adapter registrado key={} displayName={}", key, adapter.displayName());
            return this;
        }

        public AdapterRegistry build() {
            AdapterRegistry registry = new AdapterRegistry(entries);
            log.info("[Registry] {} adapters registrados: {}", registry.size(), new ArrayList<>(entries.keySet()));
            return registry;
        }
    }
}
