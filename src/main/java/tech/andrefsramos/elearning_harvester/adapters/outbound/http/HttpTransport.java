package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;

import java.io.IOException;
import java.util.Map;

/**
 * Transporte HTTP cru: um único GET, sem retry. Status de erro voltam como resposta, não como exceção.
 */
@FunctionalInterface
public interface HttpTransport {
    RawResponse get(String url, Map<String, String> headers, int timeoutMs) throws IOException;
}
