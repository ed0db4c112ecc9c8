package tech.andrefsramos.elearning_harvester.core.domain;

/**
 * Resposta bruta de um GET: URL final (após redirecionamentos), status e corpo em texto.
 */
public record RawResponse(String url, int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode < 400;
    }
}
