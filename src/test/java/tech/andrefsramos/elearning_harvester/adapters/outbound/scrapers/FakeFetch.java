package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;
import tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** FetchPort em memória: URL conhecida -> 200 com o HTML; desconhecida -> FetchException (como após 3 tentativas). */
final class FakeFetch implements FetchPort {
    private final Map<String, String> pages = new HashMap<>();
    final List<String> calls = new ArrayList<>();

    FakeFetch page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    @Override
    public RawResponse fetch(String url) {
        calls.add(url);
        String html = pages.get(url);
        if (html == null) {
            throw new FetchException(url, 3, 404, "HTTP 404", null);
        }
        return new RawResponse(url, 200, html);
    }
}
