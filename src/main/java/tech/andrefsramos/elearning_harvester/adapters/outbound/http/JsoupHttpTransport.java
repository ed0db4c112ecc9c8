package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/*
 * Finalidade

 * Implementação de {@link HttpTransport} sobre o cliente HTTP do Jsoup. Segue redirecionamentos,
 * aceita qualquer content-type e não converte status de erro em exceção: a classificação de
 * sucesso/falha fica com {@link HttpFetch}.
 */
public class JsoupHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JsoupHttpTransport.class);

    private static final String REF = "https://www.google.com";
    private static final int MAX_BODY_BYTES = 8 * 1024 * 1024;

    @Override
    public RawResponse get(String url, Map<String, String> headers, int timeoutMs) throws IOException {
        Connection conn = Jsoup.connect(url)
                .referrer(REF)
                .timeout(timeoutMs)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(MAX_BODY_BYTES)
                .method(Connection.Method.GET);
        headers.forEach(conn::header);

        Connection.Response r = conn.execute();
        String body;
        try {
            // o corpo é lido sob demanda; timeout no meio do download chega como UncheckedIOException
            r.bufferUp();
            body = r.body();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        if (log.isDebugEnabled()) {
            log.debug("JsoupHttpTransport: url={} status={} contentType={} finalUrl={}",
                    url, r.statusCode(), r.contentType(), r.url());
        }
        return new RawResponse(r.url().toString(), r.statusCode(), body);
    }
}
