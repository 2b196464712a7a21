package com.sunya.nutrition.acquisition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.model.NutritionSource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * GET-and-parse plumbing shared by the JSON providers. Every failure leaves here as a
 * {@link ProviderException} with a mapped code.
 */
abstract class JsonProviderClient implements NutritionProviderClient {

    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    protected final RestClient http;
    protected final ObjectMapper om;

    protected JsonProviderClient(RestClient http, ObjectMapper om) {
        this.http = http;
        this.om = om;
    }

    protected JsonNode getJson(Function<UriBuilder, URI> uri, String term) {
        NutritionSource source = source();
        String body;
        try {
            body = http.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    // keep 4xx/5xx apart from JSON parse failures
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        String snippet = readBodySnippetQuietly(res, MAX_ERROR_SNIPPET_BYTES);
                        ProviderErrorMapper.Mapped m = ProviderErrorMapper.byStatus(status, null);
                        throw new ProviderException(source, m.code(), status,
                                source + " HTTP " + status + " for term=" + safe(term), snippet, null);
                    })
                    .body(String.class);
        } catch (ProviderException e) {
            throw e;
        } catch (RestClientException e) {
            throw ProviderErrorMapper.toProviderException(source, e);
        }

        if (body == null || body.isBlank()) {
            throw new ProviderException(source, ProviderException.EMPTY_BODY,
                    source + " returned empty body (2xx) for term=" + safe(term), null);
        }

        try {
            return om.readTree(body);
        } catch (IOException e) {
            String snippet = shrink(body, 300);
            throw new ProviderException(source, ProviderException.JSON_PARSE_FAILED, 200,
                    source + " JSON parse failed (2xx). term=" + safe(term) + ", snippet=" + snippet, snippet, e);
        }
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res, int maxBytes) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(Math.max(0, maxBytes));
            if (bytes.length == 0) return "";
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ignore) {
            // the status code is what matters here
            return null;
        }
    }

    static String shrink(String s, int maxChars) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= maxChars) return t;
        return t.substring(0, maxChars) + "...";
    }

    static String safe(String s) {
        if (s == null) return "null";
        String t = s.trim();
        return t.isEmpty() ? "blank" : t;
    }
}
