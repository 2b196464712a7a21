package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSource;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Turns whatever a provider call threw into a stable error code.
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {}

    public record Mapped(String code, String message, Integer retryAfterSec) {}

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("PROVIDER_FAILED", null, null);

        if (e instanceof ProviderException pe && !"PROVIDER_FAILED".equals(pe.getCode())) {
            return new Mapped(pe.getCode(), safeMsg(pe), null);
        }

        // timeouts first; RestClient tends to bury them in the cause chain
        if (isTimeoutThrowable(e)) {
            return new Mapped(ProviderException.TIMEOUT, safeMsg(e), null);
        }

        if (e instanceof RestClientResponseException re) {
            var sc = re.getStatusCode();
            int status = sc.value();

            Integer retryAfter = null;
            HttpHeaders headers = re.getResponseHeaders();
            if (headers != null) {
                retryAfter = parseRetryAfterSecondsOrNull(headers.getFirst("Retry-After"));
            }
            return byStatus(status, retryAfter);
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped("PROVIDER_NETWORK_ERROR", safeMsg(rae), null);
        }

        if (e instanceof RestClientException rce) {
            return new Mapped("PROVIDER_CLIENT_ERROR", safeMsg(rce), null);
        }

        return new Mapped("PROVIDER_FAILED", safeMsg(e), null);
    }

    public static Mapped byStatus(int status, Integer retryAfter) {
        if (status == 401 || status == 403) return new Mapped("PROVIDER_AUTH_FAILED", "auth failed", null);
        if (status == 429) return new Mapped("PROVIDER_RATE_LIMITED", "rate limited", retryAfter);
        if (status == 408) return new Mapped(ProviderException.TIMEOUT, "timeout", retryAfter);
        if (status >= 500 && status < 600) return new Mapped("PROVIDER_UPSTREAM_5XX", "upstream 5xx", retryAfter);
        if (status >= 400 && status < 500) return new Mapped("PROVIDER_BAD_REQUEST", "bad request", null);
        return new Mapped("PROVIDER_FAILED", "http error", retryAfter);
    }

    /** Wraps any provider-side failure as a {@link ProviderException} with a mapped code. */
    public static ProviderException toProviderException(NutritionSource source, Throwable e) {
        if (e instanceof ProviderException pe) return pe;
        Mapped m = map(e);
        int status = e instanceof RestClientResponseException re ? re.getStatusCode().value() : 0;
        return new ProviderException(source, m.code(), status, m.message(), null, e);
    }

    private static Integer parseRetryAfterSecondsOrNull(String ra) {
        if (ra == null || ra.isBlank()) return null;
        try {
            int v = Integer.parseInt(ra.trim());
            return Math.max(0, Math.min(v, 3600));
        } catch (NumberFormatException ignored) {
            // HTTP-date form is not supported
            return null;
        }
    }

    /**
     * Any timeout in the cause chain. {@code java.net.http.HttpTimeoutException} is matched by
     * class name so that callers on other client stacks are covered too.
     */
    static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;

            String cn = c.getClass().getName();
            if ("java.net.http.HttpTimeoutException".equals(cn)) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timeout") || s.contains("timed out")) return true;
            }
        }
        return false;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
