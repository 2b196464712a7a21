package com.sunya.nutrition.acquisition;

import lombok.extern.slf4j.Slf4j;

/** One log line per provider attempt. */
@Slf4j
public class ProviderTelemetry {

    public void ok(String provider, String term, int attempt, long latencyMs) {
        log.info("provider_call status=OK provider={} term={} attempt={} latencyMs={}",
                safe(provider), safe(term), attempt, latencyMs);
    }

    public void noResults(String provider, String term, int attempt, long latencyMs) {
        log.info("provider_call status=EMPTY provider={} term={} attempt={} latencyMs={}",
                safe(provider), safe(term), attempt, latencyMs);
    }

    public void fail(String provider, String term, int attempt, long latencyMs, String errorCode) {
        log.warn("provider_call status=FAIL provider={} term={} attempt={} latencyMs={} errorCode={}",
                safe(provider), safe(term), attempt, latencyMs, safe(errorCode));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}
