package com.sunya.nutrition.acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.nutrition.api")
public class NutritionApiProperties {

    /** attempts per provider, including the first */
    private int maxRetries = 3;

    /** backoff base; the n-th pause is retryDelay * 2^(n-1) */
    private Duration retryDelay = Duration.ofSeconds(1);

    /** per-attempt read timeout */
    private Duration timeout = Duration.ofSeconds(10);

    private Duration connectTimeout = Duration.ofSeconds(3);

    private boolean useCache = true;

    private Duration cacheTtl = Duration.ofHours(24);

    private String userAgent = "Sunya-Nutrition-App/1.0";

    private final OpenFoodFacts openfoodfacts = new OpenFoodFacts();
    private final Usda usda = new Usda();

    public static class OpenFoodFacts {
        private String baseUrl = "https://world.openfoodfacts.org";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class Usda {
        private String baseUrl = "https://api.nal.usda.gov";

        /** DEMO_KEY is heavily rate limited; set USDA_API_KEY in production */
        private String apiKey = "DEMO_KEY";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    // ===== getters/setters =====
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getRetryDelay() { return retryDelay; }
    public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public boolean isUseCache() { return useCache; }
    public void setUseCache(boolean useCache) { this.useCache = useCache; }

    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public OpenFoodFacts getOpenfoodfacts() { return openfoodfacts; }

    public Usda getUsda() { return usda; }
}
