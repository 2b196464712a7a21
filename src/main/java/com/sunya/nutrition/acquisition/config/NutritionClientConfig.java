package com.sunya.nutrition.acquisition.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.acquisition.FetchRetryPolicy;
import com.sunya.nutrition.acquisition.NutritionAcquisitionService;
import com.sunya.nutrition.acquisition.OpenFoodFactsSearchClient;
import com.sunya.nutrition.acquisition.ProviderTelemetry;
import com.sunya.nutrition.acquisition.UsdaFoodDataClient;
import com.sunya.nutrition.cache.CacheStore;
import com.sunya.nutrition.cache.JsonFileCacheStore;
import com.sunya.nutrition.cache.NoopCacheStore;
import com.sunya.nutrition.cache.NutritionCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties({NutritionApiProperties.class, NutritionCacheProperties.class})
public class NutritionClientConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("offRestClient")
    public RestClient offRestClient(NutritionApiProperties props) {
        return restClient(props, props.getOpenfoodfacts().getBaseUrl());
    }

    @Bean("usdaRestClient")
    public RestClient usdaRestClient(NutritionApiProperties props) {
        return restClient(props, props.getUsda().getBaseUrl());
    }

    @Bean
    public OpenFoodFactsSearchClient openFoodFactsSearchClient(
            @Qualifier("offRestClient") RestClient http, ObjectMapper om, Clock clock) {
        return new OpenFoodFactsSearchClient(http, om, clock);
    }

    @Bean
    public UsdaFoodDataClient usdaFoodDataClient(
            @Qualifier("usdaRestClient") RestClient http, ObjectMapper om, Clock clock, NutritionApiProperties props) {
        String key = props.getUsda().getApiKey();
        if (key == null || key.isBlank()) throw new IllegalStateException("USDA_API_KEY_MISSING");
        return new UsdaFoodDataClient(http, om, key, clock);
    }

    @Bean
    public ProviderTelemetry providerTelemetry() {
        return new ProviderTelemetry();
    }

    @Bean
    @ConditionalOnMissingBean
    public FetchRetryPolicy.Sleeper retrySleeper() {
        return FetchRetryPolicy.Sleeper.threadSleep();
    }

    @Bean
    public FetchRetryPolicy fetchRetryPolicy(NutritionApiProperties props, FetchRetryPolicy.Sleeper sleeper,
                                             ProviderTelemetry telemetry) {
        return new FetchRetryPolicy(props.getMaxRetries(), props.getRetryDelay(), sleeper, telemetry);
    }

    @Bean
    public NutritionCache nutritionCache(NutritionApiProperties api, NutritionCacheProperties props,
                                         ObjectMapper om, Clock clock) {
        CacheStore store;
        String dir = props.getPersistenceDir();
        if (dir == null || dir.isBlank()) {
            store = new NoopCacheStore();
        } else {
            store = new JsonFileCacheStore(Path.of(dir), om);
            log.info("nutrition_cache persistence dir={}", dir);
        }
        return new NutritionCache(store, clock, api.getCacheTtl(), props.getMaxSize());
    }

    @Bean
    public NutritionAcquisitionService nutritionAcquisitionService(
            OpenFoodFactsSearchClient primary,
            UsdaFoodDataClient secondary,
            FetchRetryPolicy retryPolicy,
            NutritionCache cache,
            NutritionApiProperties props) {
        return new NutritionAcquisitionService(primary, secondary, retryPolicy, cache, props.isUseCache());
    }

    private static RestClient restClient(NutritionApiProperties props, String baseUrl) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getTimeout());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .build();
    }
}
