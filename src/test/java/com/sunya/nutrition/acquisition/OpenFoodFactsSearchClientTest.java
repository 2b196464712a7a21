package com.sunya.nutrition.acquisition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;
import com.sunya.nutrition.testsupport.TestRecords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenFoodFactsSearchClientTest {

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final String PATH = "/cgi/search.pl";

    private static RestClient restClientHttp11(String baseUrl, Duration readTimeout) {
        // WireMock and h2c upgrade do not mix
        HttpClient jdk = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(jdk);
        rf.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(rf)
                .build();
    }

    private OpenFoodFactsSearchClient client(Duration readTimeout) {
        return new OpenFoodFactsSearchClient(
                restClientHttp11(wm.baseUrl(), readTimeout),
                new ObjectMapper(),
                Clock.fixed(TestRecords.T0, ZoneOffset.UTC));
    }

    @Test
    void search_sends_the_documented_query_and_maps_the_first_product() {
        wm.stubFor(get(urlPathEqualTo(PATH))
                .willReturn(okJson("""
                        {"count": 2, "products": [
                          {"code": "123", "product_name": "Dried Kiwi Slices",
                           "nutriments": {"energy-kcal_100g": 250, "proteins_100g": 4.5, "sugars_100g": 45}}
                        ]}
                        """)));

        NutritionSearchResult r = client(Duration.ofSeconds(2)).search("dried kiwi");

        assertThat(r.source()).isEqualTo(NutritionSource.OPENFOODFACTS);
        assertThat(r.total()).isEqualTo(2);
        assertThat(r.record().name()).isEqualTo("Dried Kiwi Slices");
        assertThat(r.record().fetchedAt()).isEqualTo(TestRecords.T0);
        assertThat(r.record().metadata().dried()).isTrue();

        wm.verify(1, getRequestedFor(urlPathEqualTo(PATH))
                .withQueryParam("search_terms", equalTo("dried kiwi"))
                .withQueryParam("search_simple", equalTo("1"))
                .withQueryParam("action", equalTo("process"))
                .withQueryParam("json", equalTo("1"))
                .withQueryParam("page_size", equalTo("5")));
    }

    @Test
    void empty_product_list_is_no_results() {
        wm.stubFor(get(urlPathEqualTo(PATH)).willReturn(okJson("{\"count\":0,\"products\":[]}")));

        assertThatThrownBy(() -> client(Duration.ofSeconds(2)).search("zzz"))
                .isInstanceOf(NoResultsException.class);
    }

    @Test
    void server_error_maps_to_upstream_5xx_with_snippet() {
        wm.stubFor(get(urlPathEqualTo(PATH)).willReturn(aResponse().withStatus(503).withBody("maintenance")));

        assertThatThrownBy(() -> client(Duration.ofSeconds(2)).search("kiwi"))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("PROVIDER_UPSTREAM_5XX");
                    assertThat(e.getStatus()).isEqualTo(503);
                    assertThat(e.getBodySnippet()).isEqualTo("maintenance");
                });
    }

    @Test
    void rate_limit_maps_to_rate_limited() {
        wm.stubFor(get(urlPathEqualTo(PATH)).willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> client(Duration.ofSeconds(2)).search("kiwi"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getCode()).isEqualTo("PROVIDER_RATE_LIMITED"));
    }

    @Test
    void empty_body_and_broken_json_are_distinct_failures() {
        wm.stubFor(get(urlPathEqualTo(PATH)).withQueryParam("search_terms", equalTo("empty"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json")));
        wm.stubFor(get(urlPathEqualTo(PATH)).withQueryParam("search_terms", equalTo("broken"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json")
                        .withBody("{\"products\": [")));

        OpenFoodFactsSearchClient c = client(Duration.ofSeconds(2));

        assertThatThrownBy(() -> c.search("empty"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ProviderException.EMPTY_BODY));
        assertThatThrownBy(() -> c.search("broken"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ProviderException.JSON_PARSE_FAILED));
    }

    @Test
    void slow_answer_maps_to_timeout() {
        wm.stubFor(get(urlPathEqualTo(PATH)).willReturn(okJson("{\"products\":[]}").withFixedDelay(1500)));

        assertThatThrownBy(() -> client(Duration.ofMillis(200)).search("kiwi"))
                .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.isTimeout()).isTrue());
    }
}
