package com.sunya.nutrition.acquisition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.acquisition.mapper.OpenFoodFactsSearchMapper;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/** Primary provider. */
public class OpenFoodFactsSearchClient extends JsonProviderClient {

    static final int PAGE_SIZE = 5;

    private final Clock clock;

    public OpenFoodFactsSearchClient(RestClient http, ObjectMapper om, Clock clock) {
        super(http, om);
        this.clock = clock;
    }

    @Override
    public NutritionSource source() {
        return NutritionSource.OPENFOODFACTS;
    }

    @Override
    public NutritionSearchResult search(String term) {
        JsonNode root = getJson(b -> b.path("/cgi/search.pl")
                .queryParam("search_terms", term)
                .queryParam("search_simple", 1)
                .queryParam("action", "process")
                .queryParam("json", 1)
                .queryParam("page_size", PAGE_SIZE)
                .build(), term);

        return OpenFoodFactsSearchMapper.map(root, clock.instant())
                .orElseThrow(() -> new NoResultsException(source(), term));
    }
}
