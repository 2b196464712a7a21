package com.sunya.nutrition.acquisition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.acquisition.mapper.UsdaFoodMapper;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/** Secondary provider (FoodData Central). */
public class UsdaFoodDataClient extends JsonProviderClient {

    static final int PAGE_SIZE = 5;
    static final String DATA_TYPES = "Foundation,SR Legacy";

    private final String apiKey;
    private final Clock clock;

    public UsdaFoodDataClient(RestClient http, ObjectMapper om, String apiKey, Clock clock) {
        super(http, om);
        this.apiKey = apiKey;
        this.clock = clock;
    }

    @Override
    public NutritionSource source() {
        return NutritionSource.USDA;
    }

    @Override
    public NutritionSearchResult search(String term) {
        JsonNode root = getJson(b -> b.path("/fdc/v1/foods/search")
                .queryParam("api_key", apiKey)
                .queryParam("query", term)
                .queryParam("pageSize", PAGE_SIZE)
                .queryParam("dataType", DATA_TYPES)
                .build(), term);

        return UsdaFoodMapper.map(root, clock.instant())
                .orElseThrow(() -> new NoResultsException(source(), term));
    }
}
