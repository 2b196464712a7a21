package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;

/**
 * One upstream nutrition database.
 */
public interface NutritionProviderClient {

    NutritionSource source();

    /**
     * Single attempt, no retry.
     *
     * @throws NoResultsException when the provider answered with nothing usable
     * @throws ProviderException  on any transport, status or parse failure
     */
    NutritionSearchResult search(String term);
}
