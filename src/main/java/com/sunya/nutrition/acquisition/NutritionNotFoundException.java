package com.sunya.nutrition.acquisition;

import lombok.Getter;

@Getter
public class NutritionNotFoundException extends RuntimeException {

    private final String term;

    public NutritionNotFoundException(String term) {
        super("No nutrition data found for \"" + term + "\"");
        this.term = term;
    }
}
