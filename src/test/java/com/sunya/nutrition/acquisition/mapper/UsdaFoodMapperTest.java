package com.sunya.nutrition.acquisition.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class UsdaFoodMapperTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");
    private final ObjectMapper om = new ObjectMapper();

    private static final String KIWI = """
            {"totalHits": 7, "foods": [{
              "fdcId": 168153,
              "description": "Kiwifruit, green, raw",
              "foodCategory": "Fruits and Fruit Juices",
              "foodNutrients": [
                {"nutrientName": "Protein", "unitName": "G", "value": 1.14},
                {"nutrientName": "Total lipid (fat)", "unitName": "G", "value": 0.52},
                {"nutrientName": "Carbohydrate, by difference", "unitName": "G", "value": 14.7},
                {"nutrientName": "Energy", "unitName": "KJ", "value": 255},
                {"nutrientName": "Energy", "unitName": "KCAL", "value": 61},
                {"nutrientName": "Sugars, total including NLEA", "unitName": "G", "value": 8.99},
                {"nutrientName": "Fiber, total dietary", "unitName": "G", "value": 3.0},
                {"nutrientName": "Potassium, K", "unitName": "MG", "value": 312},
                {"nutrientName": "Magnesium, Mg", "unitName": "MG", "value": 17},
                {"nutrientName": "Vitamin C, total ascorbic acid", "unitName": "MG", "value": 92.7},
                {"nutrientName": "Vitamin B-6", "unitName": "MG", "value": 0.063}
              ]}]}
            """;

    @Test
    void maps_nutrients_by_name() throws Exception {
        NutritionSearchResult result = UsdaFoodMapper.map(om.readTree(KIWI), AT).orElseThrow();
        NutritionRecord r = result.record();

        assertThat(result.total()).isEqualTo(7);
        assertThat(r.source()).isEqualTo(NutritionSource.USDA);
        assertThat(r.id()).isEqualTo("168153");
        assertThat(r.name()).isEqualTo("Kiwifruit, green, raw");
        assertThat(r.calories()).isEqualTo(61);
        assertThat(r.protein()).isEqualTo(1.14);
        assertThat(r.carbs()).isEqualTo(14.7);
        assertThat(r.fiber()).isEqualTo(3.0);
        assertThat(r.fat()).isEqualTo(0.52);
        assertThat(r.sugar()).isEqualTo(8.99);
        assertThat(r.potassium()).isEqualTo(312);
        assertThat(r.magnesium()).isEqualTo(17);
        assertThat(r.vitaminC()).isEqualTo(92.7);
        assertThat(r.vitaminB6()).isEqualTo(0.063);
        assertThat(r.metadata().category()).isEqualTo("Fruits and Fruit Juices");
        assertThat(r.metadata().dried()).isFalse();
    }

    @Test
    void serving_metadata_is_kept_without_converting_values() throws Exception {
        JsonNode root = om.readTree("""
                {"foods": [{"fdcId": 1, "description": "Apples, dehydrated (low moisture), sulfured, uncooked",
                  "servingSize": 40, "servingSizeUnit": "g", "brandOwner": "Acme",
                  "foodNutrients": [{"nutrientName": "Energy", "value": 346}]}]}
                """);

        NutritionRecord r = UsdaFoodMapper.map(root, AT).orElseThrow().record();

        assertThat(r.calories()).isEqualTo(346);
        assertThat(r.metadata().originalServingSize()).isEqualTo(40);
        assertThat(r.metadata().brand()).isEqualTo("Acme");
        assertThat(r.metadata().dried()).isTrue();
        assertThat(r.protein()).isZero();
        assertThat(r.potassium()).isNull();
    }

    @Test
    void no_foods_is_no_result() throws Exception {
        assertThat(UsdaFoodMapper.map(om.readTree("{\"totalHits\":0,\"foods\":[]}"), AT)).isEmpty();
    }
}
