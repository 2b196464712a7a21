package com.sunya.nutrition.catalog;

import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSource;
import com.sunya.nutrition.testsupport.TestRecords;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CatalogRepositoryTest {

    private final CatalogRepository catalog = TestRecords.catalog();

    @Test
    void bundled_catalog_loads() {
        assertThat(catalog.products()).hasSize(8);
        assertThat(catalog.foods()).hasSize(16);
        assertThat(catalog.findProduct(1)).get().extracting(Product::name).isEqualTo("Dried Kiwi");
        assertThat(catalog.findProduct(99)).isEmpty();
    }

    @Test
    void plain_name_resolves_to_the_fresh_row() {
        assertThat(catalog.findFood("apple")).get().extracting(FoodItem::id).isEqualTo("apple-fresh");
        assertThat(catalog.findFood("Kiwi")).get().extracting(FoodItem::id).isEqualTo("kiwi-fresh");
    }

    @Test
    void drying_words_prefer_the_dehydrated_row() {
        assertThat(catalog.findFood("dried pineapple")).get().extracting(FoodItem::id).isEqualTo("pineapple-dried");
        assertThat(catalog.findFood("dehydrated mango slices")).get().extracting(FoodItem::id).isEqualTo("mango-dried");
    }

    @Test
    void unknown_or_blank_query_finds_nothing() {
        assertThat(catalog.findFood("quinoa")).isEmpty();
        assertThat(catalog.findFood(" ")).isEmpty();
        assertThat(catalog.findFood(null)).isEmpty();
    }

    @Test
    void dehydrated_lookup_prefers_exact_base_name() {
        assertThat(catalog.findDehydrated("apple")).get().extracting(FoodItem::id).isEqualTo("apple-dried");
        assertThat(catalog.findDehydrated("pineapple")).get().extracting(FoodItem::id).isEqualTo("pineapple-dried");
        assertThat(catalog.findDehydrated("durian")).isEmpty();
    }

    @Test
    void local_record_estimates_sugar_from_carbs_and_fiber() {
        NutritionRecord r = catalog.localRecord("kiwi", TestRecords.T0).orElseThrow();

        assertThat(r.source()).isEqualTo(NutritionSource.LOCAL_TABLE);
        assertThat(r.id()).isEqualTo("kiwi-fresh");
        assertThat(r.calories()).isEqualTo(61);
        assertThat(r.sugar()).isCloseTo(11.7, within(0.001));
        assertThat(r.vitaminC()).isEqualTo(92.7);
        assertThat(r.metadata().dried()).isFalse();
        assertThat(r.fetchedAt()).isEqualTo(TestRecords.T0);
    }

    @Test
    void profile_scales_to_a_portion() {
        NutrientProfile dried = catalog.findDehydrated("kiwi").orElseThrow().nutrition();

        NutrientProfile portion = dried.scaledTo(30);

        assertThat(portion.calories()).isEqualTo(75.0);
        assertThat(portion.vitaminC()).isEqualTo(111.0);
        assertThat(portion.potassium()).isEqualTo(374.4);
        assertThat(portion.bromelain()).isNull();
    }

    @Test
    void base_name_strips_the_type_suffix() {
        FoodItem item = catalog.findFood("dried blueberry").orElseThrow();

        assertThat(item.baseName()).isEqualTo("blueberry");
        assertThat(item.type()).isEqualTo(FoodType.DEHYDRATED);
    }
}
