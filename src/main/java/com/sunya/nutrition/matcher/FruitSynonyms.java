package com.sunya.nutrition.matcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class FruitSynonyms {

    private FruitSynonyms() {}

    /** base name -> synonyms, all lower case. Iteration order is lookup order. */
    public static final Map<String, List<String>> TABLE;

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("kiwi", List.of("kiwifruit", "chinese gooseberry", "kiwi fruit"));
        m.put("blueberry", List.of("blueberries", "wild blueberry", "highbush blueberry"));
        m.put("pineapple", List.of("ananas", "pine apple"));
        m.put("papaya", List.of("pawpaw", "papaw", "paw-paw"));
        m.put("apple", List.of("apples", "malus", "fruit apple"));
        m.put("banana", List.of("bananas", "plantain"));
        m.put("mango", List.of("mangos", "mangoes", "king of fruits"));
        m.put("strawberry", List.of("strawberries", "wild strawberry"));
        TABLE = Collections.unmodifiableMap(m);
    }
}
