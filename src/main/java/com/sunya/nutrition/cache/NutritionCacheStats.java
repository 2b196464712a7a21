package com.sunya.nutrition.cache;

import java.util.List;

public record NutritionCacheStats(int size, List<String> keys, int expiredCount, int validCount) {}
