package com.sunya.nutrition.safety;

/**
 * @param percentage share of safe foods, 0 for an empty list
 */
public record SafetySummary(int safe, int caution, int avoid, int total, long percentage) {
}
