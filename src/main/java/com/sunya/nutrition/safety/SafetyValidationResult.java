package com.sunya.nutrition.safety;

import java.util.List;

/**
 * {@code safe == !shouldBlock}. A blocked result always has a block reason and at least one warning.
 */
public record SafetyValidationResult(boolean safe, List<String> warnings, boolean shouldBlock, String blockReason) {

    public static SafetyValidationResult unrestricted() {
        return new SafetyValidationResult(true, List.of(), false, null);
    }
}
