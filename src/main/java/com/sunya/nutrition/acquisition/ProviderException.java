package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSource;
import lombok.Getter;

/**
 * One failed provider attempt: transport error, non-2xx answer, unreadable body or timeout.
 * Retryable.
 */
@Getter
public class ProviderException extends RuntimeException {

    public static final String TIMEOUT = "PROVIDER_TIMEOUT";
    public static final String EMPTY_BODY = "PROVIDER_EMPTY_BODY";
    public static final String JSON_PARSE_FAILED = "PROVIDER_JSON_PARSE_FAILED";

    private final NutritionSource source;
    private final String code;
    /** HTTP status, 0 when no response was received */
    private final int status;
    private final String bodySnippet;

    public ProviderException(NutritionSource source, String code, int status, String message,
                             String bodySnippet, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.code = code;
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public ProviderException(NutritionSource source, String code, String message, Throwable cause) {
        this(source, code, 0, message, null, cause);
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(code);
    }
}
