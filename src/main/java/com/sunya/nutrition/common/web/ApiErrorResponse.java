package com.sunya.nutrition.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sunya.nutrition.requirements.FieldError;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String code,
        String message,
        String requestId,
        Map<String, String> sources,
        List<FieldError> errors
) {
    public ApiErrorResponse(String code, String message, String requestId) {
        this(code, message, requestId, null, null);
    }
}
