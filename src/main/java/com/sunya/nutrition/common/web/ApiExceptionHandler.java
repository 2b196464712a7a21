package com.sunya.nutrition.common.web;

import com.sunya.nutrition.acquisition.AllSourcesFailedException;
import com.sunya.nutrition.acquisition.NutritionNotFoundException;
import com.sunya.nutrition.requirements.ProfileValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP:
 * <ul>
 *   <li>404 NUTRITION_NOT_FOUND</li>
 *   <li>503 ALL_SOURCES_FAILED, with the failure code of each provider</li>
 *   <li>400 PROFILE_INVALID, with field errors; 400 for malformed requests</li>
 *   <li>500 INTERNAL_ERROR otherwise</li>
 * </ul>
 * Safety verdicts are never errors and never pass through here.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NutritionNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NutritionNotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiErrorResponse("NUTRITION_NOT_FOUND", e.getMessage(), rid(req)));
    }

    @ExceptionHandler(AllSourcesFailedException.class)
    public ResponseEntity<ApiErrorResponse> handleAllFailed(AllSourcesFailedException e, HttpServletRequest req) {
        Map<String, String> sources = new LinkedHashMap<>();
        e.getFailures().forEach((k, v) -> sources.put(k.name(), v));
        log.warn("all_sources_failed term={} sources={}", e.getTerm(), sources);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiErrorResponse("ALL_SOURCES_FAILED", e.getMessage(), rid(req), sources, null));
    }

    @ExceptionHandler(ProfileValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleProfile(ProfileValidationException e, HttpServletRequest req) {
        return ResponseEntity.badRequest()
                .body(new ApiErrorResponse("PROFILE_INVALID", e.getMessage(), rid(req), null, e.getErrors()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.badRequest().body(new ApiErrorResponse("VALIDATION_FAILED", msg, rid(req)));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception e, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(new ApiErrorResponse("BAD_REQUEST", e.getMessage(), rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        // framework errors (unknown path, wrong method, ...) already know their status
        if (e instanceof ErrorResponse er) {
            HttpStatusCode status = er.getStatusCode();
            return ResponseEntity.status(status)
                    .body(new ApiErrorResponse("HTTP_" + status.value(), e.getMessage(), rid(req)));
        }
        log.error("unhandled error rid={}", rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", e.getMessage(), rid(req)));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }
}
