package com.sunya.nutrition.requirements;

import lombok.Getter;

import java.util.List;

@Getter
public class ProfileValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public ProfileValidationException(List<FieldError> errors) {
        super("Invalid profile fields: " + String.join(",", errors.stream().map(FieldError::field).toList()));
        this.errors = List.copyOf(errors);
    }
}
