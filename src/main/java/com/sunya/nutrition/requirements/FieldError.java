package com.sunya.nutrition.requirements;

public record FieldError(String field, String message) {}
