package com.foodgram.backend.exception;

import jakarta.validation.ConstraintViolation;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Business validation failure keyed by request field, rendered as a 400 with an {@code errors} map.
 */
@Getter
public class RequestValidationException extends CustomException {

    private final Map<String, List<String>> fieldErrors;

    public RequestValidationException(String field, String message) {
        super(ErrorCode.INVALID_INPUT_VALUE, message);
        this.fieldErrors = new LinkedHashMap<>();
        this.fieldErrors.put(field, List.of(message));
    }

    public RequestValidationException(ErrorCode errorCode, String field) {
        super(errorCode);
        this.fieldErrors = new LinkedHashMap<>();
        this.fieldErrors.put(field, List.of(errorCode.getMessage()));
    }

    private RequestValidationException(String message, Map<String, List<String>> fieldErrors) {
        super(ErrorCode.INVALID_INPUT_VALUE, message);
        this.fieldErrors = fieldErrors;
    }

    /**
     * Collects Bean Validation failures keyed by the snake_case name of the top-level property.
     */
    public static RequestValidationException of(Set<? extends ConstraintViolation<?>> violations) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        String first = null;
        for (ConstraintViolation<?> violation : violations) {
            String path = violation.getPropertyPath().toString();
            int cut = path.indexOf('[') >= 0 ? path.indexOf('[') : path.indexOf('.');
            String field = toSnakeCase(cut >= 0 ? path.substring(0, cut) : path);
            errors.computeIfAbsent(field, k -> new ArrayList<>()).add(violation.getMessage());
            if (first == null) {
                first = violation.getMessage();
            }
        }
        return new RequestValidationException(first, errors);
    }

    public static String toSnakeCase(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
