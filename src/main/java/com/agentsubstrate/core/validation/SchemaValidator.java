package com.agentsubstrate.core.validation;

import com.agentsubstrate.core.json.AgentJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validate-and-parse boundary shared by every agent.
 * <p>
 * {@link #parse} binds raw JSON to a typed record and then applies its Bean Validation
 * constraints; {@link #validate} checks an already-typed value. Both either return a valid
 * value or throw {@link ValidationFailedException} listing every field error, with paths in
 * the snake_case wire form.
 */
public class SchemaValidator {

    private static final class Holder {
        private static final ValidatorFactory FACTORY = Validation.buildDefaultValidatorFactory();
        private static final SchemaValidator SHARED =
                new SchemaValidator(AgentJson.mapper(), FACTORY.getValidator());
    }

    private final ObjectMapper mapper;
    private final Validator validator;

    public SchemaValidator(ObjectMapper mapper, Validator validator) {
        this.mapper = mapper;
        this.validator = validator;
    }

    /**
     * Process-wide instance backed by the default Hibernate Validator factory.
     */
    public static SchemaValidator shared() {
        return Holder.SHARED;
    }

    public <T> T parse(JsonNode raw, Class<T> type) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            throw new ValidationFailedException("input is required");
        }
        T value;
        try {
            value = mapper.treeToValue(raw, type);
        } catch (JsonMappingException e) {
            throw new ValidationFailedException(List.of(new FieldError(pathOf(e), e.getOriginalMessage())), e);
        } catch (JsonProcessingException e) {
            throw new ValidationFailedException(List.of(new FieldError("", e.getOriginalMessage())), e);
        }
        if (value == null) {
            throw new ValidationFailedException("input is required");
        }
        return validate(value);
    }

    public <T> T validate(T value) {
        if (value == null) {
            throw new ValidationFailedException("value is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            List<FieldError> errors = violations.stream()
                    .map(v -> new FieldError(toSnakeCase(v.getPropertyPath().toString()), v.getMessage()))
                    .sorted(Comparator.comparing(FieldError::path).thenComparing(FieldError::message))
                    .collect(Collectors.toList());
            throw new ValidationFailedException(errors);
        }
        return value;
    }

    private static String pathOf(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (!path.isEmpty()) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.toString();
    }

    static String toSnakeCase(String path) {
        return path.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
