package com.agentsubstrate.core.validation;

import com.agentsubstrate.core.json.AgentJson;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    record Sample(@NotBlank String objective, @Max(10) Integer maxDepth) {
    }

    private final SchemaValidator validator = SchemaValidator.shared();

    @Test
    @DisplayName("parse binds snake_case JSON to a record")
    void parsesValidInput() throws Exception {
        Sample sample = validator.parse(AgentJson.mapper().readTree("{\"objective\":\"x\",\"max_depth\":3}"),
                Sample.class);
        assertEquals("x", sample.objective());
        assertEquals(3, sample.maxDepth());
    }

    @Test
    @DisplayName("parse reports every violated field by its wire path")
    void reportsAllErrors() throws Exception {
        var e = assertThrows(ValidationFailedException.class, () -> validator.parse(
                AgentJson.mapper().readTree("{\"objective\":\"\",\"max_depth\":11}"), Sample.class));
        assertEquals(2, e.getErrors().size());
        assertEquals("max_depth", e.getErrors().get(0).path());
        assertEquals("objective", e.getErrors().get(1).path());
    }

    @Test
    @DisplayName("parse reports type mismatches with the offending path")
    void reportsTypeMismatch() throws Exception {
        var e = assertThrows(ValidationFailedException.class, () -> validator.parse(
                AgentJson.mapper().readTree("{\"objective\":\"x\",\"max_depth\":\"deep\"}"), Sample.class));
        assertEquals("max_depth", e.getErrors().get(0).path());
    }

    @Test
    @DisplayName("parse rejects a missing input")
    void rejectsNull() {
        assertThrows(ValidationFailedException.class, () -> validator.parse(null, Sample.class));
    }

    @Test
    @DisplayName("toSnakeCase converts nested property paths")
    void snakeCasePaths() {
        assertEquals("traces[3].reported_confidence", SchemaValidator.toSnakeCase("traces[3].reportedConfidence"));
    }
}
