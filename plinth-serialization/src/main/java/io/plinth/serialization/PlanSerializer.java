package io.plinth.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.plinth.core.plan.DeploymentPlan;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Utility class for reading and writing compiled deployment plans as JSON.
///
/// ### Usage
/// {@snippet :
/// // Load a plan produced by the blueprint compiler
/// DeploymentPlan plan = PlanSerializer.read(Path.of("blueprint/plan.json"));
///
/// // Serialize
/// String json = PlanSerializer.toJson(plan);
///
/// // Custom ObjectMapper
/// ObjectMapper mapper = PlanSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see PlinthJacksonModule for the registered type handlers
public final class PlanSerializer {

    private PlanSerializer() {}

    /// Serializes a plan to pretty-printed JSON.
    ///
    /// @param plan the plan to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(DeploymentPlan plan) {
        try {
            return createMapper().writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize plan: " + e.getMessage(), e);
        }
    }

    /// Deserializes a plan from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized plan, never null
    /// @throws IllegalArgumentException if the JSON is malformed or lacks required fields
    /// @throws io.plinth.core.exception.ConfigurationException if the plan is inconsistent
    public static DeploymentPlan fromJson(String json) {
        try {
            return createMapper().readValue(json, DeploymentPlan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize plan: " + e.getMessage(), e);
        }
    }

    /// Reads a plan from a JSON file.
    ///
    /// @param planFile path of the plan file, not null
    /// @return deserialized plan, never null
    /// @throws IOException if the file cannot be read or parsed
    public static DeploymentPlan read(Path planFile) throws IOException {
        return createMapper().readValue(Files.readAllBytes(planFile), DeploymentPlan.class);
    }

    /// Creates an ObjectMapper configured for Plinth plan and instance serialization.
    ///
    /// Registers:
    /// - `PlinthJacksonModule` for the plan type hierarchy
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled so compiler-specific fields are ignored
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PlinthJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
