package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Mock route optimization output attached to {@code optimize_route} tasks.
 */
public record RouteOptimizationResult(
        @JsonProperty("total_distance") double totalDistance,
        @JsonProperty("suggested_order") List<Integer> suggestedOrder,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("optimization_details") OptimizationDetails optimizationDetails) {

    public record OptimizationDetails(
            @JsonProperty("algorithm") String algorithm,
            @JsonProperty("time_saved") String timeSaved,
            @JsonProperty("fuel_saved") String fuelSaved) {
    }
}
