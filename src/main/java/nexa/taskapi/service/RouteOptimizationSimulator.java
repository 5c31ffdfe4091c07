package nexa.taskapi.service;

import com.fasterxml.jackson.databind.JsonNode;
import nexa.taskapi.api.v1.dto.RouteOptimizationResult;
import nexa.taskapi.api.v1.dto.RouteOptimizationResult.OptimizationDetails;
import nexa.taskapi.model.Task;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Produces placeholder route optimization results.
 *
 * No routing is computed: the distance and savings figures are random, the
 * suggested order is the identity order of the submitted locations. Output
 * differs on every call unless a seeded generator and a fixed clock are injected.
 */
public class RouteOptimizationSimulator {

    static final String ALGORITHM = "greedy_nearest_neighbor";

    static final double MIN_DISTANCE = 10.5;
    static final double MAX_DISTANCE = 150.8;
    static final int MIN_LOCATIONS = 3;
    static final int MAX_LOCATIONS = 8;
    static final int MIN_MINUTES_SAVED = 5;
    static final int MAX_MINUTES_SAVED = 45;
    static final double MIN_FUEL_SAVED = 2.1;
    static final double MAX_FUEL_SAVED = 8.5;

    private final RandomGenerator random;
    private final Clock clock;

    public RouteOptimizationSimulator() {
        this(new Random(), Clock.systemUTC());
    }

    public RouteOptimizationSimulator(RandomGenerator random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    public RouteOptimizationResult simulate(Task task) {
        int locationCount = locationCount(task.payload());

        List<Integer> order = new ArrayList<>(locationCount);
        for (int i = 1; i <= locationCount; i++) {
            order.add(i);
        }

        double distance = round(random.nextDouble(MIN_DISTANCE, MAX_DISTANCE), 2);
        int minutesSaved = random.nextInt(MIN_MINUTES_SAVED, MAX_MINUTES_SAVED + 1);
        double fuelSaved = round(random.nextDouble(MIN_FUEL_SAVED, MAX_FUEL_SAVED), 1);

        return new RouteOptimizationResult(
                distance,
                List.copyOf(order),
                clock.instant(),
                new OptimizationDetails(
                        ALGORITHM,
                        minutesSaved + " minutes",
                        fuelSaved + " liters"));
    }

    /** Size of a non-empty {@code locations} array, otherwise a random count */
    /**
     * Number of stops: elements of an array, keys of an object or characters of
     * a string. Anything else, or an empty value, gets a random count.
     */
    private int locationCount(JsonNode payload) {
        JsonNode locations = payload.get("locations");
        int count = 0;
        if (locations != null) {
            if (locations.isArray() || locations.isObject()) {
                count = locations.size();
            } else if (locations.isTextual()) {
                String text = locations.textValue();
                count = text.codePointCount(0, text.length());
            }
        }
        return count > 0 ? count : random.nextInt(MIN_LOCATIONS, MAX_LOCATIONS + 1);
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
