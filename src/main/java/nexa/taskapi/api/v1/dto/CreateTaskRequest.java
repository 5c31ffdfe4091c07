package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import nexa.taskapi.api.RequestValidationException;
import nexa.taskapi.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating a new task.
 * POST /api/v1/tasks
 *
 * <pre>
 * {"type": "optimize_route", "payload": {"locations": ["A", "B", "C"], "vehicle_type": "truck"}}
 * </pre>
 *
 * Any string is accepted as the type. Extra fields are ignored.
 */
public record CreateTaskRequest(String type, JsonNode payload) {

    /**
     * Parse and validate a raw request body.
     *
     * @throws RequestValidationException listing every problem found
     */
    public static CreateTaskRequest parse(String body) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new RequestValidationException(List.of(FieldError.invalidJson()));
        }
        if (root == null || root.isMissingNode()) {
            throw new RequestValidationException(List.of(FieldError.invalidJson()));
        }
        return fromJson(root);
    }

    /**
     * Validate an already parsed JSON document.
     *
     * @throws RequestValidationException listing every problem found
     */
    public static CreateTaskRequest fromJson(JsonNode root) {
        if (!root.isObject()) {
            throw new RequestValidationException(List.of(FieldError.notAnObject()));
        }

        List<FieldError> errors = new ArrayList<>();

        JsonNode type = root.get("type");
        if (type == null) {
            errors.add(FieldError.missing("type"));
        } else if (!type.isTextual()) {
            errors.add(FieldError.stringType("type"));
        }

        JsonNode payload = root.get("payload");
        if (payload == null) {
            errors.add(FieldError.missing("payload"));
        } else if (!payload.isObject()) {
            errors.add(FieldError.dictType("payload"));
        }

        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }

        return new CreateTaskRequest(type.asText(), payload);
    }
}
