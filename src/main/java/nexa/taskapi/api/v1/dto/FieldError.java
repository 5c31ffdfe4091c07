package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One validation problem in a request body.
 * {@code loc} is the path to the offending value, starting with "body".
 */
public record FieldError(
        @JsonProperty("loc") List<String> loc,
        @JsonProperty("msg") String msg,
        @JsonProperty("type") String type) {

    public static FieldError missing(String field) {
        return new FieldError(List.of("body", field), "Field required", "missing");
    }

    public static FieldError stringType(String field) {
        return new FieldError(List.of("body", field), "Input should be a valid string", "string_type");
    }

    public static FieldError dictType(String field) {
        return new FieldError(List.of("body", field), "Input should be a valid dictionary", "dict_type");
    }

    public static FieldError invalidJson() {
        return new FieldError(List.of("body"), "JSON decode error", "json_invalid");
    }

    public static FieldError notAnObject() {
        return new FieldError(List.of("body"),
                "Input should be a valid dictionary or object to extract fields from",
                "model_attributes_type");
    }
}
