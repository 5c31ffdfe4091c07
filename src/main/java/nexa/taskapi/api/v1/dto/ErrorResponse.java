package nexa.taskapi.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body: a human-readable message, or the list of validation problems.
 */
public record ErrorResponse(@JsonProperty("detail") Object detail) {

    public static ErrorResponse message(String message) {
        return new ErrorResponse(message);
    }

    public static ErrorResponse validation(List<FieldError> errors) {
        return new ErrorResponse(errors);
    }
}
