package nexa.taskapi.api;

import nexa.taskapi.api.v1.dto.FieldError;

import java.util.List;

/**
 * Thrown when a request body fails validation. Carries every field-level
 * problem found so the client can fix them in one round trip.
 * Rendered as 422 Unprocessable Entity.
 */
public class RequestValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public RequestValidationException(List<FieldError> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> errors() {
        return errors;
    }

    private static String summarize(List<FieldError> errors) {
        StringBuilder sb = new StringBuilder();
        for (FieldError error : errors) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(String.join(".", error.loc())).append(": ").append(error.msg());
        }
        return sb.toString();
    }
}
