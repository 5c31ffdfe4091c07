package nexa.taskapi.api.v1.dto;

import nexa.taskapi.api.RequestValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreateTaskRequestTest {

    @Test
    void parseValidRequest() {
        String json = """
                {
                  "type": "optimize_route",
                  "payload": { "locations": ["A", "B", "C", "D"], "vehicle_type": "truck" }
                }
                """;

        CreateTaskRequest req = CreateTaskRequest.parse(json);

        assertEquals("optimize_route", req.type());
        assertEquals(4, req.payload().get("locations").size());
        assertEquals("truck", req.payload().get("vehicle_type").asText());
    }

    @Test
    void extraFieldsAreIgnored() {
        CreateTaskRequest req = CreateTaskRequest.parse(
                "{\"type\":\"x\",\"payload\":{},\"priority\":5}");

        assertEquals("x", req.type());
        assertTrue(req.payload().isEmpty());
    }

    @Test
    void missingFieldsAreAllReported() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("{}"));

        assertEquals(List.of(FieldError.missing("type"), FieldError.missing("payload")), e.errors());
        assertEquals(List.of("body", "type"), e.errors().get(0).loc());
        assertEquals("missing", e.errors().get(0).type());
    }

    @Test
    void wrongTypes() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("{\"type\":42,\"payload\":[1,2]}"));

        assertEquals(List.of(FieldError.stringType("type"), FieldError.dictType("payload")), e.errors());
    }

    @Test
    void nullValuesAreTypeErrors() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("{\"type\":null,\"payload\":null}"));

        assertEquals("string_type", e.errors().get(0).type());
        assertEquals("dict_type", e.errors().get(1).type());
    }

    @Test
    void onlyPayloadWrong() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("{\"type\":\"generate_report\",\"payload\":\"monthly\"}"));

        assertEquals(1, e.errors().size());
        assertEquals(List.of("body", "payload"), e.errors().get(0).loc());
    }

    @Test
    void malformedJson() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("{\"type\": "));

        assertEquals(List.of(FieldError.invalidJson()), e.errors());
    }

    @Test
    void trailingContentAfterObjectIsInvalidJson() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("{\"type\":\"generate_report\",\"payload\":{}} trailing-garbage"));

        assertEquals(List.of(FieldError.invalidJson()), e.errors());
    }

    @Test
    void emptyBody() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse(""));

        assertEquals("json_invalid", e.errors().get(0).type());
    }

    @Test
    void bodyMustBeAnObject() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> CreateTaskRequest.parse("[\"optimize_route\"]"));

        assertEquals(List.of(FieldError.notAnObject()), e.errors());
    }
}
