package ru.tsdb.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * JSON body of every error answer.
 */
@JsonPropertyOrder({"error", "type", "code", "message", "context"})
public class ErrorResponse {

    public String error;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public String type;
    public int code;
    public String message;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> context;

    public ErrorResponse() {
        // For Jackson
    }

    ErrorResponse(String type, int code, String message, Map<String, Object> context) {
        this.error = type;
        this.type = type;
        this.code = code;
        this.message = message;
        this.context = context;
    }
}
