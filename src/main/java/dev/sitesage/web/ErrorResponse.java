package dev.sitesage.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by the API. {@code url} is set when the error concerns one analyzed page.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, String url) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }
}
