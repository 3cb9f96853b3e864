package dev.sitesage.web;

import dev.sitesage.model.AnalysisOutcome;
import dev.sitesage.model.FailureKind;
import dev.sitesage.model.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps API errors to {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(VALIDATION_ERROR, ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(VALIDATION_ERROR, "Invalid request payload"));
    }

    @ExceptionHandler(AnalysisFailedException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisFailed(AnalysisFailedException ex) {
        AnalysisOutcome.Failure failure = ex.getFailure();
        return ResponseEntity.status(statusFor(failure.kind())).body(BatchAnalyzeResponse.toError(failure));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.internalServerError()
                .body(ErrorResponse.of(FailureKind.INTERNAL.name(), "Unexpected error"));
    }

    static HttpStatus statusFor(FailureKind kind) {
        switch (kind) {
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case CONNECTION_ERROR:
            case HTTP_ERROR:
                return HttpStatus.BAD_GATEWAY;
            case TOO_LARGE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
