package dev.sitesage.ai;

import lombok.Getter;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Failure of the external summarization service. Always recovered by the insight fallback.
 */
@Getter
public class SummarizationException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        QUOTA,
        INVALID_RESPONSE,
        UNAVAILABLE
    }

    private final Reason reason;

    public SummarizationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SummarizationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Classify an error raised while calling a provider.
     */
    public static SummarizationException from(String provider, Throwable error) {
        if (error instanceof SummarizationException summarizationException) {
            return summarizationException;
        }
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException) {
                return new SummarizationException(Reason.TIMEOUT, provider + " request timed out", error);
            }
            if (current instanceof WebClientResponseException responseException) {
                int status = responseException.getStatusCode().value();
                Reason reason = status == 429 ? Reason.QUOTA : Reason.UNAVAILABLE;
                return new SummarizationException(reason, provider + " API error: " + status, error);
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return new SummarizationException(Reason.UNAVAILABLE, provider + " request failed: " + error.getMessage(), error);
    }
}
