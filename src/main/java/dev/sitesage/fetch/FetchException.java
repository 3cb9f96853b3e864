package dev.sitesage.fetch;

import dev.sitesage.model.FailureKind;
import lombok.Getter;

/**
 * Typed failure of a single page fetch. Scoped to one URL; never retried by the fetcher.
 */
@Getter
public class FetchException extends RuntimeException {

    private final String url;
    private final FailureKind kind;
    private final Integer httpStatus;

    private FetchException(String url, FailureKind kind, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public static FetchException timeout(String url, Throwable cause) {
        return new FetchException(url, FailureKind.TIMEOUT, null, "Request timeout", cause);
    }

    public static FetchException connectionError(String url, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "connection failed";
        return new FetchException(url, FailureKind.CONNECTION_ERROR, null, "Connection error: " + detail, cause);
    }

    public static FetchException httpError(String url, int status) {
        return new FetchException(url, FailureKind.HTTP_ERROR, status, "HTTP error status " + status, null);
    }

    public static FetchException tooLarge(String url, long limitBytes, Throwable cause) {
        return new FetchException(url, FailureKind.TOO_LARGE, null,
                "Response exceeds the " + limitBytes + " byte limit", cause);
    }
}
