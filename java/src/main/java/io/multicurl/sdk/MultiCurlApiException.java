package io.multicurl.sdk;

/**
 * Exception representing an error response from the API. Raised when a request whose failure is fatal (for example
 * the first page of a list) comes back with a non-2xx status, so callers can inspect both the HTTP status and the
 * server-provided message.
 */
public final class MultiCurlApiException extends MultiCurlException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public MultiCurlApiException(int statusCode, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode) : message);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status code returned by the API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    private static String defaultMessage(int status) {
        return "request failed with status " + status;
    }
}
