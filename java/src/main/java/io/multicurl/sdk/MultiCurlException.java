package io.multicurl.sdk;

/**
 * Base exception thrown by the multicurl SDK.
 */
public class MultiCurlException extends Exception {

    private static final long serialVersionUID = 1L;

    public MultiCurlException(String message) {
        super(message);
    }

    public MultiCurlException(String message, Throwable cause) {
        super(message, cause);
    }
}
