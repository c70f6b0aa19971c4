package io.surfworks.sparklaunch.provider;

/**
 * Exception thrown when a call to the cluster provider fails.
 *
 * <p>Carries the provider's own message and cause unchanged. Nothing in
 * sparklaunch retries on it; retry policy belongs to the provider SDK.
 */
public class ProviderException extends Exception {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
