package io.routeguide.store;

/**
 * The feature dataset could not be read or parsed.
 */
public class FeatureLoadException extends Exception {

    public FeatureLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public FeatureLoadException(String message) {
        super(message);
    }
}
