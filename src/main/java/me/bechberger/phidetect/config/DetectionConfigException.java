package me.bechberger.phidetect.config;

/**
 * Thrown when a configuration cannot be turned into detector components, e.g. because a custom
 * pattern does not compile.
 */
public class DetectionConfigException extends RuntimeException {

    public DetectionConfigException(String message) {
        super(message);
    }

    public DetectionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
