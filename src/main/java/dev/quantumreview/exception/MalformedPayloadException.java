package dev.quantumreview.exception;

/**
 * The webhook body passed signature verification but is not a JSON object.
 */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedPayloadException(String message) {
        super(message);
    }
}
