package dev.quantumreview.exception;

/**
 * A CI test report could not be read.
 */
public class ReportParseException extends RuntimeException {
    public ReportParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
