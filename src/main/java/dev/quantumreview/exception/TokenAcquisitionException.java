package dev.quantumreview.exception;

/**
 * A GitHub credential could not be minted or exchanged. Callers must fail rather
 * than fall back to an unauthenticated or stale token.
 *
 * <p>{@link #getInstallationId()} is {@code null} when the app JWT itself failed outside
 * any installation exchange.
 */
public class TokenAcquisitionException extends RuntimeException {

    private final Long installationId;

    public TokenAcquisitionException(long installationId, String message, Throwable cause) {
        super(message, cause);
        this.installationId = installationId;
    }

    public TokenAcquisitionException(long installationId, String message) {
        this(installationId, message, null);
    }

    private TokenAcquisitionException(String message, Throwable cause) {
        super(message, cause);
        this.installationId = null;
    }

    public static TokenAcquisitionException appLevel(String message, Throwable cause) {
        return new TokenAcquisitionException(message, cause);
    }

    public Long getInstallationId() {
        return installationId;
    }

    public boolean isAppLevel() {
        return installationId == null;
    }
}
