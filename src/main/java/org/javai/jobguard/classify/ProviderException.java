package org.javai.jobguard.classify;

/**
 * An unchecked failure of a remote call carrying the provider's condition code.
 */
public class ProviderException extends RuntimeException implements ProviderError {

    private final String errorCode;

    public ProviderException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ProviderException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    @Override
    public String errorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return errorCode + ": " + getMessage();
    }
}
