package org.javai.jobguard.classify;

/**
 * Implemented by failures that carry a structured condition code reported by the cloud provider,
 * such as {@code ThrottlingException} or {@code AccessDenied}.
 *
 * <p>Adapters for a provider SDK typically wrap the SDK's exception in a {@link ProviderException},
 * or make their own exception type implement this interface.
 */
public interface ProviderError {

    /**
     * The provider's condition code, exactly as reported. May be null when the provider sent none.
     */
    String errorCode();
}
