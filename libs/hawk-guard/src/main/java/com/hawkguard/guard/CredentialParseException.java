package com.hawkguard.guard;

/**
 * Thrown by a {@link CredentialParser} when a credential payload does not follow its grammar.
 * <p>
 * The guard never inspects the message; it wraps the exception in
 * {@link HawkError.MalformedCredential} as is.
 */
public class CredentialParseException extends Exception {

    public CredentialParseException(String message) {
        super(message);
    }

    public CredentialParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
