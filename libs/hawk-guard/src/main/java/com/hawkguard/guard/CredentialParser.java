package com.hawkguard.guard;

/**
 * Parses the credential payload that follows the scheme token of an authentication header.
 *
 * @param <C> the structured credential type
 */
@FunctionalInterface
public interface CredentialParser<C> {

    /**
     * Parses a payload.
     *
     * @param payload everything after the single space that follows the scheme token, unmodified
     * @return the parsed credential, never null
     * @throws CredentialParseException if the payload does not follow the grammar
     */
    C parse(String payload) throws CredentialParseException;
}
