package com.hawkguard.guard;

import java.util.Objects;

/**
 * Extracts and parses one authentication header from a request.
 * <p>
 * Evaluation runs three steps and stops at the first failure:
 * <ol>
 *   <li>{@link HeaderLocator#locate}: exactly one value for {@link #headerName()}</li>
 *   <li>{@link SchemeSplitter#split}: value starts with the scheme and a space</li>
 *   <li>{@link CredentialParser#parse}: payload follows the credential grammar</li>
 * </ol>
 * Instances are immutable and may be shared between threads. Evaluation only reads
 * the headers it is given.
 *
 * @param <C> the credential type produced on success
 */
public final class HeaderGuard<C> {

    private final String headerName;
    private final String scheme;
    private final CredentialParser<? extends C> parser;

    public HeaderGuard(String headerName, String scheme, CredentialParser<? extends C> parser) {
        this.headerName = Objects.requireNonNull(headerName, "headerName must not be null");
        this.scheme = Objects.requireNonNull(scheme, "scheme must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /** Guard for the {@value SchemeSplitter#HAWK_SCHEME} scheme on the given header. */
    public static <C> HeaderGuard<C> hawk(String headerName, CredentialParser<? extends C> parser) {
        return new HeaderGuard<>(headerName, SchemeSplitter.HAWK_SCHEME, parser);
    }

    public String headerName() {
        return headerName;
    }

    public String scheme() {
        return scheme;
    }

    /**
     * Evaluates the guard against a request's headers.
     *
     * @param headers the request's header lookup
     * @return the parsed credential, or the first failure encountered
     */
    public GuardOutcome<C> evaluate(HeaderView headers) {
        return HeaderLocator.locate(headers.values(headerName))
                .flatMap(raw -> SchemeSplitter.split(raw, scheme))
                .flatMap(this::parse);
    }

    private GuardOutcome<C> parse(String payload) {
        try {
            return GuardOutcome.success(parser.parse(payload));
        } catch (CredentialParseException e) {
            return GuardOutcome.failure(
                    new HawkError.MalformedCredential(e), GuardStatus.UNAUTHORIZED);
        }
    }

    @Override
    public String toString() {
        return "HeaderGuard[" + headerName + ", " + scheme + "]";
    }
}
