package com.hawkguard.header;

import com.hawkguard.credential.HawkHeader;
import com.hawkguard.credential.HawkHeaderParser;
import com.hawkguard.guard.GuardOutcome;
import com.hawkguard.guard.HeaderGuard;
import com.hawkguard.guard.HeaderView;

/**
 * A Hawk value taken from the client's {@code Authorization} header.
 */
public final class AuthorizationHeader extends HawkAuthzHeader {

    public static final String HEADER_NAME = "authorization";

    /** Guard producing the parsed header. */
    public static final HeaderGuard<HawkHeader> GUARD =
            HeaderGuard.hawk(HEADER_NAME, HawkHeaderParser.INSTANCE);

    public AuthorizationHeader(HawkHeader header) {
        super(header);
    }

    /**
     * Evaluates {@link #GUARD} against the request's headers.
     */
    public static GuardOutcome<AuthorizationHeader> from(HeaderView headers) {
        return GUARD.evaluate(headers).map(AuthorizationHeader::new);
    }

    @Override
    public String headerName() {
        return HEADER_NAME;
    }
}
