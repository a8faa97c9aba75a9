package com.hawkguard.header;

import com.hawkguard.credential.HawkHeader;
import com.hawkguard.credential.HawkHeaderParser;
import com.hawkguard.guard.GuardOutcome;
import com.hawkguard.guard.HeaderGuard;
import com.hawkguard.guard.HeaderView;

/**
 * A Hawk value taken from the {@code Server-Authorization} header a server sends back to
 * authenticate its response. Read the same way as {@link AuthorizationHeader}.
 */
public final class ServerAuthorizationHeader extends HawkAuthzHeader {

    public static final String HEADER_NAME = "server-authorization";

    /** Guard producing the parsed header. */
    public static final HeaderGuard<HawkHeader> GUARD =
            HeaderGuard.hawk(HEADER_NAME, HawkHeaderParser.INSTANCE);

    public ServerAuthorizationHeader(HawkHeader header) {
        super(header);
    }

    /**
     * Evaluates {@link #GUARD} against the request's headers.
     */
    public static GuardOutcome<ServerAuthorizationHeader> from(HeaderView headers) {
        return GUARD.evaluate(headers).map(ServerAuthorizationHeader::new);
    }

    @Override
    public String headerName() {
        return HEADER_NAME;
    }
}
