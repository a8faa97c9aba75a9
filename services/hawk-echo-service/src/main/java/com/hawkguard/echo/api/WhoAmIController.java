package com.hawkguard.echo.api;

import com.hawkguard.guard.GuardOutcome;
import com.hawkguard.header.AuthorizationHeader;
import com.hawkguard.header.HawkAuthzHeader;
import com.hawkguard.header.ServerAuthorizationHeader;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Echoes the attributes of the Hawk header a request presented.
 *
 * <p>{@code /whoami} and {@code /server-whoami} only run when the guard succeeds; failures are
 * answered by {@code HawkGuardExceptionHandler}. {@code /inspect} always runs and reports the
 * outcome itself.
 */
@RestController
@RequestMapping("/api/v1")
public class WhoAmIController {

    @GetMapping("/whoami")
    public Map<String, Object> whoami(AuthorizationHeader header) {
        return describe(header);
    }

    @GetMapping("/server-whoami")
    public Map<String, Object> serverWhoami(ServerAuthorizationHeader header) {
        return describe(header);
    }

    @GetMapping("/inspect")
    public Map<String, Object> inspect(GuardOutcome<AuthorizationHeader> outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (outcome instanceof GuardOutcome.Failure<AuthorizationHeader> failure) {
            body.put("outcome", "failure");
            body.put("error", failure.error().getClass().getSimpleName());
            body.put("message", failure.error().message());
            body.put("status", failure.status().code());
        } else {
            body.put("outcome", "success");
            outcome.toOptional()
                    .flatMap(AuthorizationHeader::id)
                    .ifPresent(id -> body.put("id", id));
        }
        return body;
    }

    private static Map<String, Object> describe(HawkAuthzHeader header) {
        // null-valued entries are left out rather than rendered as JSON null
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("header", header.headerName());
        header.id().ifPresent(id -> body.put("id", id));
        header.ts().ifPresent(ts -> body.put("ts", ts.getEpochSecond()));
        header.nonce().ifPresent(nonce -> body.put("nonce", nonce));
        header.ext().ifPresent(ext -> body.put("ext", ext));
        header.app().ifPresent(app -> body.put("app", app));
        header.dlg().ifPresent(dlg -> body.put("dlg", dlg));
        return body;
    }
}
