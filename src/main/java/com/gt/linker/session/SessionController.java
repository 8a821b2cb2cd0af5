package com.gt.linker.session;

import com.gt.linker.reconcile.ReconciliationTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/rest/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final AuthSession authSession;
    private final ReconciliationTrigger reconciliationTrigger;

    @Autowired
    public SessionController(AuthSession authSession, ReconciliationTrigger reconciliationTrigger) {
        this.authSession = authSession;
        this.reconciliationTrigger = reconciliationTrigger;
    }

    @PostMapping(value = "/login", consumes = "application/json")
    public void login(@RequestBody LoginRequest request) {
        try {
            authSession.login(request.accessToken(), request.ownerId());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @PostMapping("/logout")
    public void logout() {
        authSession.logout();
    }

    @PostMapping("/background")
    public void background() {
        log.debug("App moved to background");
        reconciliationTrigger.onBackground();
    }

    @PostMapping("/foreground")
    public void foreground() {
        log.debug("App returned to foreground");
        reconciliationTrigger.onForeground();
    }

    public record LoginRequest(String accessToken, long ownerId) { }
}
