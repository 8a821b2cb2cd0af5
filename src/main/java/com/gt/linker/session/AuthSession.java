package com.gt.linker.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Holds the credentials handed over by the sign-in flow. Token issuance and refresh happen elsewhere;
 * this only records the current bearer token and announces login/logout to the rest of the core.
 */
@Component
public class AuthSession {

    private static final Logger log = LoggerFactory.getLogger(AuthSession.class);

    private final ApplicationEventPublisher eventPublisher;

    private volatile Credentials credentials;

    public AuthSession(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public void login(String accessToken, long ownerId) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required to log in");
        }

        credentials = new Credentials(accessToken, ownerId);
        log.info("Session authenticated for owner {}", ownerId);

        eventPublisher.publishEvent(new AuthenticatedEvent(ownerId));
    }

    public void logout() {
        Credentials previous = credentials;
        credentials = null;

        log.info("Session logged out");
        eventPublisher.publishEvent(new LoggedOutEvent(previous == null ? null : previous.ownerId()));
    }

    public boolean isAuthenticated() {
        return credentials != null;
    }

    public Optional<String> getAccessToken() {
        Credentials current = credentials;
        return current == null ? Optional.empty() : Optional.of(current.accessToken());
    }

    public Optional<Long> getOwnerId() {
        Credentials current = credentials;
        return current == null ? Optional.empty() : Optional.of(current.ownerId());
    }

    private record Credentials(String accessToken, long ownerId) { }
}
