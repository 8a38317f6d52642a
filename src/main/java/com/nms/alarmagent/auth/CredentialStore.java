package com.nms.alarmagent.auth;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link Credential}.
 *
 * Readers always see a complete credential: replacement is a single reference swap.
 * Only {@link TokenManager} writes to it.
 */
@Component
public class CredentialStore {

    private final AtomicReference<Credential> current = new AtomicReference<>();

    public Optional<Credential> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @throws IllegalStateException if no credential has been acquired yet
     */
    public String currentAuthorizationHeader() {
        Credential credential = current.get();
        if (credential == null) {
            throw new IllegalStateException("No access token available. Authenticate first.");
        }
        return credential.authorizationHeader();
    }

    void replace(Credential credential) {
        current.set(credential);
    }

    void clear() {
        current.set(null);
    }
}
