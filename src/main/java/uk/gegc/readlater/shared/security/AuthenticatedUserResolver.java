package uk.gegc.readlater.shared.security;

import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import uk.gegc.readlater.shared.exception.UnauthorizedException;

import java.util.UUID;

/**
 * Resolves the owning user id from the authenticated principal.
 */
@Component
public class AuthenticatedUserResolver {

    public UUID resolveUserId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new UnauthorizedException("Authentication is required");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException ex) {
            throw new UnauthorizedException("Authenticated principal is not a user id");
        }
    }
}
