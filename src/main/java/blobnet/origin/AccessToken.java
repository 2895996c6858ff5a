package blobnet.origin;

import java.time.Instant;

/**
 * Bearer token for pulling from one repository, valid until {@code expiresAt}.
 */
public record AccessToken(String token, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken{expiresAt=" + expiresAt + "}";
    }
}
