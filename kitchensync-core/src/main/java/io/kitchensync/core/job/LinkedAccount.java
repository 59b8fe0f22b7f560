package io.kitchensync.core.job;

public record LinkedAccount(
    String id,
    String userId,
    String providerAccountId,
    String email,
    String accessToken,
    String refreshToken,
    Long expiresAt,
    String tokenType,
    String authBundle
) {

    public boolean hasAuthBundle() {
        return authBundle != null && !authBundle.isBlank();
    }
}
