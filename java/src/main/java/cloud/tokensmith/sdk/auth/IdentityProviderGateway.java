package cloud.tokensmith.sdk.auth;

import cloud.tokensmith.sdk.GatewayException;

/**
 * Network-facing capabilities of the identity provider. Implementations report every failure as a
 * {@link GatewayException} and never retry on their own behalf.
 */
public interface IdentityProviderGateway {

    TokenSet authenticate(Credentials credentials) throws GatewayException;

    TokenSet refresh(String refreshToken) throws GatewayException;

    /**
     * Exchanges {@code accessToken} for a token scoped to {@code targetAudience}.
     */
    TokenSet exchange(String accessToken, String targetAudience) throws GatewayException;

    UserInfo userInfo(String accessToken) throws GatewayException;
}
