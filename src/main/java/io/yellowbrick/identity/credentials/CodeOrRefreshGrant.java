/*
 * MIT License
 *
 * (c) 2025 Yellowbrick Data, Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES, OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package io.yellowbrick.identity.credentials;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.OAuthParameter;
import io.yellowbrick.identity.oauth2.OAuthSerializer;
import io.yellowbrick.identity.oauth2.OpenIdAuthorizationUrlParameters;

/**
 * The body shared by the authorization code and refresh token grants. Exactly one of
 * the code or the refresh token may be set.
 */
final class CodeOrRefreshGrant {
    static final String AUTHORIZATION_CODE_GRANT = "authorization_code";
    static final String REFRESH_TOKEN_GRANT = "refresh_token";

    final String authorizationCode;
    final String refreshToken;
    final String codeVerifier;
    final List<String> scope;

    CodeOrRefreshGrant(String authorizationCode, String refreshToken, String codeVerifier, List<String> scope) {
        this.authorizationCode = authorizationCode;
        this.refreshToken = refreshToken;
        this.codeVerifier = codeVerifier;
        this.scope = Collections.unmodifiableList(new ArrayList<>(scope));
    }

    /**
     * The same grant redeeming {@code refreshToken}; the authorization code is dropped.
     */
    CodeOrRefreshGrant withRefreshToken(String refreshToken) {
        return new CodeOrRefreshGrant(null, refreshToken, null, scope);
    }

    Map<String, String> form(IdentityConfiguration configuration, ClientAuthentication authentication,
            String tokenUrl, boolean openId) throws IdentityException {
        if (authorizationCode != null && refreshToken != null) {
            throw IdentityException.conflictingValues("authorization_code", "refresh_token");
        }

        if (!configuration.hasValidClientId()) {
            throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_ID.alias());
        }
        String clientId = configuration.clientId.toString();

        authentication.validate();

        OAuthSerializer serializer = new OAuthSerializer();
        serializer.clientId(clientId);
        if (openId) {
            serializer.addScope(OpenIdAuthorizationUrlParameters.OPENID_SCOPE);
        }
        serializer.extendScopes(scope);

        List<OAuthParameter> required;
        List<OAuthParameter> optional = new ArrayList<>();
        if (refreshToken != null) {
            if (refreshToken.isBlank()) {
                throw IdentityException.missingRequiredValue(OAuthParameter.REFRESH_TOKEN.alias());
            }
            serializer.refreshToken(refreshToken)
                    .grantType(REFRESH_TOKEN_GRANT);
            required = authentication.requiredWith(OAuthParameter.REFRESH_TOKEN, OAuthParameter.GRANT_TYPE);
        } else if (authorizationCode != null) {
            if (authorizationCode.isBlank()) {
                throw IdentityException.missingRequiredValue("authorization_code");
            }
            String redirectUri = configuration.requireRedirectUri().toString();
            serializer.authorizationCode(authorizationCode)
                    .redirectUri(redirectUri)
                    .grantType(AUTHORIZATION_CODE_GRANT)
                    .codeVerifier(codeVerifier);
            required = authentication.requiredWith(OAuthParameter.REDIRECT_URI, OAuthParameter.AUTHORIZATION_CODE,
                    OAuthParameter.GRANT_TYPE);
            optional.add(OAuthParameter.CODE_VERIFIER);
        } else {
            throw IdentityException.missingRequiredValue("authorization_code or refresh_token");
        }

        if (openId) {
            required.add(OAuthParameter.SCOPE);
        } else {
            optional.add(0, OAuthParameter.SCOPE);
        }

        authentication.apply(serializer, clientId, tokenUrl);
        return serializer.form(optional, required);
    }
}
