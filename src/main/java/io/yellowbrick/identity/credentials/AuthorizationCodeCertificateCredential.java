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

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.Authority;
import io.yellowbrick.identity.oauth2.ProofKeyForCodeExchange;

/**
 * Redeems an authorization code, or a refresh token, proving the client's identity
 * with a certificate instead of a secret. A new assertion is signed for each
 * {@link #form()}; no Basic authorization pair is offered.
 */
public class AuthorizationCodeCertificateCredential extends TokenCredential {
    private final ClientAuthentication authentication;
    private final CodeOrRefreshGrant grant;

    AuthorizationCodeCertificateCredential(IdentityConfiguration configuration, ClientAuthentication authentication,
            CodeOrRefreshGrant grant) {
        super(configuration, TokenCredentialOptions.from(configuration));
        this.authentication = authentication;
        this.grant = grant;
    }

    public static Builder builder(String clientId) {
        return new Builder(IdentityConfiguration.builder(clientId));
    }

    public static Builder builder(IdentityConfiguration configuration) {
        return new Builder(configuration.toBuilder());
    }

    @Override
    public GrantKind kind() {
        return GrantKind.AUTHORIZATION_CODE_CERTIFICATE;
    }

    @Override
    public Map<String, String> form() throws IdentityException {
        return grant.form(configuration, authentication, tokenUrl(), false);
    }

    public AuthorizationCodeCertificateCredential withRefreshToken(String refreshToken) {
        return new AuthorizationCodeCertificateCredential(configuration, authentication,
                grant.withRefreshToken(refreshToken));
    }

    public static class Builder {
        private final IdentityConfiguration.Builder configuration;
        private ClientAuthentication authentication = ClientAuthentication.certificate(null);
        private String authorizationCode;
        private String refreshToken;
        private String codeVerifier;
        private final List<String> scope = new ArrayList<>();

        private Builder(IdentityConfiguration.Builder configuration) {
            this.configuration = configuration;
        }

        /**
         * Signs a fresh client assertion with this certificate for every request.
         */
        public Builder withCertificate(X509CertificateAssertion certificate) {
            this.authentication = ClientAuthentication.certificate(certificate);
            return this;
        }

        /**
         * Sends an assertion signed elsewhere, as is.
         */
        public Builder withClientAssertion(String clientAssertion) {
            this.authentication = ClientAuthentication.assertion(clientAssertion);
            return this;
        }

        public Builder withAuthorizationCode(String authorizationCode) {
            this.authorizationCode = authorizationCode;
            return this;
        }

        public Builder withRefreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder withPkce(ProofKeyForCodeExchange pkce) {
            this.codeVerifier = pkce.getCodeVerifier();
            return this;
        }

        public Builder withCodeVerifier(String codeVerifier) {
            this.codeVerifier = codeVerifier;
            return this;
        }

        public Builder withRedirectUri(String redirectUri) {
            configuration.withRedirectUri(redirectUri);
            return this;
        }

        public Builder withRedirectUri(URI redirectUri) {
            configuration.withRedirectUri(redirectUri);
            return this;
        }

        public Builder withTenant(String tenantId) {
            configuration.withTenant(tenantId);
            return this;
        }

        public Builder withAuthority(Authority authority) {
            configuration.withAuthority(authority);
            return this;
        }

        public Builder withScope(String... scope) {
            return withScope(Arrays.asList(scope));
        }

        public Builder withScope(Collection<String> scope) {
            this.scope.addAll(scope);
            return this;
        }

        public AuthorizationCodeCertificateCredential build() throws IdentityException {
            AuthorizationCodeCertificateCredential credential = new AuthorizationCodeCertificateCredential(
                    configuration.build(), authentication,
                    new CodeOrRefreshGrant(authorizationCode, refreshToken, codeVerifier, scope));
            credential.form();
            return credential;
        }
    }
}
