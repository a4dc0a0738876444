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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityConstants;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.Authority;

/**
 * Requests a token for the application itself with its client secret. Without an
 * explicit scope, {@code https://graph.microsoft.com/.default} is requested.
 * <p>
 * Reference: <a href="https://learn.microsoft.com/en-us/entra/identity-platform/v2-oauth2-client-creds-grant-flow#first-case-access-token-request-with-a-shared-secret">Access token request with a shared secret</a>
 */
public class ClientSecretCredential extends TokenCredential {
    private final String clientSecret;
    private final List<String> scope;

    ClientSecretCredential(IdentityConfiguration configuration, String clientSecret, List<String> scope) {
        super(configuration, TokenCredentialOptions.from(configuration));
        this.clientSecret = clientSecret;
        this.scope = Collections.unmodifiableList(new ArrayList<>(scope));
    }

    public static Builder builder(String clientId) {
        return new Builder(IdentityConfiguration.builder(clientId));
    }

    public static Builder builder(IdentityConfiguration configuration) {
        return new Builder(configuration.toBuilder());
    }

    /**
     * A credential from connection style properties, see {@link IdentityConstants}.
     */
    public static ClientSecretCredential fromProperties(Properties info) throws IdentityException {
        Builder builder = builder(new IdentityConfiguration(info))
                .withClientSecret(info.getProperty(IdentityConstants.IDENTITY_CLIENT_SECRET));
        String scopes = info.getProperty(IdentityConstants.IDENTITY_SCOPES);
        if (scopes != null && !scopes.isBlank()) {
            builder.withScope(scopes.trim().split("\\s+"));
        }
        return builder.build();
    }

    @Override
    public GrantKind kind() {
        return GrantKind.CLIENT_SECRET;
    }

    @Override
    public Map<String, String> form() throws IdentityException {
        return ClientCredentialsGrant.form(configuration, ClientAuthentication.secret(clientSecret), tokenUrl(), scope);
    }

    @Override
    public Optional<BasicAuthCredentials> basicAuth() {
        return ClientAuthentication.secret(clientSecret).basicAuth(clientId());
    }

    public static class Builder {
        private final IdentityConfiguration.Builder configuration;
        private String clientSecret;
        private final List<String> scope = new ArrayList<>();

        private Builder(IdentityConfiguration.Builder configuration) {
            this.configuration = configuration;
        }

        public Builder withClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
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

        public Builder withExtraHeaderParameter(String name, String value) {
            configuration.withExtraHeaderParameter(name, value);
            return this;
        }

        public ClientSecretCredential build() throws IdentityException {
            ClientSecretCredential credential = new ClientSecretCredential(configuration.build(), clientSecret, scope);
            credential.form();
            return credential;
        }
    }
}
