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

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.Authority;

/**
 * Requests a token for the application itself with a client assertion obtained
 * elsewhere, such as a federated workload identity token.
 */
public class ClientAssertionCredential extends TokenCredential {
    private final String clientAssertion;
    private final List<String> scope;

    ClientAssertionCredential(IdentityConfiguration configuration, String clientAssertion, List<String> scope) {
        super(configuration, TokenCredentialOptions.from(configuration));
        this.clientAssertion = clientAssertion;
        this.scope = Collections.unmodifiableList(new ArrayList<>(scope));
    }

    public static Builder builder(String clientId) {
        return new Builder(IdentityConfiguration.builder(clientId));
    }

    public static Builder builder(IdentityConfiguration configuration) {
        return new Builder(configuration.toBuilder());
    }

    @Override
    public GrantKind kind() {
        return GrantKind.CLIENT_ASSERTION;
    }

    @Override
    public Map<String, String> form() throws IdentityException {
        return ClientCredentialsGrant.form(configuration, ClientAuthentication.assertion(clientAssertion), tokenUrl(),
                scope);
    }

    public static class Builder {
        private final IdentityConfiguration.Builder configuration;
        private String clientAssertion;
        private final List<String> scope = new ArrayList<>();

        private Builder(IdentityConfiguration.Builder configuration) {
            this.configuration = configuration;
        }

        public Builder withClientAssertion(String clientAssertion) {
            this.clientAssertion = clientAssertion;
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

        public ClientAssertionCredential build() throws IdentityException {
            ClientAssertionCredential credential = new ClientAssertionCredential(configuration.build(),
                    clientAssertion, scope);
            credential.form();
            return credential;
        }
    }
}
