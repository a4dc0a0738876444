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
package io.yellowbrick.identity.oauth2;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.web.InteractiveAuthenticator;

/**
 * The {@code /authorize} request of the OpenID Connect sign-in flow.
 * <p>
 * Unlike {@link AuthCodeAuthorizationUrlParameters}, {@code openid} is always requested,
 * {@code id_token} is the default response type and a nonce is always sent. When no nonce
 * is given one is generated at {@link Builder#build()}; read it back with {@link #getNonce()}
 * to check the returned id_token.
 * <p>
 * Reference: <a href="https://learn.microsoft.com/en-us/entra/identity-platform/v2-protocols-oidc#send-the-sign-in-request">Send the sign-in request</a>
 */
public class OpenIdAuthorizationUrlParameters {
    public static final String OPENID_SCOPE = "openid";

    static final List<OAuthParameter> REQUIRED = Collections.unmodifiableList(Arrays.asList(
            OAuthParameter.CLIENT_ID,
            OAuthParameter.RESPONSE_TYPE,
            OAuthParameter.REDIRECT_URI,
            OAuthParameter.SCOPE,
            OAuthParameter.NONCE));

    static final List<OAuthParameter> OPTIONAL = Collections.unmodifiableList(Arrays.asList(
            OAuthParameter.RESPONSE_MODE,
            OAuthParameter.STATE,
            OAuthParameter.PROMPT,
            OAuthParameter.LOGIN_HINT,
            OAuthParameter.DOMAIN_HINT,
            OAuthParameter.CODE_CHALLENGE,
            OAuthParameter.CODE_CHALLENGE_METHOD));

    private final IdentityConfiguration configuration;
    private final Set<ResponseType> responseType;
    private final ResponseMode responseMode;
    private final String nonce;
    private final String state;
    private final List<String> scope;
    private final Prompt prompt;
    private final String domainHint;
    private final String loginHint;
    private final String codeChallenge;
    private final String codeChallengeMethod;

    private OpenIdAuthorizationUrlParameters(Builder builder) {
        this.configuration = builder.configuration.build();
        this.responseType = builder.responseType.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.responseType));
        this.responseMode = builder.responseMode;
        this.nonce = builder.nonce != null ? builder.nonce : ProofKeyForCodeExchange.secureRandom32();
        this.state = builder.state;
        List<String> scopes = new ArrayList<>();
        scopes.add(OPENID_SCOPE);
        scopes.addAll(builder.scope);
        this.scope = Collections.unmodifiableList(scopes);
        this.prompt = builder.prompt;
        this.domainHint = builder.domainHint;
        this.loginHint = builder.loginHint;
        this.codeChallenge = builder.codeChallenge;
        this.codeChallengeMethod = builder.codeChallengeMethod;
    }

    public static Builder builder(String clientId) {
        return new Builder(IdentityConfiguration.builder(clientId));
    }

    public static Builder builder(IdentityConfiguration configuration) {
        return new Builder(configuration.toBuilder());
    }

    public URI url() throws IdentityException {
        return url(configuration.cloudInstance);
    }

    public URI url(AzureCloudInstance cloudInstance) throws IdentityException {
        OAuthSerializer serializer = new OAuthSerializer();

        URI redirectUri = configuration.requireRedirectUri();
        if (!configuration.hasValidClientId()) {
            throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_ID.alias());
        }
        if (nonce.isBlank()) {
            throw IdentityException.missingRequiredValue(OAuthParameter.NONCE.alias());
        }

        serializer.clientId(configuration.clientId.toString())
                .redirectUri(redirectUri.toString())
                .extendScopes(scope);
        if (configuration.authorityHost != null) {
            serializer.authority(configuration.authorityHost, configuration.authority);
        } else {
            serializer.authority(cloudInstance, configuration.authority);
        }

        AuthCodeAuthorizationUrlParameters.applyResponseType(serializer, responseType, responseMode,
                ResponseType.ID_TOKEN);

        serializer.state(state)
                .prompt(prompt != null ? prompt.value() : null)
                .domainHint(domainHint)
                .loginHint(loginHint)
                .nonce(nonce)
                .codeChallenge(codeChallenge)
                .codeChallengeMethod(codeChallengeMethod);

        return AuthCodeAuthorizationUrlParameters.buildUrl(serializer, OPTIONAL, REQUIRED,
                configuration.extraQueryParameters);
    }

    public AuthorizationQueryResponse interactiveAuthentication(InteractiveAuthenticator authenticator,
            Duration timeout) throws IdentityException {
        URI url = url();
        String redirect = authenticator.authenticate(url, configuration.requireRedirectUri(), timeout);
        return AuthorizationQueryResponse.fromRedirectUri(redirect);
    }

    public IdentityConfiguration getConfiguration() {
        return configuration;
    }

    public Set<ResponseType> getResponseType() {
        return responseType;
    }

    public Optional<ResponseMode> getResponseMode() {
        return Optional.ofNullable(responseMode);
    }

    public String getNonce() {
        return nonce;
    }

    public Optional<String> getState() {
        return Optional.ofNullable(state);
    }

    /**
     * The requested scopes, {@code openid} first.
     */
    public List<String> getScope() {
        return scope;
    }

    public static class Builder {
        private final IdentityConfiguration.Builder configuration;
        private final Set<ResponseType> responseType = EnumSet.noneOf(ResponseType.class);
        private ResponseMode responseMode;
        private String nonce;
        private String state;
        private final List<String> scope = new ArrayList<>();
        private Prompt prompt;
        private String domainHint;
        private String loginHint;
        private String codeChallenge;
        private String codeChallengeMethod;

        private Builder(IdentityConfiguration.Builder configuration) {
            this.configuration = configuration;
        }

        public Builder withClientId(String clientId) {
            configuration.withClientId(clientId);
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

        public Builder withAuthorityHost(String authorityHost) {
            configuration.withAuthorityHost(authorityHost);
            return this;
        }

        public Builder withCloudInstance(AzureCloudInstance cloudInstance) {
            configuration.withCloudInstance(cloudInstance);
            return this;
        }

        public Builder withExtraQueryParameter(String name, String value) {
            configuration.withExtraQueryParameter(name, value);
            return this;
        }

        /**
         * {@code id_token} is sent when none are added. Add {@code code} for the hybrid flow.
         */
        public Builder withResponseType(ResponseType... responseType) {
            return withResponseType(Arrays.asList(responseType));
        }

        public Builder withResponseType(Collection<ResponseType> responseType) {
            this.responseType.addAll(responseType);
            return this;
        }

        public Builder withResponseMode(ResponseMode responseMode) {
            this.responseMode = responseMode;
            return this;
        }

        public Builder withNonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder withState(String state) {
            this.state = state;
            return this;
        }

        /**
         * Additional scopes. {@code openid} is always sent and need not be repeated.
         */
        public Builder withScope(String... scope) {
            return withScope(Arrays.asList(scope));
        }

        public Builder withScope(Collection<String> scope) {
            for (String s : scope) {
                this.scope.add(Objects.requireNonNull(s, "scope").trim());
            }
            return this;
        }

        public Builder withOfflineAccess() {
            this.scope.add("offline_access");
            return this;
        }

        public Builder withPrompt(Prompt prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder withDomainHint(String domainHint) {
            this.domainHint = domainHint;
            return this;
        }

        public Builder withLoginHint(String loginHint) {
            this.loginHint = loginHint;
            return this;
        }

        public Builder withPkce(ProofKeyForCodeExchange pkce) {
            this.codeChallenge = pkce.getCodeChallenge();
            this.codeChallengeMethod = pkce.getCodeChallengeMethod();
            return this;
        }

        public OpenIdAuthorizationUrlParameters build() {
            return new OpenIdAuthorizationUrlParameters(this);
        }

        public URI url() throws IdentityException {
            return build().url();
        }

        public URI url(AzureCloudInstance cloudInstance) throws IdentityException {
            return build().url(cloudInstance);
        }
    }
}
