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
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.web.InteractiveAuthenticator;

/**
 * The {@code /authorize} request that starts the authorization code flow.
 * <p>
 * Reference: <a href="https://learn.microsoft.com/en-us/entra/identity-platform/v2-oauth2-auth-code-flow#request-an-authorization-code">Request an authorization code</a>
 *
 * <pre>{@code
 * URI url = AuthCodeAuthorizationUrlParameters.builder(clientId)
 *         .withRedirectUri("http://localhost:8000/redirect")
 *         .withScope("User.Read")
 *         .url();
 * }</pre>
 *
 * Instances are immutable. Nothing is validated until {@link #url()} is called.
 */
public class AuthCodeAuthorizationUrlParameters {
    private static final Logger LOG = LoggerFactory.getLogger(AuthCodeAuthorizationUrlParameters.class);

    static final List<OAuthParameter> REQUIRED = Collections.unmodifiableList(Arrays.asList(
            OAuthParameter.CLIENT_ID,
            OAuthParameter.RESPONSE_TYPE,
            OAuthParameter.REDIRECT_URI,
            OAuthParameter.SCOPE));

    static final List<OAuthParameter> OPTIONAL = Collections.unmodifiableList(Arrays.asList(
            OAuthParameter.RESPONSE_MODE,
            OAuthParameter.STATE,
            OAuthParameter.PROMPT,
            OAuthParameter.LOGIN_HINT,
            OAuthParameter.DOMAIN_HINT,
            OAuthParameter.NONCE,
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

    private AuthCodeAuthorizationUrlParameters(Builder builder) {
        this.configuration = builder.configuration.build();
        this.responseType = builder.responseType.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.responseType));
        this.responseMode = builder.responseMode;
        this.nonce = builder.nonce;
        this.state = builder.state;
        this.scope = Collections.unmodifiableList(new ArrayList<>(builder.scope));
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

    /**
     * The authorization URL on the configured cloud instance.
     *
     * @throws IdentityException when a required value is missing or the scope contains {@code openid}
     */
    public URI url() throws IdentityException {
        return url(configuration.cloudInstance);
    }

    public URI url(AzureCloudInstance cloudInstance) throws IdentityException {
        OAuthSerializer serializer = new OAuthSerializer();

        URI redirectUri = configuration.requireRedirectUri();
        serializer.redirectUri(redirectUri.toString());

        if (!configuration.hasValidClientId()) {
            throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_ID.alias());
        }

        if (scope.isEmpty()) {
            throw IdentityException.missingRequiredValue(OAuthParameter.SCOPE.alias());
        }

        if (scope.contains(OpenIdAuthorizationUrlParameters.OPENID_SCOPE)) {
            throw IdentityException.invalidValue(OpenIdAuthorizationUrlParameters.OPENID_SCOPE,
                    "Scope openid is not valid for authorization code - instead use OpenIdCredential");
        }

        serializer.clientId(configuration.clientId.toString())
                .extendScopes(scope);
        if (configuration.authorityHost != null) {
            serializer.authority(configuration.authorityHost, configuration.authority);
        } else {
            serializer.authority(cloudInstance, configuration.authority);
        }

        applyResponseType(serializer, responseType, responseMode, ResponseType.CODE);

        serializer.state(state)
                .prompt(prompt != null ? prompt.value() : null)
                .domainHint(domainHint)
                .loginHint(loginHint)
                .nonce(nonce)
                .codeChallenge(codeChallenge)
                .codeChallengeMethod(codeChallengeMethod);

        return buildUrl(serializer, OPTIONAL, REQUIRED, configuration.extraQueryParameters);
    }

    /**
     * Renders response_type and decides response_mode. An id_token is never delivered
     * in the query string, so an unset or {@code query} mode becomes {@code fragment}
     * whenever one is requested; any other explicit mode is kept.
     */
    static void applyResponseType(OAuthSerializer serializer, Set<ResponseType> responseType,
            ResponseMode responseMode, ResponseType defaultType) {
        if (responseType.isEmpty()) {
            serializer.responseType(defaultType.value());
            if (defaultType == ResponseType.ID_TOKEN
                    && (responseMode == null || responseMode == ResponseMode.QUERY)) {
                serializer.responseMode(ResponseMode.FRAGMENT.value());
            } else if (responseMode != null) {
                serializer.responseMode(responseMode.value());
            }
            return;
        }

        serializer.responseType(EnumSet.copyOf(responseType).stream()
                .map(ResponseType::value)
                .collect(Collectors.joining(" ")));

        if (responseType.contains(ResponseType.ID_TOKEN)) {
            if (responseMode == null || responseMode == ResponseMode.QUERY) {
                serializer.responseMode(ResponseMode.FRAGMENT.value());
            } else {
                serializer.responseMode(responseMode.value());
            }
        } else if (responseMode != null) {
            serializer.responseMode(responseMode.value());
        }
    }

    /**
     * Encodes the parameters then appends the extra query parameters, skipping any whose
     * name is a canonical parameter so the validated values cannot be overridden.
     */
    static URI buildUrl(OAuthSerializer serializer, List<OAuthParameter> optional, List<OAuthParameter> required,
            Map<String, String> extraQueryParameters) throws IdentityException {
        StringBuilder query = new StringBuilder();
        serializer.encode(optional, required, query);
        for (Map.Entry<String, String> extra : extraQueryParameters.entrySet()) {
            if (OAuthParameter.fromAlias(extra.getKey()).isPresent()) {
                LOG.warn("Ignoring extra query parameter {}, it is set by the request itself", extra.getKey());
                continue;
            }
            FormParameterEncoder.appendPair(query, extra.getKey(), extra.getValue());
        }

        String base = serializer.authorizationUrl()
                .orElseThrow(() -> IdentityException.missingRequiredValue("authorization_url", "Internal Error"));
        String url = base + "?" + query;
        try {
            URI uri = new URI(url);
            LOG.debug("Built authorization url: {}", uri);
            return uri;
        } catch (URISyntaxException e) {
            throw IdentityException.malformedUrl(url, e);
        }
    }

    /**
     * Opens the authorization URL in a browser and waits for the redirect.
     *
     * @throws IdentityException {@code TIMEOUT} if no redirect arrives in time, or any
     *         validation or redirect parsing failure
     */
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

    /**
     * The nonce sent with the request, to compare with the one returned in the id_token.
     */
    public Optional<String> getNonce() {
        return Optional.ofNullable(nonce);
    }

    public Optional<String> getState() {
        return Optional.ofNullable(state);
    }

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

        /** Same as {@code withAuthority(Authority.tenant(tenantId))}. */
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
         * Adds to the requested response types. {@code code} is sent when none are added;
         * {@code id_token} or {@code token} may be added for the hybrid flow.
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

        /**
         * A value echoed back in the id_token, used to detect token replay.
         */
        public Builder withNonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        /**
         * Sets a nonce of 32 secure random octets, base64url encoded.
         */
        public Builder withGeneratedNonce() {
            this.nonce = ProofKeyForCodeExchange.secureRandom32();
            return this;
        }

        public Builder withState(String state) {
            this.state = state;
            return this;
        }

        public Builder withScope(String... scope) {
            return withScope(Arrays.asList(scope));
        }

        public Builder withScope(Collection<String> scope) {
            for (String s : scope) {
                this.scope.add(Objects.requireNonNull(s, "scope").trim());
            }
            return this;
        }

        /**
         * Requests a refresh token along with the code.
         */
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

        public Builder withCodeChallenge(String codeChallenge) {
            this.codeChallenge = codeChallenge;
            return this;
        }

        /**
         * {@code S256} or {@code plain}. The challenge is treated as plain when omitted.
         */
        public Builder withCodeChallengeMethod(String codeChallengeMethod) {
            this.codeChallengeMethod = codeChallengeMethod;
            return this;
        }

        /**
         * Sets the challenge and its method. Keep the pair: its verifier is needed for
         * the token request.
         */
        public Builder withPkce(ProofKeyForCodeExchange pkce) {
            this.codeChallenge = pkce.getCodeChallenge();
            this.codeChallengeMethod = pkce.getCodeChallengeMethod();
            return this;
        }

        public AuthCodeAuthorizationUrlParameters build() {
            return new AuthCodeAuthorizationUrlParameters(this);
        }

        public URI url() throws IdentityException {
            return build().url();
        }

        public URI url(AzureCloudInstance cloudInstance) throws IdentityException {
            return build().url(cloudInstance);
        }
    }
}
