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
package io.yellowbrick.identity;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;

import io.yellowbrick.identity.oauth2.Authority;
import io.yellowbrick.identity.oauth2.AzureCloudInstance;
import io.yellowbrick.identity.oauth2.OAuthParameter;

/**
 * Immutable application registration and transport settings shared by every request
 * built for one client.
 * <p>
 * Values are not validated here: a client id that is not a UUID becomes the nil UUID and
 * the redirect URI is kept as given, and both are rejected when a request is built, so
 * that configuration errors surface with the name of the offending parameter.
 */
public class IdentityConfiguration {

    public static final UUID NIL_CLIENT_ID = new UUID(0L, 0L);

    // Application registration
    public final UUID clientId;
    public final Authority authority;
    public final AzureCloudInstance cloudInstance;
    public final String authorityHost;
    public final String redirectUri;
    public final Map<String, String> extraQueryParameters;
    public final Map<String, String> extraHeaderParameters;

    // Transport
    public final String cacertPath;
    public final boolean disableTrust;
    public final Duration requestTimeout;

    /**
     * Reads the configuration from connection style properties, see {@link IdentityConstants}.
     *
     * @throws IdentityException {@code INVALID_VALUE} when the request timeout is not a
     *         positive number of seconds
     */
    public IdentityConfiguration(Properties info) throws IdentityException {
        this.clientId = parseClientId(info.getProperty(IdentityConstants.IDENTITY_CLIENT_ID));
        String tenant = info.getProperty(IdentityConstants.IDENTITY_TENANT);
        this.authority = tenant != null
                ? Authority.tenant(tenant)
                : Authority.parse(info.getProperty(
                        IdentityConstants.IDENTITY_AUTHORITY,
                        IdentityConstants.IDENTITY_AUTHORITY_DEFAULT));
        this.cloudInstance = AzureCloudInstance.fromString(info.getProperty(
                IdentityConstants.IDENTITY_CLOUD_INSTANCE,
                IdentityConstants.IDENTITY_CLOUD_INSTANCE_DEFAULT));
        this.authorityHost = info.getProperty(IdentityConstants.IDENTITY_AUTHORITY_HOST);
        String redirect = info.getProperty(IdentityConstants.IDENTITY_REDIRECT_URI);
        this.redirectUri = trimToNull(redirect);
        this.extraQueryParameters = prefixed(info, IdentityConstants.IDENTITY_EXTRA_QUERY_PREFIX);
        this.extraHeaderParameters = prefixed(info, IdentityConstants.IDENTITY_EXTRA_HEADER_PREFIX);
        this.cacertPath = info.getProperty(IdentityConstants.IDENTITY_CACERT_PATH);
        this.disableTrust = Boolean.parseBoolean(info.getProperty(
                IdentityConstants.IDENTITY_DISABLE_TRUST, "false"));
        this.requestTimeout = parseTimeout(info.getProperty(
                IdentityConstants.IDENTITY_REQUEST_TIMEOUT,
                IdentityConstants.IDENTITY_REQUEST_TIMEOUT_DEFAULT));
    }

    private IdentityConfiguration(Builder builder) {
        this.clientId = builder.clientId;
        this.authority = builder.authority;
        this.cloudInstance = builder.cloudInstance;
        this.authorityHost = builder.authorityHost;
        this.redirectUri = builder.redirectUri;
        this.extraQueryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraQueryParameters));
        this.extraHeaderParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraHeaderParameters));
        this.cacertPath = builder.cacertPath;
        this.disableTrust = builder.disableTrust;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    /**
     * A builder seeded with every value of this configuration.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(clientId.toString());
        builder.authority = authority;
        builder.cloudInstance = cloudInstance;
        builder.authorityHost = authorityHost;
        builder.redirectUri = redirectUri;
        builder.extraQueryParameters.putAll(extraQueryParameters);
        builder.extraHeaderParameters.putAll(extraHeaderParameters);
        builder.cacertPath = cacertPath;
        builder.disableTrust = disableTrust;
        builder.requestTimeout = requestTimeout;
        return builder;
    }

    /**
     * The authorize endpoint for this configuration's realm, on the authority host when
     * one is set, else on {@code cloudInstance}.
     */
    public String authorizationUrl(AzureCloudInstance cloudInstance) {
        return authorityHost != null
                ? AzureCloudInstance.authorizationUrlOn(authorityHost, authority)
                : cloudInstance.authorizationUrl(authority);
    }

    public String tokenUrl(AzureCloudInstance cloudInstance) {
        return authorityHost != null
                ? AzureCloudInstance.tokenUrlOn(authorityHost, authority)
                : cloudInstance.tokenUrl(authority);
    }

    /**
     * The redirect URI, parsed.
     *
     * @throws IdentityException {@code MISSING_REQUIRED_VALUE} when none is configured,
     *         {@code MALFORMED_URL} when it does not parse
     */
    public URI requireRedirectUri() throws IdentityException {
        if (redirectUri == null) {
            throw IdentityException.missingRequiredValue(OAuthParameter.REDIRECT_URI.alias());
        }
        try {
            return new URI(redirectUri);
        } catch (URISyntaxException e) {
            throw IdentityException.malformedUrl(redirectUri, e);
        }
    }

    public boolean hasValidClientId() {
        return clientId != null && !NIL_CLIENT_ID.equals(clientId);
    }

    static UUID parseClientId(String value) {
        if (value == null || value.isBlank()) {
            return NIL_CLIENT_ID;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return NIL_CLIENT_ID;
        }
    }

    static Duration parseTimeout(String seconds) throws IdentityException {
        try {
            long value = Long.parseLong(seconds.trim());
            if (value <= 0) {
                throw IdentityException.invalidValue(IdentityConstants.IDENTITY_REQUEST_TIMEOUT,
                        "must be a positive number of seconds, got " + seconds);
            }
            return Duration.ofSeconds(value);
        } catch (NumberFormatException e) {
            throw IdentityException.invalidValue(IdentityConstants.IDENTITY_REQUEST_TIMEOUT,
                    "not a number of seconds: " + seconds);
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Map<String, String> prefixed(Properties info, String prefix) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : info.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                result.put(name.substring(prefix.length()), info.getProperty(name));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "IdentityConfiguration{clientId=" + clientId
                + ", authority=" + authority
                + ", cloudInstance=" + cloudInstance
                + ", redirectUri=" + redirectUri + "}";
    }

    public static class Builder {
        private UUID clientId;
        private Authority authority = Authority.COMMON;
        private AzureCloudInstance cloudInstance = AzureCloudInstance.AZURE_PUBLIC;
        private String authorityHost;
        private String redirectUri;
        private final Map<String, String> extraQueryParameters = new LinkedHashMap<>();
        private final Map<String, String> extraHeaderParameters = new LinkedHashMap<>();
        private String cacertPath;
        private boolean disableTrust;
        private Duration requestTimeout = Duration.ofSeconds(
                Long.parseLong(IdentityConstants.IDENTITY_REQUEST_TIMEOUT_DEFAULT));

        private Builder(String clientId) {
            this.clientId = parseClientId(clientId);
        }

        public Builder withClientId(String clientId) {
            this.clientId = parseClientId(clientId);
            return this;
        }

        public Builder withAuthority(Authority authority) {
            this.authority = Objects.requireNonNull(authority, "authority");
            return this;
        }

        /** Same as {@code withAuthority(Authority.tenant(tenantId))}. */
        public Builder withTenant(String tenantId) {
            return withAuthority(Authority.tenant(tenantId));
        }

        public Builder withCloudInstance(AzureCloudInstance cloudInstance) {
            this.cloudInstance = Objects.requireNonNull(cloudInstance, "cloudInstance");
            return this;
        }

        /**
         * Sends requests to this base URL instead of the cloud instance host.
         */
        public Builder withAuthorityHost(String authorityHost) {
            this.authorityHost = authorityHost;
            return this;
        }

        public Builder withRedirectUri(URI redirectUri) {
            this.redirectUri = redirectUri != null ? trimToNull(redirectUri.toString()) : null;
            return this;
        }

        /**
         * Kept as given; it is parsed when a request needs it.
         */
        public Builder withRedirectUri(String redirectUri) {
            this.redirectUri = trimToNull(redirectUri);
            return this;
        }

        public Builder withExtraQueryParameter(String name, String value) {
            extraQueryParameters.put(name, value);
            return this;
        }

        public Builder withExtraHeaderParameter(String name, String value) {
            extraHeaderParameters.put(name, value);
            return this;
        }

        public Builder withCacertPath(String cacertPath) {
            this.cacertPath = cacertPath;
            return this;
        }

        public Builder withDisableTrust(boolean disableTrust) {
            this.disableTrust = disableTrust;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
            return this;
        }

        public IdentityConfiguration build() {
            return new IdentityConfiguration(this);
        }
    }
}
