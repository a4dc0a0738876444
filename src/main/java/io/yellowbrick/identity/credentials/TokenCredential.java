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
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Optional;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.FormParameterEncoder;

/**
 * A token endpoint request for one grant type.
 * <p>
 * The set of variants is closed: every subclass lives in this package and is identified
 * by {@link #kind()}. A transport only needs {@link #uri()}, {@link #form()},
 * {@link #basicAuth()} and {@link #options()} to send any of them.
 * <p>
 * {@link #form()} validates before returning anything, so an invalid request never
 * reaches the network.
 */
public abstract class TokenCredential {
    protected final IdentityConfiguration configuration;
    private final TokenCredentialOptions options;

    TokenCredential(IdentityConfiguration configuration, TokenCredentialOptions options) {
        this.configuration = configuration;
        this.options = options;
    }

    public abstract GrantKind kind();

    /**
     * The ordered token request body.
     *
     * @throws IdentityException when a required value is missing or values conflict
     */
    public abstract Map<String, String> form() throws IdentityException;

    public String formUrlEncoded() throws IdentityException {
        return FormParameterEncoder.toFormEncoding(form());
    }

    /**
     * The token endpoint on the cloud instance from {@link #options()}.
     */
    public URI uri() throws IdentityException {
        String url = tokenUrl();
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw IdentityException.malformedUrl(url, e);
        }
    }

    /**
     * The pair to send as {@code Authorization: Basic}; empty for variants that
     * authenticate with an assertion.
     */
    public Optional<BasicAuthCredentials> basicAuth() {
        return Optional.empty();
    }

    public TokenCredentialOptions options() {
        return options;
    }

    public IdentityConfiguration getConfiguration() {
        return configuration;
    }

    String tokenUrl() {
        return configuration.tokenUrl(options.getCloudInstance());
    }

    String clientId() {
        return configuration.hasValidClientId() ? configuration.clientId.toString() : null;
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
