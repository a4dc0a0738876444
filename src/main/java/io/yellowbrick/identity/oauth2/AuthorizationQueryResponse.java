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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.yellowbrick.identity.IdentityException;

/**
 * Values delivered to the redirect URI at the end of an authorization request, decoded
 * from the URI's query component if present, otherwise from its fragment.
 */
public class AuthorizationQueryResponse {
    private final Map<String, String> values;

    private AuthorizationQueryResponse(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Parses the final redirect URL captured from the browser.
     *
     * @throws IdentityException {@code MALFORMED_URL} if the URL cannot be parsed,
     *         {@code MISSING_REDIRECT_PAYLOAD} if it has neither query nor fragment
     */
    public static AuthorizationQueryResponse fromRedirectUri(String redirectUrl) throws IdentityException {
        if (redirectUrl == null) {
            throw IdentityException.malformedUrl("null", null);
        }
        URI uri;
        try {
            uri = new URI(redirectUrl.trim());
        } catch (URISyntaxException e) {
            throw IdentityException.malformedUrl(redirectUrl, e);
        }
        String payload = uri.getRawQuery();
        if (payload == null || payload.isEmpty()) {
            payload = uri.getRawFragment();
        }
        if (payload == null || payload.isEmpty()) {
            throw IdentityException.missingRedirectPayload(redirectUrl);
        }
        return fromEncoded(payload);
    }

    /**
     * Parses an already extracted query or fragment, or a {@code form_post} body.
     */
    public static AuthorizationQueryResponse fromEncoded(String encoded) throws IdentityException {
        try {
            return new AuthorizationQueryResponse(FormParameterEncoder.fromFormEncoding(encoded));
        } catch (IllegalArgumentException e) {
            throw IdentityException.malformedUrl(encoded, e);
        }
    }

    public Optional<String> get(OAuthParameter parameter) {
        return Optional.ofNullable(values.get(parameter.alias()));
    }

    public Optional<String> getCode() {
        return get(OAuthParameter.AUTHORIZATION_CODE);
    }

    public Optional<String> getIdToken() {
        return get(OAuthParameter.ID_TOKEN);
    }

    public Optional<String> getAccessToken() {
        return get(OAuthParameter.ACCESS_TOKEN);
    }

    public Optional<String> getState() {
        return get(OAuthParameter.STATE);
    }

    public Optional<String> getNonce() {
        return get(OAuthParameter.NONCE);
    }

    public Optional<String> getSessionState() {
        return get(OAuthParameter.SESSION_STATE);
    }

    public Optional<String> getError() {
        return get(OAuthParameter.ERROR);
    }

    public Optional<String> getErrorDescription() {
        return get(OAuthParameter.ERROR_DESCRIPTION);
    }

    public Optional<String> getErrorUri() {
        return get(OAuthParameter.ERROR_URI);
    }

    public boolean isError() {
        return values.containsKey(OAuthParameter.ERROR.alias());
    }

    /**
     * Every decoded pair, including ones without a canonical parameter name.
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "AuthorizationQueryResponse" + OAuthSerializer.redact(values);
    }
}
