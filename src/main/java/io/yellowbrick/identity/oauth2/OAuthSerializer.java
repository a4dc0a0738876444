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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

import io.yellowbrick.identity.IdentityException;

/**
 * Parameter store backing both authorization URLs and token request bodies.
 * <p>
 * Setters only record values and never fail. All validation happens in
 * {@link #encode(List, List)} and {@link #form(List, List)}: required parameters are
 * emitted first in the order given, then optional parameters in the order given, so the
 * output is fully determined by the caller's key lists and never by the store's layout.
 * <p>
 * Instances are single-use and not thread safe.
 */
public class OAuthSerializer {
    private final EnumMap<OAuthParameter, String> parameters = new EnumMap<>(OAuthParameter.class);
    private final Set<String> scopes = new LinkedHashSet<>();
    private String authorizationUrl;
    private String tokenUrl;

    public OAuthSerializer clientId(String value) {
        return put(OAuthParameter.CLIENT_ID, value);
    }

    public OAuthSerializer clientSecret(String value) {
        return put(OAuthParameter.CLIENT_SECRET, value);
    }

    public OAuthSerializer redirectUri(String value) {
        return put(OAuthParameter.REDIRECT_URI, value);
    }

    public OAuthSerializer responseType(String value) {
        return put(OAuthParameter.RESPONSE_TYPE, value);
    }

    public OAuthSerializer responseMode(String value) {
        return put(OAuthParameter.RESPONSE_MODE, value);
    }

    public OAuthSerializer state(String value) {
        return put(OAuthParameter.STATE, value);
    }

    public OAuthSerializer prompt(String value) {
        return put(OAuthParameter.PROMPT, value);
    }

    public OAuthSerializer loginHint(String value) {
        return put(OAuthParameter.LOGIN_HINT, value);
    }

    public OAuthSerializer domainHint(String value) {
        return put(OAuthParameter.DOMAIN_HINT, value);
    }

    public OAuthSerializer nonce(String value) {
        return put(OAuthParameter.NONCE, value);
    }

    public OAuthSerializer codeChallenge(String value) {
        return put(OAuthParameter.CODE_CHALLENGE, value);
    }

    public OAuthSerializer codeChallengeMethod(String value) {
        return put(OAuthParameter.CODE_CHALLENGE_METHOD, value);
    }

    public OAuthSerializer codeVerifier(String value) {
        return put(OAuthParameter.CODE_VERIFIER, value);
    }

    public OAuthSerializer authorizationCode(String value) {
        return put(OAuthParameter.AUTHORIZATION_CODE, value);
    }

    public OAuthSerializer refreshToken(String value) {
        return put(OAuthParameter.REFRESH_TOKEN, value);
    }

    public OAuthSerializer grantType(String value) {
        return put(OAuthParameter.GRANT_TYPE, value);
    }

    public OAuthSerializer clientAssertion(String value) {
        return put(OAuthParameter.CLIENT_ASSERTION, value);
    }

    public OAuthSerializer clientAssertionType(String value) {
        return put(OAuthParameter.CLIENT_ASSERTION_TYPE, value);
    }

    /**
     * Adds scopes, keeping first-seen order and dropping blanks and duplicates.
     */
    public OAuthSerializer extendScopes(Collection<String> values) {
        for (String scope : values) {
            if (scope != null && !scope.isBlank()) {
                scopes.add(scope.trim());
            }
        }
        return this;
    }

    public OAuthSerializer addScope(String value) {
        return extendScopes(Collections.singletonList(value));
    }

    /**
     * Records the authorize and token endpoints for the given host and realm.
     */
    public OAuthSerializer authority(AzureCloudInstance cloudInstance, Authority authority) {
        this.authorizationUrl = cloudInstance.authorizationUrl(authority);
        this.tokenUrl = cloudInstance.tokenUrl(authority);
        return this;
    }

    /**
     * Records the endpoints for the realm on a host given as a base URL.
     */
    public OAuthSerializer authority(String baseUrl, Authority authority) {
        this.authorizationUrl = AzureCloudInstance.authorizationUrlOn(baseUrl, authority);
        this.tokenUrl = AzureCloudInstance.tokenUrlOn(baseUrl, authority);
        return this;
    }

    public Optional<String> authorizationUrl() {
        return Optional.ofNullable(authorizationUrl);
    }

    public Optional<String> tokenUrl() {
        return Optional.ofNullable(tokenUrl);
    }

    public Optional<String> get(OAuthParameter parameter) {
        if (parameter == OAuthParameter.SCOPE) {
            return scopes.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", scopes));
        }
        return Optional.ofNullable(parameters.get(parameter));
    }

    public boolean contains(OAuthParameter parameter) {
        return get(parameter).isPresent();
    }

    private OAuthSerializer put(OAuthParameter parameter, String value) {
        if (value == null) {
            parameters.remove(parameter);
        } else {
            parameters.put(parameter, value);
        }
        return this;
    }

    /**
     * Encodes the required then the optional parameters as
     * {@code application/x-www-form-urlencoded}.
     *
     * @throws IdentityException {@code MISSING_REQUIRED_VALUE} naming the first absent required key
     */
    public String encode(List<OAuthParameter> optional, List<OAuthParameter> required) throws IdentityException {
        StringBuilder sink = new StringBuilder();
        encode(optional, required, sink);
        return sink.toString();
    }

    /**
     * Same as {@link #encode(List, List)}, appending to {@code sink}. Nothing is appended
     * when a required value is missing.
     */
    public void encode(List<OAuthParameter> optional, List<OAuthParameter> required, StringBuilder sink)
            throws IdentityException {
        StringBuilder encoded = new StringBuilder();
        for (Map.Entry<String, String> entry : form(optional, required).entrySet()) {
            FormParameterEncoder.appendPair(encoded, entry.getKey(), entry.getValue());
        }
        if (sink.length() > 0 && encoded.length() > 0) {
            sink.append('&');
        }
        sink.append(encoded);
    }

    /**
     * The same pairs {@link #encode(List, List)} would write, in the same order, unencoded.
     */
    public Map<String, String> form(List<OAuthParameter> optional, List<OAuthParameter> required)
            throws IdentityException {
        Map<String, String> form = new LinkedHashMap<>();
        for (OAuthParameter parameter : required) {
            String value = get(parameter)
                    .orElseThrow(() -> IdentityException.missingRequiredValue(parameter.alias()));
            form.put(parameter.alias(), value);
        }
        for (OAuthParameter parameter : optional) {
            get(parameter).ifPresent(value -> form.put(parameter.alias(), value));
        }
        return form;
    }

    /**
     * Renders a form for logging with secret values masked.
     */
    public static String redact(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, String> entry : form.entrySet()) {
            boolean secret = OAuthParameter.fromAlias(entry.getKey())
                    .map(OAuthParameter::isSecret)
                    .orElse(false);
            joiner.add(entry.getKey() + "=" + (secret ? "****" : entry.getValue()));
        }
        return joiner.toString();
    }
}
