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

import java.util.Optional;

/**
 * Canonical OAuth 2.0 / OpenID Connect parameter names used on the wire by the
 * identity platform.
 */
public enum OAuthParameter {
    CLIENT_ID("client_id"),
    CLIENT_SECRET("client_secret", true),
    REDIRECT_URI("redirect_uri"),
    RESPONSE_TYPE("response_type"),
    RESPONSE_MODE("response_mode"),
    STATE("state"),
    SCOPE("scope"),
    PROMPT("prompt"),
    LOGIN_HINT("login_hint"),
    DOMAIN_HINT("domain_hint"),
    NONCE("nonce"),
    CODE_CHALLENGE("code_challenge"),
    CODE_CHALLENGE_METHOD("code_challenge_method"),
    CODE_VERIFIER("code_verifier", true),
    AUTHORIZATION_CODE("code", true),
    REFRESH_TOKEN("refresh_token", true),
    GRANT_TYPE("grant_type"),
    CLIENT_ASSERTION("client_assertion", true),
    CLIENT_ASSERTION_TYPE("client_assertion_type"),
    ID_TOKEN("id_token", true),
    ACCESS_TOKEN("access_token", true),
    SESSION_STATE("session_state"),
    ERROR("error"),
    ERROR_DESCRIPTION("error_description"),
    ERROR_URI("error_uri");

    private final String alias;
    private final boolean secret;

    OAuthParameter(String alias) {
        this(alias, false);
    }

    OAuthParameter(String alias, boolean secret) {
        this.alias = alias;
        this.secret = secret;
    }

    /**
     * The parameter name as it appears in a query string or form body.
     */
    public String alias() {
        return alias;
    }

    /**
     * True when the value must never be written to logs.
     */
    public boolean isSecret() {
        return secret;
    }

    /**
     * The parameter with this wire name, if any.
     */
    public static Optional<OAuthParameter> fromAlias(String alias) {
        for (OAuthParameter parameter : values()) {
            if (parameter.alias.equals(alias)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return alias;
    }
}
