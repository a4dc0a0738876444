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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.json.JSONObject;

/**
 * A successful token endpoint response. The access, id or refresh token is present
 * depending on the grant and the requested scopes.
 */
public class TokenResponse {
    private final String tokenType;
    private final String scope;
    private final long expiresIn;
    private final Instant expiresAt; // Receipt time plus expires_in
    private final String accessToken;
    private final String refreshToken; // ONLY if scope includes "offline_access"
    private final String idToken; // ONLY if scope includes "openid"
    private final Map<String, Object> additionalFields;

    TokenResponse(String tokenType, String scope, long expiresIn, Instant expiresAt, String accessToken,
            String refreshToken, String idToken, Map<String, Object> additionalFields) {
        this.tokenType = tokenType;
        this.scope = scope;
        this.expiresIn = expiresIn;
        this.expiresAt = expiresAt;
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.idToken = idToken;
        this.additionalFields = Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getScope() {
        return scope;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Optional<String> getAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    public Optional<String> getRefreshToken() {
        return Optional.ofNullable(refreshToken);
    }

    public Optional<String> getIdToken() {
        return Optional.ofNullable(idToken);
    }

    /**
     * Members of the response this class has no field for, such as {@code ext_expires_in}.
     */
    public Map<String, Object> getAdditionalFields() {
        return additionalFields;
    }

    public JSONObject toJSONObject() {
        JSONObject json = new JSONObject();
        for (Map.Entry<String, Object> entry : additionalFields.entrySet()) {
            json.put(entry.getKey(), entry.getValue());
        }
        json.put("token_type", tokenType);
        json.put("scope", scope);
        json.put("expires_in", expiresIn);
        json.put("access_token", accessToken);
        json.put("refresh_token", refreshToken);
        json.put("id_token", idToken);
        return json;
    }

    public static TokenResponse fromJSONObject(JSONObject json) {
        return fromJSONObject(json, Instant.now());
    }

    static TokenResponse fromJSONObject(JSONObject json, Instant receivedAt) {
        String tokenType = json.optString("token_type", null);
        String scope = json.optString("scope", null);
        // Some hosts return expires_in as a string
        long expiresIn = (long) Double.parseDouble(json.optString("expires_in", "0"));
        String accessToken = json.optString("access_token", null);
        String refreshToken = json.optString("refresh_token", null);
        String idToken = json.optString("id_token", null);

        Map<String, Object> additional = new LinkedHashMap<>(json.toMap());
        additional.remove("token_type");
        additional.remove("scope");
        additional.remove("expires_in");
        additional.remove("access_token");
        additional.remove("refresh_token");
        additional.remove("id_token");

        return new TokenResponse(tokenType, scope, expiresIn, receivedAt.plusSeconds(expiresIn), accessToken,
                refreshToken, idToken, additional);
    }

    @Override
    public String toString() {
        return "TokenResponse{tokenType=" + tokenType
                + ", scope=" + scope
                + ", expiresAt=" + expiresAt
                + ", accessToken=" + (accessToken != null ? "****" : null)
                + ", refreshToken=" + (refreshToken != null ? "****" : null)
                + ", idToken=" + (idToken != null ? "****" : null) + "}";
    }
}
