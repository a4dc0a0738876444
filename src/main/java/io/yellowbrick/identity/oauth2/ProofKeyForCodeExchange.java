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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * A PKCE (RFC 7636) verifier/challenge pair. The challenge goes on the authorization URL,
 * the verifier on the matching token request.
 */
public final class ProofKeyForCodeExchange {
    public static final String METHOD_S256 = "S256";
    public static final String METHOD_PLAIN = "plain";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final String codeVerifier;
    private final String codeChallenge;
    private final String codeChallengeMethod;

    public ProofKeyForCodeExchange(String codeVerifier, String codeChallenge, String codeChallengeMethod) {
        this.codeVerifier = Objects.requireNonNull(codeVerifier, "codeVerifier");
        this.codeChallenge = Objects.requireNonNull(codeChallenge, "codeChallenge");
        this.codeChallengeMethod = Objects.requireNonNull(codeChallengeMethod, "codeChallengeMethod");
    }

    /**
     * A new S256 pair with a 43 character verifier.
     */
    public static ProofKeyForCodeExchange generate() {
        String verifier = secureRandom32();
        return new ProofKeyForCodeExchange(verifier, s256(verifier), METHOD_S256);
    }

    /**
     * 32 random octets, base64url encoded without padding.
     */
    public static String secureRandom32() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String s256(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    public String getCodeVerifier() {
        return codeVerifier;
    }

    public String getCodeChallenge() {
        return codeChallenge;
    }

    public String getCodeChallengeMethod() {
        return codeChallengeMethod;
    }

    @Override
    public String toString() {
        return "ProofKeyForCodeExchange{codeVerifier=****, codeChallenge=" + codeChallenge
                + ", codeChallengeMethod=" + codeChallengeMethod + "}";
    }
}
