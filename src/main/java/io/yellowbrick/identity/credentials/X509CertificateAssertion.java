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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.Enumeration;
import java.util.Objects;
import java.util.UUID;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import io.yellowbrick.identity.IdentityException;

/**
 * Signs the client assertion that proves possession of a registered certificate.
 * <p>
 * The assertion is an RS256 JWT whose audience is the token endpoint, issued by and about
 * the client, valid for ten minutes, with the certificate's SHA-1 thumbprint in the
 * {@code x5t} header.
 * <p>
 * Reference: <a href="https://learn.microsoft.com/en-us/entra/identity-platform/certificate-credentials">Certificate credentials</a>
 */
public final class X509CertificateAssertion {
    public static final String JWT_BEARER_ASSERTION_TYPE = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";
    static final Duration VALIDITY = Duration.ofMinutes(10);

    private final X509Certificate certificate;
    private final RSAPrivateKey privateKey;

    public X509CertificateAssertion(X509Certificate certificate, PrivateKey privateKey) {
        this.certificate = Objects.requireNonNull(certificate, "certificate");
        Objects.requireNonNull(privateKey, "privateKey");
        if (!(privateKey instanceof RSAPrivateKey)) {
            throw new IllegalArgumentException(
                    String.format("The provided key (algorithm = %s) is not supported, an RSA key is required",
                            privateKey.getAlgorithm()));
        }
        this.privateKey = (RSAPrivateKey) privateKey;
    }

    /**
     * Loads the first key entry of a PKCS#12 file.
     */
    public static X509CertificateAssertion fromPkcs12(Path path, char[] password) throws IdentityException {
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore ks = KeyStore.getInstance("PKCS12");
            ks.load(in, password);
            Enumeration<String> aliases = ks.aliases();
            for (String alias : Collections.list(aliases)) {
                if (ks.isKeyEntry(alias)) {
                    PrivateKey key = (PrivateKey) ks.getKey(alias, password);
                    X509Certificate cert = (X509Certificate) ks.getCertificate(alias);
                    return new X509CertificateAssertion(cert, key);
                }
            }
            throw IdentityException.invalidValue("certificate", "No private key entry found in " + path);
        } catch (IdentityException e) {
            throw e;
        } catch (IOException e) {
            throw IdentityException.invalidValue("certificate", "Could not read " + path + ": " + e.getMessage());
        } catch (Exception e) {
            throw IdentityException.invalidValue("certificate", "Could not load key from " + path + ": " + e);
        }
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    /**
     * Base64url SHA-1 digest of the DER encoded certificate.
     */
    public Base64URL thumbprint() throws IdentityException {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return Base64URL.encode(sha1.digest(certificate.getEncoded()));
        } catch (Exception e) {
            throw IdentityException.invalidValue("certificate", "Could not compute thumbprint: " + e);
        }
    }

    /**
     * Signs a fresh assertion for {@code clientId} addressed to {@code audience}.
     */
    public String sign(String clientId, String audience) throws IdentityException {
        return sign(clientId, audience, Instant.now());
    }

    String sign(String clientId, String audience, Instant now) throws IdentityException {
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256)
                .type(JOSEObjectType.JWT)
                .x509CertThumbprint(thumbprint())
                .build();

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .audience(audience)
                .issuer(clientId)
                .subject(clientId)
                .jwtID(UUID.randomUUID().toString())
                .notBeforeTime(Date.from(now))
                .expirationTime(Date.from(now.plus(VALIDITY)))
                .build();

        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(new RSASSASigner(privateKey));
        } catch (JOSEException e) {
            throw IdentityException.invalidValue("client_assertion", "Could not sign assertion: " + e.getMessage());
        }
        return jwt.serialize();
    }
}
