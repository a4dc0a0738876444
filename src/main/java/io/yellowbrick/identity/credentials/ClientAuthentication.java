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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.OAuthParameter;
import io.yellowbrick.identity.oauth2.OAuthSerializer;

/**
 * How a confidential client proves its identity in a token request body: a shared
 * secret, a caller supplied assertion, or an assertion signed with a certificate.
 */
abstract class ClientAuthentication {

    /**
     * Fails with the name of the missing value, before anything is serialized.
     */
    abstract void validate() throws IdentityException;

    /**
     * Writes the authentication parameters for a request to {@code tokenUrl}.
     */
    abstract void apply(OAuthSerializer serializer, String clientId, String tokenUrl) throws IdentityException;

    abstract List<OAuthParameter> required();

    Optional<BasicAuthCredentials> basicAuth(String clientId) {
        return Optional.empty();
    }

    /**
     * {@code client_id} followed by this authentication's parameters, then {@code rest}.
     */
    List<OAuthParameter> requiredWith(OAuthParameter... rest) {
        List<OAuthParameter> keys = new ArrayList<>();
        keys.add(OAuthParameter.CLIENT_ID);
        keys.addAll(required());
        keys.addAll(Arrays.asList(rest));
        return keys;
    }

    static ClientAuthentication secret(String clientSecret) {
        return new Secret(clientSecret);
    }

    static ClientAuthentication assertion(String clientAssertion) {
        return new Assertion(clientAssertion);
    }

    static ClientAuthentication certificate(X509CertificateAssertion certificate) {
        return new Certificate(certificate);
    }

    static final class Secret extends ClientAuthentication {
        private final String clientSecret;

        Secret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        @Override
        void validate() throws IdentityException {
            if (TokenCredential.isBlank(clientSecret)) {
                throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_SECRET.alias());
            }
        }

        @Override
        void apply(OAuthSerializer serializer, String clientId, String tokenUrl) {
            serializer.clientSecret(clientSecret);
        }

        @Override
        List<OAuthParameter> required() {
            return Collections.singletonList(OAuthParameter.CLIENT_SECRET);
        }

        @Override
        Optional<BasicAuthCredentials> basicAuth(String clientId) {
            if (clientId == null || TokenCredential.isBlank(clientSecret)) {
                return Optional.empty();
            }
            return Optional.of(new BasicAuthCredentials(clientId, clientSecret));
        }
    }

    static final class Assertion extends ClientAuthentication {
        private final String clientAssertion;

        Assertion(String clientAssertion) {
            this.clientAssertion = clientAssertion;
        }

        @Override
        void validate() throws IdentityException {
            if (TokenCredential.isBlank(clientAssertion)) {
                throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_ASSERTION.alias());
            }
        }

        @Override
        void apply(OAuthSerializer serializer, String clientId, String tokenUrl) {
            serializer.clientAssertion(clientAssertion)
                    .clientAssertionType(X509CertificateAssertion.JWT_BEARER_ASSERTION_TYPE);
        }

        @Override
        List<OAuthParameter> required() {
            return Arrays.asList(OAuthParameter.CLIENT_ASSERTION, OAuthParameter.CLIENT_ASSERTION_TYPE);
        }
    }

    static final class Certificate extends ClientAuthentication {
        private final X509CertificateAssertion certificate;

        Certificate(X509CertificateAssertion certificate) {
            this.certificate = certificate;
        }

        @Override
        void validate() throws IdentityException {
            if (certificate == null) {
                throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_ASSERTION.alias(),
                        "a certificate is required to sign the client assertion");
            }
        }

        @Override
        void apply(OAuthSerializer serializer, String clientId, String tokenUrl) throws IdentityException {
            serializer.clientAssertion(certificate.sign(clientId, tokenUrl))
                    .clientAssertionType(X509CertificateAssertion.JWT_BEARER_ASSERTION_TYPE);
        }

        @Override
        List<OAuthParameter> required() {
            return Arrays.asList(OAuthParameter.CLIENT_ASSERTION, OAuthParameter.CLIENT_ASSERTION_TYPE);
        }
    }
}
