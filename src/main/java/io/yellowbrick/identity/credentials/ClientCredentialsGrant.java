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

import java.util.List;
import java.util.Map;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityConstants;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.OAuthParameter;
import io.yellowbrick.identity.oauth2.OAuthSerializer;

/**
 * The body of a client credentials grant, where the application acts as itself.
 */
final class ClientCredentialsGrant {
    static final String CLIENT_CREDENTIALS_GRANT = "client_credentials";

    private ClientCredentialsGrant() {
    }

    static Map<String, String> form(IdentityConfiguration configuration, ClientAuthentication authentication,
            String tokenUrl, List<String> scope) throws IdentityException {
        if (!configuration.hasValidClientId()) {
            throw IdentityException.missingRequiredValue(OAuthParameter.CLIENT_ID.alias());
        }
        String clientId = configuration.clientId.toString();

        authentication.validate();

        OAuthSerializer serializer = new OAuthSerializer()
                .clientId(clientId)
                .grantType(CLIENT_CREDENTIALS_GRANT)
                .extendScopes(scope);
        if (!serializer.contains(OAuthParameter.SCOPE)) {
            serializer.addScope(IdentityConstants.GRAPH_DEFAULT_SCOPE);
        }
        authentication.apply(serializer, clientId, tokenUrl);

        return serializer.form(List.of(), authentication.requiredWith(OAuthParameter.GRANT_TYPE, OAuthParameter.SCOPE));
    }
}
