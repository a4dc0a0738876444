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
package io.yellowbrick.identity.example;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.IdentityConstants;
import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.credentials.AuthorizationCodeCredential;
import io.yellowbrick.identity.credentials.ConfidentialClientApplication;
import io.yellowbrick.identity.credentials.TokenResponse;
import io.yellowbrick.identity.oauth2.AuthCodeAuthorizationUrlParameters;
import io.yellowbrick.identity.oauth2.AuthorizationQueryResponse;
import io.yellowbrick.identity.oauth2.ProofKeyForCodeExchange;
import io.yellowbrick.identity.web.InteractiveAuthenticator;

/**
 * Signs in through the browser with PKCE, redeems the code, then redeems the refresh
 * token when one was returned.
 */
public class AuthorizationCodeFlowExample {

    public static void main(String[] args) {
        if (args.length < 5) {
            System.err.println("Usage: java -cp <jar> " + AuthorizationCodeFlowExample.class.getName()
                    + " <tenant> <clientId> <clientSecret> <redirectUri> <scope>...");
            System.exit(1);
        }

        Properties props = new Properties();
        props.setProperty(IdentityConstants.IDENTITY_TENANT, args[0]);
        props.setProperty(IdentityConstants.IDENTITY_CLIENT_ID, args[1]);
        props.setProperty(IdentityConstants.IDENTITY_CLIENT_SECRET, args[2]);
        props.setProperty(IdentityConstants.IDENTITY_REDIRECT_URI, args[3]);
        List<String> scope = Arrays.asList(args).subList(4, args.length);

        Duration timeout = Duration.ofSeconds(Long.parseLong(System.getProperty(
                IdentityConstants.IDENTITY_INTERACTIVE_TIMEOUT,
                IdentityConstants.IDENTITY_INTERACTIVE_TIMEOUT_DEFAULT)));

        try {
            IdentityConfiguration configuration = new IdentityConfiguration(props);
            ProofKeyForCodeExchange pkce = ProofKeyForCodeExchange.generate();
            AuthorizationQueryResponse response = AuthCodeAuthorizationUrlParameters.builder(configuration)
                    .withScope(scope)
                    .withOfflineAccess()
                    .withPkce(pkce)
                    .withGeneratedNonce()
                    .build()
                    .interactiveAuthentication(new InteractiveAuthenticator(), timeout);

            if (response.isError()) {
                System.err.println("Sign-in failed: " + response.getError().orElse("") + ": "
                        + response.getErrorDescription().orElse(""));
                System.exit(1);
            }

            AuthorizationCodeCredential credential = AuthorizationCodeCredential.builder(configuration)
                    .withClientSecret(props.getProperty(IdentityConstants.IDENTITY_CLIENT_SECRET))
                    .withAuthorizationCode(response.getCode().orElse(""))
                    .withPkce(pkce)
                    .withScope(scope)
                    .build();
            ConfidentialClientApplication app = new ConfidentialClientApplication(credential);
            TokenResponse token = app.getToken();
            System.out.println("Token received: " + token);

            if (token.getRefreshToken().isPresent()) {
                TokenResponse refreshed = app
                        .withCredential(credential.withRefreshToken(token.getRefreshToken().get()))
                        .getToken();
                System.out.println("Refreshed token received: " + refreshed);
            }
        } catch (IdentityException e) {
            System.err.println("Authentication failed (" + e.getKind() + "): " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
