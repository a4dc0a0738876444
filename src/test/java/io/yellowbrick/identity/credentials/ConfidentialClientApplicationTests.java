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

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.github.tomakehurst.wiremock.client.BasicCredentials;

import io.yellowbrick.identity.IdentityConstants;
import io.yellowbrick.identity.IdentityException;

class ConfidentialClientApplicationTests extends TokenRequestTestSupport {

    AuthorizationCodeCredential authorizationCodeCredential() throws IdentityException {
        return AuthorizationCodeCredential.builder(configuration())
                .withClientSecret(TEST_CLIENT_SECRET)
                .withAuthorizationCode(TEST_AUTHORIZATION_CODE)
                .withScope("openid", "User.Read", "offline_access")
                .build();
    }

    @Test
    @DisplayName("Authorization code is redeemed for tokens")
    void testGetToken_authorizationCode() throws IdentityException {
        ConfidentialClientApplication app = new ConfidentialClientApplication(authorizationCodeCredential());

        TokenResponse token = app.getToken();

        assertEquals("Bearer", token.getTokenType());
        assertEquals(Optional.of(TEST_ACCESS_TOKEN), token.getAccessToken());
        assertEquals(Optional.of(TEST_ID_TOKEN), token.getIdToken());
        assertEquals(Optional.of(TEST_REFRESH_TOKEN), token.getRefreshToken());
        assertEquals(3599, token.getExpiresIn());
        assertEquals(3599, ((Number) token.getAdditionalFields().get("ext_expires_in")).intValue());

        wm.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH))
                .withBasicAuth(new BasicCredentials(
                        TEST_CLIENT_ID, TEST_CLIENT_SECRET))
                .withRequestBody(containing("client_secret=" + TEST_CLIENT_SECRET))
                .withRequestBody(containing("redirect_uri=http://localhost:8000/redirect")));
    }

    @Test
    @DisplayName("Refresh token is redeemed with the same client")
    void testGetToken_refresh() throws IdentityException {
        AuthorizationCodeCredential credential = authorizationCodeCredential();
        ConfidentialClientApplication app = new ConfidentialClientApplication(credential);
        TokenResponse first = app.getToken();

        ConfidentialClientApplication refresh = app.withCredential(
                credential.withRefreshToken(first.getRefreshToken().orElseThrow()));
        TokenResponse second = refresh.getToken();

        assertEquals(Optional.of(TEST_ACCESS_TOKEN), second.getAccessToken());
        assertEquals(Optional.empty(), second.getRefreshToken());
        // expires_in came back as a string
        assertEquals(3599, second.getExpiresIn());
        assertState("REFRESHED", 1);
        wm.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                .withRequestBody(notContaining("code=" + TEST_AUTHORIZATION_CODE)));
    }

    @Test
    void testGetTokenAsync_clientSecret() throws Exception {
        ClientSecretCredential credential = ClientSecretCredential.builder(configuration())
                .withClientSecret(TEST_CLIENT_SECRET)
                .build();

        TokenResponse token = new ConfidentialClientApplication(credential).getTokenAsync().get(10, TimeUnit.SECONDS);

        assertEquals(Optional.of(TEST_ACCESS_TOKEN), token.getAccessToken());
        wm.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                .withRequestBody(containing("scope=https://graph.microsoft.com/.default")));
    }

    @Test
    void testExecute_rawResponse() throws IdentityException {
        HttpResponse<String> response = new ConfidentialClientApplication(authorizationCodeCredential()).execute();
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains(TEST_ACCESS_TOKEN));
    }

    @Test
    @DisplayName("Error response is reported with status, error and description")
    void testGetToken_errorResponse() throws IdentityException {
        info.setProperty(IdentityConstants.IDENTITY_TENANT, FAILING_TENANT);
        ConfidentialClientApplication app = new ConfidentialClientApplication(authorizationCodeCredential());

        IdentityException ex = assertThrows(IdentityException.class, app::getToken);

        assertEquals(IdentityException.Kind.UPSTREAM_HTTP_ERROR, ex.getKind());
        assertEquals(400, ex.getStatusCode());
        assertTrue(ex.getMessage().contains(TEST_ERROR), ex.getMessage());
        assertTrue(ex.getMessage().contains(TEST_ERROR_DESCRIPTION), ex.getMessage());
    }

    @Test
    void testGetTokenAsync_errorResponse() throws IdentityException {
        info.setProperty(IdentityConstants.IDENTITY_TENANT, FAILING_TENANT);
        ConfidentialClientApplication app = new ConfidentialClientApplication(authorizationCodeCredential());

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> app.getTokenAsync().get(10, TimeUnit.SECONDS));

        IdentityException cause = assertInstanceOf(IdentityException.class, ex.getCause());
        assertEquals(400, cause.getStatusCode());
    }

    @Test
    void testGetToken_notJson() throws IdentityException {
        info.setProperty(IdentityConstants.IDENTITY_TENANT, NOT_JSON_TENANT);
        ConfidentialClientApplication app = new ConfidentialClientApplication(authorizationCodeCredential());

        IdentityException ex = assertThrows(IdentityException.class, app::getToken);

        assertEquals(502, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("Bad Gateway"), ex.getMessage());
        assertTrue(ex.getMessage().contains("(content returned was not JSON)"), ex.getMessage());
    }

    @Test
    void testExecute_extraHeaders() throws IdentityException {
        info.setProperty(IdentityConstants.IDENTITY_EXTRA_HEADER_PREFIX + "x-client-SKU", "yellowbrick-identity");

        new ConfidentialClientApplication(authorizationCodeCredential()).execute();

        wm.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                .withHeader("x-client-SKU", equalTo("yellowbrick-identity")));
    }

    @Test
    void testExecute_assertionHasNoBasicAuth() throws IdentityException {
        ClientAssertionCredential credential = ClientAssertionCredential.builder(configuration())
                .withClientAssertion("federated.jwt.value")
                .build();

        new ConfidentialClientApplication(credential).getToken();

        wm.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                .withoutHeader("Authorization")
                .withRequestBody(containing("client_assertion=federated.jwt.value")));
    }

    @Test
    @DisplayName("Invalid credential never reaches the network")
    void testBuildRequest_validationFailure() throws IdentityException {
        TokenRequestExecutor executor = new TokenRequestExecutor(HttpClient.newHttpClient());
        AuthorizationCodeCredential invalid = new AuthorizationCodeCredential(configuration(), null,
                new CodeOrRefreshGrant(TEST_AUTHORIZATION_CODE, null, null, List.of()));

        IdentityException ex = assertThrows(IdentityException.class, () -> executor.execute(invalid));

        assertEquals(IdentityException.Kind.MISSING_REQUIRED_VALUE, ex.getKind());
        assertEquals(List.of("client_secret"), ex.getFields());
        wm.verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    void testExecute_connectionRefused() throws IOException, IdentityException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        info.setProperty(IdentityConstants.IDENTITY_AUTHORITY_HOST, "http://localhost:" + port);
        ConfidentialClientApplication app = new ConfidentialClientApplication(authorizationCodeCredential());

        IdentityException ex = assertThrows(IdentityException.class, app::execute);

        assertEquals(IdentityException.Kind.UPSTREAM_HTTP_ERROR, ex.getKind());
        assertEquals(-1, ex.getStatusCode());
    }

    @Test
    void testExecuteAsync_connectionRefused() throws IOException, IdentityException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        info.setProperty(IdentityConstants.IDENTITY_AUTHORITY_HOST, "http://localhost:" + port);
        ConfidentialClientApplication app = new ConfidentialClientApplication(authorizationCodeCredential());

        CompletionException ex = assertThrows(CompletionException.class, () -> app.executeAsync().join());

        IdentityException cause = assertInstanceOf(IdentityException.class, ex.getCause());
        assertEquals(IdentityException.Kind.UPSTREAM_HTTP_ERROR, cause.getKind());
    }

    @Test
    void testTokenResponse_toJSONObject() {
        TokenResponse token = TokenResponse.fromJSONObject(new JSONObject(toJSON(
                "token_type", "Bearer",
                "expires_in", 60,
                "access_token", TEST_ACCESS_TOKEN,
                "foci", "1")));

        assertEquals(60, token.getExpiresIn());
        assertEquals("1", token.getAdditionalFields().get("foci"));
        assertEquals("1", token.toJSONObject().getString("foci"));
        assertTrue(token.toString().contains("accessToken=****"));
        assertFalse(token.toString().contains(TEST_ACCESS_TOKEN));
    }
}
