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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.ProofKeyForCodeExchange;

class AuthorizationCodeCredentialTest {
    static final String CLIENT_ID = TokenRequestTestSupport.TEST_CLIENT_ID;
    static final String CLIENT_SECRET = TokenRequestTestSupport.TEST_CLIENT_SECRET;
    static final String REDIRECT_URI = TokenRequestTestSupport.TEST_REDIRECT_URI;

    static AuthorizationCodeCredential.Builder builder() {
        return AuthorizationCodeCredential.builder(CLIENT_ID)
                .withClientSecret(CLIENT_SECRET)
                .withRedirectUri(REDIRECT_URI);
    }

    @Test
    void testForm_authorizationCode() throws IdentityException {
        AuthorizationCodeCredential credential = builder()
                .withAuthorizationCode("auth-code")
                .withScope("User.Read")
                .withCodeVerifier("verifier")
                .build();

        Map<String, String> form = credential.form();

        assertEquals(List.of("client_id", "client_secret", "redirect_uri", "code", "grant_type", "scope",
                "code_verifier"), List.copyOf(form.keySet()));
        assertEquals("authorization_code", form.get("grant_type"));
        assertEquals("auth-code", form.get("code"));
        assertEquals(CLIENT_SECRET, form.get("client_secret"));
        assertEquals(GrantKind.AUTHORIZATION_CODE, credential.kind());
    }

    @Test
    void testFormUrlEncoded_authorizationCode() throws IdentityException {
        String body = builder().withAuthorizationCode("auth-code").build().formUrlEncoded();
        assertEquals("client_id=" + CLIENT_ID
                + "&client_secret=the-client-secret"
                + "&redirect_uri=http://localhost:8000/redirect"
                + "&code=auth-code"
                + "&grant_type=authorization_code", body);
    }

    @Test
    void testForm_refreshToken() throws IdentityException {
        Map<String, String> form = builder()
                .withRefreshToken("refresh")
                .withScope("User.Read", "offline_access")
                .build()
                .form();

        assertEquals(List.of("client_id", "client_secret", "refresh_token", "grant_type", "scope"),
                List.copyOf(form.keySet()));
        assertEquals("refresh_token", form.get("grant_type"));
        assertEquals("User.Read offline_access", form.get("scope"));
    }

    @Test
    void testForm_pkceVerifier() throws IdentityException {
        ProofKeyForCodeExchange pkce = ProofKeyForCodeExchange.generate();
        Map<String, String> form = builder().withAuthorizationCode("auth-code").withPkce(pkce).build().form();
        assertEquals(pkce.getCodeVerifier(), form.get("code_verifier"));
    }

    @Test
    @DisplayName("Code and refresh token together conflict")
    void testBuild_conflictingValues() {
        IdentityException ex = assertThrows(IdentityException.class, () -> builder()
                .withAuthorizationCode("auth-code")
                .withRefreshToken("refresh")
                .build());
        assertEquals(IdentityException.Kind.CONFLICTING_VALUES, ex.getKind());
        assertEquals(List.of("authorization_code", "refresh_token"), ex.getFields());
    }

    @Test
    void testBuild_conflictCheckedFirst() {
        IdentityException ex = assertThrows(IdentityException.class, () -> AuthorizationCodeCredential
                .builder("")
                .withAuthorizationCode("auth-code")
                .withRefreshToken("refresh")
                .build());
        assertEquals(IdentityException.Kind.CONFLICTING_VALUES, ex.getKind());
    }

    @Test
    void testBuild_blankClientId() {
        IdentityException ex = assertThrows(IdentityException.class, () -> AuthorizationCodeCredential
                .builder(" ")
                .withClientSecret(CLIENT_SECRET)
                .withAuthorizationCode("auth-code")
                .withRedirectUri(REDIRECT_URI)
                .build());
        assertEquals(IdentityException.Kind.MISSING_REQUIRED_VALUE, ex.getKind());
        assertEquals(List.of("client_id"), ex.getFields());
    }

    @Test
    void testBuild_blankClientSecret() {
        for (String secret : new String[] { null, "", "   " }) {
            IdentityException ex = assertThrows(IdentityException.class, () -> builder()
                    .withClientSecret(secret)
                    .withAuthorizationCode("auth-code")
                    .build());
            assertEquals(List.of("client_secret"), ex.getFields());
        }
    }

    @Test
    void testBuild_blankRefreshToken() {
        IdentityException ex = assertThrows(IdentityException.class,
                () -> builder().withRefreshToken(" ").build());
        assertEquals(List.of("refresh_token"), ex.getFields());
    }

    @Test
    void testBuild_blankAuthorizationCode() {
        IdentityException ex = assertThrows(IdentityException.class,
                () -> builder().withAuthorizationCode("").build());
        assertEquals(List.of("authorization_code"), ex.getFields());
    }

    @Test
    void testBuild_codeWithoutRedirectUri() {
        IdentityException ex = assertThrows(IdentityException.class, () -> AuthorizationCodeCredential
                .builder(CLIENT_ID)
                .withClientSecret(CLIENT_SECRET)
                .withAuthorizationCode("auth-code")
                .build());
        assertEquals(List.of("redirect_uri"), ex.getFields());
    }

    @Test
    void testBuild_malformedRedirectUri() {
        IdentityException ex = assertThrows(IdentityException.class, () -> builder()
                .withRedirectUri("http://localhost:8000/re direct")
                .withAuthorizationCode("auth-code")
                .build());
        assertEquals(IdentityException.Kind.MALFORMED_URL, ex.getKind());
    }

    @Test
    void testBuild_refreshWithoutRedirectUri() throws IdentityException {
        Map<String, String> form = AuthorizationCodeCredential.builder(CLIENT_ID)
                .withClientSecret(CLIENT_SECRET)
                .withRefreshToken("refresh")
                .build()
                .form();
        assertFalse(form.containsKey("redirect_uri"));
    }

    @Test
    void testBuild_neitherCodeNorRefreshToken() {
        IdentityException ex = assertThrows(IdentityException.class, () -> builder().build());
        assertEquals(List.of("authorization_code or refresh_token"), ex.getFields());
    }

    @Test
    void testWithRefreshToken_dropsCode() throws IdentityException {
        AuthorizationCodeCredential credential = builder()
                .withAuthorizationCode("auth-code")
                .withCodeVerifier("verifier")
                .build();

        AuthorizationCodeCredential refreshed = credential.withRefreshToken("refresh");

        assertEquals(Optional.empty(), refreshed.getAuthorizationCode());
        assertEquals(Optional.of("refresh"), refreshed.getRefreshToken());
        Map<String, String> form = refreshed.form();
        assertEquals("refresh_token", form.get("grant_type"));
        assertFalse(form.containsKey("code"));
        assertFalse(form.containsKey("code_verifier"));
        // The original is unchanged
        assertEquals(Optional.of("auth-code"), credential.getAuthorizationCode());
    }

    @Test
    void testBasicAuth_isClientIdAndSecret() throws IdentityException {
        AuthorizationCodeCredential credential = builder().withAuthorizationCode("auth-code").build();
        BasicAuthCredentials pair = credential.basicAuth().orElseThrow();
        assertEquals(CLIENT_ID, pair.getClientId());
        assertEquals(CLIENT_SECRET, pair.getClientSecret());
        assertTrue(pair.toHeaderValue().startsWith("Basic "));
        // The secret is still sent in the body as well
        assertTrue(credential.form().containsKey("client_secret"));
    }

    @Test
    void testUri_tenantTokenEndpoint() throws IdentityException {
        AuthorizationCodeCredential credential = builder()
                .withTenant("contoso.onmicrosoft.com")
                .withAuthorizationCode("auth-code")
                .build();
        assertEquals(URI.create("https://login.microsoftonline.com/contoso.onmicrosoft.com/oauth2/v2.0/token"),
                credential.uri());
    }

    @Test
    void testOpenIdCredential_requiresOpenidScope() throws IdentityException {
        OpenIdCredential credential = OpenIdCredential.builder(CLIENT_ID)
                .withClientSecret(CLIENT_SECRET)
                .withRedirectUri(REDIRECT_URI)
                .withAuthorizationCode("auth-code")
                .withScope("profile")
                .build();

        Map<String, String> form = credential.form();

        assertEquals(List.of("client_id", "client_secret", "redirect_uri", "code", "grant_type", "scope"),
                List.copyOf(form.keySet()));
        assertEquals("openid profile", form.get("scope"));
        assertEquals(GrantKind.OPEN_ID, credential.kind());

        Map<String, String> refreshed = credential.withRefreshToken("refresh").form();
        assertEquals("openid profile", refreshed.get("scope"));
        assertEquals(List.of("client_id", "client_secret", "refresh_token", "grant_type", "scope"),
                List.copyOf(refreshed.keySet()));
    }

    @Test
    void testOpenIdCredential_blankClientSecret() {
        IdentityException ex = assertThrows(IdentityException.class, () -> OpenIdCredential.builder(CLIENT_ID)
                .withRedirectUri(REDIRECT_URI)
                .withAuthorizationCode("auth-code")
                .build());
        assertEquals(List.of("client_secret"), ex.getFields());
    }
}
