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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.yellowbrick.identity.IdentityException;

class OAuthSerializerTest {

    @Test
    void testEncode_followsCallerOrderNotSetterOrder() throws IdentityException {
        OAuthSerializer serializer = new OAuthSerializer()
                .state("s1")
                .redirectUri("http://localhost:8000/redirect")
                .clientId("client")
                .responseType("code");

        String encoded = serializer.encode(
                List.of(OAuthParameter.STATE),
                List.of(OAuthParameter.CLIENT_ID, OAuthParameter.RESPONSE_TYPE, OAuthParameter.REDIRECT_URI));

        assertEquals("client_id=client&response_type=code&redirect_uri=http://localhost:8000/redirect&state=s1",
                encoded);
    }

    @Test
    void testEncode_missingRequiredNamesFirstAbsentKey() {
        OAuthSerializer serializer = new OAuthSerializer().clientId("client");
        IdentityException ex = assertThrows(IdentityException.class, () -> serializer.encode(
                List.of(),
                List.of(OAuthParameter.CLIENT_ID, OAuthParameter.REDIRECT_URI, OAuthParameter.SCOPE)));
        assertEquals(IdentityException.Kind.MISSING_REQUIRED_VALUE, ex.getKind());
        assertEquals(List.of("redirect_uri"), ex.getFields());
    }

    @Test
    void testEncode_writesNothingToSinkOnFailure() {
        StringBuilder sink = new StringBuilder("existing=1");
        OAuthSerializer serializer = new OAuthSerializer().clientId("client");
        assertThrows(IdentityException.class, () -> serializer.encode(
                List.of(), List.of(OAuthParameter.CLIENT_ID, OAuthParameter.GRANT_TYPE), sink));
        assertEquals("existing=1", sink.toString());
    }

    @Test
    void testEncode_appendsToSinkWithSeparator() throws IdentityException {
        StringBuilder sink = new StringBuilder("existing=1");
        new OAuthSerializer().grantType("client_credentials")
                .encode(List.of(), List.of(OAuthParameter.GRANT_TYPE), sink);
        assertEquals("existing=1&grant_type=client_credentials", sink.toString());
    }

    @Test
    void testEncode_skipsAbsentOptional() throws IdentityException {
        String encoded = new OAuthSerializer().clientId("client")
                .encode(List.of(OAuthParameter.STATE, OAuthParameter.NONCE), List.of(OAuthParameter.CLIENT_ID));
        assertEquals("client_id=client", encoded);
    }

    @Test
    void testScopes_joinedDeduplicatedInFirstSeenOrder() {
        OAuthSerializer serializer = new OAuthSerializer()
                .extendScopes(List.of("User.Read", " Mail.Read ", "User.Read", ""))
                .addScope("offline_access");
        assertEquals("User.Read Mail.Read offline_access", serializer.get(OAuthParameter.SCOPE).orElseThrow());
    }

    @Test
    void testScopes_absentWhenEmpty() {
        OAuthSerializer serializer = new OAuthSerializer().extendScopes(List.of(" "));
        assertFalse(serializer.contains(OAuthParameter.SCOPE));
    }

    @Test
    void testSetter_nullRemovesValue() {
        OAuthSerializer serializer = new OAuthSerializer().state("s1").state(null);
        assertFalse(serializer.contains(OAuthParameter.STATE));
    }

    @Test
    void testForm_requiredThenOptional() throws IdentityException {
        Map<String, String> form = new OAuthSerializer()
                .codeVerifier("verifier")
                .grantType("authorization_code")
                .clientId("client")
                .form(List.of(OAuthParameter.CODE_VERIFIER), List.of(OAuthParameter.CLIENT_ID, OAuthParameter.GRANT_TYPE));
        assertEquals(List.of("client_id", "grant_type", "code_verifier"), List.copyOf(form.keySet()));
    }

    @Test
    void testAuthority_recordsEndpoints() {
        OAuthSerializer serializer = new OAuthSerializer()
                .authority(AzureCloudInstance.AZURE_PUBLIC, Authority.tenant("contoso.onmicrosoft.com"));
        assertEquals("https://login.microsoftonline.com/contoso.onmicrosoft.com/oauth2/v2.0/authorize",
                serializer.authorizationUrl().orElseThrow());
        assertEquals("https://login.microsoftonline.com/contoso.onmicrosoft.com/oauth2/v2.0/token",
                serializer.tokenUrl().orElseThrow());
    }

    @Test
    void testRedact_masksSecrets() {
        String redacted = OAuthSerializer.redact(Map.of(
                "client_secret", "hunter2",
                "code", "auth-code",
                "client_id", "client"));
        assertFalse(redacted.contains("hunter2"));
        assertFalse(redacted.contains("auth-code"));
        assertTrue(redacted.contains("client_id=client"));
    }
}
