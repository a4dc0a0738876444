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
package io.yellowbrick.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import io.yellowbrick.identity.oauth2.Authority;
import io.yellowbrick.identity.oauth2.AzureCloudInstance;

class IdentityConfigurationTest {
    static final String CLIENT_ID = "6731de76-14a6-49ae-97bc-6eba6914391e";

    @Test
    void testFromProperties() throws IdentityException {
        Properties info = new Properties();
        info.setProperty(IdentityConstants.IDENTITY_CLIENT_ID, CLIENT_ID);
        info.setProperty(IdentityConstants.IDENTITY_AUTHORITY, "consumers");
        info.setProperty(IdentityConstants.IDENTITY_CLOUD_INSTANCE, "us-government");
        info.setProperty(IdentityConstants.IDENTITY_REDIRECT_URI, "http://localhost:8000/redirect");
        info.setProperty(IdentityConstants.IDENTITY_EXTRA_QUERY_PREFIX + "dc", "ESTS-PUB");
        info.setProperty(IdentityConstants.IDENTITY_EXTRA_HEADER_PREFIX + "x-client-SKU", "yellowbrick");
        info.setProperty(IdentityConstants.IDENTITY_REQUEST_TIMEOUT, "5");

        IdentityConfiguration configuration = new IdentityConfiguration(info);

        assertEquals(UUID.fromString(CLIENT_ID), configuration.clientId);
        assertEquals(Authority.CONSUMERS, configuration.authority);
        assertEquals(AzureCloudInstance.AZURE_US_GOVERNMENT, configuration.cloudInstance);
        assertEquals("http://localhost:8000/redirect", configuration.redirectUri);
        assertEquals(URI.create("http://localhost:8000/redirect"), configuration.requireRedirectUri());
        assertEquals(Map.of("dc", "ESTS-PUB"), configuration.extraQueryParameters);
        assertEquals(Map.of("x-client-SKU", "yellowbrick"), configuration.extraHeaderParameters);
        assertEquals(Duration.ofSeconds(5), configuration.requestTimeout);
        assertFalse(configuration.disableTrust);
        assertNull(configuration.cacertPath);
        assertTrue(configuration.hasValidClientId());
    }

    @Test
    void testFromProperties_tenantOverridesAuthority() throws IdentityException {
        Properties info = new Properties();
        info.setProperty(IdentityConstants.IDENTITY_AUTHORITY, "organizations");
        info.setProperty(IdentityConstants.IDENTITY_TENANT, "contoso.onmicrosoft.com");

        IdentityConfiguration configuration = new IdentityConfiguration(info);

        assertEquals(Authority.tenant("contoso.onmicrosoft.com"), configuration.authority);
        assertFalse(configuration.hasValidClientId());
        assertEquals(IdentityConfiguration.NIL_CLIENT_ID, configuration.clientId);
    }

    @Test
    void testFromProperties_invalidTimeout() {
        for (String timeout : new String[] { "abc", "0", "-5" }) {
            Properties info = new Properties();
            info.setProperty(IdentityConstants.IDENTITY_CLIENT_ID, CLIENT_ID);
            info.setProperty(IdentityConstants.IDENTITY_REQUEST_TIMEOUT, timeout);

            IdentityException ex = assertThrows(IdentityException.class, () -> new IdentityConfiguration(info));

            assertEquals(IdentityException.Kind.INVALID_VALUE, ex.getKind());
            assertEquals(List.of(IdentityConstants.IDENTITY_REQUEST_TIMEOUT), ex.getFields());
        }
    }

    @Test
    void testRequireRedirectUri() throws IdentityException {
        IdentityConfiguration missing = IdentityConfiguration.builder(CLIENT_ID).withRedirectUri(" ").build();
        IdentityException ex = assertThrows(IdentityException.class, missing::requireRedirectUri);
        assertEquals(IdentityException.Kind.MISSING_REQUIRED_VALUE, ex.getKind());
        assertEquals(List.of("redirect_uri"), ex.getFields());

        // Kept as given until it is needed
        IdentityConfiguration malformed = IdentityConfiguration.builder(CLIENT_ID)
                .withRedirectUri("http://localhost:8000/re direct")
                .build();
        ex = assertThrows(IdentityException.class, malformed::requireRedirectUri);
        assertEquals(IdentityException.Kind.MALFORMED_URL, ex.getKind());

        IdentityConfiguration valid = IdentityConfiguration.builder(CLIENT_ID)
                .withRedirectUri(" http://localhost:8000/redirect ")
                .build();
        assertEquals(URI.create("http://localhost:8000/redirect"), valid.requireRedirectUri());
    }

    @Test
    void testDefaults() {
        IdentityConfiguration configuration = IdentityConfiguration.builder(CLIENT_ID).build();
        assertEquals(Authority.COMMON, configuration.authority);
        assertEquals(AzureCloudInstance.AZURE_PUBLIC, configuration.cloudInstance);
        assertNull(configuration.redirectUri);
        assertEquals(Duration.ofSeconds(30), configuration.requestTimeout);
        assertEquals("https://login.microsoftonline.com/common/oauth2/v2.0/token",
                configuration.tokenUrl(configuration.cloudInstance));
    }

    @Test
    void testParseClientId_invalidBecomesNil() {
        assertEquals(IdentityConfiguration.NIL_CLIENT_ID, IdentityConfiguration.parseClientId("abc"));
        assertEquals(IdentityConfiguration.NIL_CLIENT_ID, IdentityConfiguration.parseClientId(" "));
        assertEquals(UUID.fromString(CLIENT_ID), IdentityConfiguration.parseClientId(" " + CLIENT_ID + " "));
    }

    @Test
    void testToBuilder_copiesEverything() {
        IdentityConfiguration original = IdentityConfiguration.builder(CLIENT_ID)
                .withTenant("contoso.onmicrosoft.com")
                .withCloudInstance(AzureCloudInstance.AZURE_CHINA)
                .withAuthorityHost("http://localhost:8080")
                .withRedirectUri("http://localhost:8000/redirect")
                .withExtraHeaderParameter("x-a", "1")
                .withDisableTrust(true)
                .build();

        IdentityConfiguration copy = original.toBuilder().build();

        assertEquals(original.clientId, copy.clientId);
        assertEquals(original.authority, copy.authority);
        assertEquals(original.cloudInstance, copy.cloudInstance);
        assertEquals(original.authorityHost, copy.authorityHost);
        assertEquals(original.redirectUri, copy.redirectUri);
        assertEquals(original.extraHeaderParameters, copy.extraHeaderParameters);
        assertTrue(copy.disableTrust);
        assertEquals("http://localhost:8080/contoso.onmicrosoft.com/oauth2/v2.0/token",
                copy.tokenUrl(AzureCloudInstance.AZURE_PUBLIC));
    }
}
