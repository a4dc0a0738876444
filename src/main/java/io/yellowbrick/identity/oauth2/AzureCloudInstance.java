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

import io.yellowbrick.identity.IdentityConstants;

/**
 * Selects the login host of a national or public cloud. The endpoint URLs are derived
 * from the host and an {@link Authority} without any network access.
 */
public enum AzureCloudInstance {
    AZURE_PUBLIC(IdentityConstants.IDENTITY_CLOUD_INSTANCE_PUBLIC, "login.microsoftonline.com"),
    AZURE_CHINA(IdentityConstants.IDENTITY_CLOUD_INSTANCE_CHINA, "login.chinacloudapi.cn"),
    AZURE_GERMANY(IdentityConstants.IDENTITY_CLOUD_INSTANCE_GERMANY, "login.microsoftonline.de"),
    AZURE_US_GOVERNMENT(IdentityConstants.IDENTITY_CLOUD_INSTANCE_US_GOVERNMENT, "login.microsoftonline.us");

    private final String value;
    private final String host;

    AzureCloudInstance(String value, String host) {
        this.value = value;
        this.host = host;
    }

    public String value() {
        return value;
    }

    public String host() {
        return host;
    }

    public String authorizationUrl(Authority authority) {
        return endpoint(authority, "authorize");
    }

    public String tokenUrl(Authority authority) {
        return endpoint(authority, "token");
    }

    private String endpoint(Authority authority, String name) {
        return endpoint("https://" + host, authority, name);
    }

    /**
     * The authorize endpoint on a host given as a base URL, such as an on-premises
     * federation server or a local test server.
     */
    public static String authorizationUrlOn(String baseUrl, Authority authority) {
        return endpoint(baseUrl, authority, "authorize");
    }

    public static String tokenUrlOn(String baseUrl, Authority authority) {
        return endpoint(baseUrl, authority, "token");
    }

    // ADFS only exposes the v1 endpoints.
    private static String endpoint(String baseUrl, Authority authority, String name) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (authority.isFederatedServices()) {
            return String.format("%s/%s/oauth2/%s", base, authority.realm(), name);
        }
        return String.format("%s/%s/oauth2/v2.0/%s", base, authority.realm(), name);
    }

    public static AzureCloudInstance fromString(String value) {
        if (value == null)
            return AZURE_PUBLIC; // Default
        for (AzureCloudInstance c : values()) {
            if (c.value.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Invalid cloud instance: " + value);
    }
}
