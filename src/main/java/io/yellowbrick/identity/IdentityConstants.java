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

public interface IdentityConstants {
    // Application registration
    String IDENTITY_CLIENT_ID = "identityClientId";
    String IDENTITY_CLIENT_SECRET = "identityClientSecret";
    String IDENTITY_REDIRECT_URI = "identityRedirectUri";

    // Directory realm: a tenant id, or one of the shared realms below
    String IDENTITY_TENANT = "identityTenant";
    String IDENTITY_AUTHORITY = "identityAuthority";
    String IDENTITY_AUTHORITY_COMMON = "common";
    String IDENTITY_AUTHORITY_ORGANIZATIONS = "organizations";
    String IDENTITY_AUTHORITY_CONSUMERS = "consumers";
    String IDENTITY_AUTHORITY_ADFS = "adfs";
    String IDENTITY_AUTHORITY_DEFAULT = IDENTITY_AUTHORITY_COMMON;
    String[] IDENTITY_AUTHORITY_OPTIONS = {
        IDENTITY_AUTHORITY_COMMON,
        IDENTITY_AUTHORITY_ORGANIZATIONS,
        IDENTITY_AUTHORITY_CONSUMERS,
        IDENTITY_AUTHORITY_ADFS
    };

    // Which sovereign cloud hosts the login endpoints
    String IDENTITY_CLOUD_INSTANCE = "identityCloudInstance";
    String IDENTITY_CLOUD_INSTANCE_PUBLIC = "public";
    String IDENTITY_CLOUD_INSTANCE_CHINA = "china";
    String IDENTITY_CLOUD_INSTANCE_GERMANY = "germany";
    String IDENTITY_CLOUD_INSTANCE_US_GOVERNMENT = "us-government";
    String IDENTITY_CLOUD_INSTANCE_DEFAULT = IDENTITY_CLOUD_INSTANCE_PUBLIC;

    // Base URL replacing the cloud instance host, e.g. https://adfs.contoso.com
    String IDENTITY_AUTHORITY_HOST = "identityAuthorityHost";

    // Space separated scopes for token requests
    String IDENTITY_SCOPES = "identityScopes";

    // Pass-through parameters, prefix followed by the parameter name
    String IDENTITY_EXTRA_QUERY_PREFIX = "identityQuery.";
    String IDENTITY_EXTRA_HEADER_PREFIX = "identityHeader.";

    // Path to custom CA certificate (PEM)
    String IDENTITY_CACERT_PATH = "identityCAcertPath";

    // Disable trust to the login host (for testing purposes)
    String IDENTITY_DISABLE_TRUST = "identitySSLDisableTrust";

    // Timeouts, in seconds
    String IDENTITY_REQUEST_TIMEOUT = "identityRequestTimeoutSeconds";
    String IDENTITY_REQUEST_TIMEOUT_DEFAULT = "30";
    String IDENTITY_INTERACTIVE_TIMEOUT = "identityInteractiveTimeoutSeconds";
    String IDENTITY_INTERACTIVE_TIMEOUT_DEFAULT = "300";

    // Default scope for client credentials grants
    String GRAPH_DEFAULT_SCOPE = "https://graph.microsoft.com/.default";
}
