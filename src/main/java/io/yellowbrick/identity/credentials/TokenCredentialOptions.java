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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.yellowbrick.identity.IdentityConfiguration;
import io.yellowbrick.identity.oauth2.AzureCloudInstance;

/**
 * Transport settings for one token request: the cloud instance to send it to, extra
 * request headers, the request timeout and the TLS trust to use.
 */
public class TokenCredentialOptions {
    private final AzureCloudInstance cloudInstance;
    private final Map<String, String> extraHeaders;
    private final Duration requestTimeout;
    private final String cacertPath;
    private final boolean disableTrust;

    private TokenCredentialOptions(AzureCloudInstance cloudInstance, Map<String, String> extraHeaders,
            Duration requestTimeout, String cacertPath, boolean disableTrust) {
        this.cloudInstance = cloudInstance;
        this.extraHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(extraHeaders));
        this.requestTimeout = requestTimeout;
        this.cacertPath = cacertPath;
        this.disableTrust = disableTrust;
    }

    public static TokenCredentialOptions from(IdentityConfiguration configuration) {
        return new TokenCredentialOptions(configuration.cloudInstance, configuration.extraHeaderParameters,
                configuration.requestTimeout, configuration.cacertPath, configuration.disableTrust);
    }

    public AzureCloudInstance getCloudInstance() {
        return cloudInstance;
    }

    public Map<String, String> getExtraHeaders() {
        return extraHeaders;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * PEM or DER file of a CA certificate to trust instead of the default trust store.
     */
    public String getCacertPath() {
        return cacertPath;
    }

    /**
     * Accept any server certificate. Only for testing against local endpoints.
     */
    public boolean isDisableTrust() {
        return disableTrust;
    }
}
