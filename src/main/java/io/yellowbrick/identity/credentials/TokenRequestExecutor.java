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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.yellowbrick.identity.IdentityException;
import io.yellowbrick.identity.oauth2.FormParameterEncoder;
import io.yellowbrick.identity.oauth2.OAuthSerializer;

/**
 * Sends a {@link TokenCredential} to its token endpoint as a single form POST.
 * <p>
 * The request is validated before anything is sent. There are no retries: a transport
 * failure or error status is reported to the caller once.
 */
public class TokenRequestExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(TokenRequestExecutor.class);
    private static final String ENCODING_JSON = "application/json";
    private static final String ENCODING_FORM_URLENCODED = "application/x-www-form-urlencoded";

    private final HttpClient httpClient;

    public TokenRequestExecutor(TokenCredentialOptions options) throws IdentityException {
        this(createHttpClient(options));
    }

    public TokenRequestExecutor(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * The POST for {@code credential}: form body, JSON accept, the Basic authorization
     * pair when the credential has one, and any extra headers.
     *
     * @throws IdentityException when the credential is invalid
     */
    public HttpRequest buildRequest(TokenCredential credential) throws IdentityException {
        Map<String, String> form = credential.form();
        URI uri = credential.uri();
        TokenCredentialOptions options = credential.options();

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", ENCODING_FORM_URLENCODED)
                .header("Accept", ENCODING_JSON)
                .timeout(options.getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(FormParameterEncoder.toFormEncoding(form)));
        credential.basicAuth().ifPresent(pair -> request.header("Authorization", pair.toHeaderValue()));
        for (Map.Entry<String, String> header : options.getExtraHeaders().entrySet()) {
            request.header(header.getKey(), header.getValue());
        }

        LOG.debug("Token request {} to {} with payload {}", credential.kind(), uri, OAuthSerializer.redact(form));
        return request.build();
    }

    /**
     * Sends the request and waits for the response.
     *
     * @throws IdentityException on validation failure, or {@code UPSTREAM_HTTP_ERROR} when
     *         no response could be read
     */
    public HttpResponse<String> execute(TokenCredential credential) throws IdentityException {
        HttpRequest request = buildRequest(credential);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOG.debug("Token response: {}", response.statusCode());
            return response;
        } catch (IOException e) {
            throw IdentityException.upstream("Token request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw IdentityException.upstream("Token request to " + request.uri() + " was interrupted", e);
        }
    }

    /**
     * Validates now, then sends without blocking. The future fails with a
     * {@link CompletionException} wrapping an {@code UPSTREAM_HTTP_ERROR}
     * {@link IdentityException} when no response could be read.
     */
    public CompletableFuture<HttpResponse<String>> executeAsync(TokenCredential credential)
            throws IdentityException {
        HttpRequest request = buildRequest(credential);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        throw new CompletionException(IdentityException.upstream(
                                "Token request to " + request.uri() + " failed: " + cause.getMessage(), cause));
                    }
                    LOG.debug("Token response: {}", response.statusCode());
                    return response;
                });
    }

    /**
     * Parses a 2xx response body, or turns an error status into {@code UPSTREAM_HTTP_ERROR}
     * carrying the status, {@code error} and {@code error_description}.
     */
    public static TokenResponse toTokenResponse(HttpResponse<String> response) throws IdentityException {
        Map<String, Object> content = toJSONResponse(response);
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw IdentityException.upstream(status, String.valueOf(content.get("error")),
                    String.valueOf(content.get("error_description")));
        }
        if (content.containsKey("error") && !content.containsKey("access_token") && !content.containsKey("id_token")) {
            throw IdentityException.upstream(status, String.valueOf(content.get("error")),
                    String.valueOf(content.get("error_description")));
        }
        return TokenResponse.fromJSONObject(new JSONObject(content));
    }

    private static Map<String, Object> toJSONResponse(HttpResponse<String> response) {
        try {
            return new JSONObject(response.body()).toMap();
        } catch (JSONException e) {
            Map<String, Object> content = new HashMap<>();
            content.put("error", response.body());
            content.put("error_description", "(content returned was not JSON)");
            return content;
        }
    }

    static HttpClient createHttpClient(TokenCredentialOptions options) throws IdentityException {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(options.getRequestTimeout());
        if (options.isDisableTrust() || options.getCacertPath() != null) {
            builder.sslContext(createSSLContext(options));
        }
        return builder.build();
    }

    private static SSLContext createSSLContext(TokenCredentialOptions options) throws IdentityException {
        try {
            if (options.isDisableTrust()) {
                LOG.warn("Server certificate validation is disabled for token requests");
                return createAllTrustingSSLContext();
            }
            return createCustomCaSslContext(options.getCacertPath());
        } catch (Exception e) {
            throw IdentityException.upstream("Could not create TLS context: " + e.getMessage(), e);
        }
    }

    private static SSLContext createAllTrustingSSLContext() throws Exception {
        TrustManager[] trustAllCerts = new TrustManager[] {
                new X509TrustManager() {
                    public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    }

                    public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    }

                    public X509Certificate[] getAcceptedIssuers() {
                        return new X509Certificate[0];
                    }
                }
        };
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, trustAllCerts, new SecureRandom());
        return sslContext;
    }

    private static SSLContext createCustomCaSslContext(String cacertPath) throws Exception {
        CertificateFactory cf = CertificateFactory.getInstance("X.509");
        try (InputStream caInput = new FileInputStream(cacertPath)) {
            KeyStore ks = KeyStore.getInstance(KeyStore.getDefaultType());
            ks.load(null, null);
            int i = 0;
            for (java.security.cert.Certificate cert : cf.generateCertificates(caInput)) {
                ks.setCertificateEntry("custom-ca-" + i++, cert);
            }

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(ks);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        }
    }
}
