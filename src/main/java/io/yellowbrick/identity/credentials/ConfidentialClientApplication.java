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

import java.net.URI;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import io.yellowbrick.identity.IdentityException;

/**
 * One confidential client holding any kind of {@link TokenCredential}.
 *
 * <pre>{@code
 * ConfidentialClientApplication app = new ConfidentialClientApplication(
 *         ClientSecretCredential.builder(clientId)
 *                 .withTenant(tenantId)
 *                 .withClientSecret(secret)
 *                 .build());
 * TokenResponse token = app.getToken();
 * }</pre>
 *
 * A credential is not shared between in-flight requests; swap it with
 * {@link #withCredential(TokenCredential)} to redeem a refresh token.
 */
public class ConfidentialClientApplication {
    private final TokenCredential credential;
    private TokenRequestExecutor executor;

    public ConfidentialClientApplication(TokenCredential credential) {
        this.credential = Objects.requireNonNull(credential, "credential");
    }

    public ConfidentialClientApplication(TokenCredential credential, TokenRequestExecutor executor) {
        this.credential = Objects.requireNonNull(credential, "credential");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * A client for {@code credential} sharing this client's transport.
     */
    public ConfidentialClientApplication withCredential(TokenCredential credential) {
        return executor != null
                ? new ConfidentialClientApplication(credential, executor)
                : new ConfidentialClientApplication(credential);
    }

    public TokenCredential getCredential() {
        return credential;
    }

    public GrantKind kind() {
        return credential.kind();
    }

    public URI uri() throws IdentityException {
        return credential.uri();
    }

    public Map<String, String> form() throws IdentityException {
        return credential.form();
    }

    public Optional<BasicAuthCredentials> basicAuth() {
        return credential.basicAuth();
    }

    public TokenCredentialOptions options() {
        return credential.options();
    }

    /**
     * Sends the token request and returns the raw response, whatever its status.
     */
    public HttpResponse<String> execute() throws IdentityException {
        return executor().execute(credential);
    }

    public CompletableFuture<HttpResponse<String>> executeAsync() throws IdentityException {
        return executor().executeAsync(credential);
    }

    /**
     * Sends the token request and parses the response.
     *
     * @throws IdentityException {@code UPSTREAM_HTTP_ERROR} with the returned status,
     *         {@code error} and {@code error_description} on an error response
     */
    public TokenResponse getToken() throws IdentityException {
        return TokenRequestExecutor.toTokenResponse(execute());
    }

    public CompletableFuture<TokenResponse> getTokenAsync() throws IdentityException {
        return executeAsync().thenApply(response -> {
            try {
                return TokenRequestExecutor.toTokenResponse(response);
            } catch (IdentityException e) {
                throw new CompletionException(e);
            }
        });
    }

    private synchronized TokenRequestExecutor executor() throws IdentityException {
        if (executor == null) {
            executor = new TokenRequestExecutor(credential.options());
        }
        return executor;
    }
}
