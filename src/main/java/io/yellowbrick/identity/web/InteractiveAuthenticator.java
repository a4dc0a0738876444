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
package io.yellowbrick.identity.web;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.yellowbrick.identity.IdentityException;

/**
 * Runs the browser part of the authorization code flow: opens the authorization URL
 * and waits, for a bounded time, for the identity platform to redirect back to a
 * loopback address.
 *
 * <pre>{@code
 * AuthorizationQueryResponse response = AuthCodeAuthorizationUrlParameters.builder(clientId)
 *         .withRedirectUri("http://localhost:8000/redirect")
 *         .withScope("User.Read")
 *         .build()
 *         .interactiveAuthentication(new InteractiveAuthenticator(), Duration.ofMinutes(5));
 * }</pre>
 */
public class InteractiveAuthenticator {
    private static final Logger LOG = LoggerFactory.getLogger(InteractiveAuthenticator.class);

    private final BrowserLauncher browserLauncher;

    public InteractiveAuthenticator() {
        this(BrowserLauncher.system());
    }

    public InteractiveAuthenticator(BrowserLauncher browserLauncher) {
        this.browserLauncher = Objects.requireNonNull(browserLauncher, "browserLauncher");
    }

    /**
     * Opens {@code authorizationUrl} and blocks until the redirect arrives.
     *
     * @return the full redirect URL, including its query
     * @throws IdentityException {@code TIMEOUT} when nothing arrives within {@code timeout},
     *         {@code INVALID_VALUE} when the redirect URI is not a loopback http address
     */
    public String authenticate(URI authorizationUrl, URI redirectUri, Duration timeout) throws IdentityException {
        try (PendingRedirect pending = begin(authorizationUrl, redirectUri)) {
            return pending.await(timeout);
        }
    }

    /**
     * Starts listening on {@code redirectUri} and opens {@code authorizationUrl}. The
     * caller waits on, or cancels, the returned handle and must close it.
     */
    public PendingRedirect begin(URI authorizationUrl, URI redirectUri) throws IdentityException {
        checkLoopback(redirectUri);

        CompletableFuture<String> redirect = new CompletableFuture<>();
        RedirectCaptureServer server;
        try {
            server = new RedirectCaptureServer(redirectUri, redirect);
        } catch (IOException e) {
            throw IdentityException.invalidValue("redirect_uri",
                    "Could not listen on " + redirectUri + ": " + e.getMessage());
        }

        try {
            browserLauncher.browse(authorizationUrl);
        } catch (IOException e) {
            LOG.warn("Could not open a browser ({}), visit this URL to sign in: {}", e.getMessage(), authorizationUrl);
        }
        return new PendingRedirect(redirect, server);
    }

    static void checkLoopback(URI redirectUri) throws IdentityException {
        if (redirectUri == null || redirectUri.toString().isBlank()) {
            throw IdentityException.missingRequiredValue("redirect_uri");
        }
        String host = redirectUri.getHost() == null ? "" : redirectUri.getHost().toLowerCase(Locale.ROOT);
        boolean loopback = host.equals("localhost") || host.equals("127.0.0.1") || host.equals("[::1]");
        if (!"http".equalsIgnoreCase(redirectUri.getScheme()) || !loopback) {
            throw IdentityException.invalidValue("redirect_uri",
                    "Interactive authentication needs a loopback http redirect uri, got " + redirectUri);
        }
    }

    /**
     * A redirect that has not arrived yet.
     */
    public static final class PendingRedirect implements AutoCloseable {
        private final CompletableFuture<String> redirect;
        private final RedirectCaptureServer server;

        PendingRedirect(CompletableFuture<String> redirect, RedirectCaptureServer server) {
            this.redirect = redirect;
            this.server = server;
        }

        /**
         * Blocks until the redirect arrives, the timeout elapses or the wait is cancelled.
         */
        public String await(Duration timeout) throws IdentityException {
            try {
                return redirect.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw IdentityException.timeout("No redirect received within " + timeout.getSeconds() + " seconds");
            } catch (CancellationException e) {
                throw IdentityException.cancelled("Interactive authentication was cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw IdentityException.cancelled("Interrupted while waiting for the redirect");
            } catch (ExecutionException e) {
                throw IdentityException.upstream("Redirect capture failed: " + e.getCause(), e.getCause());
            }
        }

        /**
         * Stops waiting; a blocked {@link #await(Duration)} fails with {@code CANCELLED}.
         */
        public void cancel() {
            redirect.cancel(false);
        }

        public boolean isDone() {
            return redirect.isDone();
        }

        /**
         * The port the capture server is listening on.
         */
        public int getPort() {
            return server.getPort();
        }

        @Override
        public void close() {
            server.stop();
        }
    }
}
