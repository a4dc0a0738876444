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
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * Listens on a loopback redirect URI and completes a future with the first redirect
 * that reaches it.
 * <p>
 * Query and {@code form_post} responses are captured directly. Browsers never send the
 * fragment, so a redirect without a query is answered with a page that resubmits the
 * fragment as the query; if there is no fragment either, the page posts back an empty
 * body and the bare redirect URL is delivered.
 */
public class RedirectCaptureServer {
    private static final Logger LOG = LoggerFactory.getLogger(RedirectCaptureServer.class);

    private final HttpServer server;
    private final URI redirectUri;

    public RedirectCaptureServer(URI redirectUri, CompletableFuture<String> redirect) throws IOException {
        this.redirectUri = redirectUri;
        int port = redirectUri.getPort() != -1 ? redirectUri.getPort() : 80;
        String path = redirectUri.getRawPath() == null || redirectUri.getRawPath().isEmpty()
                ? "/"
                : redirectUri.getRawPath();
        server = HttpServer.create(new InetSocketAddress(redirectUri.getHost(), port), 0);
        server.createContext(path, new RedirectHandler(redirectUri, redirect));
        server.setExecutor(null);
        server.start();
        LOG.debug("Redirect capture server started on {}", redirectUri);
    }

    /**
     * The port actually bound, useful when the redirect URI asked for port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public URI getRedirectUri() {
        return redirectUri;
    }

    public void stop() {
        server.stop(0);
        LOG.debug("Redirect capture server stopped");
    }

    static class RedirectHandler implements HttpHandler {
        private final URI redirectUri;
        private final CompletableFuture<String> redirect;

        RedirectHandler(URI redirectUri, CompletableFuture<String> redirect) {
            this.redirectUri = redirectUri;
            this.redirect = redirect;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            // The bound port, which differs from the redirect URI's when it asked for port 0
            int port = exchange.getLocalAddress().getPort();
            String authority = redirectUri.getPort() == -1 && port == 80
                    ? redirectUri.getRawAuthority()
                    : redirectUri.getHost() + ":" + port;
            String base = redirectUri.getScheme() + "://" + authority + exchange.getRequestURI().getRawPath();
            String query = exchange.getRequestURI().getRawQuery();

            if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                String body;
                try (InputStream in = exchange.getRequestBody()) {
                    body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
                redirect.complete(body.isEmpty() ? base : base + "?" + body);
                respond(exchange, loadTemplate("redirect-complete.html"));
            } else if (query != null) {
                redirect.complete(base + "?" + query);
                respond(exchange, loadTemplate("redirect-complete.html"));
            } else {
                respond(exchange, loadTemplate("redirect-fragment.html"));
            }
        }

        private static void respond(HttpExchange exchange, String response) throws IOException {
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=UTF-8");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }

        private String loadTemplate(String name) throws IOException {
            try (InputStream in = getClass().getResourceAsStream(name)) {
                if (in == null) {
                    throw new IOException(name + " not found");
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
    }
}
