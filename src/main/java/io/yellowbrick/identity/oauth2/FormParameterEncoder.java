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

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes and decodes key-value pairs in the {@code application/x-www-form-urlencoded}
 * format used by the identity platform for authorization query strings, token request
 * bodies and redirect payloads.
 * <p>
 * Only characters outside the RFC 3986 unreserved set are percent-encoded (as UTF-8),
 * spaces become {@code +}, and {@code :} and {@code /} are kept as-is so that values such
 * as {@code urn:ietf:params:oauth:client-assertion-type:jwt-bearer} or a redirect URI stay
 * readable. See
 * <a href="https://url.spec.whatwg.org/#urlencoded-serializing">WHATWG URL Standard: application/x-www-form-urlencoded serializing</a>
 * and <a href="https://www.rfc-editor.org/rfc/rfc6749.html#appendix-B">RFC 6749, Appendix B</a>.
 *
 * <p><strong>Example usage:</strong>
 * <pre>{@code
 * Map<String, String> params = new LinkedHashMap<>();
 * params.put("client_id", "abc");
 * params.put("scope", "User.Read offline_access");
 * String body = FormParameterEncoder.toFormEncoding(params);
 * // Output: client_id=abc&scope=User.Read+offline_access
 * }</pre>
 */
public final class FormParameterEncoder {

    private FormParameterEncoder() {
    }

    /**
     * Encodes the entries in the map's iteration order.
     */
    public static String toFormEncoding(Map<String, ?> params) {
        StringBuilder result = new StringBuilder();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            appendPair(result, entry.getKey(), String.valueOf(entry.getValue()));
        }
        return result.toString();
    }

    /**
     * Appends {@code name=value} to the sink, preceded by {@code &} unless the sink is empty.
     */
    public static void appendPair(StringBuilder sink, String name, String value) {
        if (sink.length() > 0) {
            sink.append('&');
        }
        sink.append(encodeValue(name, StandardCharsets.UTF_8));
        sink.append('=');
        sink.append(encodeValue(value, StandardCharsets.UTF_8));
    }

    static String encodeValue(String s, Charset charset) {
        StringBuilder encoded = new StringBuilder();
        s.codePoints().forEach(cp -> {
            if (cp < 0x80 && isSafeChar((char) cp)) {
                encoded.append((char) cp);
            } else if (cp == ' ') {
                encoded.append('+');
            } else {
                byte[] bytes = new String(Character.toChars(cp)).getBytes(charset);
                for (byte b : bytes) {
                    encoded.append('%');
                    encoded.append(String.format("%02X", b));
                }
            }
        });
        return encoded.toString();
    }

    static boolean isSafeChar(char c) {
        // Per RFC 3986, unreserved = ALPHA / DIGIT / "-" / "." / "_" / "~"
        // ':' and '/' are kept for URNs and redirect URIs
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                (c >= '0' && c <= '9') ||
                c == '-' || c == '.' || c == '_' || c == '~' ||
                c == ':' || c == '/';
    }

    /**
     * Decodes a query string or fragment into its pairs, keeping their order. A repeated
     * name keeps its last value; a pair without {@code =} decodes to an empty value.
     *
     * @throws IllegalArgumentException on a truncated or invalid percent escape
     */
    public static Map<String, String> fromFormEncoding(String encoded) {
        Map<String, String> result = new LinkedHashMap<>();
        if (encoded == null || encoded.isEmpty()) {
            return result;
        }
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            result.put(decodeValue(name, StandardCharsets.UTF_8), decodeValue(value, StandardCharsets.UTF_8));
        }
        return result;
    }

    static String decodeValue(String s, Charset charset) {
        StringBuilder decoded = new StringBuilder();
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '%') {
                if (i + 2 >= s.length()) {
                    throw new IllegalArgumentException("Truncated escape at index " + i + " in: " + s);
                }
                int hi = Character.digit(s.charAt(i + 1), 16);
                int lo = Character.digit(s.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new IllegalArgumentException("Invalid escape at index " + i + " in: " + s);
                }
                pending.write((hi << 4) | lo);
                i += 3;
                continue;
            }
            if (pending.size() > 0) {
                decoded.append(new String(pending.toByteArray(), charset));
                pending.reset();
            }
            decoded.append(c == '+' ? ' ' : c);
            i++;
        }
        if (pending.size() > 0) {
            decoded.append(new String(pending.toByteArray(), charset));
        }
        return decoded.toString();
    }
}
