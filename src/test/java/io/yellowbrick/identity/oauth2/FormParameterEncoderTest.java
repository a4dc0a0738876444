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

import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormParameterEncoderTest {

    @Test
    void testToFormEncoding_keepsInsertionOrder() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("scope", "User.Read offline_access");
        params.put("client_id", "my-client-id");
        assertEquals("scope=User.Read+offline_access&client_id=my-client-id",
                FormParameterEncoder.toFormEncoding(params));
    }

    @Test
    void testToFormEncoding_withSpecialChars() {
        String encoded = FormParameterEncoder.toFormEncoding(Map.of("state", "value with spaces & symbols!"));
        assertParamsEqual("state=value+with+spaces+%26+symbols%21", encoded);
    }

    @Test
    void testToFormEncoding_withColonAndSlash() {
        String encoded = FormParameterEncoder
                .toFormEncoding(Map.of("client_assertion_type", "urn:ietf:params:oauth:client-assertion-type:jwt-bearer"));
        assertEquals("client_assertion_type=urn:ietf:params:oauth:client-assertion-type:jwt-bearer", encoded);
    }

    @Test
    void testToFormEncoding_unicodeCharacters() {
        String encoded = FormParameterEncoder.toFormEncoding(Map.of("login_hint", "你好 世界"));
        assertEquals("login_hint=%E4%BD%A0%E5%A5%BD+%E4%B8%96%E7%95%8C", encoded);
    }

    @Test
    void testEncodeValue_supplementaryCharacter() {
        assertEquals("%F0%9F%94%91", FormParameterEncoder.encodeValue("🔑", StandardCharsets.UTF_8));
    }

    @Test
    void testEncodeValue_safeCharacters() {
        String input = "abcABC123-._~:/";
        assertEquals(input, FormParameterEncoder.encodeValue(input, StandardCharsets.UTF_8));
    }

    @Test
    void testEncodeValue_spaceAndSymbols() {
        String encoded = FormParameterEncoder.encodeValue("value with spaces & things!", StandardCharsets.UTF_8);
        assertEquals("value+with+spaces+%26+things%21", encoded);
    }

    @Test
    void testIsSafeChar() {
        for (char c : "abcABC123-._~:/".toCharArray()) {
            assertTrue(FormParameterEncoder.isSafeChar(c), "Expected safe: " + c);
        }
        for (char c : "!@#$%^&*()[]{}+=?".toCharArray()) {
            assertFalse(FormParameterEncoder.isSafeChar(c), "Expected unsafe: " + c);
        }
    }

    @Test
    void testFromFormEncoding_decodesPairs() {
        Map<String, String> decoded = FormParameterEncoder
                .fromFormEncoding("code=abc%2F123&state=a+b&session_state=x%3Dy");
        assertEquals("abc/123", decoded.get("code"));
        assertEquals("a b", decoded.get("state"));
        assertEquals("x=y", decoded.get("session_state"));
    }

    @Test
    void testFromFormEncoding_multibyte() {
        Map<String, String> decoded = FormParameterEncoder.fromFormEncoding("greeting=%E4%BD%A0%E5%A5%BD");
        assertEquals("你好", decoded.get("greeting"));
    }

    @Test
    void testFromFormEncoding_lastValueWinsAndMissingValueIsEmpty() {
        Map<String, String> decoded = FormParameterEncoder.fromFormEncoding("state=1&state=2&flag&&");
        assertEquals("2", decoded.get("state"));
        assertEquals("", decoded.get("flag"));
        assertEquals(2, decoded.size());
    }

    @Test
    void testFromFormEncoding_emptyInput() {
        assertTrue(FormParameterEncoder.fromFormEncoding("").isEmpty());
        assertTrue(FormParameterEncoder.fromFormEncoding(null).isEmpty());
    }

    @Test
    void testDecodeValue_invalidEscape() {
        assertThrows(IllegalArgumentException.class,
                () -> FormParameterEncoder.decodeValue("abc%2", StandardCharsets.UTF_8));
        assertThrows(IllegalArgumentException.class,
                () -> FormParameterEncoder.decodeValue("abc%zz", StandardCharsets.UTF_8));
    }

    @Test
    void testEncodeThenDecode_matchesJdkDecoder() {
        String value = "https://localhost:8000/redirect?x=1&y=✓";
        String encoded = FormParameterEncoder.encodeValue(value, StandardCharsets.UTF_8);
        assertEquals(value, URLDecoder.decode(encoded, StandardCharsets.UTF_8));
        assertEquals(value, FormParameterEncoder.decodeValue(encoded, StandardCharsets.UTF_8));
    }

    private void assertParamsEqual(String p1, String p2) {
        assertEquals(decodeForm(p1), decodeForm(p2));
    }

    private Map<String, String> decodeForm(String encoded) {
        Map<String, String> result = new HashMap<>();
        String[] pairs = encoded.split("&");
        for (String pair : pairs) {
            String[] parts = pair.split("=", 2);
            String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            String value = parts.length > 1 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
            result.put(key, value);
        }
        return result;
    }
}
