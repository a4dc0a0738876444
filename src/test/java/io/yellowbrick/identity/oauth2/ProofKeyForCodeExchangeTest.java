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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ProofKeyForCodeExchangeTest {

    @Test
    void testS256_knownVector() {
        // RFC 7636, Appendix B
        assertEquals("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM",
                ProofKeyForCodeExchange.s256("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"));
    }

    @Test
    void testGenerate() {
        ProofKeyForCodeExchange pkce = ProofKeyForCodeExchange.generate();
        assertEquals(43, pkce.getCodeVerifier().length());
        assertEquals(ProofKeyForCodeExchange.METHOD_S256, pkce.getCodeChallengeMethod());
        assertEquals(ProofKeyForCodeExchange.s256(pkce.getCodeVerifier()), pkce.getCodeChallenge());
        assertTrue(pkce.getCodeVerifier().matches("[A-Za-z0-9_-]+"));
        assertFalse(pkce.toString().contains(pkce.getCodeVerifier()));
    }

    @Test
    void testSecureRandom32_unique() {
        assertNotEquals(ProofKeyForCodeExchange.secureRandom32(), ProofKeyForCodeExchange.secureRandom32());
    }
}
