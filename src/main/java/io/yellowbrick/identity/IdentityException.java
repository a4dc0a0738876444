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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Raised for every failure while building or sending an identity platform request.
 * <p>
 * Validation failures always name the offending parameter(s) so callers can report
 * exactly what is missing or inconsistent. Validation happens before any network I/O.
 */
public class IdentityException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        MISSING_REQUIRED_VALUE,
        CONFLICTING_VALUES,
        INVALID_VALUE,
        MALFORMED_URL,
        MISSING_REDIRECT_PAYLOAD,
        UPSTREAM_HTTP_ERROR,
        TIMEOUT,
        CANCELLED
    }

    private final Kind kind;
    private final List<String> fields;
    private final int statusCode;

    private IdentityException(Kind kind, String message, Throwable cause, int statusCode, String... fields) {
        super(message, cause);
        this.kind = kind;
        this.fields = Collections.unmodifiableList(Arrays.asList(fields));
        this.statusCode = statusCode;
    }

    public static IdentityException missingRequiredValue(String field) {
        return new IdentityException(Kind.MISSING_REQUIRED_VALUE,
                "Missing required value: " + field, null, -1, field);
    }

    public static IdentityException missingRequiredValue(String field, String message) {
        return new IdentityException(Kind.MISSING_REQUIRED_VALUE,
                "Missing required value: " + field + " - " + message, null, -1, field);
    }

    public static IdentityException conflictingValues(String fieldA, String fieldB) {
        return new IdentityException(Kind.CONFLICTING_VALUES,
                String.format("Conflicting values: %s and %s must not be set at the same time", fieldA, fieldB),
                null, -1, fieldA, fieldB);
    }

    public static IdentityException invalidValue(String field, String reason) {
        return new IdentityException(Kind.INVALID_VALUE,
                "Invalid value: " + field + " - " + reason, null, -1, field);
    }

    public static IdentityException malformedUrl(String url, Throwable cause) {
        return new IdentityException(Kind.MALFORMED_URL, "Malformed url: " + url, cause, -1);
    }

    public static IdentityException missingRedirectPayload(String url) {
        return new IdentityException(Kind.MISSING_REDIRECT_PAYLOAD,
                "No query or fragment returned on redirect, url: " + url, null, -1, "query", "fragment");
    }

    public static IdentityException upstream(String message, Throwable cause) {
        return new IdentityException(Kind.UPSTREAM_HTTP_ERROR, message, cause, -1);
    }

    public static IdentityException upstream(int statusCode, String error, String description) {
        return new IdentityException(Kind.UPSTREAM_HTTP_ERROR,
                "Invalid response: " + statusCode + ", error: " + error + ", description: " + description,
                null, statusCode);
    }

    public static IdentityException timeout(String message) {
        return new IdentityException(Kind.TIMEOUT, message, null, -1);
    }

    public static IdentityException cancelled(String message) {
        return new IdentityException(Kind.CANCELLED, message, null, -1);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The parameter names this failure refers to; empty for transport and timeout failures.
     */
    public List<String> getFields() {
        return fields;
    }

    /**
     * HTTP status of an upstream error response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
