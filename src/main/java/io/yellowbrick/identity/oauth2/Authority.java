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

import java.util.Objects;

import io.yellowbrick.identity.IdentityConstants;

/**
 * The directory realm segment of the identity platform endpoints: a specific tenant,
 * or one of the shared realms {@code common}, {@code organizations}, {@code consumers}
 * and {@code adfs}.
 */
public final class Authority {
    public static final Authority COMMON = new Authority(IdentityConstants.IDENTITY_AUTHORITY_COMMON, false);
    public static final Authority ORGANIZATIONS = new Authority(IdentityConstants.IDENTITY_AUTHORITY_ORGANIZATIONS, false);
    public static final Authority CONSUMERS = new Authority(IdentityConstants.IDENTITY_AUTHORITY_CONSUMERS, false);
    public static final Authority AZURE_DIRECTORY_FEDERATED_SERVICES = new Authority(IdentityConstants.IDENTITY_AUTHORITY_ADFS, false);

    private final String realm;
    private final boolean tenant;

    private Authority(String realm, boolean tenant) {
        this.realm = realm;
        this.tenant = tenant;
    }

    public static Authority tenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        return new Authority(tenantId.trim(), true);
    }

    /**
     * Maps the literal shared realm names back to their constants; anything else is a tenant id.
     */
    public static Authority parse(String value) {
        if (value == null || value.isBlank()) {
            return COMMON;
        }
        switch (value.trim().toLowerCase()) {
            case IdentityConstants.IDENTITY_AUTHORITY_COMMON:
                return COMMON;
            case IdentityConstants.IDENTITY_AUTHORITY_ORGANIZATIONS:
                return ORGANIZATIONS;
            case IdentityConstants.IDENTITY_AUTHORITY_CONSUMERS:
                return CONSUMERS;
            case IdentityConstants.IDENTITY_AUTHORITY_ADFS:
                return AZURE_DIRECTORY_FEDERATED_SERVICES;
            default:
                return tenant(value);
        }
    }

    public String realm() {
        return realm;
    }

    public boolean isTenant() {
        return tenant;
    }

    public boolean isFederatedServices() {
        return this == AZURE_DIRECTORY_FEDERATED_SERVICES;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Authority)) {
            return false;
        }
        Authority other = (Authority) o;
        return tenant == other.tenant && realm.equals(other.realm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(realm, tenant);
    }

    @Override
    public String toString() {
        return realm;
    }
}
