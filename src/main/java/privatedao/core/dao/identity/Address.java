/*
 * This file is part of PrivateDAO.
 *
 * PrivateDAO is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * PrivateDAO is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with PrivateDAO. If not, see <http://www.gnu.org/licenses/>.
 */

package privatedao.core.dao.identity;

import org.bitcoinj.core.Base58;
import org.bitcoinj.core.Utils;

import java.security.SecureRandom;

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A 32 byte identity. Used for members, authorities, token mints and for the keys of stored records,
 * which are derived deterministically from the identities they belong to (see
 * {@link privatedao.core.dao.state.RecordKeys}).
 */
@Immutable
public final class Address {
    public static final int LENGTH = 32;

    // All zero. Never a valid recipient.
    public static final Address DEFAULT = new Address(new byte[LENGTH]);

    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Address of(byte[] bytes) {
        checkNotNull(bytes, "bytes must not be null");
        checkArgument(bytes.length == LENGTH, "Address must be %s bytes but was %s", LENGTH, bytes.length);
        return new Address(bytes.clone());
    }

    public static Address fromBase58(String base58) {
        return of(Base58.decode(base58));
    }

    public static Address fromHex(String hex) {
        return of(Utils.HEX.decode(hex));
    }

    public static Address random() {
        byte[] bytes = new byte[LENGTH];
        RANDOM.nextBytes(bytes);
        return new Address(bytes);
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public boolean isDefault() {
        return equals(DEFAULT);
    }

    public String toHex() {
        return Utils.HEX.encode(bytes);
    }

    public String toBase58() {
        return Base58.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        return Arrays.equals(bytes, ((Address) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
