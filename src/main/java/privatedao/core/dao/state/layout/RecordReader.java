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

package privatedao.core.dao.state.layout;

import privatedao.core.dao.identity.Address;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import java.util.Arrays;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Counterpart of {@link RecordWriter}.
 */
public class RecordReader {
    private final ByteBuffer buffer;

    public RecordReader(String recordName, int size, byte[] data) {
        checkArgument(data.length == size, "%s must be %s bytes but was %s", recordName, size, data.length);
        buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        byte[] header = new byte[Discriminator.LENGTH];
        buffer.get(header);
        checkArgument(Arrays.equals(header, Discriminator.forRecord(recordName)),
                "Data is not a %s record", recordName);
    }

    public Address readAddress() {
        return Address.of(readBytes(Address.LENGTH));
    }

    @Nullable
    public Address readOptionalAddress() {
        boolean present = readBoolean();
        Address address = readAddress();
        return present ? address : null;
    }

    public byte[] readBytes(int length) {
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    public int readU8() {
        return buffer.get() & 0xFF;
    }

    @Nullable
    public Integer readOptionalU8() {
        boolean present = readBoolean();
        int value = readU8();
        return present ? value : null;
    }

    public boolean readBoolean() {
        return buffer.get() != 0;
    }

    public long readLong() {
        return buffer.getLong();
    }

    @Nullable
    public Long readOptionalLong() {
        boolean present = readBoolean();
        long value = readLong();
        return present ? value : null;
    }

    public String readString(int maxBytes) {
        int length = buffer.getInt();
        checkArgument(length >= 0 && length <= maxBytes, "invalid string length %s", length);
        String value = new String(readBytes(length), StandardCharsets.UTF_8);
        buffer.position(buffer.position() + maxBytes - length);
        return value;
    }

    public RecordReader skip(int numBytes) {
        buffer.position(buffer.position() + numBytes);
        return this;
    }
}
