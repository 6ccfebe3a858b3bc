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

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Writes a record into a buffer of fixed size. Integers are little endian, strings are length prefixed and padded
 * to their maximum, optional values take a presence byte plus a value slot which is zeroed when absent.
 */
public class RecordWriter {
    private final ByteBuffer buffer;

    public RecordWriter(String recordName, int size) {
        buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(Discriminator.forRecord(recordName));
    }

    public RecordWriter writeAddress(Address address) {
        buffer.put(address.getBytes());
        return this;
    }

    public RecordWriter writeOptionalAddress(@Nullable Address address) {
        buffer.put((byte) (address != null ? 1 : 0));
        buffer.put(address != null ? address.getBytes() : new byte[Address.LENGTH]);
        return this;
    }

    public RecordWriter writeBytes(byte[] bytes) {
        buffer.put(bytes);
        return this;
    }

    public RecordWriter writeU8(int value) {
        checkArgument(value >= 0 && value <= 0xFF, "value out of u8 range: %s", value);
        buffer.put((byte) value);
        return this;
    }

    public RecordWriter writeOptionalU8(@Nullable Integer value) {
        buffer.put((byte) (value != null ? 1 : 0));
        return writeU8(value != null ? value : 0);
    }

    public RecordWriter writeBoolean(boolean value) {
        buffer.put((byte) (value ? 1 : 0));
        return this;
    }

    public RecordWriter writeLong(long value) {
        buffer.putLong(value);
        return this;
    }

    public RecordWriter writeOptionalLong(@Nullable Long value) {
        buffer.put((byte) (value != null ? 1 : 0));
        buffer.putLong(value != null ? value : 0L);
        return this;
    }

    public RecordWriter writeString(String value, int maxBytes) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        checkArgument(bytes.length <= maxBytes, "string exceeds %s bytes", maxBytes);
        buffer.putInt(bytes.length);
        buffer.put(bytes);
        buffer.position(buffer.position() + maxBytes - bytes.length);
        return this;
    }

    public RecordWriter skip(int numBytes) {
        buffer.position(buffer.position() + numBytes);
        return this;
    }

    public byte[] toByteArray() {
        checkState(!buffer.hasRemaining(), "Record layout not filled. %s bytes remaining", buffer.remaining());
        return buffer.array();
    }
}
