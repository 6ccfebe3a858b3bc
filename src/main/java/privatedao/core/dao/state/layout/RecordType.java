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

import java.util.Arrays;
import java.util.function.Function;

import lombok.Getter;

/**
 * Ties a record name and size to its decoder so stored bytes can be checked before they are decoded.
 */
public class RecordType<T extends PersistableRecord> {
    @Getter
    private final String recordName;
    @Getter
    private final int size;
    private final Function<byte[], T> decoder;
    private final byte[] discriminator;

    public RecordType(String recordName, int size, Function<byte[], T> decoder) {
        this.recordName = recordName;
        this.size = size;
        this.decoder = decoder;
        this.discriminator = Discriminator.forRecord(recordName);
    }

    public boolean matches(byte[] data) {
        return data.length == size &&
                Arrays.equals(Arrays.copyOf(data, Discriminator.LENGTH), discriminator);
    }

    public T decode(byte[] data) {
        return decoder.apply(data);
    }
}
