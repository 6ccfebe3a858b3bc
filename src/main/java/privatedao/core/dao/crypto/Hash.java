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

package privatedao.core.dao.crypto;

import org.bitcoinj.core.Sha256Hash;

import java.io.ByteArrayOutputStream;

import java.nio.charset.StandardCharsets;

public class Hash {
    public static final int LENGTH = 32;

    public static byte[] getSha256Hash(byte[] data) {
        return Sha256Hash.hash(data);
    }

    /**
     * @return SHA-256 over the concatenation of all parts.
     */
    public static byte[] getSha256Hash(byte[]... parts) {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            outputStream.write(part, 0, part.length);
        }
        return Sha256Hash.hash(outputStream.toByteArray());
    }

    public static byte[] getSha256Hash(String data) {
        return Sha256Hash.hash(data.getBytes(StandardCharsets.UTF_8));
    }
}
