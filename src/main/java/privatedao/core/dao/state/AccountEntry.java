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

package privatedao.core.dao.state;

import lombok.Value;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Content stored under one key: a native lamport balance and an optional fixed size record.
 */
@Immutable
@Value
public class AccountEntry {
    public static final AccountEntry EMPTY = new AccountEntry(0, null);

    long lamports;
    @Nullable
    byte[] data;

    public AccountEntry withLamports(long lamports) {
        return new AccountEntry(lamports, data);
    }

    public AccountEntry withData(byte[] data) {
        return new AccountEntry(lamports, data);
    }

    public boolean hasData() {
        return data != null;
    }
}
