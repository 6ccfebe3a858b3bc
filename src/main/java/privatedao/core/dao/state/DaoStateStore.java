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

import privatedao.core.dao.identity.Address;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Content addressed store of all DAO records. Keys are derived by {@link RecordKeys}, so a lookup never needs
 * an index beyond the map itself. Only {@link StateService} writes to it.
 */
public class DaoStateStore {
    private final Map<Address, AccountEntry> entries = new HashMap<>();

    Optional<AccountEntry> get(Address key) {
        return Optional.ofNullable(entries.get(key));
    }

    void putAll(Map<Address, AccountEntry> writeSet) {
        entries.putAll(writeSet);
    }

    public int size() {
        return entries.size();
    }
}
