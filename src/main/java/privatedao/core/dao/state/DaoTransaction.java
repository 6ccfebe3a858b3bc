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

import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.DuplicateException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.events.DaoEvent;
import privatedao.core.dao.state.layout.PersistableRecord;
import privatedao.core.dao.state.layout.RecordType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * View on the store for a single request. Reads see the request's own writes. Nothing reaches the store before
 * {@link StateService} commits, so a rejected request leaves no trace.
 */
public class DaoTransaction {
    private final DaoStateStore store;
    // Clock reading of this request
    @Getter
    private final long unixTimestamp;
    @Getter
    private final long slot;

    private final Map<Address, AccountEntry> writeSet = new LinkedHashMap<>();
    private final List<DaoEvent> events = new ArrayList<>();

    DaoTransaction(DaoStateStore store, long unixTimestamp, long slot) {
        this.store = store;
        this.unixTimestamp = unixTimestamp;
        this.slot = slot;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Records
    ///////////////////////////////////////////////////////////////////////////////////////////

    public boolean hasRecord(Address key) {
        return getEntry(key).hasData();
    }

    /**
     * @return a fresh copy of the record, or empty if there is none or it is of another type.
     */
    public <T extends PersistableRecord> Optional<T> findRecord(Address key, RecordType<T> type) {
        AccountEntry entry = getEntry(key);
        if (!entry.hasData() || !type.matches(entry.getData()))
            return Optional.empty();
        return Optional.of(type.decode(entry.getData()));
    }

    public <T extends PersistableRecord> T getRecord(Address key, RecordType<T> type, ErrorCode notFound)
            throws DaoException {
        Optional<T> record = findRecord(key, type);
        if (!record.isPresent())
            throw DaoException.of(notFound, notFound.getMessage() + ". key=" + key);
        return record.get();
    }

    public void createRecord(Address key, PersistableRecord record) throws DuplicateException {
        if (hasRecord(key))
            throw new DuplicateException(ErrorCode.RECORD_EXISTS,
                    record.getRecordName() + " record already exists. key=" + key);
        putRecord(key, record);
    }

    public void putRecord(Address key, PersistableRecord record) {
        writeSet.put(key, getEntry(key).withData(record.serialize()));
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Lamports
    ///////////////////////////////////////////////////////////////////////////////////////////

    public long getLamports(Address key) {
        return getEntry(key).getLamports();
    }

    public void transferLamports(Address from, Address to, long amount) throws DaoException {
        DaoChecks.require(amount >= 0, ErrorCode.INVALID_AMOUNT);
        long fromBalance = getLamports(from);
        DaoChecks.require(fromBalance >= amount, ErrorCode.INSUFFICIENT_FUNDS);
        writeSet.put(from, getEntry(from).withLamports(fromBalance - amount));
        long toBalance = DaoChecks.add(getLamports(to), amount);
        writeSet.put(to, getEntry(to).withLamports(toBalance));
    }

    void creditLamports(Address key, long amount) throws DaoException {
        DaoChecks.require(amount > 0, ErrorCode.INVALID_AMOUNT);
        writeSet.put(key, getEntry(key).withLamports(DaoChecks.add(getLamports(key), amount)));
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Events
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void emit(DaoEvent event) {
        events.add(event);
    }

    List<DaoEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Package private
    ///////////////////////////////////////////////////////////////////////////////////////////

    void commit() {
        store.putAll(writeSet);
    }

    private AccountEntry getEntry(Address key) {
        AccountEntry written = writeSet.get(key);
        if (written != null)
            return written;
        return store.get(key).orElse(AccountEntry.EMPTY);
    }
}
