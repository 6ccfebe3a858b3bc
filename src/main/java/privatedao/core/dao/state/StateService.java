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

import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.events.DaoEventLog;
import privatedao.core.dao.time.HostClock;

import javax.inject.Inject;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies requests to the {@link DaoStateStore} one at a time. Each request reads the clock once, sees a consistent
 * state and either commits all of its writes and events or none.
 */
@Slf4j
public class StateService {
    private final DaoStateStore store;
    private final HostClock hostClock;
    private final DaoEventLog eventLog;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public StateService(DaoStateStore store, HostClock hostClock, DaoEventLog eventLog) {
        this.store = store;
        this.hostClock = hostClock;
        this.eventLog = eventLog;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    public synchronized <T> T execute(String requestName, StateTransition<T> transition) throws DaoException {
        DaoTransaction transaction = newTransaction();
        T result;
        try {
            result = transition.apply(transaction);
        } catch (DaoException e) {
            log.warn("{} rejected. errorCode={}, message={}", requestName, e.getErrorCode(), e.getMessage());
            throw e;
        }
        transaction.commit();
        eventLog.append(transaction.getEvents());
        log.debug("{} committed", requestName);
        return result;
    }

    /**
     * Runs a read only request. Writes it might do are discarded.
     */
    public synchronized <T> T query(StateTransition<T> transition) throws DaoException {
        return transition.apply(newTransaction());
    }

    /**
     * Funds a key with native lamports from outside the system, e.g. a faucet or a bridge of the host.
     */
    public void creditLamports(Address key, long amount) throws DaoException {
        execute("creditLamports", transaction -> {
            transaction.creditLamports(key, amount);
            return null;
        });
    }

    public long getLamports(Address key) {
        try {
            return query(transaction -> transaction.getLamports(key));
        } catch (DaoException e) {
            // getLamports does not reject
            throw new IllegalStateException(e);
        }
    }

    public DaoEventLog getEventLog() {
        return eventLog;
    }

    private DaoTransaction newTransaction() {
        return new DaoTransaction(store, hostClock.getUnixTimestamp(), hostClock.getSlot());
    }
}
