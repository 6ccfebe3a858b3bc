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

import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.VotingConfig;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.DuplicateException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.StateException;
import privatedao.core.dao.exceptions.ValidationException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.events.DaoCreated;
import privatedao.core.dao.state.events.DaoEvent;
import privatedao.core.dao.state.events.DaoEventListener;
import privatedao.core.dao.state.events.DaoEventLog;
import privatedao.core.dao.time.ManualHostClock;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class StateServiceTest {
    private DaoStateStore store;
    private DaoEventLog eventLog;
    private StateService stateService;
    private final Address key = Address.random();
    private final Address alice = Address.random();
    private final Address bob = Address.random();

    @Before
    public void setUp() {
        store = new DaoStateStore();
        eventLog = new DaoEventLog();
        stateService = new StateService(store, new ManualHostClock(1_000, 10), eventLog);
    }

    @Test
    public void testCommittedRequestIsVisibleToLaterRequests() throws DaoException {
        stateService.execute("write", transaction -> {
            transaction.createRecord(key, newConfig());
            transaction.emit(new DaoCreated(key, "name", alice));
            return null;
        });

        assertTrue(stateService.query(transaction -> transaction.findRecord(key, DaoConfig.TYPE)).isPresent());
        assertEquals(1, eventLog.getEvents(DaoCreated.class).size());
    }

    @Test
    public void testRejectedRequestLeavesNoTrace() throws DaoException {
        stateService.creditLamports(alice, 100);
        DaoEventListener listener = mock(DaoEventListener.class);
        eventLog.addListener(listener);

        try {
            stateService.execute("failing", transaction -> {
                transaction.createRecord(key, newConfig());
                transaction.transferLamports(alice, bob, 60);
                transaction.emit(new DaoCreated(key, "name", alice));
                throw new StateException(ErrorCode.DAO_NOT_FOUND);
            });
            fail("Expected StateException");
        } catch (StateException expected) {
            assertEquals(ErrorCode.DAO_NOT_FOUND, expected.getErrorCode());
        }

        assertFalse(stateService.query(transaction -> transaction.hasRecord(key)));
        assertEquals(100, stateService.getLamports(alice));
        assertEquals(0, stateService.getLamports(bob));
        assertTrue(eventLog.getEvents(DaoCreated.class).isEmpty());
        verify(listener, never()).onEvent(any(DaoEvent.class));
    }

    @Test
    public void testReadsSeeOwnWrites() throws DaoException {
        stateService.creditLamports(alice, 100);
        long bobBalance = stateService.execute("transfers", transaction -> {
            transaction.transferLamports(alice, bob, 30);
            transaction.transferLamports(bob, alice, 10);
            return transaction.getLamports(bob);
        });
        assertEquals(20, bobBalance);
        assertEquals(80, stateService.getLamports(alice));
    }

    @Test
    public void testSecondCreateOfSameKeyIsDuplicate() throws DaoException {
        stateService.execute("first", transaction -> {
            transaction.createRecord(key, newConfig());
            return null;
        });
        try {
            stateService.execute("second", transaction -> {
                transaction.createRecord(key, newConfig());
                return null;
            });
            fail("Expected DuplicateException");
        } catch (DuplicateException expected) {
            assertEquals(ErrorCode.RECORD_EXISTS, expected.getErrorCode());
        }
    }

    @Test
    public void testTransferBeyondBalanceIsRejected() throws DaoException {
        stateService.creditLamports(alice, 10);
        try {
            stateService.execute("overdraw", transaction -> {
                transaction.transferLamports(alice, bob, 11);
                return null;
            });
            fail("Expected ValidationException");
        } catch (ValidationException expected) {
            assertEquals(ErrorCode.INSUFFICIENT_FUNDS, expected.getErrorCode());
        }
        assertEquals(10, stateService.getLamports(alice));
    }

    @Test
    public void testFailingListenerDoesNotStopOthers() throws DaoException {
        DaoEventListener second = mock(DaoEventListener.class);
        eventLog.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        eventLog.addListener(second);

        stateService.execute("emit", transaction -> {
            transaction.emit(new DaoCreated(key, "name", alice));
            return null;
        });

        verify(second).onEvent(any(DaoCreated.class));
    }

    @Test
    public void testClockIsReadOncePerRequest() throws DaoException {
        ManualHostClock clock = new ManualHostClock(500, 5);
        StateService service = new StateService(store, clock, eventLog);
        long[] readings = service.execute("clock", transaction -> {
            long first = transaction.getUnixTimestamp();
            clock.advanceSeconds(100);
            return new long[]{first, transaction.getUnixTimestamp()};
        });
        assertEquals(readings[0], readings[1]);
    }

    private DaoConfig newConfig() {
        return new DaoConfig(alice, "name", Address.random(), 50, 0, 5, 0, VotingConfig.tokenWeighted(), 0, null);
    }
}
