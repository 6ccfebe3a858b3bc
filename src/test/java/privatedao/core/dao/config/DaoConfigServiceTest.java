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

package privatedao.core.dao.config;

import privatedao.core.dao.DaoTestFixture;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.DuplicateException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.ValidationException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.events.DaoCreated;
import privatedao.core.dao.state.events.DaoMigrated;

import org.apache.commons.lang3.StringUtils;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class DaoConfigServiceTest {
    private DaoTestFixture fixture;
    private DaoConfigService service;
    private Address authority;
    private Address token;

    @Before
    public void setUp() {
        fixture = new DaoTestFixture();
        service = fixture.daoConfigService;
        authority = fixture.authority;
        token = fixture.governanceToken;
    }

    @Test
    public void testCreateConfig() throws DaoException {
        Address daoKey = service.createConfig(authority, "grants", token, 40, 500, 60, 86_400,
                VotingConfig.quadratic());

        assertEquals(RecordKeys.getDaoKey(authority, "grants"), daoKey);
        DaoConfig daoConfig = service.findConfig(daoKey).get();
        assertEquals(authority, daoConfig.getAuthority());
        assertEquals("grants", daoConfig.getName());
        assertEquals(40, daoConfig.getQuorumPercentage());
        assertEquals(500, daoConfig.getRequiredBalance());
        assertEquals(VotingMode.QUADRATIC, daoConfig.getVotingConfig().getMode());
        assertEquals(0, daoConfig.getProposalCount());
        assertNull(daoConfig.getMigratedFrom());
        assertEquals(1, fixture.eventLog.getEvents(DaoCreated.class).size());
    }

    @Test
    public void testSameNameOfSameAuthorityIsDuplicate() throws DaoException {
        service.createConfig(authority, "grants", token, 40, 0, 60, 0, VotingConfig.tokenWeighted());
        try {
            service.createConfig(authority, "grants", token, 60, 0, 60, 0, VotingConfig.tokenWeighted());
            fail("Expected DuplicateException");
        } catch (DuplicateException expected) {
            assertEquals(ErrorCode.RECORD_EXISTS, expected.getErrorCode());
        }
        // Another authority may reuse the name
        service.createConfig(Address.random(), "grants", token, 60, 0, 60, 0, VotingConfig.tokenWeighted());
    }

    @Test
    public void testValidation() {
        assertRejected(ErrorCode.NAME_TOO_LONG, StringUtils.repeat('n', 65), 50, 0, 60, 0,
                VotingConfig.tokenWeighted());
        // 22 three byte characters exceed 64 bytes
        assertRejected(ErrorCode.NAME_TOO_LONG, StringUtils.repeat('€', 22), 50, 0, 60, 0,
                VotingConfig.tokenWeighted());
        assertRejected(ErrorCode.INVALID_QUORUM, "dao", 0, 0, 60, 0, VotingConfig.tokenWeighted());
        assertRejected(ErrorCode.INVALID_QUORUM, "dao", 101, 0, 60, 0, VotingConfig.tokenWeighted());
        assertRejected(ErrorCode.INVALID_REQUIRED_BALANCE, "dao", 50, -1, 60, 0, VotingConfig.tokenWeighted());
        assertRejected(ErrorCode.REVEAL_WINDOW_TOO_SHORT, "dao", 50, 0, 4, 0, VotingConfig.tokenWeighted());
        assertRejected(ErrorCode.INVALID_EXECUTION_DELAY, "dao", 50, 0, 60, -1, VotingConfig.tokenWeighted());
        assertRejected(ErrorCode.INVALID_THRESHOLD, "dao", 50, 0, 60, 0, VotingConfig.dualChamber(0, 50));
        assertRejected(ErrorCode.INVALID_THRESHOLD, "dao", 50, 0, 60, 0, VotingConfig.dualChamber(50, 101));
        // Only the funded authority
        assertEquals(1, fixture.store.size());
    }

    @Test
    public void testBoundaryValuesAreAccepted() throws DaoException {
        service.createConfig(authority, StringUtils.repeat('n', 64), token, 100, 0, 5, 0,
                VotingConfig.dualChamber(100, 1));
        service.createConfig(authority, "", token, 1, 0, 5, 0, VotingConfig.tokenWeighted());
    }

    @Test
    public void testMigrateConfig() throws DaoException {
        Address external = Address.random();
        Address daoKey = service.migrateConfig(authority, "mirror", token, external, 30, 60, 0,
                VotingConfig.tokenWeighted());

        DaoConfig daoConfig = service.findConfig(daoKey).get();
        assertEquals(external, daoConfig.getMigratedFrom());
        assertEquals(0, daoConfig.getRequiredBalance());
        assertFalse(daoConfig.enforcesRequiredBalance());
        DaoMigrated event = fixture.eventLog.getEvents(DaoMigrated.class).get(0);
        assertEquals(external, event.getMigratedFrom());
        assertEquals(token, event.getGovernanceToken());
    }

    @Test
    public void testUnknownDaoIsNotFound() {
        assertFalse(service.findConfig(Address.random()).isPresent());
        // A plain lamport account is no config
        assertFalse(service.findConfig(fixture.authority).isPresent());
    }

    private void assertRejected(ErrorCode errorCode, String name, int quorum, long requiredBalance,
                                long revealWindow, long executionDelay, VotingConfig votingConfig) {
        try {
            service.createConfig(authority, name, token, quorum, requiredBalance, revealWindow, executionDelay,
                    votingConfig);
            fail("Expected " + errorCode);
        } catch (ValidationException expected) {
            assertEquals(errorCode, expected.getErrorCode());
        } catch (DaoException e) {
            fail("Unexpected " + e);
        }
    }
}
