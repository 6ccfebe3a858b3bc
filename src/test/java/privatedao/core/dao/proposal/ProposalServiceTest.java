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

package privatedao.core.dao.proposal;

import privatedao.core.dao.DaoTestFixture;
import privatedao.core.dao.config.VotingConfig;
import privatedao.core.dao.exceptions.AuthorizationException;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.StateException;
import privatedao.core.dao.exceptions.ValidationException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.events.ProposalCancelled;
import privatedao.core.dao.state.events.ProposalCreated;

import org.apache.commons.lang3.StringUtils;

import org.junit.Before;
import org.junit.Test;

import static privatedao.core.dao.DaoTestFixture.DEPOSIT;
import static privatedao.core.dao.DaoTestFixture.MEMBER_LAMPORTS;
import static privatedao.core.dao.DaoTestFixture.REVEAL_WINDOW;
import static privatedao.core.dao.DaoTestFixture.START_TIME;
import static privatedao.core.dao.DaoTestFixture.VOTING_DURATION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class ProposalServiceTest {
    private DaoTestFixture fixture;
    private ProposalService service;
    private Address daoKey;

    @Before
    public void setUp() throws DaoException {
        fixture = new DaoTestFixture();
        service = fixture.proposalService;
        daoKey = fixture.createDao(50, VotingConfig.tokenWeighted());
    }

    @Test
    public void testCreateProposal() throws DaoException {
        Address proposalKey = fixture.createProposal(daoKey);

        assertEquals(RecordKeys.getProposalKey(daoKey, 0), proposalKey);
        Proposal proposal = fixture.getProposal(proposalKey);
        assertEquals(ProposalStatus.VOTING, proposal.getStatus());
        assertEquals(START_TIME + VOTING_DURATION, proposal.getVotingEnd());
        assertEquals(START_TIME + VOTING_DURATION + REVEAL_WINDOW, proposal.getRevealEnd());
        assertEquals(0, proposal.getCommitCount());
        assertEquals(0, proposal.getRevealCount());
        assertNull(proposal.getTreasuryAction());
        assertFalse(proposal.isExecuted());

        assertEquals(DEPOSIT, fixture.stateService.getLamports(proposalKey));
        assertEquals(MEMBER_LAMPORTS - DEPOSIT, fixture.stateService.getLamports(fixture.authority));
        assertEquals(1, fixture.daoConfigService.findConfig(daoKey).get().getProposalCount());
        assertEquals(proposalKey, fixture.eventLog.getEvents(ProposalCreated.class).get(0).getProposal());
    }

    @Test
    public void testProposalIdsAreSequential() throws DaoException {
        Address first = fixture.createProposal(daoKey);
        Address second = fixture.createProposal(daoKey);

        assertEquals(0, fixture.getProposal(first).getProposalId());
        assertEquals(1, fixture.getProposal(second).getProposalId());
        assertEquals(RecordKeys.getProposalKey(daoKey, 1), second);
        assertEquals(2, fixture.daoConfigService.findConfig(daoKey).get().getProposalCount());
    }

    @Test
    public void testProposerOtherThanAuthority() throws DaoException {
        Address proposer = fixture.member(0);
        Address proposalKey = service.createProposal(proposer, fixture.authority, daoKey, "t", "d",
                VOTING_DURATION, null);

        assertEquals(proposer, fixture.getProposal(proposalKey).getProposer());
        assertEquals(MEMBER_LAMPORTS - DEPOSIT, fixture.stateService.getLamports(proposer));
        assertEquals(MEMBER_LAMPORTS, fixture.stateService.getLamports(fixture.authority));
    }

    @Test
    public void testMissingAuthorityCoSignIsRejected() throws DaoException {
        Address stranger = fixture.member(0);
        try {
            service.createProposal(stranger, stranger, daoKey, "t", "d", VOTING_DURATION, null);
            fail("Expected AuthorizationException");
        } catch (AuthorizationException expected) {
            assertEquals(ErrorCode.NOT_AUTHORITY, expected.getErrorCode());
        }
        assertEquals(0, fixture.daoConfigService.findConfig(daoKey).get().getProposalCount());
        assertEquals(MEMBER_LAMPORTS, fixture.stateService.getLamports(stranger));
    }

    @Test
    public void testProposerWithoutDepositIsRejected() throws DaoException {
        Address poorProposer = Address.random();
        fixture.stateService.creditLamports(poorProposer, DEPOSIT - 1);
        try {
            service.createProposal(poorProposer, fixture.authority, daoKey, "t", "d", VOTING_DURATION, null);
            fail("Expected ValidationException");
        } catch (ValidationException expected) {
            assertEquals(ErrorCode.INSUFFICIENT_FUNDS, expected.getErrorCode());
        }
        assertFalse(service.findProposal(RecordKeys.getProposalKey(daoKey, 0)).isPresent());
    }

    @Test
    public void testUnknownDao() {
        try {
            fixture.createProposal(Address.random());
            fail("Expected StateException");
        } catch (DaoException expected) {
            assertEquals(ErrorCode.DAO_NOT_FOUND, expected.getErrorCode());
        }
    }

    @Test
    public void testInputValidation() {
        assertRejected(ErrorCode.TITLE_TOO_LONG, StringUtils.repeat('t', 129), "d", VOTING_DURATION, null);
        assertRejected(ErrorCode.DESCRIPTION_TOO_LONG, "t", StringUtils.repeat('d', 1025), VOTING_DURATION, null);
        assertRejected(ErrorCode.VOTING_DURATION_TOO_SHORT, "t", "d", 4, null);
        assertRejected(ErrorCode.INVALID_TREASURY_ACTION, "t", "d", VOTING_DURATION,
                TreasuryAction.sendSol(0, Address.random()));
        assertRejected(ErrorCode.INVALID_TREASURY_ACTION, "t", "d", VOTING_DURATION,
                TreasuryAction.sendSol(10, Address.DEFAULT));
        assertRejected(ErrorCode.TOKEN_MINT_REQUIRED, "t", "d", VOTING_DURATION,
                new TreasuryAction(TreasuryActionType.SEND_TOKEN, 10, Address.random(), null));
        assertRejected(ErrorCode.INVALID_TREASURY_ACTION, "t", "d", VOTING_DURATION,
                new TreasuryAction(TreasuryActionType.CUSTOM_CPI, 1, Address.random(), null));
    }

    @Test
    public void testMaximumSizesAreAccepted() throws DaoException {
        Address proposalKey = service.createProposal(fixture.authority, fixture.authority, daoKey,
                StringUtils.repeat('t', 128), StringUtils.repeat('d', 1024), 5,
                TreasuryAction.customCpi(Address.random()));
        assertEquals(1024, fixture.getProposal(proposalKey).getDescription().length());
    }

    @Test
    public void testCancelProposal() throws DaoException {
        Address proposalKey = fixture.createProposal(daoKey);
        service.cancelProposal(fixture.authority, proposalKey);

        assertEquals(ProposalStatus.CANCELLED, fixture.getProposal(proposalKey).getStatus());
        assertEquals(fixture.authority,
                fixture.eventLog.getEvents(ProposalCancelled.class).get(0).getCancelledBy());

        try {
            service.cancelProposal(fixture.authority, proposalKey);
            fail("Expected StateException");
        } catch (StateException expected) {
            assertEquals(ErrorCode.PROPOSAL_NOT_CANCELLABLE, expected.getErrorCode());
        }
    }

    @Test
    public void testOnlyAuthorityCancels() throws DaoException {
        Address proposalKey = fixture.createProposal(daoKey);
        try {
            service.cancelProposal(Address.random(), proposalKey);
            fail("Expected AuthorizationException");
        } catch (AuthorizationException expected) {
            assertEquals(ErrorCode.NOT_AUTHORITY, expected.getErrorCode());
        }
        assertEquals(ProposalStatus.VOTING, fixture.getProposal(proposalKey).getStatus());
    }

    @Test
    public void testCancelAfterFinalizeIsRejected() throws DaoException {
        Address proposalKey = fixture.createProposal(daoKey);
        fixture.moveToRevealEnd(proposalKey);
        fixture.voteResultService.finalizeProposal(proposalKey);
        try {
            service.cancelProposal(fixture.authority, proposalKey);
            fail("Expected StateException");
        } catch (StateException expected) {
            assertEquals(ErrorCode.PROPOSAL_NOT_CANCELLABLE, expected.getErrorCode());
        }
    }

    private void assertRejected(ErrorCode errorCode, String title, String description, long duration,
                                TreasuryAction action) {
        try {
            service.createProposal(fixture.authority, fixture.authority, daoKey, title, description, duration,
                    action);
            fail("Expected " + errorCode);
        } catch (ValidationException expected) {
            assertEquals(errorCode, expected.getErrorCode());
        } catch (DaoException e) {
            fail("Unexpected " + e);
        }
    }
}
