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

package privatedao.core.dao.vote.blindvote;

import privatedao.core.dao.DaoTestFixture;
import privatedao.core.dao.config.VotingConfig;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.DuplicateException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.StateException;
import privatedao.core.dao.exceptions.ValidationException;
import privatedao.core.dao.exceptions.WindowException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.events.VoteCommitted;
import privatedao.core.dao.token.TokenLedger;
import privatedao.core.dao.vote.VoterRecord;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CommitVoteServiceTest {
    private DaoTestFixture fixture;
    private CommitVoteService service;
    private Address daoKey;
    private Address proposalKey;

    @Before
    public void setUp() throws DaoException {
        fixture = new DaoTestFixture();
        service = fixture.commitVoteService;
        daoKey = fixture.createDao(50, VotingConfig.quadratic());
        proposalKey = fixture.createProposal(daoKey);
    }

    @Test
    public void testNegativeLedgerBalanceIsRejected() throws DaoException {
        TokenLedger brokenLedger = new TokenLedger() {
            @Override
            public long getBalance(Address owner, Address mint) {
                return -1;
            }

            @Override
            public void transfer(Address mint, Address from, Address to, long amount) {
                throw new UnsupportedOperationException();
            }
        };
        CommitVoteService brokenLedgerService = new CommitVoteService(fixture.stateService, brokenLedger);
        Address voter = fixture.member(0);
        byte[] commitment = BlindVoteConsensus.getCommitment(true, BlindVoteConsensus.getRandomSalt(), voter);
        try {
            brokenLedgerService.commitVote(voter, proposalKey, commitment, null);
            fail("Expected ValidationException");
        } catch (ValidationException expected) {
            assertEquals(ErrorCode.INVALID_TOKEN_BALANCE, expected.getErrorCode());
        }
        assertFalse(fixture.getVoterRecord(proposalKey, voter).isPresent());
        assertEquals(0, fixture.getProposal(proposalKey).getCommitCount());
    }

    @Test
    public void testCommitSnapshotsWeights() throws DaoException {
        Address voter = fixture.member(10_000);
        byte[] commitment = BlindVoteConsensus.getCommitment(true, BlindVoteConsensus.getRandomSalt(), voter);
        Address keeper = Address.random();

        service.commitVote(voter, proposalKey, commitment, keeper);

        VoterRecord voterRecord = fixture.getVoterRecord(proposalKey, voter).get();
        assertArrayEquals(commitment, voterRecord.getCommitment());
        assertEquals(10_000, voterRecord.getCapitalWeight());
        assertEquals(100, voterRecord.getCommunityWeight());
        assertTrue(voterRecord.isCommitted());
        assertFalse(voterRecord.isRevealed());
        assertEquals(keeper, voterRecord.getKeeper());
        assertEquals(1, fixture.getProposal(proposalKey).getCommitCount());
        assertEquals(1, fixture.eventLog.getEvents(VoteCommitted.class).get(0).getCommitCount());
    }

    @Test
    public void testLaterBalanceChangesDoNotAffectSnapshot() throws DaoException {
        Address voter = fixture.member(400);
        fixture.commit(voter, proposalKey, true);

        fixture.tokenLedger.mint(fixture.governanceToken, voter, 1_000_000);

        VoterRecord voterRecord = fixture.getVoterRecord(proposalKey, voter).get();
        assertEquals(400, voterRecord.getCapitalWeight());
        assertEquals(20, voterRecord.getCommunityWeight());
    }

    @Test
    public void testVoterWithoutTokensCommitsZeroWeight() throws DaoException {
        Address voter = fixture.member(0);
        fixture.commit(voter, proposalKey, false);

        VoterRecord voterRecord = fixture.getVoterRecord(proposalKey, voter).get();
        assertEquals(0, voterRecord.getCapitalWeight());
        assertNull(voterRecord.getKeeper());
    }

    @Test
    public void testSecondCommitIsRejected() throws DaoException {
        Address voter = fixture.member(100);
        fixture.commit(voter, proposalKey, true);
        try {
            fixture.commit(voter, proposalKey, false);
            fail("Expected DuplicateException");
        } catch (DuplicateException expected) {
            assertEquals(ErrorCode.ALREADY_COMMITTED, expected.getErrorCode());
        }
        assertEquals(1, fixture.getProposal(proposalKey).getCommitCount());
    }

    @Test
    public void testRequiredBalanceIsEnforced() throws DaoException {
        Address gatedDao = fixture.createDao(50, 1_000, VotingConfig.tokenWeighted());
        Address gatedProposal = fixture.createProposal(gatedDao);

        try {
            fixture.commit(fixture.member(999), gatedProposal, true);
            fail("Expected ValidationException");
        } catch (ValidationException expected) {
            assertEquals(ErrorCode.INSUFFICIENT_TOKENS, expected.getErrorCode());
        }
        fixture.commit(fixture.member(1_000), gatedProposal, true);
        assertEquals(1, fixture.getProposal(gatedProposal).getCommitCount());
    }

    @Test
    public void testCommitAtVotingEndIsRejected() throws DaoException {
        Address voter = fixture.member(100);
        fixture.clock.setUnixTimestamp(fixture.getProposal(proposalKey).getVotingEnd() - 1);
        fixture.commit(fixture.member(100), proposalKey, true);

        fixture.moveToRevealPhase(proposalKey);
        try {
            fixture.commit(voter, proposalKey, true);
            fail("Expected WindowException");
        } catch (WindowException expected) {
            assertEquals(ErrorCode.VOTING_CLOSED, expected.getErrorCode());
        }
        assertFalse(fixture.getVoterRecord(proposalKey, voter).isPresent());
    }

    @Test
    public void testCommitOnCancelledProposalIsRejected() throws DaoException {
        fixture.proposalService.cancelProposal(fixture.authority, proposalKey);
        try {
            fixture.commit(fixture.member(100), proposalKey, true);
            fail("Expected StateException");
        } catch (StateException expected) {
            assertEquals(ErrorCode.VOTING_NOT_OPEN, expected.getErrorCode());
        }
    }

    @Test
    public void testMalformedCommitmentIsRejected() throws DaoException {
        try {
            service.commitVote(fixture.member(100), proposalKey, new byte[31], null);
            fail("Expected ValidationException");
        } catch (ValidationException expected) {
            assertEquals(ErrorCode.INVALID_COMMITMENT, expected.getErrorCode());
        }
    }

    @Test
    public void testUnknownProposal() throws DaoException {
        try {
            fixture.commit(fixture.member(100), Address.random(), true);
            fail("Expected StateException");
        } catch (StateException expected) {
            assertEquals(ErrorCode.PROPOSAL_NOT_FOUND, expected.getErrorCode());
        }
    }
}
