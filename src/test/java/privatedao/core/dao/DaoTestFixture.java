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

package privatedao.core.dao;

import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.config.DaoConfigValidator;
import privatedao.core.dao.config.VotingConfig;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.plugin.VoterWeightService;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.proposal.TreasuryAction;
import privatedao.core.dao.state.DaoStateStore;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.DaoEventLog;
import privatedao.core.dao.time.ManualHostClock;
import privatedao.core.dao.timelock.TimelockController;
import privatedao.core.dao.token.InMemoryTokenLedger;
import privatedao.core.dao.treasury.LedgerTreasuryGateway;
import privatedao.core.dao.treasury.TreasuryGateway;
import privatedao.core.dao.treasury.TreasuryService;
import privatedao.core.dao.vote.VoterRecord;
import privatedao.core.dao.vote.blindvote.BlindVoteConsensus;
import privatedao.core.dao.vote.blindvote.CommitVoteService;
import privatedao.core.dao.vote.delegation.DelegationService;
import privatedao.core.dao.vote.myvote.MyVoteService;
import privatedao.core.dao.vote.myvote.MyVoteStorage;
import privatedao.core.dao.vote.votereveal.VoteRevealService;
import privatedao.core.dao.vote.voteresult.VoteResultService;

import java.util.Optional;

import javax.annotation.Nullable;

/**
 * Wires all services by hand around a {@link ManualHostClock} and an {@link InMemoryTokenLedger}.
 */
public class DaoTestFixture {
    public static final long START_TIME = 1_700_000_000L;
    public static final long START_SLOT = 250_000_000L;
    public static final long DEPOSIT = 10_565_280L;
    public static final long REBATE = 1_000_000L;
    public static final long RESERVE = 1_500_000L;
    public static final long REVEAL_WINDOW = 60;
    public static final long EXECUTION_DELAY = 3_600;
    public static final long VOTING_DURATION = 100;
    public static final long MEMBER_LAMPORTS = 100_000_000L;

    public final ManualHostClock clock = new ManualHostClock(START_TIME, START_SLOT);
    public final DaoStateStore store = new DaoStateStore();
    public final DaoEventLog eventLog = new DaoEventLog();
    public final StateService stateService = new StateService(store, clock, eventLog);
    public final InMemoryTokenLedger tokenLedger = new InMemoryTokenLedger();

    public final DaoConfigService daoConfigService;
    public final ProposalService proposalService;
    public final CommitVoteService commitVoteService;
    public final DelegationService delegationService;
    public final MyVoteService myVoteService;
    public final VoteRevealService voteRevealService;
    public final VoteResultService voteResultService;
    public final TimelockController timelockController;
    public final TreasuryService treasuryService;
    public final VoterWeightService voterWeightService;

    public final Address authority = Address.random();
    public final Address governanceToken = Address.random();

    public DaoTestFixture() {
        this(DEPOSIT, null);
    }

    public DaoTestFixture(long proposalDeposit, @Nullable TreasuryGateway treasuryGateway) {
        daoConfigService = new DaoConfigService(stateService, new DaoConfigValidator(5));
        proposalService = new ProposalService(stateService, proposalDeposit, 5);
        commitVoteService = new CommitVoteService(stateService, tokenLedger);
        delegationService = new DelegationService(stateService, tokenLedger);
        myVoteService = new MyVoteService(proposalService, new MyVoteStorage(""));
        voteRevealService = new VoteRevealService(stateService, myVoteService, clock, REBATE, RESERVE);
        voteResultService = new VoteResultService(stateService);
        timelockController = new TimelockController(stateService, treasuryGateway != null ? treasuryGateway :
                new LedgerTreasuryGateway(stateService, tokenLedger));
        treasuryService = new TreasuryService(stateService);
        voterWeightService = new VoterWeightService(stateService, tokenLedger, 100);
        try {
            stateService.creditLamports(authority, MEMBER_LAMPORTS);
        } catch (DaoException e) {
            throw new IllegalStateException(e);
        }
    }

    public Address createDao(int quorumPercentage, VotingConfig votingConfig) throws DaoException {
        return createDao(quorumPercentage, 0, votingConfig);
    }

    public Address createDao(int quorumPercentage, long requiredBalance, VotingConfig votingConfig)
            throws DaoException {
        return daoConfigService.createConfig(authority, "dao-" + Address.random().toHex().substring(0, 8),
                governanceToken, quorumPercentage, requiredBalance, REVEAL_WINDOW, EXECUTION_DELAY, votingConfig);
    }

    /**
     * @return a new member with native lamports and the given amount of governance tokens.
     */
    public Address member(long tokens) throws DaoException {
        Address member = Address.random();
        stateService.creditLamports(member, MEMBER_LAMPORTS);
        if (tokens > 0)
            tokenLedger.mint(governanceToken, member, tokens);
        return member;
    }

    public Address createProposal(Address daoKey) throws DaoException {
        return createProposal(daoKey, null);
    }

    public Address createProposal(Address daoKey, @Nullable TreasuryAction treasuryAction) throws DaoException {
        return proposalService.createProposal(authority, authority, daoKey, "Fund the audit",
                "Pays the external auditor", VOTING_DURATION, treasuryAction);
    }

    /**
     * Commits a vote and returns the salt needed to reveal it.
     */
    public byte[] commit(Address voter, Address proposalKey, boolean voteYes) throws DaoException {
        byte[] salt = BlindVoteConsensus.getRandomSalt();
        commitVoteService.commitVote(voter, proposalKey, BlindVoteConsensus.getCommitment(voteYes, salt, voter),
                null);
        return salt;
    }

    public Proposal getProposal(Address proposalKey) {
        return proposalService.findProposal(proposalKey)
                .orElseThrow(() -> new IllegalStateException("No proposal " + proposalKey));
    }

    public Optional<VoterRecord> getVoterRecord(Address proposalKey, Address voter) {
        return commitVoteService.findVoterRecord(proposalKey, voter);
    }

    public void moveToRevealPhase(Address proposalKey) {
        clock.setUnixTimestamp(getProposal(proposalKey).getVotingEnd());
    }

    public void moveToRevealEnd(Address proposalKey) {
        clock.setUnixTimestamp(getProposal(proposalKey).getRevealEnd());
    }
}
