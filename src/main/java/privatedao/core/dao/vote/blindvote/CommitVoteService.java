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

import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.crypto.Hash;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.state.DaoTransaction;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.VoteCommitted;
import privatedao.core.dao.token.TokenLedger;
import privatedao.core.dao.vote.VoteWeightConsensus;
import privatedao.core.dao.vote.VoterRecord;

import javax.inject.Inject;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * First phase of the commit-reveal protocol. A commitment binds the vote without disclosing it; the tally stays
 * untouched until the reveal.
 */
@Slf4j
public class CommitVoteService {
    private final StateService stateService;
    private final TokenLedger tokenLedger;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public CommitVoteService(StateService stateService, TokenLedger tokenLedger) {
        this.stateService = stateService;
        this.tokenLedger = tokenLedger;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * @param keeper optional identity allowed to submit the reveal on behalf of the voter
     */
    public void commitVote(Address voter, Address proposalKey, byte[] commitment, @Nullable Address keeper)
            throws DaoException {
        checkNotNull(voter, "voter must not be null");
        checkNotNull(commitment, "commitment must not be null");

        stateService.execute("commitVote", transaction -> {
            Proposal proposal = ProposalService.getProposal(transaction, proposalKey);
            DaoConfig daoConfig = DaoConfigService.getConfig(transaction, proposal.getDao());
            requireVotingOpen(transaction, proposal);

            long rawBalance = tokenLedger.getVotingBalance(voter, daoConfig.getGovernanceToken());
            if (daoConfig.enforcesRequiredBalance() && rawBalance < daoConfig.getRequiredBalance())
                throw DaoException.of(ErrorCode.INSUFFICIENT_TOKENS, "Voter holds " + rawBalance +
                        " but at least " + daoConfig.getRequiredBalance() + " are required");

            storeCommitment(transaction, proposalKey, proposal, voter, commitment,
                    VoteWeightConsensus.getCapitalWeight(rawBalance),
                    VoteWeightConsensus.getCommunityWeight(rawBalance),
                    keeper);
            return null;
        });
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Shared with delegated commits
    ///////////////////////////////////////////////////////////////////////////////////////////

    public static void requireVotingOpen(DaoTransaction transaction, Proposal proposal) throws DaoException {
        DaoChecks.require(proposal.isVoting(), ErrorCode.VOTING_NOT_OPEN);
        DaoChecks.require(transaction.getUnixTimestamp() < proposal.getVotingEnd(), ErrorCode.VOTING_CLOSED);
    }

    public Optional<VoterRecord> findVoterRecord(Address proposalKey, Address voter) {
        Address voterRecordKey = RecordKeys.getVoterRecordKey(proposalKey, voter);
        try {
            return stateService.query(transaction -> transaction.findRecord(voterRecordKey, VoterRecord.TYPE));
        } catch (DaoException e) {
            // findRecord does not reject
            throw new IllegalStateException(e);
        }
    }

    /**
     * Creates the voter record with the given weight snapshot and counts the commit on the proposal.
     */
    public static void storeCommitment(DaoTransaction transaction, Address proposalKey, Proposal proposal,
                                       Address voter, byte[] commitment, long capitalWeight, long communityWeight,
                                       @Nullable Address keeper) throws DaoException {
        DaoChecks.require(commitment.length == Hash.LENGTH, ErrorCode.INVALID_COMMITMENT);
        Address voterRecordKey = RecordKeys.getVoterRecordKey(proposalKey, voter);
        if (transaction.hasRecord(voterRecordKey))
            throw DaoException.of(ErrorCode.ALREADY_COMMITTED, "Voter " + voter + " already committed on " + proposalKey);

        transaction.createRecord(voterRecordKey,
                new VoterRecord(voter, proposalKey, commitment, capitalWeight, communityWeight, keeper));
        proposal.incrementCommitCount();
        transaction.putRecord(proposalKey, proposal);

        transaction.emit(new VoteCommitted(proposalKey, voter, proposal.getCommitCount()));
        log.info("Vote committed. proposal={}, voter={}, commitCount={}", proposalKey, voter,
                proposal.getCommitCount());
    }
}
