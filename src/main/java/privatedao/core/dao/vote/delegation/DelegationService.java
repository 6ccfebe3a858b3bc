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

package privatedao.core.dao.vote.delegation;

import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.VoteDelegated;
import privatedao.core.dao.token.TokenLedger;
import privatedao.core.dao.vote.VoteWeightConsensus;
import privatedao.core.dao.vote.blindvote.CommitVoteService;

import javax.inject.Inject;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One-shot delegation of voting weight. The delegatee picks vote and salt on its own and commits with the
 * combined weight; the reveal is the same as for a direct vote.
 */
@Slf4j
public class DelegationService {
    private final StateService stateService;
    private final TokenLedger tokenLedger;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public DelegationService(StateService stateService, TokenLedger tokenLedger) {
        this.stateService = stateService;
        this.tokenLedger = tokenLedger;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * @return the key of the new delegation.
     */
    public Address delegate(Address delegator, Address proposalKey, Address delegatee) throws DaoException {
        checkNotNull(delegator, "delegator must not be null");
        checkNotNull(delegatee, "delegatee must not be null");

        return stateService.execute("delegate", transaction -> {
            Proposal proposal = ProposalService.getProposal(transaction, proposalKey);
            DaoConfig daoConfig = DaoConfigService.getConfig(transaction, proposal.getDao());
            CommitVoteService.requireVotingOpen(transaction, proposal);
            DaoChecks.require(!delegator.equals(delegatee), ErrorCode.SELF_DELEGATION);

            long rawBalance = tokenLedger.getVotingBalance(delegator, daoConfig.getGovernanceToken());
            DaoChecks.require(rawBalance > 0, ErrorCode.INSUFFICIENT_TOKENS);

            Address delegationKey = RecordKeys.getDelegationKey(proposalKey, delegator);
            if (transaction.hasRecord(delegationKey))
                throw DaoException.of(ErrorCode.DELEGATION_EXISTS,
                        "Delegator " + delegator + " already delegated on " + proposalKey);

            VoteDelegation delegation = new VoteDelegation(delegator, delegatee, proposalKey,
                    VoteWeightConsensus.getCapitalWeight(rawBalance),
                    VoteWeightConsensus.getCommunityWeight(rawBalance),
                    false);
            transaction.createRecord(delegationKey, delegation);

            transaction.emit(new VoteDelegated(proposalKey, delegator, delegatee, rawBalance));
            log.info("Vote delegated. proposal={}, delegator={}, delegatee={}, weight={}",
                    proposalKey, delegator, delegatee, rawBalance);
            return delegationKey;
        });
    }

    /**
     * Commits the delegatee's vote with its own weight plus the delegated weight. Community weights are added
     * after taking the square root of each balance separately.
     */
    public void commitDelegatedVote(Address delegatee, Address proposalKey, Address delegationKey,
                                    byte[] commitment, @Nullable Address keeper) throws DaoException {
        checkNotNull(delegatee, "delegatee must not be null");
        checkNotNull(commitment, "commitment must not be null");

        stateService.execute("commitDelegatedVote", transaction -> {
            Proposal proposal = ProposalService.getProposal(transaction, proposalKey);
            DaoConfig daoConfig = DaoConfigService.getConfig(transaction, proposal.getDao());
            VoteDelegation delegation = transaction.getRecord(delegationKey, VoteDelegation.TYPE,
                    ErrorCode.DELEGATION_NOT_FOUND);
            if (!delegation.getDelegatee().equals(delegatee))
                throw DaoException.of(ErrorCode.NOT_DELEGATEE, "Caller " + delegatee + " is not the delegatee");
            DaoChecks.require(delegation.getProposal().equals(proposalKey), ErrorCode.WRONG_PROPOSAL);

            CommitVoteService.requireVotingOpen(transaction, proposal);
            DaoChecks.require(!delegation.isUsed(), ErrorCode.DELEGATION_ALREADY_USED);

            long delegateeBalance = tokenLedger.getVotingBalance(delegatee, daoConfig.getGovernanceToken());
            long combinedCapital = DaoChecks.add(VoteWeightConsensus.getCapitalWeight(delegateeBalance),
                    delegation.getDelegatedCapital());
            long combinedCommunity = DaoChecks.add(VoteWeightConsensus.getCommunityWeight(delegateeBalance),
                    delegation.getDelegatedCommunity());

            CommitVoteService.storeCommitment(transaction, proposalKey, proposal, delegatee, commitment,
                    combinedCapital, combinedCommunity, keeper);
            delegation.markUsed();
            transaction.putRecord(delegationKey, delegation);
            log.info("Delegation used. delegation={}, combinedCapital={}, combinedCommunity={}",
                    delegationKey, combinedCapital, combinedCommunity);
            return null;
        });
    }

    public Optional<VoteDelegation> findDelegation(Address proposalKey, Address delegator) {
        Address delegationKey = RecordKeys.getDelegationKey(proposalKey, delegator);
        try {
            return stateService.query(transaction -> transaction.findRecord(delegationKey, VoteDelegation.TYPE));
        } catch (DaoException e) {
            // findRecord does not reject
            throw new IllegalStateException(e);
        }
    }
}
