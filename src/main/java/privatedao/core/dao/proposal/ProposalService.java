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

import privatedao.core.dao.DaoOptionKeys;
import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.ValidationException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.DaoTransaction;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.ProposalCancelled;
import privatedao.core.dao.state.events.ProposalCreated;

import javax.inject.Inject;
import javax.inject.Named;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Creates and cancels proposals.
 */
@Slf4j
public class ProposalService {
    private final StateService stateService;
    private final long proposalDepositLamports;
    private final long minVotingDurationSeconds;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public ProposalService(StateService stateService,
                           @Named(DaoOptionKeys.PROPOSAL_DEPOSIT_LAMPORTS) long proposalDepositLamports,
                           @Named(DaoOptionKeys.MIN_VOTING_DURATION_SECONDS) long minVotingDurationSeconds) {
        this.stateService = stateService;
        this.proposalDepositLamports = proposalDepositLamports;
        this.minVotingDurationSeconds = minVotingDurationSeconds;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * Creates a proposal in the Voting state. The DAO authority has to co-authorize the request and the proposer
     * deposits {@code proposalDepositLamports} into the proposal, which later pays the reveal rebates.
     *
     * @return the key of the new proposal.
     */
    public Address createProposal(Address proposer, Address authority, Address daoKey, String title,
                                  String description, long votingDurationSeconds,
                                  @Nullable TreasuryAction treasuryAction) throws DaoException {
        checkNotNull(proposer, "proposer must not be null");
        checkNotNull(daoKey, "daoKey must not be null");
        checkNotNull(title, "title must not be null");
        checkNotNull(description, "description must not be null");
        validateProposal(title, description, votingDurationSeconds, treasuryAction);

        return stateService.execute("createProposal", transaction -> {
            DaoConfig daoConfig = DaoConfigService.requireAuthority(transaction, daoKey, authority);
            long now = transaction.getUnixTimestamp();
            long votingEnd = ProposalConsensus.getVotingEnd(now, votingDurationSeconds);
            long revealEnd = ProposalConsensus.getRevealEnd(votingEnd, daoConfig.getRevealWindowSeconds());

            long proposalId = daoConfig.getProposalCount();
            Address proposalKey = RecordKeys.getProposalKey(daoKey, proposalId);
            Proposal proposal = new Proposal(daoKey, proposer, proposalId, title, description, votingEnd,
                    revealEnd, treasuryAction);
            transaction.createRecord(proposalKey, proposal);
            transaction.transferLamports(proposer, proposalKey, proposalDepositLamports);
            transaction.putRecord(daoKey, daoConfig.withProposalCount(DaoChecks.add(proposalId, 1)));

            transaction.emit(new ProposalCreated(daoKey, proposalKey, proposalId, title, votingEnd, revealEnd));
            log.info("Proposal created. proposal={}, proposalId={}, votingEnd={}, revealEnd={}",
                    proposalKey, proposalId, votingEnd, revealEnd);
            return proposalKey;
        });
    }

    public void cancelProposal(Address authority, Address proposalKey) throws DaoException {
        stateService.execute("cancelProposal", transaction -> {
            Proposal proposal = getProposal(transaction, proposalKey);
            DaoConfigService.requireAuthority(transaction, proposal.getDao(), authority);
            DaoChecks.require(proposal.isVoting(), ErrorCode.PROPOSAL_NOT_CANCELLABLE);

            proposal.cancel();
            transaction.putRecord(proposalKey, proposal);
            transaction.emit(new ProposalCancelled(proposalKey, authority));
            log.info("Proposal cancelled. proposal={}, cancelledBy={}", proposalKey, authority);
            return null;
        });
    }

    public Optional<Proposal> findProposal(Address proposalKey) {
        try {
            return stateService.query(transaction -> transaction.findRecord(proposalKey, Proposal.TYPE));
        } catch (DaoException e) {
            // findRecord does not reject
            throw new IllegalStateException(e);
        }
    }

    public static Proposal getProposal(DaoTransaction transaction, Address proposalKey) throws DaoException {
        return transaction.getRecord(proposalKey, Proposal.TYPE, ErrorCode.PROPOSAL_NOT_FOUND);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private void validateProposal(String title, String description, long votingDurationSeconds,
                                  @Nullable TreasuryAction treasuryAction) throws ValidationException {
        if (!ProposalConsensus.isTitleSizeValid(title))
            throw new ValidationException(ErrorCode.TITLE_TOO_LONG);
        if (!ProposalConsensus.isDescriptionSizeValid(description))
            throw new ValidationException(ErrorCode.DESCRIPTION_TOO_LONG);
        if (votingDurationSeconds < minVotingDurationSeconds)
            throw new ValidationException(ErrorCode.VOTING_DURATION_TOO_SHORT,
                    "Voting duration must be at least " + minVotingDurationSeconds + " seconds");
        if (treasuryAction != null)
            TreasuryActionValidator.validate(treasuryAction);
    }
}
