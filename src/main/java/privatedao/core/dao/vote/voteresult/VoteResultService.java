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

package privatedao.core.dao.vote.voteresult;

import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.ProposalFinalized;

import javax.inject.Inject;

import lombok.extern.slf4j.Slf4j;

/**
 * Finalizes a proposal once its reveal window is over. Anyone may call it; the status transition makes it
 * happen only once.
 */
@Slf4j
public class VoteResultService {
    private final StateService stateService;

    @Inject
    public VoteResultService(StateService stateService) {
        this.stateService = stateService;
    }

    public VoteResult finalizeProposal(Address proposalKey) throws DaoException {
        return stateService.execute("finalize", transaction -> {
            Proposal proposal = ProposalService.getProposal(transaction, proposalKey);
            long now = transaction.getUnixTimestamp();
            DaoChecks.require(now >= proposal.getRevealEnd(), ErrorCode.REVEAL_STILL_OPEN);
            DaoChecks.require(proposal.isVoting(), ErrorCode.ALREADY_FINALIZED);

            DaoConfig daoConfig = DaoConfigService.getConfig(transaction, proposal.getDao());
            VoteResult voteResult = VoteResultConsensus.getVoteResult(daoConfig.getVotingConfig(),
                    daoConfig.getQuorumPercentage(), proposal);
            if (voteResult.isPassed())
                proposal.pass(DaoChecks.add(now, daoConfig.getExecutionDelaySeconds()));
            else
                proposal.fail();
            transaction.putRecord(proposalKey, proposal);

            transaction.emit(new ProposalFinalized(proposalKey,
                    proposal.getYesCapital(), proposal.getNoCapital(),
                    proposal.getYesCommunity(), proposal.getNoCommunity(),
                    voteResult.isPassed(), voteResult.isQuorumMet(),
                    proposal.getCommitCount(), proposal.getRevealCount(),
                    proposal.getExecutionUnlocksAt()));
            log.info("Proposal finalized. proposal={}, status={}, quorumMet={}, executionUnlocksAt={}",
                    proposalKey, proposal.getStatus(), voteResult.isQuorumMet(), proposal.getExecutionUnlocksAt());
            return voteResult;
        });
    }
}
