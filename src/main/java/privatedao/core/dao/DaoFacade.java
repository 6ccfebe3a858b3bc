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

import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.config.VotingConfig;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.plugin.VoterWeightRecord;
import privatedao.core.dao.plugin.VoterWeightService;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.proposal.TreasuryAction;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.DaoEventListener;
import privatedao.core.dao.timelock.ExecutionReceipt;
import privatedao.core.dao.timelock.TimelockController;
import privatedao.core.dao.treasury.TreasuryService;
import privatedao.core.dao.vote.VoterRecord;
import privatedao.core.dao.vote.blindvote.CommitVoteService;
import privatedao.core.dao.vote.delegation.DelegationService;
import privatedao.core.dao.vote.delegation.VoteDelegation;
import privatedao.core.dao.vote.myvote.MyVote;
import privatedao.core.dao.vote.myvote.MyVoteService;
import privatedao.core.dao.vote.votereveal.RevealedVote;
import privatedao.core.dao.vote.votereveal.VoteRevealService;
import privatedao.core.dao.vote.voteresult.VoteResult;
import privatedao.core.dao.vote.voteresult.VoteResultService;

import javax.inject.Inject;

import java.io.IOException;

import java.util.List;
import java.util.Optional;

import javax.annotation.Nullable;

/**
 * Provides a facade to interact with the DAO domain. Hides complexity and domain details to clients (e.g. a
 * command line client or an RPC layer). All operations are synchronous and fail closed: a thrown
 * {@link DaoException} means the request had no effect.
 */
public class DaoFacade {
    private final DaoConfigService daoConfigService;
    private final ProposalService proposalService;
    private final CommitVoteService commitVoteService;
    private final DelegationService delegationService;
    private final VoteRevealService voteRevealService;
    private final VoteResultService voteResultService;
    private final TimelockController timelockController;
    private final TreasuryService treasuryService;
    private final VoterWeightService voterWeightService;
    private final MyVoteService myVoteService;
    private final StateService stateService;

    @Inject
    public DaoFacade(DaoConfigService daoConfigService,
                     ProposalService proposalService,
                     CommitVoteService commitVoteService,
                     DelegationService delegationService,
                     VoteRevealService voteRevealService,
                     VoteResultService voteResultService,
                     TimelockController timelockController,
                     TreasuryService treasuryService,
                     VoterWeightService voterWeightService,
                     MyVoteService myVoteService,
                     StateService stateService) {
        this.daoConfigService = daoConfigService;
        this.proposalService = proposalService;
        this.commitVoteService = commitVoteService;
        this.delegationService = delegationService;
        this.voteRevealService = voteRevealService;
        this.voteResultService = voteResultService;
        this.timelockController = timelockController;
        this.treasuryService = treasuryService;
        this.voterWeightService = voterWeightService;
        this.myVoteService = myVoteService;
        this.stateService = stateService;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Create DAO
    ///////////////////////////////////////////////////////////////////////////////////////////

    public Address createConfig(Address authority, String name, Address governanceToken, int quorumPercentage,
                                long requiredBalance, long revealWindowSeconds, long executionDelaySeconds,
                                VotingConfig votingConfig) throws DaoException {
        return daoConfigService.createConfig(authority, name, governanceToken, quorumPercentage, requiredBalance,
                revealWindowSeconds, executionDelaySeconds, votingConfig);
    }

    public Address migrateConfig(Address authority, String name, Address governanceToken, Address migratedFrom,
                                 int quorumPercentage, long revealWindowSeconds, long executionDelaySeconds,
                                 VotingConfig votingConfig) throws DaoException {
        return daoConfigService.migrateConfig(authority, name, governanceToken, migratedFrom, quorumPercentage,
                revealWindowSeconds, executionDelaySeconds, votingConfig);
    }

    public void depositTreasury(Address depositor, Address daoKey, long amount) throws DaoException {
        treasuryService.depositTreasury(depositor, daoKey, amount);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Proposal lifecycle
    ///////////////////////////////////////////////////////////////////////////////////////////

    public Address createProposal(Address proposer, Address authority, Address daoKey, String title,
                                  String description, long votingDurationSeconds,
                                  @Nullable TreasuryAction treasuryAction) throws DaoException {
        return proposalService.createProposal(proposer, authority, daoKey, title, description,
                votingDurationSeconds, treasuryAction);
    }

    public void cancelProposal(Address authority, Address proposalKey) throws DaoException {
        proposalService.cancelProposal(authority, proposalKey);
    }

    public void vetoProposal(Address authority, Address proposalKey) throws DaoException {
        timelockController.vetoProposal(authority, proposalKey);
    }

    public VoteResult finalizeProposal(Address proposalKey) throws DaoException {
        return voteResultService.finalizeProposal(proposalKey);
    }

    public ExecutionReceipt execute(Address caller, Address proposalKey, Address target) throws DaoException {
        return timelockController.execute(caller, proposalKey, target);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Vote
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void commitVote(Address voter, Address proposalKey, byte[] commitment, @Nullable Address keeper)
            throws DaoException {
        commitVoteService.commitVote(voter, proposalKey, commitment, keeper);
    }

    /**
     * Prepares the vote in the local vault and commits it.
     */
    public MyVote prepareAndCommitVote(Address voter, Address proposalKey, boolean voteYes,
                                       @Nullable Address keeper) throws DaoException, IOException {
        MyVote myVote = myVoteService.prepareVote(voter, proposalKey, voteYes);
        commitVoteService.commitVote(voter, proposalKey, myVote.getCommitment(), keeper);
        return myVote;
    }

    public Address delegate(Address delegator, Address proposalKey, Address delegatee) throws DaoException {
        return delegationService.delegate(delegator, proposalKey, delegatee);
    }

    public void commitDelegatedVote(Address delegatee, Address proposalKey, Address delegationKey,
                                    byte[] commitment, @Nullable Address keeper) throws DaoException {
        delegationService.commitDelegatedVote(delegatee, proposalKey, delegationKey, commitment, keeper);
    }

    public RevealedVote revealVote(Address revealer, Address proposalKey, Address voter, boolean voteYes,
                                   byte[] salt) throws DaoException {
        return voteRevealService.revealVote(revealer, proposalKey, voter, voteYes, salt);
    }

    public int maybeRevealVotes(Address revealer) {
        return voteRevealService.maybeRevealVotes(revealer);
    }

    public List<MyVote> getMyVotes() {
        return myVoteService.getMyVoteList();
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: External voting power
    ///////////////////////////////////////////////////////////////////////////////////////////

    public VoterWeightRecord syncExternalVotingWeight(Address voter, Address daoKey, Address realm,
                                                      Address governingTokenMint) throws DaoException {
        return voterWeightService.syncExternalVotingWeight(voter, daoKey, realm, governingTokenMint);
    }

    public long readCommittedWeight(Address proposalKey, Address voter) throws DaoException {
        return voterWeightService.readCommittedWeight(proposalKey, voter);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Use case: Read state
    ///////////////////////////////////////////////////////////////////////////////////////////

    public Optional<DaoConfig> getConfig(Address daoKey) {
        return daoConfigService.findConfig(daoKey);
    }

    public Optional<Proposal> getProposal(Address proposalKey) {
        return proposalService.findProposal(proposalKey);
    }

    public Optional<VoterRecord> getVoterRecord(Address proposalKey, Address voter) {
        return commitVoteService.findVoterRecord(proposalKey, voter);
    }

    public Optional<VoteDelegation> getDelegation(Address proposalKey, Address delegator) {
        return delegationService.findDelegation(proposalKey, delegator);
    }

    public long getTreasuryBalance(Address daoKey) {
        return treasuryService.getTreasuryBalance(daoKey);
    }

    public long getLamports(Address key) {
        return stateService.getLamports(key);
    }

    public void creditLamports(Address key, long amount) throws DaoException {
        stateService.creditLamports(key, amount);
    }

    public void addEventListener(DaoEventListener listener) {
        stateService.getEventLog().addListener(listener);
    }
}
