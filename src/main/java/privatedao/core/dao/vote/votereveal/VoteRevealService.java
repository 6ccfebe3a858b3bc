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

package privatedao.core.dao.vote.votereveal;

import privatedao.core.dao.DaoOptionKeys;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.state.DaoTransaction;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.VoteRevealed;
import privatedao.core.dao.time.HostClock;
import privatedao.core.dao.vote.VoterRecord;
import privatedao.core.dao.vote.blindvote.BlindVoteConsensus;
import privatedao.core.dao.vote.myvote.MyVote;
import privatedao.core.dao.vote.myvote.MyVoteService;

import javax.inject.Inject;
import javax.inject.Named;

import java.io.IOException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Second phase of the commit-reveal protocol. The voter, or the keeper it named, discloses vote and salt; a
 * matching commitment adds the snapshot weights to the tallies and earns the caller a rebate from the proposal's
 * balance while the balance stays above the reserve.
 */
@Slf4j
public class VoteRevealService {
    private final StateService stateService;
    private final MyVoteService myVoteService;
    private final HostClock hostClock;
    private final long revealRebateLamports;
    private final long revealRebateReserveLamports;

    private final List<VoteRevealException> voteRevealExceptions = new CopyOnWriteArrayList<>();


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public VoteRevealService(StateService stateService,
                             MyVoteService myVoteService,
                             HostClock hostClock,
                             @Named(DaoOptionKeys.REVEAL_REBATE_LAMPORTS) long revealRebateLamports,
                             @Named(DaoOptionKeys.REVEAL_REBATE_RESERVE_LAMPORTS) long revealRebateReserveLamports) {
        this.stateService = stateService;
        this.myVoteService = myVoteService;
        this.hostClock = hostClock;
        checkArgument(revealRebateLamports >= 0, "revealRebateLamports must not be negative");
        checkArgument(revealRebateReserveLamports >= 0, "revealRebateReserveLamports must not be negative");
        this.revealRebateLamports = revealRebateLamports;
        this.revealRebateReserveLamports = revealRebateReserveLamports;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * @param revealer the voter or its keeper
     * @param voter    the identity the vote was committed under
     */
    public RevealedVote revealVote(Address revealer, Address proposalKey, Address voter, boolean voteYes,
                                   byte[] salt) throws DaoException {
        checkNotNull(revealer, "revealer must not be null");
        checkNotNull(voter, "voter must not be null");
        checkNotNull(salt, "salt must not be null");

        return stateService.execute("revealVote", transaction -> {
            DaoChecks.require(salt.length == BlindVoteConsensus.SALT_LENGTH, ErrorCode.INVALID_SALT);
            Proposal proposal = ProposalService.getProposal(transaction, proposalKey);
            long now = transaction.getUnixTimestamp();
            DaoChecks.require(now >= proposal.getVotingEnd(), ErrorCode.REVEAL_TOO_EARLY);
            DaoChecks.require(now < proposal.getRevealEnd(), ErrorCode.REVEAL_CLOSED);

            Address voterRecordKey = RecordKeys.getVoterRecordKey(proposalKey, voter);
            VoterRecord voterRecord = transaction.getRecord(voterRecordKey, VoterRecord.TYPE, ErrorCode.NOT_COMMITTED);
            DaoChecks.require(voterRecord.isCommitted(), ErrorCode.NOT_COMMITTED);
            DaoChecks.require(!voterRecord.isRevealed(), ErrorCode.ALREADY_REVEALED);
            if (!voterRecord.mayReveal(revealer))
                throw DaoException.of(ErrorCode.NOT_AUTHORIZED_TO_REVEAL,
                        "Caller " + revealer + " is neither voter nor keeper of " + voter);

            // Always the identity of the voter record, also when the keeper reveals
            if (!BlindVoteConsensus.isCommitmentValid(voterRecord.getCommitment(), voteYes, salt,
                    voterRecord.getVoter()))
                throw DaoException.of(ErrorCode.COMMITMENT_MISMATCH);

            proposal.addRevealedVote(voteYes, voterRecord.getCapitalWeight(), voterRecord.getCommunityWeight());
            voterRecord.markRevealed(voteYes);
            transaction.putRecord(voterRecordKey, voterRecord);
            transaction.putRecord(proposalKey, proposal);

            boolean rebatePaid = maybePayRebate(transaction, proposalKey, revealer);
            transaction.emit(new VoteRevealed(proposalKey, voter, proposal.getRevealCount(), rebatePaid));
            log.info("Vote revealed. proposal={}, voter={}, revealCount={}, rebatePaid={}",
                    proposalKey, voter, proposal.getRevealCount(), rebatePaid);
            return new RevealedVote(proposalKey, voter, voteYes, voterRecord.getCapitalWeight(),
                    voterRecord.getCommunityWeight(), rebatePaid);
        });
    }

    /**
     * Reveals all own votes which are not revealed yet and whose proposal is in its reveal window. Failures are
     * collected in {@link #getVoteRevealExceptions()}.
     *
     * @return the number of votes revealed.
     */
    public int maybeRevealVotes(Address revealer) {
        long now = hostClock.getUnixTimestamp();
        List<MyVote> candidates = new ArrayList<>();
        myVoteService.getMyVoteList().stream()
                .filter(myVote -> !myVote.isRevealed())
                .forEach(myVote -> {
                    Optional<Proposal> proposal = myVoteService.findProposal(myVote.getProposal());
                    if (proposal.isPresent() && now >= proposal.get().getVotingEnd() &&
                            now < proposal.get().getRevealEnd())
                        candidates.add(myVote);
                });

        int numRevealed = 0;
        for (MyVote myVote : candidates) {
            try {
                revealVote(revealer, myVote.getProposal(), myVote.getVoter(), myVote.isVoteYes(), myVote.getSalt());
                myVoteService.applyRevealed(myVote);
                numRevealed++;
            } catch (DaoException e) {
                addVoteRevealException(new VoteRevealException("Exception at calling revealVote.", e, myVote));
            } catch (IOException e) {
                addVoteRevealException(new VoteRevealException("Could not persist revealed vote.", e, myVote));
            }
        }
        return numRevealed;
    }

    public List<VoteRevealException> getVoteRevealExceptions() {
        return Collections.unmodifiableList(voteRevealExceptions);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    // Best effort: the reveal stands also if no rebate is paid
    private boolean maybePayRebate(DaoTransaction transaction, Address proposalKey, Address revealer)
            throws DaoException {
        long balance = transaction.getLamports(proposalKey);
        // balance > rebate + reserve, without overflow
        if (revealRebateReserveLamports > Long.MAX_VALUE - revealRebateLamports ||
                balance - revealRebateLamports <= revealRebateReserveLamports) {
            log.info("Reveal rebate skipped as proposal balance {} would fall below the reserve of {}. proposal={}",
                    balance, revealRebateReserveLamports, proposalKey);
            return false;
        }
        long revealerBalance = transaction.getLamports(revealer);
        if (revealerBalance > Long.MAX_VALUE - revealRebateLamports) {
            log.info("Reveal rebate skipped as revealer balance {} can not take another {}. revealer={}",
                    revealerBalance, revealRebateLamports, revealer);
            return false;
        }
        transaction.transferLamports(proposalKey, revealer, revealRebateLamports);
        return true;
    }

    private void addVoteRevealException(VoteRevealException exception) {
        log.error(exception.toString());
        voteRevealExceptions.add(exception);
    }
}
