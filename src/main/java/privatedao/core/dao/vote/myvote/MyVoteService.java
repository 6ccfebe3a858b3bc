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

package privatedao.core.dao.vote.myvote;

import privatedao.core.dao.identity.Address;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.vote.blindvote.BlindVoteConsensus;

import javax.inject.Inject;

import java.io.IOException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Voter side vault of vote secrets. The commitment of a prepared vote is submitted with commitVote; the stored
 * salt is needed later for the reveal.
 */
@Slf4j
public class MyVoteService {
    private final ProposalService proposalService;
    private final MyVoteStorage myVoteStorage;

    private final List<MyVote> myVoteList = new ArrayList<>();


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public MyVoteService(ProposalService proposalService, MyVoteStorage myVoteStorage) {
        this.proposalService = proposalService;
        this.myVoteStorage = myVoteStorage;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    public synchronized void readPersisted() {
        myVoteList.clear();
        myVoteList.addAll(myVoteStorage.load());
    }

    /**
     * Draws a fresh salt and remembers the vote before its commitment leaves this process.
     */
    public synchronized MyVote prepareVote(Address voter, Address proposalKey, boolean voteYes) throws IOException {
        checkNotNull(voter, "voter must not be null");
        checkNotNull(proposalKey, "proposalKey must not be null");
        MyVote myVote = new MyVote(proposalKey, voter, voteYes, BlindVoteConsensus.getRandomSalt());
        addMyVote(myVote);
        log.info("Vote prepared. proposal={}, voter={}", proposalKey, voter);
        return myVote;
    }

    /**
     * Adds a vote secret, e.g. one a voter shared with its keeper.
     */
    public synchronized void addMyVote(MyVote myVote) throws IOException {
        if (!myVoteList.contains(myVote)) {
            myVoteList.add(myVote);
            myVoteStorage.persist(myVoteList);
        }
    }

    public synchronized void applyRevealed(MyVote myVote) throws IOException {
        myVoteList.stream()
                .filter(e -> e.equals(myVote))
                .forEach(MyVote::setRevealed);
        myVoteStorage.persist(myVoteList);
    }

    public synchronized List<MyVote> getMyVoteList() {
        return new ArrayList<>(myVoteList);
    }

    public Optional<Proposal> findProposal(Address proposalKey) {
        return proposalService.findProposal(proposalKey);
    }
}
