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

import privatedao.core.dao.exceptions.ArithmeticOverflowException;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.layout.Discriminator;
import privatedao.core.dao.state.layout.PersistableRecord;
import privatedao.core.dao.state.layout.RecordReader;
import privatedao.core.dao.state.layout.RecordType;
import privatedao.core.dao.state.layout.RecordWriter;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkState;

/**
 * Lifecycle state and running tallies of one proposal. Identity, texts, deadlines and the treasury action are
 * fixed at creation. Tallies and counters only grow and {@code executed} only goes from false to true.
 */
@Getter
@EqualsAndHashCode
public final class Proposal implements PersistableRecord {
    public static final String RECORD_NAME = "Proposal";

    public static final int LEN = Discriminator.LENGTH
            + Address.LENGTH                                    // dao
            + Address.LENGTH                                    // proposer
            + 8                                                 // proposal id
            + (4 + ProposalConsensus.MAX_TITLE_LENGTH)          // title
            + (4 + ProposalConsensus.MAX_DESCRIPTION_LENGTH)    // description
            + 1                                                 // status
            + 8 + 8                                             // voting end, reveal end
            + 8 + 8 + 8 + 8                                     // yes/no capital, yes/no community
            + 8 + 8                                             // commit count, reveal count
            + (1 + TreasuryAction.LEN)                          // treasury action
            + 8                                                 // execution unlocks at
            + 1;                                                // executed

    public static final RecordType<Proposal> TYPE = new RecordType<>(RECORD_NAME, LEN, Proposal::fromBytes);

    private final Address dao;
    private final Address proposer;
    private final long proposalId;
    private final String title;
    private final String description;
    private ProposalStatus status;
    private final long votingEnd;
    private final long revealEnd;
    private long yesCapital;
    private long noCapital;
    private long yesCommunity;
    private long noCommunity;
    private long commitCount;
    private long revealCount;
    @Nullable
    private final TreasuryAction treasuryAction;
    // 0 unless passed
    private long executionUnlocksAt;
    private boolean executed;

    public Proposal(Address dao, Address proposer, long proposalId, String title, String description,
                    long votingEnd, long revealEnd, @Nullable TreasuryAction treasuryAction) {
        this(dao, proposer, proposalId, title, description, ProposalStatus.VOTING, votingEnd, revealEnd,
                0, 0, 0, 0, 0, 0, treasuryAction, 0, false);
    }

    private Proposal(Address dao, Address proposer, long proposalId, String title, String description,
                     ProposalStatus status, long votingEnd, long revealEnd,
                     long yesCapital, long noCapital, long yesCommunity, long noCommunity,
                     long commitCount, long revealCount, @Nullable TreasuryAction treasuryAction,
                     long executionUnlocksAt, boolean executed) {
        this.dao = dao;
        this.proposer = proposer;
        this.proposalId = proposalId;
        this.title = title;
        this.description = description;
        this.status = status;
        this.votingEnd = votingEnd;
        this.revealEnd = revealEnd;
        this.yesCapital = yesCapital;
        this.noCapital = noCapital;
        this.yesCommunity = yesCommunity;
        this.noCommunity = noCommunity;
        this.commitCount = commitCount;
        this.revealCount = revealCount;
        this.treasuryAction = treasuryAction;
        this.executionUnlocksAt = executionUnlocksAt;
        this.executed = executed;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Protocol mutations
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void incrementCommitCount() throws ArithmeticOverflowException {
        commitCount = DaoChecks.add(commitCount, 1);
    }

    /**
     * Adds the snapshot weights of one revealed vote to the matching tally pair.
     */
    public void addRevealedVote(boolean voteYes, long capitalWeight, long communityWeight)
            throws ArithmeticOverflowException {
        if (voteYes) {
            long newYesCapital = DaoChecks.add(yesCapital, capitalWeight);
            yesCommunity = DaoChecks.add(yesCommunity, communityWeight);
            yesCapital = newYesCapital;
        } else {
            long newNoCapital = DaoChecks.add(noCapital, capitalWeight);
            noCommunity = DaoChecks.add(noCommunity, communityWeight);
            noCapital = newNoCapital;
        }
        revealCount = DaoChecks.add(revealCount, 1);
    }

    public void cancel() {
        checkState(status == ProposalStatus.VOTING, "Only a voting proposal can be cancelled");
        status = ProposalStatus.CANCELLED;
    }

    public void veto() {
        checkState(status == ProposalStatus.PASSED && !executed, "Only a passed and unexecuted proposal can be vetoed");
        status = ProposalStatus.VETOED;
    }

    public void pass(long executionUnlocksAt) {
        checkState(status == ProposalStatus.VOTING, "Proposal already finalized");
        this.status = ProposalStatus.PASSED;
        this.executionUnlocksAt = executionUnlocksAt;
    }

    public void fail() {
        checkState(status == ProposalStatus.VOTING, "Proposal already finalized");
        status = ProposalStatus.FAILED;
    }

    public void markExecuted() {
        checkState(status == ProposalStatus.PASSED && !executed, "Only a passed proposal executes, and only once");
        executed = true;
    }

    public boolean isVoting() {
        return status == ProposalStatus.VOTING;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Fixed layout
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Override
    public String getRecordName() {
        return RECORD_NAME;
    }

    @Override
    public byte[] serialize() {
        RecordWriter writer = new RecordWriter(RECORD_NAME, LEN)
                .writeAddress(dao)
                .writeAddress(proposer)
                .writeLong(proposalId)
                .writeString(title, ProposalConsensus.MAX_TITLE_LENGTH)
                .writeString(description, ProposalConsensus.MAX_DESCRIPTION_LENGTH)
                .writeU8(status.getTag())
                .writeLong(votingEnd)
                .writeLong(revealEnd)
                .writeLong(yesCapital)
                .writeLong(noCapital)
                .writeLong(yesCommunity)
                .writeLong(noCommunity)
                .writeLong(commitCount)
                .writeLong(revealCount);
        TreasuryAction.writeOptional(writer, treasuryAction);
        return writer.writeLong(executionUnlocksAt)
                .writeBoolean(executed)
                .toByteArray();
    }

    public static Proposal fromBytes(byte[] data) {
        RecordReader reader = new RecordReader(RECORD_NAME, LEN, data);
        Address dao = reader.readAddress();
        Address proposer = reader.readAddress();
        long proposalId = reader.readLong();
        String title = reader.readString(ProposalConsensus.MAX_TITLE_LENGTH);
        String description = reader.readString(ProposalConsensus.MAX_DESCRIPTION_LENGTH);
        ProposalStatus status = ProposalStatus.fromTag(reader.readU8());
        long votingEnd = reader.readLong();
        long revealEnd = reader.readLong();
        long yesCapital = reader.readLong();
        long noCapital = reader.readLong();
        long yesCommunity = reader.readLong();
        long noCommunity = reader.readLong();
        long commitCount = reader.readLong();
        long revealCount = reader.readLong();
        TreasuryAction treasuryAction = TreasuryAction.readOptional(reader);
        long executionUnlocksAt = reader.readLong();
        boolean executed = reader.readBoolean();
        return new Proposal(dao, proposer, proposalId, title, description, status, votingEnd, revealEnd,
                yesCapital, noCapital, yesCommunity, noCommunity, commitCount, revealCount, treasuryAction,
                executionUnlocksAt, executed);
    }

    @Override
    public String toString() {
        return "Proposal{" +
                "\n     dao=" + dao +
                ",\n     proposalId=" + proposalId +
                ",\n     title='" + title + '\'' +
                ",\n     status=" + status +
                ",\n     votingEnd=" + votingEnd +
                ",\n     revealEnd=" + revealEnd +
                ",\n     yesCapital=" + yesCapital +
                ",\n     noCapital=" + noCapital +
                ",\n     yesCommunity=" + yesCommunity +
                ",\n     noCommunity=" + noCommunity +
                ",\n     commitCount=" + commitCount +
                ",\n     revealCount=" + revealCount +
                ",\n     treasuryAction=" + treasuryAction +
                ",\n     executionUnlocksAt=" + executionUnlocksAt +
                ",\n     executed=" + executed +
                "\n}";
    }
}
