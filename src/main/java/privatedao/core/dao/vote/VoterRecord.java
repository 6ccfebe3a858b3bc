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

package privatedao.core.dao.vote;

import privatedao.core.dao.crypto.Hash;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.layout.Discriminator;
import privatedao.core.dao.state.layout.PersistableRecord;
import privatedao.core.dao.state.layout.RecordReader;
import privatedao.core.dao.state.layout.RecordType;
import privatedao.core.dao.state.layout.RecordWriter;

import org.bitcoinj.core.Utils;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * One voter's commitment on one proposal. Weights are snapshotted at commit time and never re-read from the
 * token ledger. The record changes once more, at reveal.
 */
@Getter
@EqualsAndHashCode
public final class VoterRecord implements PersistableRecord {
    public static final String RECORD_NAME = "VoterRecord";

    public static final int LEN = Discriminator.LENGTH
            + Address.LENGTH            // voter
            + Address.LENGTH            // proposal
            + Hash.LENGTH               // commitment
            + 8                         // capital weight
            + 8                         // community weight
            + 1 + 1 + 1                 // committed, revealed, voted yes
            + (1 + Address.LENGTH);     // keeper

    public static final RecordType<VoterRecord> TYPE = new RecordType<>(RECORD_NAME, LEN, VoterRecord::fromBytes);

    private final Address voter;
    private final Address proposal;
    private final byte[] commitment;
    private final long capitalWeight;
    private final long communityWeight;
    private final boolean committed;
    private boolean revealed;
    private boolean votedYes;
    @Nullable
    private final Address keeper;

    public VoterRecord(Address voter, Address proposal, byte[] commitment, long capitalWeight, long communityWeight,
                       @Nullable Address keeper) {
        this(voter, proposal, commitment, capitalWeight, communityWeight, true, false, false, keeper);
    }

    private VoterRecord(Address voter, Address proposal, byte[] commitment, long capitalWeight,
                        long communityWeight, boolean committed, boolean revealed, boolean votedYes,
                        @Nullable Address keeper) {
        checkArgument(commitment.length == Hash.LENGTH, "commitment must be %s bytes", Hash.LENGTH);
        this.voter = voter;
        this.proposal = proposal;
        this.commitment = commitment.clone();
        this.capitalWeight = capitalWeight;
        this.communityWeight = communityWeight;
        this.committed = committed;
        this.revealed = revealed;
        this.votedYes = votedYes;
        this.keeper = keeper;
    }

    public byte[] getCommitment() {
        return commitment.clone();
    }

    /**
     * @return true if {@code caller} is the voter or the keeper the voter named at commit time.
     */
    public boolean mayReveal(Address caller) {
        return voter.equals(caller) || caller.equals(keeper);
    }

    public void markRevealed(boolean voteYes) {
        checkState(committed && !revealed, "Vote must be committed and not yet revealed");
        this.revealed = true;
        this.votedYes = voteYes;
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
        return new RecordWriter(RECORD_NAME, LEN)
                .writeAddress(voter)
                .writeAddress(proposal)
                .writeBytes(commitment)
                .writeLong(capitalWeight)
                .writeLong(communityWeight)
                .writeBoolean(committed)
                .writeBoolean(revealed)
                .writeBoolean(votedYes)
                .writeOptionalAddress(keeper)
                .toByteArray();
    }

    public static VoterRecord fromBytes(byte[] data) {
        RecordReader reader = new RecordReader(RECORD_NAME, LEN, data);
        return new VoterRecord(reader.readAddress(),
                reader.readAddress(),
                reader.readBytes(Hash.LENGTH),
                reader.readLong(),
                reader.readLong(),
                reader.readBoolean(),
                reader.readBoolean(),
                reader.readBoolean(),
                reader.readOptionalAddress());
    }

    @Override
    public String toString() {
        return "VoterRecord{" +
                "\n     voter=" + voter +
                ",\n     proposal=" + proposal +
                ",\n     commitment=" + Utils.HEX.encode(commitment) +
                ",\n     capitalWeight=" + capitalWeight +
                ",\n     communityWeight=" + communityWeight +
                ",\n     revealed=" + revealed +
                ",\n     keeper=" + keeper +
                "\n}";
    }
}
