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

import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.layout.Discriminator;
import privatedao.core.dao.state.layout.PersistableRecord;
import privatedao.core.dao.state.layout.RecordReader;
import privatedao.core.dao.state.layout.RecordType;
import privatedao.core.dao.state.layout.RecordWriter;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import static com.google.common.base.Preconditions.checkState;

/**
 * Weight a delegator lends to a delegatee for a single proposal. Carries weight only, never a vote. It funds at
 * most one commit.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class VoteDelegation implements PersistableRecord {
    public static final String RECORD_NAME = "VoteDelegation";

    public static final int LEN = Discriminator.LENGTH
            + Address.LENGTH            // delegator
            + Address.LENGTH            // delegatee
            + Address.LENGTH            // proposal
            + 8                         // delegated capital
            + 8                         // delegated community
            + 1;                        // used

    public static final RecordType<VoteDelegation> TYPE =
            new RecordType<>(RECORD_NAME, LEN, VoteDelegation::fromBytes);

    private final Address delegator;
    private final Address delegatee;
    private final Address proposal;
    private final long delegatedCapital;
    private final long delegatedCommunity;
    private boolean used;

    public VoteDelegation(Address delegator, Address delegatee, Address proposal, long delegatedCapital,
                          long delegatedCommunity, boolean used) {
        this.delegator = delegator;
        this.delegatee = delegatee;
        this.proposal = proposal;
        this.delegatedCapital = delegatedCapital;
        this.delegatedCommunity = delegatedCommunity;
        this.used = used;
    }

    public void markUsed() {
        checkState(!used, "Delegation already used");
        used = true;
    }

    @Override
    public String getRecordName() {
        return RECORD_NAME;
    }

    @Override
    public byte[] serialize() {
        return new RecordWriter(RECORD_NAME, LEN)
                .writeAddress(delegator)
                .writeAddress(delegatee)
                .writeAddress(proposal)
                .writeLong(delegatedCapital)
                .writeLong(delegatedCommunity)
                .writeBoolean(used)
                .toByteArray();
    }

    public static VoteDelegation fromBytes(byte[] data) {
        RecordReader reader = new RecordReader(RECORD_NAME, LEN, data);
        return new VoteDelegation(reader.readAddress(), reader.readAddress(), reader.readAddress(),
                reader.readLong(), reader.readLong(), reader.readBoolean());
    }
}
