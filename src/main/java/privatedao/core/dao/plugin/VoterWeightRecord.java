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

package privatedao.core.dao.plugin;

import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.layout.Discriminator;
import privatedao.core.dao.state.layout.PersistableRecord;
import privatedao.core.dao.state.layout.RecordReader;
import privatedao.core.dao.state.layout.RecordType;
import privatedao.core.dao.state.layout.RecordWriter;

import lombok.Value;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Voting power as read by an external governance platform. The byte layout is a contract with that platform:
 * field order and sizes must not change.
 */
@Immutable
@Value
public class VoterWeightRecord implements PersistableRecord {
    public static final String RECORD_NAME = "VoterWeightRecord";
    public static final int RESERVED_LENGTH = 8;

    public static final int LEN = Discriminator.LENGTH
            + Address.LENGTH            // realm
            + Address.LENGTH            // governing token mint
            + Address.LENGTH            // governing token owner
            + 8                         // voter weight
            + (1 + 8)                   // expiry
            + (1 + 1)                   // weight action
            + (1 + Address.LENGTH)      // weight action target
            + RESERVED_LENGTH;

    public static final RecordType<VoterWeightRecord> TYPE =
            new RecordType<>(RECORD_NAME, LEN, VoterWeightRecord::fromBytes);

    Address realm;
    Address governingTokenMint;
    Address governingTokenOwner;
    long voterWeight;
    // Slot after which the consuming platform rejects the weight
    @Nullable
    Long voterWeightExpiry;
    @Nullable
    Integer weightAction;
    @Nullable
    Address weightActionTarget;

    @Override
    public String getRecordName() {
        return RECORD_NAME;
    }

    @Override
    public byte[] serialize() {
        return new RecordWriter(RECORD_NAME, LEN)
                .writeAddress(realm)
                .writeAddress(governingTokenMint)
                .writeAddress(governingTokenOwner)
                .writeLong(voterWeight)
                .writeOptionalLong(voterWeightExpiry)
                .writeOptionalU8(weightAction)
                .writeOptionalAddress(weightActionTarget)
                .skip(RESERVED_LENGTH)
                .toByteArray();
    }

    public static VoterWeightRecord fromBytes(byte[] data) {
        RecordReader reader = new RecordReader(RECORD_NAME, LEN, data);
        VoterWeightRecord record = new VoterWeightRecord(reader.readAddress(),
                reader.readAddress(),
                reader.readAddress(),
                reader.readLong(),
                reader.readOptionalLong(),
                reader.readOptionalU8(),
                reader.readOptionalAddress());
        reader.skip(RESERVED_LENGTH);
        return record;
    }
}
