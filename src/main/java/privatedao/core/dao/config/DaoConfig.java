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

package privatedao.core.dao.config;

import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.layout.Discriminator;
import privatedao.core.dao.state.layout.PersistableRecord;
import privatedao.core.dao.state.layout.RecordReader;
import privatedao.core.dao.state.layout.RecordType;
import privatedao.core.dao.state.layout.RecordWriter;

import lombok.Value;
import lombok.With;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Configuration of one DAO. Only the proposal counter changes after creation. A changed configuration requires a
 * new instance created by migration.
 */
@Immutable
@Value
public class DaoConfig implements PersistableRecord {
    public static final String RECORD_NAME = "Dao";
    public static final int MAX_NAME_LENGTH = 64;

    public static final int LEN = Discriminator.LENGTH
            + Address.LENGTH            // authority
            + (4 + MAX_NAME_LENGTH)     // name
            + Address.LENGTH            // governance token
            + 1                         // quorum percentage
            + 8                         // required balance
            + 8                         // reveal window
            + 8                         // execution delay
            + VotingConfig.LEN          // voting config
            + 8                         // proposal count
            + (1 + Address.LENGTH);     // migrated from

    public static final RecordType<DaoConfig> TYPE = new RecordType<>(RECORD_NAME, LEN, DaoConfig::fromBytes);

    Address authority;
    String name;
    Address governanceToken;
    int quorumPercentage;
    long requiredBalance;
    long revealWindowSeconds;
    long executionDelaySeconds;
    VotingConfig votingConfig;
    @With
    long proposalCount;
    // Informational only
    @Nullable
    Address migratedFrom;

    public boolean enforcesRequiredBalance() {
        return requiredBalance > 0;
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
                .writeAddress(authority)
                .writeString(name, MAX_NAME_LENGTH)
                .writeAddress(governanceToken)
                .writeU8(quorumPercentage)
                .writeLong(requiredBalance)
                .writeLong(revealWindowSeconds)
                .writeLong(executionDelaySeconds)
                .writeU8(votingConfig.getMode().getTag())
                .writeU8(votingConfig.getCapitalThreshold())
                .writeU8(votingConfig.getCommunityThreshold())
                .writeLong(proposalCount)
                .writeOptionalAddress(migratedFrom)
                .toByteArray();
    }

    public static DaoConfig fromBytes(byte[] data) {
        RecordReader reader = new RecordReader(RECORD_NAME, LEN, data);
        Address authority = reader.readAddress();
        String name = reader.readString(MAX_NAME_LENGTH);
        Address governanceToken = reader.readAddress();
        int quorumPercentage = reader.readU8();
        long requiredBalance = reader.readLong();
        long revealWindowSeconds = reader.readLong();
        long executionDelaySeconds = reader.readLong();
        VotingMode mode = VotingMode.fromTag(reader.readU8());
        VotingConfig votingConfig = VotingConfig.of(mode, reader.readU8(), reader.readU8());
        long proposalCount = reader.readLong();
        Address migratedFrom = reader.readOptionalAddress();
        return new DaoConfig(authority, name, governanceToken, quorumPercentage, requiredBalance,
                revealWindowSeconds, executionDelaySeconds, votingConfig, proposalCount, migratedFrom);
    }
}
