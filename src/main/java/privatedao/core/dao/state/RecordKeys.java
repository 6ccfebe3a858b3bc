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

package privatedao.core.dao.state;

import privatedao.core.dao.crypto.Hash;
import privatedao.core.dao.identity.Address;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Derives the storage key of every record from the semantic identity of the record.
 */
public class RecordKeys {
    private static final String DAO_SEED = "dao";
    private static final String PROPOSAL_SEED = "proposal";
    private static final String VOTE_SEED = "vote";
    private static final String DELEGATION_SEED = "delegation";
    private static final String TREASURY_SEED = "treasury";
    private static final String VOTER_WEIGHT_RECORD_SEED = "voter-weight-record";

    public static Address getDaoKey(Address authority, String daoName) {
        return derive(seed(DAO_SEED), authority.getBytes(), daoName.getBytes(StandardCharsets.UTF_8));
    }

    public static Address getProposalKey(Address daoKey, long proposalId) {
        byte[] id = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(proposalId).array();
        return derive(seed(PROPOSAL_SEED), daoKey.getBytes(), id);
    }

    public static Address getVoterRecordKey(Address proposalKey, Address voter) {
        return derive(seed(VOTE_SEED), proposalKey.getBytes(), voter.getBytes());
    }

    public static Address getDelegationKey(Address proposalKey, Address delegator) {
        return derive(seed(DELEGATION_SEED), proposalKey.getBytes(), delegator.getBytes());
    }

    public static Address getTreasuryKey(Address daoKey) {
        return derive(seed(TREASURY_SEED), daoKey.getBytes());
    }

    public static Address getVoterWeightRecordKey(Address realm, Address governingTokenMint, Address owner) {
        return derive(seed(VOTER_WEIGHT_RECORD_SEED), realm.getBytes(), governingTokenMint.getBytes(),
                owner.getBytes());
    }

    // Each seed is length prefixed so different splits of the same bytes never collide.
    private static Address derive(byte[]... seeds) {
        byte[][] parts = new byte[seeds.length * 2][];
        for (int i = 0; i < seeds.length; i++) {
            parts[2 * i] = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(seeds[i].length).array();
            parts[2 * i + 1] = seeds[i];
        }
        return Address.of(Hash.getSha256Hash(parts));
    }

    private static byte[] seed(String seed) {
        return seed.getBytes(StandardCharsets.UTF_8);
    }
}
