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

package privatedao.core.dao.vote.blindvote;

import privatedao.core.dao.crypto.Hash;
import privatedao.core.dao.identity.Address;

import java.security.MessageDigest;
import java.security.SecureRandom;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Commitment scheme of the blind vote: {@code sha256(voteByte || salt || voter)} with a one byte vote (0x01 for
 * yes, 0x00 for no), a 32 byte salt and the 32 byte voter identity. The voter identity is always the one of the
 * voter record, also when a keeper or a delegatee's keeper submits the reveal.
 */
public class BlindVoteConsensus {
    public static final int SALT_LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    public static byte[] getCommitment(boolean voteYes, byte[] salt, Address voter) {
        checkArgument(salt.length == SALT_LENGTH, "salt must be %s bytes", SALT_LENGTH);
        byte[] voteByte = new byte[]{(byte) (voteYes ? 1 : 0)};
        return Hash.getSha256Hash(voteByte, salt, voter.getBytes());
    }

    public static boolean isCommitmentValid(byte[] commitment, boolean voteYes, byte[] salt, Address voter) {
        // Constant time comparison
        return MessageDigest.isEqual(commitment, getCommitment(voteYes, salt, voter));
    }

    public static byte[] getRandomSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        RANDOM.nextBytes(salt);
        return salt;
    }
}
