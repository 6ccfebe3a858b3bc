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

import privatedao.core.dao.identity.Address;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BlindVoteConsensusTest {
    private final Address voter = Address.random();
    private final byte[] salt = BlindVoteConsensus.getRandomSalt();

    @Test
    public void testCommitmentIsSha256OfVoteSaltAndVoter() throws NoSuchAlgorithmException {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        digest.update((byte) 1);
        digest.update(salt);
        digest.update(voter.getBytes());

        byte[] commitment = BlindVoteConsensus.getCommitment(true, salt, voter);
        assertEquals(32, commitment.length);
        assertArrayEquals(digest.digest(), commitment);
    }

    @Test
    public void testMatchingRevealIsValid() {
        byte[] commitment = BlindVoteConsensus.getCommitment(false, salt, voter);
        assertTrue(BlindVoteConsensus.isCommitmentValid(commitment, false, salt, voter));
    }

    @Test
    public void testAnyFlippedBitIsRejected() {
        byte[] commitment = BlindVoteConsensus.getCommitment(true, salt, voter);

        assertFalse(BlindVoteConsensus.isCommitmentValid(commitment, false, salt, voter));

        for (int i = 0; i < salt.length * 8; i++) {
            byte[] flippedSalt = salt.clone();
            flippedSalt[i / 8] ^= (byte) (1 << (i % 8));
            assertFalse(BlindVoteConsensus.isCommitmentValid(commitment, true, flippedSalt, voter));
        }

        for (int i = 0; i < Address.LENGTH * 8; i++) {
            byte[] flippedVoter = voter.getBytes();
            flippedVoter[i / 8] ^= (byte) (1 << (i % 8));
            assertFalse(BlindVoteConsensus.isCommitmentValid(commitment, true, salt, Address.of(flippedVoter)));
        }
    }

    @Test
    public void testRandomSaltsDiffer() {
        byte[] other = BlindVoteConsensus.getRandomSalt();
        assertEquals(BlindVoteConsensus.SALT_LENGTH, other.length);
        assertFalse(Arrays.equals(salt, other));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShortSaltIsRejected() {
        BlindVoteConsensus.getCommitment(true, new byte[31], voter);
    }
}
