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

import privatedao.core.dao.config.VotingMode;

import java.math.BigInteger;

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class VoteWeightConsensusTest {

    @Test
    public void testIsqrtOfSmallValues() {
        assertEquals(0, VoteWeightConsensus.isqrt(0));
        assertEquals(1, VoteWeightConsensus.isqrt(1));
        assertEquals(1, VoteWeightConsensus.isqrt(2));
        assertEquals(1, VoteWeightConsensus.isqrt(3));
        assertEquals(2, VoteWeightConsensus.isqrt(4));
        assertEquals(3, VoteWeightConsensus.isqrt(15));
        assertEquals(4, VoteWeightConsensus.isqrt(16));
        assertEquals(1_000, VoteWeightConsensus.isqrt(1_000_000));
        assertEquals(999, VoteWeightConsensus.isqrt(999_999));
    }

    @Test
    public void testIsqrtAtUpperBound() {
        assertEquals(3_037_000_499L, VoteWeightConsensus.isqrt(Long.MAX_VALUE));
        assertEquals(3_037_000_499L, VoteWeightConsensus.isqrt(3_037_000_499L * 3_037_000_499L));
        assertEquals(3_037_000_498L, VoteWeightConsensus.isqrt(3_037_000_499L * 3_037_000_499L - 1));
    }

    @Test
    public void testIsqrtIsFloorOfSquareRoot() {
        Random random = new Random(42);
        for (int i = 0; i < 10_000; i++) {
            long n = random.nextLong() & Long.MAX_VALUE;
            if (i % 2 == 0)
                n = n >>> random.nextInt(63);
            assertFloorSqrt(n);
        }
        for (long n = 0; n < 10_000; n++) {
            assertFloorSqrt(n);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIsqrtRejectsNegativeValue() {
        VoteWeightConsensus.isqrt(-1);
    }

    @Test
    public void testExternalWeightByMode() {
        assertEquals(144, VoteWeightConsensus.getExternalWeight(VotingMode.TOKEN_WEIGHTED, 144));
        assertEquals(12, VoteWeightConsensus.getExternalWeight(VotingMode.QUADRATIC, 144));
        assertEquals(12, VoteWeightConsensus.getExternalWeight(VotingMode.DUAL_CHAMBER, 144));
    }

    private static void assertFloorSqrt(long n) {
        BigInteger root = BigInteger.valueOf(VoteWeightConsensus.isqrt(n));
        BigInteger value = BigInteger.valueOf(n);
        assertTrue("isqrt(" + n + ")^2 <= n", root.multiply(root).compareTo(value) <= 0);
        BigInteger next = root.add(BigInteger.ONE);
        assertTrue("n < (isqrt(" + n + ")+1)^2", next.multiply(next).compareTo(value) > 0);
    }
}
