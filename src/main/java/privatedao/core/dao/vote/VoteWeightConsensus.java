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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns a raw token balance into the weights of the two chambers.
 */
public class VoteWeightConsensus {

    /**
     * Floor of the square root by Newton's method. The iterate starts at ceil(n/2) and decreases monotonically
     * until it stops decreasing.
     */
    public static long isqrt(long n) {
        checkArgument(n >= 0, "isqrt of negative value %s", n);
        if (n == 0)
            return 0;

        long x = n;
        // (n + 1) / 2 without overflow at Long.MAX_VALUE
        long y = n / 2 + (n & 1);
        while (y < x) {
            x = y;
            y = (x + n / x) / 2;
        }
        return x;
    }

    public static long getCapitalWeight(long rawBalance) {
        return rawBalance;
    }

    public static long getCommunityWeight(long rawBalance) {
        return isqrt(rawBalance);
    }

    /**
     * Weight published to external governance platforms: linear under token weighted voting, quadratic otherwise.
     */
    public static long getExternalWeight(VotingMode votingMode, long rawBalance) {
        return votingMode == VotingMode.TOKEN_WEIGHTED ? rawBalance : isqrt(rawBalance);
    }
}
