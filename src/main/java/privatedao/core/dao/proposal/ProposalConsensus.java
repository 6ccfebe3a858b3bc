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

import java.nio.charset.StandardCharsets;

/**
 * Size limits and timing rules every proposal has to follow. The limits determine the record layout and are not
 * configurable.
 */
public class ProposalConsensus {
    public static final int MAX_TITLE_LENGTH = 128;
    public static final int MAX_DESCRIPTION_LENGTH = 1024;

    public static boolean isTitleSizeValid(String title) {
        return title.getBytes(StandardCharsets.UTF_8).length <= MAX_TITLE_LENGTH;
    }

    public static boolean isDescriptionSizeValid(String description) {
        return description.getBytes(StandardCharsets.UTF_8).length <= MAX_DESCRIPTION_LENGTH;
    }

    public static long getVotingEnd(long now, long votingDurationSeconds) throws ArithmeticOverflowException {
        return DaoChecks.add(now, votingDurationSeconds);
    }

    public static long getRevealEnd(long votingEnd, long revealWindowSeconds) throws ArithmeticOverflowException {
        return DaoChecks.add(votingEnd, revealWindowSeconds);
    }
}
