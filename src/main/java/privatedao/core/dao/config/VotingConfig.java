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

import lombok.Value;

import javax.annotation.concurrent.Immutable;

/**
 * How revealed weight decides a proposal. Thresholds are only meaningful for {@link VotingMode#DUAL_CHAMBER}
 * and are 0 otherwise.
 */
@Immutable
@Value
public class VotingConfig {
    // tag + capital threshold + community threshold
    public static final int LEN = 3;

    VotingMode mode;
    int capitalThreshold;
    int communityThreshold;

    private VotingConfig(VotingMode mode, int capitalThreshold, int communityThreshold) {
        this.mode = mode;
        this.capitalThreshold = capitalThreshold;
        this.communityThreshold = communityThreshold;
    }

    public static VotingConfig tokenWeighted() {
        return new VotingConfig(VotingMode.TOKEN_WEIGHTED, 0, 0);
    }

    public static VotingConfig quadratic() {
        return new VotingConfig(VotingMode.QUADRATIC, 0, 0);
    }

    public static VotingConfig dualChamber(int capitalThreshold, int communityThreshold) {
        return new VotingConfig(VotingMode.DUAL_CHAMBER, capitalThreshold, communityThreshold);
    }

    static VotingConfig of(VotingMode mode, int capitalThreshold, int communityThreshold) {
        return mode == VotingMode.DUAL_CHAMBER ?
                dualChamber(capitalThreshold, communityThreshold) :
                new VotingConfig(mode, 0, 0);
    }
}
