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

import java.util.Arrays;

import lombok.Getter;

public enum VotingMode {
    // weight = raw token balance
    TOKEN_WEIGHTED(0),
    // weight = isqrt(raw token balance)
    QUADRATIC(1),
    // both chambers must clear their own threshold
    DUAL_CHAMBER(2);

    @Getter
    private final int tag;

    VotingMode(int tag) {
        this.tag = tag;
    }

    public static VotingMode fromTag(int tag) {
        return Arrays.stream(values())
                .filter(mode -> mode.tag == tag)
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException("Unknown voting mode tag " + tag));
    }
}
