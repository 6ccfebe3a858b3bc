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

import java.util.Arrays;

import lombok.Getter;

public enum TreasuryActionType {
    // native lamports from the DAO treasury
    SEND_SOL(0),
    // tokens of the action's mint held by the DAO treasury
    SEND_TOKEN(1),
    // published for an off-process relayer, moves no value itself
    CUSTOM_CPI(2);

    @Getter
    private final int tag;

    TreasuryActionType(int tag) {
        this.tag = tag;
    }

    public static TreasuryActionType fromTag(int tag) {
        return Arrays.stream(values())
                .filter(type -> type.tag == tag)
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException("Unknown treasury action type tag " + tag));
    }
}
