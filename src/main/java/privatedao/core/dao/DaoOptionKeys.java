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

package privatedao.core.dao;

/**
 * Keys of the engine parameters in the {@link org.springframework.core.env.Environment}.
 */
public class DaoOptionKeys {
    public static final String REVEAL_REBATE_LAMPORTS = "revealRebateLamports";
    public static final String REVEAL_REBATE_RESERVE_LAMPORTS = "revealRebateReserveLamports";
    public static final String PROPOSAL_DEPOSIT_LAMPORTS = "proposalDepositLamports";
    public static final String VOTER_WEIGHT_EXPIRY_SLOTS = "voterWeightExpirySlots";
    public static final String MIN_REVEAL_WINDOW_SECONDS = "minRevealWindowSeconds";
    public static final String MIN_VOTING_DURATION_SECONDS = "minVotingDurationSeconds";
    public static final String MY_VOTE_STORAGE_DIR = "myVoteStorageDir";
}
