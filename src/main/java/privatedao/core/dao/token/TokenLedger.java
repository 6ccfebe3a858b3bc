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

package privatedao.core.dao.token;

import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;

/**
 * External token balance ledger. Voting weight is read from it at commit and delegation time only.
 */
public interface TokenLedger {

    /**
     * @return balance of {@code owner} in tokens of {@code mint}, 0 if the owner holds none.
     */
    long getBalance(Address owner, Address mint);

    /**
     * Balance as used for voting weight. A negative balance of an ill-behaved ledger rejects the request.
     */
    default long getVotingBalance(Address owner, Address mint) throws DaoException {
        long balance = getBalance(owner, mint);
        if (balance < 0)
            throw DaoException.of(ErrorCode.INVALID_TOKEN_BALANCE,
                    "Token ledger reported balance " + balance + " for " + owner);
        return balance;
    }

    void transfer(Address mint, Address from, Address to, long amount) throws TokenTransferException;
}
