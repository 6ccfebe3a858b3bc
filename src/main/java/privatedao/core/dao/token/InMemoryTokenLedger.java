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

import privatedao.core.dao.identity.Address;

import java.util.HashMap;
import java.util.Map;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;

@Slf4j
public class InMemoryTokenLedger implements TokenLedger {
    private final Map<Holding, Long> balances = new HashMap<>();

    @Override
    public synchronized long getBalance(Address owner, Address mint) {
        return balances.getOrDefault(new Holding(owner, mint), 0L);
    }

    @Override
    public synchronized void transfer(Address mint, Address from, Address to, long amount)
            throws TokenTransferException {
        if (amount <= 0)
            throw new TokenTransferException("Amount must be positive but was " + amount);
        long fromBalance = getBalance(from, mint);
        if (fromBalance < amount)
            throw new TokenTransferException("Insufficient token balance. owner=" + from + ", mint=" + mint +
                    ", balance=" + fromBalance + ", amount=" + amount);
        long toBalance = getBalance(to, mint);
        if (toBalance > Long.MAX_VALUE - amount)
            throw new TokenTransferException("Token balance overflow. owner=" + to);

        balances.put(new Holding(from, mint), fromBalance - amount);
        balances.put(new Holding(to, mint), toBalance + amount);
        log.debug("Transferred {} of mint {} from {} to {}", amount, mint, from, to);
    }

    /**
     * Issues new tokens to {@code owner}.
     */
    public synchronized void mint(Address mint, Address owner, long amount) {
        checkArgument(amount > 0, "amount must be positive");
        balances.merge(new Holding(owner, mint), amount, Math::addExact);
    }

    @Value
    private static class Holding {
        Address owner;
        Address mint;
    }
}
