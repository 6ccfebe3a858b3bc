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

package privatedao.core.dao.treasury;

import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.token.TokenLedger;
import privatedao.core.dao.token.TokenTransferException;

import javax.inject.Inject;

import lombok.extern.slf4j.Slf4j;

/**
 * Native lamports move inside the state store in a request of their own, tokens move on the {@link TokenLedger}.
 * Custom invocations are only logged for an off-process relayer, which also reads the published
 * {@link privatedao.core.dao.state.events.TreasuryExecuted} event.
 */
@Slf4j
public class LedgerTreasuryGateway implements TreasuryGateway {
    private final StateService stateService;
    private final TokenLedger tokenLedger;

    @Inject
    public LedgerTreasuryGateway(StateService stateService, TokenLedger tokenLedger) {
        this.stateService = stateService;
        this.tokenLedger = tokenLedger;
    }

    @Override
    public void sendNative(Address treasury, Address recipient, long lamports) throws TreasuryTransferException {
        try {
            stateService.execute("treasurySendNative", transaction -> {
                transaction.transferLamports(treasury, recipient, lamports);
                return null;
            });
        } catch (DaoException e) {
            throw new TreasuryTransferException("Native transfer of " + lamports + " lamports from treasury " +
                    treasury + " failed", e);
        }
    }

    @Override
    public void sendToken(Address treasury, Address mint, Address recipient, long amount)
            throws TreasuryTransferException {
        try {
            tokenLedger.transfer(mint, treasury, recipient, amount);
        } catch (TokenTransferException e) {
            throw new TreasuryTransferException("Token transfer of " + amount + " from treasury " + treasury +
                    " failed", e);
        }
    }

    @Override
    public void invokeCustom(Address treasury, Address proposal, Address target) {
        log.info("Custom invocation handed to relayer. treasury={}, proposal={}, target={}", treasury, proposal, target);
    }
}
