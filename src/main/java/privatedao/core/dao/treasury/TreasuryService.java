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

import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.TreasuryDeposit;

import javax.inject.Inject;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TreasuryService {
    private final StateService stateService;

    @Inject
    public TreasuryService(StateService stateService) {
        this.stateService = stateService;
    }

    public void depositTreasury(Address depositor, Address daoKey, long amount) throws DaoException {
        stateService.execute("depositTreasury", transaction -> {
            DaoConfigService.getConfig(transaction, daoKey);
            DaoChecks.require(amount > 0, ErrorCode.INVALID_AMOUNT);
            Address treasuryKey = RecordKeys.getTreasuryKey(daoKey);
            transaction.transferLamports(depositor, treasuryKey, amount);

            transaction.emit(new TreasuryDeposit(daoKey, depositor, amount));
            log.info("Treasury deposit. dao={}, from={}, amount={}", daoKey, depositor, amount);
            return null;
        });
    }

    public long getTreasuryBalance(Address daoKey) {
        return stateService.getLamports(RecordKeys.getTreasuryKey(daoKey));
    }
}
