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

import privatedao.core.dao.identity.Address;

/**
 * Moves value out of a DAO treasury once the timelock authorized it. Only called after the authorizing state
 * change has been committed, so a failure here never undoes the authorization.
 */
public interface TreasuryGateway {

    void sendNative(Address treasury, Address recipient, long lamports) throws TreasuryTransferException;

    void sendToken(Address treasury, Address mint, Address recipient, long amount) throws TreasuryTransferException;

    /**
     * Hands a custom invocation to whoever relays it. Moves no value itself.
     */
    void invokeCustom(Address treasury, Address proposal, Address target) throws TreasuryTransferException;
}
