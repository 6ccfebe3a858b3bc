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

import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.ValidationException;
import privatedao.core.dao.identity.Address;

/**
 * Shape rules of a treasury action. Checked at proposal creation and again before execution.
 */
public class TreasuryActionValidator {

    public static void validate(TreasuryAction action) throws ValidationException {
        switch (action.getActionType()) {
            case SEND_SOL:
                require(action.getAmount() > 0, "SendSol amount must be positive");
                require(action.getTokenMint() == null, "SendSol must not name a token mint");
                requireRecipient(action.getRecipient());
                break;
            case SEND_TOKEN:
                require(action.getAmount() > 0, "SendToken amount must be positive");
                if (action.getTokenMint() == null)
                    throw new ValidationException(ErrorCode.TOKEN_MINT_REQUIRED);
                requireRecipient(action.getRecipient());
                break;
            case CUSTOM_CPI:
                require(action.getAmount() == 0, "CustomCPI must not carry an amount");
                require(action.getTokenMint() == null, "CustomCPI must not name a token mint");
                requireRecipient(action.getRecipient());
                break;
            default:
                throw new IllegalStateException("Unhandled action type " + action.getActionType());
        }
    }

    private static void requireRecipient(Address recipient) throws ValidationException {
        require(recipient != null && !recipient.isDefault(), "Recipient must not be the default address");
    }

    private static void require(boolean condition, String message) throws ValidationException {
        if (!condition)
            throw new ValidationException(ErrorCode.INVALID_TREASURY_ACTION, message);
    }
}
