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

import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.layout.RecordReader;
import privatedao.core.dao.state.layout.RecordWriter;

import lombok.Value;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Guarded treasury action attached to a proposal at creation. Never changed afterwards.
 */
@Immutable
@Value
public class TreasuryAction {
    // type + amount + recipient + optional token mint
    public static final int LEN = 1 + 8 + Address.LENGTH + (1 + Address.LENGTH);

    TreasuryActionType actionType;
    long amount;
    Address recipient;
    @Nullable
    Address tokenMint;

    public static TreasuryAction sendSol(long lamports, Address recipient) {
        return new TreasuryAction(TreasuryActionType.SEND_SOL, lamports, recipient, null);
    }

    public static TreasuryAction sendToken(long amount, Address recipient, Address tokenMint) {
        return new TreasuryAction(TreasuryActionType.SEND_TOKEN, amount, recipient, tokenMint);
    }

    public static TreasuryAction customCpi(Address target) {
        return new TreasuryAction(TreasuryActionType.CUSTOM_CPI, 0, target, null);
    }

    // Option slot: presence byte plus LEN bytes, zeroed when absent
    static void writeOptional(RecordWriter writer, @Nullable TreasuryAction action) {
        writer.writeBoolean(action != null);
        if (action == null) {
            writer.skip(LEN);
            return;
        }
        writer.writeU8(action.actionType.getTag())
                .writeLong(action.amount)
                .writeAddress(action.recipient)
                .writeOptionalAddress(action.tokenMint);
    }

    @Nullable
    static TreasuryAction readOptional(RecordReader reader) {
        if (!reader.readBoolean()) {
            reader.skip(LEN);
            return null;
        }
        TreasuryActionType actionType = TreasuryActionType.fromTag(reader.readU8());
        long amount = reader.readLong();
        Address recipient = reader.readAddress();
        Address tokenMint = reader.readOptionalAddress();
        return new TreasuryAction(actionType, amount, recipient, tokenMint);
    }
}
