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

package privatedao.core.dao.vote.myvote;

import privatedao.core.dao.identity.Address;
import privatedao.core.dao.vote.blindvote.BlindVoteConsensus;

import org.bitcoinj.core.Utils;

import java.util.Date;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A vote as the voter remembers it: the secret half of a commitment. Without the salt the vote can not be revealed.
 */
@Getter
@EqualsAndHashCode
public class MyVote {
    private Address proposal;
    private Address voter;
    private boolean voteYes;
    private byte[] salt;
    @EqualsAndHashCode.Exclude
    private long date;
    @EqualsAndHashCode.Exclude
    private boolean revealed;

    public MyVote(Address proposal, Address voter, boolean voteYes, byte[] salt) {
        this.proposal = proposal;
        this.voter = voter;
        this.voteYes = voteYes;
        this.salt = salt.clone();
        this.date = new Date().getTime();
    }

    // Used by Gson
    @SuppressWarnings("unused")
    private MyVote() {
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public byte[] getCommitment() {
        return BlindVoteConsensus.getCommitment(voteYes, salt, voter);
    }

    void setRevealed() {
        revealed = true;
    }

    @Override
    public String toString() {
        return "MyVote{" +
                "\n     proposal=" + proposal +
                ",\n     voter=" + voter +
                ",\n     commitment=" + Utils.HEX.encode(getCommitment()) +
                ",\n     date=" + new Date(date) +
                ",\n     revealed=" + revealed +
                "\n}";
    }
}
