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

package privatedao.core.dao.vote.votereveal;

import privatedao.core.dao.vote.myvote.MyVote;

import lombok.Getter;

/**
 * Failure of an automatic reveal. Kept in a list instead of being thrown, as no user request triggered it.
 */
@Getter
public class VoteRevealException extends Exception {
    private final MyVote myVote;

    public VoteRevealException(String message, Throwable cause, MyVote myVote) {
        super(message, cause);
        this.myVote = myVote;
    }

    @Override
    public String toString() {
        return "VoteRevealException{" +
                "\n     myVote=" + myVote +
                ",\n     cause=" + getCause() +
                "\n} " + super.toString();
    }
}
