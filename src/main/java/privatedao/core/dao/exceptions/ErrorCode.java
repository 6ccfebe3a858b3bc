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

package privatedao.core.dao.exceptions;

import lombok.Getter;

/**
 * All reasons a request can be rejected. The category decides which {@link DaoException} subclass is thrown.
 */
public enum ErrorCode {
    // Config
    NAME_TOO_LONG(Category.VALIDATION, "DAO name max 64 bytes"),
    INVALID_QUORUM(Category.VALIDATION, "Quorum must be 1-100"),
    INVALID_THRESHOLD(Category.VALIDATION, "Threshold must be 1-100"),
    REVEAL_WINDOW_TOO_SHORT(Category.VALIDATION, "Reveal window is below the minimum"),
    INVALID_EXECUTION_DELAY(Category.VALIDATION, "Execution delay must be non-negative"),
    INVALID_REQUIRED_BALANCE(Category.VALIDATION, "Required token balance must be non-negative"),

    // Proposal
    TITLE_TOO_LONG(Category.VALIDATION, "Title max 128 bytes"),
    DESCRIPTION_TOO_LONG(Category.VALIDATION, "Description max 1024 bytes"),
    VOTING_DURATION_TOO_SHORT(Category.VALIDATION, "Voting duration is below the minimum"),
    INVALID_TREASURY_ACTION(Category.VALIDATION, "Treasury action payload is invalid"),
    TOKEN_MINT_REQUIRED(Category.VALIDATION, "SendToken action requires a token mint"),
    TREASURY_RECIPIENT_MISMATCH(Category.VALIDATION, "Executor must use the action recipient"),
    PROPOSAL_NOT_CANCELLABLE(Category.STATE, "Can only cancel proposals that are voting"),
    PROPOSAL_NOT_PASSED(Category.STATE, "Proposal did not pass"),
    ALREADY_EXECUTED(Category.STATE, "Treasury action already executed"),
    EXECUTION_TIMELOCK_ACTIVE(Category.WINDOW, "Execution timelock has not yet expired"),
    VETO_WINDOW_EXPIRED(Category.WINDOW, "Veto window has expired"),
    PROPOSAL_NOT_FOUND(Category.STATE, "Proposal does not exist"),
    DAO_NOT_FOUND(Category.STATE, "DAO config does not exist"),

    // Voting
    VOTING_NOT_OPEN(Category.STATE, "Voting is not open"),
    VOTING_CLOSED(Category.WINDOW, "Voting period has closed"),
    ALREADY_COMMITTED(Category.DUPLICATE, "Already committed a vote"),
    INSUFFICIENT_TOKENS(Category.VALIDATION, "Not enough governance tokens"),
    INVALID_TOKEN_BALANCE(Category.VALIDATION, "Token ledger reported a negative balance"),
    INVALID_COMMITMENT(Category.VALIDATION, "Commitment must be 32 bytes"),
    INVALID_SALT(Category.VALIDATION, "Salt must be 32 bytes"),
    REVEAL_TOO_EARLY(Category.STATE, "Reveal phase has not started yet"),
    REVEAL_CLOSED(Category.WINDOW, "Reveal window has closed"),
    NOT_COMMITTED(Category.STATE, "No commitment found for this voter"),
    ALREADY_REVEALED(Category.DUPLICATE, "Vote already revealed"),
    COMMITMENT_MISMATCH(Category.CRYPTO_MISMATCH, "Commitment hash does not match"),
    NOT_AUTHORIZED_TO_REVEAL(Category.AUTHORIZATION, "Not authorized to reveal this vote"),

    // Delegation
    DELEGATION_ALREADY_USED(Category.DUPLICATE, "This delegation has already been used"),
    DELEGATION_EXISTS(Category.DUPLICATE, "Delegator already delegated on this proposal"),
    DELEGATION_NOT_FOUND(Category.STATE, "Delegation does not exist"),
    NOT_DELEGATEE(Category.AUTHORIZATION, "Caller is not the designated delegatee"),
    WRONG_PROPOSAL(Category.VALIDATION, "Delegation belongs to a different proposal"),
    SELF_DELEGATION(Category.VALIDATION, "Delegator and delegatee must differ"),

    // Finalization
    REVEAL_STILL_OPEN(Category.WINDOW, "Reveal phase is still open"),
    ALREADY_FINALIZED(Category.STATE, "Proposal has already been finalized"),

    // Roles and records
    NOT_AUTHORITY(Category.AUTHORIZATION, "Caller is not the DAO authority"),
    RECORD_EXISTS(Category.DUPLICATE, "Record already exists"),
    GOVERNING_MINT_MISMATCH(Category.VALIDATION, "Governing mint must match DAO governance token"),
    INSUFFICIENT_FUNDS(Category.VALIDATION, "Not enough lamports"),
    INVALID_AMOUNT(Category.VALIDATION, "Amount must be positive"),

    OVERFLOW(Category.ARITHMETIC, "Arithmetic overflow");

    public enum Category {
        VALIDATION,
        STATE,
        AUTHORIZATION,
        CRYPTO_MISMATCH,
        DUPLICATE,
        WINDOW,
        ARITHMETIC
    }

    @Getter
    private final Category category;
    @Getter
    private final String message;

    ErrorCode(Category category, String message) {
        this.category = category;
        this.message = message;
    }
}
