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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Base of all request rejections. A rejected request has no effect on state.
 */
@Getter
public abstract class DaoException extends Exception {
    private final ErrorCode errorCode;

    protected DaoException(ErrorCode errorCode, ErrorCode.Category expectedCategory) {
        this(errorCode, expectedCategory, errorCode.getMessage());
    }

    protected DaoException(ErrorCode errorCode, ErrorCode.Category expectedCategory, String message) {
        super(message);
        checkArgument(errorCode.getCategory() == expectedCategory,
                "%s is not of category %s", errorCode, expectedCategory);
        this.errorCode = errorCode;
    }

    public static DaoException of(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    public static DaoException of(ErrorCode errorCode, String message) {
        switch (errorCode.getCategory()) {
            case VALIDATION:
                return new ValidationException(errorCode, message);
            case STATE:
                return new StateException(errorCode, message);
            case AUTHORIZATION:
                return new AuthorizationException(errorCode, message);
            case CRYPTO_MISMATCH:
                return new CryptoMismatchException(errorCode, message);
            case DUPLICATE:
                return new DuplicateException(errorCode, message);
            case WINDOW:
                return new WindowException(errorCode, message);
            case ARITHMETIC:
                return new ArithmeticOverflowException(errorCode, message);
            default:
                throw new IllegalStateException("Unhandled category " + errorCode.getCategory());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "\n     errorCode=" + errorCode +
                ",\n     message=" + getMessage() +
                "\n}";
    }
}
