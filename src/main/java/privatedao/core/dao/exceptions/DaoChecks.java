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

/**
 * Request level guards. Unlike Guava's Preconditions these throw checked {@link DaoException}s, so a failing guard
 * rejects the request instead of signalling a programming error.
 */
public class DaoChecks {

    public static void require(boolean condition, ErrorCode errorCode) throws DaoException {
        if (!condition)
            throw DaoException.of(errorCode);
    }

    public static long add(long a, long b) throws ArithmeticOverflowException {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException(ErrorCode.OVERFLOW, "Overflow at " + a + " + " + b);
        }
    }

    public static long multiply(long a, long b) throws ArithmeticOverflowException {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException(ErrorCode.OVERFLOW, "Overflow at " + a + " * " + b);
        }
    }
}
