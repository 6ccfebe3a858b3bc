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

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class DaoExceptionTest {

    @Test
    public void testCategoryDecidesSubclass() {
        assertThat(DaoException.of(ErrorCode.INVALID_QUORUM), instanceOf(ValidationException.class));
        assertThat(DaoException.of(ErrorCode.PROPOSAL_NOT_FOUND), instanceOf(StateException.class));
        assertThat(DaoException.of(ErrorCode.NOT_AUTHORITY), instanceOf(AuthorizationException.class));
        assertThat(DaoException.of(ErrorCode.COMMITMENT_MISMATCH), instanceOf(CryptoMismatchException.class));
        assertThat(DaoException.of(ErrorCode.ALREADY_REVEALED), instanceOf(DuplicateException.class));
        assertThat(DaoException.of(ErrorCode.REVEAL_CLOSED), instanceOf(WindowException.class));
        assertThat(DaoException.of(ErrorCode.OVERFLOW), instanceOf(ArithmeticOverflowException.class));
    }

    @Test
    public void testEveryCodeMapsToItsCategory() {
        for (ErrorCode errorCode : ErrorCode.values()) {
            DaoException exception = DaoException.of(errorCode);
            assertEquals(errorCode, exception.getErrorCode());
            assertEquals(errorCode.getMessage(), exception.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCodeOfOtherCategoryIsRejected() {
        new WindowException(ErrorCode.INVALID_QUORUM);
    }

    @Test
    public void testCheckedArithmetic() throws ArithmeticOverflowException {
        assertEquals(Long.MAX_VALUE, DaoChecks.add(Long.MAX_VALUE - 1, 1));
        assertEquals(600, DaoChecks.multiply(6, 100));
        try {
            DaoChecks.multiply(Long.MAX_VALUE / 2 + 1, 2);
            fail("Expected ArithmeticOverflowException");
        } catch (ArithmeticOverflowException expected) {
            assertEquals(ErrorCode.OVERFLOW, expected.getErrorCode());
        }
    }

    @Test(expected = ArithmeticOverflowException.class)
    public void testAddOverflow() throws ArithmeticOverflowException {
        DaoChecks.add(Long.MAX_VALUE, 1);
    }

    @Test
    public void testRequire() throws DaoException {
        DaoChecks.require(true, ErrorCode.REVEAL_CLOSED);
        try {
            DaoChecks.require(false, ErrorCode.REVEAL_CLOSED);
            fail("Expected WindowException");
        } catch (WindowException expected) {
            assertEquals(ErrorCode.REVEAL_CLOSED, expected.getErrorCode());
        }
    }
}
