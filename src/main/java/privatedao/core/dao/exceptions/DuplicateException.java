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
 * Second commit, reused delegation, double reveal or an already existing record.
 */
public class DuplicateException extends DaoException {
    public DuplicateException(ErrorCode errorCode) {
        super(errorCode, ErrorCode.Category.DUPLICATE);
    }

    public DuplicateException(ErrorCode errorCode, String message) {
        super(errorCode, ErrorCode.Category.DUPLICATE, message);
    }
}
