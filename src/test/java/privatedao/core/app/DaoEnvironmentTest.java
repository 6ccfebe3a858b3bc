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

package privatedao.core.app;

import privatedao.core.dao.DaoOptionKeys;

import java.io.IOException;

import java.util.Properties;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DaoEnvironmentTest {

    @Test
    public void testDefaultsAreLoaded() throws IOException {
        DaoEnvironment environment = new DaoEnvironment();

        assertEquals(Long.valueOf(1_000_000),
                environment.getRequiredProperty(DaoOptionKeys.REVEAL_REBATE_LAMPORTS, Long.class));
        assertEquals(Long.valueOf(1_500_000),
                environment.getRequiredProperty(DaoOptionKeys.REVEAL_REBATE_RESERVE_LAMPORTS, Long.class));
        assertEquals(Long.valueOf(10_565_280),
                environment.getRequiredProperty(DaoOptionKeys.PROPOSAL_DEPOSIT_LAMPORTS, Long.class));
        assertEquals(Long.valueOf(100),
                environment.getRequiredProperty(DaoOptionKeys.VOTER_WEIGHT_EXPIRY_SLOTS, Long.class));
        assertTrue(environment.getProperty(DaoOptionKeys.MY_VOTE_STORAGE_DIR, "").isEmpty());
    }

    @Test
    public void testOverridesWin() throws IOException {
        Properties overrides = new Properties();
        overrides.setProperty(DaoOptionKeys.MIN_REVEAL_WINDOW_SECONDS, "3600");

        DaoEnvironment environment = new DaoEnvironment(overrides);

        assertEquals(Long.valueOf(3_600),
                environment.getRequiredProperty(DaoOptionKeys.MIN_REVEAL_WINDOW_SECONDS, Long.class));
        assertEquals(Long.valueOf(5),
                environment.getRequiredProperty(DaoOptionKeys.MIN_VOTING_DURATION_SECONDS, Long.class));
        assertEquals(DaoEnvironment.OVERRIDES_PROPERTY_SOURCE_NAME,
                environment.getPropertySources().iterator().next().getName());
    }
}
