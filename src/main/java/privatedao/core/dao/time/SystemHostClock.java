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

package privatedao.core.dao.time;

import java.time.Clock;

import javax.inject.Inject;

public class SystemHostClock implements HostClock {
    // 400 ms slots
    static final long SLOT_MILLIS = 400;

    private final Clock clock;

    @Inject
    public SystemHostClock() {
        this(Clock.systemUTC());
    }

    SystemHostClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long getUnixTimestamp() {
        return clock.millis() / 1000;
    }

    @Override
    public long getSlot() {
        return clock.millis() / SLOT_MILLIS;
    }
}
