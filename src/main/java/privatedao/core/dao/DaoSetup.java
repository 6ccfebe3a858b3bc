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

package privatedao.core.dao;

import privatedao.core.dao.vote.myvote.MyVoteService;

import javax.inject.Inject;

import lombok.extern.slf4j.Slf4j;

/**
 * Starts the services which hold state outside of the store.
 */
@Slf4j
public class DaoSetup {
    private final MyVoteService myVoteService;

    @Inject
    public DaoSetup(MyVoteService myVoteService) {
        this.myVoteService = myVoteService;
    }

    public void onAllServicesInitialized() {
        myVoteService.readPersisted();
        log.info("DAO services initialized. {} own votes loaded", myVoteService.getMyVoteList().size());
    }
}
