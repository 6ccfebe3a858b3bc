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

package privatedao.core.dao.config;

import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.DaoTransaction;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.DaoCreated;
import privatedao.core.dao.state.events.DaoMigrated;

import javax.inject.Inject;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Creates DAO configurations. A configuration is never changed afterwards except for its proposal counter; a DAO
 * which wants other rules creates a new one.
 */
@Slf4j
public class DaoConfigService {
    private final StateService stateService;
    private final DaoConfigValidator daoConfigValidator;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public DaoConfigService(StateService stateService, DaoConfigValidator daoConfigValidator) {
        this.stateService = stateService;
        this.daoConfigValidator = daoConfigValidator;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    /**
     * @return the key of the new DAO.
     */
    public Address createConfig(Address authority, String name, Address governanceToken, int quorumPercentage,
                                long requiredBalance, long revealWindowSeconds, long executionDelaySeconds,
                                VotingConfig votingConfig) throws DaoException {
        checkNotNull(authority, "authority must not be null");
        checkNotNull(name, "name must not be null");
        checkNotNull(governanceToken, "governanceToken must not be null");
        checkNotNull(votingConfig, "votingConfig must not be null");
        daoConfigValidator.validate(name, quorumPercentage, requiredBalance, revealWindowSeconds,
                executionDelaySeconds, votingConfig);

        DaoConfig daoConfig = new DaoConfig(authority, name, governanceToken, quorumPercentage, requiredBalance,
                revealWindowSeconds, executionDelaySeconds, votingConfig, 0, null);
        return stateService.execute("createConfig", transaction -> {
            Address daoKey = storeConfig(transaction, daoConfig);
            transaction.emit(new DaoCreated(daoKey, name, authority));
            log.info("DAO created. name={}, dao={}, votingConfig={}", name, daoKey, votingConfig);
            return daoKey;
        });
    }

    /**
     * Mirrors a DAO of an external governance system. The new DAO does not enforce a minimum balance and keeps
     * the external reference for information only.
     */
    public Address migrateConfig(Address authority, String name, Address governanceToken, Address migratedFrom,
                                 int quorumPercentage, long revealWindowSeconds, long executionDelaySeconds,
                                 VotingConfig votingConfig) throws DaoException {
        checkNotNull(authority, "authority must not be null");
        checkNotNull(name, "name must not be null");
        checkNotNull(governanceToken, "governanceToken must not be null");
        checkNotNull(migratedFrom, "migratedFrom must not be null");
        checkNotNull(votingConfig, "votingConfig must not be null");
        daoConfigValidator.validate(name, quorumPercentage, 0, revealWindowSeconds, executionDelaySeconds,
                votingConfig);

        DaoConfig daoConfig = new DaoConfig(authority, name, governanceToken, quorumPercentage, 0,
                revealWindowSeconds, executionDelaySeconds, votingConfig, 0, migratedFrom);
        return stateService.execute("migrateConfig", transaction -> {
            Address daoKey = storeConfig(transaction, daoConfig);
            transaction.emit(new DaoMigrated(daoKey, name, migratedFrom, governanceToken));
            log.info("DAO migrated. name={}, dao={}, migratedFrom={}", name, daoKey, migratedFrom);
            return daoKey;
        });
    }

    public Optional<DaoConfig> findConfig(Address daoKey) {
        try {
            return stateService.query(transaction -> transaction.findRecord(daoKey, DaoConfig.TYPE));
        } catch (DaoException e) {
            // findRecord does not reject
            throw new IllegalStateException(e);
        }
    }

    public static DaoConfig getConfig(DaoTransaction transaction, Address daoKey) throws DaoException {
        return transaction.getRecord(daoKey, DaoConfig.TYPE, ErrorCode.DAO_NOT_FOUND);
    }

    /**
     * Rejects unless the caller is the authority of the given DAO.
     */
    public static DaoConfig requireAuthority(DaoTransaction transaction, Address daoKey, @Nullable Address caller)
            throws DaoException {
        DaoConfig daoConfig = getConfig(transaction, daoKey);
        if (!daoConfig.getAuthority().equals(caller))
            throw DaoException.of(ErrorCode.NOT_AUTHORITY, "Caller " + caller + " is not the authority of " + daoKey);
        return daoConfig;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private Address storeConfig(DaoTransaction transaction, DaoConfig daoConfig) throws DaoException {
        Address daoKey = RecordKeys.getDaoKey(daoConfig.getAuthority(), daoConfig.getName());
        transaction.createRecord(daoKey, daoConfig);
        return daoKey;
    }
}
