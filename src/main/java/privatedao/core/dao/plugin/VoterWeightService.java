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

package privatedao.core.dao.plugin;

import privatedao.core.dao.DaoOptionKeys;
import privatedao.core.dao.config.DaoConfig;
import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.token.TokenLedger;
import privatedao.core.dao.vote.VoteWeightConsensus;
import privatedao.core.dao.vote.VoterRecord;

import javax.inject.Inject;
import javax.inject.Named;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Publishes voting power to an external governance platform through {@link VoterWeightRecord}s.
 */
@Slf4j
public class VoterWeightService {
    private final StateService stateService;
    private final TokenLedger tokenLedger;
    private final long voterWeightExpirySlots;

    @Inject
    public VoterWeightService(StateService stateService,
                              TokenLedger tokenLedger,
                              @Named(DaoOptionKeys.VOTER_WEIGHT_EXPIRY_SLOTS) long voterWeightExpirySlots) {
        this.stateService = stateService;
        this.tokenLedger = tokenLedger;
        this.voterWeightExpirySlots = voterWeightExpirySlots;
    }

    /**
     * Creates or overwrites the voter's record for the realm with the current weight. Every sync moves the expiry
     * to the current slot plus {@code voterWeightExpirySlots}.
     */
    public VoterWeightRecord syncExternalVotingWeight(Address voter, Address daoKey, Address realm,
                                                      Address governingTokenMint) throws DaoException {
        return stateService.execute("syncExternalVotingWeight", transaction -> {
            DaoConfig daoConfig = DaoConfigService.getConfig(transaction, daoKey);
            DaoChecks.require(daoConfig.getGovernanceToken().equals(governingTokenMint),
                    ErrorCode.GOVERNING_MINT_MISMATCH);

            long rawBalance = tokenLedger.getVotingBalance(voter, governingTokenMint);
            long weight = VoteWeightConsensus.getExternalWeight(daoConfig.getVotingConfig().getMode(), rawBalance);
            long expiry = DaoChecks.add(transaction.getSlot(), voterWeightExpirySlots);
            VoterWeightRecord record = new VoterWeightRecord(realm, governingTokenMint, voter, weight, expiry,
                    null, null);
            transaction.putRecord(RecordKeys.getVoterWeightRecordKey(realm, governingTokenMint, voter), record);
            log.info("Voter weight synced. realm={}, voter={}, weight={}, expiry={}", realm, voter, weight, expiry);
            return record;
        });
    }

    /**
     * @return the community weight the voter committed on the proposal, 0 if it did not commit.
     */
    public long readCommittedWeight(Address proposalKey, Address voter) throws DaoException {
        Address voterRecordKey = RecordKeys.getVoterRecordKey(proposalKey, voter);
        return stateService.query(transaction -> transaction.findRecord(voterRecordKey, VoterRecord.TYPE)
                .filter(VoterRecord::isCommitted)
                .map(VoterRecord::getCommunityWeight)
                .orElse(0L));
    }

    public Optional<VoterWeightRecord> findVoterWeightRecord(Address realm, Address governingTokenMint,
                                                             Address owner) throws DaoException {
        Address key = RecordKeys.getVoterWeightRecordKey(realm, governingTokenMint, owner);
        return stateService.query(transaction -> transaction.findRecord(key, VoterWeightRecord.TYPE));
    }
}
