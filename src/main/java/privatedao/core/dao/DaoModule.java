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

import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.config.DaoConfigValidator;
import privatedao.core.dao.plugin.VoterWeightService;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.state.DaoStateStore;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.DaoEventLog;
import privatedao.core.dao.time.HostClock;
import privatedao.core.dao.time.SystemHostClock;
import privatedao.core.dao.timelock.TimelockController;
import privatedao.core.dao.token.InMemoryTokenLedger;
import privatedao.core.dao.token.TokenLedger;
import privatedao.core.dao.treasury.LedgerTreasuryGateway;
import privatedao.core.dao.treasury.TreasuryGateway;
import privatedao.core.dao.treasury.TreasuryService;
import privatedao.core.dao.vote.blindvote.CommitVoteService;
import privatedao.core.dao.vote.delegation.DelegationService;
import privatedao.core.dao.vote.myvote.MyVoteService;
import privatedao.core.dao.vote.myvote.MyVoteStorage;
import privatedao.core.dao.vote.votereveal.VoteRevealService;
import privatedao.core.dao.vote.voteresult.VoteResultService;

import org.springframework.core.env.Environment;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

import static com.google.inject.name.Names.named;

public class DaoModule extends AbstractModule {
    private final Environment environment;

    public DaoModule(Environment environment) {
        this.environment = environment;
    }

    @Override
    protected void configure() {
        bind(DaoSetup.class).in(Singleton.class);
        bind(DaoFacade.class).in(Singleton.class);

        bind(DaoStateStore.class).in(Singleton.class);
        bind(DaoEventLog.class).in(Singleton.class);
        bind(StateService.class).in(Singleton.class);
        bind(HostClock.class).to(SystemHostClock.class).in(Singleton.class);

        bind(InMemoryTokenLedger.class).in(Singleton.class);
        bind(TokenLedger.class).to(InMemoryTokenLedger.class);
        bind(TreasuryGateway.class).to(LedgerTreasuryGateway.class).in(Singleton.class);

        bind(DaoConfigValidator.class).in(Singleton.class);
        bind(DaoConfigService.class).in(Singleton.class);
        bind(ProposalService.class).in(Singleton.class);
        bind(CommitVoteService.class).in(Singleton.class);
        bind(DelegationService.class).in(Singleton.class);
        bind(MyVoteStorage.class).in(Singleton.class);
        bind(MyVoteService.class).in(Singleton.class);
        bind(VoteRevealService.class).in(Singleton.class);
        bind(VoteResultService.class).in(Singleton.class);
        bind(TimelockController.class).in(Singleton.class);
        bind(TreasuryService.class).in(Singleton.class);
        bind(VoterWeightService.class).in(Singleton.class);

        bindLongConstant(DaoOptionKeys.REVEAL_REBATE_LAMPORTS);
        bindLongConstant(DaoOptionKeys.REVEAL_REBATE_RESERVE_LAMPORTS);
        bindLongConstant(DaoOptionKeys.PROPOSAL_DEPOSIT_LAMPORTS);
        bindLongConstant(DaoOptionKeys.VOTER_WEIGHT_EXPIRY_SLOTS);
        bindLongConstant(DaoOptionKeys.MIN_REVEAL_WINDOW_SECONDS);
        bindLongConstant(DaoOptionKeys.MIN_VOTING_DURATION_SECONDS);
        bindConstant().annotatedWith(named(DaoOptionKeys.MY_VOTE_STORAGE_DIR))
                .to(environment.getProperty(DaoOptionKeys.MY_VOTE_STORAGE_DIR, ""));
    }

    private void bindLongConstant(String key) {
        bindConstant().annotatedWith(named(key)).to(environment.getRequiredProperty(key, Long.class));
    }
}
