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

package privatedao.core.dao.timelock;

import privatedao.core.dao.config.DaoConfigService;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.exceptions.DaoException;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.identity.Address;
import privatedao.core.dao.proposal.Proposal;
import privatedao.core.dao.proposal.ProposalService;
import privatedao.core.dao.proposal.ProposalStatus;
import privatedao.core.dao.proposal.TreasuryAction;
import privatedao.core.dao.proposal.TreasuryActionValidator;
import privatedao.core.dao.state.RecordKeys;
import privatedao.core.dao.state.StateService;
import privatedao.core.dao.state.events.DaoEvent;
import privatedao.core.dao.state.events.ProposalVetoed;
import privatedao.core.dao.state.events.TreasuryExecuted;
import privatedao.core.dao.state.events.TreasuryExecutionFailed;
import privatedao.core.dao.treasury.TreasuryGateway;
import privatedao.core.dao.treasury.TreasuryTransferException;

import javax.inject.Inject;

import java.util.Collections;

import lombok.extern.slf4j.Slf4j;

/**
 * Gate between a passed proposal and its treasury action. Execution waits for the timelock, during which the
 * authority may veto.
 */
@Slf4j
public class TimelockController {
    private final StateService stateService;
    private final TreasuryGateway treasuryGateway;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public TimelockController(StateService stateService, TreasuryGateway treasuryGateway) {
        this.stateService = stateService;
        this.treasuryGateway = treasuryGateway;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void vetoProposal(Address authority, Address proposalKey) throws DaoException {
        stateService.execute("vetoProposal", transaction -> {
            Proposal proposal = ProposalService.getProposal(transaction, proposalKey);
            DaoConfigService.requireAuthority(transaction, proposal.getDao(), authority);
            DaoChecks.require(proposal.getStatus() == ProposalStatus.PASSED, ErrorCode.PROPOSAL_NOT_PASSED);
            if (proposal.isExecuted())
                throw DaoException.of(ErrorCode.VETO_WINDOW_EXPIRED, "Proposal was already executed");
            DaoChecks.require(transaction.getUnixTimestamp() < proposal.getExecutionUnlocksAt(),
                    ErrorCode.VETO_WINDOW_EXPIRED);

            proposal.veto();
            transaction.putRecord(proposalKey, proposal);
            transaction.emit(new ProposalVetoed(proposalKey, authority));
            log.info("Proposal vetoed. proposal={}, vetoedBy={}", proposalKey, authority);
            return null;
        });
    }

    /**
     * Marks the proposal executed and then hands its treasury action to the {@link TreasuryGateway}. The mark is
     * committed before the hand-off, so the action is attempted at most once even if the transfer fails.
     *
     * @param target recipient the caller intends to pay; must equal the action's recipient
     */
    public ExecutionReceipt execute(Address caller, Address proposalKey, Address target) throws DaoException {
        Proposal proposal = stateService.execute("execute", transaction -> {
            Proposal p = ProposalService.getProposal(transaction, proposalKey);
            DaoChecks.require(p.getStatus() == ProposalStatus.PASSED, ErrorCode.PROPOSAL_NOT_PASSED);
            DaoChecks.require(!p.isExecuted(), ErrorCode.ALREADY_EXECUTED);
            DaoChecks.require(transaction.getUnixTimestamp() >= p.getExecutionUnlocksAt(),
                    ErrorCode.EXECUTION_TIMELOCK_ACTIVE);

            if (p.getTreasuryAction() != null) {
                // Re-check in case the stored record was altered after creation
                TreasuryActionValidator.validate(p.getTreasuryAction());
                DaoChecks.require(p.getTreasuryAction().getRecipient().equals(target),
                        ErrorCode.TREASURY_RECIPIENT_MISMATCH);
            }

            p.markExecuted();
            transaction.putRecord(proposalKey, p);
            log.info("Proposal executed. proposal={}, caller={}", proposalKey, caller);
            return p;
        });

        TreasuryAction action = proposal.getTreasuryAction();
        if (action == null)
            return new ExecutionReceipt(proposalKey, null, null);

        Address treasuryKey = RecordKeys.getTreasuryKey(proposal.getDao());
        try {
            handOff(treasuryKey, proposalKey, action);
        } catch (TreasuryTransferException e) {
            log.error("Treasury action of proposal {} failed downstream. It will not be attempted again.",
                    proposalKey, e);
            publish(new TreasuryExecutionFailed(proposalKey, e.getMessage()));
            return new ExecutionReceipt(proposalKey, action, e.getMessage());
        }
        publish(new TreasuryExecuted(proposalKey, action.getAmount(), action.getRecipient()));
        return new ExecutionReceipt(proposalKey, action, null);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private void handOff(Address treasuryKey, Address proposalKey, TreasuryAction action)
            throws TreasuryTransferException {
        switch (action.getActionType()) {
            case SEND_SOL:
                treasuryGateway.sendNative(treasuryKey, action.getRecipient(), action.getAmount());
                break;
            case SEND_TOKEN:
                treasuryGateway.sendToken(treasuryKey, action.getTokenMint(), action.getRecipient(),
                        action.getAmount());
                break;
            case CUSTOM_CPI:
                treasuryGateway.invokeCustom(treasuryKey, proposalKey, action.getRecipient());
                break;
            default:
                throw new IllegalStateException("Unhandled action type " + action.getActionType());
        }
    }

    private void publish(DaoEvent event) {
        stateService.getEventLog().append(Collections.singletonList(event));
    }
}
