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

package privatedao.core.dao.vote.voteresult;

import privatedao.core.dao.config.VotingConfig;
import privatedao.core.dao.exceptions.ArithmeticOverflowException;
import privatedao.core.dao.exceptions.DaoChecks;
import privatedao.core.dao.proposal.Proposal;

import java.math.BigInteger;

import lombok.extern.slf4j.Slf4j;

/**
 * Pass rules. All comparisons are on cross multiplied integers, there is no rounding tolerance.
 */
@Slf4j
public class VoteResultConsensus {

    /**
     * Quorum counts voters, not weight: at least {@code quorumPercentage} percent of the committed voters must
     * have revealed.
     */
    public static boolean isQuorumMet(long commitCount, long revealCount, int quorumPercentage)
            throws ArithmeticOverflowException {
        return commitCount > 0 &&
                DaoChecks.multiply(revealCount, 100) >= DaoChecks.multiply(commitCount, quorumPercentage);
    }

    public static boolean isPassed(VotingConfig votingConfig, long yesCapital, long noCapital, long yesCommunity,
                                   long noCommunity) throws ArithmeticOverflowException {
        switch (votingConfig.getMode()) {
            case TOKEN_WEIGHTED:
                return hasMajority(yesCapital, noCapital);
            case QUADRATIC:
                return hasMajority(yesCommunity, noCommunity);
            case DUAL_CHAMBER:
                // Each chamber has to clear its own threshold
                boolean capitalPasses = clearsThreshold(yesCapital, noCapital, votingConfig.getCapitalThreshold());
                boolean communityPasses = clearsThreshold(yesCommunity, noCommunity,
                        votingConfig.getCommunityThreshold());
                log.debug("capitalPasses={}, communityPasses={}", capitalPasses, communityPasses);
                return capitalPasses && communityPasses;
            default:
                throw new IllegalStateException("Unhandled voting mode " + votingConfig.getMode());
        }
    }

    public static VoteResult getVoteResult(VotingConfig votingConfig, int quorumPercentage, Proposal proposal)
            throws ArithmeticOverflowException {
        boolean quorumMet = isQuorumMet(proposal.getCommitCount(), proposal.getRevealCount(), quorumPercentage);
        boolean passed = quorumMet && isPassed(votingConfig, proposal.getYesCapital(), proposal.getNoCapital(),
                proposal.getYesCommunity(), proposal.getNoCommunity());
        return new VoteResult(quorumMet, passed);
    }

    // A tie fails
    private static boolean hasMajority(long yes, long no) throws ArithmeticOverflowException {
        long total = DaoChecks.add(yes, no);
        return total > 0 && yes > no;
    }

    private static boolean clearsThreshold(long yes, long no, int thresholdPercentage)
            throws ArithmeticOverflowException {
        long total = DaoChecks.add(yes, no);
        return total > 0 &&
                BigInteger.valueOf(yes).multiply(BigInteger.valueOf(100))
                        .compareTo(BigInteger.valueOf(total).multiply(BigInteger.valueOf(thresholdPercentage))) >= 0;
    }
}
