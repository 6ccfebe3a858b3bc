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

import privatedao.core.dao.DaoOptionKeys;
import privatedao.core.dao.exceptions.ErrorCode;
import privatedao.core.dao.exceptions.ValidationException;

import javax.inject.Inject;
import javax.inject.Named;

import java.nio.charset.StandardCharsets;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DaoConfigValidator {
    private final long minRevealWindowSeconds;

    @Inject
    public DaoConfigValidator(@Named(DaoOptionKeys.MIN_REVEAL_WINDOW_SECONDS) long minRevealWindowSeconds) {
        this.minRevealWindowSeconds = minRevealWindowSeconds;
    }

    public void validate(String name, int quorumPercentage, long requiredBalance, long revealWindowSeconds,
                         long executionDelaySeconds, VotingConfig votingConfig) throws ValidationException {
        if (name.getBytes(StandardCharsets.UTF_8).length > DaoConfig.MAX_NAME_LENGTH)
            throw new ValidationException(ErrorCode.NAME_TOO_LONG);
        if (!isPercentageValid(quorumPercentage))
            throw new ValidationException(ErrorCode.INVALID_QUORUM, "Quorum must be 1-100 but was " + quorumPercentage);
        if (requiredBalance < 0)
            throw new ValidationException(ErrorCode.INVALID_REQUIRED_BALANCE);
        if (revealWindowSeconds < minRevealWindowSeconds)
            throw new ValidationException(ErrorCode.REVEAL_WINDOW_TOO_SHORT,
                    "Reveal window must be at least " + minRevealWindowSeconds + " seconds");
        if (executionDelaySeconds < 0)
            throw new ValidationException(ErrorCode.INVALID_EXECUTION_DELAY);
        validateVotingConfig(votingConfig);
    }

    public void validateVotingConfig(VotingConfig votingConfig) throws ValidationException {
        if (votingConfig.getMode() != VotingMode.DUAL_CHAMBER)
            return;

        if (!isPercentageValid(votingConfig.getCapitalThreshold()) ||
                !isPercentageValid(votingConfig.getCommunityThreshold())) {
            log.debug("Rejected thresholds. votingConfig={}", votingConfig);
            throw new ValidationException(ErrorCode.INVALID_THRESHOLD);
        }
    }

    private static boolean isPercentageValid(int percentage) {
        return percentage > 0 && percentage <= 100;
    }
}
