package com.coopvault.governance;

import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating proposal status transitions.
 *
 * <pre>
 *   SUBMITTED -> VOTABLE | APPROVED | REJECTED | WITHDRAWN
 *   VOTABLE   -> APPROVED | REJECTED | WITHDRAWN
 *   APPROVED  -> FUNDED | FAILED
 * </pre>
 * FUNDED, REJECTED, WITHDRAWN and FAILED are final. Moving to the current status is
 * always allowed and changes nothing.
 */
@Component
public class ProposalStateMachine {

    private static final Map<ProposalStatus, Set<ProposalStatus>> ALLOWED_TRANSITIONS = Map.of(
        ProposalStatus.SUBMITTED, EnumSet.of(
            ProposalStatus.VOTABLE,
            ProposalStatus.APPROVED,
            ProposalStatus.REJECTED,
            ProposalStatus.WITHDRAWN
        ),
        ProposalStatus.VOTABLE, EnumSet.of(
            ProposalStatus.APPROVED,
            ProposalStatus.REJECTED,
            ProposalStatus.WITHDRAWN
        ),
        ProposalStatus.APPROVED, EnumSet.of(
            ProposalStatus.FUNDED,
            ProposalStatus.FAILED
        )
    );

    public boolean isTransitionAllowed(ProposalStatus from, ProposalStatus to) {
        if (from == null || to == null) {
            return false;
        }
        if (from == to) {
            return true;
        }
        Set<ProposalStatus> allowed = ALLOWED_TRANSITIONS.get(from);
        return allowed != null && allowed.contains(to);
    }

    public void validateTransition(String proposalId, ProposalStatus from, ProposalStatus to) {
        if (!isTransitionAllowed(from, to)) {
            throw new InvalidStateException(ErrorKind.BAD_REQUEST_TRANSITION, "Proposal", proposalId,
                String.valueOf(from), "transition to " + to);
        }
    }

    public boolean isFinalState(ProposalStatus status) {
        return !ALLOWED_TRANSITIONS.containsKey(status);
    }

    public Set<ProposalStatus> getAllowedTransitions(ProposalStatus from) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of());
    }
}
