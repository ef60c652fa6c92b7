package com.aegis.screening.payment;

import com.aegis.screening.domain.Decision;

/**
 * Lifecycle of one payment screening run.
 *
 * <pre>
 * RECEIVED → SCREENING → CLEARED
 *                      → REVIEW
 *                      → BLOCKED
 *                      → ERROR
 * </pre>
 *
 * <p>RECEIVED may also go straight to ERROR when the run fails before
 * screening starts. Terminal states have no outgoing transitions.
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
public enum PaymentScreeningStatus {

    RECEIVED(false),
    SCREENING(false),
    CLEARED(true),
    REVIEW(true),
    BLOCKED(true),
    ERROR(true);

    private final boolean terminal;

    PaymentScreeningStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Validates a transition against the state machine above.
     *
     * @throws IllegalArgumentException if target is null
     */
    public boolean canTransitionTo(PaymentScreeningStatus target) {
        if (target == null) {
            throw new IllegalArgumentException("Target status cannot be null");
        }
        return switch (this) {
            case RECEIVED -> target == SCREENING || target == ERROR;
            case SCREENING -> target.isTerminal();
            case CLEARED, REVIEW, BLOCKED, ERROR -> false;
        };
    }

    /**
     * Terminal state for a run that completed without errors
     */
    public static PaymentScreeningStatus fromDecision(Decision decision) {
        return switch (decision) {
            case CLEAR -> CLEARED;
            case REVIEW -> REVIEW;
            case BLOCK -> BLOCKED;
        };
    }
}
