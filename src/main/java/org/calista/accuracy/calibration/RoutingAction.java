package org.calista.accuracy.calibration;

import java.util.Locale;
import java.util.Optional;

/** What the gate does with a candidate once its confidence band is known. */
public enum RoutingAction {
    /** Return the candidate unchanged. */
    DIRECT,
    /** Append a "please verify" note. */
    WITH_VERIFICATION,
    /** Append a "check additional sources" note. */
    WITH_CITATIONS,
    /** Replace the answer with an abstention message. */
    ABSTAIN,
    /** Replace the answer with a human-review notice. */
    ESCALATE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whitelist conversion of a wire label; never coerces unknown strings. */
    public static Optional<RoutingAction> fromLabel(String label) {
        if (label == null) return Optional.empty();
        switch (label) {
            case "direct":
                return Optional.of(DIRECT);
            case "with_verification":
                return Optional.of(WITH_VERIFICATION);
            case "with_citations":
                return Optional.of(WITH_CITATIONS);
            case "abstain":
                return Optional.of(ABSTAIN);
            case "escalate":
                return Optional.of(ESCALATE);
            default:
                return Optional.empty();
        }
    }
}
