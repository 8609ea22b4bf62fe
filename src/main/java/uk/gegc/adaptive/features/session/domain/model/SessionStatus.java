package uk.gegc.adaptive.features.session.domain.model;

public enum SessionStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
