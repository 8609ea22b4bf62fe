package uk.gegc.adaptive.features.session.domain.model;

public enum SessionType {
    PRACTICE,
    DIAGNOSTIC,
    TIMED
}
