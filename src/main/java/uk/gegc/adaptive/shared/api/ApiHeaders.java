package uk.gegc.adaptive.shared.api;

public final class ApiHeaders {

    /**
     * Identity of the learner a request acts for, supplied by the calling platform.
     */
    public static final String LEARNER_ID = "X-Learner-Id";

    private ApiHeaders() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
