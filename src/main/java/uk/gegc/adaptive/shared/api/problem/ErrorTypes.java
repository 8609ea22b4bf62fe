package uk.gegc.adaptive.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://adaptive.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MISSING_HEADER = URI.create(BASE_URL + "/missing-header");

    // ==================== Generation Errors ====================
    public static final URI NO_CATEGORIES_AVAILABLE = URI.create(BASE_URL + "/no-categories-available");
    public static final URI NO_ELIGIBLE_QUESTIONS = URI.create(BASE_URL + "/no-eligible-questions");

    // ==================== Session Errors ====================
    public static final URI SESSION_STATE_CONFLICT = URI.create(BASE_URL + "/session-state-conflict");
    public static final URI SETTLEMENT_FAILED = URI.create(BASE_URL + "/settlement-failed");
    public static final URI CONCURRENT_UPDATE = URI.create(BASE_URL + "/concurrent-update");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_ERROR = URI.create(BASE_URL + "/internal-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
