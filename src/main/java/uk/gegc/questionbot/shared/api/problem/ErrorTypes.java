package uk.gegc.questionbot.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the REST surface.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://upscpredictor.in/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Credit Errors ====================
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");
    public static final URI ACCOUNT_CONFLICT = URI.create(BASE_URL + "/account-conflict");
    public static final URI INCONSISTENT_ACCOUNT_STATE = URI.create(BASE_URL + "/inconsistent-account-state");

    // ==================== State Errors ====================
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== AI Errors ====================
    public static final URI AI_SERVICE_ERROR = URI.create(BASE_URL + "/ai-service-error");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
