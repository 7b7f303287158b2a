package space.maatini.transfer.common.exception;

/**
 * Engine-level classification of transfer failures.
 */
public enum ErrorCode {

    /** The object (or bucket) does not exist. Expected for existence checks. */
    NOT_FOUND,

    /** The remote store redirected the request; the caller must reconfigure the region. */
    WRONG_REGION,

    /** Throttling, 5xx responses and transport failures. */
    TRANSIENT_SERVICE_ERROR,

    /** Any other non-success remote response. */
    SERVICE_ERROR,

    PERMISSION_DENIED,

    /** The caller supplied a value the engine cannot handle. */
    INVALID_ARGUMENT,

    /** A part failure escalated under {@code PartFailurePolicy.FATAL}. */
    FATAL,

    /** Synthetic failure raised by a fault injector. */
    INJECTED_FAULT,

    UNKNOWN
}
