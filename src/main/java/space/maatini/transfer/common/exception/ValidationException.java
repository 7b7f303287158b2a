package space.maatini.transfer.common.exception;

/**
 * Exception thrown for invalid arguments or configuration values.
 */
public class ValidationException extends TransferException {

    public ValidationException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ARGUMENT, message, cause);
    }
}
