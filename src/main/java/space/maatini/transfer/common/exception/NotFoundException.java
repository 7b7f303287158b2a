package space.maatini.transfer.common.exception;

/**
 * Exception thrown when a remote object or bucket does not exist.
 */
public class NotFoundException extends TransferException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
