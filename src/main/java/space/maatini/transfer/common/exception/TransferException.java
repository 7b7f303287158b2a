package space.maatini.transfer.common.exception;

/**
 * Base exception for every failure surfaced by the transfer engine.
 */
public class TransferException extends RuntimeException {

    private final ErrorCode code;

    public TransferException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TransferException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
