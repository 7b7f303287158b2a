package space.maatini.transfer.group;

import space.maatini.transfer.common.exception.RemoteErrorMapper;
import space.maatini.transfer.common.exception.TransferException;

/**
 * Failure of one labelled operation of a group. Keeps the error code of the underlying failure.
 */
public class GroupOperationException extends TransferException {

    private final String label;

    public GroupOperationException(String label, Throwable failure) {
        super(RemoteErrorMapper.codeOf(failure),
                "Operation '" + label + "' failed: " + RemoteErrorMapper.unwrap(failure).getMessage(),
                RemoteErrorMapper.unwrap(failure));
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
