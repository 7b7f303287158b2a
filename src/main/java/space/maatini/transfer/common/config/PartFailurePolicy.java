package space.maatini.transfer.common.config;

import org.jboss.logging.Logger;
import space.maatini.transfer.common.exception.ErrorCode;
import space.maatini.transfer.common.exception.TransferException;

/**
 * What happens when one part of a segmented transfer fails.
 */
public enum PartFailurePolicy {

    /** Record the normalized error on the owning session or future. */
    PROPAGATE,

    /** Re-kind the error as {@link ErrorCode#FATAL} and log it at FATAL level before propagating. */
    FATAL;

    private static final Logger LOG = Logger.getLogger(PartFailurePolicy.class);

    /**
     * Apply this policy to the error of a failed part.
     */
    public TransferException escalate(TransferException error) {
        if (this != FATAL) {
            return error;
        }
        LOG.fatalf("Unrecoverable part failure: %s", error.getMessage());
        return new TransferException(ErrorCode.FATAL, error.getMessage(), error);
    }
}
