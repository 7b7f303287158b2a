package space.maatini.transfer.fault;

import space.maatini.transfer.common.exception.ErrorCode;
import space.maatini.transfer.common.exception.TransferException;

/**
 * Synthetic failure raised at a probe point.
 */
public class InjectedFaultException extends TransferException {

    private final String site;

    public InjectedFaultException(String site, long probe) {
        super(ErrorCode.INJECTED_FAULT, String.format("Injected fault at probe %d (%s)", probe, site));
        this.site = site;
    }

    public String getSite() {
        return site;
    }
}
