package space.maatini.transfer.fault;

/**
 * How likely a failure at a probe point is to expose a bug. Injectors may ignore low-sensitivity probes.
 */
public enum FaultSensitivity {
    NORMAL,
    HIGH
}
