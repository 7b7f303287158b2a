package space.maatini.transfer.fault;

/**
 * Hook invoked before every remote call is issued and again when its result arrives.
 * <p>
 * An implementation may throw to force a failure at that point or block to simulate a slow store.
 */
@FunctionalInterface
public interface FaultInjector {

    FaultInjector NONE = (sensitivity, site) -> {
    };

    /**
     * @param sensitivity sensitivity of the probe point
     * @param site        call site, e.g. {@code uploadPart:post}
     */
    void probe(FaultSensitivity sensitivity, String site);
}
