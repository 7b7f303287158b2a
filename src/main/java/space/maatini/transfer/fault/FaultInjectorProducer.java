package space.maatini.transfer.fault;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Produces the fault injector selected by {@code transfer.fault.*}.
 */
@ApplicationScoped
public class FaultInjectorProducer {

    private static final Logger LOG = Logger.getLogger(FaultInjectorProducer.class);

    @ConfigProperty(name = "transfer.fault.mode", defaultValue = "NONE")
    ProbeCountingFaultInjector.Mode mode;

    @ConfigProperty(name = "transfer.fault.probe", defaultValue = "0")
    long probe;

    @ConfigProperty(name = "transfer.fault.sensitivity", defaultValue = "NORMAL")
    FaultSensitivity sensitivity;

    @ConfigProperty(name = "transfer.fault.delay", defaultValue = "PT1S")
    Duration delay;

    // not proxied, so FaultInjectingObjectStore.wrap can recognise NONE
    @Produces
    @Singleton
    FaultInjector faultInjector() {
        if (mode == ProbeCountingFaultInjector.Mode.NONE || probe < 1) {
            return FaultInjector.NONE;
        }
        LOG.warnf("Fault injection enabled: %s at probe %d (sensitivity >= %s)", mode, probe, sensitivity);
        return new ProbeCountingFaultInjector(mode, probe, sensitivity, delay);
    }
}
