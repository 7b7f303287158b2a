package space.maatini.transfer.fault;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts probes at or above a sensitivity and acts once, at a chosen probe.
 */
public class ProbeCountingFaultInjector implements FaultInjector {

    private static final Logger LOG = Logger.getLogger(ProbeCountingFaultInjector.class);

    /**
     * What to do when the chosen probe is reached.
     */
    public enum Mode {
        NONE,
        FAIL,
        DELAY
    }

    private final Mode mode;
    private final long triggerProbe;
    private final FaultSensitivity minimumSensitivity;
    private final Duration delay;
    private final AtomicLong probes = new AtomicLong();

    public ProbeCountingFaultInjector(Mode mode, long triggerProbe, FaultSensitivity minimumSensitivity,
            Duration delay) {
        this.mode = mode;
        this.triggerProbe = triggerProbe;
        this.minimumSensitivity = minimumSensitivity;
        this.delay = delay;
    }

    public static ProbeCountingFaultInjector failAt(long probe) {
        return new ProbeCountingFaultInjector(Mode.FAIL, probe, FaultSensitivity.NORMAL, Duration.ZERO);
    }

    public static ProbeCountingFaultInjector delayAt(long probe, Duration delay) {
        return new ProbeCountingFaultInjector(Mode.DELAY, probe, FaultSensitivity.NORMAL, delay);
    }

    @Override
    public void probe(FaultSensitivity sensitivity, String site) {
        if (mode == Mode.NONE || sensitivity.compareTo(minimumSensitivity) < 0) {
            return;
        }
        long current = probes.incrementAndGet();
        if (current != triggerProbe) {
            return;
        }

        if (mode == Mode.FAIL) {
            LOG.warnf("Injecting failure at probe %d (%s)", current, site);
            throw new InjectedFaultException(site, current);
        }
        LOG.warnf("Injecting %s delay at probe %d (%s)", delay, current, site);
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public Mode mode() {
        return mode;
    }

    public long triggerProbe() {
        return triggerProbe;
    }

    public Duration delay() {
        return delay;
    }

    /**
     * Number of counted probes so far.
     */
    public long probeCount() {
        return probes.get();
    }
}
