package space.maatini.transfer.fault;

import org.junit.jupiter.api.Test;
import space.maatini.transfer.common.exception.ErrorCode;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProbeCountingFaultInjector.
 */
class ProbeCountingFaultInjectorTest {

    @Test
    void testFailAt_ThrowsOnlyAtTriggerProbe() {
        ProbeCountingFaultInjector injector = ProbeCountingFaultInjector.failAt(3);

        injector.probe(FaultSensitivity.NORMAL, "a:pre");
        injector.probe(FaultSensitivity.NORMAL, "a:post");
        InjectedFaultException exception = assertThrows(InjectedFaultException.class,
                () -> injector.probe(FaultSensitivity.HIGH, "b:pre"));
        injector.probe(FaultSensitivity.NORMAL, "b:post");

        assertEquals("b:pre", exception.getSite());
        assertEquals(ErrorCode.INJECTED_FAULT, exception.getCode());
        assertEquals(4, injector.probeCount());
    }

    @Test
    void testSensitivity_LowProbesNotCounted() {
        ProbeCountingFaultInjector injector = new ProbeCountingFaultInjector(ProbeCountingFaultInjector.Mode.FAIL, 1,
                FaultSensitivity.HIGH, Duration.ZERO);

        injector.probe(FaultSensitivity.NORMAL, "uploadPart:pre");
        injector.probe(FaultSensitivity.NORMAL, "uploadPart:post");
        assertEquals(0, injector.probeCount());

        assertThrows(InjectedFaultException.class, () -> injector.probe(FaultSensitivity.HIGH, "deleteObjects:pre"));
    }

    @Test
    void testDelayAt_Sleeps() {
        ProbeCountingFaultInjector injector = ProbeCountingFaultInjector.delayAt(2, Duration.ofMillis(200));

        long before = System.nanoTime();
        injector.probe(FaultSensitivity.NORMAL, "a:pre");
        long first = System.nanoTime() - before;
        injector.probe(FaultSensitivity.NORMAL, "a:post");
        long total = System.nanoTime() - before;

        assertTrue(first < Duration.ofMillis(150).toNanos());
        assertTrue(total >= Duration.ofMillis(200).toNanos());
    }

    @Test
    void testNoneMode_NeverActs() {
        ProbeCountingFaultInjector injector = new ProbeCountingFaultInjector(ProbeCountingFaultInjector.Mode.NONE, 1,
                FaultSensitivity.NORMAL, Duration.ZERO);

        injector.probe(FaultSensitivity.HIGH, "a:pre");
        assertEquals(0, injector.probeCount());
    }
}
