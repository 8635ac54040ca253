package beacon.scheduler.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void positiveMaxEnablesBudget() {
        RetryPolicy policy = RetryPolicy.from(3);

        assertTrue(policy.enabled());
        assertEquals(3, policy.max());
        assertTrue(policy.canRetry(2));
        assertFalse(policy.canRetry(3));
        assertFalse(policy.isExhausted(2));
        assertTrue(policy.isExhausted(3));
    }

    @Test
    void zeroOrNegativeMeansUnlimited() {
        assertSame(RetryPolicy.UNLIMITED, RetryPolicy.from(0));
        assertSame(RetryPolicy.UNLIMITED, RetryPolicy.from(-1));
        assertTrue(RetryPolicy.UNLIMITED.canRetry(Integer.MAX_VALUE - 1));
        assertFalse(RetryPolicy.UNLIMITED.isExhausted(1000));
    }

    @Test
    void enabledPolicyNeedsPositiveMax() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(true, 0));
    }
}
