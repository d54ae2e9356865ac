package com.ckpt.worker;

import com.ckpt.shared.CkptConfig;
import org.junit.Test;

import static org.junit.Assert.*;

public class RetryPolicyTest {

    @Test
    public void testBackoffDoublesUpToCap() {
        RetryPolicy policy = new RetryPolicy(5, 100, 350);
        assertEquals(100, policy.backoffFor(1));
        assertEquals(200, policy.backoffFor(2));
        assertEquals(350, policy.backoffFor(3));
        assertEquals(350, policy.backoffFor(30));
    }

    @Test
    public void testFromConfig() {
        RetryPolicy policy = RetryPolicy.from(CkptConfig.builder()
                .snapshotWriteAttempts(4)
                .snapshotWriteBackoffMs(10)
                .snapshotWriteMaxBackoffMs(50)
                .build());
        assertEquals(4, policy.getMaxAttempts());
        assertEquals(10, policy.backoffFor(1));
        assertEquals(50, policy.backoffFor(4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroAttemptsRejected() {
        new RetryPolicy(0, 1, 1);
    }
}
