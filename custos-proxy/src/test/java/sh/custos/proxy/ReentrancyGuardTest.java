// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.custos.proxy.error.ReentrantCallException;

class ReentrancyGuardTest {

    private final ReentrancyGuard guard = new ReentrancyGuard();

    @Test
    void runsBodyAndClearsFlag() {
        assertEquals("done", guard.guard("withdraw", () -> {
            assertTrue(guard.isEntered());
            return "done";
        }));
        assertFalse(guard.isEntered());
    }

    @Test
    void rejectsNestedEntry() {
        ReentrantCallException e = assertThrows(ReentrantCallException.class,
                () -> guard.guard("withdraw", () -> guard.guard("claimReward", () -> "inner")));
        assertTrue(e.getMessage().contains("claimReward"));
        assertFalse(guard.isEntered());
    }

    @Test
    void clearsFlagWhenBodyThrows() {
        assertThrows(IllegalStateException.class, () -> guard.guard("withdraw", () -> {
            throw new IllegalStateException("boom");
        }));
        assertFalse(guard.isEntered());
        assertEquals(1, guard.guard("withdraw", () -> 1));
    }
}
