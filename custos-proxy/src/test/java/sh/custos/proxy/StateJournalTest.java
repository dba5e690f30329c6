// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StateJournalTest {

    @Mock
    private Journaled first;
    @Mock
    private Journaled second;
    @Mock
    private Checkpoint firstCheckpoint;
    @Mock
    private Checkpoint secondCheckpoint;

    private StateJournal journal;

    @BeforeEach
    void setUp() {
        when(first.checkpoint()).thenReturn(firstCheckpoint);
        when(second.checkpoint()).thenReturn(secondCheckpoint);
        journal = new StateJournal(List.of(first, second));
    }

    @Test
    void commitsOnSuccess() {
        assertEquals("ok", journal.atomically("op", () -> "ok"));

        verify(first).commit();
        verify(second).commit();
        verify(firstCheckpoint, never()).restore();
        assertEquals(0, journal.depth());
    }

    @Test
    void restoresInReverseOrderAndRethrows() {
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> journal.run("op", () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        InOrder order = inOrder(secondCheckpoint, firstCheckpoint);
        order.verify(secondCheckpoint).restore();
        order.verify(firstCheckpoint).restore();
        verify(first, never()).commit();
        assertEquals(0, journal.depth());
    }

    @Test
    void commitsOnlyAtOutermostLevel() {
        journal.run("outer", () -> {
            journal.run("inner", () -> assertEquals(2, journal.depth()));
            verify(first, never()).commit();
        });

        verify(first, times(2)).checkpoint();
        verify(first, times(1)).commit();
    }

    @Test
    void innerFailureCaughtByOuterStillCommits() {
        journal.run("outer", () -> assertThrows(IllegalArgumentException.class,
                () -> journal.run("inner", () -> {
                    throw new IllegalArgumentException("inner");
                })));

        verify(firstCheckpoint, times(1)).restore();
        verify(first).commit();
    }

    @Test
    void readWaitsForRunningOperation() throws Exception {
        CompletableFuture<Integer> reader = new CompletableFuture<>();

        journal.run("op", () -> {
            new Thread(() -> reader.complete(journal.read(journal::depth))).start();
            assertThrows(TimeoutException.class, () -> reader.get(200, TimeUnit.MILLISECONDS));
            assertFalse(reader.isDone());
        });

        assertEquals(0, reader.get(5, TimeUnit.SECONDS));
    }
}
