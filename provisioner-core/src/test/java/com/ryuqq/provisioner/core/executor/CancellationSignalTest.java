package com.ryuqq.provisioner.core.executor;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationSignal 테스트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class CancellationSignalTest {

    @Test
    void create_NotCanceled() {
        assertFalse(CancellationSignal.create().isCanceled());
    }

    @Test
    void cancel_FirstCallReturnsTrue_SecondReturnsFalse() {
        // Given
        CancellationSignal signal = CancellationSignal.create();

        // When & Then
        assertTrue(signal.cancel());
        assertFalse(signal.cancel());
        assertTrue(signal.isCanceled());
    }

    @Test
    void cancel_FromAnotherThread_IsVisible() {
        // Given
        CancellationSignal signal = CancellationSignal.create();

        // When
        CompletableFuture.runAsync(signal::cancel).join();

        // Then
        assertTrue(signal.isCanceled());
    }
}
