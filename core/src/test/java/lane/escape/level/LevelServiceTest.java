package lane.escape.level;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LevelServiceTest {

    @Mock
    private LevelGenerator generator;

    @Mock
    private GenerationListener listener;

    private LevelService service;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        service = new LevelService(generator, 2);
        service.addListener(listener);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        service.dispose();
    }

    private static GenerationResult board(int level, int variant) {
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();
        diagnostics.seed = LevelGenerator.levelSeed(level, variant, 0L);
        return new GenerationResult(level, Collections.emptyList(), true, variant, diagnostics);
    }

    @Test
    void testPrefetchIsSingleFlight() throws Exception {
        GenerationResult result = board(3, 0);
        when(generator.generate(3, 0)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return result;
        });

        CompletableFuture<GenerationResult> first = service.prefetch(3);
        CompletableFuture<GenerationResult> second = service.prefetch(3);

        assertSame(first, second);
        assertTrue(service.isPending(3));
        release.countDown();
        assertSame(result, first.get(5, TimeUnit.SECONDS));
        verify(generator, times(1)).generate(eq(3), anyInt());
    }

    @Test
    void testObtainHandsOutEachBoardOnce() {
        GenerationResult first = board(4, 0);
        GenerationResult second = board(4, 1);
        when(generator.generate(4, 0)).thenReturn(first);
        when(generator.generate(4, 1)).thenReturn(second);

        assertSame(first, service.obtain(4));
        assertFalse(service.isPending(4));
        assertSame(second, service.obtain(4));
    }

    @Test
    void testListenersHearAboutBackgroundWork() {
        GenerationResult result = board(5, 0);
        when(generator.generate(5, 0)).thenReturn(result);

        service.obtain(5);

        verify(listener).onGenerationStarted(5);
        verify(listener).onGenerationCompleted(5, result);
        verify(listener, never()).onGenerationFailed(anyInt(), any());
    }

    @Test
    void testSlowBackgroundFallsBackToForeground() {
        GenerationResult late = board(6, 0);
        GenerationResult fallback = board(6, 1);
        lenient().when(generator.generate(6, 0)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return late;
        });
        when(generator.generate(6, 1)).thenReturn(fallback);

        assertSame(fallback, service.obtain(6, 50L));
        assertFalse(service.isPending(6));
    }

    @Test
    void testFailedBackgroundFallsBackToForeground() {
        GenerationResult fallback = board(7, 1);
        IllegalStateException failure = new IllegalStateException("boom");
        when(generator.generate(7, 0)).thenThrow(failure);
        when(generator.generate(7, 1)).thenReturn(fallback);

        assertSame(fallback, service.obtain(7, 5_000L));
        verify(listener, timeout(1_000)).onGenerationFailed(7, failure);
    }

    @Test
    void testDiscardDropsThePendingBoard() {
        lenient().when(generator.generate(8, 0)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return board(8, 0);
        });

        service.prefetch(8);
        service.discard(8);

        assertFalse(service.isPending(8));
    }

    @Test
    void testRemovedListenerIsNotCalled() {
        when(generator.generate(9, 0)).thenReturn(board(9, 0));
        service.removeListener(listener);

        service.obtain(9);

        verify(listener, never()).onGenerationStarted(anyInt());
    }

    @Test
    void testRejectsBadRequests() {
        assertThrows(IllegalArgumentException.class, () -> service.prefetch(0));

        service.dispose();
        assertThrows(IllegalStateException.class, () -> service.prefetch(1));
    }
}
