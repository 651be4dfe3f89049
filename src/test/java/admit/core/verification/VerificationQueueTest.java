package admit.core.verification;

import admit.core.clock.ManualClock;
import admit.core.collision.IdentityRegistration;
import admit.core.model.ReasonCode;
import admit.core.model.StoreUnavailableException;
import admit.core.model.ValidationException;
import admit.java.store.InMemoryIdentityRegistry;
import admit.java.store.InMemoryPendingSet;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VerificationQueue.
 *
 * Focus:
 * - Idempotent enqueue
 * - Already-verified subjects never reach the pending set
 * - Backlog warning on threshold crossing
 * - Drain order and batch bounds
 * - Concurrent enqueue of one subject
 */
class VerificationQueueTest {

    private static final long T0 = 1_700_000_000_000L;

    private ManualClock clock;
    private InMemoryIdentityRegistry registry;
    private InMemoryPendingSet pending;

    private Logger queueLogger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(T0);
        registry = new InMemoryIdentityRegistry();
        pending = new InMemoryPendingSet();

        queueLogger = (Logger) LoggerFactory.getLogger(VerificationQueue.class);
        previousLevel = queueLogger.getLevel();
        queueLogger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        queueLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        queueLogger.detachAppender(appender);
        queueLogger.setLevel(previousLevel);
    }

    @Test
    void testEnqueue_isIdempotent() {
        VerificationQueue queue = newQueue(1000);

        EnqueueResult first = queue.enqueue("mint-1");
        EnqueueResult second = queue.enqueue("mint-1");

        assertEquals(EnqueueOutcome.ENQUEUED, first.outcome());
        assertTrue(first.queued());
        assertEquals(1L, first.queueDepth());
        assertEquals(EnqueueOutcome.SKIPPED_ALREADY_QUEUED, second.outcome());
        assertFalse(second.queued());
        assertEquals(1L, second.queueDepth());
        assertEquals(1L, queue.depth());
    }

    @Test
    void testEnqueue_scoresByCurrentTime_andKeepsOriginalScore() {
        VerificationQueue queue = newQueue(1000);

        queue.enqueue("mint-1");
        clock.advanceMinutes(5);
        queue.enqueue("mint-1");

        assertEquals((double) T0, pending.scoreOf("mint-1"));
    }

    @Test
    void testEnqueue_preservesCaseAndTrims() {
        VerificationQueue queue = newQueue(1000);

        queue.enqueue("  MintAbC ");
        EnqueueResult lower = queue.enqueue("mintabc");

        assertTrue(pending.contains("MintAbC"));
        assertEquals(EnqueueOutcome.ENQUEUED, lower.outcome());
        assertEquals(2L, queue.depth());
    }

    @Test
    void testAlreadyVerified_neverTouchesPendingSet() throws Exception {
        registry.insert(IdentityRegistration.created("mint-1", "MoonCoin", "MOON", T0).verify());
        PendingSetStore untouchable = new PendingSetStore() {
            @Override
            public boolean insertIfAbsent(String member, double score) {
                return fail("pending set must not be touched");
            }

            @Override
            public long size() {
                return fail("pending set must not be touched");
            }

            @Override
            public List<String> popOldest(int max) {
                return fail("pending set must not be touched");
            }
        };
        VerificationQueue queue = new VerificationQueue(clock, registry, untouchable, 1000);

        EnqueueResult result = queue.enqueue("mint-1");

        assertEquals(EnqueueOutcome.SKIPPED_ALREADY_VERIFIED, result.outcome());
        assertFalse(result.hasQueueDepth());
        assertEquals(EnqueueResult.UNKNOWN_DEPTH, result.queueDepth());
    }

    @Test
    void testUnverifiedRegistration_isEnqueued() throws Exception {
        registry.insert(IdentityRegistration.created("mint-1", "MoonCoin", "MOON", T0));
        VerificationQueue queue = newQueue(1000);

        assertEquals(EnqueueOutcome.ENQUEUED, queue.enqueue("mint-1").outcome());
    }

    @Test
    void testValidation_reasons() {
        VerificationQueue queue = newQueue(1000);

        assertEquals(ReasonCode.SUBJECT_REQUIRED,
            assertThrows(ValidationException.class, () -> queue.enqueue(null)).reason());
        assertEquals(ReasonCode.SUBJECT_REQUIRED,
            assertThrows(ValidationException.class, () -> queue.enqueue("   ")).reason());
        assertEquals(ReasonCode.SUBJECT_TOO_LONG,
            assertThrows(ValidationException.class,
                () -> queue.enqueue("x".repeat(VerificationQueue.MAX_SUBJECT_LENGTH + 1))).reason());
        assertDoesNotThrow(() -> queue.enqueue("x".repeat(VerificationQueue.MAX_SUBJECT_LENGTH)));
    }

    @Test
    void testDepthWarning_firesOnCrossing_andRearms() {
        VerificationQueue queue = newQueue(2);

        queue.enqueue("a");
        queue.enqueue("b");
        assertEquals(0, warnings());
        assertFalse(queue.isBacklogged());

        queue.enqueue("c");
        queue.enqueue("d");
        assertEquals(1, warnings(), "Warning fires once per crossing");
        assertTrue(queue.isBacklogged());

        pending.popOldest(3);
        assertEquals(1L, queue.depth());
        assertFalse(queue.isBacklogged());

        queue.enqueue("e");
        queue.enqueue("f");
        assertEquals(2, warnings(), "Warning fires again after re-arming");
    }

    @Test
    void testDepthWarning_thresholdIsExclusive() {
        VerificationQueue queue = newQueue(3);

        queue.enqueue("a");
        queue.enqueue("b");
        queue.enqueue("c");

        assertEquals(0, warnings());
        assertFalse(queue.isBacklogged());
    }

    @Test
    void testDrain_oldestFirst_andSubjectCanBeQueuedAgain() {
        VerificationQueue queue = newQueue(1000);
        queue.enqueue("mint-b");
        clock.advanceMillis(5);
        queue.enqueue("mint-a");
        clock.advanceMillis(5);
        queue.enqueue("mint-c");

        assertEquals(List.of("mint-b", "mint-a"), queue.drain(2));
        assertEquals(1L, queue.depth());
        assertEquals(List.of("mint-c"), queue.drain(VerificationQueue.MAX_DRAIN_BATCH));
        assertEquals(List.of(), queue.drain(1));

        assertEquals(EnqueueOutcome.ENQUEUED, queue.enqueue("mint-b").outcome());
    }

    @Test
    void testDrain_clearsBacklog() {
        VerificationQueue queue = newQueue(2);
        queue.enqueue("a");
        queue.enqueue("b");
        queue.enqueue("c");
        assertTrue(queue.isBacklogged());

        queue.drain(2);

        assertFalse(queue.isBacklogged());
        assertTrue(appender.list.stream()
            .anyMatch(event -> event.getLevel() == Level.INFO
                && event.getFormattedMessage().contains("back within threshold")));
    }

    @Test
    void testDrain_batchBounds() {
        VerificationQueue queue = newQueue(1000);

        assertEquals(ReasonCode.BATCH_SIZE_INVALID,
            assertThrows(ValidationException.class, () -> queue.drain(0)).reason());
        assertEquals(ReasonCode.BATCH_SIZE_INVALID,
            assertThrows(ValidationException.class, () -> queue.drain(VerificationQueue.MAX_DRAIN_BATCH + 1)).reason());
    }

    @Test
    void testDrainFailure_surfacesAsStoreUnavailable() {
        VerificationQueue queue = new VerificationQueue(clock, registry, new FailingPendingSet(true, false), 1000);

        assertThrows(StoreUnavailableException.class, () -> queue.drain(10));
    }

    @Test
    void testInsertFailure_surfacesAsStoreUnavailable() {
        PendingSetStore broken = new FailingPendingSet(true, false);
        VerificationQueue queue = new VerificationQueue(clock, registry, broken, 1000);

        assertThrows(StoreUnavailableException.class, () -> queue.enqueue("mint-1"));
    }

    @Test
    void testSizeFailureAfterInsert_stillReportsEnqueued() {
        PendingSetStore flaky = new FailingPendingSet(false, true);
        VerificationQueue queue = new VerificationQueue(clock, registry, flaky, 1000);

        EnqueueResult result = queue.enqueue("mint-1");

        assertEquals(EnqueueOutcome.ENQUEUED, result.outcome());
        assertFalse(result.hasQueueDepth());
        assertThrows(StoreUnavailableException.class, queue::depth);
    }

    @Test
    void testConcurrent_sameSubjectEnqueuedOnce() throws InterruptedException {
        VerificationQueue queue = newQueue(1000);

        int numThreads = 16;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger enqueued = new AtomicInteger(0);
        AtomicInteger skipped = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    EnqueueResult result = queue.enqueue("mint-1");
                    if (result.outcome() == EnqueueOutcome.ENQUEUED) {
                        enqueued.incrementAndGet();
                    } else if (result.outcome() == EnqueueOutcome.SKIPPED_ALREADY_QUEUED) {
                        skipped.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        assertEquals(1, enqueued.get());
        assertEquals(numThreads - 1, skipped.get());
        assertEquals(1L, queue.depth());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new VerificationQueue(null, registry, pending, 1));
        assertThrows(IllegalArgumentException.class, () -> new VerificationQueue(clock, null, pending, 1));
        assertThrows(IllegalArgumentException.class, () -> new VerificationQueue(clock, registry, null, 1));
        assertThrows(IllegalArgumentException.class, () -> new VerificationQueue(clock, registry, pending, 0));
    }

    private VerificationQueue newQueue(long threshold) {
        return new VerificationQueue(clock, registry, pending, threshold);
    }

    private long warnings() {
        return appender.list.stream()
            .filter(event -> event.getLevel() == Level.WARN)
            .filter(event -> event.getFormattedMessage().contains("exceeds warning threshold"))
            .count();
    }

    private static final class FailingPendingSet implements PendingSetStore {
        private final boolean failWrites;
        private final boolean failSize;

        FailingPendingSet(boolean failWrites, boolean failSize) {
            this.failWrites = failWrites;
            this.failSize = failSize;
        }

        @Override
        public boolean insertIfAbsent(String member, double score) {
            if (failWrites) throw new IllegalStateException("pending set down");
            return true;
        }

        @Override
        public long size() {
            if (failSize) throw new IllegalStateException("pending set down");
            return 1L;
        }

        @Override
        public List<String> popOldest(int max) {
            if (failWrites) throw new IllegalStateException("pending set down");
            return List.of();
        }
    }
}
