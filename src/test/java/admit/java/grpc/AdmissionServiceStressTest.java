package admit.java.grpc;

import admit.core.clock.SystemClock;
import admit.java.config.AdmissionConfig;
import admit.java.engine.RateLimiterRegistry;
import admit.java.store.InMemoryIdentityRegistry;
import admit.proto.AdmissionServiceGrpc;
import admit.proto.CheckRateLimitRequest;
import admit.proto.EnqueueVerificationRequest;
import admit.proto.EnqueueVerificationResponse;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent RPC tests: the invariants of the components must hold end to end.
 *
 * <p>Note: These are stress tests, not precise benchmarks.
 * For throughput numbers, use the JMH benchmarks.
 */
class AdmissionServiceStressTest {

    private static final int LIMIT = 200;

    private Server server;
    private ManagedChannel channel;
    private RateLimiterRegistry rateLimiters;
    private AdmissionServiceGrpc.AdmissionServiceBlockingStub blockingStub;

    @BeforeEach
    void setUp() throws Exception {
        // Use SystemClock for realistic stress testing
        SystemClock clock = SystemClock.instance();
        AdmissionConfig config = AdmissionConfig.fromProperties(Map.of("rateLimit.max", String.valueOf(LIMIT)));
        rateLimiters = new RateLimiterRegistry(clock, config.rateLimits());
        AdmissionServiceImpl service = AdmissionServer.createService(
            config, clock, new InMemoryIdentityRegistry(), rateLimiters);

        String serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(ServerInterceptors.intercept(service, new ClientIdentityInterceptor()))
            .build()
            .start();

        channel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();

        blockingStub = AdmissionServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.shutdown();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
        rateLimiters.close();
    }

    @Test
    void testConcurrentChecks_sameKeyAdmitsExactlyLimit() throws InterruptedException {
        int numThreads = 16;
        int requestsPerThread = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitted = new AtomicInteger(0);
        AtomicInteger failures = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    CheckRateLimitRequest request = CheckRateLimitRequest.newBuilder().setKey("hot-key").build();
                    for (int i = 0; i < requestsPerThread; i++) {
                        if (blockingStub.checkRateLimit(request).getAllowed()) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(0, failures.get());
        assertEquals(LIMIT, admitted.get());
    }

    @Test
    void testConcurrentEnqueue_subjectQueuedOnce() throws InterruptedException {
        int numThreads = 16;
        int subjects = 25;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger enqueued = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < subjects; i++) {
                        EnqueueVerificationResponse response = blockingStub.enqueueVerification(
                            EnqueueVerificationRequest.newBuilder().setSubject("mint-" + i).build());
                        if (response.getOutcome() == EnqueueVerificationResponse.Outcome.ENQUEUED) {
                            enqueued.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(subjects, enqueued.get());
    }
}
