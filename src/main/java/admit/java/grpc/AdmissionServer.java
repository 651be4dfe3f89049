package admit.java.grpc;

import admit.core.admission.RegistrationAdmission;
import admit.core.clock.Clock;
import admit.core.clock.SystemClock;
import admit.core.collision.CollisionGuard;
import admit.core.verification.VerificationQueue;
import admit.java.config.AdmissionConfig;
import admit.java.config.AdmissionConfigLoader;
import admit.java.engine.RateLimiterRegistry;
import admit.java.store.InMemoryIdentityRegistry;
import admit.java.store.InMemoryPendingSet;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server exposing the admission components.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090) and YAML configuration</li>
 *   <li>Rate-limit sweep tasks started and stopped with the server</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>In-memory identity registry and pending set, written through RecordRegistration,
 *       MarkGraduated and MarkVerified and drained through DrainVerification; a deployment
 *       backed by real stores wires its own collaborators through
 *       {@link #AdmissionServer(int, AdmissionServiceImpl, RateLimiterRegistry)}</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java admit.java.grpc.AdmissionServer [port] [config.yaml]
 * </pre>
 */
public final class AdmissionServer {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final RateLimiterRegistry rateLimiters;

    /**
     * Creates a server with in-memory collaborators built from {@code config}.
     *
     * @param config Admission configuration
     * @param clock Clock shared by every component
     */
    public AdmissionServer(AdmissionConfig config, Clock clock) {
        this(config.port(), config, clock, new InMemoryIdentityRegistry());
    }

    private AdmissionServer(int port, AdmissionConfig config, Clock clock, InMemoryIdentityRegistry identities) {
        this(port, config, clock, identities, new RateLimiterRegistry(clock, config.rateLimits()));
    }

    private AdmissionServer(int port, AdmissionConfig config, Clock clock,
                            InMemoryIdentityRegistry identities, RateLimiterRegistry rateLimiters) {
        this(port, createService(config, clock, identities, rateLimiters), rateLimiters);
    }

    /**
     * Creates a server with a custom service (useful for testing).
     *
     * @param port Port to listen on
     * @param service Admission service
     * @param rateLimiters Limiters whose sweep tasks follow the server lifecycle
     */
    public AdmissionServer(int port, AdmissionServiceImpl service, RateLimiterRegistry rateLimiters) {
        this.rateLimiters = rateLimiters;
        this.server = ServerBuilder.forPort(port)
            .addService(ServerInterceptors.intercept(service, new ClientIdentityInterceptor()))
            .build();
    }

    static AdmissionServiceImpl createService(AdmissionConfig config, Clock clock,
                                              InMemoryIdentityRegistry identities,
                                              RateLimiterRegistry rateLimiters) {
        CollisionGuard guard = new CollisionGuard(clock, identities, config.identityRules());
        RegistrationAdmission registration = new RegistrationAdmission(
            rateLimiters.limiter(config.registrationPolicy()), guard, identities);
        VerificationQueue queue = new VerificationQueue(
            clock, identities, new InMemoryPendingSet(), config.depthWarningThreshold());
        return new AdmissionServiceImpl(clock, rateLimiters, guard, registration, identities, queue);
    }

    /**
     * Starts the sweep tasks and the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        rateLimiters.start();
        server.start();
        log.info("AdmissionServer started on port {} with policies {}", server.getPort(), rateLimiters.policies());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                AdmissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully, then the sweep tasks.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        try {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } finally {
            rateLimiters.stop();
        }
        log.info("AdmissionServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Loads configuration from {@code path} when given, otherwise from the packaged
     * {@value AdmissionConfigLoader#DEFAULT_RESOURCE}, otherwise built-in defaults.
     *
     * @throws IOException if the configuration cannot be read
     */
    static AdmissionConfig loadConfig(Path path) throws IOException {
        Optional<Map<String, String>> props = path != null
            ? AdmissionConfigLoader.load(path)
            : AdmissionConfigLoader.loadResource(AdmissionConfigLoader.DEFAULT_RESOURCE);
        if (path != null && props.isEmpty()) {
            throw new IOException("configuration file not found: " + path);
        }
        return AdmissionConfig.fromProperties(props.orElse(Map.of()));
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number, then configuration path
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        AdmissionConfig config = loadConfig(args.length > 1 ? Path.of(args[1]) : null);

        int port = config.port();
        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        AdmissionServer server = new AdmissionServer(port, config, SystemClock.instance(), new InMemoryIdentityRegistry());
        server.start();
        server.blockUntilShutdown();
    }
}
