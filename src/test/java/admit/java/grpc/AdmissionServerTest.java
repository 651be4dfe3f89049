package admit.java.grpc;

import admit.core.clock.ManualClock;
import admit.java.config.AdmissionConfig;
import admit.proto.AdmissionServiceGrpc;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionServerTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadConfig_packagedResourceByDefault() throws Exception {
        AdmissionConfig config = AdmissionServer.loadConfig(null);

        assertTrue(config.rateLimits().containsKey("realtime-auth"));
        assertEquals("prepare", config.registrationPolicy());
    }

    @Test
    void testLoadConfig_explicitFile() throws Exception {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "server:\n  port: 7443\nrateLimit:\n  max: 7\n");

        AdmissionConfig config = AdmissionServer.loadConfig(file);

        assertEquals(7443, config.port());
        assertEquals(7, config.rateLimits().get("default").limit());
    }

    @Test
    void testLoadConfig_missingFileFails() {
        assertThrows(IOException.class, () -> AdmissionServer.loadConfig(tempDir.resolve("missing.yaml")));
    }

    @Test
    void testStartServeStop() throws Exception {
        AdmissionConfig config = AdmissionConfig.fromProperties(Map.of("server.port", "0"));
        AdmissionServer server = new AdmissionServer(config, new ManualClock(0L));
        server.start();
        ManagedChannel channel = ManagedChannelBuilder.forAddress("localhost", server.getPort())
            .usePlaintext()
            .build();
        try {
            HealthCheckResponse response = AdmissionServiceGrpc.newBlockingStub(channel)
                .withDeadlineAfter(5, TimeUnit.SECONDS)
                .healthCheck(HealthCheckRequest.getDefaultInstance());

            assertEquals(HealthCheckResponse.Status.SERVING, response.getStatus());
        } finally {
            channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
            server.stop();
        }
    }
}
