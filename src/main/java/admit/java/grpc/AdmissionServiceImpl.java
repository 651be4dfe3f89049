package admit.java.grpc;

import admit.core.admission.IdentityWriter;
import admit.core.admission.RegistrationAdmission;
import admit.core.admission.RegistrationDecision;
import admit.core.clock.Clock;
import admit.core.collision.CollisionGuard;
import admit.core.collision.IdentityQuery;
import admit.core.collision.IdentityRegistration;
import admit.core.collision.LockState;
import admit.core.collision.LockStatus;
import admit.core.model.RateLimitResult;
import admit.core.model.StoreUnavailableException;
import admit.core.model.Subjects;
import admit.core.model.ValidationException;
import admit.core.verification.EnqueueResult;
import admit.core.verification.VerificationQueue;
import admit.java.engine.RateLimiterRegistry;
import admit.proto.AdmissionServiceGrpc;
import admit.proto.AdmitRegistrationRequest;
import admit.proto.AdmitRegistrationResponse;
import admit.proto.CheckRateLimitRequest;
import admit.proto.CheckRateLimitResponse;
import admit.proto.DrainVerificationRequest;
import admit.proto.DrainVerificationResponse;
import admit.proto.EnqueueVerificationRequest;
import admit.proto.EnqueueVerificationResponse;
import admit.proto.EvaluateIdentityRequest;
import admit.proto.EvaluateIdentityResponse;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import admit.proto.IdentityUpdateRequest;
import admit.proto.IdentityUpdateResponse;
import admit.proto.QueueDepthRequest;
import admit.proto.QueueDepthResponse;
import admit.proto.RecordRegistrationRequest;
import admit.proto.RecordRegistrationResponse;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * gRPC service implementation for admission decisions.
 *
 * <p>This is a thin wrapper over the admission components with:
 * <ul>
 *   <li>Input errors mapped to INVALID_ARGUMENT, described as "REASON: message"</li>
 *   <li>Backing-store failures mapped to UNAVAILABLE</li>
 *   <li>Anything else mapped to INTERNAL</li>
 *   <li>Protobuf conversion of every result</li>
 * </ul>
 *
 * <p>RecordRegistration is not rate limited; callers record only what
 * AdmitRegistration admitted.
 *
 * <p>Thread-safety: the components handle concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    static final String RATE_LIMITED_MESSAGE = "Rate limit exceeded. Please try again later.";

    private final Clock clock;
    private final RateLimiterRegistry rateLimiters;
    private final CollisionGuard guard;
    private final RegistrationAdmission registration;
    private final IdentityWriter identities;
    private final VerificationQueue verificationQueue;

    public AdmissionServiceImpl(
        Clock clock,
        RateLimiterRegistry rateLimiters,
        CollisionGuard guard,
        RegistrationAdmission registration,
        IdentityWriter identities,
        VerificationQueue verificationQueue
    ) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (rateLimiters == null) throw new IllegalArgumentException("rateLimiters cannot be null");
        if (guard == null) throw new IllegalArgumentException("guard cannot be null");
        if (registration == null) throw new IllegalArgumentException("registration cannot be null");
        if (identities == null) throw new IllegalArgumentException("identities cannot be null");
        if (verificationQueue == null) throw new IllegalArgumentException("verificationQueue cannot be null");
        this.clock = clock;
        this.rateLimiters = rateLimiters;
        this.guard = guard;
        this.registration = registration;
        this.identities = identities;
        this.verificationQueue = verificationQueue;
    }

    @Override
    public void checkRateLimit(CheckRateLimitRequest request, StreamObserver<CheckRateLimitResponse> responseObserver) {
        respond(responseObserver, () -> {
            // protobuf strings are never null, only empty
            String key = request.getKey().isEmpty()
                ? ClientIdentityInterceptor.currentClientKey()
                : request.getKey();
            RateLimitResult result = rateLimiters.check(request.getPolicy(), key);
            return CheckRateLimitResponse.newBuilder()
                .setAllowed(result.admitted())
                .setRemaining(result.remaining())
                .setRetryAfterMillis(result.retryAfterMillis())
                .setDegraded(result.degraded())
                .build();
        });
    }

    @Override
    public void evaluateIdentity(EvaluateIdentityRequest request,
                                 StreamObserver<EvaluateIdentityResponse> responseObserver) {
        respond(responseObserver, () -> {
            IdentityQuery query = guard.normalize(request.getName(), request.getSymbol());
            LockState state = guard.evaluate(query);
            return EvaluateIdentityResponse.newBuilder()
                .setStatus(toProto(state.status()))
                .setLocked(state.locked())
                .setRemainingMillis(state.remainingMillis())
                .setMessage(state.describe(query))
                .build();
        });
    }

    @Override
    public void admitRegistration(AdmitRegistrationRequest request,
                                  StreamObserver<AdmitRegistrationResponse> responseObserver) {
        respond(responseObserver, () -> {
            String clientKey = ClientIdentityInterceptor.currentClientKey();
            RegistrationDecision decision = registration.admit(clientKey, request.getName(), request.getSymbol());

            AdmitRegistrationResponse.Builder response = AdmitRegistrationResponse.newBuilder();
            switch (decision.outcome()) {
                case RATE_LIMITED -> response
                    .setOutcome(AdmitRegistrationResponse.Outcome.RATE_LIMITED)
                    .setRetryAfterMillis(decision.rateLimit().retryAfterMillis())
                    .setMessage(RATE_LIMITED_MESSAGE);
                case IDENTITY_LOCKED, ADMITTED -> {
                    LockState state = decision.lockState();
                    response
                        .setOutcome(state.locked()
                            ? AdmitRegistrationResponse.Outcome.IDENTITY_LOCKED
                            : AdmitRegistrationResponse.Outcome.ADMITTED)
                        .setLockStatus(toProto(state.status()))
                        .setLockRemainingMillis(state.remainingMillis())
                        .setMessage(state.describe(guard.normalize(request.getName(), request.getSymbol())));
                }
                default -> throw new IllegalStateException("unexpected admission outcome: " + decision.outcome());
            }
            return response.build();
        });
    }

    @Override
    public void recordRegistration(RecordRegistrationRequest request,
                                   StreamObserver<RecordRegistrationResponse> responseObserver) {
        respond(responseObserver, () -> {
            String subject = Subjects.normalize(request.getSubject());
            IdentityQuery query = guard.normalize(request.getName(), request.getSymbol());
            RegistrationDecision decision = registration.record(
                IdentityRegistration.created(subject, query.name(), query.symbol(), clock.nowMillis()));

            RecordRegistrationResponse.Outcome outcome = switch (decision.outcome()) {
                case RECORDED -> RecordRegistrationResponse.Outcome.RECORDED;
                case IDENTITY_TAKEN -> RecordRegistrationResponse.Outcome.IDENTITY_TAKEN;
                default -> throw new IllegalStateException("unexpected record outcome: " + decision.outcome());
            };
            if (decision.proceed()) {
                log.info("Recorded registration {} ({})", subject, query.name());
            }
            return RecordRegistrationResponse.newBuilder().setOutcome(outcome).build();
        });
    }

    @Override
    public void markGraduated(IdentityUpdateRequest request, StreamObserver<IdentityUpdateResponse> responseObserver) {
        respond(responseObserver, () -> IdentityUpdateResponse.newBuilder()
            .setUpdated(identities.markGraduated(Subjects.normalize(request.getSubject())))
            .build());
    }

    @Override
    public void markVerified(IdentityUpdateRequest request, StreamObserver<IdentityUpdateResponse> responseObserver) {
        respond(responseObserver, () -> IdentityUpdateResponse.newBuilder()
            .setUpdated(identities.markVerified(Subjects.normalize(request.getSubject())))
            .build());
    }

    @Override
    public void enqueueVerification(EnqueueVerificationRequest request,
                                    StreamObserver<EnqueueVerificationResponse> responseObserver) {
        respond(responseObserver, () -> {
            EnqueueResult result = verificationQueue.enqueue(request.getSubject());
            EnqueueVerificationResponse.Outcome outcome = switch (result.outcome()) {
                case ENQUEUED -> EnqueueVerificationResponse.Outcome.ENQUEUED;
                case SKIPPED_ALREADY_VERIFIED -> EnqueueVerificationResponse.Outcome.ALREADY_VERIFIED;
                case SKIPPED_ALREADY_QUEUED -> EnqueueVerificationResponse.Outcome.ALREADY_QUEUED;
            };
            return EnqueueVerificationResponse.newBuilder()
                .setOutcome(outcome)
                .setQueued(result.queued())
                .setQueueDepth(result.queueDepth())
                .build();
        });
    }

    @Override
    public void drainVerification(DrainVerificationRequest request,
                                  StreamObserver<DrainVerificationResponse> responseObserver) {
        respond(responseObserver, () -> {
            List<String> subjects = verificationQueue.drain(request.getMax());
            return DrainVerificationResponse.newBuilder()
                .addAllSubjects(subjects)
                .setRemainingDepth(verificationQueue.depth())
                .build();
        });
    }

    @Override
    public void getQueueDepth(QueueDepthRequest request, StreamObserver<QueueDepthResponse> responseObserver) {
        respond(responseObserver, () -> {
            long depth = verificationQueue.depth();
            return QueueDepthResponse.newBuilder()
                .setDepth(depth)
                .setBacklogged(verificationQueue.isBacklogged())
                .build();
        });
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        // Simple health check: if we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (ValidationException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.reason() + ": " + e.getMessage())
                    .asRuntimeException()
            );
            return;
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (StoreUnavailableException e) {
            log.warn("Backing store unavailable: {}", e.getMessage(), e);
            responseObserver.onError(
                Status.UNAVAILABLE
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (Exception e) {
            log.error("Unexpected admission error", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        }

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static admit.proto.LockStatus toProto(LockStatus status) {
        return switch (status) {
            case UNLOCKED -> admit.proto.LockStatus.UNLOCKED;
            case LOCKED_GRADUATED -> admit.proto.LockStatus.LOCKED_GRADUATED;
            case LOCKED_RECENT -> admit.proto.LockStatus.LOCKED_RECENT;
        };
    }
}
