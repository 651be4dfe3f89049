package admit.java.grpc;

import admit.java.client.ClientIdentity;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * Resolves the caller's rate-limit key from proxy headers and the transport
 * address, and exposes it to service methods through the gRPC {@link Context}.
 */
public final class ClientIdentityInterceptor implements ServerInterceptor {

    static final Context.Key<String> CLIENT_KEY = Context.key("admit-client-key");

    static final Metadata.Key<String> FORWARDED_FOR =
        Metadata.Key.of("x-forwarded-for", Metadata.ASCII_STRING_MARSHALLER);
    static final Metadata.Key<String> REAL_IP =
        Metadata.Key.of("x-real-ip", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call,
        Metadata headers,
        ServerCallHandler<ReqT, RespT> next
    ) {
        String key = ClientIdentity.resolve(
            headers.get(FORWARDED_FOR),
            headers.get(REAL_IP),
            ClientIdentity.hostOf(call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR))
        );
        Context context = Context.current().withValue(CLIENT_KEY, key);
        return Contexts.interceptCall(context, call, headers, next);
    }

    /**
     * Key of the current call; {@link ClientIdentity#UNKNOWN} outside an intercepted call.
     */
    static String currentClientKey() {
        String key = CLIENT_KEY.get();
        return key != null ? key : ClientIdentity.UNKNOWN;
    }
}
