package ibft.validator.rpc;

import ibft.proto.Empty;
import ibft.proto.GossipEnvelope;
import ibft.proto.GossipServiceGrpc;
import ibft.validator.net.GrpcPubSub;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GossipRpcService extends GossipServiceGrpc.GossipServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(GossipRpcService.class);

    private final String selfId;
    private final GrpcPubSub pubSub;

    public GossipRpcService(String selfId, GrpcPubSub pubSub) {
        this.selfId = selfId;
        this.pubSub = pubSub;
    }

    @Override
    public void publish(GossipEnvelope request, StreamObserver<Empty> responseObserver) {
        if (request.getTopic().isBlank()) {
            log.warn("REJECT Publish from={} reason=blank topic on {}", request.getOrigin(), selfId);
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("topic must not be blank").asRuntimeException());
            return;
        }
        int delivered = pubSub.deliverFromPeer(request.getTopic(), request.getData().toByteArray());
        if (delivered == 0) {
            log.debug("DROP Publish topic={} from={} reason=no subscriber on {}", request.getTopic(), request.getOrigin(), selfId);
        }
        responseObserver.onNext(Empty.getDefaultInstance());
        responseObserver.onCompleted();
    }
}
