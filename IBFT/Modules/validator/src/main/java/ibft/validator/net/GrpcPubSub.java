package ibft.validator.net;

import com.google.protobuf.ByteString;
import ibft.proto.Empty;
import ibft.proto.GossipEnvelope;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

// Gossip over gRPC: a published payload is queued for local subscribers and pushed with one
// asynchronous unary Publish call to every other member of the topic. Peers do not forward.
// A slow or dead peer never holds up delivery to the others.
public final class GrpcPubSub implements PubSub, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GrpcPubSub.class);
    private static final long DEADLINE_MS = Math.max(100L, Long.getLong("ibft.gossip.deadline_ms", 4000L));

    private final String selfId;
    private final PeerChannels peers;
    private final LocalTopics local = new LocalTopics();
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();
    private final Map<String, String> peerStatus = new ConcurrentHashMap<>();

    public GrpcPubSub(String selfId, PeerChannels peers) {
        this.selfId = selfId;
        this.peers = peers;
    }

    public void registerTopic(String topic, Collection<String> memberIds) {
        members.put(topic, Set.copyOf(memberIds));
    }

    @Override
    public void publish(String topic, byte[] data) throws TransportException {
        local.deliver(topic, data);
        GossipEnvelope env = GossipEnvelope.newBuilder()
                .setTopic(topic)
                .setData(ByteString.copyFrom(data))
                .setOrigin(selfId)
                .build();
        Map<String, String> failed = new TreeMap<>();
        for (String id : members.getOrDefault(topic, Set.of())) {
            if (selfId.equals(id)) continue;
            try {
                peers.stubFor(id)
                        .withDeadlineAfter(DEADLINE_MS, TimeUnit.MILLISECONDS)
                        .publish(env, new PublishObserver(id, topic));
            } catch (RuntimeException ex) {
                peerStatus.put(id, "ERR:DOWN");
                failed.put(id, "ERR:DOWN");
            }
        }
        if (!failed.isEmpty()) {
            throw new TransportException("gossip on " + topic + " could not reach " + failed);
        }
    }

    public Map<String, String> peerStatus() {
        return Map.copyOf(peerStatus);
    }

    private final class PublishObserver implements StreamObserver<Empty> {
        private final String peer;
        private final String topic;

        PublishObserver(String peer, String topic) {
            this.peer = peer;
            this.topic = topic;
        }

        @Override
        public void onNext(Empty value) {
        }

        @Override
        public void onError(Throwable t) {
            String status = "ERR:" + Status.fromThrowable(t).getCode().name();
            String previous = peerStatus.put(peer, status);
            if (!status.equals(previous)) {
                log.warn("GOSSIP topic={} to={} status={} from {}", topic, peer, status, selfId);
            } else {
                log.debug("GOSSIP topic={} to={} status={} from {}", topic, peer, status, selfId);
            }
        }

        @Override
        public void onCompleted() {
            String previous = peerStatus.put(peer, "OK");
            if (previous != null && !"OK".equals(previous)) {
                log.info("GOSSIP topic={} to={} recovered from {}", topic, peer, selfId);
            }
        }
    }

    public int deliverFromPeer(String topic, byte[] data) {
        return local.deliver(topic, data);
    }

    @Override
    public Subscription subscribe(String topic) {
        return local.subscribe(topic);
    }

    @Override
    public void close() {
        peers.shutdown();
    }
}
