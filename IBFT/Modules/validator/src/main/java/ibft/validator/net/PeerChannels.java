package ibft.validator.net;

import ibft.common.config.ClusterConfig;
import ibft.proto.GossipServiceGrpc;
import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

public final class PeerChannels {
    public record PeerAddress(String id, String host, int port) {}

    private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, GossipServiceGrpc.GossipServiceStub> gossipStubs = new ConcurrentHashMap<>();

    private final Map<String, PeerAddress> peers = new LinkedHashMap<>();
    private final String selfId;
    private final Function<PeerAddress, ManagedChannel> channelFactory;

    public PeerChannels(Collection<PeerAddress> peers, String selfId, Function<PeerAddress, ManagedChannel> channelFactory) {
        for (PeerAddress p : peers) this.peers.put(p.id(), p);
        this.selfId = selfId;
        this.channelFactory = channelFactory;
    }

    public PeerChannels(Collection<PeerAddress> peers, String selfId) {
        this(peers, selfId, p -> NettyChannelBuilder.forAddress(p.host(), p.port())
                .usePlaintext()
                .build());
    }

    public static PeerChannels fromConfig(ClusterConfig cfg, String selfId) {
        List<PeerAddress> addresses = new ArrayList<>();
        if (cfg.validators != null) {
            for (var v : cfg.validators) addresses.add(new PeerAddress(v.id, v.host, v.port));
        }
        return new PeerChannels(addresses, selfId);
    }

    private ManagedChannel channelFor(String id) {
        return channels.computeIfAbsent(id, pid -> {
            PeerAddress p = peers.get(pid);
            if (p == null) throw new IllegalArgumentException("Unknown validator id: " + pid);
            return channelFactory.apply(p);
        });
    }

    public List<String> peerIds() {
        List<String> ids = new ArrayList<>();
        for (String id : peers.keySet()) if (!selfId.equals(id)) ids.add(id);
        return ids;
    }

    public boolean knows(String id) { return peers.containsKey(id); }

    public GossipServiceGrpc.GossipServiceStub stubFor(String id) {
        if (selfId.equals(id)) throw new IllegalArgumentException("stubFor self not allowed: " + id);
        return gossipStubs.computeIfAbsent(id, pid -> GossipServiceGrpc.newStub(channelFor(pid)));
    }

    public void shutdown() {
        for (var ch : channels.values()) {
            ch.shutdown();
        }
        for (var ch : channels.values()) {
            try {
                ch.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        for (var ch : channels.values()) {
            if (!ch.isTerminated()) ch.shutdownNow();
        }
    }
}
