package ibft.validator.net;

import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.DecodeException;
import ibft.common.validation.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

// Binds a shard's core to its gossip topic: encodes outbound messages, decodes inbound ones.
public final class GossipTransport implements Transport, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GossipTransport.class);
    private static final long POLL_MS = 200L;

    private final PubSub pubSub;
    private final String topic;
    private final String selfId;

    private volatile boolean running;
    private PubSub.Subscription subscription;
    private Thread loop;

    public GossipTransport(PubSub pubSub, String topic, String selfId) {
        this.pubSub = pubSub;
        this.topic = topic;
        this.selfId = selfId;
    }

    public String topic() { return topic; }

    @Override
    public void multicast(ConsensusMessage message) throws TransportException {
        pubSub.publish(topic, MessageCodec.encode(message));
    }

    public synchronized void start(Consumer<ConsensusMessage> sink, BooleanSupplier activeValidator) {
        if (running) throw new IllegalStateException("already started on " + topic);
        subscription = pubSub.subscribe(topic);
        running = true;
        PubSub.Subscription sub = subscription;
        loop = new Thread(() -> readLoop(sub, sink, activeValidator), selfId + "-gossip-" + topic);
        loop.setDaemon(true);
        loop.start();
        log.info("GOSSIP subscribed topic={} on {}", topic, selfId);
    }

    private void readLoop(PubSub.Subscription sub, Consumer<ConsensusMessage> sink, BooleanSupplier activeValidator) {
        while (running) {
            byte[] data;
            try {
                data = sub.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (data == null) continue;
            handle(data, sink, activeValidator);
        }
        log.debug("GOSSIP loop stopped topic={} on {}", topic, selfId);
    }

    void handle(byte[] data, Consumer<ConsensusMessage> sink, BooleanSupplier activeValidator) {
        if (data.length == 0) {
            log.debug("DROP empty gossip payload topic={} on {}", topic, selfId);
            return;
        }
        if (!activeValidator.getAsBoolean()) {
            log.trace("DROP gossip payload topic={} reason=not an active validator on {}", topic, selfId);
            return;
        }
        ConsensusMessage m;
        try {
            m = MessageCodec.decode(data);
        } catch (DecodeException e) {
            log.warn("DROP gossip payload topic={} bytes={} reason=decode: {} on {}", topic, data.length, e.getMessage(), selfId);
            return;
        }
        log.debug("RECV {} topic={} on {}", m, topic, selfId);
        sink.accept(m);
    }

    @Override
    public synchronized void close() {
        running = false;
        if (loop != null) {
            loop.interrupt();
            try {
                loop.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (subscription != null) subscription.close();
    }
}
