package ibft.validator.net;

import java.util.concurrent.TimeUnit;

/**
 * Topic based publish/subscribe between the validators of a shard. A publisher's own
 * subscribers receive what it publishes.
 */
public interface PubSub {

    void publish(String topic, byte[] data) throws TransportException;

    Subscription subscribe(String topic);

    /** FIFO stream of the payloads published on one topic. */
    interface Subscription extends AutoCloseable {
        /** Next payload, or {@code null} when none arrives within the timeout. */
        byte[] poll(long timeout, TimeUnit unit) throws InterruptedException;

        @Override
        void close();
    }
}
