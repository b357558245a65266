package ibft.validator.net;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public final class LocalTopics {
    private final Map<String, List<QueueSubscription>> subscribers = new ConcurrentHashMap<>();

    public PubSub.Subscription subscribe(String topic) {
        QueueSubscription s = new QueueSubscription(topic);
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(s);
        return s;
    }

    public int deliver(String topic, byte[] data) {
        List<QueueSubscription> subs = subscribers.get(topic);
        if (subs == null) return 0;
        for (QueueSubscription s : subs) s.queue.add(data);
        return subs.size();
    }

    public int subscriberCount(String topic) {
        List<QueueSubscription> subs = subscribers.get(topic);
        return subs == null ? 0 : subs.size();
    }

    private final class QueueSubscription implements PubSub.Subscription {
        private final String topic;
        private final BlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();

        QueueSubscription(String topic) { this.topic = topic; }

        @Override
        public byte[] poll(long timeout, TimeUnit unit) throws InterruptedException {
            return queue.poll(timeout, unit);
        }

        @Override
        public void close() {
            List<QueueSubscription> subs = subscribers.get(topic);
            if (subs != null) subs.remove(this);
            queue.clear();
        }
    }
}
