package ibft.validator.core;

import ibft.common.messages.ConsensusMessage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Messages for heights above the running one, held until that height starts.
// Bounded in heights ahead, per height and per sender within a height; overflow is dropped.
final class FutureMessageBuffer {
    static final int MAX_HEIGHTS_AHEAD = 16;
    static final int MAX_PER_HEIGHT = 1024;
    static final int MAX_PER_SENDER = 64;

    enum Outcome { NEW_HEIGHT, BUFFERED, DROPPED }

    private static final class Pending {
        final List<ConsensusMessage> messages = new ArrayList<>();
        final Map<String, Integer> perSender = new HashMap<>();
    }

    private final TreeMap<Long, Pending> byHeight = new TreeMap<>();

    Outcome add(ConsensusMessage m, long currentHeight) {
        long h = m.height();
        if (h <= currentHeight || h - currentHeight > MAX_HEIGHTS_AHEAD) return Outcome.DROPPED;
        Pending pending = byHeight.get(h);
        boolean newHeight = pending == null;
        if (newHeight) {
            pending = new Pending();
            byHeight.put(h, pending);
        } else {
            if (pending.messages.size() >= MAX_PER_HEIGHT) return Outcome.DROPPED;
            if (pending.perSender.getOrDefault(m.sender(), 0) >= MAX_PER_SENDER) return Outcome.DROPPED;
            if (pending.messages.contains(m)) return Outcome.DROPPED;
        }
        pending.messages.add(m);
        pending.perSender.merge(m.sender(), 1, Integer::sum);
        return newHeight ? Outcome.NEW_HEIGHT : Outcome.BUFFERED;
    }

    List<ConsensusMessage> drain(long height) {
        byHeight.headMap(height, false).clear();
        Pending pending = byHeight.remove(height);
        return pending == null ? List.of() : pending.messages;
    }

    int size() {
        int n = 0;
        for (Pending p : byHeight.values()) n += p.messages.size();
        return n;
    }
}
