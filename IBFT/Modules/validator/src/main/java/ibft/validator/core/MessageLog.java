package ibft.validator.core;

import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.MessageType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

// Accepted messages of the current height, keyed round, then type, then sender.
// One message per (sender, type, round), and one ROUND_CHANGE per sender: its highest round.
// Owned by the consensus thread.
public final class MessageLog {
    static final int MAX_EVIDENCE = 256;

    public enum AddResult { ADDED, DUPLICATE, SUPERSEDED, EQUIVOCATION }

    private final long height;
    private final TreeMap<Long, EnumMap<MessageType, LinkedHashMap<String, ConsensusMessage>>> rounds = new TreeMap<>();
    private final Map<String, ConsensusMessage> latestRoundChange = new HashMap<>();
    private final List<EquivocationEvidence> equivocations = new ArrayList<>();
    private final Set<ConsensusMessage> conflicting = new HashSet<>();
    private int size;

    public MessageLog(long height) {
        this.height = height;
    }

    public long height() { return height; }

    public AddResult add(ConsensusMessage m) {
        if (m.height() != height) {
            throw new IllegalArgumentException("message for height " + m.height() + " in log of height " + height);
        }
        if (m.type() == MessageType.ROUND_CHANGE) {
            ConsensusMessage held = latestRoundChange.get(m.sender());
            if (held != null && held.round() > m.round()) return AddResult.SUPERSEDED;
            if (held != null && held.round() < m.round()) remove(held);
        }
        Map<String, ConsensusMessage> bySender = rounds
                .computeIfAbsent(m.round(), r -> new EnumMap<>(MessageType.class))
                .computeIfAbsent(m.type(), t -> new LinkedHashMap<>());
        ConsensusMessage first = bySender.get(m.sender());
        if (first == null) {
            bySender.put(m.sender(), m);
            if (m.type() == MessageType.ROUND_CHANGE) latestRoundChange.put(m.sender(), m);
            size++;
            return AddResult.ADDED;
        }
        if (first.equals(m) || conflicting.contains(m)) return AddResult.DUPLICATE;
        if (equivocations.size() < MAX_EVIDENCE) {
            conflicting.add(m);
            equivocations.add(new EquivocationEvidence(m.sender(), m.type(), m.view(), first, m));
        }
        return AddResult.EQUIVOCATION;
    }

    private void remove(ConsensusMessage m) {
        var byType = rounds.get(m.round());
        if (byType == null) return;
        var bySender = byType.get(m.type());
        if (bySender != null && bySender.remove(m.sender()) != null) size--;
    }

    public boolean contains(ConsensusMessage m) {
        if (conflicting.contains(m)) return true;
        var byType = rounds.get(m.round());
        if (byType == null) return false;
        var bySender = byType.get(m.type());
        return bySender != null && m.equals(bySender.get(m.sender()));
    }

    public ConsensusMessage firstOf(ConsensusMessage m) {
        var byType = rounds.get(m.round());
        if (byType == null) return null;
        var bySender = byType.get(m.type());
        return bySender == null ? null : bySender.get(m.sender());
    }

    public List<ConsensusMessage> messages(long round, MessageType type) {
        var byType = rounds.get(round);
        if (byType == null) return List.of();
        var bySender = byType.get(type);
        return bySender == null ? List.of() : List.copyOf(bySender.values());
    }

    public List<ConsensusMessage> messages(long round, MessageType type, Predicate<ConsensusMessage> filter) {
        List<ConsensusMessage> out = new ArrayList<>();
        for (ConsensusMessage m : messages(round, type)) {
            if (filter.test(m)) out.add(m);
        }
        return out;
    }

    public NavigableMap<Long, List<ConsensusMessage>> roundsAbove(long round, MessageType type) {
        TreeMap<Long, List<ConsensusMessage>> out = new TreeMap<>();
        for (var e : rounds.tailMap(round, false).entrySet()) {
            var bySender = e.getValue().get(type);
            if (bySender != null && !bySender.isEmpty()) out.put(e.getKey(), List.copyOf(bySender.values()));
        }
        return out;
    }

    // Equivocation evidence survives pruning.
    public void pruneBelow(long round) {
        var old = rounds.headMap(round, false);
        for (var byType : old.values()) {
            for (var bySender : byType.values()) size -= bySender.size();
        }
        old.clear();
        latestRoundChange.values().removeIf(m -> m.round() < round);
    }

    public List<EquivocationEvidence> equivocations() {
        return Collections.unmodifiableList(new ArrayList<>(equivocations));
    }

    public int size() { return size; }

    public void clear() {
        rounds.clear();
        latestRoundChange.clear();
        size = 0;
    }
}
