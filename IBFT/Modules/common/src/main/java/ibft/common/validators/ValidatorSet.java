package ibft.common.validators;

import java.security.PublicKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class ValidatorSet {
    private final long height;
    private final List<Validator> validators;
    private final Map<String, Validator> byId;
    private final ProposerSchedule schedule;

    public ValidatorSet(long height, List<Validator> validators, ProposerSchedule schedule) {
        if (validators == null || validators.isEmpty()) {
            throw new IllegalArgumentException("validator set for height " + height + " is empty");
        }
        this.height = height;
        this.validators = List.copyOf(validators);
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        Map<String, Validator> m = new LinkedHashMap<>();
        for (Validator v : this.validators) {
            if (m.put(v.id(), v) != null) {
                throw new IllegalArgumentException("duplicate validator " + v.id() + " at height " + height);
            }
        }
        this.byId = Collections.unmodifiableMap(m);
    }

    public ValidatorSet(long height, List<Validator> validators) {
        this(height, validators, ProposerSchedule.roundRobin());
    }

    public long height() { return height; }

    public List<Validator> validators() { return validators; }

    public int size() { return validators.size(); }

    public int maxFaulty() { return (size() - 1) / 3; }

    // ceil(2n/3), which is 2f+1 when n = 3f+1
    public int quorumSize() { return (2 * size() + 2) / 3; }

    public int weakQuorumSize() { return maxFaulty() + 1; }

    public boolean contains(String id) { return byId.containsKey(id); }

    public Optional<PublicKey> publicKey(String id) {
        Validator v = byId.get(id);
        return v == null ? Optional.empty() : Optional.of(v.publicKey());
    }

    public String proposer(long round) {
        return validators.get(schedule.proposerIndex(size(), height, round)).id();
    }

    public boolean isProposer(String id, long h, long round) {
        if (h != height) {
            throw new IllegalArgumentException("validator set is for height " + height + ", asked about " + h);
        }
        return proposer(round).equals(id);
    }

    public ValidatorSet atHeight(long h) {
        return h == height ? this : new ValidatorSet(h, validators, schedule);
    }

    @Override
    public String toString() {
        return "ValidatorSet{h=" + height + ", n=" + size() + ", quorum=" + quorumSize() + "}";
    }
}
