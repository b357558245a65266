package ibft.validator.core;

import ibft.common.crypto.Signatures;
import ibft.common.validators.ValidatorSetProvider;

import java.util.Objects;

public final class ShardContext {
    public final String selfId;
    public final int shardId;
    public final ValidatorSetProvider validators;
    public final Signatures signatures;
    public final ProposalSource proposals;
    public final FinalizationSink sink;
    public final HeightCatchUpListener catchUp;
    public final long baseRoundTimeoutMs;
    public final long maxRoundTimeoutMs;

    public ShardContext(String selfId,
                        int shardId,
                        ValidatorSetProvider validators,
                        Signatures signatures,
                        ProposalSource proposals,
                        FinalizationSink sink,
                        HeightCatchUpListener catchUp,
                        long baseRoundTimeoutMs,
                        long maxRoundTimeoutMs) {
        this.selfId = Objects.requireNonNull(selfId, "selfId");
        this.shardId = shardId;
        this.validators = Objects.requireNonNull(validators, "validators");
        this.signatures = Objects.requireNonNull(signatures, "signatures");
        this.proposals = Objects.requireNonNull(proposals, "proposals");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.catchUp = catchUp == null ? HeightCatchUpListener.NONE : catchUp;
        this.baseRoundTimeoutMs = baseRoundTimeoutMs;
        this.maxRoundTimeoutMs = maxRoundTimeoutMs;
    }

    public ShardContext(String selfId,
                        int shardId,
                        ValidatorSetProvider validators,
                        Signatures signatures,
                        ProposalSource proposals,
                        FinalizationSink sink) {
        this(selfId, shardId, validators, signatures, proposals, sink, HeightCatchUpListener.NONE, 2000L, 60000L);
    }

    public String name() {
        return selfId + "-shard" + shardId;
    }
}
