package ibft.validator.state;

import com.google.protobuf.ByteString;
import ibft.common.messages.View;
import ibft.validator.core.ProposalSource;

import java.nio.charset.StandardCharsets;
import java.util.function.LongSupplier;

// Placeholder block builder: a small text record naming shard, view, proposer and time.
public final class TimestampProposalSource implements ProposalSource {
    static final int MAX_PROPOSAL_BYTES = 1 << 20;

    private final String selfId;
    private final int shardId;
    private final LongSupplier clock;

    public TimestampProposalSource(String selfId, int shardId, LongSupplier clock) {
        this.selfId = selfId;
        this.shardId = shardId;
        this.clock = clock;
    }

    public TimestampProposalSource(String selfId, int shardId) {
        this(selfId, shardId, System::currentTimeMillis);
    }

    @Override
    public ByteString buildProposal(View view) {
        String block = "shard=" + shardId + ";height=" + view.height() + ";round=" + view.round()
                + ";proposer=" + selfId + ";ts=" + clock.getAsLong();
        return ByteString.copyFrom(block, StandardCharsets.UTF_8);
    }

    @Override
    public boolean isValidProposal(ByteString rawProposal) {
        return !rawProposal.isEmpty() && rawProposal.size() <= MAX_PROPOSAL_BYTES;
    }
}
