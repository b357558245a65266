package ibft.common.messages;

import com.google.protobuf.ByteString;

import java.util.Objects;

// Opaque block payload together with the round it was proposed in.
// The round is part of the hashed content.
public record Proposal(ByteString rawProposal, long round) {
    public Proposal {
        Objects.requireNonNull(rawProposal, "rawProposal");
    }

    public Proposal inRound(long r) { return new Proposal(rawProposal, r); }
}
