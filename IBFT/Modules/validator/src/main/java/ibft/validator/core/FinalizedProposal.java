package ibft.validator.core;

import com.google.protobuf.ByteString;
import ibft.common.messages.CommittedSeal;
import ibft.common.messages.Proposal;

import java.util.List;

public record FinalizedProposal(long height, long round, Proposal proposal, ByteString proposalHash,
                                List<CommittedSeal> seals) {
    public FinalizedProposal {
        seals = List.copyOf(seals);
    }
}
