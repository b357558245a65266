package ibft.common.messages;

import com.google.protobuf.ByteString;

import java.util.Objects;

public record PrePrepareData(Proposal proposal, ByteString proposalHash, RoundChangeCertificate certificate)
        implements Payload {
    public PrePrepareData {
        Objects.requireNonNull(proposal, "proposal");
        Objects.requireNonNull(proposalHash, "proposalHash");
    }

    @Override public MessageType type() { return MessageType.PRE_PREPARE; }
}
