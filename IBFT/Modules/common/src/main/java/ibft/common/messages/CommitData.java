package ibft.common.messages;

import com.google.protobuf.ByteString;

import java.util.Objects;

public record CommitData(ByteString proposalHash, ByteString committedSeal) implements Payload {
    public CommitData {
        Objects.requireNonNull(proposalHash, "proposalHash");
        Objects.requireNonNull(committedSeal, "committedSeal");
    }

    @Override public MessageType type() { return MessageType.COMMIT; }
}
