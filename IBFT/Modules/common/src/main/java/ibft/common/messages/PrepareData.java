package ibft.common.messages;

import com.google.protobuf.ByteString;

import java.util.Objects;

public record PrepareData(ByteString proposalHash) implements Payload {
    public PrepareData {
        Objects.requireNonNull(proposalHash, "proposalHash");
    }

    @Override public MessageType type() { return MessageType.PREPARE; }
}
