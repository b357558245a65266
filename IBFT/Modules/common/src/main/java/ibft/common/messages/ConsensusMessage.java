package ibft.common.messages;

import com.google.protobuf.ByteString;

import java.util.Objects;

public record ConsensusMessage(View view, String sender, Payload payload, ByteString signature) {

    public ConsensusMessage {
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");
        if (signature == null) signature = ByteString.EMPTY;
    }

    public static ConsensusMessage unsigned(View view, String sender, Payload payload) {
        return new ConsensusMessage(view, sender, payload, ByteString.EMPTY);
    }

    public MessageType type() { return payload.type(); }

    public long height() { return view.height(); }

    public long round() { return view.round(); }

    public ConsensusMessage withSignature(ByteString sig) {
        return new ConsensusMessage(view, sender, payload, sig);
    }

    @Override
    public String toString() {
        return type().toString() + view + " from " + sender;
    }
}
