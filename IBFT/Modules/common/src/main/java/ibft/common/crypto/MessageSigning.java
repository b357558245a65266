package ibft.common.crypto;

import com.google.protobuf.ByteString;
import ibft.common.messages.CommitData;
import ibft.common.messages.ConsensusMessage;
import ibft.common.validation.MessageCodec;

import java.security.PublicKey;

public final class MessageSigning {
    private MessageSigning() {}

    public static ConsensusMessage sign(ConsensusMessage unsigned, Signatures signatures) {
        ByteString data = ByteString.copyFrom(MessageCodec.signingBytes(unsigned));
        return unsigned.withSignature(signatures.sign(SigningDomains.forType(unsigned.type()), data));
    }

    public static boolean verify(ConsensusMessage message, PublicKey senderKey, Signatures signatures) {
        ByteString data = ByteString.copyFrom(MessageCodec.signingBytes(message));
        return signatures.verify(senderKey, SigningDomains.forType(message.type()), data, message.signature());
    }

    public static ByteString seal(ByteString proposalHash, Signatures signatures) {
        return signatures.sign(SigningDomains.COMMITTED_SEAL, proposalHash);
    }

    public static boolean verifySeal(ConsensusMessage commit, PublicKey senderKey, Signatures signatures) {
        if (!(commit.payload() instanceof CommitData d)) return false;
        return signatures.verify(senderKey, SigningDomains.COMMITTED_SEAL, d.proposalHash(), d.committedSeal());
    }
}
