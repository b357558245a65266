package ibft.common.crypto;

import com.google.protobuf.ByteString;
import ibft.common.messages.Proposal;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Digests {
    private Digests() {}

    public static byte[] sha256(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static ByteString proposalHash(Proposal proposal) {
        byte[] raw = proposal.rawProposal().toByteArray();
        ByteBuffer buf = ByteBuffer.allocate(raw.length + Long.BYTES);
        buf.put(raw).putLong(proposal.round());
        return ByteString.copyFrom(sha256(buf.array()));
    }
}
