package ibft.common.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.*;

public final class Signer {
    private static final String ALGORITHM = "Ed25519";

    private Signer() {}

    public static byte[] sign(String domain, byte[] data, PrivateKey sk) throws GeneralSecurityException {
        Signature s = Signature.getInstance(ALGORITHM);
        s.initSign(sk);
        s.update(join(domain, data));
        return s.sign();
    }

    public static boolean verify(String domain, byte[] data, byte[] signature, PublicKey pk)
            throws GeneralSecurityException {
        Signature s = Signature.getInstance(ALGORITHM);
        s.initVerify(pk);
        s.update(join(domain, data));
        try {
            return s.verify(signature);
        } catch (SignatureException e) {
            // malformed signature encoding
            return false;
        }
    }

    private static byte[] join(String domain, byte[] data) {
        byte[] d = domain.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(d.length + 1 + data.length);
        buf.put(d).put((byte) 0).put(data);
        return buf.array();
    }
}
