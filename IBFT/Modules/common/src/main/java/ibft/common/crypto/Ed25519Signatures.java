package ibft.common.crypto;

import com.google.protobuf.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

public final class Ed25519Signatures implements Signatures {
    private static final Logger log = LoggerFactory.getLogger(Ed25519Signatures.class);

    private final PrivateKey sk;

    public Ed25519Signatures(PrivateKey sk) {
        this.sk = Objects.requireNonNull(sk, "sk");
    }

    @Override
    public ByteString sign(String domain, ByteString data) {
        try {
            return ByteString.copyFrom(Signer.sign(domain, data.toByteArray(), sk));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 signing failed for " + domain, e);
        }
    }

    @Override
    public boolean verify(PublicKey publicKey, String domain, ByteString data, ByteString signature) {
        if (signature.isEmpty()) return false;
        try {
            return Signer.verify(domain, data.toByteArray(), signature.toByteArray(), publicKey);
        } catch (GeneralSecurityException e) {
            log.debug("signature check failed for {}: {}", domain, e.getMessage());
            return false;
        }
    }
}
