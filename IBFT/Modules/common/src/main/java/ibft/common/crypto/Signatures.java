package ibft.common.crypto;

import com.google.protobuf.ByteString;
import ibft.common.messages.CommittedSeal;
import ibft.common.validators.ValidatorSet;

import java.security.PublicKey;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Signing capability of the local validator plus verification against any validator key.
 * Consumers never see key material beyond public keys.
 */
public interface Signatures {

    ByteString sign(String domain, ByteString data);

    boolean verify(PublicKey publicKey, String domain, ByteString data, ByteString signature);

    /**
     * Threshold check of a finality proof: at least a quorum of distinct validators of {@code validators},
     * each with a valid seal over {@code proposalHash}.
     */
    default boolean verifyCommittedSeals(ByteString proposalHash, List<CommittedSeal> seals, ValidatorSet validators) {
        Set<String> signers = new HashSet<>();
        for (CommittedSeal seal : seals) {
            Optional<PublicKey> pk = validators.publicKey(seal.signer());
            if (pk.isEmpty()) return false;
            if (!verify(pk.get(), SigningDomains.COMMITTED_SEAL, proposalHash, seal.signature())) return false;
            if (!signers.add(seal.signer())) return false;
        }
        return signers.size() >= validators.quorumSize();
    }
}
