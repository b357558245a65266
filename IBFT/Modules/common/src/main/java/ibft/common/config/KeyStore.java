package ibft.common.config;

import ibft.common.crypto.KeyFiles;
import ibft.common.validators.ProposerSchedule;
import ibft.common.validators.StaticValidatorSetProvider;
import ibft.common.validators.Validator;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class KeyStore {

    private final Map<String, PublicKey> validators = new HashMap<>();

    public static KeyStore from(ClusterConfig config, Path baseDir) throws IOException, GeneralSecurityException {
        KeyStore keyStore = new KeyStore();
        if (config.validators == null) return keyStore;
        for (ClusterConfig.ValidatorEntry v : config.validators) {
            if (v.publicKeyPath != null && !v.publicKeyPath.isBlank()) {
                keyStore.validators.put(v.id, KeyFiles.loadPublicKeyPem(baseDir.resolve(v.publicKeyPath)));
            }
        }
        return keyStore;
    }

    public Optional<PublicKey> validatorKey(String id) { return Optional.ofNullable(validators.get(id)); }

    public int validatorCount() { return validators.size(); }

    public StaticValidatorSetProvider rosterFor(ClusterConfig.Shard shard) {
        List<Validator> roster = new ArrayList<>(shard.validators.size());
        for (String id : shard.validators) {
            PublicKey pk = validators.get(id);
            if (pk == null) throw new IllegalStateException("Trust invalid: no public key for " + id + " in shard " + shard.id);
            roster.add(new Validator(id, pk));
        }
        return new StaticValidatorSetProvider(roster, ProposerSchedule.roundRobin());
    }
}
