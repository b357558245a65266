package ibft.common.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterConfig {
    public static final String DEFAULT_PROTOCOL = "/ibft/0.1";

    public String protocol = DEFAULT_PROTOCOL;
    public long baseRoundTimeoutMs = 2000L;
    public long maxRoundTimeoutMs = 60000L;
    public List<ValidatorEntry> validators;
    public List<Shard> shards;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidatorEntry {
        public String id;
        public String host;
        public int port;
        @JsonAlias({"pubkeyPemPath", "publicKeyPath"})
        public String publicKeyPath;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Shard {
        public int id;
        public List<String> validators;
    }

    public static ClusterConfig load(Path path) throws IOException {
        return new ObjectMapper().readValue(path.toFile(), ClusterConfig.class);
    }

    public Optional<ValidatorEntry> validator(String id) {
        if (validators == null) return Optional.empty();
        return validators.stream().filter(v -> id.equals(v.id)).findFirst();
    }

    public List<Shard> shardsOf(String validatorId) {
        if (shards == null) return List.of();
        return shards.stream().filter(s -> s.validators != null && s.validators.contains(validatorId)).toList();
    }

    public void validate() {
        if (protocol == null || protocol.isBlank()) throw new IllegalStateException("Config invalid: protocol blank");
        if (baseRoundTimeoutMs <= 0 || maxRoundTimeoutMs < baseRoundTimeoutMs) {
            throw new IllegalStateException("Config invalid: round timeouts base=" + baseRoundTimeoutMs + " max=" + maxRoundTimeoutMs);
        }
        if (validators == null || validators.isEmpty()) throw new IllegalStateException("Config invalid: validators list empty");
        Set<String> ids = new HashSet<>();
        for (ValidatorEntry v : validators) {
            if (v.id == null || v.id.isBlank()) throw new IllegalStateException("Config invalid: validator without id");
            if (!ids.add(v.id)) throw new IllegalStateException("Config invalid: duplicate validator " + v.id);
        }
        if (shards == null || shards.isEmpty()) throw new IllegalStateException("Config invalid: shards list empty");
        Set<Integer> shardIds = new HashSet<>();
        for (Shard s : shards) {
            if (!shardIds.add(s.id)) throw new IllegalStateException("Config invalid: duplicate shard " + s.id);
            if (s.validators == null || s.validators.isEmpty()) {
                throw new IllegalStateException("Config invalid: shard " + s.id + " has no validators");
            }
            for (String member : s.validators) {
                if (!ids.contains(member)) {
                    throw new IllegalStateException("Config invalid: shard " + s.id + " names unknown validator " + member);
                }
            }
        }
    }
}
