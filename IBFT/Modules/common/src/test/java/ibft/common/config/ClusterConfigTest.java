package ibft.common.config;

import ibft.common.crypto.KeyFiles;
import ibft.common.validators.ValidatorSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterConfigTest {

    private static final String CLUSTER = """
            {
              "protocol": "/ibft/test",
              "baseRoundTimeoutMs": 500,
              "maxRoundTimeoutMs": 8000,
              "validators": [
                {"id": "n1", "host": "127.0.0.1", "port": 7001, "publicKeyPath": "keys/n1/ed25519.pub"},
                {"id": "n2", "host": "127.0.0.1", "port": 7002, "publicKeyPath": "keys/n2/ed25519.pub"},
                {"id": "n3", "host": "127.0.0.1", "port": 7003, "pubkeyPemPath": "keys/n3/ed25519.pub"},
                {"id": "n4", "host": "127.0.0.1", "port": 7004, "publicKeyPath": "keys/n4/ed25519.pub"}
              ],
              "shards": [
                {"id": 0, "validators": ["n1", "n2", "n3", "n4"]},
                {"id": 1, "validators": ["n2", "n3"]}
              ],
              "comment": "unknown fields are ignored"
            }
            """;

    @Test
    void loadsConfigAndRosters(@TempDir Path dir) throws Exception {
        for (String id : new String[]{"n1", "n2", "n3", "n4"}) {
            KeyFiles.writeKeyPair(dir.resolve("keys").resolve(id), KeyFiles.generateKeyPair());
        }
        Path file = dir.resolve("configs").resolve("cluster.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, CLUSTER);

        ClusterConfig cfg = ClusterConfig.load(file);
        cfg.validate();
        assertThat(cfg.protocol).isEqualTo("/ibft/test");
        assertThat(cfg.baseRoundTimeoutMs).isEqualTo(500);
        assertThat(cfg.validator("n3")).hasValueSatisfying(v -> assertThat(v.port).isEqualTo(7003));
        assertThat(cfg.shardsOf("n1")).extracting(s -> s.id).containsExactly(0);
        assertThat(cfg.shardsOf("n2")).extracting(s -> s.id).containsExactly(0, 1);

        KeyStore keys = KeyStore.from(cfg, dir);
        assertThat(keys.validatorCount()).isEqualTo(4);
        ValidatorSet shard1 = keys.rosterFor(cfg.shards.get(1)).forHeight(1);
        assertThat(shard1.size()).isEqualTo(2);
        assertThat(shard1.quorumSize()).isEqualTo(2);
        assertThat(shard1.proposer(0)).isEqualTo("n3");
    }

    @Test
    void defaultsApply(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("c.json");
        Files.writeString(file, "{\"validators\":[{\"id\":\"a\"}],\"shards\":[{\"id\":0,\"validators\":[\"a\"]}]}");
        ClusterConfig cfg = ClusterConfig.load(file);
        cfg.validate();
        assertThat(cfg.protocol).isEqualTo(ClusterConfig.DEFAULT_PROTOCOL);
        assertThat(cfg.baseRoundTimeoutMs).isEqualTo(2000);
        assertThat(cfg.maxRoundTimeoutMs).isEqualTo(60000);
    }

    @Test
    void validateRejectsInconsistentClusters() {
        ClusterConfig cfg = new ClusterConfig();
        assertThatThrownBy(cfg::validate).hasMessageContaining("validators");

        cfg.validators = new java.util.ArrayList<>();
        cfg.validators.add(entry("a"));
        cfg.validators.add(entry("a"));
        assertThatThrownBy(cfg::validate).hasMessageContaining("duplicate validator a");

        cfg.validators.set(1, entry("b"));
        assertThatThrownBy(cfg::validate).hasMessageContaining("shards");

        ClusterConfig.Shard s = new ClusterConfig.Shard();
        s.id = 3;
        s.validators = java.util.List.of("a", "zz");
        cfg.shards = java.util.List.of(s);
        assertThatThrownBy(cfg::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("unknown validator zz");
    }

    @Test
    void rosterNeedsEveryKey(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("c.json");
        Files.writeString(file, "{\"validators\":[{\"id\":\"a\"}],\"shards\":[{\"id\":0,\"validators\":[\"a\"]}]}");
        ClusterConfig cfg = ClusterConfig.load(file);
        KeyStore keys = KeyStore.from(cfg, dir);
        assertThatThrownBy(() -> keys.rosterFor(cfg.shards.get(0))).hasMessageContaining("Trust invalid");
    }

    private static ClusterConfig.ValidatorEntry entry(String id) {
        ClusterConfig.ValidatorEntry e = new ClusterConfig.ValidatorEntry();
        e.id = id;
        return e;
    }
}
