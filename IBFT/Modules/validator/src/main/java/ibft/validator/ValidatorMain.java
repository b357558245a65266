package ibft.validator;

import com.google.protobuf.ByteString;
import ibft.common.config.ClusterConfig;
import ibft.common.config.KeyStore;
import ibft.common.crypto.Ed25519Signatures;
import ibft.common.crypto.KeyFiles;
import ibft.common.crypto.SigningDomains;
import ibft.validator.core.ShardContext;
import ibft.validator.net.GrpcPubSub;
import ibft.validator.net.PeerChannels;
import ibft.validator.net.Topics;
import ibft.validator.rpc.GossipRpcService;
import ibft.validator.state.LoggingFinalizationSink;
import ibft.validator.state.TimestampProposalSource;
import io.grpc.Server;
import io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "ibft-validator", mixinStandardHelpOptions = true,
        description = "Runs the IBFT consensus of every shard this validator belongs to.")
public class ValidatorMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }
    private static final Logger log = LoggerFactory.getLogger(ValidatorMain.class);

    @CommandLine.Option(names = "--id", required = true) String nodeId;
    @CommandLine.Option(names = "--port", required = true) int port;
    @CommandLine.Option(names = "--config", required = true, description = "Path to configs/cluster.json")
    String configPath;

    @CommandLine.Option(names = "--keys-dir", required = true, description = "Directory containing ed25519.key for this node")
    String keysDir;

    @CommandLine.Option(names = "--start-height", defaultValue = "1", description = "First height to run (default: ${DEFAULT-VALUE})")
    long startHeight;

    public static void main(String[] args) {
        System.exit(new CommandLine(new ValidatorMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        log.info("Starting validator {} on port {}", nodeId, port);

        java.util.logging.Logger.getLogger("io.grpc").setLevel(java.util.logging.Level.SEVERE);
        java.util.logging.Logger.getLogger("io.grpc.internal").setLevel(java.util.logging.Level.SEVERE);

        if (startHeight < 1) throw new IllegalStateException("--start-height must be >= 1");

        Path configFile = Path.of(configPath).toAbsolutePath();
        ClusterConfig cfg = ClusterConfig.load(configFile);
        cfg.validate();
        Path baseDir = configFile.getParent().getParent();
        KeyStore keys = KeyStore.from(cfg, baseDir);

        var me = cfg.validator(nodeId)
                .orElseThrow(() -> new IllegalStateException("Config invalid: nodeId " + nodeId + " not present in validators list"));
        if (me.port != this.port) {
            throw new IllegalStateException("Port mismatch: CLI --port=" + this.port + " but config has " + me.port + " for " + nodeId);
        }
        if (keys.validatorCount() != cfg.validators.size()) {
            throw new IllegalStateException("Trust invalid: loaded " + keys.validatorCount() + " validator keys but config has " + cfg.validators.size());
        }

        PrivateKey sk = KeyFiles.loadPrivateKeyPem(Path.of(keysDir, KeyFiles.PRIVATE_KEY_FILE));
        Ed25519Signatures signatures = new Ed25519Signatures(sk);
        PublicKey myPub = keys.validatorKey(nodeId).orElseThrow();
        ByteString sample = ByteString.copyFrom(new byte[]{1, 2, 3});
        if (!signatures.verify(myPub, SigningDomains.COMMITTED_SEAL, sample, signatures.sign(SigningDomains.COMMITTED_SEAL, sample))) {
            throw new IllegalStateException("Private key does not match configured public key for " + nodeId);
        }

        List<ClusterConfig.Shard> shards = cfg.shardsOf(nodeId);
        if (shards.isEmpty()) log.warn("Validator {} is not a member of any shard", nodeId);

        PeerChannels peers = PeerChannels.fromConfig(cfg, nodeId);
        GrpcPubSub pubSub = new GrpcPubSub(nodeId, peers);
        List<ShardValidator> running = new ArrayList<>();
        for (ClusterConfig.Shard shard : shards) {
            pubSub.registerTopic(Topics.forShard(cfg.protocol, shard.id), shard.validators);
            ShardContext ctx = new ShardContext(nodeId, shard.id, keys.rosterFor(shard), signatures,
                    new TimestampProposalSource(nodeId, shard.id),
                    new LoggingFinalizationSink(nodeId, shard.id),
                    (h, from) -> log.warn("Shard {} saw h={} from {} ahead of local progress on {}", shard.id, h, from, nodeId),
                    cfg.baseRoundTimeoutMs, cfg.maxRoundTimeoutMs);
            running.add(new ShardValidator(ctx, pubSub, cfg.protocol));
        }

        Server server = NettyServerBuilder.forAddress(new InetSocketAddress("0.0.0.0", port))
                .addService(new GossipRpcService(nodeId, pubSub))
                .build()
                .start();

        for (ShardValidator sv : running) sv.start(startHeight);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down validator {}", nodeId);
            server.shutdown();
            for (ShardValidator sv : running) sv.close();
            pubSub.close();
        }));
        log.info("Validator {} started with {} shard(s)", nodeId, running.size());
        server.awaitTermination();
        return 0;
    }
}
