package ibft.validator;

import ibft.validator.core.FinalizedProposal;
import ibft.validator.core.IbftCore;
import ibft.validator.core.ShardContext;
import ibft.validator.net.GossipTransport;
import ibft.validator.net.PubSub;
import ibft.validator.net.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

// One shard on one node: a consensus core wired to the shard's gossip topic, run height after height.
public final class ShardValidator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShardValidator.class);

    private final ShardContext ctx;
    private final IbftCore core;
    private final GossipTransport transport;
    private volatile boolean closed;

    public ShardValidator(ShardContext ctx, PubSub pubSub, String protocol) {
        this.ctx = ctx;
        this.core = new IbftCore(ctx);
        this.transport = new GossipTransport(pubSub, Topics.forShard(protocol, ctx.shardId), ctx.selfId);
        core.setTransport(transport);
    }

    public IbftCore core() { return core; }

    public String topic() { return transport.topic(); }

    public void start(long startHeight) {
        transport.start(core::addMessage, core::isActiveValidator);
        log.info("Shard {} started at h={} topic={} on {}", ctx.shardId, startHeight, transport.topic(), ctx.selfId);
        runHeight(startHeight);
    }

    private void runHeight(long height) {
        if (closed) return;
        core.runSequence(height).whenComplete((finalized, err) -> onSequenceDone(height, finalized, err));
    }

    private void onSequenceDone(long height, FinalizedProposal finalized, Throwable err) {
        if (closed) return;
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof CancellationException) {
            log.info("Shard {} sequence h={} cancelled on {}", ctx.shardId, height, ctx.selfId);
            return;
        }
        if (cause != null) {
            // consensus finalized the height; only applying it failed
            log.error("Shard {} h={} finalized but not applied, moving on on {}", ctx.shardId, height, ctx.selfId, cause);
        } else {
            log.debug("Shard {} h={} done in round {} on {}", ctx.shardId, height, finalized.round(), ctx.selfId);
        }
        runHeight(height + 1);
    }

    @Override
    public void close() {
        closed = true;
        transport.close();
        core.close();
    }
}
