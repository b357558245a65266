package ibft.validator.state;

import ibft.common.util.Hex;
import ibft.validator.core.FinalizationSink;
import ibft.validator.core.FinalizedProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

public final class LoggingFinalizationSink implements FinalizationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingFinalizationSink.class);

    private final String selfId;
    private final int shardId;
    private final AtomicLong lastHeight = new AtomicLong(0);

    public LoggingFinalizationSink(String selfId, int shardId) {
        this.selfId = selfId;
        this.shardId = shardId;
    }

    @Override
    public void insertProposal(FinalizedProposal finalized) {
        long prev = lastHeight.getAndSet(finalized.height());
        if (prev != 0 && finalized.height() != prev + 1) {
            log.warn("BLOCK shard={} h={} follows h={}, heights skipped on {}", shardId, finalized.height(), prev, selfId);
        }
        log.info("BLOCK shard={} h={} r={} hash={} seals={} body={} on {}", shardId, finalized.height(), finalized.round(),
                Hex.shortHex(finalized.proposalHash()), finalized.seals().size(),
                finalized.proposal().rawProposal().toString(StandardCharsets.UTF_8), selfId);
    }

    public long lastHeight() { return lastHeight.get(); }
}
