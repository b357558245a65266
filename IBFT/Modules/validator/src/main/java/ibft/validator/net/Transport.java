package ibft.validator.net;

import ibft.common.messages.ConsensusMessage;

/**
 * Broadcast primitive the consensus core sends through. Every validator of the shard,
 * the sender included, receives the message. Failed sends are not retried here.
 */
@FunctionalInterface
public interface Transport {
    void multicast(ConsensusMessage message) throws TransportException;
}
