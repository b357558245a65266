package ibft.validator.net;

import ibft.common.messages.ConsensusMessage;
import ibft.validator.core.IbftCore;

// Hands every message straight back to one local core, for single validator shards and tests.
// Delivery keeps send order because the core queues it on its own FIFO executor.
public final class LoopbackTransport implements Transport {
    private final IbftCore core;

    public LoopbackTransport(IbftCore core) {
        this.core = core;
    }

    @Override
    public void multicast(ConsensusMessage message) {
        core.addMessage(message);
    }
}
