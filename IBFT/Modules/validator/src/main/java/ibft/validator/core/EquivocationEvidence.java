package ibft.validator.core;

import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.MessageType;
import ibft.common.messages.View;

// Two validly signed, different messages of one type from one sender in one view.
// The first one seen is the one that was kept.
public record EquivocationEvidence(String sender, MessageType type, View view,
                                   ConsensusMessage first, ConsensusMessage conflicting) {
}
