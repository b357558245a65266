package ibft.common.messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record PreparedCertificate(ConsensusMessage proposalMessage, List<ConsensusMessage> prepareMessages) {
    public PreparedCertificate {
        Objects.requireNonNull(proposalMessage, "proposalMessage");
        prepareMessages = List.copyOf(prepareMessages);
    }

    public List<ConsensusMessage> allMessages() {
        List<ConsensusMessage> all = new ArrayList<>(prepareMessages.size() + 1);
        all.add(proposalMessage);
        all.addAll(prepareMessages);
        return all;
    }

    public long round() { return proposalMessage.round(); }
}
