package ibft.validator.core;

import com.google.protobuf.ByteString;
import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.MessageType;
import ibft.common.messages.View;
import ibft.validator.TestCluster;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageLogTest {
    private static final ByteString H1 = ByteString.copyFromUtf8("h1");
    private static final ByteString H2 = ByteString.copyFromUtf8("h2");

    private final TestCluster cluster = TestCluster.of(4);
    private final MessageLog log = new MessageLog(3);

    @Test
    void keepsOneMessagePerSenderTypeAndRound() {
        ConsensusMessage p = cluster.factory("v1").prepare(new View(3, 0), H1);
        assertThat(log.add(p)).isEqualTo(MessageLog.AddResult.ADDED);
        assertThat(log.add(p)).isEqualTo(MessageLog.AddResult.DUPLICATE);
        assertThat(log.contains(p)).isTrue();
        assertThat(log.size()).isEqualTo(1);

        // same sender, other round or type: separate slots
        assertThat(log.add(cluster.factory("v1").prepare(new View(3, 1), H1))).isEqualTo(MessageLog.AddResult.ADDED);
        assertThat(log.add(cluster.factory("v1").commit(new View(3, 0), H1))).isEqualTo(MessageLog.AddResult.ADDED);
        assertThat(log.size()).isEqualTo(3);
    }

    @Test
    void firstSeenWinsAndConflictIsRecorded() {
        ConsensusMessage first = cluster.factory("v2").prepare(new View(3, 0), H1);
        ConsensusMessage second = cluster.factory("v2").prepare(new View(3, 0), H2);
        log.add(first);

        assertThat(log.add(second)).isEqualTo(MessageLog.AddResult.EQUIVOCATION);
        assertThat(log.messages(0, MessageType.PREPARE)).containsExactly(first);
        assertThat(log.equivocations()).singleElement().satisfies(e -> {
            assertThat(e.sender()).isEqualTo("v2");
            assertThat(e.type()).isEqualTo(MessageType.PREPARE);
            assertThat(e.first()).isEqualTo(first);
            assertThat(e.conflicting()).isEqualTo(second);
        });
    }

    @Test
    void resentConflictIsNotRecordedTwice() {
        ConsensusMessage first = cluster.factory("v2").prepare(new View(3, 0), H1);
        ConsensusMessage second = cluster.factory("v2").prepare(new View(3, 0), H2);
        log.add(first);

        assertThat(log.add(second)).isEqualTo(MessageLog.AddResult.EQUIVOCATION);
        for (int i = 0; i < 4; i++) assertThat(log.add(second)).isEqualTo(MessageLog.AddResult.DUPLICATE);
        assertThat(log.contains(second)).isTrue();
        assertThat(log.firstOf(second)).isEqualTo(first);
        assertThat(log.equivocations()).hasSize(1);
    }

    @Test
    void evidencePerHeightIsBounded() {
        MessageFactory v1 = cluster.factory("v1");
        log.add(v1.prepare(new View(3, 0), H1));
        for (int i = 0; i < MessageLog.MAX_EVIDENCE + 10; i++) {
            log.add(v1.prepare(new View(3, 0), ByteString.copyFromUtf8("conflict-" + i)));
        }
        assertThat(log.equivocations()).hasSize(MessageLog.MAX_EVIDENCE);
    }

    @Test
    void keepsOnlyTheHighestRoundChangeOfEachSender() {
        MessageFactory v1 = cluster.factory("v1");
        assertThat(log.add(v1.roundChange(new View(3, 2), null, null))).isEqualTo(MessageLog.AddResult.ADDED);
        assertThat(log.add(v1.roundChange(new View(3, 6), null, null))).isEqualTo(MessageLog.AddResult.ADDED);
        assertThat(log.add(v1.roundChange(new View(3, 4), null, null))).isEqualTo(MessageLog.AddResult.SUPERSEDED);

        assertThat(log.roundsAbove(0, MessageType.ROUND_CHANGE)).containsOnlyKeys(6L);
        assertThat(log.size()).isEqualTo(1);

        // other types are unaffected
        assertThat(log.add(v1.prepare(new View(3, 2), H1))).isEqualTo(MessageLog.AddResult.ADDED);
        assertThat(log.size()).isEqualTo(2);
    }

    @Test
    void queriesByRoundTypeAndFilter() {
        MessageFactory v0 = cluster.factory("v0");
        MessageFactory v1 = cluster.factory("v1");
        MessageFactory v2 = cluster.factory("v2");
        log.add(v0.prepare(new View(3, 0), H1));
        log.add(v1.prepare(new View(3, 0), H2));
        log.add(v0.roundChange(new View(3, 2), null, null));
        log.add(v1.roundChange(new View(3, 2), null, null));
        log.add(v2.roundChange(new View(3, 5), null, null));

        assertThat(log.messages(0, MessageType.PREPARE, m -> m.sender().equals("v1")))
                .extracting(ConsensusMessage::sender).containsExactly("v1");
        assertThat(log.messages(1, MessageType.PREPARE)).isEmpty();
        assertThat(log.roundsAbove(0, MessageType.ROUND_CHANGE)).containsOnlyKeys(2L, 5L);
        assertThat(log.roundsAbove(2, MessageType.ROUND_CHANGE)).containsOnlyKeys(5L);
        assertThat(log.roundsAbove(0, MessageType.ROUND_CHANGE).get(2L)).hasSize(2);
    }

    @Test
    void pruneAndClearKeepEvidence() {
        MessageFactory v0 = cluster.factory("v0");
        log.add(v0.prepare(new View(3, 0), H1));
        log.add(v0.prepare(new View(3, 0), H2));
        log.add(v0.prepare(new View(3, 2), H1));

        log.pruneBelow(2);
        assertThat(log.messages(0, MessageType.PREPARE)).isEmpty();
        assertThat(log.size()).isEqualTo(1);

        log.clear();
        assertThat(log.size()).isZero();
        assertThat(log.equivocations()).hasSize(1);
    }

    @Test
    void rejectsOtherHeights() {
        ConsensusMessage p = cluster.factory("v0").prepare(new View(4, 0), H1);
        assertThatThrownBy(() -> log.add(p)).isInstanceOf(IllegalArgumentException.class);
    }
}
