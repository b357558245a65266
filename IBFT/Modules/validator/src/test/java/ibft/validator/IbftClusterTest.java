package ibft.validator;

import com.google.protobuf.ByteString;
import ibft.common.messages.MessageType;
import ibft.common.messages.View;
import ibft.common.validation.MessageCodec;
import ibft.validator.core.EquivocationEvidence;
import ibft.validator.core.FinalizedProposal;
import ibft.validator.core.MessageFactory;
import ibft.validator.core.ProposalSource;
import ibft.validator.net.InMemoryPubSub;
import ibft.validator.net.LocalTopics;
import ibft.validator.net.Topics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Four validators of one shard over a shared in-memory network, three of them honest.
 */
class IbftClusterTest {
    private static final String PROTOCOL = "/ibft/test";

    private final TestCluster cluster = TestCluster.of(4);
    private final LocalTopics network = new LocalTopics();
    private final Map<String, List<FinalizedProposal>> finalized = new LinkedHashMap<>();
    private final List<ShardValidator> running = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (ShardValidator v : running) v.close();
    }

    private static ProposalSource proposalsOf(String id) {
        return view -> TestCluster.raw(id + "@" + view.height() + "/" + view.round());
    }

    private void start(List<String> ids, long baseTimeoutMs) {
        for (String id : ids) {
            List<FinalizedProposal> out = new CopyOnWriteArrayList<>();
            finalized.put(id, out);
            ShardValidator v = new ShardValidator(cluster.context(id, proposalsOf(id), out::add, baseTimeoutMs),
                    new InMemoryPubSub(network), PROTOCOL);
            running.add(v);
        }
        for (ShardValidator v : running) v.start(1);
    }

    private void awaitHeight(long height) throws InterruptedException {
        TestCluster.waitFor(() -> finalized.values().stream().allMatch(l -> l.size() >= height), 15_000);
    }

    private void assertAgreementUpTo(long height) {
        for (int h = 0; h < height; h++) {
            List<ByteString> hashes = new ArrayList<>();
            for (List<FinalizedProposal> l : finalized.values()) {
                assertThat(l.get(h).height()).isEqualTo(h + 1);
                hashes.add(l.get(h).proposalHash());
            }
            assertThat(hashes).as("height %d", h + 1).containsOnly(hashes.get(0));
        }
    }

    @Test
    void honestMajorityAgreesDespiteEquivocatingValidator() throws Exception {
        start(List.of("v0", "v1", "v2"), 500);

        // v3 votes for two different values at a height the others have not reached yet
        MessageFactory byzantine = cluster.factory("v3");
        InMemoryPubSub byzantineNet = new InMemoryPubSub(network);
        String topic = Topics.forShard(PROTOCOL, TestCluster.SHARD);
        List<View> views = List.of(new View(5, 0), new View(5, 1));
        for (View view : views) {
            byzantineNet.publish(topic, MessageCodec.encode(byzantine.prepare(view, ByteString.copyFromUtf8("value-a"))));
            byzantineNet.publish(topic, MessageCodec.encode(byzantine.prepare(view, ByteString.copyFromUtf8("value-b"))));
        }

        awaitHeight(5);
        assertAgreementUpTo(5);

        for (ShardValidator v : running) {
            List<EquivocationEvidence> evidence = v.core().equivocations().get(5, TimeUnit.SECONDS);
            assertThat(evidence).allSatisfy(e -> {
                assertThat(e.sender()).isEqualTo("v3");
                assertThat(e.type()).isEqualTo(MessageType.PREPARE);
            });
            assertThat(evidence).extracting(EquivocationEvidence::view).containsExactlyInAnyOrderElementsOf(views);
        }
    }

    @Test
    void silentProposerIsReplacedByRoundChange() throws Exception {
        // v1 proposes round 0 of height 1 and never comes up
        start(List.of("v0", "v2", "v3"), 200);

        awaitHeight(1);
        assertAgreementUpTo(1);
        for (List<FinalizedProposal> l : finalized.values()) {
            FinalizedProposal first = l.get(0);
            assertThat(first.round()).isGreaterThanOrEqualTo(1);
            assertThat(first.proposal().rawProposal().toStringUtf8()).doesNotStartWith("v1@");
        }
    }
}
