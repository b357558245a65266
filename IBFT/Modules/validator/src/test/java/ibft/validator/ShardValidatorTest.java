package ibft.validator;

import ibft.validator.core.FinalizedProposal;
import ibft.validator.net.InMemoryPubSub;
import ibft.validator.net.LocalTopics;
import ibft.validator.state.LoggingFinalizationSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ShardValidatorTest {
    private final TestCluster solo = TestCluster.of(1);
    private ShardValidator validator;

    @AfterEach
    void tearDown() {
        if (validator != null) validator.close();
    }

    @Test
    void soloShardFinalizesHeightsInOrder() throws Exception {
        LoggingFinalizationSink blocks = new LoggingFinalizationSink("v0", TestCluster.SHARD);
        List<FinalizedProposal> finalized = new CopyOnWriteArrayList<>();
        validator = new ShardValidator(solo.context("v0", TestCluster.freshProposals(), f -> {
            finalized.add(f);
            blocks.insertProposal(f);
        }, 60_000L), new InMemoryPubSub(new LocalTopics()), "/ibft/test");

        assertThat(validator.topic()).isEqualTo("/ibft/test/shard/0");
        validator.start(1);
        TestCluster.waitFor(() -> blocks.lastHeight() >= 3, 5_000);

        assertThat(finalized.subList(0, 3)).extracting(FinalizedProposal::height).containsExactly(1L, 2L, 3L);
        assertThat(finalized.get(1).proposal().rawProposal()).isEqualTo(TestCluster.raw("fresh-2-0"));
    }

    @Test
    void sinkFailureDoesNotStopLaterHeights() throws Exception {
        List<Long> applied = new CopyOnWriteArrayList<>();
        validator = new ShardValidator(solo.context("v0", TestCluster.freshProposals(), f -> {
            if (f.height() == 2) throw new IllegalStateException("rejected block");
            applied.add(f.height());
        }, 60_000L), new InMemoryPubSub(new LocalTopics()), "/ibft/test");

        validator.start(1);
        TestCluster.waitFor(() -> applied.contains(3L), 5_000);
        assertThat(applied).startsWith(1L, 3L);
    }
}
