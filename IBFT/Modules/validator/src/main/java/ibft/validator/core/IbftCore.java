package ibft.validator.core;

import com.google.protobuf.ByteString;
import ibft.common.crypto.Digests;
import ibft.common.messages.CommittedSeal;
import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.MessageType;
import ibft.common.messages.Messages;
import ibft.common.messages.PreparedCertificate;
import ibft.common.messages.Proposal;
import ibft.common.messages.RoundChangeCertificate;
import ibft.common.messages.View;
import ibft.common.util.Hex;
import ibft.common.validation.CertificateValidator;
import ibft.common.validation.MessageValidation.Code;
import ibft.common.validation.MessageValidation.Result;
import ibft.common.validators.ValidatorSet;
import ibft.validator.net.Transport;
import ibft.validator.net.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * IBFT round protocol for one shard, one height at a time.
 * <p>
 * Inbound messages, round timeouts and sequence control are all queued on the shard's
 * {@link ConsensusEngine}; outbound messages go through a separate executor and are
 * never awaited. A node learns about its own messages the same way as everyone else's,
 * through the transport.
 */
public final class IbftCore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IbftCore.class);
    private static final int MAX_EVIDENCE = 1024;

    private final ShardContext ctx;
    private final ConsensusEngine engine;
    private final RoundTimers timers;
    private final Executor outbound;
    private final ExecutorService ownedOutbound;
    private final MessageFactory factory;

    private volatile Transport transport;
    private volatile ConsensusStatus status = ConsensusStatus.idle();
    private volatile ValidatorSet validators;
    private volatile boolean closed;

    // consensus thread only
    private final ConsensusState state = new ConsensusState();
    private final FutureMessageBuffer future = new FutureMessageBuffer();
    private final List<EquivocationEvidence> evidence = new ArrayList<>();
    private MessageLog messages;
    private CompletableFuture<FinalizedProposal> sequence;
    private boolean participating;

    public IbftCore(ShardContext ctx) {
        this(ctx, null);
    }

    /**
     * @param outbound executor for multicast calls; {@code null} for a private single-thread one
     */
    public IbftCore(ShardContext ctx, Executor outbound) {
        this.ctx = ctx;
        this.engine = new ConsensusEngine(ctx.name() + "-ibft");
        this.timers = new RoundTimers(ctx.name() + "-timers", ctx.baseRoundTimeoutMs, ctx.maxRoundTimeoutMs);
        if (outbound == null) {
            this.ownedOutbound = Executors.newSingleThreadExecutor(new ConsensusEngine.NamedTF(ctx.name() + "-outbound"));
            this.outbound = ownedOutbound;
        } else {
            this.ownedOutbound = null;
            this.outbound = outbound;
        }
        this.factory = new MessageFactory(ctx.selfId, ctx.signatures);
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    public String selfId() { return ctx.selfId; }

    /** Queues a decoded inbound message. Never blocks. */
    public void addMessage(ConsensusMessage message) {
        engine.submit("AddMessage " + message, () -> onInbound(message));
    }

    /**
     * Runs consensus for {@code height}. The future completes with the finalized proposal, or is
     * cancelled when a later sequence starts, {@link #cancelSequence()} is called or the core closes.
     */
    public CompletableFuture<FinalizedProposal> runSequence(long height) {
        CompletableFuture<FinalizedProposal> f = new CompletableFuture<>();
        if (closed) {
            f.cancel(false);
            return f;
        }
        engine.submit("RunSequence h=" + height, () -> startSequence(height, f));
        return f;
    }

    public void cancelSequence() {
        engine.submit("CancelSequence", () -> abandonSequence("cancelled"));
    }

    /** Last published snapshot; does not wait for queued work. */
    public ConsensusStatus currentView() {
        return status;
    }

    /** Snapshot taken after everything queued before this call has been processed. */
    public CompletableFuture<ConsensusStatus> status() {
        return engine.call("Status", () -> status);
    }

    public CompletableFuture<List<EquivocationEvidence>> equivocations() {
        return engine.call("Equivocations", () -> List.copyOf(evidence));
    }

    /** Whether this node is in the roster of the height it is running. */
    public boolean isActiveValidator() {
        ValidatorSet vs = validators;
        if (vs == null) vs = ctx.validators.forHeight(status.height());
        return vs.contains(ctx.selfId);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        engine.submit("Close", () -> abandonSequence("closed"));
        engine.shutdown();
        timers.close();
        if (ownedOutbound != null) ownedOutbound.shutdown();
    }

    // ---- sequence control ----

    private void startSequence(long height, CompletableFuture<FinalizedProposal> f) {
        abandonSequence("superseded by height " + height);
        if (height < state.height()) {
            f.completeExceptionally(new IllegalArgumentException(
                    "height " + height + " is below current height " + state.height()));
            return;
        }
        ValidatorSet vs = ctx.validators.forHeight(height);
        validators = vs;
        participating = vs.contains(ctx.selfId);
        messages = new MessageLog(height);
        state.reset(height);
        sequence = f;
        log.info("SEQUENCE h={} start {} participating={} on {}", height, vs, participating, ctx.selfId);
        if (!participating) {
            log.warn("SEQUENCE h={} {} is not a validator at this height, observing only", height, ctx.selfId);
        }

        startRound(0);

        List<ConsensusMessage> buffered = future.drain(height);
        if (!buffered.isEmpty()) log.debug("REPLAY {} buffered messages for h={} on {}", buffered.size(), height, ctx.selfId);
        for (ConsensusMessage m : buffered) {
            if (!sequenceActive()) break;
            admit(m);
        }
    }

    private void abandonSequence(String reason) {
        timers.cancel();
        if (sequence != null && !sequence.isDone()) {
            log.info("ABANDON h={} r={} reason={} on {}", state.height(), state.round(), reason, ctx.selfId);
            sequence.cancel(false);
        }
    }

    private boolean sequenceActive() {
        return sequence != null && !sequence.isDone() && state.name() != StateName.FINALIZED;
    }

    // ---- admission ----

    private void onInbound(ConsensusMessage m) {
        long h = state.height();
        if (m.height() > h) {
            bufferFuture(m);
            return;
        }
        if (m.height() < h) {
            log.debug("DROP {} reason=stale height current={} on {}", m, h, ctx.selfId);
            return;
        }
        if (!sequenceActive()) {
            log.debug("DROP {} reason=no active sequence at h={} on {}", m, h, ctx.selfId);
            return;
        }
        admit(m);
    }

    private void bufferFuture(ConsensusMessage m) {
        if (m.height() - state.height() > FutureMessageBuffer.MAX_HEIGHTS_AHEAD) {
            log.debug("DROP {} reason=too far ahead current={} on {}", m, state.height(), ctx.selfId);
            return;
        }
        Result sender = CertificateValidator.validateSender(m, ctx.validators.forHeight(m.height()), ctx.signatures);
        if (!sender.isOk()) {
            log.debug("REJECT {} h={} r={} sender={} reason={} on {}", m.type(), m.height(), m.round(), m.sender(),
                    sender.reason(), ctx.selfId);
            return;
        }
        switch (future.add(m, state.height())) {
            case NEW_HEIGHT -> {
                log.debug("BUFFER {} for future height, current={} on {}", m, state.height(), ctx.selfId);
                if (sequenceActive() || m.height() > state.height() + 1) {
                    ctx.catchUp.onFutureHeight(m.height(), m.sender());
                }
            }
            case BUFFERED -> log.trace("BUFFER {} on {}", m, ctx.selfId);
            case DROPPED -> log.debug("DROP {} reason=future buffer full or too far ahead current={} on {}",
                    m, state.height(), ctx.selfId);
        }
    }

    private void admit(ConsensusMessage m) {
        if (messages.contains(m)) {
            log.trace("IGNORE duplicate {} on {}", m, ctx.selfId);
            return;
        }
        Result r = validate(m);
        if (!r.isOk()) {
            if (r.code() == Code.UNKNOWN_SIGNER) {
                log.debug("REJECT {} h={} r={} sender={} reason={} on {}", m.type(), m.height(), m.round(), m.sender(), r.reason(), ctx.selfId);
            } else {
                log.warn("REJECT {} h={} r={} sender={} code={} reason={} on {}", m.type(), m.height(), m.round(), m.sender(), r.code(), r.reason(), ctx.selfId);
            }
            return;
        }
        if (m.round() < state.round()) {
            log.debug("DROP {} reason=stale round current={} on {}", m, state.round(), ctx.selfId);
            return;
        }
        switch (messages.add(m)) {
            case DUPLICATE -> log.trace("IGNORE duplicate {} on {}", m, ctx.selfId);
            case SUPERSEDED -> log.debug("IGNORE {} reason=sender already asked for a higher round on {}", m, ctx.selfId);
            case EQUIVOCATION -> onEquivocation(m);
            case ADDED -> dispatch(m);
        }
    }

    private Result validate(ConsensusMessage m) {
        Result r = CertificateValidator.validateSender(m, validators, ctx.signatures);
        if (!r.isOk()) return r;
        return switch (m.type()) {
            case PRE_PREPARE -> validatePrePrepare(m);
            case PREPARE -> Result.ok();
            case COMMIT -> CertificateValidator.validateCommitSeal(m, validators, ctx.signatures);
            case ROUND_CHANGE -> CertificateValidator.validateRoundChangePayload(m, validators, ctx.signatures);
        };
    }

    private Result validatePrePrepare(ConsensusMessage m) {
        if (!validators.isProposer(m.sender(), m.height(), m.round())) {
            return Result.fail(Code.NOT_PROPOSER, "proposer of round " + m.round() + " is " + validators.proposer(m.round()));
        }
        Result r = CertificateValidator.validateProposalHash(m);
        if (!r.isOk()) return r;
        Proposal proposal = Messages.extractProposal(m).orElseThrow();
        Optional<RoundChangeCertificate> rcc = Messages.extractRoundChangeCertificate(m);
        if (m.round() == 0) {
            if (rcc.isPresent()) return Result.fail(Code.BAD_CERTIFICATE, "round change certificate in round 0");
        } else {
            if (rcc.isEmpty()) return Result.fail(Code.BAD_CERTIFICATE, "no round change certificate for round " + m.round());
            r = CertificateValidator.validateRoundChangeCertificate(rcc.get(), validators, m.round(), ctx.signatures);
            if (!r.isOk()) return r;
            r = CertificateValidator.validateReproposal(proposal, rcc.get());
            if (!r.isOk()) return r;
        }
        if (!ctx.proposals.isValidProposal(proposal.rawProposal())) {
            return Result.fail(Code.INVALID_PROPOSAL, "proposal rejected by proposal source");
        }
        return Result.ok();
    }

    private void onEquivocation(ConsensusMessage m) {
        if (!messages.contains(m)) {
            log.debug("DROP {} reason=conflicting vote, evidence for h={} full on {}", m, state.height(), ctx.selfId);
            return;
        }
        log.warn("EQUIVOCATION {} h={} r={} sender={} first kept, conflicting dropped on {}",
                m.type(), m.height(), m.round(), m.sender(), ctx.selfId);
        if (evidence.size() < MAX_EVIDENCE) {
            evidence.add(new EquivocationEvidence(m.sender(), m.type(), m.view(), messages.firstOf(m), m));
        }
    }

    private void dispatch(ConsensusMessage m) {
        switch (m.type()) {
            case PRE_PREPARE -> onPrePrepare(m);
            case PREPARE -> {
                if (m.round() == state.round()) checkPrepareQuorum();
            }
            case COMMIT -> {
                if (m.round() == state.round()) checkCommitQuorum();
            }
            case ROUND_CHANGE -> onRoundChange(m);
        }
    }

    // ---- transitions ----

    private void startRound(long round) {
        timers.cancel();
        state.newRound(round);
        messages.pruneBelow(round);
        publishStatus();

        View view = state.view();
        timers.schedule(view, () -> engine.submit("RoundTimeout " + view, () -> onRoundTimeout(view)));
        boolean proposer = validators.isProposer(ctx.selfId, view.height(), round);
        log.info("ROUND h={} r={} proposer={} T={}ms on {}", view.height(), round,
                validators.proposer(round), timers.timeoutFor(round), ctx.selfId);

        state.name(StateName.PRE_PREPARE);
        publishStatus();
        if (proposer && participating) {
            if (round == 0) {
                freshProposal().ifPresent(p -> propose(p, null));
            } else {
                tryProposeWithCertificate();
            }
        }
        processRoundBacklog();
    }

    // Re-examines messages logged for the round before it started.
    private void processRoundBacklog() {
        if (state.name() == StateName.PRE_PREPARE) {
            List<ConsensusMessage> pps = messages.messages(state.round(), MessageType.PRE_PREPARE);
            if (!pps.isEmpty()) acceptProposal(pps.get(0));
        }
        checkPrepareQuorum();
        checkCommitQuorum();
        checkRoundJump();
    }

    private Optional<Proposal> freshProposal() {
        View view = state.view();
        try {
            ByteString raw = ctx.proposals.buildProposal(view);
            if (raw == null || raw.isEmpty()) {
                log.warn("PROPOSE h={} r={} skipped: proposal source returned nothing on {}", view.height(), view.round(), ctx.selfId);
                return Optional.empty();
            }
            return Optional.of(new Proposal(raw, view.round()));
        } catch (RuntimeException e) {
            log.error("PROPOSE h={} r={} failed to build proposal on {}", view.height(), view.round(), ctx.selfId, e);
            return Optional.empty();
        }
    }

    private void propose(Proposal proposal, RoundChangeCertificate certificate) {
        ByteString hash = Digests.proposalHash(proposal);
        ConsensusMessage pp = factory.prePrepare(state.view(), proposal, hash, certificate);
        log.info("PROPOSE h={} r={} hash={} justified={} on {}", state.height(), state.round(),
                Hex.shortHex(hash), certificate != null, ctx.selfId);
        multicast(pp);
        acceptProposal(pp);
    }

    private boolean awaitingCertificate() {
        return participating
                && state.name() == StateName.PRE_PREPARE
                && state.round() > 0
                && validators.isProposer(ctx.selfId, state.height(), state.round());
    }

    private void tryProposeWithCertificate() {
        List<ConsensusMessage> rcs = messages.messages(state.round(), MessageType.ROUND_CHANGE);
        if (rcs.size() < validators.quorumSize()) return;
        RoundChangeCertificate rcc = new RoundChangeCertificate(rcs);
        Optional<ConsensusMessage> highest = CertificateValidator.highestPrepared(rcs);
        if (highest.isPresent()) {
            PreparedCertificate pc = Messages.extractLatestPreparedCertificate(highest.get()).orElseThrow();
            Proposal last = Messages.extractLastPreparedProposal(highest.get()).orElseThrow();
            log.info("REPROPOSE h={} r={} value prepared in round {} on {}", state.height(), state.round(), pc.round(), ctx.selfId);
            propose(last.inRound(state.round()), rcc);
        } else {
            freshProposal().ifPresent(p -> propose(p, rcc));
        }
    }

    private void onPrePrepare(ConsensusMessage m) {
        if (m.round() > state.round()) {
            log.info("ROUND JUMP h={} r={} -> {} reason=justified proposal from {} on {}",
                    m.height(), state.round(), m.round(), m.sender(), ctx.selfId);
            startRound(m.round());
            return;
        }
        if (m.round() == state.round() && state.name() == StateName.PRE_PREPARE) {
            acceptProposal(m);
        }
    }

    private void acceptProposal(ConsensusMessage prePrepare) {
        state.acceptProposal(prePrepare);
        publishStatus();
        log.info("PP h={} r={} hash={} proposer={} on {}", state.height(), state.round(),
                Hex.shortHex(state.proposalHash()), prePrepare.sender(), ctx.selfId);
        if (!prePrepare.sender().equals(ctx.selfId)) {
            multicast(factory.prepare(state.view(), state.proposalHash()));
        }
        checkPrepareQuorum();
    }

    private void checkPrepareQuorum() {
        if (state.name() != StateName.PREPARE) return;
        ByteString hash = state.proposalHash();
        String proposer = state.proposalMessage().sender();
        List<ConsensusMessage> prepares = messages.messages(state.round(), MessageType.PREPARE,
                m -> !m.sender().equals(proposer) && Messages.extractPrepareHash(m).map(hash::equals).orElse(false));
        // the PRE_PREPARE is the proposer's vote
        if (prepares.size() + 1 < validators.quorumSize()) return;

        PreparedCertificate pc = new PreparedCertificate(state.proposalMessage(), prepares);
        state.prepared(pc);
        publishStatus();
        log.info("PREPARED h={} r={} hash={} votes={} on {}", state.height(), state.round(),
                Hex.shortHex(hash), prepares.size() + 1, ctx.selfId);
        multicast(factory.commit(state.view(), hash));
        checkCommitQuorum();
    }

    private void checkCommitQuorum() {
        if (state.name() != StateName.PREPARE && state.name() != StateName.COMMIT) return;
        ByteString hash = state.proposalHash();
        List<ConsensusMessage> commits = messages.messages(state.round(), MessageType.COMMIT,
                m -> Messages.extractCommitHash(m).map(hash::equals).orElse(false));
        if (commits.size() < validators.quorumSize()) return;
        finalizeProposal(commits);
    }

    private void finalizeProposal(List<ConsensusMessage> commits) {
        ByteString hash = state.proposalHash();
        List<CommittedSeal> seals = Messages.extractCommittedSeals(commits).orElseThrow();
        if (!ctx.signatures.verifyCommittedSeals(hash, seals, validators)) {
            log.error("REJECT commit quorum h={} r={} hash={} reason=committed seals do not verify on {}",
                    state.height(), state.round(), Hex.shortHex(hash), ctx.selfId);
            return;
        }
        timers.cancel();
        state.name(StateName.FINALIZED);
        publishStatus();
        FinalizedProposal finalized = new FinalizedProposal(state.height(), state.round(), state.proposal(), hash, seals);
        messages.clear();
        log.info("FINALIZED h={} r={} hash={} seals={} on {}", finalized.height(), finalized.round(),
                Hex.shortHex(hash), seals.size(), ctx.selfId);

        CompletableFuture<FinalizedProposal> done = sequence;
        try {
            ctx.sink.insertProposal(finalized);
        } catch (RuntimeException e) {
            log.error("SINK failed h={} hash={} on {}", finalized.height(), Hex.shortHex(hash), ctx.selfId, e);
            done.completeExceptionally(e);
            return;
        }
        done.complete(finalized);
    }

    private void onRoundChange(ConsensusMessage m) {
        if (m.round() == state.round()) {
            if (awaitingCertificate()) tryProposeWithCertificate();
        } else if (m.round() > state.round()) {
            checkRoundJump();
        }
    }

    // f+1 validators asking for a higher round include an honest one: follow the lowest such round.
    private void checkRoundJump() {
        if (!sequenceActive()) return;
        for (Map.Entry<Long, List<ConsensusMessage>> e : messages.roundsAbove(state.round(), MessageType.ROUND_CHANGE).entrySet()) {
            if (e.getValue().size() >= validators.weakQuorumSize()) {
                log.info("ROUND JUMP h={} r={} -> {} reason={} round changes on {}",
                        state.height(), state.round(), e.getKey(), e.getValue().size(), ctx.selfId);
                changeRound(e.getKey());
                return;
            }
        }
    }

    private void onRoundTimeout(View view) {
        if (!sequenceActive() || !state.view().equals(view)) {
            log.debug("IGNORE stale timeout {} current={} on {}", view, state.view(), ctx.selfId);
            return;
        }
        log.warn("TIMEOUT h={} r={} state={} on {}", view.height(), view.round(), state.name(), ctx.selfId);
        changeRound(view.round() + 1);
    }

    private void changeRound(long newRound) {
        state.name(StateName.ROUND_CHANGE);
        publishStatus();
        ConsensusMessage rc = factory.roundChange(new View(state.height(), newRound),
                state.latestPreparedCertificate(), state.latestPreparedProposal());
        log.info("ROUND_CHANGE h={} r={} -> {} prepared={} on {}", state.height(), state.round(), newRound,
                state.latestPreparedCertificate() == null ? "-" : state.latestPreparedCertificate().round(), ctx.selfId);
        multicast(rc);
        startRound(newRound);
    }

    // ---- output ----

    private void multicast(ConsensusMessage m) {
        if (!participating) return;
        Transport t = transport;
        if (t == null) {
            log.warn("SEND {} dropped: no transport on {}", m, ctx.selfId);
            return;
        }
        try {
            outbound.execute(() -> {
                try {
                    t.multicast(m);
                } catch (TransportException e) {
                    log.warn("SEND {} failed: {} on {}", m, e.getMessage(), ctx.selfId);
                } catch (RuntimeException e) {
                    log.warn("SEND {} failed on {}", m, ctx.selfId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("SEND {} dropped after shutdown on {}", m, ctx.selfId);
        }
    }

    private void publishStatus() {
        status = new ConsensusStatus(state.height(), state.round(), state.name());
    }
}
