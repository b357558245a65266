package ibft.common.validation;

import com.google.protobuf.ByteString;
import ibft.common.crypto.Digests;
import ibft.common.crypto.MessageSigning;
import ibft.common.crypto.Signatures;
import ibft.common.messages.*;
import ibft.common.validation.MessageValidation.Code;
import ibft.common.validation.MessageValidation.Result;
import ibft.common.validators.ValidatorSet;

import java.security.PublicKey;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public final class CertificateValidator {
    private CertificateValidator() {}

    public static Result validateSender(ConsensusMessage message, ValidatorSet validators, Signatures signatures) {
        Optional<PublicKey> pk = validators.publicKey(message.sender());
        if (pk.isEmpty()) {
            return Result.fail(Code.UNKNOWN_SIGNER, "not a validator at height " + validators.height() + ": " + message.sender());
        }
        if (!MessageSigning.verify(message, pk.get(), signatures)) {
            return Result.fail(Code.BAD_SIGNATURE, "signature mismatch for " + message.sender());
        }
        return Result.ok();
    }

    public static Result validateCommitSeal(ConsensusMessage commit, ValidatorSet validators, Signatures signatures) {
        Optional<PublicKey> pk = validators.publicKey(commit.sender());
        if (pk.isEmpty()) return Result.fail(Code.UNKNOWN_SIGNER, "not a validator: " + commit.sender());
        if (!MessageSigning.verifySeal(commit, pk.get(), signatures)) {
            return Result.fail(Code.BAD_SEAL, "committed seal mismatch for " + commit.sender());
        }
        return Result.ok();
    }

    // The proposal hash of a PRE_PREPARE must be the digest of its proposal, and the proposal
    // must be made for the message's own round.
    public static Result validateProposalHash(ConsensusMessage prePrepare) {
        if (!(prePrepare.payload() instanceof PrePrepareData d)) {
            return Result.fail(Code.BAD_CERTIFICATE, "not a PRE_PREPARE: " + prePrepare.type());
        }
        if (d.proposal().round() != prePrepare.round()) {
            return Result.fail(Code.BAD_VIEW, "proposal round " + d.proposal().round() + " in round " + prePrepare.round());
        }
        if (!Digests.proposalHash(d.proposal()).equals(d.proposalHash())) {
            return Result.fail(Code.BAD_HASH, "proposal hash does not match proposal");
        }
        return Result.ok();
    }

    public static Result validatePreparedCertificate(PreparedCertificate pc, ValidatorSet validators,
                                                     long roundLimit, Signatures signatures) {
        ConsensusMessage pp = pc.proposalMessage();
        if (pp.type() != MessageType.PRE_PREPARE) {
            return Result.fail(Code.BAD_CERTIFICATE, "prepared certificate proposal is " + pp.type());
        }
        for (ConsensusMessage p : pc.prepareMessages()) {
            if (p.type() != MessageType.PREPARE) {
                return Result.fail(Code.BAD_CERTIFICATE, "prepared certificate member is " + p.type());
            }
        }
        List<ConsensusMessage> all = pc.allMessages();
        if (!Messages.validatePreparedCertificateSet(all, validators.height(), roundLimit)) {
            return Result.fail(Code.BAD_CERTIFICATE, "inconsistent prepared certificate below round " + roundLimit);
        }
        if (all.size() < validators.quorumSize()) {
            return Result.fail(Code.BAD_CERTIFICATE, "insufficient prepares: " + all.size() + " < " + validators.quorumSize());
        }
        if (!validators.isProposer(pp.sender(), pp.height(), pp.round())) {
            return Result.fail(Code.NOT_PROPOSER, pp.sender() + " is not proposer of " + pp.view());
        }
        Result hash = validateProposalHash(pp);
        if (!hash.isOk()) return hash;
        for (ConsensusMessage m : all) {
            Result r = validateSender(m, validators, signatures);
            if (!r.isOk()) return Result.fail(r.code(), "in prepared certificate: " + r.reason());
        }
        return Result.ok();
    }

    public static Result validateRoundChangePayload(ConsensusMessage roundChange, ValidatorSet validators,
                                                    Signatures signatures) {
        Optional<PreparedCertificate> pc = Messages.extractLatestPreparedCertificate(roundChange);
        Optional<Proposal> last = Messages.extractLastPreparedProposal(roundChange);
        if (pc.isEmpty() && last.isEmpty()) return Result.ok();
        if (pc.isEmpty() || last.isEmpty()) {
            return Result.fail(Code.BAD_CERTIFICATE, "prepared certificate and proposal must come together");
        }
        Result r = validatePreparedCertificate(pc.get(), validators, roundChange.round(), signatures);
        if (!r.isOk()) return r;
        ByteString certified = Messages.extractProposalHash(pc.get().proposalMessage()).orElseThrow();
        if (!Digests.proposalHash(last.get()).equals(certified)) {
            return Result.fail(Code.BAD_HASH, "last prepared proposal does not match its certificate");
        }
        return Result.ok();
    }

    public static Result validateRoundChangeCertificate(RoundChangeCertificate rcc, ValidatorSet validators,
                                                        long round, Signatures signatures) {
        List<ConsensusMessage> msgs = rcc.roundChangeMessages();
        if (!Messages.hasUniqueSenders(msgs)) {
            return Result.fail(Code.BAD_CERTIFICATE, "round change certificate empty or with duplicate senders");
        }
        if (msgs.size() < validators.quorumSize()) {
            return Result.fail(Code.BAD_CERTIFICATE, "insufficient round changes: " + msgs.size() + " < " + validators.quorumSize());
        }
        for (ConsensusMessage m : msgs) {
            if (m.type() != MessageType.ROUND_CHANGE) {
                return Result.fail(Code.BAD_CERTIFICATE, "round change certificate member is " + m.type());
            }
            if (m.height() != validators.height() || m.round() != round) {
                return Result.fail(Code.BAD_VIEW, "round change for " + m.view() + " in certificate for round " + round);
            }
            Result r = validateSender(m, validators, signatures);
            if (!r.isOk()) return Result.fail(r.code(), "in round change certificate: " + r.reason());
            r = validateRoundChangePayload(m, validators, signatures);
            if (!r.isOk()) return r;
        }
        return Result.ok();
    }

    public static Optional<ConsensusMessage> highestPrepared(Collection<ConsensusMessage> roundChanges) {
        ConsensusMessage best = null;
        long bestRound = -1;
        for (ConsensusMessage m : roundChanges) {
            Optional<PreparedCertificate> pc = Messages.extractLatestPreparedCertificate(m);
            if (pc.isPresent() && pc.get().round() > bestRound) {
                bestRound = pc.get().round();
                best = m;
            }
        }
        return Optional.ofNullable(best);
    }

    // A proposal made in a round above zero must re-propose the highest prepared value of its
    // justification, if the justification has one.
    public static Result validateReproposal(Proposal proposal, RoundChangeCertificate rcc) {
        Optional<ConsensusMessage> highest = highestPrepared(rcc.roundChangeMessages());
        if (highest.isEmpty()) return Result.ok();
        PreparedCertificate pc = Messages.extractLatestPreparedCertificate(highest.get()).orElseThrow();
        ByteString certified = Messages.extractProposalHash(pc.proposalMessage()).orElseThrow();
        ByteString candidate = Digests.proposalHash(proposal.inRound(pc.round()));
        if (!candidate.equals(certified)) {
            return Result.fail(Code.BAD_CERTIFICATE, "proposal differs from value prepared in round " + pc.round());
        }
        return Result.ok();
    }
}
