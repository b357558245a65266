package ibft.common.validation;

import com.google.protobuf.ByteString;
import ibft.common.TestValidators;
import ibft.common.crypto.Digests;
import ibft.common.crypto.Signatures;
import ibft.common.messages.*;
import ibft.common.validation.MessageValidation.Code;
import ibft.common.validators.ValidatorSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CertificateValidatorTest {
    private final TestValidators tv = TestValidators.of(4);
    private final ValidatorSet vs = tv.at(7);
    // verification only needs public keys; any validator's instance will do
    private final Signatures sigs = tv.signatures("v0");

    @Test
    void senderMustBeKnownAndSignatureValid() {
        ConsensusMessage p = tv.prepare("v1", new View(7, 0), ByteString.copyFromUtf8("h"));
        assertThat(CertificateValidator.validateSender(p, vs, sigs).isOk()).isTrue();

        ConsensusMessage forged = p.withSignature(tv.prepare("v2", new View(7, 0), ByteString.copyFromUtf8("h")).signature());
        assertThat(CertificateValidator.validateSender(forged, vs, sigs).code()).isEqualTo(Code.BAD_SIGNATURE);

        ConsensusMessage stranger = ConsensusMessage.unsigned(new View(7, 0), "x", new PrepareData(ByteString.EMPTY));
        assertThat(CertificateValidator.validateSender(stranger, vs, sigs).code()).isEqualTo(Code.UNKNOWN_SIGNER);
    }

    @Test
    void commitSealMustCoverTheHash() {
        ByteString hash = ByteString.copyFromUtf8("h");
        ConsensusMessage commit = tv.commit("v2", new View(7, 0), hash);
        assertThat(CertificateValidator.validateCommitSeal(commit, vs, sigs).isOk()).isTrue();

        CommitData d = (CommitData) commit.payload();
        ConsensusMessage badSeal = tv.sign(ConsensusMessage.unsigned(commit.view(), "v2",
                new CommitData(ByteString.copyFromUtf8("other"), d.committedSeal())));
        MessageValidation.Result r = CertificateValidator.validateCommitSeal(badSeal, vs, sigs);
        assertThat(r.code()).isEqualTo(Code.BAD_SEAL);
        assertThat(r.isSignatureError()).isTrue();
    }

    @Test
    void proposalHashMustMatchProposalAndRound() {
        View view = new View(7, 1);
        ConsensusMessage pp = tv.prePrepare("v0", view, TestValidators.raw("b"), null);
        assertThat(CertificateValidator.validateProposalHash(pp).isOk()).isTrue();

        Proposal p = new Proposal(TestValidators.raw("b"), 1);
        ConsensusMessage wrongHash = tv.sign(ConsensusMessage.unsigned(view, "v0",
                new PrePrepareData(p, Digests.proposalHash(p.inRound(0)), null)));
        assertThat(CertificateValidator.validateProposalHash(wrongHash).code()).isEqualTo(Code.BAD_HASH);

        Proposal other = new Proposal(TestValidators.raw("b"), 0);
        ConsensusMessage wrongRound = tv.sign(ConsensusMessage.unsigned(view, "v0",
                new PrePrepareData(other, Digests.proposalHash(other), null)));
        assertThat(CertificateValidator.validateProposalHash(wrongRound).code()).isEqualTo(Code.BAD_VIEW);
    }

    @Test
    void preparedCertificateNeedsQuorumProposerAndRoundBelowLimit() {
        View view = new View(7, 2);
        PreparedCertificate pc = tv.preparedCertificate(view, TestValidators.raw("b"), 2);
        assertThat(CertificateValidator.validatePreparedCertificate(pc, vs, 3, sigs).isOk()).isTrue();
        assertThat(CertificateValidator.validatePreparedCertificate(pc, vs, 2, sigs).code()).isEqualTo(Code.BAD_CERTIFICATE);

        PreparedCertificate small = tv.preparedCertificate(view, TestValidators.raw("b"), 1);
        assertThat(CertificateValidator.validatePreparedCertificate(small, vs, 3, sigs).code()).isEqualTo(Code.BAD_CERTIFICATE);

        // PRE_PREPARE by someone other than the round's proposer
        String notProposer = vs.proposer(3);
        ConsensusMessage pp = tv.prePrepare(notProposer, view, TestValidators.raw("b"), null);
        ByteString hash = Messages.extractProposalHash(pp).orElseThrow();
        List<ConsensusMessage> prepares = new ArrayList<>();
        for (String id : tv.ids()) if (!id.equals(notProposer) && prepares.size() < 2) prepares.add(tv.prepare(id, view, hash));
        PreparedCertificate wrongProposer = new PreparedCertificate(pp, prepares);
        assertThat(CertificateValidator.validatePreparedCertificate(wrongProposer, vs, 3, sigs).code()).isEqualTo(Code.NOT_PROPOSER);
    }

    @Test
    void roundChangeMustCarryCertificateAndProposalTogether() {
        View certified = new View(7, 1);
        PreparedCertificate pc = tv.preparedCertificate(certified, TestValidators.raw("b"), 2);
        Proposal last = Messages.extractProposal(pc.proposalMessage()).orElseThrow();
        View next = new View(7, 2);

        assertThat(CertificateValidator.validateRoundChangePayload(tv.roundChange("v1", next, pc, last), vs, sigs).isOk()).isTrue();
        assertThat(CertificateValidator.validateRoundChangePayload(tv.roundChange("v1", next, null, null), vs, sigs).isOk()).isTrue();
        assertThat(CertificateValidator.validateRoundChangePayload(tv.roundChange("v1", next, pc, null), vs, sigs).code())
                .isEqualTo(Code.BAD_CERTIFICATE);

        Proposal substituted = new Proposal(TestValidators.raw("evil"), 1);
        assertThat(CertificateValidator.validateRoundChangePayload(tv.roundChange("v1", next, pc, substituted), vs, sigs).code())
                .isEqualTo(Code.BAD_HASH);

        // a certificate from the round change's own round is not "prior"
        assertThat(CertificateValidator.validateRoundChangePayload(tv.roundChange("v1", certified, pc, last), vs, sigs).isOk())
                .isFalse();
    }

    @Test
    void roundChangeCertificateNeedsQuorumOfDistinctRoundChangesForTheRound() {
        View view = new View(7, 3);
        List<ConsensusMessage> rcs = List.of(
                tv.roundChange("v0", view, null, null),
                tv.roundChange("v1", view, null, null),
                tv.roundChange("v2", view, null, null));
        assertThat(CertificateValidator.validateRoundChangeCertificate(new RoundChangeCertificate(rcs), vs, 3, sigs).isOk()).isTrue();
        assertThat(CertificateValidator.validateRoundChangeCertificate(new RoundChangeCertificate(rcs), vs, 4, sigs).code())
                .isEqualTo(Code.BAD_VIEW);
        assertThat(CertificateValidator.validateRoundChangeCertificate(new RoundChangeCertificate(rcs.subList(0, 2)), vs, 3, sigs).code())
                .isEqualTo(Code.BAD_CERTIFICATE);
        List<ConsensusMessage> dup = List.of(rcs.get(0), rcs.get(1), rcs.get(1));
        assertThat(CertificateValidator.validateRoundChangeCertificate(new RoundChangeCertificate(dup), vs, 3, sigs).code())
                .isEqualTo(Code.BAD_CERTIFICATE);
    }

    @Test
    void reproposalMustUseHighestPreparedValue() {
        View view = new View(7, 4);
        PreparedCertificate older = tv.preparedCertificate(new View(7, 1), TestValidators.raw("old"), 2);
        PreparedCertificate newer = tv.preparedCertificate(new View(7, 2), TestValidators.raw("new"), 2);
        Proposal oldValue = Messages.extractProposal(older.proposalMessage()).orElseThrow();
        Proposal newValue = Messages.extractProposal(newer.proposalMessage()).orElseThrow();
        RoundChangeCertificate rcc = new RoundChangeCertificate(List.of(
                tv.roundChange("v0", view, older, oldValue),
                tv.roundChange("v1", view, newer, newValue),
                tv.roundChange("v2", view, null, null)));

        assertThat(CertificateValidator.highestPrepared(rcc.roundChangeMessages()))
                .hasValueSatisfying(m -> assertThat(m.sender()).isEqualTo("v1"));
        assertThat(CertificateValidator.validateReproposal(new Proposal(TestValidators.raw("new"), 4), rcc).isOk()).isTrue();
        assertThat(CertificateValidator.validateReproposal(new Proposal(TestValidators.raw("old"), 4), rcc).isOk()).isFalse();
        assertThat(CertificateValidator.validateReproposal(new Proposal(TestValidators.raw("fresh"), 4), rcc).isOk()).isFalse();

        RoundChangeCertificate unprepared = new RoundChangeCertificate(List.of(tv.roundChange("v2", view, null, null)));
        assertThat(CertificateValidator.validateReproposal(new Proposal(TestValidators.raw("fresh"), 4), unprepared).isOk()).isTrue();
    }
}
