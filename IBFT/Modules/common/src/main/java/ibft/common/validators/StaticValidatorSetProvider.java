package ibft.common.validators;

import java.util.List;

public final class StaticValidatorSetProvider implements ValidatorSetProvider {
    private final ValidatorSet template;

    public StaticValidatorSetProvider(List<Validator> validators, ProposerSchedule schedule) {
        this.template = new ValidatorSet(0, validators, schedule);
    }

    public StaticValidatorSetProvider(List<Validator> validators) {
        this(validators, ProposerSchedule.roundRobin());
    }

    @Override
    public ValidatorSet forHeight(long height) {
        return template.atHeight(height);
    }
}
