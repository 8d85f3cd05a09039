package angstromio.guard;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One rule attached to one target: the predicate to run, the template its failure message is
 * rendered from, and the argument position it applies to when the target is a parameter.
 *
 * @param predicate       the rule.
 * @param messageTemplate failure message, may contain {@link MessageTemplate#MARKER}.
 * @param parameterIndex  argument position for parameter rules, empty for accessor rules.
 * @param ruleName        short name used in diagnostics.
 */
public record ValidatorEntry(ValuePredicate predicate,
                             String messageTemplate,
                             OptionalInt parameterIndex,
                             String ruleName) {

    public ValidatorEntry {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(messageTemplate, "messageTemplate");
        Objects.requireNonNull(parameterIndex, "parameterIndex");
        if (ruleName == null || ruleName.isBlank()) {
            ruleName = predicate.toString();
        }
    }

    static ValidatorEntry forTarget(TargetIdentity target, ValuePredicate predicate, String messageTemplate, String ruleName) {
        OptionalInt index = target.kind() == TargetIdentity.Kind.PARAMETER
                ? OptionalInt.of(target.parameterIndex())
                : OptionalInt.empty();
        return new ValidatorEntry(predicate, messageTemplate, index, ruleName);
    }
}
