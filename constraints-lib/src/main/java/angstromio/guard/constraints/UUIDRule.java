package angstromio.guard.constraints;

import angstromio.guard.AnnotationRule;
import angstromio.guard.ValuePredicate;

/**
 * Checks {@link UUID}-annotated values with {@link Predicates#isUUID()}.
 */
public class UUIDRule implements AnnotationRule<UUID> {

    @Override
    public ValuePredicate predicate(UUID annotation) {
        return Predicates.isUUID();
    }
}
