package angstromio.guard.constraints;

import angstromio.guard.AnnotationRule;
import angstromio.guard.ValuePredicate;

public class NonNegativeRule implements AnnotationRule<NonNegative> {

    @Override
    public ValuePredicate predicate(NonNegative annotation) {
        return Predicates.nonNegative();
    }
}
