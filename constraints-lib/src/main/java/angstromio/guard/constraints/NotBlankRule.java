package angstromio.guard.constraints;

import angstromio.guard.AnnotationRule;
import angstromio.guard.ValuePredicate;

public class NotBlankRule implements AnnotationRule<NotBlank> {

    @Override
    public ValuePredicate predicate(NotBlank annotation) {
        return Predicates.notBlank();
    }
}
