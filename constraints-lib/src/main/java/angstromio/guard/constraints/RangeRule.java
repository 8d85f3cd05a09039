package angstromio.guard.constraints;

import angstromio.guard.AnnotationRule;
import angstromio.guard.ValuePredicate;

/**
 * Builds one {@link Predicates#inRange(RangeConfig)} rule per {@link Range} use, so differently
 * bounded uses never share bounds.
 */
public class RangeRule implements AnnotationRule<Range> {

    @Override
    public ValuePredicate predicate(Range annotation) {
        return Predicates.inRange(new RangeConfig(annotation.min(), annotation.max()));
    }
}
