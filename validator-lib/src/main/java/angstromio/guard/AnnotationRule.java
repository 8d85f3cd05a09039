package angstromio.guard;

import java.lang.annotation.Annotation;

/**
 * Builds the predicate for one use of a {@link GuardRule} annotation. Annotation elements such as
 * bounds or patterns are read here, so each use of the annotation gets its own configured
 * predicate.
 *
 * @param <A> the rule annotation type.
 */
public interface AnnotationRule<A extends Annotation> {

    /**
     * @param annotation the annotation as declared on a method or parameter.
     * @return the predicate enforcing it.
     */
    ValuePredicate predicate(A annotation);
}
