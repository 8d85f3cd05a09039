package angstromio.guard.constraints;

import java.lang.annotation.Documented;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import angstromio.guard.GuardRule;
import angstromio.guard.constraints.Range.List;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Requires a number within the inclusive bounds {@code [min, max]}. An omitted bound leaves that
 * side open.
 * Validated by the {@code RangeRule} class.
 */
@Documented
@GuardRule(validatedBy = RangeRule.class)
@Target({METHOD, PARAMETER})
@Retention(RUNTIME)
@Repeatable(List.class)
public @interface Range {

    /**
     * Every rule annotation must define a message element of type String. Occurrences of
     * {@code ${validatedValue}} are replaced with the rejected value.
     *
     * @return String message.
     */
    String message() default "${validatedValue} is out of range";

    /**
     * @return lowest accepted value.
     */
    double min() default Double.NEGATIVE_INFINITY;

    /**
     * @return highest accepted value.
     */
    double max() default Double.POSITIVE_INFINITY;

    /**
     * Defines several {@code @Range} annotations on the same element.
     */
    @Target({METHOD, PARAMETER})
    @Retention(RUNTIME)
    @Documented
    public @interface List {
        /**
         * @return Array of {@code Range} values.
         */
        Range[] value();
    }
}
