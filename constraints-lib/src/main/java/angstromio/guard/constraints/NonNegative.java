package angstromio.guard.constraints;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import angstromio.guard.GuardRule;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Requires a number greater than or equal to zero.
 * Validated by the {@code NonNegativeRule} class.
 */
@Documented
@GuardRule(validatedBy = NonNegativeRule.class)
@Target({METHOD, PARAMETER})
@Retention(RUNTIME)
public @interface NonNegative {

    /** failure message */
    String message() default "${validatedValue} must not be negative";
}
