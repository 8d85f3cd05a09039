package angstromio.guard.constraints;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import angstromio.guard.GuardRule;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Requires a character sequence containing at least one non-whitespace character.
 * Validated by the {@code NotBlankRule} class.
 */
@Documented
@GuardRule(validatedBy = NotBlankRule.class)
@Target({METHOD, PARAMETER})
@Retention(RUNTIME)
public @interface NotBlank {

    /** failure message */
    String message() default "${validatedValue} must not be blank";
}
