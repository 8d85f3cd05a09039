package angstromio.guard.constraints;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import angstromio.guard.GuardRule;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * A rule which enforces that the annotated accessor or parameter receives a valid Java UUID string.
 * Validated by the {@code UUIDRule} class.
 */
@Documented
@GuardRule(validatedBy = UUIDRule.class)
@Target({METHOD, PARAMETER})
@Retention(RUNTIME)
public @interface UUID {

    /**
     * Every rule annotation must define a message element of type String. Occurrences of
     * {@code ${validatedValue}} are replaced with the rejected value.
     *
     * @return String message.
     */
    String message() default "${validatedValue} is not a valid UUID";
}
