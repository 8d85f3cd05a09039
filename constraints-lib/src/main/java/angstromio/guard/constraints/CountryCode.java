package angstromio.guard.constraints;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import angstromio.guard.GuardRule;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Defines a rule which enforces that the annotated accessor or parameter receives a valid ISO-3166
 * country code, or a non-empty collection or array of them.
 * Validated by the {@code ISO3166CountryCodeRule} class.
 */
@Documented
@GuardRule(validatedBy = ISO3166CountryCodeRule.class)
@Target({METHOD, PARAMETER})
@Retention(RUNTIME)
public @interface CountryCode {

    /**
     * Every rule annotation must define a message element of type String. Occurrences of
     * {@code ${validatedValue}} are replaced with the rejected value.
     *
     * @return String message.
     */
    String message() default "${validatedValue} is not a valid ISO 3166 country code";
}
