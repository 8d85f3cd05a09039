package angstromio.guard;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.ANNOTATION_TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks an annotation type as a validation rule. Placing such an annotation on a method of a type
 * passed to {@link DeclarationScanner#scan(Class)} attaches the rule to the method's accessor
 * identity; placing it on a parameter attaches it to that parameter.
 *
 * <p>The annotated annotation type must declare a {@code String message()} element, which becomes
 * the failure message template. It may be {@link java.lang.annotation.Repeatable}; repeated uses
 * are attached in source order.
 *
 * <pre>{@code
 * @Documented
 * @GuardRule(validatedBy = PositiveRule.class)
 * @Target({METHOD, PARAMETER})
 * @Retention(RUNTIME)
 * public @interface Positive {
 *     String message() default "${validatedValue} is not positive";
 * }
 * }</pre>
 */
@Documented
@Target({ANNOTATION_TYPE})
@Retention(RUNTIME)
public @interface GuardRule {

    /**
     * The rule implementation, instantiated once per scanner through its no-argument constructor.
     *
     * @return rule class.
     */
    Class<? extends AnnotationRule<?>> validatedBy();
}
