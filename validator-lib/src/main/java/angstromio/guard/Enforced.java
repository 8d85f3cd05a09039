package angstromio.guard;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Activates rule checking on a method, or on every method of a type, of an interface guarded with
 * {@link Enforcer#guard(Class, Object)}. Rule annotations on a member that is not enforced are
 * registered but never checked.
 */
@Documented
@Target({TYPE, METHOD})
@Retention(RUNTIME)
public @interface Enforced {
}
