package angstromio.guard;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Identifies one accessor or one method parameter of a declaring type. Two identities built from
 * the same member are equal, so registration and enforcement meet on the same rule list.
 *
 * <p>Members built from a {@link Method} are named by their signature, e.g.
 * {@code setSpeed(java.lang.Object)}, which keeps overloads apart.
 *
 * @param owner          the declaring type.
 * @param member         accessor name or method signature.
 * @param kind           accessor write or method parameter.
 * @param parameterIndex zero-based argument position, {@code -1} for accessors.
 */
public record TargetIdentity(Class<?> owner, String member, Kind kind, int parameterIndex) {

    public enum Kind {
        ACCESSOR,
        PARAMETER
    }

    public TargetIdentity {
        if (owner == null) {
            throw new ValidatorDefinitionException("target identity requires an owning type");
        }
        if (member == null || member.isBlank()) {
            throw new ValidatorDefinitionException("target identity requires a member name on " + owner.getName());
        }
        if (kind == null) {
            throw new ValidatorDefinitionException("target identity requires a kind for " + owner.getName() + "." + member);
        }
        if (kind == Kind.ACCESSOR && parameterIndex != -1) {
            throw new ValidatorDefinitionException("accessor " + owner.getName() + "." + member + " cannot carry a parameter index");
        }
        if (kind == Kind.PARAMETER && parameterIndex < 0) {
            throw new ValidatorDefinitionException(
                    "parameter index must be non-negative for " + owner.getName() + "." + member + " (was " + parameterIndex + ")");
        }
    }

    public static TargetIdentity accessor(Class<?> owner, String name) {
        return new TargetIdentity(owner, name, Kind.ACCESSOR, -1);
    }

    public static TargetIdentity accessor(Method method) {
        requireMethod(method);
        return accessor(method.getDeclaringClass(), signatureOf(method));
    }

    public static TargetIdentity parameter(Class<?> owner, String member, int index) {
        return new TargetIdentity(owner, member, Kind.PARAMETER, index);
    }

    public static TargetIdentity parameter(Method method, int index) {
        requireMethod(method);
        if (index >= method.getParameterCount()) {
            throw new ValidatorDefinitionException(
                    "parameter index " + index + " out of range for " + method.toGenericString());
        }
        return parameter(method.getDeclaringClass(), signatureOf(method), index);
    }

    private static void requireMethod(Method method) {
        if (method == null) {
            throw new ValidatorDefinitionException("cannot resolve a target identity without a method");
        }
    }

    static String signatureOf(Method method) {
        return method.getName() + Arrays.stream(method.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    public String toString() {
        String base = owner.getSimpleName() + "." + member;
        return kind == Kind.ACCESSOR ? base : base + "[" + parameterIndex + "]";
    }
}
