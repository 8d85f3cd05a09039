package angstromio.guard;

import java.lang.reflect.Method;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the rules registered for a target against an incoming value.
 *
 * <p>Rules run in registration order and checking stops at the first rule that rejects the value,
 * which is reported as a {@link ConstraintViolatedException} carrying the rendered message. Later
 * rules for the same target are not evaluated. A target with no rules accepts every value. The
 * value is never copied or converted, and nothing is remembered between calls.
 */
public final class EnforcementWrapper {

    private static final Logger log = LoggerFactory.getLogger(EnforcementWrapper.class);

    private final MetadataRegistry registry;
    private final ValueRenderer renderer;

    public EnforcementWrapper(MetadataRegistry registry) {
        this(registry, RenderLimits.DEFAULT);
    }

    public EnforcementWrapper(MetadataRegistry registry, RenderLimits limits) {
        if (registry == null) {
            throw new ValidatorDefinitionException("enforcement requires a registry");
        }
        this.registry = registry;
        this.renderer = new ValueRenderer(limits);
    }

    /**
     * Checks one value against the target's rules.
     *
     * @param target accessor or parameter receiving the value.
     * @param value  the value as passed by the caller.
     * @throws ConstraintViolatedException when a rule rejects the value.
     * @throws ValidatorDefinitionException when a rule throws instead of answering.
     */
    public void check(TargetIdentity target, Object value) {
        List<ValidatorEntry> entries = registry.lookup(target);
        for (ValidatorEntry entry : entries) {
            if (!accepts(target, entry, value)) {
                String message = MessageTemplate.render(entry.messageTemplate(), value, renderer);
                log.debug("Rule '{}' rejected value for {}: {}", entry.ruleName(), target, message);
                throw new ConstraintViolatedException(message, target, entry.ruleName(), value);
            }
        }
    }

    /**
     * Checks a call's arguments: accessor rules against the only argument of a single-argument
     * method, then parameter rules left to right.
     */
    public void checkArguments(Method method, Object[] args) {
        checkArguments(MethodTargets.of(method), args);
    }

    void checkArguments(MethodTargets targets, Object[] args) {
        int count = args == null ? 0 : args.length;
        if (targets.accessor() != null && count == 1) {
            check(targets.accessor(), args[0]);
        }
        for (int index = 0; index < count && index < targets.parameters().size(); index++) {
            check(targets.parameters().get(index), args[index]);
        }
    }

    private static boolean accepts(TargetIdentity target, ValidatorEntry entry, Object value) {
        try {
            return entry.predicate().test(value);
        } catch (ValidatorDefinitionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidatorDefinitionException(
                    "rule '" + entry.ruleName() + "' on " + target + " threw " + e.getClass().getName() + " instead of answering", e);
        }
    }

    /**
     * The identities a method's arguments are checked under, resolved once per method.
     */
    record MethodTargets(TargetIdentity accessor, List<TargetIdentity> parameters) {

        static MethodTargets of(Method method) {
            TargetIdentity accessor = method.getParameterCount() == 1 ? TargetIdentity.accessor(method) : null;
            TargetIdentity[] parameters = new TargetIdentity[method.getParameterCount()];
            for (int index = 0; index < parameters.length; index++) {
                parameters[index] = TargetIdentity.parameter(method, index);
            }
            return new MethodTargets(accessor, List.of(parameters));
        }
    }
}
