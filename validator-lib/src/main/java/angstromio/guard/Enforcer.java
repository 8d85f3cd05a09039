package angstromio.guard;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

import angstromio.guard.EnforcementWrapper.MethodTargets;

/**
 * Entry point tying registration and enforcement to one {@link MetadataRegistry}.
 *
 * <p>{@link #guard(Class, Object)} scans an interface for rule annotations and returns a proxy that
 * checks the arguments of its {@link Enforced} methods before delegating. The {@code wrap} and
 * {@link #accessor(TargetIdentity, Object)} variants guard plain functions and values under an
 * explicit {@link TargetIdentity}, for rules attached with {@link AnnotationFactory}.
 *
 * <pre>{@code
 * Enforcer enforcer = new Enforcer(MetadataRegistry.shared());
 * Vehicle vehicle = enforcer.guard(Vehicle.class, new DefaultVehicle());
 * vehicle.setSettings(settings); // throws ConstraintViolatedException when a rule rejects settings
 * }</pre>
 */
public final class Enforcer {

    private final MetadataRegistry registry;
    private final AnnotationFactory annotations;
    private final DeclarationScanner scanner;
    private final EnforcementWrapper wrapper;

    public Enforcer(MetadataRegistry registry) {
        this(registry, RenderLimits.DEFAULT);
    }

    public Enforcer(MetadataRegistry registry, RenderLimits limits) {
        this.registry = registry;
        this.annotations = new AnnotationFactory(registry);
        this.scanner = new DeclarationScanner(annotations);
        this.wrapper = new EnforcementWrapper(registry, limits);
    }

    /**
     * Registers the rules declared on {@code contract} and returns a checking proxy for
     * {@code target}.
     *
     * @param contract interface whose methods carry rule annotations.
     * @param target   implementation receiving the calls that pass.
     * @param <T>      the contract type.
     * @return a proxy implementing only {@code contract}.
     */
    public <T> T guard(Class<T> contract, T target) {
        if (contract == null || !contract.isInterface()) {
            throw new ValidatorDefinitionException("only interfaces can be guarded (was " + contract + ")");
        }
        if (target == null) {
            throw new ValidatorDefinitionException("cannot guard a missing " + contract.getName() + " implementation");
        }
        scanner.scan(contract);
        Object proxy = Proxy.newProxyInstance(contract.getClassLoader(),
                new Class<?>[]{contract},
                new EnforcingInvocationHandler(contract, target, wrapper));
        return contract.cast(proxy);
    }

    /**
     * Checks each value against {@code target}'s rules before passing it to {@code body}.
     */
    public <T> Consumer<T> wrap(TargetIdentity target, Consumer<T> body) {
        return value -> {
            wrapper.check(target, value);
            body.accept(value);
        };
    }

    /**
     * Checks each argument against {@code target}'s rules before applying {@code body}.
     */
    public <T, R> Function<T, R> wrap(TargetIdentity target, Function<T, R> body) {
        return value -> {
            wrapper.check(target, value);
            return body.apply(value);
        };
    }

    /**
     * @param target  accessor identity whose rules guard writes.
     * @param initial starting value, not checked.
     */
    public <T> GuardedAccessor<T> accessor(TargetIdentity target, T initial) {
        if (target == null || target.kind() != TargetIdentity.Kind.ACCESSOR) {
            throw new ValidatorDefinitionException("guarded accessors need an accessor identity (was " + target + ")");
        }
        return new GuardedAccessor<>(target, wrapper, initial);
    }

    public MetadataRegistry registry() {
        return registry;
    }

    public AnnotationFactory annotations() {
        return annotations;
    }

    public DeclarationScanner scanner() {
        return scanner;
    }

    public EnforcementWrapper wrapper() {
        return wrapper;
    }

    private record EnforcingInvocationHandler(Class<?> contract,
                                              Object delegate,
                                              EnforcementWrapper wrapper,
                                              Map<Method, MethodTargets> targets) implements InvocationHandler {

        EnforcingInvocationHandler(Class<?> contract, Object delegate, EnforcementWrapper wrapper) {
            this(contract, delegate, wrapper, new ConcurrentHashMap<>());
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (!isObjectMethod(method) && isEnforced(method)) {
                wrapper.checkArguments(targets.computeIfAbsent(method, MethodTargets::of), args);
            }
            try {
                return method.invoke(delegate, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }

        private boolean isEnforced(Method method) {
            return method.isAnnotationPresent(Enforced.class)
                    || method.getDeclaringClass().isAnnotationPresent(Enforced.class)
                    || contract.isAnnotationPresent(Enforced.class);
        }

        private boolean isObjectMethod(Method method) {
            return method.getDeclaringClass() == Object.class;
        }
    }
}
