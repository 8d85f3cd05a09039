package angstromio.guard;

import java.lang.annotation.Annotation;
import java.lang.annotation.Repeatable;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the {@link GuardRule} annotations declared on a type's methods and method parameters.
 *
 * <p>Each type is scanned at most once per {@link MetadataRegistry}, however many scanners write to
 * it. Supertypes are scanned first and on their own, so a method inherited by several subtypes is
 * registered exactly once, under its declaring type.
 * Methods are visited in signature order and the rule annotations of one element in the order
 * reflection reports them.
 */
public final class DeclarationScanner {

    private static final Logger log = LoggerFactory.getLogger(DeclarationScanner.class);

    private final AnnotationFactory annotations;
    private final Map<Class<?>, AnnotationRule<?>> rules = new ConcurrentHashMap<>();

    public DeclarationScanner(AnnotationFactory annotations) {
        this.annotations = annotations;
    }

    /**
     * Registers every rule declared on {@code type} and its supertypes. Repeated calls for the
     * same type do nothing.
     */
    public void scan(Class<?> type) {
        if (type == null || type == Object.class || !annotations.registry().claimScan(type)) {
            return;
        }
        scan(type.getSuperclass());
        for (Class<?> contract : type.getInterfaces()) {
            scan(contract);
        }

        Method[] methods = type.getDeclaredMethods();
        Arrays.sort(methods, Comparator.comparing(TargetIdentity::signatureOf));
        int registered = 0;
        for (Method method : methods) {
            if (method.isSynthetic() || Modifier.isStatic(method.getModifiers()) || Modifier.isPrivate(method.getModifiers())) {
                continue;
            }
            registered += scanMethod(method);
        }
        if (registered > 0) {
            log.info("Registered {} rule(s) declared on {}", registered, type.getName());
        }
    }

    public boolean isScanned(Class<?> type) {
        return annotations.registry().isScanned(type);
    }

    private int scanMethod(Method method) {
        int registered = 0;
        List<Annotation> accessorRules = rulesOn(method.getDeclaredAnnotations());
        if (!accessorRules.isEmpty() && method.getParameterCount() != 1) {
            throw new ValidatorDefinitionException(
                    "accessor rules " + accessorRules + " require a single-argument method but "
                            + method.toGenericString() + " takes " + method.getParameterCount());
        }
        for (Annotation rule : accessorRules) {
            toValidationAnnotation(rule).applyToAccessor(method);
            registered++;
        }

        Annotation[][] parameterAnnotations = method.getParameterAnnotations();
        for (int index = 0; index < parameterAnnotations.length; index++) {
            for (Annotation rule : rulesOn(parameterAnnotations[index])) {
                toValidationAnnotation(rule).applyToParameter(method, index);
                registered++;
            }
        }
        return registered;
    }

    private List<Annotation> rulesOn(Annotation[] declared) {
        List<Annotation> found = new ArrayList<>();
        for (Annotation annotation : declared) {
            if (isRule(annotation.annotationType())) {
                found.add(annotation);
            } else {
                found.addAll(unwrapContainer(annotation));
            }
        }
        return found;
    }

    private static boolean isRule(Class<? extends Annotation> type) {
        return type.isAnnotationPresent(GuardRule.class);
    }

    /**
     * Returns the repeated rules held by a {@link Repeatable} container, in source order, or
     * nothing when the annotation is not a container of rules.
     */
    private static List<Annotation> unwrapContainer(Annotation annotation) {
        Method value;
        try {
            value = annotation.annotationType().getDeclaredMethod("value");
        } catch (NoSuchMethodException e) {
            return List.of();
        }
        Class<?> elementType = value.getReturnType().getComponentType();
        if (elementType == null || !elementType.isAnnotation()) {
            return List.of();
        }
        Repeatable repeatable = elementType.getAnnotation(Repeatable.class);
        if (repeatable == null || repeatable.value() != annotation.annotationType() || !elementType.isAnnotationPresent(GuardRule.class)) {
            return List.of();
        }
        return Arrays.asList((Annotation[]) invokeElement(annotation, value));
    }

    private ValidationAnnotation toValidationAnnotation(Annotation annotation) {
        Class<? extends Annotation> type = annotation.annotationType();
        AnnotationRule<Annotation> rule = ruleFor(type);
        ValuePredicate predicate;
        try {
            predicate = rule.predicate(annotation);
        } catch (ValidatorDefinitionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidatorDefinitionException("rule " + rule.getClass().getName() + " failed to configure " + annotation, e);
        }
        if (predicate == null) {
            throw new ValidatorDefinitionException("rule " + rule.getClass().getName() + " returned no predicate for " + annotation);
        }
        return annotations.makeAnnotation(type.getSimpleName(), predicate, messageOf(annotation));
    }

    @SuppressWarnings("unchecked")
    private AnnotationRule<Annotation> ruleFor(Class<? extends Annotation> type) {
        Class<? extends AnnotationRule<?>> ruleClass = type.getAnnotation(GuardRule.class).validatedBy();
        return (AnnotationRule<Annotation>) rules.computeIfAbsent(ruleClass, DeclarationScanner::instantiate);
    }

    private static AnnotationRule<?> instantiate(Class<?> ruleClass) {
        try {
            Constructor<?> constructor = ruleClass.getDeclaredConstructor();
            constructor.trySetAccessible();
            return (AnnotationRule<?>) constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new ValidatorDefinitionException("rule " + ruleClass.getName() + " failed to initialize", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ValidatorDefinitionException("rule " + ruleClass.getName() + " needs an accessible no-argument constructor", e);
        }
    }

    private static String messageOf(Annotation annotation) {
        Method message;
        try {
            message = annotation.annotationType().getDeclaredMethod("message");
        } catch (NoSuchMethodException e) {
            throw new ValidatorDefinitionException(
                    "rule annotation @" + annotation.annotationType().getName() + " must declare a String message() element", e);
        }
        if (message.getReturnType() != String.class) {
            throw new ValidatorDefinitionException(
                    "message() of @" + annotation.annotationType().getName() + " must return String");
        }
        return (String) invokeElement(annotation, message);
    }

    private static Object invokeElement(Annotation annotation, Method element) {
        try {
            element.trySetAccessible();
            return element.invoke(annotation);
        } catch (InvocationTargetException e) {
            throw new ValidatorDefinitionException("cannot read " + element.getName() + "() of " + annotation, e.getCause());
        } catch (IllegalAccessException e) {
            throw new ValidatorDefinitionException("cannot read " + element.getName() + "() of " + annotation, e);
        }
    }
}
