package angstromio.guard;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.annotation.Annotation;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.lang.reflect.Method;
import java.util.List;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeclarationScannerTest {

    public static class AcceptAll implements AnnotationRule<Annotation> {
        @Override
        public ValuePredicate predicate(Annotation annotation) {
            return value -> true;
        }
    }

    @GuardRule(validatedBy = AcceptAll.class)
    @Target({METHOD, PARAMETER})
    @Retention(RUNTIME)
    public @interface Silent {
    }

    public interface Garage {
        void park(@ValidSettings Object settings, @Silent Object other);
    }

    public interface Workshop {
        @ValidSettings
        void tune(Object settings, Object tool);
    }

    public interface SportsVehicle extends Vehicle {
    }

    private MetadataRegistry registry;
    private DeclarationScanner scanner;

    @BeforeEach
    public void setUp() {
        registry = new MetadataRegistry();
        scanner = new DeclarationScanner(new AnnotationFactory(registry));
    }

    @Test
    public void testRegistersAccessorAndParameterRules() throws NoSuchMethodException {
        scanner.scan(Vehicle.class);

        Method setSettings = Vehicle.class.getMethod("setSettings", Object.class);
        List<ValidatorEntry> parameterRules = registry.lookup(TargetIdentity.parameter(setSettings, 0));
        assertEquals(1, parameterRules.size());
        assertEquals("ValidSettings", parameterRules.get(0).ruleName());
        assertEquals("${validatedValue} is not a valid settings object", parameterRules.get(0).messageTemplate());
        assertTrue(registry.lookup(TargetIdentity.accessor(setSettings)).isEmpty());

        Method setLimited = Vehicle.class.getMethod("setLimitedSettings", Object.class);
        List<ValidatorEntry> accessorRules = registry.lookup(TargetIdentity.accessor(setLimited));
        assertEquals(List.of("ValidSettings", "SpeedRange"), accessorRules.stream().map(ValidatorEntry::ruleName).toList());
    }

    @Test
    public void testRepeatedRulesKeepSourceOrder() throws NoSuchMethodException {
        scanner.scan(Vehicle.class);

        Method describe = Vehicle.class.getMethod("describe", String.class, Object.class);
        List<ValidatorEntry> rules = registry.lookup(TargetIdentity.parameter(describe, 1));

        assertEquals(2, rules.size());
        assertTrue(rules.get(0).predicate().test(Settings.of(true, 2)));
        assertFalse(rules.get(1).predicate().test(Settings.of(true, 2)));
        assertTrue(registry.lookup(TargetIdentity.parameter(describe, 0)).isEmpty());
    }

    @Test
    public void testScanningTwiceRegistersOnce() throws NoSuchMethodException {
        scanner.scan(Vehicle.class);
        scanner.scan(Vehicle.class);
        scanner.scan(SportsVehicle.class);

        Method setSettings = Vehicle.class.getMethod("setSettings", Object.class);
        assertEquals(1, registry.lookup(TargetIdentity.parameter(setSettings, 0)).size());
        assertTrue(scanner.isScanned(SportsVehicle.class));
        assertTrue(scanner.isScanned(Vehicle.class));
    }

    @Test
    public void testRuleWithoutMessageIsRejected() {
        ValidatorDefinitionException e = assertThrows(ValidatorDefinitionException.class, () -> scanner.scan(Garage.class));
        assertTrue(e.getMessage().contains("message()"));
    }

    @Test
    public void testAccessorRuleNeedsSingleArgument() {
        ValidatorDefinitionException e = assertThrows(ValidatorDefinitionException.class, () -> scanner.scan(Workshop.class));
        assertTrue(e.getMessage().contains("tune"));
    }

    // Rule annotations must stay visible to reflection on interface methods and parameters
    @Test
    public void testAnnotationsAreVisible() throws NoSuchMethodException {
        Method describe = Vehicle.class.getMethod("describe", String.class, Object.class);
        Annotation[] onSettings = describe.getParameterAnnotations()[1];

        assertEquals(1, onSettings.length);
        assertEquals(SpeedRange.List.class, onSettings[0].annotationType());
        assertEquals(new SpeedRangeImpl(1, 10), ((SpeedRange.List) onSettings[0]).value()[0]);
    }
}
