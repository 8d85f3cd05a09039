package angstromio.guard.constraints;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

import angstromio.guard.ValidatorDefinitionException;
import angstromio.guard.ValuePredicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PredicatesTest {

    @Test
    public void testTypeChecks() {
        assertTrue(Predicates.isBoolean().test(false));
        assertFalse(Predicates.isBoolean().test("true"));
        assertTrue(Predicates.isNumber().test(1.5f));
        assertFalse(Predicates.isNumber().test("1000"));
        assertTrue(Predicates.isString().test(""));
        assertFalse(Predicates.isString().test(null));
        assertTrue(Predicates.notNull().test(0));
        assertFalse(Predicates.notNull().test(null));
        assertEquals(Number.class, Predicates.isNumber().guardedType());
    }

    @Test
    public void testNotBlank() {
        ValuePredicate notBlank = Predicates.notBlank();

        assertTrue(notBlank.test(" a "));
        assertTrue(notBlank.test(new StringBuilder("b")));
        assertFalse(notBlank.test(" \t"));
        assertFalse(notBlank.test(null));
        assertFalse(notBlank.test(42));
    }

    @Test
    public void testNumericBounds() {
        ValuePredicate percent = Predicates.inRange(new RangeConfig(0, 100));

        assertTrue(percent.test(0));
        assertTrue(percent.test(100L));
        assertTrue(percent.test(50.5));
        assertFalse(percent.test(150));
        assertFalse(percent.test(-0.1));
        assertFalse(percent.test(Double.NaN));
        assertFalse(percent.test("50"));

        assertTrue(Predicates.nonNegative().test(0));
        assertTrue(Predicates.nonNegative().test(Long.MAX_VALUE));
        assertFalse(Predicates.nonNegative().test(-2000));
    }

    @Test
    public void testPatterns() {
        ValuePredicate digits = Predicates.matches(Pattern.compile("\\d+"));

        assertTrue(digits.test("123"));
        assertFalse(digits.test("12a"));
        assertFalse(digits.test(123));

        assertTrue(Predicates.isUUID().test("123e4567-e89b-12d3-a456-426614174000"));
        assertTrue(Predicates.isUUID().test(java.util.UUID.randomUUID().toString()));
        assertFalse(Predicates.isUUID().test("123e4567-e89b-12d3-a456"));
        assertFalse(Predicates.isUUID().test("123e4567-e89b-12d3-a456-426614174000\n"));
        assertFalse(Predicates.isUUID().test(java.util.UUID.randomUUID()));
    }

    @Test
    public void testCountryCodes() {
        ValuePredicate countryCode = Predicates.isCountryCode();

        assertTrue(countryCode.test("CA"));
        assertTrue(countryCode.test("fr"));
        assertFalse(countryCode.test("XX"));
        assertFalse(countryCode.test("CAN"));
        assertTrue(countryCode.test(List.of("US", "MX")));
        assertTrue(countryCode.test(new String[]{"DE", "JP"}));
        assertFalse(countryCode.test(List.of("US", "ZZ")));
        assertFalse(countryCode.test(Arrays.asList("US", null)));
        assertFalse(countryCode.test(List.of()));
        assertFalse(countryCode.test(null));
    }

    @Test
    public void testFieldRules() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("flag1", true);
        settings.put("speed", 1000);

        Map<String, ValuePredicate> fields = new LinkedHashMap<>();
        fields.put("flag1", Predicates.isBoolean());
        fields.put("speed", Predicates.isNumber());
        ValuePredicate isSettings = Predicates.hasFields(fields);

        assertTrue(isSettings.test(settings));
        assertFalse(isSettings.test(Map.of("flag1", true)));
        assertFalse(isSettings.test("Fooo"));
        assertTrue(Predicates.field("speed", Predicates.nonNegative()).test(settings));
        assertFalse(Predicates.field("speed", Predicates.nonNegative()).test(List.of(1000)));
    }

    @Test
    public void testMapsWithForeignKeysAreRejected() {
        TreeMap<Integer, Object> byIndex = new TreeMap<>();
        byIndex.put(1, true);

        assertFalse(Predicates.hasFields(Map.of("flag1", Predicates.isBoolean())).test(byIndex));
        assertFalse(Predicates.field("flag1", Predicates.notNull()).test(byIndex));
    }

    @Test
    public void testAllOfStopsAtFirstRejection() {
        ValuePredicate explodes = value -> {
            throw new AssertionError("evaluated after a rejection");
        };

        assertFalse(Predicates.allOf(Predicates.isNumber(), explodes).test("x"));
        assertTrue(Predicates.allOf(Predicates.isNumber(), Predicates.nonNegative()).test(3));
    }

    @Test
    public void testDefinitionErrors() {
        assertThrows(ValidatorDefinitionException.class, () -> Predicates.inRange(null));
        assertThrows(ValidatorDefinitionException.class, () -> Predicates.matches(null));
        assertThrows(ValidatorDefinitionException.class, () -> Predicates.field(null, Predicates.notNull()));
        assertThrows(ValidatorDefinitionException.class, () -> Predicates.hasFields(Map.of()));
        assertThrows(ValidatorDefinitionException.class, () -> Predicates.allOf());
        assertThrows(ValidatorDefinitionException.class, () -> Predicates.allOf(Predicates.notNull(), null));
        assertThrows(ValidatorDefinitionException.class, () -> new RangeConfig(10, 0));
        assertThrows(ValidatorDefinitionException.class, () -> new RangeConfig(Double.NaN, 0));
    }
}
