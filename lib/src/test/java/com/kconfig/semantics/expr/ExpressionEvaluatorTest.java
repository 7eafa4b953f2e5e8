package com.kconfig.semantics.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {

    private final ExpressionCache cache = new ExpressionCache();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private final Map<String, ConfigValue> values = Map.of(
            "ON", ConfigValue.TRUE,
            "OFF", ConfigValue.FALSE,
            "COUNT", ConfigValue.of(50L),
            "NAME", ConfigValue.of("name"));

    private ConfigValue solve(String source) throws ExpressionException {
        return evaluator.solve(cache.compile(source), values::get);
    }

    @Test
    void booleanOperators() throws Exception {
        assertEquals(ConfigValue.TRUE, solve("ON && !OFF"));
        assertEquals(ConfigValue.FALSE, solve("OFF || OFF"));
        assertEquals(ConfigValue.TRUE, solve("!(OFF || OFF)"));
    }

    @Test
    void unknownSymbolsAreFalse() throws Exception {
        assertEquals(ConfigValue.FALSE, solve("UNDECLARED"));
        assertEquals(ConfigValue.TRUE, solve("!UNDECLARED"));
    }

    @Test
    void tristateLiteralsCollapseToBooleans() throws Exception {
        assertEquals(ConfigValue.TRUE, solve("m"));
        assertEquals(ConfigValue.TRUE, solve("ON = y"));
        assertEquals(ConfigValue.TRUE, solve("ON = m"));
        assertEquals(ConfigValue.TRUE, solve("OFF = n"));
    }

    @Test
    void comparisonsOnNumbersAndStrings() throws Exception {
        assertEquals(ConfigValue.TRUE, solve("COUNT >= 50"));
        assertEquals(ConfigValue.FALSE, solve("COUNT > 50"));
        assertEquals(ConfigValue.TRUE, solve("COUNT < 0x40"));
        assertEquals(ConfigValue.TRUE, solve("COUNT <= 50"));
        assertEquals(ConfigValue.TRUE, solve("NAME = \"name\""));
        assertEquals(ConfigValue.TRUE, solve("NAME != \"other\""));
    }

    @Test
    void valuesOfDifferentKindsAreNeverEqual() throws Exception {
        assertEquals(ConfigValue.FALSE, solve("COUNT = \"50\""));
        assertEquals(ConfigValue.TRUE, solve("OFF != 0"));
    }

    @Test
    void andShortCircuits() throws Exception {
        List<String> resolved = new ArrayList<>();
        SymbolResolver tracking = name -> {
            resolved.add(name);
            return values.get(name);
        };

        evaluator.solve(cache.compile("OFF && ON"), tracking);
        evaluator.solve(cache.compile("ON || OFF"), tracking);

        assertEquals(List.of("OFF", "ON"), resolved);
    }

    @Test
    void operandsOfTheWrongKindAreTypeErrors() {
        assertThrows(ExpressionTypeException.class, () -> solve("COUNT && ON"));
        assertThrows(ExpressionTypeException.class, () -> solve("!NAME"));
        ExpressionTypeException ex = assertThrows(ExpressionTypeException.class, () -> solve("NAME > 3"));
        assertEquals(">", ex.getOperator());
        assertEquals(ConfigValue.Kind.STRING, ex.getActual());
    }

    @Test
    void truthinessIsLooserThanTruth() {
        assertEquals(true, ConfigValue.of(3L).isTruthy());
        assertEquals(false, ConfigValue.of(3L).isTrue());
        assertEquals(false, ConfigValue.of("").isTruthy());
        assertEquals(true, ConfigValue.of("x").isTruthy());
        assertEquals(OptionalLong.of(-16L), ConfigValue.parseNumber("-0x10"));
        assertEquals(OptionalLong.empty(), ConfigValue.parseNumber("99999999999999999999"));
        assertEquals(OptionalLong.empty(), ConfigValue.parseNumber("size"));
    }
}
