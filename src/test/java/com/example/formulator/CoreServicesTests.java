package com.example.formulator;

import com.example.formulator.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.*;

public class CoreServicesTests {

    @Test
    void numberParser_accepts_both_decimal_conventions() {
        assertEquals(0, new BigDecimal("1234.5").compareTo(NumberParser.parse("1.234,5")));
        assertEquals(0, new BigDecimal("12.5").compareTo(NumberParser.parse("12,5")));
        assertEquals(0, new BigDecimal("12.5").compareTo(NumberParser.parse(" 12.5 ")));
        assertEquals(0, new BigDecimal("1000").compareTo(NumberParser.parse("1 000")));
        assertEquals(0, new BigDecimal("7").compareTo(NumberParser.parse(7)));
    }

    @Test
    void numberParser_returns_null_for_missing_or_garbage() {
        assertNull(NumberParser.parse((Object) null));
        assertNull(NumberParser.parse(""));
        assertNull(NumberParser.parse("   "));
        assertNull(NumberParser.parse("abc"));
        assertNull(NumberParser.parse("1,2,x"));
    }

    @Test
    void numberParser_passes_decimals_through() {
        BigDecimal v = new BigDecimal("3.14159");
        assertSame(v, NumberParser.parse((Object) v));
    }

    @Test
    void units_convert_mass_through_grams() {
        Units units = new Units();
        assertEquals(0, new BigDecimal("1000").compareTo(units.convertMass(BigDecimal.ONE, "kg", "g")));
        assertEquals(0, new BigDecimal("0.5").compareTo(units.convertMass(new BigDecimal("500"), "g", "kg")));
        assertEquals(0, new BigDecimal("453.59237").compareTo(units.massToGrams(BigDecimal.ONE, "lb")));
        assertEquals(0, new BigDecimal("28.349523125").compareTo(units.massToGrams(BigDecimal.ONE, "onza")));
        assertEquals(0, new BigDecimal("2").compareTo(units.massToKilograms(new BigDecimal("2000"), "g")));
        assertEquals(1.0, units.convertMass(new BigDecimal("1000"), "mcg", "mg").doubleValue(), 1e-12);
    }

    @Test
    void units_identity_and_unknown() {
        Units units = new Units();
        BigDecimal v = new BigDecimal("42.5");
        assertSame(v, units.convertMass(v, "Kilogramos", "kg"));
        assertNull(units.convertMass(v, "cup", "g"));
        assertNull(units.convertMass(v, "g", ""));
        assertNull(units.convertMass(null, "g", "kg"));
    }

    @Test
    void units_convert_energy_between_kcal_and_kj() {
        Units units = new Units();
        assertEquals(0, new BigDecimal("418.4").compareTo(units.convertAmount(new BigDecimal("100"), "kcal", "kJ")));
        assertEquals(100.0, units.convertAmount(new BigDecimal("418.4"), "kilojoules", "kcal").doubleValue(), 1e-9);
        assertNull(units.convertAmount(BigDecimal.ONE, "kcal", "g"));
    }

    @Test
    void units_extra_factors_never_override_builtins() {
        Units units = new Units(Map.of("g", new BigDecimal("5"), "grain", new BigDecimal("0.06479891")));
        assertEquals(0, new BigDecimal("1000").compareTo(units.massToGrams(BigDecimal.ONE, "kg")));
        assertEquals(0, new BigDecimal("0.06479891").compareTo(units.massToGrams(BigDecimal.ONE, "grain")));
        assertTrue(units.isMassUnit("grain"));
    }
}
