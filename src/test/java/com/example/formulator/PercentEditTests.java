package com.example.formulator;

import com.example.formulator.model.*;
import com.example.formulator.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import static com.example.formulator.FormulationServiceTests.*;

import java.math.BigDecimal;
import java.util.*;

public class PercentEditTests {
    private final FormulationService service = new FormulationService();

    @Test
    void free_rows_share_the_remaining_budget_proportionally() {
        Formulation f = formulation("50", "30", "20");
        service.applyPercentEdit(f, 0, new BigDecimal("60"));
        assertAmounts(f, "60", "24", "16");
    }

    @Test
    void locked_rows_keep_their_share() {
        Formulation f = formulation("50", "30", "20");
        service.lockIngredient(f, 1);
        service.applyPercentEdit(f, 0, new BigDecimal("60"));
        assertAmounts(f, "60", "30", "10");
    }

    @Test
    void total_weight_is_preserved() {
        Formulation f = formulation("100", "100");
        service.applyPercentEdit(f, 0, new BigDecimal("25"));
        assertAmounts(f, "50", "150");
    }

    @Test
    void total_stays_exact_with_uneven_shares() {
        Formulation f = formulation("10", "1", "2", "4");
        service.applyPercentEdit(f, 0, new BigDecimal("50"));
        assertEquals(0, new BigDecimal("17").compareTo(f.getTotalWeight()));
        assertEquals(0, new BigDecimal("8.5").compareTo(f.getIngredient(0).getAmountG()));
    }

    @Test
    void weightless_formulation_uses_100g_base_and_first_free_row() {
        Formulation f = formulation("0", "0", "0");
        service.applyPercentEdit(f, 1, new BigDecimal("25"));
        assertAmounts(f, "75", "25", "0");
    }

    @Test
    void budget_overflow_fails_without_mutation() {
        Formulation f = formulation("50", "30", "20");
        service.lockIngredient(f, 1);
        List<BigDecimal> before = amounts(f);
        assertThrows(InvalidFormulationException.class, () -> service.applyPercentEdit(f, 0, new BigDecimal("80")));
        assertEquals(before, amounts(f));
    }

    @Test
    void remaining_budget_needs_a_free_row() {
        Formulation f = formulation("50", "50");
        service.lockIngredient(f, 1);
        assertThrows(InvalidFormulationException.class, () -> service.applyPercentEdit(f, 0, new BigDecimal("40")));
        assertAmounts(f, "50", "50");

        service.applyPercentEdit(f, 0, new BigDecimal("50"));
        assertAmounts(f, "50", "50");
    }

    @Test
    void rejects_out_of_range_input() {
        Formulation f = formulation("50", "50");
        assertThrows(InvalidFormulationException.class, () -> service.applyPercentEdit(f, 0, new BigDecimal("100.5")));
        assertThrows(InvalidFormulationException.class, () -> service.applyPercentEdit(f, 0, new BigDecimal("-1")));
        assertThrows(InvalidFormulationException.class, () -> service.applyPercentEdit(f, 2, BigDecimal.TEN));
        assertAmounts(f, "50", "50");
    }

    @Test
    void single_row_takes_everything() {
        Formulation f = formulation("40");
        service.applyPercentEdit(f, 0, new BigDecimal("100"));
        assertAmounts(f, "40");
    }
}
