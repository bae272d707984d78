package com.example.formulator.storage;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** User defaults applied to new formulations. */
public class Settings {
    public String defaultQuantityMode = "g";
    public BigDecimal defaultYieldPercent = BigDecimal.valueOf(100);
    public BigDecimal costTargetMassValue;
    public String costTargetMassUnit;
    // extra currencies on top of the base one
    public List<Rate> currencyRates = new ArrayList<>();
    public String lastFormulationPath;

    public static class Rate {
        public String name;
        public String symbol;
        public BigDecimal rateToBase;
        public Rate() {}
        public Rate(String name, String symbol, BigDecimal rateToBase) { this.name = name; this.symbol = symbol; this.rateToBase = rateToBase; }
    }
}
