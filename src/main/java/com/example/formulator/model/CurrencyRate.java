package com.example.formulator.model;

import java.math.BigDecimal;

/** Exchange rate of a currency to the base currency ({@code $}). Immutable. */
public class CurrencyRate {
    public static final String BASE_SYMBOL = "$";
    public static final String BASE_NAME = "Base currency";

    public final String name;
    public final String symbol;
    public final BigDecimal rateToBase;

    public CurrencyRate(String name, String symbol, BigDecimal rateToBase) {
        this.name = name; this.symbol = symbol; this.rateToBase = rateToBase;
    }

    public static CurrencyRate base() { return new CurrencyRate(BASE_NAME, BASE_SYMBOL, BigDecimal.ONE); }

    public boolean isBase() { return symbol != null && BASE_SYMBOL.equals(symbol.trim()); }

    @Override public String toString() { return symbol + "=" + rateToBase; }
}
