package com.example.formulator.model;

import java.math.BigDecimal;

/** A packaging component used once per sold pack. */
public class PackagingItem {
    public String name;
    public BigDecimal quantityPerPack;
    /** Unit cost already expressed in base currency. */
    public BigDecimal unitCost;
    /** Unit cost in another currency; takes precedence over {@link #unitCost} when set. */
    public BigDecimal unitCostValue;
    public String unitCostCurrencySymbol;
    public String notes;

    public PackagingItem() {}
    public PackagingItem(String name, BigDecimal quantityPerPack, BigDecimal unitCost) {
        this.name = name; this.quantityPerPack = quantityPerPack; this.unitCost = unitCost;
    }

    @Override public String toString() { return name + "," + quantityPerPack + "," + unitCost; }
}
