package com.example.formulator.model;

import java.math.BigDecimal;

/** A production step billed by time. Every numeric field is optional. */
public class ProcessCost {
    public String name;
    public ScaleType scaleType;           // nullable: cost stays undefined
    public BigDecimal timeValue;
    public String timeUnit;               // "min" or "h"
    public BigDecimal costPerHour;
    public BigDecimal totalCost;
    public BigDecimal setupTimeValue;
    public String setupTimeUnit;
    public BigDecimal timePerKgValue;
    public String notes;

    public ProcessCost() {}
    public ProcessCost(String name, ScaleType scaleType) {
        this.name = name; this.scaleType = scaleType;
    }

    @Override public String toString() { return name + " (" + scaleType + ")"; }
}
