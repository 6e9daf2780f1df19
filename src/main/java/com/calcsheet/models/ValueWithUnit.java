package com.calcsheet.models;

public class ValueWithUnit {
    private double value;
    private String unit; // unit expression, e.g. "kg*m/s**2"; null when dimensionless

    public ValueWithUnit() {
    }

    public ValueWithUnit(double value, String unit) {
        this.value = value;
        this.unit = unit;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public boolean hasUnit() {
        return unit != null && !unit.isBlank();
    }

    /**
     * Whole numbers print without a fraction part: 10.0 prints as {@code 10}.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return hasUnit() ? formatNumber(value) + " " + unit : formatNumber(value);
    }
}
