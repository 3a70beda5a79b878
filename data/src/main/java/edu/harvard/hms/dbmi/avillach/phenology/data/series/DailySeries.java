package edu.harvard.hms.dbmi.avillach.phenology.data.series;

import java.util.Arrays;

/**
 * A dense series with one value per day of year, starting at {@link #getFirstDay()}.
 */
public abstract class DailySeries {

    private final int firstDay;

    private final double[] values;

    protected DailySeries(int firstDay, double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("A daily series needs at least one value");
        }
        this.firstDay = firstDay;
        this.values = values.clone();
    }

    public int getFirstDay() {
        return firstDay;
    }

    public int getLastDay() {
        return firstDay + values.length - 1;
    }

    public int size() {
        return values.length;
    }

    public int dayAt(int index) {
        return firstDay + index;
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double[] getValues() {
        return values.clone();
    }

    public double min() {
        return Arrays.stream(values).min().getAsDouble();
    }

    public double max() {
        return Arrays.stream(values).max().getAsDouble();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DailySeries that = (DailySeries) o;
        return firstDay == that.firstDay && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * firstDay + Arrays.hashCode(values);
    }
}
