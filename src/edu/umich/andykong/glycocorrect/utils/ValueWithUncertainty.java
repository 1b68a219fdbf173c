/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.glycocorrect.utils;

import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

/**
 * A nominal value with a standard deviation. All arithmetic goes through the named combinators below, which propagate
 * uncertainty to first order under the assumption that the operands are independent.
 */
public final class ValueWithUncertainty {

    public static final ValueWithUncertainty ZERO = new ValueWithUncertainty(0.0, 0.0);

    private final double value;
    private final double error;

    /**
     * @param value nominal value
     * @param error standard deviation, must not be negative
     */
    public ValueWithUncertainty(double value, double error) {
        if (error < 0) {
            throw new IllegalArgumentException(String.format("Standard deviation must not be negative: %f", error));
        }
        this.value = value;
        this.error = error;
    }

    public static ValueWithUncertainty of(double value, double error) {
        return new ValueWithUncertainty(value, error);
    }

    /** Exact value, zero uncertainty. */
    public static ValueWithUncertainty exact(double value) {
        return new ValueWithUncertainty(value, 0.0);
    }

    public double getValue() {
        return value;
    }

    public double getError() {
        return error;
    }

    // (a±da) + (b±db) = (a+b) ± sqrt(da²+db²)
    public ValueWithUncertainty add(ValueWithUncertainty other) {
        return new ValueWithUncertainty(value + other.value, FastMath.hypot(error, other.error));
    }

    // (a±da) - (b±db) = (a-b) ± sqrt(da²+db²)
    public ValueWithUncertainty subtract(ValueWithUncertainty other) {
        return new ValueWithUncertainty(value - other.value, FastMath.hypot(error, other.error));
    }

    public ValueWithUncertainty negate() {
        return new ValueWithUncertainty(-value, error);
    }

    // (a±da)·k = a·k ± |k|·da
    public ValueWithUncertainty multiply(double factor) {
        return new ValueWithUncertainty(value * factor, FastMath.abs(factor) * error);
    }

    // (a±da)·(b±db) = ab ± sqrt((b·da)² + (a·db)²)
    public ValueWithUncertainty multiply(ValueWithUncertainty other) {
        return new ValueWithUncertainty(value * other.value,
                FastMath.hypot(other.value * error, value * other.error));
    }

    public ValueWithUncertainty divide(double divisor) {
        return multiply(1.0 / divisor);
    }

    // (a±da)/(b±db) = a/b ± sqrt((da/b)² + (a·db/b²)²)
    public ValueWithUncertainty divide(ValueWithUncertainty divisor) {
        double b = divisor.value;
        return new ValueWithUncertainty(value / b,
                FastMath.hypot(error / b, value * divisor.error / (b * b)));
    }

    /**
     * Compare nominal values and standard deviations within an absolute tolerance.
     */
    public boolean equalsWithin(ValueWithUncertainty other, double eps) {
        return Precision.equals(value, other.value, eps) && Precision.equals(error, other.error, eps);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueWithUncertainty)) {
            return false;
        }
        ValueWithUncertainty other = (ValueWithUncertainty) o;
        return Double.compare(value, other.value) == 0 && Double.compare(error, other.error) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(value) + Double.hashCode(error);
    }

    @Override
    public String toString() {
        return String.format("%.2f+/-%.2f", value, error);
    }
}
