/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package quantities;

import org.apache.commons.numbers.fraction.BigFraction;

import java.util.logging.Logger;

import static quantities.Math2.propagate;
import static quantities.Math2.sqr;
import static quantities.Math2.unboundedIfUndefined;


/**
 * A measured value with an uncertainty and some units. Every operation returns a new
 * Quantity whose error has been propagated from the operands'. Errors are always
 * nonnegative; an error of +∞ means the uncertainty is unbounded, which is what you
 * get when you divide by something that might be zero.
 * <p>
 * Quantities deliberately don't implement equals or compareTo, since two measurements
 * with overlapping error bars can't be meaningfully ordered.
 */
public final class Quantity {
	private static final Logger logger = Logger.getLogger(Logging.LOGGER_NAME);

	private static final BigFraction ONE_HALF = BigFraction.of(1, 2);

	public final double value;
	public final double error;
	public final Units units;

	public Quantity(double value, double error, Units units) {
		if (!Double.isFinite(value))
			throw new IllegalArgumentException("value must be finite but it was " + value);
		if (!(error >= 0))
			throw new IllegalArgumentException("error must be nonnegative but it was " + error);
		if (units == null)
			throw new IllegalArgumentException("units must not be null; use Units.NONE for a dimensionless quantity");
		this.value = value;
		this.error = error;
		this.units = units;
	}

	/**
	 * a dimensionless measurement
	 */
	public Quantity(double value, double error) {
		this(value, error, Units.NONE);
	}

	/**
	 * an exactly known value
	 */
	public Quantity(double value, Units units) {
		this(value, 0, units);
	}

	public Quantity plus(Quantity that) {
		return this.plus(that, ErrorPropagation.WORST_CASE);
	}

	public Quantity plus(Quantity that, ErrorPropagation model) {
		if (!this.units.equals(that.units))
			throw new IllegalArgumentException(
				  "can't add quantities with different units ("+this.units+" and "+that.units+")");
		return new Quantity(
			  this.value + that.value,
			  model.combine(this.error, that.error),
			  this.units);
	}

	public Quantity minus(Quantity that) {
		return this.minus(that, ErrorPropagation.WORST_CASE);
	}

	public Quantity minus(Quantity that, ErrorPropagation model) {
		if (!this.units.equals(that.units))
			throw new IllegalArgumentException(
				  "can't subtract quantities with different units ("+this.units+" and "+that.units+")");
		return new Quantity(
			  this.value - that.value,
			  model.combine(this.error, that.error),
			  this.units);
	}

	public Quantity times(Quantity that) {
		return this.times(that, ErrorPropagation.WORST_CASE);
	}

	/**
	 * Δ(xy) combines |y|Δx and |x|Δy
	 */
	public Quantity times(Quantity that, ErrorPropagation model) {
		double error = model.combine(
			  Math.abs(that.value)*this.error,
			  Math.abs(this.value)*that.error);
		return new Quantity(
			  this.value*that.value,
			  unboundedIfUndefined(error),
			  this.units.times(that.units));
	}

	public Quantity times(double factor) {
		return new Quantity(this.value*factor, propagate(factor, this.error), this.units);
	}

	public Quantity over(Quantity that) {
		return this.over(that, ErrorPropagation.WORST_CASE);
	}

	/**
	 * Δ(x/y) combines Δx/|y| and |x|Δy/y². if the denominator's error bar reaches zero,
	 * the linearization is meaningless and the error is set to +∞ regardless of model.
	 */
	public Quantity over(Quantity that, ErrorPropagation model) {
		double value = this.value/that.value;
		Units units = this.units.over(that.units);

		if (that.value - that.error <= 0 && that.value + that.error >= 0) {
			logger.fine(String.format("the denominator %s could be zero; the quotient's error is unbounded", that));
			return new Quantity(value, Double.POSITIVE_INFINITY, units);
		}

		double error = model.combine(
			  this.error/Math.abs(that.value),
			  Math.abs(this.value)*that.error/sqr(that.value));
		return new Quantity(value, unboundedIfUndefined(error), units);
	}

	public Quantity over(double divisor) {
		return new Quantity(this.value/divisor, propagate(1/divisor, this.error), this.units);
	}

	public Quantity neg() {
		return new Quantity(-this.value, this.error, this.units);
	}

	public Quantity abs() {
		if (this.value < 0)
			return this.neg();
		else
			return this;
	}

	/**
	 * raise this to an exact power. the exponent goes into the units exactly, and
	 * into the value as a double. a negative value to a fractional power isn't
	 * real, so it will fail when the NaN result gets checked.
	 */
	public Quantity pow(BigFraction exponent) {
		if (exponent.signum() == 0)
			return new Quantity(1, 0, Units.NONE); // x^0 doesn't depend on x at all
		double p = exponent.doubleValue();
		return new Quantity(
			  Math.pow(this.value, p),
			  propagate(p*Math.pow(this.value, p - 1), this.error),
			  this.units.pow(exponent));
	}

	public Quantity sqrt() {
		return this.pow(ONE_HALF);
	}

	public Quantity exp() {
		this.requireDimensionless("exp");
		double exp = Math.exp(this.value);
		return new Quantity(exp, propagate(exp, this.error), Units.NONE);
	}

	public Quantity log() {
		this.requireDimensionless("log");
		if (this.value <= 0)
			throw new IllegalArgumentException("log requires a positive value but it was " + this.value);
		return new Quantity(Math.log(this.value), propagate(1/this.value, this.error), Units.NONE);
	}

	/**
	 * @return the sine, treating this as an angle in radians
	 */
	public Quantity sin() {
		this.requireDimensionless("sin");
		return new Quantity(Math.sin(this.value), propagate(Math.cos(this.value), this.error), Units.NONE);
	}

	/**
	 * @return the cosine, treating this as an angle in radians
	 */
	public Quantity cos() {
		this.requireDimensionless("cos");
		return new Quantity(Math.cos(this.value), propagate(Math.sin(this.value), this.error), Units.NONE);
	}

	public Quantity tan() {
		this.requireDimensionless("tan");
		double tan = Math.tan(this.value);
		return new Quantity(tan, propagate(1 + tan*tan, this.error), Units.NONE);
	}

	public Quantity atan() {
		this.requireDimensionless("atan");
		return new Quantity(Math.atan(this.value), propagate(1/(1 + sqr(this.value)), this.error), Units.NONE);
	}

	private void requireDimensionless(String function) {
		if (!this.units.isDimensionless())
			throw new IllegalArgumentException(
				  function+" requires a dimensionless quantity but this has units of "+this.units);
	}

	/**
	 * @return the error as a fraction of the magnitude of the value
	 */
	public double relativeError() {
		if (this.error == 0)
			return 0;
		return this.error/Math.abs(this.value);
	}

	public boolean isExact() {
		return this.error == 0;
	}

	public boolean isErrorBounded() {
		return Double.isFinite(this.error);
	}

	/**
	 * @see SignificantErrorFormat#format(Quantity, int, boolean)
	 */
	public String formatWithSignificantError(int sigDigits, boolean leadingOneException) {
		return SignificantErrorFormat.format(this, sigDigits, leadingOneException);
	}

	@Override
	public String toString() {
		if (this.units.isDimensionless())
			return this.value + " +/- " + this.error;
		else
			return this.value + " +/- " + this.error + " " + this.units;
	}
}
