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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * a file with some useful numerical stuff for moving errors around.
 */
public class Math2 {

	public static double sqr(double x) {
		return x*x;
	}

	/**
	 * round to the given number of decimal places, with ties going away from zero. this
	 * works on the shortest decimal representation of x (the digits {@link Double#toString}
	 * would print) rather than its binary value, so 1.005 to 2 places is 1.01 and not 1.00.
	 * @param x the number to round
	 * @param decimalPlaces where to round; a negative number rounds to tens, hundreds, etc.
	 * @return the rounded number, exactly
	 */
	public static BigDecimal roundHalfUp(double x, int decimalPlaces) {
		return BigDecimal.valueOf(x).setScale(decimalPlaces, RoundingMode.HALF_UP);
	}

	/**
	 * @return the power of ten of the leading digit of x, which must be nonzero. 0.0022 gives -3 and 120 gives 2.
	 */
	public static int orderOfMagnitude(BigDecimal x) {
		if (x.signum() == 0)
			throw new IllegalArgumentException("zero has no order of magnitude");
		return x.precision() - x.scale() - 1;
	}

	/**
	 * linearize a function of one variable to estimate the error of its output:
	 * Δf ≈ |df/dx|Δx. an exact input always gives an exact output, even where the
	 * derivative blows up.
	 * @param derivative the derivative of the function at the measured value
	 * @param error the uncertainty in the input
	 * @return the uncertainty in the output
	 */
	public static double propagate(double derivative, double error) {
		if (error == 0)
			return 0;
		return unboundedIfUndefined(Math.abs(derivative)*error);
	}

	/**
	 * an error of NaN comes out of things like 0*∞; call it unbounded.
	 */
	public static double unboundedIfUndefined(double error) {
		if (Double.isNaN(error))
			return Double.POSITIVE_INFINITY;
		else
			return error;
	}
}
