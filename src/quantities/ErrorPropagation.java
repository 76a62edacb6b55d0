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

/**
 * How the uncertainties of two operands combine in a binary operation.
 */
public enum ErrorPropagation {
	/** assume the errors are fully correlated: Δ = Δa + Δb */
	WORST_CASE {
		@Override
		public double combine(double a, double b) {
			return a + b;
		}
	},
	/** assume the errors are independent: Δ = √(Δa² + Δb²) */
	QUADRATURE {
		@Override
		public double combine(double a, double b) {
			return Math.sqrt(a*a + b*b);
		}
	};

	/**
	 * combine two nonnegative error contributions
	 * @param a the contribution of the first operand
	 * @param b the contribution of the second operand
	 * @return the error of the result
	 */
	public abstract double combine(double a, double b);
}
