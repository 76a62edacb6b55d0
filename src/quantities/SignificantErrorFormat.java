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
import java.util.logging.Logger;

import static quantities.Math2.orderOfMagnitude;
import static quantities.Math2.roundHalfUp;

/**
 * Renders a Quantity as "value ± error units", with the error cut to a given number of
 * significant digits and the value rounded to the same decimal place as the error.
 * The error decides where to round; the value just follows it.
 */
public class SignificantErrorFormat {
	private static final Logger logger = Logger.getLogger(Logging.LOGGER_NAME);

	public static final String PLUS_MINUS = " ± ";
	public static final String INFINITY = "∞";
	public static final String NO_ERROR = " (no error)";

	/**
	 * format a quantity so that its error has exactly sigDigits significant digits.
	 * <ol>
	 *   <li>find the order of magnitude of the error and its leading digit.</li>
	 *   <li>if leadingOneException is set and the error would be shown as a single
	 *       digit that is a 1, show two digits instead.</li>
	 *   <li>round the error and the value half-up at that decimal place.</li>
	 *   <li>pad the error out to the right number of digits, and give the value the
	 *       same number of decimals as the error.</li>
	 * </ol>
	 * an exact quantity is printed as-is with a note, and an unbounded one is printed
	 * with an error of ∞.
	 * @param q the quantity to format
	 * @param sigDigits the number of significant digits to give the error; at least 1
	 * @param leadingOneException whether to give a leading 1 a second digit
	 * @return the formatted string
	 */
	public static String format(Quantity q, int sigDigits, boolean leadingOneException) {
		if (sigDigits < 1)
			throw new IllegalArgumentException("the number of significant digits must be at least 1 but it was " + sigDigits);

		if (q.error == 0)
			return q.value + NO_ERROR + unitSuffix(q.units);
		if (Double.isInfinite(q.error))
			return q.value + PLUS_MINUS + INFINITY + unitSuffix(q.units);

		BigDecimal error = BigDecimal.valueOf(q.error).abs();
		int exponent = orderOfMagnitude(error);
		int leadingDigit = error.movePointLeft(exponent).intValue();

		int digits = sigDigits;
		if (leadingOneException && leadingDigit == 1 && sigDigits == 1) {
			logger.fine(String.format("giving the error %s a second digit since it starts with 1", error));
			digits = 2;
		}

		int shift = digits - 1 - exponent; // the number of decimal places to keep; negative means tens, hundreds...

		String errorString = toSignificantDigits(roundHalfUp(q.error, shift).abs(), digits);
		String valueString = toDecimalPlaces(roundHalfUp(q.value, shift), countDecimals(errorString));

		return valueString + PLUS_MINUS + errorString + unitSuffix(q.units);
	}

	private static String unitSuffix(Units units) {
		if (units.isDimensionless())
			return "";
		else
			return " " + units;
	}

	/**
	 * write an already rounded number with exactly the given number of significant
	 * digits, adding trailing zeros (and a decimal point if need be) when it's short.
	 * for example, 0.5 to 2 digits is "0.50" and 123 to 4 digits is "123.0".
	 */
	static String toSignificantDigits(BigDecimal x, int sigDigits) {
		if (x.signum() == 0) {
			if (sigDigits == 1)
				return "0";
			else
				return "0." + "0".repeat(sigDigits - 1);
		}

		String plain = x.stripTrailingZeros().toPlainString();
		int missing = sigDigits - countSignificantDigits(plain);
		if (missing <= 0)
			return plain;
		else if (plain.indexOf('.') < 0)
			return plain + "." + "0".repeat(missing);
		else
			return plain + "0".repeat(missing);
	}

	/**
	 * count the digits from the first nonzero one onward, ignoring any sign and the
	 * decimal point. "0.50" has 2 and "100" has 3. a string of only zeros has none.
	 */
	static int countSignificantDigits(String number) {
		String digits = number.replace(".", "");
		if (digits.startsWith("-"))
			digits = digits.substring(1);
		for (int i = 0; i < digits.length(); i ++)
			if (digits.charAt(i) != '0')
				return digits.length() - i;
		return 0;
	}

	static int countDecimals(String number) {
		int point = number.indexOf('.');
		if (point < 0)
			return 0;
		else
			return number.length() - point - 1;
	}

	/**
	 * write a number rounded half-up to the given number of decimal places, keeping
	 * trailing zeros. with no decimal places it comes out as a bare integer.
	 */
	static String toDecimalPlaces(BigDecimal x, int decimals) {
		BigDecimal rounded = x.setScale(decimals, RoundingMode.HALF_UP);
		if (decimals == 0)
			return rounded.stripTrailingZeros().toPlainString();
		else
			return rounded.toPlainString();
	}
}
