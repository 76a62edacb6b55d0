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

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * A dimensional signature: each unit symbol raised to an exact rational power.
 * Symbols are compared literally, so "m" and "meter" are unrelated. Symbols
 * whose exponent comes out to zero are dropped, which makes the map canonical.
 */
public final class Units {
	public static final Units NONE = new Units(Collections.emptyMap());

	private final SortedMap<String, BigFraction> symbols;

	public Units(Map<String, BigFraction> symbols) {
		SortedMap<String, BigFraction> nonzero = new TreeMap<>();
		for (Map.Entry<String, BigFraction> entry: symbols.entrySet())
			if (entry.getValue().signum() != 0)
				nonzero.put(entry.getKey(), entry.getValue());
		this.symbols = Collections.unmodifiableSortedMap(nonzero);
	}

	public static Units of(String symbol) {
		return of(symbol, BigFraction.ONE);
	}

	public static Units of(String symbol, BigFraction exponent) {
		return new Units(Map.of(symbol, exponent));
	}

	public Units times(Units that) {
		Map<String, BigFraction> product = new TreeMap<>(this.symbols);
		for (Map.Entry<String, BigFraction> entry: that.symbols.entrySet())
			product.merge(entry.getKey(), entry.getValue(), BigFraction::add);
		return new Units(product);
	}

	public Units over(Units that) {
		return this.times(that.invert());
	}

	public Units invert() {
		return this.map(BigFraction::negate);
	}

	public Units pow(BigFraction exponent) {
		return this.map(c -> c.multiply(exponent));
	}

	private Units map(UnaryOperator<BigFraction> function) {
		Map<String, BigFraction> result = new TreeMap<>();
		for (Map.Entry<String, BigFraction> entry: this.symbols.entrySet())
			result.put(entry.getKey(), function.apply(entry.getValue()));
		return new Units(result);
	}

	/**
	 * @return the power to which this symbol is raised, or zero if it doesn't appear
	 */
	public BigFraction getExponent(String symbol) {
		return this.symbols.getOrDefault(symbol, BigFraction.ZERO);
	}

	public SortedMap<String, BigFraction> getSymbols() {
		return this.symbols;
	}

	public boolean isDimensionless() {
		return this.symbols.isEmpty();
	}

	/**
	 * render the symbols in alphabetical order, separated by spaces. an exponent
	 * of 1 is implicit; anything else is written after a caret as an integer or
	 * as numerator/denominator, never with internal spaces.
	 */
	@Override
	public String toString() {
		StringBuilder s = new StringBuilder();
		for (Map.Entry<String, BigFraction> entry: this.symbols.entrySet()) {
			if (s.length() > 0)
				s.append(" ");
			s.append(entry.getKey());
			if (!entry.getValue().equals(BigFraction.ONE))
				s.append("^").append(exponentToString(entry.getValue()));
		}
		return s.toString();
	}

	private static String exponentToString(BigFraction exponent) {
		String sign = (exponent.signum() < 0) ? "-" : "";
		BigInteger numerator = exponent.getNumerator().abs();
		BigInteger denominator = exponent.getDenominator().abs(); // the denominator may carry the sign
		if (denominator.equals(BigInteger.ONE))
			return sign + numerator;
		else
			return sign + numerator + "/" + denominator;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Units))
			return false;
		return this.symbols.equals(((Units) o).symbols);
	}

	@Override
	public int hashCode() {
		return this.symbols.hashCode();
	}
}
