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
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnitsTest {

	private static final BigFraction HALF = BigFraction.of(1, 2);
	private static final BigFraction TWO = BigFraction.of(2);

	private static final Units METER = Units.of("m");
	private static final Units SECOND = Units.of("s");
	private static final Units KILOGRAM = Units.of("kg");

	@Test
	void testZeroExponentsAreDropped() {
		Map<String, BigFraction> symbols = new HashMap<>();
		symbols.put("m", BigFraction.ONE);
		symbols.put("s", BigFraction.ZERO);
		Units units = new Units(symbols);
		assertEquals(METER, units);
		assertEquals(1, units.getSymbols().size());
		assertTrue(new Units(Map.of("K", BigFraction.ZERO)).isDimensionless());
	}

	@Test
	void testEqualityIgnoresInsertionOrder() {
		Map<String, BigFraction> a = new HashMap<>();
		a.put("m", BigFraction.ONE);
		a.put("s", BigFraction.of(-2));
		Map<String, BigFraction> b = new HashMap<>();
		b.put("s", BigFraction.of(-4, 2));
		b.put("m", BigFraction.of(3, 3));
		assertEquals(new Units(a), new Units(b));
		assertEquals(new Units(a).hashCode(), new Units(b).hashCode());
		assertNotEquals(METER, Units.of("meter"));
	}

	@Test
	void testTimes() {
		Units force = KILOGRAM.times(METER).over(SECOND.pow(TWO));
		assertEquals(BigFraction.ONE, force.getExponent("kg"));
		assertEquals(BigFraction.ONE, force.getExponent("m"));
		assertEquals(BigFraction.of(-2), force.getExponent("s"));
		assertEquals(BigFraction.ZERO, force.getExponent("A"));
		assertEquals(Units.of("m", TWO), METER.times(METER));
	}

	@Test
	void testOverCancels() {
		assertTrue(METER.over(METER).isDimensionless());
		assertEquals(Units.NONE, METER.times(SECOND).over(SECOND).over(METER));
	}

	@Test
	void testInvertThenTimesIsDimensionless() {
		Units[] all = {
			  Units.NONE, METER, KILOGRAM.times(METER).over(SECOND),
			  Units.of("Hz", HALF).times(Units.of("V", BigFraction.of(-3, 7)))};
		for (Units u: all)
			assertTrue(u.invert().times(u).isDimensionless(), u.toString());
	}

	@Test
	void testPow() {
		Units area = METER.pow(TWO);
		assertEquals(METER, area.pow(HALF));
		assertEquals(Units.of("m", HALF), METER.pow(HALF));
		assertTrue(area.pow(BigFraction.ZERO).isDimensionless());
	}

	@Test
	void testToString() {
		assertEquals("", Units.NONE.toString());
		assertEquals("m", METER.toString());
		assertEquals("kg m s^-2", SECOND.pow(BigFraction.of(-2)).times(METER).times(KILOGRAM).toString());
		assertEquals("m^1/2", METER.pow(HALF).toString());
		assertEquals("s^-3/2", SECOND.pow(BigFraction.of(-3, 2)).toString());
		assertEquals("Hz^2 J", Units.of("J").times(Units.of("Hz", TWO)).toString());
	}

	@Test
	void testImmutable() {
		Map<String, BigFraction> symbols = new HashMap<>();
		symbols.put("m", BigFraction.ONE);
		Units units = new Units(symbols);
		symbols.put("s", BigFraction.ONE);
		assertEquals(METER, units);
		assertThrows(UnsupportedOperationException.class,
		             () -> units.getSymbols().put("s", BigFraction.ONE));
		assertFalse(units.isDimensionless());
	}
}
