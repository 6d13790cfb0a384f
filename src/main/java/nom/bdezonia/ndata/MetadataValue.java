/*
 * zorbage-ndata: code for reading neutron detector files into zorbage structures and reducing them to contrast
 *
 * Copyright (C) 2023 Barry DeZonia
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
package nom.bdezonia.ndata;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed value found in an instrument file header. Values are immutable
 * and compare by content.
 *
 * @author Barry DeZonia
 */
public final class MetadataValue {

	public enum Kind {
		NONE,
		INTEGER,
		FLOAT,
		STRING,
		QUANTITY,
		QUANTITY_TUPLE,
		NUMBER_TUPLE,
		STRING_TUPLE,
		ENTRIES
	}

	public static final MetadataValue NONE = new MetadataValue(Kind.NONE, 0, 0, null, null, null, null);

	private final Kind kind;
	private final long integer;
	private final double number;
	private final String text;
	private final double[] numbers;
	private final String[] strings;
	private final Map<String, MetadataValue> entries;

	private MetadataValue(Kind kind, long integer, double number, String text,
			double[] numbers, String[] strings, Map<String, MetadataValue> entries)
	{
		this.kind = kind;
		this.integer = integer;
		this.number = number;
		this.text = text;
		this.numbers = numbers;
		this.strings = strings;
		this.entries = entries;
	}

	public static MetadataValue ofInteger(long value) {

		return new MetadataValue(Kind.INTEGER, value, value, null, null, null, null);
	}

	public static MetadataValue ofFloat(double value) {

		return new MetadataValue(Kind.FLOAT, 0, value, null, null, null, null);
	}

	public static MetadataValue ofString(String value) {

		Objects.requireNonNull(value, "value");

		return new MetadataValue(Kind.STRING, 0, 0, value, null, null, null);
	}

	/**
	 * A single number with a unit, e.g. {@code (5.7, "s")}.
	 */
	public static MetadataValue ofQuantity(double value, String unit) {

		Objects.requireNonNull(unit, "unit");

		return new MetadataValue(Kind.QUANTITY, 0, value, unit, null, null, null);
	}

	/**
	 * Several numbers sharing one unit, e.g. {@code ((1.0, 2.0), "mm")}.
	 */
	public static MetadataValue ofQuantityTuple(double[] values, String unit) {

		Objects.requireNonNull(unit, "unit");

		return new MetadataValue(Kind.QUANTITY_TUPLE, 0, 0, unit, values.clone(), null, null);
	}

	public static MetadataValue ofNumbers(double... values) {

		return new MetadataValue(Kind.NUMBER_TUPLE, 0, 0, null, values.clone(), null, null);
	}

	public static MetadataValue ofStrings(String... values) {

		return new MetadataValue(Kind.STRING_TUPLE, 0, 0, null, null, values.clone(), null);
	}

	public static MetadataValue ofEntries(Map<String, MetadataValue> values) {

		Map<String, MetadataValue> copy = Collections.unmodifiableMap(new LinkedHashMap<>(values));

		return new MetadataValue(Kind.ENTRIES, 0, 0, null, null, null, copy);
	}

	public Kind kind() {

		return kind;
	}

	public boolean isFloat() {

		return kind == Kind.FLOAT;
	}

	/**
	 * True for integers, floats and single quantities.
	 */
	public boolean isScalarNumber() {

		return kind == Kind.INTEGER || kind == Kind.FLOAT || kind == Kind.QUANTITY;
	}

	public long asLong() {

		if (kind != Kind.INTEGER)
			throw new IllegalStateException("not an integer value: " + this);

		return integer;
	}

	public double asDouble() {

		if (!isScalarNumber())
			throw new IllegalStateException("not a scalar number: " + this);

		return number;
	}

	public String asString() {

		if (kind != Kind.STRING)
			throw new IllegalStateException("not a string value: " + this);

		return text;
	}

	/**
	 * @return The unit of a quantity or quantity tuple.
	 */
	public String unit() {

		if (kind != Kind.QUANTITY && kind != Kind.QUANTITY_TUPLE)
			throw new IllegalStateException("value carries no unit: " + this);

		return text;
	}

	public double[] numbers() {

		if (numbers == null)
			throw new IllegalStateException("not a number tuple: " + this);

		return numbers.clone();
	}

	public String[] strings() {

		if (strings == null)
			throw new IllegalStateException("not a string tuple: " + this);

		return strings.clone();
	}

	public Map<String, MetadataValue> entries() {

		if (entries == null)
			throw new IllegalStateException("not an entry map: " + this);

		return entries;
	}

	@Override
	public boolean equals(Object o) {

		if (this == o)
			return true;

		if (!(o instanceof MetadataValue))
			return false;

		MetadataValue other = (MetadataValue) o;

		return kind == other.kind &&
				integer == other.integer &&
				Double.compare(number, other.number) == 0 &&
				Objects.equals(text, other.text) &&
				Arrays.equals(numbers, other.numbers) &&
				Arrays.equals(strings, other.strings) &&
				Objects.equals(entries, other.entries);
	}

	@Override
	public int hashCode() {

		int result = Objects.hash(kind, integer, number, text, entries);

		result = 31 * result + Arrays.hashCode(numbers);

		result = 31 * result + Arrays.hashCode(strings);

		return result;
	}

	@Override
	public String toString() {

		switch (kind) {
			case INTEGER:
				return Long.toString(integer);
			case FLOAT:
				return Double.toString(number);
			case STRING:
				return "'" + text + "'";
			case QUANTITY:
				return "(" + number + ", '" + text + "')";
			case QUANTITY_TUPLE:
				return "(" + Arrays.toString(numbers) + ", '" + text + "')";
			case NUMBER_TUPLE:
				return Arrays.toString(numbers);
			case STRING_TUPLE:
				return Arrays.toString(strings);
			case ENTRIES:
				return entries.toString();
			default:
				return "None";
		}
	}
}
