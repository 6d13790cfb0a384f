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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers the type of header values and table cells from their text.
 *
 * @author Barry DeZonia
 */
public class ValueClassifier {

	// do not instantiate

	private ValueClassifier() { }

	static final Pattern NUMBER = Pattern.compile("[+-]?\\d+[\\.e+-]{0,2}\\d*");

	static final Pattern UNIT = Pattern.compile("\\s[A-Za-z]{1,4}[\\-\\d]{0,2}$");

	static final Pattern INTEGER_CELL = Pattern.compile("[+-]?\\d+$");

	static final Pattern COLUMN_TOKEN = Pattern.compile("[A-Za-z0-9\\._\\-;]+");

	/**
	 * Classifies the value part of a {@code key : value} header line.
	 *
	 * <ol>
	 * <li>one number and a unit: a quantity</li>
	 * <li>several numbers and a unit: a quantity tuple</li>
	 * <li>several numbers, no unit: a number tuple, or a string tuple when
	 *     a match is not a valid float</li>
	 * <li>one number, no unit: an integer when lossless, else a float</li>
	 * <li>no number: the trimmed text</li>
	 * </ol>
	 *
	 * @param value The raw text after the first colon.
	 * @return The classified value.
	 * @throws NumberFormatException when a lone numeric match is not a
	 *   valid number (for example {@code "1e"}).
	 */
	public static

		MetadataValue

			classify(String value)
	{
		List<String> numbers = findAll(NUMBER, value);

		Matcher unitMatcher = UNIT.matcher(value);

		String unit = unitMatcher.find() ? unitMatcher.group().trim() : null;

		if (numbers.size() == 1 && unit != null) {

			return MetadataValue.ofQuantity(Double.parseDouble(numbers.get(0)), unit);
		}
		else if (numbers.size() > 1 && unit != null) {

			return MetadataValue.ofQuantityTuple(parseAll(numbers), unit);
		}
		else if (numbers.size() > 1) {

			try {

				return MetadataValue.ofNumbers(parseAll(numbers));

			} catch (NumberFormatException e) {

				return MetadataValue.ofStrings(numbers.toArray(new String[0]));
			}
		}
		else if (numbers.size() == 1) {

			String number = numbers.get(0);

			try {

				return MetadataValue.ofInteger(Long.parseLong(number));

			} catch (NumberFormatException e) {

				return MetadataValue.ofFloat(Double.parseDouble(number));
			}
		}

		return MetadataValue.ofString(value.trim());
	}

	/**
	 * Infers the storage type of an ASCII scan column from one of its cells.
	 *
	 * @param cell
	 * @return INT64 for integer literals, FLOAT64 for cells that start with a
	 *   numeric literal and read as a double, STRING otherwise.
	 */
	public static

		ColumnType

			columnType(String cell)
	{
		if (INTEGER_CELL.matcher(cell).matches())
			return ColumnType.INT64;

		if (NUMBER.matcher(cell).lookingAt() && isDouble(cell))
			return ColumnType.FLOAT64;

		return ColumnType.STRING;
	}

	/**
	 * Splits a column name or unit line of a scan data section.
	 */
	public static

		List<String>

			columnTokens(String line)
	{
		return findAll(COLUMN_TOKEN, line);
	}

	static

		boolean

			isDouble(String text)
	{
		try {

			Double.parseDouble(text);

			return true;

		} catch (NumberFormatException e) {

			return false;
		}
	}

	private static

		List<String>

			findAll(Pattern pattern, String text)
	{
		List<String> matches = new ArrayList<>();

		Matcher m = pattern.matcher(text);

		while (m.find()) {

			matches.add(m.group());
		}

		return matches;
	}

	private static

		double[]

			parseAll(List<String> numbers)
	{
		double[] values = new double[numbers.size()];

		for (int i = 0; i < values.length; i++) {

			values[i] = Double.parseDouble(numbers.get(i));
		}

		return values;
	}
}
