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
 * The data rows of an ASCII scan file: one named, typed column per scanned
 * or measured quantity.
 *
 * @author Barry DeZonia
 */
public final class ScanTable {

	private static final Pattern DIGITS = Pattern.compile("\\d+");

	private final ArrayFormat format;

	private final int rows;

	// one long[], double[] or String[] per column

	private final Object[] columns;

	ScanTable(ArrayFormat format, int rows, Object[] columns) {

		this.format = format;
		this.rows = rows;
		this.columns = columns;
	}

	public ArrayFormat format() {

		return format;
	}

	public List<String> names() {

		return format.names();
	}

	public int rowCount() {

		return rows;
	}

	public int columnCount() {

		return format.columnCount();
	}

	public ColumnType type(String name) {

		return format.types().get(indexOf(name));
	}

	/**
	 * @return The column as doubles. Integer columns are widened.
	 */
	public double[] doubles(String name) {

		int c = indexOf(name);

		switch (format.types().get(c)) {
			case FLOAT64:
				return ((double[]) columns[c]).clone();
			case INT64:
				long[] longs = (long[]) columns[c];
				double[] widened = new double[longs.length];
				for (int i = 0; i < longs.length; i++) {
					widened[i] = longs[i];
				}
				return widened;
			default:
				throw new IllegalStateException("column '" + name + "' holds text");
		}
	}

	public long[] longs(String name) {

		int c = indexOf(name);

		if (format.types().get(c) != ColumnType.INT64)
			throw new IllegalStateException("column '" + name + "' is not an integer column");

		return ((long[]) columns[c]).clone();
	}

	/**
	 * @return Any cell as text.
	 */
	public String cell(int row, int column) {

		Object col = columns[column];

		switch (format.types().get(column)) {
			case INT64:
				return Long.toString(((long[]) col)[row]);
			case FLOAT64:
				return Double.toString(((double[]) col)[row]);
			default:
				return ((String[]) col)[row];
		}
	}

	/**
	 * Reads the detector file number each scan point refers to: the first
	 * run of digits in the last column, usually the name of the detector
	 * file written for that point.
	 *
	 * @return One file number per row.
	 * @throws IllegalStateException if a row names no number, or one
	 *   beyond the range of a long.
	 */
	public List<Long> fileNumbers() {

		List<Long> numbers = new ArrayList<>();

		int last = columnCount() - 1;

		for (int r = 0; r < rows; r++) {

			Matcher m = DIGITS.matcher(cell(r, last));

			if (!m.find())
				throw new IllegalStateException("row " + r + " names no file number: " + cell(r, last));

			try {

				numbers.add(Long.parseLong(m.group()));

			} catch (NumberFormatException e) {

				throw new IllegalStateException("row " + r + " file number is out of range: " + m.group(), e);
			}
		}

		return numbers;
	}

	private int indexOf(String name) {

		int idx = format.names().indexOf(name);

		if (idx < 0)
			throw new IllegalArgumentException("no column named '" + name + "' in " + format.names());

		return idx;
	}
}
