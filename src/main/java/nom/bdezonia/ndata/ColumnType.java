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

/**
 * Storage type of one column of an ASCII scan table.
 *
 * @author Barry DeZonia
 */
public enum ColumnType {

	INT64,
	FLOAT64,
	STRING;

	/**
	 * Accepts the enum names and the numpy style codes {@code i8}, {@code f8}
	 * and {@code S<n>} used in instrument configuration files.
	 */
	public static ColumnType from(String code) {

		String c = code.trim();

		if (c.equalsIgnoreCase("i8") || c.equalsIgnoreCase("INT64"))
			return INT64;

		if (c.equalsIgnoreCase("f8") || c.equalsIgnoreCase("FLOAT64"))
			return FLOAT64;

		if (c.startsWith("S") || c.equalsIgnoreCase("STRING"))
			return STRING;

		throw new ConfigurationException("unknown column type '" + code + "'");
	}
}
