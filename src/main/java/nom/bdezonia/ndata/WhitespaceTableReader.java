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

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Reads a whitespace delimited numeric table into a two dimensional zorbage
 * data source indexed (column, row).
 *
 * @author Barry DeZonia
 */
public class WhitespaceTableReader {

	// do not instantiate

	private WhitespaceTableReader() { }

	/**
	 * Blank lines and text after a {@code #} are ignored. Cells that are not
	 * numbers, and cells missing from short rows, become NaN.
	 *
	 * @param path
	 * @param skipHeader Number of leading lines that are not part of the table.
	 * @return
	 * @throws EOFException when no table row follows the header.
	 * @throws IOException
	 */
	public static

		DimensionedDataSource<Float64Member>

			read(Path path, int skipHeader) throws IOException
	{
		List<String[]> rows = new ArrayList<>();

		int numCols = 0;

		try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {

			String line;

			int lineNumber = 0;

			while ((line = br.readLine()) != null) {

				lineNumber++;

				if (lineNumber <= skipHeader)
					continue;

				int comment = line.indexOf('#');

				String content = (comment >= 0 ? line.substring(0, comment) : line).trim();

				if (content.isEmpty())
					continue;

				String[] terms = content.split("\\s+");

				numCols = Math.max(numCols, terms.length);

				rows.add(terms);
			}
		}

		if (rows.isEmpty())
			throw new EOFException("no table rows after line " + skipHeader + " of " + path);

		Float64Member val = G.DBL.construct();

		DimensionedDataSource<Float64Member> data =
				DimensionedStorage.allocate(val, new long[] {numCols, rows.size()});

		TwoDView<Float64Member> vw = new TwoDView<>(data);

		for (int y = 0; y < rows.size(); y++) {

			String[] terms = rows.get(y);

			for (int x = 0; x < numCols; x++) {

				val.setV(x < terms.length ? number(terms[x]) : Double.NaN);

				vw.set(x, y, val);
			}
		}

		data.setSource(path.toString());

		return data;
	}

	private static

		double

			number(String term)
	{
		try {

			return Double.parseDouble(term);

		} catch (NumberFormatException e) {

			return Double.NaN;
		}
	}
}
