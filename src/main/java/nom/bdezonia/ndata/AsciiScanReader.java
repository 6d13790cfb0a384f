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
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the whitespace separated data rows of a NICOS ASCII scan file into
 * a {@link ScanTable}.
 *
 * @author Barry DeZonia
 */
public class AsciiScanReader {

	private static final Logger logger = LoggerFactory.getLogger(AsciiScanReader.class);

	// do not instantiate

	private AsciiScanReader() { }

	/**
	 * Reads the table of a scan file. The column layout comes from the
	 * override when one is given, otherwise the names are taken from the
	 * {@code Scan data} section of the header and the types are inferred
	 * from the first data row.
	 *
	 * @param path
	 * @param metadata The parsed header of the same file, may be null when
	 *   an override is given.
	 * @param override Column layout from the instrument settings, or null.
	 * @return
	 * @throws IOException if the file cannot be read or its layout cannot
	 *   be determined.
	 */
	public static

		ScanTable

			read(Path path, MetadataDocument metadata, ArrayFormat override) throws IOException
	{
		List<String[]> rows = new ArrayList<>();

		try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {

			String line;

			while ((line = br.readLine()) != null) {

				int comment = line.indexOf('#');

				String content = (comment >= 0 ? line.substring(0, comment) : line).trim();

				if (content.isEmpty())
					continue;

				rows.add(content.split("\\s+"));
			}
		}

		return toTable(rows, metadata, override, path.toString());
	}

	static ScanTable toTable(List<String[]> rows, MetadataDocument metadata, ArrayFormat override, String source)
			throws IOException
	{
		ArrayFormat format = override;

		if (format == null) {

			MetadataValue names = metadata == null
					? null
					: metadata.get(HeaderParser.SCAN_DATA, HeaderParser.NAMES).orElse(null);

			if (names == null || rows.isEmpty())
				throw new IOException("The data format is not correctly specified for " + source);

			format = inferFormat(rows.get(0), Arrays.asList(names.strings()));
		}

		int numCols = format.columnCount();

		Object[] columns = new Object[numCols];

		for (int c = 0; c < numCols; c++) {

			switch (format.types().get(c)) {
				case INT64:
					columns[c] = new long[rows.size()];
					break;
				case FLOAT64:
					columns[c] = new double[rows.size()];
					break;
				default:
					columns[c] = new String[rows.size()];
			}
		}

		for (int r = 0; r < rows.size(); r++) {

			String[] cells = rows.get(r);

			if (cells.length != numCols)
				throw new IOException(source + ": row " + r + " has " + cells.length + " cells, expected " + numCols);

			for (int c = 0; c < numCols; c++) {

				try {

					switch (format.types().get(c)) {
						case INT64:
							((long[]) columns[c])[r] = Long.parseLong(cells[c]);
							break;
						case FLOAT64:
							((double[]) columns[c])[r] = Double.parseDouble(cells[c]);
							break;
						default:
							((String[]) columns[c])[r] = cells[c];
					}

				} catch (NumberFormatException e) {

					throw new IOException(source + ": cell '" + cells[c] + "' of column '" + format.names().get(c) +
							"' is not " + format.types().get(c), e);
				}
			}
		}

		logger.debug("read {} rows of {} from {}", rows.size(), format, source);

		return new ScanTable(format, rows.size(), columns);
	}

	/**
	 * Guesses column types from the cells of one row.
	 *
	 * @param cells
	 * @param names
	 * @return
	 * @throws IOException when the number of names and cells differ.
	 */
	public static

		ArrayFormat

			inferFormat(String[] cells, List<String> names) throws IOException
	{
		if (cells.length != names.size())
			throw new IOException("header names " + names.size() + " columns but the data has " + cells.length);

		List<ColumnType> types = new ArrayList<>();

		for (String cell : cells) {

			types.add(ValueClassifier.columnType(cell));
		}

		return new ArrayFormat(names, types);
	}
}
