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
package nom.bdezonia.ndata.mieze;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a {@link ReductionSummary} as a text table. Parameters that are
 * the same for every run come first as {@code # name = value} lines. Then
 * a {@code #} line names the columns: the varying parameters, contrast and
 * contrast_err, and optionally the contrast and error of every foil. One
 * fixed width row per run follows.
 *
 * @author Barry DeZonia
 */
public class ReductionTableWriter {

	private static final String NUMBER_FORMAT = "%-18.10e";

	private static final String NAME_FORMAT = "%-18s";

	private final boolean perFoil;

	/**
	 * @param perFoil Add the contrast and error of every foil to each row.
	 */
	public ReductionTableWriter(boolean perFoil) {

		this.perFoil = perFoil;
	}

	public void write(ReductionSummary summary, Path path) throws IOException {

		try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

			write(summary, writer);
		}
	}

	public void write(ReductionSummary summary, Writer writer) throws IOException {

		List<ParameterColumn> varying = new ArrayList<>();

		for (ParameterColumn column : summary.parameters().values()) {

			if (column.isScalar())
				writer.write("# " + column.alias() + " = " + format(column.scalar()).trim() + "\n");
			else
				varying.add(column);
		}

		List<String> names = new ArrayList<>();

		for (ParameterColumn column : varying) {

			names.add(column.alias());
		}

		names.add("contrast");
		names.add("contrast_err");

		int foils = foilCount(summary);

		for (int f = 0; f < foils; f++) {

			names.add("contrast_" + f);
			names.add("contrast_err_" + f);
		}

		StringBuilder header = new StringBuilder("#");

		for (String name : names) {

			header.append(' ').append(String.format(NAME_FORMAT, name));
		}

		writer.write(header.toString().stripTrailing() + "\n");

		for (int run = 0; run < summary.runCount(); run++) {

			StringBuilder row = new StringBuilder(" ");

			for (ParameterColumn column : varying) {

				row.append(' ').append(format(column.values().get(run)));
			}

			ReductionJobResult result = summary.results().get(run);

			row.append(' ').append(format(result.contrast()));
			row.append(' ').append(format(result.contrastErr()));

			for (int f = 0; f < foils; f++) {

				SineFitResult fit = result.fits().get(f);

				row.append(' ').append(format(fit.contrast()));
				row.append(' ').append(format(fit.contrastErr()));
			}

			writer.write(row.toString().stripTrailing() + "\n");
		}
	}

	private int foilCount(ReductionSummary summary) {

		if (!perFoil || summary.runCount() == 0)
			return 0;

		int foils = Integer.MAX_VALUE;

		for (ReductionJobResult r : summary.results()) {

			foils = Math.min(foils, r.fits().size());
		}

		return foils;
	}

	private static String format(double value) {

		return String.format(Locale.ROOT, NUMBER_FORMAT, value);
	}
}
