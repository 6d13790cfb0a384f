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

import java.io.IOException;
import java.util.Objects;

import nom.bdezonia.ndata.CascadeLoader;
import nom.bdezonia.ndata.InstrumentSettings;
import nom.bdezonia.ndata.LoadedFile;
import nom.bdezonia.ndata.MetadataDocument;
import nom.bdezonia.ndata.RawDataArray;

/**
 * The reduction of one time resolved detector file: its header and the
 * contrast its job found.
 *
 * @author Barry DeZonia
 */
public final class Reduction {

	private final int fileNumber;

	private final MetadataDocument metadata;

	private final ReductionJobResult result;

	public Reduction(int fileNumber, MetadataDocument metadata, ReductionJobResult result) {

		this.fileNumber = fileNumber;
		this.metadata = Objects.requireNonNull(metadata, "metadata");
		this.result = Objects.requireNonNull(result, "result");
	}

	/**
	 * Loads a file, keeps the foils the instrument settings name (all foils
	 * when none are named) and runs the job on them.
	 *
	 * @param loader
	 * @param fileNumber
	 * @param job
	 * @return
	 * @throws IOException
	 */
	public static

		Reduction

			run(CascadeLoader loader, int fileNumber, ReductionJob job) throws IOException
	{
		LoadedFile<RawDataArray> file = loader.load(fileNumber);

		RawDataArray raw = file.payload().orElseThrow(() ->
				new IllegalStateException("reading raw data is switched off in " + loader.settings()));

		if (raw.numDimensions() != 4)
			throw new IllegalArgumentException(file.path() + " holds " + raw + ", not time resolved counts");

		InstrumentSettings settings = loader.settings();

		RawDataArray selected = settings.foils().isEmpty() ? raw : raw.selectChannels(settings.foilIndices());

		MetadataDocument metadata = file.metadata().orElse(MetadataDocument.builder().build());

		return new Reduction(fileNumber, metadata, job.run(selected));
	}

	public int fileNumber() {

		return fileNumber;
	}

	public MetadataDocument metadata() {

		return metadata;
	}

	public ReductionJobResult result() {

		return result;
	}
}
