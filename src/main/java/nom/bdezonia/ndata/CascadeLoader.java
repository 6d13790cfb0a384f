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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads the .tof and .pad files NICOS writes from CASCADE detector output.
 *
 * @author Barry DeZonia
 */
public class CascadeLoader extends FileLoader<RawDataArray> {

	private final HeaderParser parser = new HeaderParser(HeaderDialect.CASCADE);

	public CascadeLoader(DataPathResolver resolver, InstrumentSettings settings) {

		super(resolver, settings);

		if (!settings.mode().isBinary())
			throw new ConfigurationException(settings.mode() + " files are not CASCADE detector files");
	}

	@Override
	protected MetadataDocument readHeader(Path path) throws IOException {

		return parser.parse(path);
	}

	@Override
	protected RawDataArray readPayload(Path path, MetadataDocument header) throws IOException {

		return RawArrayExtractor.read(path);
	}
}
