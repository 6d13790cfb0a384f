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
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the header and the payload of numbered measurement files. The
 * instrument settings decide whether each part is read and which header
 * keys are kept.
 *
 * @author Barry DeZonia
 *
 * @param <P> The payload type.
 */
public abstract class FileLoader<P> {

	private static final Logger logger = LoggerFactory.getLogger(FileLoader.class);

	private final DataPathResolver resolver;

	private final InstrumentSettings settings;

	protected FileLoader(DataPathResolver resolver, InstrumentSettings settings) {

		this.resolver = Objects.requireNonNull(resolver, "resolver");
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	public DataPathResolver resolver() {

		return resolver;
	}

	public InstrumentSettings settings() {

		return settings;
	}

	/**
	 *
	 * @param fileNumber
	 * @return
	 * @throws IOException
	 */
	public LoadedFile<P> load(int fileNumber) throws IOException {

		Path path = resolver.resolve(fileNumber);

		logger.debug("loading file {} from {}", fileNumber, path);

		MetadataDocument header = null;

		if (settings.readsMetadata() || needsHeaderForPayload())
			header = readHeader(path);

		MetadataDocument metadata = null;

		if (settings.readsMetadata()) {

			MetadataFilter filter = settings.metadataFilter();

			metadata = filter == null ? header : header.filter(filter);
		}

		P payload = settings.readsRawdata() ? readPayload(path, header) : null;

		return new LoadedFile<>(fileNumber, path, metadata, payload);
	}

	/**
	 * @return True when the payload cannot be read without the unfiltered
	 *   header.
	 */
	protected boolean needsHeaderForPayload() {

		return false;
	}

	protected abstract MetadataDocument readHeader(Path path) throws IOException;

	/**
	 * @param header The unfiltered header when one was read, else null.
	 */
	protected abstract P readPayload(Path path, MetadataDocument header) throws IOException;
}
