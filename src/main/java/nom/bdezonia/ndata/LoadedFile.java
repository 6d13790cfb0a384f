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

import java.nio.file.Path;
import java.util.Optional;

/**
 * What a {@link FileLoader} read from one file. Either part is absent when
 * the instrument settings switched it off.
 *
 * @author Barry DeZonia
 *
 * @param <P> The payload type.
 */
public final class LoadedFile<P> {

	private final int fileNumber;

	private final Path path;

	private final MetadataDocument metadata;

	private final P payload;

	LoadedFile(int fileNumber, Path path, MetadataDocument metadata, P payload) {

		this.fileNumber = fileNumber;
		this.path = path;
		this.metadata = metadata;
		this.payload = payload;
	}

	public int fileNumber() {

		return fileNumber;
	}

	public Path path() {

		return path;
	}

	public Optional<MetadataDocument> metadata() {

		return Optional.ofNullable(metadata);
	}

	public Optional<P> payload() {

		return Optional.ofNullable(payload);
	}
}
