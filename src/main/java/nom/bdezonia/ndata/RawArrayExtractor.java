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
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.IntBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.storage.Storage;
import nom.bdezonia.zorbage.type.integer.int32.SignedInt32Member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the binary payload of CASCADE detector files (.tof, .pad) into a
 * {@link RawDataArray}.
 * <p>
 * The whole file is read as little endian 32 bit integers. The leading
 * values are reshaped into the richest layout the file is large enough for:
 * a time resolved file first, then a single frame. Anything beyond the
 * chosen layout, such as the text header appended by the instrument
 * control software, is dropped.
 *
 * @author Barry DeZonia
 */
public class RawArrayExtractor {

	private static final Logger logger = LoggerFactory.getLogger(RawArrayExtractor.class);

	// do not instantiate

	private RawArrayExtractor() { }

	/**
	 *
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static

		RawDataArray

			read(Path path) throws IOException
	{
		try (InputStream is = Files.newInputStream(path)) {

			RawDataArray data = read(is);

			data.setSource(path.toString());

			return data;
		}
	}

	/**
	 * Reads the stream to its end. The caller owns and closes the stream.
	 *
	 * @param is
	 * @return
	 * @throws IOException
	 */
	public static

		RawDataArray

			read(InputStream is) throws IOException
	{
		return decode(is.readAllBytes());
	}

	/**
	 * Every payload is tried as a time resolved dump first, whatever mode
	 * the file was recorded in.
	 *
	 * @param bytes
	 * @return
	 */
	public static

		RawDataArray

			decode(byte[] bytes)
	{
		IntBuffer ints = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asIntBuffer();

		long available = ints.remaining();

		for (DetectorShape shape : DetectorShape.TIME_RESOLVED.withFallbacks()) {

			long needed = shape.elementCount();

			if (available < needed) {

				logger.info("payload of {} values too small for {}, trying a simpler layout", available, shape);

				continue;
			}

			IndexedDataSource<SignedInt32Member> storage = Storage.allocate(G.INT32.construct(), needed);

			SignedInt32Member value = G.INT32.construct();

			for (int i = 0; i < needed; i++) {

				value.setV(ints.get(i));

				storage.set(i, value);
			}

			logger.debug("read {} of {} values as {}", needed, available, shape);

			return new RawDataArray(shape.dims(), storage);
		}

		throw new IllegalArgumentException("payload of " + available + " values fits no detector layout");
	}
}
