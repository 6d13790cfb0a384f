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
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes synthetic CASCADE detector files: little endian int32 counts
 * followed by a text header.
 *
 * @author Barry DeZonia
 */
public class DetectorFileFixtures {

	// do not instantiate

	private DetectorFileFixtures() { }

	public static final int TOF_SUM = 19271934;

	public static final int PAD_SUM = 28696;

	public static final String HEADER =
			"\n" +
			"###File Info\n" +
			"filename : 00123456.tof\n" +
			"url : https://example.org/p12345\n" +
			"###Sample\n" +
			"samplename : test sample\n" +
			"echotime : 0.25\n" +
			"temperature : 5.7 K\n" +
			"position : 1.0 2.0 3.0 mm\n" +
			"###Detector\n" +
			"counter : monitor1 : 42\n" +
			"started : 2017-10-27 : 14 : 23\n";

	public static void writeCascade(Path path, int[] counts, String header) throws IOException {

		ByteBuffer buf = ByteBuffer.allocate(counts.length * 4).order(ByteOrder.LITTLE_ENDIAN);

		for (int c : counts) {

			buf.putInt(c);
		}

		try (OutputStream os = Files.newOutputStream(path)) {

			os.write(buf.array());

			os.write(header.getBytes(StandardCharsets.UTF_8));
		}
	}

	/**
	 * Time resolved counts summing to {@link #TOF_SUM}. The first count is
	 * -1 so the payload does not decode as text.
	 */
	public static int[] tofCounts() {

		int n = (int) DetectorShape.TIME_RESOLVED.elementCount();

		int[] counts = new int[n];

		counts[0] = -1;

		int extra = TOF_SUM + 1 - 9 * (n - 1);

		for (int i = 1; i < n; i++) {

			counts[i] = i <= extra ? 10 : 9;
		}

		return counts;
	}

	/**
	 * Single frame counts summing to {@link #PAD_SUM}.
	 */
	public static int[] padCounts() {

		int n = (int) DetectorShape.SINGLE_FRAME.elementCount();

		int[] counts = new int[n];

		int extra = PAD_SUM - n;

		for (int i = 0; i < n; i++) {

			counts[i] = i < extra ? 2 : 1;
		}

		return counts;
	}

	/**
	 * A modulated beam spot: every pixel follows
	 * {@code B(y,x) (1 + contrast sin(pi/8 t + phase))} where B is a
	 * Gaussian spot on a flat background.
	 *
	 * @param foils
	 * @param size Pixels along x and y.
	 * @param cy
	 * @param cx
	 * @param contrast
	 * @param phase
	 * @return Counts shaped (foil, time bin, y, x), flattened.
	 */
	public static int[] beamCounts(int foils, int size, double cy, double cx, double contrast, double phase) {

		int bins = DetectorShape.TIME_BINS;

		int[] counts = new int[foils * bins * size * size];

		int i = 0;

		for (int f = 0; f < foils; f++) {

			for (int t = 0; t < bins; t++) {

				double modulation = 1 + contrast * Math.sin(2 * Math.PI / bins * t + phase);

				for (int y = 0; y < size; y++) {

					for (int x = 0; x < size; x++) {

						double r2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);

						double spot = 10 + 1000 * Math.exp(-r2 / (2 * 3.0 * 3.0));

						counts[i++] = (int) Math.round(spot * modulation);
					}
				}
			}
		}

		return counts;
	}
}
