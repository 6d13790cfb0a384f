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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.RawDataArray;

class RoiExtractorTest {

	// shape (2, 3, 4): value = 100 f + 10 y + x
	private static RawDataArray frames() {

		int[] counts = new int[24];

		int i = 0;

		for (int f = 0; f < 2; f++) {

			for (int y = 0; y < 3; y++) {

				for (int x = 0; x < 4; x++) {

					counts[i++] = 100 * f + 10 * y + x;
				}
			}
		}

		return RawDataArray.of(new long[] {2, 3, 4}, counts);
	}

	@Test
	void sumsEachFrameInsideTheWindow() {

		assertThat(RoiExtractor.extract(frames(), RoiSpec.lrbt(1, 3, 0, 2))).containsExactly(26, 426);
		assertThat(RoiExtractor.extract(frames(), RoiSpec.lbwh(1, 0, 2, 2))).containsExactly(26, 426);
	}

	@Test
	void windowIsCutToTheFrame() {

		assertThat(RoiExtractor.extract(frames(), RoiSpec.lrbt(-5, 10, 2, 99))).containsExactly(86, 486);
		assertThat(RoiExtractor.extract(frames(), RoiSpec.lrbt(5, 9, 0, 3))).containsExactly(0, 0);
	}

	@Test
	void singleFrame() {

		RawDataArray frame = frames().channel(1);

		assertThat(RoiExtractor.extract(frame, RoiSpec.lrbt(0, 1, 0, 1))).containsExactly(100);
	}

	@Test
	void maskIsNotSupported() {

		assertThatThrownBy(() -> RoiExtractor.extract(frames(), RoiSpec.mask(new double[][] {{1}})))
				.isInstanceOf(UnsupportedOperationException.class);
	}
}
