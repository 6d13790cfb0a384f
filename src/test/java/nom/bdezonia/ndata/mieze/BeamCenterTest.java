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
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.RawDataArray;

class BeamCenterTest {

	private static RawDataArray blob(double background, double cy, double cx) {

		int size = 128;

		int[] counts = new int[size * size];

		for (int y = 0; y < size; y++) {

			for (int x = 0; x < size; x++) {

				double r2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);

				counts[y * size + x] = (int) Math.round(background + 1000 * Math.exp(-r2 / 18));
			}
		}

		return RawDataArray.of(new long[] {size, size}, counts);
	}

	@Test
	void gaussianFitFindsTheBeam() {

		RawDataArray data = blob(10, 40, 70);

		double[] center = BeamCenter.fit(data);

		assertThat(center[0]).isCloseTo(40, within(0.05));
		assertThat(center[1]).isCloseTo(70, within(0.05));

		double[] fromImage = BeamCenter.fitImage(data.image());

		assertThat(fromImage[0]).isCloseTo(center[0], within(1e-9));
		assertThat(fromImage[1]).isCloseTo(center[1], within(1e-9));
	}

	@Test
	void centerOfMassIsPulledByTheBackground() {

		double[] clean = BeamCenter.centerOfMass(blob(0, 40, 70));

		assertThat(clean[0]).isCloseTo(40, within(1e-6));
		assertThat(clean[1]).isCloseTo(70, within(1e-6));

		double[] noisy = BeamCenter.centerOfMass(blob(10, 40, 70));

		assertThat(noisy[0]).isBetween(41.0, 63.5);
	}

	@Test
	void emptyProfileHasNoCenter() {

		assertThatThrownBy(() -> BeamCenter.fitProfile(new double[10]))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void centroidOfAProfile() {

		assertThat(BeamCenter.centroid(new double[] {0, 1, 2, 1, 0})).isEqualTo(2.0);
	}
}
