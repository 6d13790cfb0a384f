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
package nom.bdezonia.ndata.mask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.AcquisitionMode;
import nom.bdezonia.ndata.ConfigurationException;
import nom.bdezonia.ndata.InstrumentSettings;
import nom.bdezonia.ndata.InstrumentSettingsLoader;
import nom.bdezonia.ndata.RawDataArray;

class SectorMaskTest {

	private static final InstrumentSettings MIRA = InstrumentSettingsLoader.bundled().load("MIRA", "PAD");

	@Test
	void sectorBetweenTenAndEightyDegrees() {

		SectorMask mask = new SectorMask(16, 8, 8, 0, 3, 10, 80, MIRA);

		// (dx, dy) in {1, 2} x {1, 2}
		assertThat(mask.total()).isEqualTo(4);
		assertThat(mask.weight(9, 9)).isEqualTo(1);
		assertThat(mask.weight(10, 9)).isEqualTo(1);
		assertThat(mask.weight(9, 10)).isEqualTo(1);
		assertThat(mask.weight(10, 10)).isEqualTo(1);
		assertThat(mask.weight(9, 8)).isEqualTo(0);
		assertThat(mask.weight(8, 8)).isEqualTo(0);
		assertThat(mask.weight(7, 9)).isEqualTo(0);
	}

	@Test
	void sectorWrapsThroughZero() {

		SectorMask mask = new SectorMask(16, 8, 8, 0, 3, 350, 10, MIRA);

		assertThat(mask.total()).isEqualTo(4);
		assertThat(mask.weight(8, 8)).isEqualTo(1);
		assertThat(mask.weight(9, 8)).isEqualTo(1);
		assertThat(mask.weight(11, 8)).isEqualTo(1);
		assertThat(mask.weight(11, 9)).isEqualTo(0);
		assertThat(mask.weight(5, 8)).isEqualTo(0);
	}

	@Test
	void ringMomentumTransfer() {

		SectorMask ring = new SectorMask(128, 64, 64, 5, 5, 0, 360, MIRA);

		assertThat(ring.total()).isEqualTo(12);

		double angle = Math.atan(5 * DetectorMask.PIXEL_SIZE / 1.5);

		double expected = 4 * Math.PI / 4.33 * Math.sin(angle / 2);

		MomentumTransfer q = ring.momentumTransfer();

		assertThat(q.q()).isCloseTo(expected, within(1e-12));
		assertThat(q.error()).isCloseTo(0, within(1e-12));
	}

	@Test
	void beamCentreHasNoMomentumTransfer() {

		SectorMask mask = new SectorMask(16, 8, 8, 0, 3, 0, 360, MIRA);

		assertThat(mask.scatteringVector(8, 8)).containsExactly(0, 0, 0);
		assertThat(mask.scatteringVector(8, 9)[0]).isPositive();
		assertThat(mask.scatteringVector(8, 9)[2]).isNegative();
	}

	@Test
	void emptySectorGivesNaN() {

		SectorMask mask = new SectorMask(16, 100, 100, 0, 2, 0, 360, MIRA);

		assertThat(mask.total()).isZero();
		assertThat(mask.momentumTransfer().q()).isNaN();
	}

	@Test
	void applySumsInsidePixels() {

		int[] counts = new int[16 * 16];

		Arrays.fill(counts, 3);

		SectorMask mask = new SectorMask(16, 8, 8, 0, 3, 10, 80, MIRA);

		assertThat(mask.apply(RawDataArray.of(new long[] {16, 16}, counts))).containsExactly(12);
	}

	@Test
	void instrumentConstantsAreRequired() {

		InstrumentSettings bare = InstrumentSettings.of("MIRA", AcquisitionMode.PAD);

		assertThatThrownBy(() -> new SectorMask(16, 8, 8, 0, 3, 0, 360, bare))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("distance_SD");
	}
}
