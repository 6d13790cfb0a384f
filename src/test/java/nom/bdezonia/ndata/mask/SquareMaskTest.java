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

import java.util.List;

import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.AcquisitionMode;
import nom.bdezonia.ndata.InstrumentSettings;
import nom.bdezonia.ndata.RawDataArray;

class SquareMaskTest {

	private static final InstrumentSettings MIRA = InstrumentSettings.of("MIRA", AcquisitionMode.PAD);

	@Test
	void rectangleRunsAlongColumnsAndRows() {

		SquareMask mask = new SquareMask(8, MIRA, 1, 3, 2, 2);

		assertThat(mask.total()).isEqualTo(6);
		assertThat(mask.weight(2, 1)).isEqualTo(1);
		assertThat(mask.weight(3, 3)).isEqualTo(1);
		assertThat(mask.weight(1, 2)).isEqualTo(0);
		assertThat(mask.weight(2, 4)).isEqualTo(0);
	}

	@Test
	void rectanglesAreJoinedAndCut() {

		SquareMask mask = new SquareMask(8, MIRA, 1, 3, 2, 2, 6, 5, 7, 4);

		assertThat(mask.total()).isEqualTo(8);
		assertThat(mask.weight(7, 7)).isEqualTo(1);
		assertThat(mask.rectangles()).hasSize(2);
		assertThat(mask.rectangles().get(1)).containsExactly(6, 5, 7, 4);
	}

	@Test
	void applyContractsEachFrame() {

		int[] counts = new int[2 * 8 * 8];

		for (int i = 0; i < counts.length; i++) {

			counts[i] = i < 64 ? 1 : 2;
		}

		double[] sums = new SquareMask(8, MIRA, 1, 3, 2, 2).apply(RawDataArray.of(new long[] {2, 8, 8}, counts));

		assertThat(sums).containsExactly(6, 12);
	}

	@Test
	void combineMultipliesEveryPair() {

		SquareMask left = new SquareMask(8, MIRA, 0, 4, 0, 8);

		SquareMask top = new SquareMask(8, MIRA, 0, 8, 4, 4);

		SquareMask all = new SquareMask(8, MIRA, 0, 8, 0, 8);

		List<List<double[][]>> combined = DetectorMask.combine(List.of(left, all), List.of(top, all));

		assertThat(combined).hasSize(2);
		assertThat(combined.get(0)).hasSize(2);
		assertThat(combined.get(0).get(0)[5][2]).isEqualTo(1);
		assertThat(combined.get(0).get(0)[5][6]).isEqualTo(0);
		assertThat(combined.get(0).get(0)[1][2]).isEqualTo(0);
		assertThat(combined.get(1).get(1)[1][6]).isEqualTo(1);

		assertThatThrownBy(() -> DetectorMask.combine(List.of(left), List.of(new SquareMask(4, MIRA, 0, 1, 0, 1))))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void rectanglesNeedFourValues() {

		assertThatThrownBy(() -> new SquareMask(8, MIRA, 1, 2, 3))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
