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

import java.util.List;

import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.DetectorFileFixtures;
import nom.bdezonia.ndata.RawDataArray;

class RoiReductionJobTest {

	private static RawDataArray beam(double contrast) {

		return RawDataArray.of(new long[] {3, 16, 32, 32},
				DetectorFileFixtures.beamCounts(3, 32, 14.3, 18.3, contrast, 1.0));
	}

	@Test
	void everyFoilShowsTheModulation() {

		RoiReductionJob job = new RoiReductionJob(new LeastSquaresSineFitter(),
				RoiSpec.aroundCenter(new double[] {14.3, 18.3}), ResultSpec.allAverage());

		List<SineFitResult> fits = job.fitChannels(beam(0.5));

		assertThat(fits).hasSize(3);

		for (SineFitResult fit : fits) {

			assertThat(fit.success()).isTrue();
			assertThat(fit.contrast()).isCloseTo(0.5, within(0.01));
			assertThat(fit.phase()).isCloseTo(1.0, within(0.02));
		}
	}

	@Test
	void resultCombinesTheFoils() {

		RoiReductionJob job = new RoiReductionJob(new LeastSquaresSineFitter(),
				RoiSpec.lbwh(11, 10, 9, 9), ResultSpec.selectFoil(2));

		ReductionJobResult result = job.run(beam(0.3));

		assertThat(result.format()).isEqualTo(ResultFormat.SELECT_FOIL);
		assertThat(result.contrast()).isCloseTo(0.3, within(0.01));
		assertThat(result.contrastErr()).isPositive();
		assertThat(job.roi().lrbtWindow()).containsExactly(11, 20, 10, 19);
	}

	@Test
	void needsFourDimensions() {

		RoiReductionJob job = new RoiReductionJob(new LeastSquaresSineFitter(),
				RoiSpec.lbwh(0, 0, 4, 4), ResultSpec.allAverage());

		assertThatThrownBy(() -> job.run(beam(0.5).channel(0)))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
