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

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.ConfigurationException;
import nom.bdezonia.ndata.DetectorFileFixtures;
import nom.bdezonia.ndata.RawDataArray;

class BootstrapReductionJobTest {

	private static final RawDataArray BEAM = RawDataArray.of(new long[] {3, 16, 32, 32},
			DetectorFileFixtures.beamCounts(3, 32, 14.3, 18.3, 0.5, 1.0));

	private static final int[] OFFSETS = {-7, 2, -4, 5};

	@Test
	void searchAroundAGivenCenter() {

		BootstrapSettings settings = new BootstrapSettings(1, 12, OFFSETS, 1.0, 42L, new double[] {14.3, 18.3});

		BootstrapReductionJob job = new BootstrapReductionJob(new LeastSquaresSineFitter(), settings,
				ResultSpec.allAverage());

		ReductionJobResult result = job.run(BEAM);

		assertThat(result.contrast()).isCloseTo(0.5, within(0.01));
		assertThat(result.fits()).hasSize(3);

		BootstrapSummary summary = result.fits().get(0).bootstrap();

		assertThat(summary).isNotNull();
		assertThat(summary.steps()).isEqualTo(12);
		assertThat(summary.validSteps()).isPositive();
		assertThat(summary.contrast()).isCloseTo(0.5, within(0.02));
		assertThat(summary.roi()).hasSize(4);

		for (SineFitResult fit : result.fits()) {

			assertThat(fit.bootstrap()).isSameAs(summary);
		}
	}

	@Test
	void sameSeedSameSearch() {

		BootstrapSettings settings = new BootstrapSettings(0, 8, OFFSETS, 1.5, 7L, new double[] {14.3, 18.3});

		BootstrapReductionJob job = new BootstrapReductionJob(new LeastSquaresSineFitter(), settings,
				ResultSpec.allAverage());

		BootstrapSummary first = job.search(BEAM);

		BootstrapSummary second = job.search(BEAM);

		assertThat(second.roi()).containsExactly(first.roi());
		assertThat(second.contrast()).isEqualTo(first.contrast());
		assertThat(second.contrastErr()).isEqualTo(first.contrastErr());
	}

	@Test
	void centerIsFoundWhenNotGiven() {

		BootstrapSettings settings = BootstrapSettings.of(0, 3, 0.0, 1L);

		BootstrapReductionJob job = new BootstrapReductionJob(new LeastSquaresSineFitter(), settings,
				ResultSpec.allAverage());

		BootstrapSummary summary = job.search(BEAM);

		assertThat(summary.roi()).containsExactly(11, 20, 10, 19);
		assertThat(summary.validSteps()).isEqualTo(3);
		assertThat(summary.contrast()).isCloseTo(0.5, within(0.01));
	}

	// answers A = contrast, y0 = 1 so the contrast error equals the A error
	private static SineFitter scripted(double[] contrasts, double[] errors, int[] calls) {

		return (x, series, weights) -> {

			int i = calls[0]++;

			return SineFitResult.fromParameters(new double[] {contrasts[i], SineModel.OMEGA, 1.0, 1.0},
					new double[] {errors[i], Double.NaN, 0.1, 0.0}, 1.0, 1.0, true);
		};
	}

	@Test
	void representativeIsTheValidTrialNearestTheEstimate() {

		double[] contrasts = {0.30, Double.NaN, 0.50, 0.62, 0.90};

		double[] errors = {0.1, 0.1, 0.2, 0.1, Double.NaN};

		int[] calls = {0};

		BootstrapSettings settings = new BootstrapSettings(0, 5, new int[] {-10, 10, -10, 10}, 1.0, 3L,
				new double[] {14.3, 18.3});

		BootstrapReductionJob job = new BootstrapReductionJob(scripted(contrasts, errors, calls), settings,
				ResultSpec.allAverage());

		BootstrapSummary summary = job.search(BEAM);

		// the same draws the search makes around the base window {8, 28, 4, 24}
		NormalDistribution noise = new NormalDistribution(new Well19937c(3L), 0, 1.0);

		int[][] windows = new int[5][];

		for (int s = 0; s < 5; s++) {

			windows[s] = new int[] {8, 28, 4, 24};

			for (int i = 0; i < 4; i++) {

				windows[s][i] += (int) Math.round(noise.sample());
			}
		}

		// weights 100, 25 and 100 for trials 0, 2 and 3
		double expected = (0.30 * 100 + 0.50 * 25 + 0.62 * 100) / 225;

		assertThat(calls[0]).isEqualTo(5);
		assertThat(summary.validSteps()).isEqualTo(3);
		assertThat(summary.contrast()).isCloseTo(expected, within(1e-12));
		assertThat(summary.contrastErr()).isCloseTo(1.0 / 15, within(1e-12));
		assertThat(summary.roi()).containsExactly(windows[2]);
	}

	@Test
	void degenerateWindowsGiveNoContrast() {

		BootstrapSettings settings = new BootstrapSettings(0, 4, new int[] {2, -7, -4, 5}, 0.0, 1L,
				new double[] {14, 18});

		BootstrapReductionJob job = new BootstrapReductionJob(new LeastSquaresSineFitter(), settings,
				ResultSpec.allAverage());

		BootstrapSummary summary = job.search(BEAM);

		assertThat(summary.validSteps()).isZero();
		assertThat(summary.contrast()).isNaN();
		assertThat(summary.roi()).containsExactly(20, 11, 10, 19);
	}

	@Test
	void invalidInput() {

		BootstrapReductionJob job = new BootstrapReductionJob(new LeastSquaresSineFitter(),
				BootstrapSettings.of(3, 2, 1.0, 1L), ResultSpec.allAverage());

		assertThatThrownBy(() -> job.run(BEAM)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> job.run(BEAM.channel(0))).isInstanceOf(IllegalArgumentException.class);

		assertThatThrownBy(() -> BootstrapSettings.of(0, 0, 1.0, 1L)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> BootstrapSettings.of(-1, 5, 1.0, 1L)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> BootstrapSettings.of(0, 5, -1.0, 1L)).isInstanceOf(ConfigurationException.class);
	}
}
