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

import nom.bdezonia.ndata.ConfigurationException;

class ReductionJobResultTest {

	private static SineFitResult fit(double a, double aErr, double y0, double y0Err) {

		return SineFitResult.fromParameters(
				new double[] {a, SineModel.OMEGA, 1.0, y0},
				new double[] {aErr, Double.NaN, 0.1, y0Err},
				1.0, 1.0, true);
	}

	private static final List<SineFitResult> FITS = List.of(
			fit(50, 10, 100, 0),
			fit(70, 20, 100, 0),
			SineFitResult.failed(Double.NaN, Double.NaN));

	@Test
	void contrastAndErrorOfOneFit() {

		SineFitResult first = FITS.get(0);

		assertThat(first.contrast()).isCloseTo(0.5, within(1e-12));
		assertThat(first.contrastErr()).isCloseTo(0.1, within(1e-12));
		assertThat(first.phase()).isEqualTo(1.0);
		assertThat(first.phaseErr()).isEqualTo(0.1);
		assertThat(first.bootstrap()).isNull();
		assertThat(FITS.get(1).contrastErr()).isCloseTo(0.2, within(1e-12));
	}

	@Test
	void allAverageSkipsFailedFits() {

		ReductionJobResult result = ReductionJobResult.create(ResultSpec.allAverage(), FITS);

		assertThat(result).isInstanceOf(ReductionJobResult.AllAverage.class);
		assertThat(result.format()).isEqualTo(ResultFormat.ALL_AVERAGE);
		assertThat(result.contrast()).isCloseTo(0.54, within(1e-12));
		assertThat(result.contrastErr()).isCloseTo(Math.pow(125, -0.5), within(1e-12));
		assertThat(result.fits()).hasSize(3);
	}

	@Test
	void selectiveAverageUsesChosenFoils() {

		ReductionJobResult result = ReductionJobResult.create(ResultSpec.of("selectiveaverage", new int[] {1}, null), FITS);

		assertThat(result).isInstanceOf(ReductionJobResult.SelectiveAverage.class);
		assertThat(((ReductionJobResult.SelectiveAverage) result).indices()).containsExactly(1);
		assertThat(result.contrast()).isCloseTo(0.7, within(1e-12));
		assertThat(result.contrastErr()).isCloseTo(0.2, within(1e-12));

		assertThatThrownBy(() -> ReductionJobResult.create(ResultSpec.selectiveAverage(0, 3), FITS))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void selectFoilTakesOneFit() {

		ReductionJobResult result = ReductionJobResult.create(ResultSpec.of("selectfoil", null, 0), FITS);

		assertThat(result).isInstanceOf(ReductionJobResult.SelectFoil.class);
		assertThat(((ReductionJobResult.SelectFoil) result).index()).isZero();
		assertThat(result.contrast()).isCloseTo(0.5, within(1e-12));
		assertThat(result.contrastErr()).isCloseTo(0.1, within(1e-12));

		assertThatThrownBy(() -> ReductionJobResult.create(ResultSpec.selectFoil(5), FITS))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void resultSpecsFromKeys() {

		assertThat(ResultSpec.of("allaverage", null, null).format()).isEqualTo(ResultFormat.ALL_AVERAGE);
		assertThat(ResultSpec.selectiveAverage(2, 0).toString()).isEqualTo("selectiveaverage[2, 0]");

		assertThatThrownBy(() -> ResultSpec.of("median", null, null))
				.isInstanceOf(ConfigurationException.class)
				.hasMessage("'median' is not linked to a valid result format");

		assertThatThrownBy(() -> ResultSpec.of("selectiveaverage", null, null)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> ResultSpec.of("selectfoil", null, null)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> ResultSpec.selectiveAverage()).isInstanceOf(ConfigurationException.class);
	}
}
