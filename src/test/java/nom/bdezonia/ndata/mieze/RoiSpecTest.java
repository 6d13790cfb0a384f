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

import nom.bdezonia.ndata.ConfigurationException;

class RoiSpecTest {

	@Test
	void exactlyOneModeMustBeGiven() {

		assertThat(RoiSpec.of(new int[] {1, 2, 3, 4}, null, null).mode()).isEqualTo(RoiSpec.Mode.LBWH);
		assertThat(RoiSpec.of(new int[0], new int[] {1, 2, 3, 4}, null).mode()).isEqualTo(RoiSpec.Mode.LRBT);
		assertThat(RoiSpec.of(null, null, new double[][] {{1}}).mode()).isEqualTo(RoiSpec.Mode.MASK);

		assertThatThrownBy(() -> RoiSpec.of(null, null, null))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("0 were given");

		assertThatThrownBy(() -> RoiSpec.of(new int[] {1, 2, 3, 4}, new int[] {1, 2, 3, 4}, null))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("2 were given");

		assertThatThrownBy(() -> RoiSpec.lrbt(1, 2, 3)).isInstanceOf(ConfigurationException.class);
	}

	@Test
	void lbwhConvertsToLrbt() {

		RoiSpec roi = RoiSpec.lbwh(10, 20, 5, 6);

		assertThat(roi.lrbtWindow()).containsExactly(10, 15, 20, 26);
		assertThat(roi.isRectangular()).isTrue();
		assertThat(roi.toString()).isEqualTo("lbwh[10, 20, 5, 6]");
		assertThatThrownBy(roi::mask).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void windowAroundBeamCenter() {

		RoiSpec roi = RoiSpec.aroundCenter(new double[] {40.6, 70.2});

		assertThat(roi).isEqualTo(RoiSpec.lrbt(63, 72, 36, 45));
		assertThat(roi.hashCode()).isEqualTo(RoiSpec.lrbt(63, 72, 36, 45).hashCode());
	}

	@Test
	void maskHasNoWindow() {

		double[][] weights = {{0, 1}, {1, 0}};

		RoiSpec roi = RoiSpec.mask(weights);

		weights[0][0] = 5;

		assertThat(roi.isRectangular()).isFalse();
		assertThat(roi.mask()[0][0]).isEqualTo(0);
		assertThatThrownBy(roi::lrbtWindow).isInstanceOf(UnsupportedOperationException.class);
	}
}
