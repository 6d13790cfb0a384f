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

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import nom.bdezonia.ndata.AcquisitionMode;
import nom.bdezonia.ndata.InstrumentSettings;
import nom.bdezonia.ndata.RawDataArray;

class GridMaskTest {

	private static final InstrumentSettings MIRA = InstrumentSettings.of("MIRA", AcquisitionMode.PAD);

	private static double[][] ones(int size) {

		double[][] panel = new double[size][size];

		for (double[] row : panel) {

			Arrays.fill(row, 1);
		}

		return panel;
	}

	@Test
	void pixelsCarryTheirTileNumber() {

		GridMask grid = new GridMask(4, 8, MIRA);

		assertThat(grid.tilesPerRow()).isEqualTo(2);
		assertThat(grid.weight(5, 2)).isEqualTo(2);
		assertThat(grid.weight(0, 7)).isEqualTo(1);
		assertThat(grid.toArray()[7][7]).isEqualTo(3);
		assertThat(grid.toString()).isEqualTo("8x8 Grid mask for MIRA data");
	}

	@Test
	void tileSizeMustDivideTheMask() {

		GridMask grid = new GridMask(3, 8, MIRA);

		assertThat(grid.tileSize()).isEqualTo(1);
		assertThat(grid.withTileSize(3)).isSameAs(grid);
		assertThat(grid.withTileSize(2).tileSize()).isEqualTo(2);
	}

	@Test
	void tilesAreSummedSkippingNaN() {

		GridMask grid = new GridMask(4, 8, MIRA);

		double[][] panel = ones(8);

		panel[1][6] = Double.NaN;

		double[][] tiles = grid.contractTiles(panel);

		assertThat(tiles[0]).containsExactly(16, 15);
		assertThat(tiles[1]).containsExactly(16, 16);
		assertThat(grid.contract(panel)).isEqualTo(63);
	}

	@Test
	void expandCopiesTilesOntoPixels() {

		GridMask grid = new GridMask(4, 8, MIRA);

		double[][] expanded = grid.expand(new double[][] {{1, 2}, {3, 4}});

		assertThat(expanded[0][3]).isEqualTo(1);
		assertThat(expanded[0][4]).isEqualTo(2);
		assertThat(expanded[4][0]).isEqualTo(3);
		assertThat(expanded[5][6]).isEqualTo(4);

		assertThatThrownBy(() -> grid.expand(new double[][] {{1}}))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void applySumsEveryPanel() {

		int[] counts = new int[2 * 8 * 8];

		for (int i = 0; i < counts.length; i++) {

			counts[i] = i < 64 ? 1 : 2;
		}

		double[] sums = new GridMask(2, 8, MIRA).apply(RawDataArray.of(new long[] {2, 8, 8}, counts));

		assertThat(sums).containsExactly(64, 128);
	}

	@Test
	void panelMustMatchTheMask() {

		GridMask grid = new GridMask(4, 8, MIRA);

		assertThatThrownBy(() -> grid.contractTiles(ones(4)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("4x4");
	}
}
