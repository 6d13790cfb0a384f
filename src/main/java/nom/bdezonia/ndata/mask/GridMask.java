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

import nom.bdezonia.ndata.InstrumentSettings;
import nom.bdezonia.ndata.RawDataArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups detector pixels into square tiles. The weight of a pixel is the
 * number of its tile, counted row by row from 0.
 *
 * @author Barry DeZonia
 */
public final class GridMask extends DetectorMask {

	private static final Logger logger = LoggerFactory.getLogger(GridMask.class);

	private final int tileSize;

	/**
	 *
	 * @param tileSize Edge length of a tile. A size that does not divide
	 *   the mask size falls back to 1.
	 * @param size
	 * @param settings
	 */
	public GridMask(int tileSize, int size, InstrumentSettings settings) {

		super("Grid mask", size, settings);

		if (tileSize > 0 && size % tileSize == 0) {

			this.tileSize = tileSize;
		}
		else {

			logger.warn("tile size {} does not divide {}, using 1", tileSize, size);

			this.tileSize = 1;
		}
	}

	public int tileSize() {

		return tileSize;
	}

	public int tilesPerRow() {

		return size() / tileSize;
	}

	/**
	 * @return A mask with the new tile size, or this mask when the size
	 *   does not divide the mask size.
	 */
	public GridMask withTileSize(int newTileSize) {

		if (newTileSize < 1 || size() % newTileSize != 0) {

			logger.warn("tile size {} does not divide {}, keeping {}", newTileSize, size(), tileSize);

			return this;
		}

		return new GridMask(newTileSize, size(), settings());
	}

	public int tileIndex(int row, int col) {

		return (row / tileSize) * tilesPerRow() + col / tileSize;
	}

	@Override
	public double weight(int row, int col) {

		return tileIndex(row, col);
	}

	/**
	 * Every pixel belongs to a tile, so the whole panel is summed.
	 */
	@Override
	public double contract(double[][] panel) {

		double sum = 0;

		for (double[] row : contractTiles(panel)) {

			for (double v : row) {

				sum += v;
			}
		}

		return sum;
	}

	@Override
	public double[] apply(RawDataArray data) {

		long[] shape = data.shape();

		if (shape.length < 2)
			throw new IllegalArgumentException("expected at least (y, x) counts, got " + data);

		checkPanel(shape[shape.length - 2], shape[shape.length - 1]);

		long panelSize = (long) size() * size();

		double[] result = new double[(int) (data.size() / panelSize)];

		for (int p = 0; p < result.length; p++) {

			for (long i = 0; i < panelSize; i++) {

				result[p] += data.at(p * panelSize + i);
			}
		}

		return result;
	}

	/**
	 * Sums each tile of a panel, skipping NaN counts.
	 *
	 * @param panel Counts indexed {@code [row][col]}, {@link #size()} square.
	 * @return The tile sums, {@link #tilesPerRow()} square.
	 */
	public double[][] contractTiles(double[][] panel) {

		checkPanel(panel.length, panel.length == 0 ? 0 : panel[0].length);

		int tiles = tilesPerRow();

		double[][] contracted = new double[tiles][tiles];

		for (int r = 0; r < size(); r++) {

			for (int c = 0; c < size(); c++) {

				double v = panel[r][c];

				if (!Double.isNaN(v))
					contracted[r / tileSize][c / tileSize] += v;
			}
		}

		return contracted;
	}

	/**
	 * Copies every tile value onto the pixels of its tile.
	 *
	 * @param tiles Values indexed {@code [tileRow][tileCol]},
	 *   {@link #tilesPerRow()} square.
	 * @return A {@link #size()} square array.
	 */
	public double[][] expand(double[][] tiles) {

		int perRow = tilesPerRow();

		if (tiles.length != perRow || (perRow > 0 && tiles[0].length != perRow))
			throw new IllegalArgumentException("expected " + perRow + "x" + perRow + " tiles for " + this);

		double[][] expanded = new double[size()][size()];

		for (int r = 0; r < size(); r++) {

			for (int c = 0; c < size(); c++) {

				expanded[r][c] = tiles[r / tileSize][c / tileSize];
			}
		}

		return expanded;
	}
}
