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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import nom.bdezonia.ndata.InstrumentSettings;
import nom.bdezonia.ndata.RawDataArray;

/**
 * A square weighting of the CASCADE detector plane, indexed
 * {@code [row][col]} like {@link RawDataArray#image()}. A pixel with weight
 * 0 is masked out.
 *
 * @author Barry DeZonia
 */
public abstract class DetectorMask {

	/**
	 * Edge length of a CASCADE pixel in meters.
	 */
	public static final double PIXEL_SIZE = 0.0015625;

	public static final int DEFAULT_SIZE = 128;

	private final String type;

	private final int size;

	private final InstrumentSettings settings;

	protected DetectorMask(String type, int size, InstrumentSettings settings) {

		if (size < 1)
			throw new IllegalArgumentException("mask size must be positive: " + size);

		this.type = type;
		this.size = size;
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	public int size() {

		return size;
	}

	public InstrumentSettings settings() {

		return settings;
	}

	public abstract double weight(int row, int col);

	public double[][] toArray() {

		double[][] array = new double[size][size];

		for (int r = 0; r < size; r++) {

			for (int c = 0; c < size; c++) {

				array[r][c] = weight(r, c);
			}
		}

		return array;
	}

	/**
	 * @return The sum of all weights, the pixel count for a boolean mask.
	 */
	public double total() {

		double total = 0;

		for (int r = 0; r < size; r++) {

			for (int c = 0; c < size; c++) {

				total += weight(r, c);
			}
		}

		return total;
	}

	/**
	 * Sums one detector panel weighted by the mask. NaN counts are skipped.
	 *
	 * @param panel Counts indexed {@code [row][col]}, {@link #size()} square.
	 * @return
	 */
	public double contract(double[][] panel) {

		checkPanel(panel.length, panel.length == 0 ? 0 : panel[0].length);

		double sum = 0;

		for (int r = 0; r < size; r++) {

			for (int c = 0; c < size; c++) {

				double v = panel[r][c] * weight(r, c);

				if (!Double.isNaN(v))
					sum += v;
			}
		}

		return sum;
	}

	/**
	 * Contracts every panel of a stack.
	 *
	 * @param data Counts whose last two axes are a {@link #size()} square
	 *   panel, e.g. (foil, time, y, x).
	 * @return One contraction per panel, the leading axes in row major
	 *   order.
	 */
	public double[] apply(RawDataArray data) {

		long[] shape = data.shape();

		if (shape.length < 2)
			throw new IllegalArgumentException("expected at least (y, x) counts, got " + data);

		checkPanel(shape[shape.length - 2], shape[shape.length - 1]);

		long panelSize = (long) size * size;

		int panels = (int) (data.size() / panelSize);

		double[] result = new double[panels];

		for (int p = 0; p < panels; p++) {

			double sum = 0;

			for (int r = 0; r < size; r++) {

				for (int c = 0; c < size; c++) {

					double w = weight(r, c);

					if (w != 0)
						sum += w * data.at(p * panelSize + (long) r * size + c);
				}
			}

			result[p] = sum;
		}

		return result;
	}

	/**
	 * Multiplies every mask of one list with every mask of the other.
	 *
	 * @param pres
	 * @param posts
	 * @return {@code result.get(i).get(j)} is {@code pres[i] * posts[j]}.
	 */
	public static

		List<List<double[][]>>

			combine(List<? extends DetectorMask> pres, List<? extends DetectorMask> posts)
	{
		List<List<double[][]>> combined = new ArrayList<>();

		for (DetectorMask pre : pres) {

			List<double[][]> line = new ArrayList<>();

			for (DetectorMask post : posts) {

				if (pre.size() != post.size())
					throw new IllegalArgumentException("cannot combine " + pre + " with " + post);

				double[][] product = new double[pre.size()][pre.size()];

				for (int r = 0; r < pre.size(); r++) {

					for (int c = 0; c < pre.size(); c++) {

						product[r][c] = pre.weight(r, c) * post.weight(r, c);
					}
				}

				line.add(product);
			}

			combined.add(line);
		}

		return combined;
	}

	protected void checkPanel(long rows, long cols) {

		if (rows != size || cols != size)
			throw new IllegalArgumentException("panel of " + rows + "x" + cols + " does not fit " + this);
	}

	@Override
	public String toString() {

		return size + "x" + size + " " + type + " for " + settings.instrument() + " data";
	}
}
