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

import java.util.List;

/**
 * The contrast of one reduction, combined from the fits of its foils. The
 * kinds of result are fixed: {@link AllAverage}, {@link SelectiveAverage}
 * and {@link SelectFoil}, built by {@link #create(ResultSpec, List)}.
 *
 * @author Barry DeZonia
 */
public abstract class ReductionJobResult {

	private final List<SineFitResult> fits;

	private final double contrast;

	private final double contrastErr;

	// subclasses are all nested below
	private ReductionJobResult(List<SineFitResult> fits, double contrast, double contrastErr) {

		this.fits = List.copyOf(fits);
		this.contrast = contrast;
		this.contrastErr = contrastErr;
	}

	public static ReductionJobResult create(ResultSpec spec, List<SineFitResult> fits) {

		switch (spec.format()) {
			case ALL_AVERAGE:
				return new AllAverage(fits);
			case SELECTIVE_AVERAGE:
				return new SelectiveAverage(fits, spec.indices());
			case SELECT_FOIL:
				return new SelectFoil(fits, spec.indices()[0]);
			default:
				throw new IllegalStateException("unhandled result format " + spec.format());
		}
	}

	public abstract ResultFormat format();

	public double contrast() {

		return contrast;
	}

	public double contrastErr() {

		return contrastErr;
	}

	/**
	 * @return The fit of every foil, in foil order.
	 */
	public List<SineFitResult> fits() {

		return fits;
	}

	/**
	 * Inverse variance weighted mean of the chosen contrasts. Terms that
	 * are NaN are left out of both sums.
	 *
	 * @param fits
	 * @param indices
	 * @return {contrast, error}
	 */
	static double[] weightedMean(List<SineFitResult> fits, int[] indices) {

		double numerator = 0;

		double denominator = 0;

		for (int i : indices) {

			if (i < 0 || i >= fits.size())
				throw new IllegalArgumentException("foil index " + i + " outside 0.." + (fits.size() - 1));

			SineFitResult fit = fits.get(i);

			double w = 1.0 / (fit.contrastErr() * fit.contrastErr());

			double term = fit.contrast() * w;

			if (!Double.isNaN(term))
				numerator += term;

			if (!Double.isNaN(w))
				denominator += w;
		}

		return new double[] {numerator / denominator, Math.pow(denominator, -0.5)};
	}

	private static int[] all(int n) {

		int[] idx = new int[n];

		for (int i = 0; i < n; i++) {

			idx[i] = i;
		}

		return idx;
	}

	@Override
	public String toString() {

		return format().key() + " contrast " + contrast + " +- " + contrastErr;
	}

	public static final class AllAverage extends ReductionJobResult {

		private AllAverage(List<SineFitResult> fits) {

			this(fits, weightedMean(fits, all(fits.size())));
		}

		private AllAverage(List<SineFitResult> fits, double[] mean) {

			super(fits, mean[0], mean[1]);
		}

		@Override
		public ResultFormat format() {

			return ResultFormat.ALL_AVERAGE;
		}
	}

	public static final class SelectiveAverage extends ReductionJobResult {

		private final int[] indices;

		private SelectiveAverage(List<SineFitResult> fits, int[] indices) {

			this(fits, indices, weightedMean(fits, indices));
		}

		private SelectiveAverage(List<SineFitResult> fits, int[] indices, double[] mean) {

			super(fits, mean[0], mean[1]);

			this.indices = indices.clone();
		}

		@Override
		public ResultFormat format() {

			return ResultFormat.SELECTIVE_AVERAGE;
		}

		public int[] indices() {

			return indices.clone();
		}
	}

	public static final class SelectFoil extends ReductionJobResult {

		private final int index;

		private SelectFoil(List<SineFitResult> fits, int index) {

			super(fits, fits.get(checked(fits, index)).contrast(), fits.get(index).contrastErr());

			this.index = index;
		}

		private static int checked(List<SineFitResult> fits, int index) {

			if (index < 0 || index >= fits.size())
				throw new IllegalArgumentException("foil index " + index + " outside 0.." + (fits.size() - 1));

			return index;
		}

		@Override
		public ResultFormat format() {

			return ResultFormat.SELECT_FOIL;
		}

		public int index() {

			return index;
		}
	}
}
