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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import nom.bdezonia.ndata.RawDataArray;

/**
 * Sums every foil's counts inside one region of interest and fits the
 * resulting time series.
 *
 * @author Barry DeZonia
 */
public class RoiReductionJob implements ReductionJob {

	private final SineFitter fitter;

	private final RoiSpec roi;

	private final ResultSpec resultSpec;

	public RoiReductionJob(SineFitter fitter, RoiSpec roi, ResultSpec resultSpec) {

		this.fitter = Objects.requireNonNull(fitter, "fitter");
		this.roi = Objects.requireNonNull(roi, "roi");
		this.resultSpec = Objects.requireNonNull(resultSpec, "resultSpec");
	}

	public RoiSpec roi() {

		return roi;
	}

	public ResultSpec resultSpec() {

		return resultSpec;
	}

	@Override
	public ReductionJobResult run(RawDataArray selectedData) {

		return ReductionJobResult.create(resultSpec, fitChannels(selectedData));
	}

	/**
	 * @return One fit per foil, in foil order.
	 */
	public List<SineFitResult> fitChannels(RawDataArray selectedData) {

		if (selectedData.numDimensions() != 4)
			throw new IllegalArgumentException("expected (foil, time bin, y, x) counts, got " + selectedData);

		List<SineFitResult> fits = new ArrayList<>();

		for (int c = 0; c < selectedData.shape()[0]; c++) {

			fits.add(fitChannel(fitter, selectedData.channel(c), roi));
		}

		return fits;
	}

	/**
	 * Fits the ROI sums of one foil with Poisson weights {@code 1/sqrt(counts)}.
	 *
	 * @param fitter
	 * @param channel Counts shaped (time bin, y, x).
	 * @param roi
	 * @return
	 */
	static SineFitResult fitChannel(SineFitter fitter, RawDataArray channel, RoiSpec roi) {

		double[] series = RoiExtractor.extract(channel, roi);

		double[] weights = new double[series.length];

		for (int i = 0; i < series.length; i++) {

			// zero counts give infinite weights, which the fitter drops
			weights[i] = 1.0 / Math.sqrt(series[i]);
		}

		return fitter.fit(SineModel.timeBins(series.length), series, weights);
	}
}
