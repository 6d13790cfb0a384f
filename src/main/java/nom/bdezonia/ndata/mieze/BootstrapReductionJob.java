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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.ndata.RawDataArray;

/**
 * Chooses the ROI by a randomized search before fitting. Trial windows are
 * scattered around the beam center and fitted on one foil only; their
 * contrasts are combined by inverse variance weighting, and the trial
 * whose own contrast lies closest to that estimate becomes the window for
 * the fit of all foils. Every foil's result carries the search summary.
 * <p>
 * Trials without a contrast or error (NaN) are left out of the estimate
 * and cannot be chosen as the representative window.
 *
 * @author Barry DeZonia
 */
public class BootstrapReductionJob implements ReductionJob {

	private static final Logger logger = LoggerFactory.getLogger(BootstrapReductionJob.class);

	private final SineFitter fitter;

	private final BootstrapSettings settings;

	private final ResultSpec resultSpec;

	public BootstrapReductionJob(SineFitter fitter, BootstrapSettings settings, ResultSpec resultSpec) {

		this.fitter = Objects.requireNonNull(fitter, "fitter");
		this.settings = Objects.requireNonNull(settings, "settings");
		this.resultSpec = Objects.requireNonNull(resultSpec, "resultSpec");
	}

	@Override
	public ReductionJobResult run(RawDataArray selectedData) {

		if (selectedData.numDimensions() != 4)
			throw new IllegalArgumentException("expected (foil, time bin, y, x) counts, got " + selectedData);

		if (settings.channel() >= selectedData.shape()[0])
			throw new IllegalArgumentException("bootstrap channel " + settings.channel() + " outside 0.." +
					(selectedData.shape()[0] - 1));

		BootstrapSummary summary = search(selectedData);

		RoiReductionJob full = new RoiReductionJob(fitter, RoiSpec.lrbt(summary.roi()), resultSpec);

		List<SineFitResult> fits = new ArrayList<>();

		for (SineFitResult fit : full.fitChannels(selectedData)) {

			fits.add(fit.withBootstrap(summary));
		}

		return ReductionJobResult.create(resultSpec, fits);
	}

	BootstrapSummary search(RawDataArray selectedData) {

		double[] center = settings.center();

		if (center == null)
			center = BeamCenter.fitImage(selectedData.image());

		int cy = (int) center[0];

		int cx = (int) center[1];

		int[] base = settings.baseOffsets();

		int[] baseWindow = {cx + base[0], cx + base[1], cy + base[2], cy + base[3]};

		RawDataArray channel = selectedData.channel(settings.channel());

		NormalDistribution noise = settings.sigma() > 0
				? new NormalDistribution(new Well19937c(settings.seed()), 0, settings.sigma())
				: null;

		int steps = settings.steps();

		int[][] windows = new int[steps][];

		double[] contrasts = new double[steps];

		double[] errors = new double[steps];

		for (int s = 0; s < steps; s++) {

			int[] w = baseWindow.clone();

			for (int i = 0; i < w.length; i++) {

				if (noise != null)
					w[i] += (int) Math.round(noise.sample());
			}

			windows[s] = w;

			if (w[1] <= w[0] || w[3] <= w[2]) {

				contrasts[s] = Double.NaN;
				errors[s] = Double.NaN;

				continue;
			}

			SineFitResult fit = RoiReductionJob.fitChannel(fitter, channel, RoiSpec.lrbt(w));

			contrasts[s] = fit.contrast();
			errors[s] = fit.contrastErr();
		}

		double numerator = 0;

		double denominator = 0;

		int valid = 0;

		for (int s = 0; s < steps; s++) {

			if (isValid(contrasts[s], errors[s])) {

				double weight = 1.0 / (errors[s] * errors[s]);

				numerator += contrasts[s] * weight;

				denominator += weight;

				valid++;
			}
		}

		double estimate = numerator / denominator;

		double estimateErr = Math.pow(denominator, -0.5);

		int representative = -1;

		for (int s = 0; s < steps; s++) {

			if (!isValid(contrasts[s], errors[s]))
				continue;

			if (representative < 0 ||
					Math.abs(contrasts[s] - estimate) < Math.abs(contrasts[representative] - estimate))
			{
				representative = s;
			}
		}

		if (valid < steps)
			logger.warn("{} of {} bootstrap trials gave no contrast and were left out", steps - valid, steps);

		int[] chosen;

		if (representative < 0) {

			logger.warn("no bootstrap trial gave a contrast, fitting the base window {}", Arrays.toString(baseWindow));

			chosen = baseWindow;
		}
		else {

			chosen = windows[representative];
		}

		logger.info("bootstrap contrast {} +- {} from {} trials, representative window {}",
				estimate, estimateErr, valid, Arrays.toString(chosen));

		return new BootstrapSummary(estimate, estimateErr, chosen, steps, valid);
	}

	private static boolean isValid(double contrast, double error) {

		return !Double.isNaN(contrast) && !Double.isNaN(error) && error != 0;
	}
}
