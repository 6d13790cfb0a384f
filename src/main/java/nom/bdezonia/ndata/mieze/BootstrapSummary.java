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

import java.util.Arrays;

/**
 * The outcome of a randomized ROI search: the weighted contrast over all
 * usable trials and the trial window the final fit used.
 *
 * @author Barry DeZonia
 */
public final class BootstrapSummary {

	private final double contrast;

	private final double contrastErr;

	private final int[] roi;

	private final int steps;

	private final int validSteps;

	public BootstrapSummary(double contrast, double contrastErr, int[] roi, int steps, int validSteps) {

		this.contrast = contrast;
		this.contrastErr = contrastErr;
		this.roi = roi.clone();
		this.steps = steps;
		this.validSteps = validSteps;
	}

	public double contrast() {

		return contrast;
	}

	public double contrastErr() {

		return contrastErr;
	}

	/**
	 * @return {left, right, bottom, top} of the representative trial.
	 */
	public int[] roi() {

		return roi.clone();
	}

	public int steps() {

		return steps;
	}

	/**
	 * @return How many trials gave a contrast and an error.
	 */
	public int validSteps() {

		return validSteps;
	}

	@Override
	public String toString() {

		return "bootstrap contrast " + contrast + " +- " + contrastErr + " roi " + Arrays.toString(roi) +
				" (" + validSteps + " of " + steps + " trials)";
	}
}
