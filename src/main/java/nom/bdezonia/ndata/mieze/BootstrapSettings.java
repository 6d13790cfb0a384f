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

import nom.bdezonia.ndata.ConfigurationException;

/**
 * Parameters of a randomized ROI search. Trial windows are the base
 * offsets around the beam center, each moved by an independent normally
 * distributed number of pixels.
 *
 * @author Barry DeZonia
 */
public final class BootstrapSettings {

	private static final int[] DEFAULT_OFFSETS = {-7, 2, -4, 5};

	private final int channel;

	private final int steps;

	private final int[] baseOffsets;

	private final double sigma;

	private final long seed;

	private final double[] center;

	/**
	 *
	 * @param channel Foil whose counts are searched.
	 * @param steps Number of trial windows.
	 * @param baseOffsets {left, right, bottom, top} relative to the center.
	 * @param sigma Standard deviation of each offset, in pixels.
	 * @param seed Seed of the random trials.
	 * @param center {y, x}, or null to find the beam center in the data.
	 */
	public BootstrapSettings(int channel, int steps, int[] baseOffsets, double sigma, long seed, double[] center) {

		if (channel < 0)
			throw new ConfigurationException("bootstrap channel must not be negative: " + channel);

		if (steps < 1)
			throw new ConfigurationException("bootstrap needs at least one step, got " + steps);

		if (baseOffsets.length != 4)
			throw new ConfigurationException("bootstrap needs 4 base offsets, got " + Arrays.toString(baseOffsets));

		if (!(sigma >= 0))
			throw new ConfigurationException("bootstrap sigma must not be negative: " + sigma);

		if (center != null && center.length != 2)
			throw new ConfigurationException("a beam center is {y, x}, got " + Arrays.toString(center));

		this.channel = channel;
		this.steps = steps;
		this.baseOffsets = baseOffsets.clone();
		this.sigma = sigma;
		this.seed = seed;
		this.center = center == null ? null : center.clone();
	}

	/**
	 * The default window offsets around a beam center found in the data.
	 */
	public static BootstrapSettings of(int channel, int steps, double sigma, long seed) {

		return new BootstrapSettings(channel, steps, DEFAULT_OFFSETS, sigma, seed, null);
	}

	public int channel() {

		return channel;
	}

	public int steps() {

		return steps;
	}

	public int[] baseOffsets() {

		return baseOffsets.clone();
	}

	public double sigma() {

		return sigma;
	}

	public long seed() {

		return seed;
	}

	/**
	 * @return {y, x}, or null when the center is found in the data.
	 */
	public double[] center() {

		return center == null ? null : center.clone();
	}
}
