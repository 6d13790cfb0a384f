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

/**
 * The MIEZE signal of one detector foil: {@code y = A sin(omega x + phi) + y0}
 * over the time bins of one acquisition period.
 *
 * @author Barry DeZonia
 */
public class SineModel {

	// do not instantiate

	private SineModel() { }

	public static final int TIME_BINS = 16;

	/**
	 * One period per 16 time bins. Not a fit parameter.
	 */
	public static final double OMEGA = 2 * Math.PI / TIME_BINS;

	public static

		double

			value(double x, double amplitude, double omega, double phase, double offset)
	{
		return amplitude * Math.sin(omega * x + phase) + offset;
	}

	/**
	 * Starting amplitude, phase and offset for a fit of one series.
	 *
	 * @param series
	 * @return {A, phi, y0}
	 */
	public static

		double[]

			seed(double[] series)
	{
		double min = Double.POSITIVE_INFINITY;

		double max = Double.NEGATIVE_INFINITY;

		double sum = 0;

		int argmax = 0;

		for (int i = 0; i < series.length; i++) {

			if (series[i] > max) {
				max = series[i];
				argmax = i;
			}

			min = Math.min(min, series[i]);

			sum += series[i];
		}

		double amplitude = (max - min) / 2.0;

		// a sine peaking at bin argmax
		double phase = (((2.0 - argmax / 8.0 + 0.5) % 2.0 + 2.0) % 2.0) * Math.PI;

		return new double[] {amplitude, phase, sum / series.length};
	}

	/**
	 * @return The time bin indices 0, 1, ... n-1.
	 */
	public static

		double[]

			timeBins(int n)
	{
		double[] x = new double[n];

		for (int i = 0; i < n; i++) {

			x[i] = i;
		}

		return x;
	}
}
