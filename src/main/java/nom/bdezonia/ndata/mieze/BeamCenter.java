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

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.ndata.RawDataArray;

/**
 * Locates the direct beam on the detector. Each axis is handled on its own
 * by projecting the counts onto it, so any number of dimensions works.
 *
 * @author Barry DeZonia
 */
public class BeamCenter {

	private static final Logger logger = LoggerFactory.getLogger(BeamCenter.class);

	private static final double FWHM_PER_SIGMA = 2.35;

	private static final double MIN_SIGMA = 1e-9;

	private static final int MAX_EVALUATIONS = 2000;

	// do not instantiate

	private BeamCenter() { }

	/**
	 * Fits a Gaussian on a flat background to the projection of the counts
	 * onto each axis.
	 *
	 * @param data
	 * @return The center along each axis, detector order.
	 */
	public static

		double[]

			fit(RawDataArray data)
	{
		double[] center = new double[data.numDimensions()];

		for (int axis = 0; axis < center.length; axis++) {

			center[axis] = fitProfile(data.marginal(axis));
		}

		return center;
	}

	/**
	 * @param image Counts indexed {@code [y][x]}.
	 * @return {y, x}
	 */
	public static

		double[]

			fitImage(double[][] image)
	{
		return new double[] {fitProfile(rowSums(image)), fitProfile(columnSums(image))};
	}

	/**
	 * Intensity weighted mean index along each axis. Quick, but pulled
	 * towards the middle when the beam is cut by the detector edge.
	 *
	 * @param data
	 * @return The center along each axis, detector order.
	 */
	public static

		double[]

			centerOfMass(RawDataArray data)
	{
		double[] center = new double[data.numDimensions()];

		for (int axis = 0; axis < center.length; axis++) {

			center[axis] = centroid(data.marginal(axis));
		}

		return center;
	}

	static

		double

			centroid(double[] profile)
	{
		double total = 0;

		double moment = 0;

		for (int i = 0; i < profile.length; i++) {

			total += profile[i];

			moment += i * profile[i];
		}

		return moment / total;
	}

	/**
	 * Fits {@code amp / sqrt(2 pi sig^2) exp(-(x-x0)^2 / (2 sig^2)) + bckg}.
	 * Seeds come from the peak and the number of bins above half maximum.
	 *
	 * @param profile
	 * @return x0
	 */
	static

		double

			fitProfile(double[] profile)
	{
		int argmax = 0;

		for (int i = 1; i < profile.length; i++) {

			if (profile[i] > profile[argmax])
				argmax = i;
		}

		double peak = profile[argmax];

		if (!(peak > 0))
			throw new IllegalArgumentException("a beam profile without counts has no center");

		int aboveHalf = 0;

		for (double v : profile) {

			if (v > peak / 2)
				aboveHalf++;
		}

		double sigma = aboveHalf / FWHM_PER_SIGMA;

		double amplitude = peak * Math.sqrt(2 * Math.PI) * sigma;

		double maxCenter = profile.length;

		ParameterValidator bounds = p -> new ArrayRealVector(new double[] {
				Math.max(0, p.getEntry(0)),
				Math.min(maxCenter, Math.max(0, p.getEntry(1))),
				Math.max(MIN_SIGMA, p.getEntry(2)),
				Math.max(0, p.getEntry(3))
		});

		try {

			LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(
					new LeastSquaresBuilder()
						.start(new double[] {amplitude, argmax, sigma, 0})
						.model(gaussian(profile.length))
						.target(profile)
						.parameterValidator(bounds)
						.maxEvaluations(MAX_EVALUATIONS)
						.maxIterations(MAX_EVALUATIONS)
						.build());

			return bounds.validate(optimum.getPoint()).getEntry(1);

		} catch (MathIllegalStateException e) {

			logger.warn("beam profile fit did not converge, using the peak bin {}: {}", argmax, e.getMessage());

			return argmax;
		}
	}

	private static

		MultivariateJacobianFunction

			gaussian(int n)
	{
		return p -> {

			double amp = p.getEntry(0);

			double x0 = p.getEntry(1);

			double sig = p.getEntry(2);

			double bckg = p.getEntry(3);

			double norm = 1.0 / (Math.sqrt(2 * Math.PI) * sig);

			RealVector value = new ArrayRealVector(n);

			RealMatrix jacobian = new Array2DRowRealMatrix(n, 4);

			for (int i = 0; i < n; i++) {

				double u = (i - x0) / sig;

				double g = norm * Math.exp(-0.5 * u * u);

				value.setEntry(i, amp * g + bckg);

				jacobian.setEntry(i, 0, g);
				jacobian.setEntry(i, 1, amp * g * u / sig);
				jacobian.setEntry(i, 2, amp * g * (u * u - 1) / sig);
				jacobian.setEntry(i, 3, 1.0);
			}

			return new Pair<>(value, jacobian);
		};
	}

	private static

		double[]

			rowSums(double[][] image)
	{
		double[] sums = new double[image.length];

		for (int y = 0; y < image.length; y++) {

			for (double v : image[y]) {

				sums[y] += v;
			}
		}

		return sums;
	}

	private static

		double[]

			columnSums(double[][] image)
	{
		double[] sums = new double[image.length == 0 ? 0 : image[0].length];

		for (double[] row : image) {

			for (int x = 0; x < sums.length; x++) {

				sums[x] += row[x];
			}
		}

		return sums;
	}
}
