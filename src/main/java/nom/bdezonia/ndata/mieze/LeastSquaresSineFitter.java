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
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Levenberg-Marquardt fit of {@link SineModel} with omega fixed and A, phi
 * and y0 free. A and y0 are kept non negative and phi inside [0, 2 pi).
 * Standard errors are the square roots of the covariance diagonal scaled
 * by the reduced chi square.
 *
 * @author Barry DeZonia
 */
public class LeastSquaresSineFitter implements SineFitter {

	private static final Logger logger = LoggerFactory.getLogger(LeastSquaresSineFitter.class);

	private static final int FREE_PARAMETERS = 3;

	private static final int MAX_EVALUATIONS = 2000;

	private static final double SINGULARITY_THRESHOLD = 1e-14;

	private static final double TWO_PI = 2 * Math.PI;

	// a negative amplitude is the same sine half a period later
	private static final ParameterValidator BOUNDS = params -> {

		double a = params.getEntry(0);

		double phi = params.getEntry(1);

		double y0 = params.getEntry(2);

		if (a < 0) {
			a = -a;
			phi += Math.PI;
		}

		phi = ((phi % TWO_PI) + TWO_PI) % TWO_PI;

		return new ArrayRealVector(new double[] {a, phi, Math.max(0, y0)});
	};

	@Override
	public SineFitResult fit(double[] x, double[] series, double[] weights) {

		int n = series.length;

		if (x.length != n || weights.length != n)
			throw new IllegalArgumentException("x, series and weights differ in length: " + x.length + ", " + n + ", " +
					weights.length);

		for (double v : series) {

			if (!Double.isFinite(v)) {

				logger.warn("cannot fit a series holding {}", v);

				return SineFitResult.failed(Double.NaN, Double.NaN);
			}
		}

		double[] squaredWeights = new double[n];

		for (int i = 0; i < n; i++) {

			double w = Double.isFinite(weights[i]) ? weights[i] : 0.0;

			squaredWeights[i] = w * w;
		}

		LeastSquaresProblem problem = new LeastSquaresBuilder()
				.start(SineModel.seed(series))
				.model(model(x))
				.target(series)
				.weight(new DiagonalMatrix(squaredWeights))
				.parameterValidator(BOUNDS)
				.maxEvaluations(MAX_EVALUATIONS)
				.maxIterations(MAX_EVALUATIONS)
				.build();

		LeastSquaresOptimizer.Optimum optimum;

		try {

			optimum = new LevenbergMarquardtOptimizer().optimize(problem);

		} catch (MathIllegalStateException e) {

			logger.warn("sine fit did not converge: {}", e.getMessage());

			return SineFitResult.failed(Double.NaN, Double.NaN);
		}

		RealVector p = BOUNDS.validate(optimum.getPoint());

		double chisqr = optimum.getCost() * optimum.getCost();

		double redchi = chisqr / Math.max(1, n - FREE_PARAMETERS);

		double[] errors = {Double.NaN, Double.NaN, Double.NaN, Double.NaN};

		try {

			RealMatrix covariance = optimum.getCovariances(SINGULARITY_THRESHOLD);

			errors[0] = Math.sqrt(covariance.getEntry(0, 0) * redchi);
			errors[2] = Math.sqrt(covariance.getEntry(1, 1) * redchi);
			errors[3] = Math.sqrt(covariance.getEntry(2, 2) * redchi);

		} catch (SingularMatrixException e) {

			logger.debug("no covariance estimate for the sine fit: {}", e.getMessage());
		}

		double[] values = {p.getEntry(0), SineModel.OMEGA, p.getEntry(1), p.getEntry(2)};

		return SineFitResult.fromParameters(values, errors, chisqr, redchi, true);
	}

	private static MultivariateJacobianFunction model(double[] x) {

		return point -> {

			double a = point.getEntry(0);

			double phi = point.getEntry(1);

			double y0 = point.getEntry(2);

			RealVector value = new ArrayRealVector(x.length);

			RealMatrix jacobian = new Array2DRowRealMatrix(x.length, FREE_PARAMETERS);

			for (int i = 0; i < x.length; i++) {

				double arg = SineModel.OMEGA * x[i] + phi;

				value.setEntry(i, SineModel.value(x[i], a, SineModel.OMEGA, phi, y0));

				jacobian.setEntry(i, 0, Math.sin(arg));
				jacobian.setEntry(i, 1, a * Math.cos(arg));
				jacobian.setEntry(i, 2, 1.0);
			}

			return new Pair<>(value, jacobian);
		};
	}
}
