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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fitted sine of one foil reduced to its contrast {@code A/y0} and
 * phase, with the raw parameters and their standard errors.
 *
 * @author Barry DeZonia
 */
public final class SineFitResult {

	public static final String AMPLITUDE = "A";

	public static final String OMEGA = "omega";

	public static final String PHASE = "phi";

	public static final String OFFSET = "y0";

	private final double contrast;

	private final double contrastErr;

	private final double phase;

	private final double phaseErr;

	private final double chisqr;

	private final double redchi;

	private final boolean success;

	private final Map<String, Double> rawValues;

	private final Map<String, Double> rawErrors;

	private final BootstrapSummary bootstrap;

	private SineFitResult(double contrast, double contrastErr, double phase, double phaseErr, double chisqr,
			double redchi, boolean success, Map<String, Double> rawValues, Map<String, Double> rawErrors,
			BootstrapSummary bootstrap)
	{
		this.contrast = contrast;
		this.contrastErr = contrastErr;
		this.phase = phase;
		this.phaseErr = phaseErr;
		this.chisqr = chisqr;
		this.redchi = redchi;
		this.success = success;
		this.rawValues = rawValues;
		this.rawErrors = rawErrors;
		this.bootstrap = bootstrap;
	}

	/**
	 * Derives contrast and phase from fitted parameters. The contrast error
	 * combines the relative errors of A and y0 and is NaN when either is
	 * unknown.
	 *
	 * @param values {A, omega, phi, y0}
	 * @param errors Standard errors in the same order, NaN when unknown.
	 * @param chisqr
	 * @param redchi
	 * @param success
	 * @return
	 */
	public static SineFitResult fromParameters(double[] values, double[] errors, double chisqr, double redchi,
			boolean success)
	{
		double a = values[0];

		double y0 = values[3];

		double contrast = a / y0;

		double contrastErr = contrast * Math.sqrt(square(errors[0] / a) + square(errors[3] / y0));

		return new SineFitResult(contrast, contrastErr, values[2], errors[2], chisqr, redchi, success,
				named(values), named(errors), null);
	}

	/**
	 * A result for a fit that produced no parameters.
	 */
	public static SineFitResult failed(double chisqr, double redchi) {

		double[] nan = {Double.NaN, SineModel.OMEGA, Double.NaN, Double.NaN};

		double[] errs = {Double.NaN, Double.NaN, Double.NaN, Double.NaN};

		return fromParameters(nan, errs, chisqr, redchi, false);
	}

	public SineFitResult withBootstrap(BootstrapSummary summary) {

		return new SineFitResult(contrast, contrastErr, phase, phaseErr, chisqr, redchi, success,
				rawValues, rawErrors, summary);
	}

	public double contrast() {

		return contrast;
	}

	public double contrastErr() {

		return contrastErr;
	}

	public double phase() {

		return phase;
	}

	public double phaseErr() {

		return phaseErr;
	}

	public double chisqr() {

		return chisqr;
	}

	public double redchi() {

		return redchi;
	}

	public boolean success() {

		return success;
	}

	/**
	 * @return A, omega, phi and y0 as fitted.
	 */
	public Map<String, Double> rawValues() {

		return rawValues;
	}

	/**
	 * @return Standard errors of A, omega, phi and y0. Omega is fixed and
	 *   has a NaN error.
	 */
	public Map<String, Double> rawErrors() {

		return rawErrors;
	}

	/**
	 * @return The ROI search this fit came from, or null.
	 */
	public BootstrapSummary bootstrap() {

		return bootstrap;
	}

	private static Map<String, Double> named(double[] v) {

		Map<String, Double> map = new LinkedHashMap<>();

		map.put(AMPLITUDE, v[0]);
		map.put(OMEGA, v[1]);
		map.put(PHASE, v[2]);
		map.put(OFFSET, v[3]);

		return Collections.unmodifiableMap(map);
	}

	private static double square(double v) {

		return v * v;
	}

	@Override
	public String toString() {

		return "contrast " + contrast + " +- " + contrastErr + ", phase " + phase + " +- " + phaseErr +
				", redchi " + redchi + (success ? "" : " (failed)");
	}
}
