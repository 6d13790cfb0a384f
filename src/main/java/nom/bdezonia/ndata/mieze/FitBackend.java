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

import java.util.Locale;

import nom.bdezonia.ndata.ConfigurationException;

/**
 * The fitting engines a reduction can be run with.
 *
 * @author Barry DeZonia
 */
public enum FitBackend {

	/**
	 * Levenberg-Marquardt least squares.
	 */
	LEAST_SQUARES("lmfit", "least_squares"),

	/**
	 * Minuit style minimization. Not available yet.
	 */
	MINUIT("minuit", "iminuit");

	private final String[] keys;

	FitBackend(String... keys) {

		this.keys = keys;
	}

	public static FitBackend fromKey(String key) {

		if (key != null) {

			String k = key.trim().toLowerCase(Locale.ROOT);

			for (FitBackend b : values()) {

				for (String s : b.keys) {

					if (s.equals(k))
						return b;
				}
			}
		}

		throw new ConfigurationException("The backend '" + key + "' is not recognized.");
	}

	public SineFitter createFitter() {

		switch (this) {
			case LEAST_SQUARES:
				return new LeastSquaresSineFitter();
			case MINUIT:
				return (x, series, weights) -> {
					throw new UnsupportedOperationException("the minuit fit backend is not implemented");
				};
			default:
				throw new IllegalStateException("unhandled backend " + this);
		}
	}
}
