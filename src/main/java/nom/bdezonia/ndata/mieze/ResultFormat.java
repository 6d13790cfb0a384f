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

import nom.bdezonia.ndata.ConfigurationException;

/**
 * How the per foil fits of a reduction combine into one contrast.
 *
 * @author Barry DeZonia
 */
public enum ResultFormat {

	/**
	 * inverse variance weighted mean over all foils
	 */
	ALL_AVERAGE("allaverage"),

	/**
	 * inverse variance weighted mean over chosen foils
	 */
	SELECTIVE_AVERAGE("selectiveaverage"),

	/**
	 * the fit of one foil
	 */
	SELECT_FOIL("selectfoil");

	private final String key;

	ResultFormat(String key) {

		this.key = key;
	}

	public String key() {

		return key;
	}

	public static ResultFormat fromKey(String key) {

		for (ResultFormat f : values()) {

			if (f.key.equals(key))
				return f;
		}

		throw new ConfigurationException("'" + key + "' is not linked to a valid result format");
	}
}
