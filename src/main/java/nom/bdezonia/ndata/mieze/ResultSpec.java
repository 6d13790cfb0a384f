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
 * A {@link ResultFormat} with the foil indices it needs.
 *
 * @author Barry DeZonia
 */
public final class ResultSpec {

	private final ResultFormat format;

	private final int[] indices;

	private ResultSpec(ResultFormat format, int[] indices) {

		this.format = format;
		this.indices = indices;
	}

	public static ResultSpec allAverage() {

		return new ResultSpec(ResultFormat.ALL_AVERAGE, new int[0]);
	}

	public static ResultSpec selectiveAverage(int... foilIndices) {

		if (foilIndices.length == 0)
			throw new ConfigurationException("selectiveaverage needs at least one foil index");

		return new ResultSpec(ResultFormat.SELECTIVE_AVERAGE, foilIndices.clone());
	}

	public static ResultSpec selectFoil(int index) {

		return new ResultSpec(ResultFormat.SELECT_FOIL, new int[] {index});
	}

	/**
	 * Builds a spec from a format key as used in job configuration.
	 *
	 * @param key allaverage, selectiveaverage or selectfoil.
	 * @param foilIndices Used by selectiveaverage.
	 * @param index Used by selectfoil.
	 * @return
	 */
	public static ResultSpec of(String key, int[] foilIndices, Integer index) {

		ResultFormat format = ResultFormat.fromKey(key);

		switch (format) {
			case ALL_AVERAGE:
				return allAverage();
			case SELECTIVE_AVERAGE:
				if (foilIndices == null)
					throw new ConfigurationException("selectiveaverage needs 'foilsidx'");
				return selectiveAverage(foilIndices);
			case SELECT_FOIL:
				if (index == null)
					throw new ConfigurationException("selectfoil needs 'idx'");
				return selectFoil(index);
			default:
				throw new IllegalStateException("unhandled format " + format);
		}
	}

	public ResultFormat format() {

		return format;
	}

	public int[] indices() {

		return indices.clone();
	}

	@Override
	public String toString() {

		return format.key() + (indices.length == 0 ? "" : Arrays.toString(indices));
	}
}
