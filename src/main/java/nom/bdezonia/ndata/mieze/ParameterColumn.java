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

import java.util.List;

/**
 * The values one header parameter took over a batch of reductions. When
 * every run has (nearly) the same value the column collapses to that
 * scalar.
 *
 * @author Barry DeZonia
 */
public final class ParameterColumn {

	private final String alias;

	private final String key;

	private final List<Double> values;

	private final boolean scalar;

	ParameterColumn(String alias, String key, List<Double> values, boolean scalar) {

		this.alias = alias;
		this.key = key;
		this.values = List.copyOf(values);
		this.scalar = scalar;
	}

	public String alias() {

		return alias;
	}

	/**
	 * @return The header key the values were read from.
	 */
	public String key() {

		return key;
	}

	public boolean isScalar() {

		return scalar;
	}

	/**
	 * @return The shared value of a scalar column.
	 */
	public double scalar() {

		if (!scalar)
			throw new IllegalStateException(alias + " varies between runs");

		return values.get(0);
	}

	/**
	 * @return One value per run. A scalar column holds only its value.
	 */
	public List<Double> values() {

		return values;
	}

	@Override
	public String toString() {

		return alias + "=" + (scalar ? String.valueOf(values.get(0)) : values.toString());
	}
}
