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
package nom.bdezonia.ndata;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.misc.DataSourceUtils;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * The scan points of a triple axis scan: a numeric table with named
 * columns (one per counter or motor) and one row per point.
 *
 * @author Barry DeZonia
 */
public final class NeutronDataTable {

	private final DimensionedDataSource<Float64Member> data;

	private final List<String> names;

	private final List<String> units;

	/**
	 *
	 * @param data Values indexed (column, row).
	 * @param names
	 * @param units
	 */
	public NeutronDataTable(DimensionedDataSource<Float64Member> data, List<String> names, List<String> units) {

		long[] dims = DataSourceUtils.dimensions(data);

		if (dims.length != 2)
			throw new IllegalArgumentException("a data table has two dimensions, not " + dims.length);

		if (names.size() != dims[0] || units.size() != dims[0])
			throw new IllegalArgumentException("table has " + dims[0] + " columns but " + names.size() + " names and " +
					units.size() + " units");

		this.data = data;
		this.names = List.copyOf(names);
		this.units = List.copyOf(units);
	}

	public DimensionedDataSource<Float64Member> dataSource() {

		return data;
	}

	public List<String> names() {

		return names;
	}

	public List<String> units() {

		return units;
	}

	public int columnCount() {

		return names.size();
	}

	public int rowCount() {

		return (int) DataSourceUtils.dimensions(data)[1];
	}

	public double value(int row, int column) {

		Float64Member val = G.DBL.construct();

		new TwoDView<>(data).get(column, row, val);

		return val.v();
	}

	public double[] column(String name) {

		int idx = names.indexOf(name);

		if (idx < 0)
			throw new IllegalArgumentException("no column named '" + name + "' in " + names);

		return column(idx);
	}

	public double[] column(int index) {

		TwoDView<Float64Member> vw = new TwoDView<>(data);

		Float64Member val = G.DBL.construct();

		double[] values = new double[rowCount()];

		for (int r = 0; r < values.length; r++) {

			vw.get(index, r, val);

			values[r] = val.v();
		}

		return values;
	}

	/**
	 * Copies a subset of the columns. Columns may be named by index, by name
	 * or both; the union is returned in column order. With neither, the
	 * whole table is returned.
	 *
	 * @param indices
	 * @param columnNames
	 * @return
	 */
	public NeutronDataTable select(List<Integer> indices, List<String> columnNames) {

		if (indices.isEmpty() && columnNames.isEmpty())
			return this;

		TreeSet<Integer> chosen = new TreeSet<>(indices);

		for (String name : columnNames) {

			int idx = names.indexOf(name);

			if (idx < 0)
				throw new IllegalArgumentException("no column named '" + name + "' in " + names);

			chosen.add(idx);
		}

		int rows = rowCount();

		Float64Member val = G.DBL.construct();

		DimensionedDataSource<Float64Member> copy =
				DimensionedStorage.allocate(val, new long[] {chosen.size(), rows});

		TwoDView<Float64Member> from = new TwoDView<>(data);

		TwoDView<Float64Member> to = new TwoDView<>(copy);

		List<String> newNames = new ArrayList<>();

		List<String> newUnits = new ArrayList<>();

		int x = 0;

		for (int c : chosen) {

			if (c < 0 || c >= columnCount())
				throw new IllegalArgumentException("column index " + c + " outside 0.." + (columnCount() - 1));

			for (int r = 0; r < rows; r++) {

				from.get(c, r, val);

				to.set(x, r, val);
			}

			newNames.add(names.get(c));

			newUnits.add(units.get(c));

			x++;
		}

		return new NeutronDataTable(copy, newNames, newUnits);
	}
}
