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

import java.util.Arrays;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.NdData;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.storage.Storage;
import nom.bdezonia.zorbage.type.integer.int32.SignedInt32Member;

/**
 * Neutron counts of one detector file held in zorbage storage.
 * <p>
 * Shapes and indices are given in detector order, slowest axis first, for
 * example {@code (foil, time bin, y, x)}. Zorbage orders dimensions fastest
 * first, so the backing {@link NdData} carries the reversed dimensions. Both
 * describe the same flat storage, which is the order the counts are written
 * to disk.
 *
 * @author Barry DeZonia
 */
public final class RawDataArray {

	private static final String[] AXIS_NAMES_4D = {"x", "y", "time bin", "foil"};

	private final long[] shape;

	private final long[] strides;

	private final IndexedDataSource<SignedInt32Member> values;

	private final NdData<SignedInt32Member> data;

	/**
	 *
	 * @param shape Dimensions in detector order.
	 * @param values Flat counts, last axis fastest.
	 */
	public RawDataArray(long[] shape, IndexedDataSource<SignedInt32Member> values) {

		long count = 1;

		for (long d : shape) {

			if (d <= 0)
				throw new IllegalArgumentException("dimensions must be positive: " + Arrays.toString(shape));

			count *= d;
		}

		if (count != values.size())
			throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " does not match " + values.size() + " values");

		this.shape = shape.clone();

		this.values = values;

		this.strides = new long[shape.length];

		long stride = 1;

		for (int i = shape.length - 1; i >= 0; i--) {

			strides[i] = stride;

			stride *= shape[i];
		}

		this.data = new NdData<>(reverse(shape), values);

		data.setValueType("Counts");

		data.setValueUnit("");

		if (shape.length == AXIS_NAMES_4D.length) {

			for (int i = 0; i < AXIS_NAMES_4D.length; i++) {

				data.setAxisType(i, AXIS_NAMES_4D[i]);
			}
		}
	}

	/**
	 * Copies plain counts into zorbage storage.
	 *
	 * @param shape Dimensions in detector order.
	 * @param counts Flat counts, last axis fastest.
	 * @return
	 */
	public static RawDataArray of(long[] shape, int[] counts) {

		IndexedDataSource<SignedInt32Member> storage = Storage.allocate(G.INT32.construct(), counts.length);

		SignedInt32Member value = G.INT32.construct();

		for (int i = 0; i < counts.length; i++) {

			value.setV(counts[i]);

			storage.set(i, value);
		}

		return new RawDataArray(shape, storage);
	}

	/**
	 * @return Dimensions in detector order.
	 */
	public long[] shape() {

		return shape.clone();
	}

	public int numDimensions() {

		return shape.length;
	}

	public long size() {

		return values.size();
	}

	/**
	 * @return The counts as a zorbage data source (dimensions fastest first).
	 */
	public DimensionedDataSource<SignedInt32Member> dataSource() {

		return data;
	}

	public void setSource(String source) {

		data.setSource(source);
	}

	/**
	 *
	 * @param index One coordinate per axis, detector order.
	 * @return
	 */
	public int get(long... index) {

		if (index.length != shape.length)
			throw new IllegalArgumentException("expected " + shape.length + " coordinates, got " + index.length);

		long offset = 0;

		for (int i = 0; i < index.length; i++) {

			if (index[i] < 0 || index[i] >= shape[i])
				throw new IndexOutOfBoundsException("coordinate " + index[i] + " outside axis " + i + " of length " + shape[i]);

			offset += index[i] * strides[i];
		}

		return at(offset);
	}

	/**
	 * Reads a count by its position in flat storage.
	 */
	public int at(long flatIndex) {

		SignedInt32Member value = G.INT32.construct();

		values.get(flatIndex, value);

		return value.v();
	}

	public long stride(int axis) {

		return strides[axis];
	}

	public long sum() {

		SignedInt32Member value = G.INT32.construct();

		long total = 0;

		for (long i = 0; i < values.size(); i++) {

			values.get(i, value);

			total += value.v();
		}

		return total;
	}

	/**
	 * Copies out one entry of the leading axis, e.g. the (time, y, x) counts
	 * of one foil.
	 *
	 * @param index
	 * @return An array with one dimension less.
	 */
	public RawDataArray channel(int index) {

		return selectChannels(index).squeezeLeading();
	}

	/**
	 * Copies the listed entries of the leading axis, in the listed order,
	 * into a new array.
	 *
	 * @param indices
	 * @return
	 */
	public RawDataArray selectChannels(int... indices) {

		if (shape.length < 2)
			throw new IllegalArgumentException("a one dimensional array has no channels");

		long block = strides[0];

		IndexedDataSource<SignedInt32Member> storage = Storage.allocate(G.INT32.construct(), block * indices.length);

		SignedInt32Member value = G.INT32.construct();

		for (int c = 0; c < indices.length; c++) {

			int idx = indices[c];

			if (idx < 0 || idx >= shape[0])
				throw new IllegalArgumentException("channel " + idx + " outside 0.." + (shape[0] - 1));

			long from = idx * block;

			long to = c * block;

			for (long i = 0; i < block; i++) {

				values.get(from + i, value);

				storage.set(to + i, value);
			}
		}

		long[] newShape = shape.clone();

		newShape[0] = indices.length;

		return new RawDataArray(newShape, storage);
	}

	/**
	 * Sums all axes but the last two.
	 *
	 * @return The detector image indexed {@code [y][x]}.
	 */
	public double[][] image() {

		if (shape.length < 2)
			throw new IllegalArgumentException("an image needs at least two dimensions");

		int rows = (int) shape[shape.length - 2];

		int cols = (int) shape[shape.length - 1];

		double[][] image = new double[rows][cols];

		long frame = (long) rows * cols;

		SignedInt32Member value = G.INT32.construct();

		for (long i = 0; i < values.size(); i++) {

			values.get(i, value);

			long pos = i % frame;

			image[(int) (pos / cols)][(int) (pos % cols)] += value.v();
		}

		return image;
	}

	/**
	 * Projects the counts onto one axis by summing over every other axis.
	 *
	 * @param axis Axis in detector order.
	 * @return
	 */
	public double[] marginal(int axis) {

		if (axis < 0 || axis >= shape.length)
			throw new IllegalArgumentException("no axis " + axis + " in " + shape.length + " dimensions");

		double[] profile = new double[(int) shape[axis]];

		SignedInt32Member value = G.INT32.construct();

		for (long i = 0; i < values.size(); i++) {

			values.get(i, value);

			profile[(int) ((i / strides[axis]) % shape[axis])] += value.v();
		}

		return profile;
	}

	private RawDataArray squeezeLeading() {

		return new RawDataArray(Arrays.copyOfRange(shape, 1, shape.length), values);
	}

	private static long[] reverse(long[] dims) {

		long[] reversed = new long[dims.length];

		for (int i = 0; i < dims.length; i++) {

			reversed[i] = dims[dims.length - 1 - i];
		}

		return reversed;
	}

	@Override
	public String toString() {

		return "RawDataArray" + Arrays.toString(shape);
	}
}
