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
 * A region of interest on the detector, given in exactly one of three ways:
 * left, bottom, width and height; left, right, bottom and top; or a weight
 * mask over the pixels. Right and top are exclusive.
 *
 * @author Barry DeZonia
 */
public final class RoiSpec {

	public enum Mode { LBWH, LRBT, MASK }

	private final Mode mode;

	private final int[] bounds;

	private final double[][] mask;

	private RoiSpec(Mode mode, int[] bounds, double[][] mask) {

		this.mode = mode;
		this.bounds = bounds;
		this.mask = mask;
	}

	/**
	 * Builds a spec from the addressing modes a caller filled in. Null or
	 * empty arguments count as not given.
	 *
	 * @param lbwh {left, bottom, width, height}
	 * @param lrbt {left, right, bottom, top}
	 * @param mask Weights indexed {@code [y][x]}.
	 * @return
	 * @throws ConfigurationException unless exactly one mode is given.
	 */
	public static RoiSpec of(int[] lbwh, int[] lrbt, double[][] mask) {

		boolean hasLbwh = lbwh != null && lbwh.length > 0;

		boolean hasLrbt = lrbt != null && lrbt.length > 0;

		boolean hasMask = mask != null && mask.length > 0;

		int given = (hasLbwh ? 1 : 0) + (hasLrbt ? 1 : 0) + (hasMask ? 1 : 0);

		if (given != 1)
			throw new ConfigurationException("ROI specification requires exactly one of lbwh, lrbt or mask, " +
					given + " were given");

		if (hasLbwh)
			return lbwh(lbwh);

		if (hasLrbt)
			return lrbt(lrbt);

		return mask(mask);
	}

	public static RoiSpec lbwh(int... lbwh) {

		if (lbwh.length != 4)
			throw new ConfigurationException("lbwh needs 4 values, got " + Arrays.toString(lbwh));

		return new RoiSpec(Mode.LBWH, lbwh.clone(), null);
	}

	public static RoiSpec lrbt(int... lrbt) {

		if (lrbt.length != 4)
			throw new ConfigurationException("lrbt needs 4 values, got " + Arrays.toString(lrbt));

		return new RoiSpec(Mode.LRBT, lrbt.clone(), null);
	}

	public static RoiSpec mask(double[][] mask) {

		double[][] copy = new double[mask.length][];

		for (int i = 0; i < mask.length; i++) {

			copy[i] = mask[i].clone();
		}

		return new RoiSpec(Mode.MASK, null, copy);
	}

	/**
	 * The default window around a beam center: nine pixels wide and high,
	 * shifted three pixels towards smaller x.
	 *
	 * @param center {y, x} as found by {@link BeamCenter}.
	 * @return
	 */
	public static RoiSpec aroundCenter(double[] center) {

		int cy = (int) center[0];

		int cx = (int) center[1];

		return lrbt(cx - 7, cx + 2, cy - 4, cy + 5);
	}

	public Mode mode() {

		return mode;
	}

	public boolean isRectangular() {

		return mode != Mode.MASK;
	}

	/**
	 * @return {left, right, bottom, top} with right and top exclusive.
	 */
	public int[] lrbtWindow() {

		if (mode == Mode.MASK)
			throw new UnsupportedOperationException("a mask ROI has no rectangular window");

		if (mode == Mode.LRBT)
			return bounds.clone();

		return new int[] {bounds[0], bounds[0] + bounds[2], bounds[1], bounds[1] + bounds[3]};
	}

	public double[][] mask() {

		if (mode != Mode.MASK)
			throw new IllegalStateException(mode + " ROI carries no mask");

		return mask;
	}

	@Override
	public boolean equals(Object o) {

		if (!(o instanceof RoiSpec))
			return false;

		RoiSpec other = (RoiSpec) o;

		return mode == other.mode && Arrays.equals(bounds, other.bounds) && Arrays.deepEquals(mask, other.mask);
	}

	@Override
	public int hashCode() {

		return 31 * mode.hashCode() + Arrays.hashCode(bounds);
	}

	@Override
	public String toString() {

		if (mode == Mode.MASK)
			return "mask[" + mask.length + "]";

		return mode.name().toLowerCase() + Arrays.toString(bounds);
	}
}
