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
package nom.bdezonia.ndata.mask;

import java.util.ArrayList;
import java.util.List;

import nom.bdezonia.ndata.InstrumentSettings;

/**
 * A union of axis aligned rectangles. A rectangle is given the way ROI
 * windows are: left and width along x (columns), bottom and height along
 * y (rows). Rectangles are cut to the detector.
 *
 * @author Barry DeZonia
 */
public final class SquareMask extends DetectorMask {

	private final boolean[][] inside;

	private final List<int[]> rectangles;

	/**
	 *
	 * @param size
	 * @param settings
	 * @param lbwh One or more {left, width, bottom, height} groups.
	 */
	public SquareMask(int size, InstrumentSettings settings, int... lbwh) {

		super("Square mask", size, settings);

		if (lbwh.length == 0 || lbwh.length % 4 != 0)
			throw new IllegalArgumentException("rectangles take four values each, got " + lbwh.length);

		this.inside = new boolean[size][size];

		this.rectangles = new ArrayList<>();

		for (int i = 0; i < lbwh.length; i += 4) {

			int left = lbwh[i];

			int width = lbwh[i + 1];

			int bottom = lbwh[i + 2];

			int height = lbwh[i + 3];

			rectangles.add(new int[] {left, width, bottom, height});

			for (int r = Math.max(0, bottom); r < Math.min(size, bottom + height); r++) {

				for (int c = Math.max(0, left); c < Math.min(size, left + width); c++) {

					inside[r][c] = true;
				}
			}
		}
	}

	/**
	 * @return Copies of the {left, width, bottom, height} groups.
	 */
	public List<int[]> rectangles() {

		List<int[]> copies = new ArrayList<>();

		for (int[] r : rectangles) {

			copies.add(r.clone());
		}

		return copies;
	}

	@Override
	public double weight(int row, int col) {

		return inside[row][col] ? 1 : 0;
	}
}
