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

import nom.bdezonia.ndata.RawDataArray;

/**
 * Contracts detector frames to a time series by summing the counts inside
 * a region of interest.
 *
 * @author Barry DeZonia
 */
public class RoiExtractor {

	// do not instantiate

	private RoiExtractor() { }

	/**
	 * Sums each frame of a stack over a rectangular window. The window is
	 * cut to the frame.
	 *
	 * @param frames Counts shaped (frame, y, x), or a single (y, x) frame.
	 * @param roi
	 * @return One sum per frame.
	 * @throws UnsupportedOperationException for mask regions.
	 */
	public static

		double[]

			extract(RawDataArray frames, RoiSpec roi)
	{
		if (!roi.isRectangular())
			throw new UnsupportedOperationException("mask based ROI extraction is not implemented");

		long[] shape = frames.shape();

		if (shape.length != 2 && shape.length != 3)
			throw new IllegalArgumentException("expected (y, x) or (frame, y, x) counts, got " + frames);

		int rows = (int) shape[shape.length - 2];

		int cols = (int) shape[shape.length - 1];

		int numFrames = shape.length == 3 ? (int) shape[0] : 1;

		int[] lrbt = roi.lrbtWindow();

		int left = clamp(lrbt[0], cols);

		int right = clamp(lrbt[1], cols);

		int bottom = clamp(lrbt[2], rows);

		int top = clamp(lrbt[3], rows);

		long frameSize = (long) rows * cols;

		double[] series = new double[numFrames];

		for (int f = 0; f < numFrames; f++) {

			double sum = 0;

			for (int y = bottom; y < top; y++) {

				long rowStart = f * frameSize + (long) y * cols;

				for (int x = left; x < right; x++) {

					sum += frames.at(rowStart + x);
				}
			}

			series[f] = sum;
		}

		return series;
	}

	private static

		int

			clamp(int value, int length)
	{
		return Math.max(0, Math.min(value, length));
	}
}
