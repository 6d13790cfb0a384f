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

/**
 * The array layouts a CASCADE detector dump can hold, in detector order
 * (slowest axis first).
 *
 * @author Barry DeZonia
 */
public enum DetectorShape {

	/**
	 * foil x time bin x y pixel x x pixel
	 */
	TIME_RESOLVED(8, 16, 128, 128),

	/**
	 * y pixel x x pixel
	 */
	SINGLE_FRAME(128, 128);

	public static final int TIME_BINS = 16;

	public static final int PIXELS = 128;

	private final long[] dims;

	DetectorShape(long... dims) {

		this.dims = dims;
	}

	public long[] dims() {

		return dims.clone();
	}

	public long elementCount() {

		long count = 1;

		for (long d : dims) {

			count *= d;
		}

		return count;
	}

	/**
	 * @return This shape followed by every simpler shape, the order in
	 *   which a payload of unknown layout is tried.
	 */
	public List<DetectorShape> withFallbacks() {

		List<DetectorShape> shapes = new ArrayList<>();

		for (DetectorShape s : values()) {

			if (s.ordinal() >= ordinal())
				shapes.add(s);
		}

		return shapes;
	}
}
