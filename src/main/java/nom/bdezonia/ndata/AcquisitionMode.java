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

import java.util.Locale;

/**
 * The kind of file an instrument writes for a measurement.
 *
 * @author Barry DeZonia
 */
public enum AcquisitionMode {

	/**
	 * time resolved CASCADE dump (.tof)
	 */
	TOF(DetectorShape.TIME_RESOLVED),

	/**
	 * single CASCADE frame (.pad)
	 */
	PAD(DetectorShape.SINGLE_FRAME),

	/**
	 * same files as PAD
	 */
	SANS(DetectorShape.SINGLE_FRAME),

	/**
	 * ASCII scan file (.dat)
	 */
	DAT(null);

	private final DetectorShape shape;

	AcquisitionMode(DetectorShape shape) {

		this.shape = shape;
	}

	/**
	 * @return The detector array layout, or null for ASCII scan files.
	 */
	public DetectorShape shape() {

		return shape;
	}

	public boolean isBinary() {

		return shape != null;
	}

	public static AcquisitionMode fromName(String name) {

		if (name != null) {

			for (AcquisitionMode m : values()) {

				if (m.name().equals(name.trim().toUpperCase(Locale.ROOT)))
					return m;
			}
		}

		throw new ConfigurationException("The '" + name + "' mode is not recognized as a valid option");
	}
}
