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

import nom.bdezonia.ndata.InstrumentConstant;
import nom.bdezonia.ndata.InstrumentSettings;

/**
 * An annulus sector around the direct beam. Angles are measured clockwise
 * in degrees from the positive y direction of the detector. A sector whose
 * end angle is below its start angle wraps through 0.
 * <p>
 * The sample to detector distance and the wavelength come from the
 * instrument constants {@code distance_SD} and {@code wavelength}, so a
 * sector can report the momentum transfer it covers.
 *
 * @author Barry DeZonia
 */
public final class SectorMask extends DetectorMask {

	public static final String DISTANCE_KEY = "distance_SD";

	public static final String WAVELENGTH_KEY = "wavelength";

	private final int centerX;

	private final int centerY;

	private final int innerRadius;

	private final int outerRadius;

	private final double startAngle;

	private final double endAngle;

	private final InstrumentConstant distance;

	private final InstrumentConstant wavelength;

	private final boolean[][] inside;

	/**
	 *
	 * @param size
	 * @param centerX Beam centre column.
	 * @param centerY Beam centre row.
	 * @param innerRadius In pixels, inclusive.
	 * @param outerRadius In pixels, inclusive.
	 * @param startAngle Degrees.
	 * @param endAngle Degrees.
	 * @param settings Must carry the distance_SD and wavelength constants.
	 */
	public SectorMask(int size, int centerX, int centerY, int innerRadius, int outerRadius,
			double startAngle, double endAngle, InstrumentSettings settings)
	{
		super("Sector mask", size, settings);

		if (innerRadius < 0 || outerRadius < innerRadius)
			throw new IllegalArgumentException("bad radii " + innerRadius + ", " + outerRadius);

		this.centerX = centerX;
		this.centerY = centerY;
		this.innerRadius = innerRadius;
		this.outerRadius = outerRadius;
		this.startAngle = startAngle;
		this.endAngle = endAngle;
		this.distance = settings.constant(DISTANCE_KEY);
		this.wavelength = settings.constant(WAVELENGTH_KEY);
		this.inside = new boolean[size][size];

		double tmin = Math.toRadians(startAngle);

		double tmax = Math.toRadians(endAngle);

		if (tmax < tmin)
			tmax += 2 * Math.PI;

		double span = tmax - tmin;

		long rin2 = (long) innerRadius * innerRadius;

		long rout2 = (long) outerRadius * outerRadius;

		for (int y = 0; y < size; y++) {

			for (int x = 0; x < size; x++) {

				long dx = x - centerX;

				long dy = y - centerY;

				long r2 = dx * dx + dy * dy;

				if (r2 < rin2 || r2 > rout2)
					continue;

				double theta = (Math.atan2(dx, dy) - tmin) % (2 * Math.PI);

				if (theta < 0)
					theta += 2 * Math.PI;

				inside[y][x] = theta <= span;
			}
		}
	}

	public int centerX() {

		return centerX;
	}

	public int centerY() {

		return centerY;
	}

	public int innerRadius() {

		return innerRadius;
	}

	public int outerRadius() {

		return outerRadius;
	}

	public double startAngle() {

		return startAngle;
	}

	public double endAngle() {

		return endAngle;
	}

	@Override
	public double weight(int row, int col) {

		return inside[row][col] ? 1 : 0;
	}

	/**
	 * The scattering vector of a neutron of the instrument wavelength that
	 * lands on a pixel, taking the mask centre as the direct beam.
	 *
	 * @param row
	 * @param col
	 * @return {qx, qy, qz}
	 */
	public double[] scatteringVector(int row, int col) {

		double k = 2 * Math.PI / wavelength.value();

		double d = distance.value();

		double px = PIXEL_SIZE * (col - centerX);

		double py = PIXEL_SIZE * (row - centerY);

		double path = Math.sqrt(d * d + px * px + py * py);

		return new double[] {px / path * k, py / path * k, (d / path - 1) * k};
	}

	/**
	 * Averages |q| over the pixels of the sector. The error is the sample
	 * standard deviation of the pixel values, NaN for fewer than two
	 * pixels.
	 *
	 * @return
	 */
	public MomentumTransfer momentumTransfer() {

		double sum = 0;

		int count = 0;

		double[][] magnitudes = new double[size()][size()];

		for (int r = 0; r < size(); r++) {

			for (int c = 0; c < size(); c++) {

				if (!inside[r][c])
					continue;

				double[] q = scatteringVector(r, c);

				magnitudes[r][c] = Math.sqrt(q[0] * q[0] + q[1] * q[1] + q[2] * q[2]);

				sum += magnitudes[r][c];

				count++;
			}
		}

		if (count == 0)
			return new MomentumTransfer(Double.NaN, Double.NaN);

		double mean = sum / count;

		if (count == 1)
			return new MomentumTransfer(mean, Double.NaN);

		double squares = 0;

		for (int r = 0; r < size(); r++) {

			for (int c = 0; c < size(); c++) {

				if (inside[r][c])
					squares += (magnitudes[r][c] - mean) * (magnitudes[r][c] - mean);
			}
		}

		return new MomentumTransfer(mean, Math.sqrt(squares / (count - 1)));
	}
}
