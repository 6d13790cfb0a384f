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

import java.util.Objects;

/**
 * A physical constant of an instrument with its absolute error and unit,
 * for example a sample to detector distance of 2.25 +- 0.001 m.
 *
 * @author Barry DeZonia
 */
public final class InstrumentConstant {

	private final double value;

	private final double error;

	private final String unit;

	public InstrumentConstant(double value, double error, String unit) {

		this.value = value;
		this.error = error;
		this.unit = Objects.requireNonNull(unit, "unit");
	}

	/**
	 * @param percent The error as a percentage of the value.
	 */
	public static InstrumentConstant withRelativeError(double value, double percent, String unit) {

		return new InstrumentConstant(value, value * percent / 100.0, unit);
	}

	public double value() {

		return value;
	}

	public double error() {

		return error;
	}

	public String unit() {

		return unit;
	}

	@Override
	public boolean equals(Object o) {

		if (!(o instanceof InstrumentConstant))
			return false;

		InstrumentConstant other = (InstrumentConstant) o;

		return Double.compare(value, other.value) == 0 && Double.compare(error, other.error) == 0 &&
				unit.equals(other.unit);
	}

	@Override
	public int hashCode() {

		return Objects.hash(value, error, unit);
	}

	@Override
	public String toString() {

		return value + " +- " + error + " " + unit;
	}
}
