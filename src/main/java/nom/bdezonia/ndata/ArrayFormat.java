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

import java.util.List;

/**
 * Column names and storage types of an ASCII scan table.
 *
 * @author Barry DeZonia
 */
public final class ArrayFormat {

	private final List<String> names;

	private final List<ColumnType> types;

	public ArrayFormat(List<String> names, List<ColumnType> types) {

		if (names.size() != types.size())
			throw new ConfigurationException("array format has " + names.size() + " names but " + types.size() + " types");

		this.names = List.copyOf(names);

		this.types = List.copyOf(types);
	}

	public List<String> names() {

		return names;
	}

	public List<ColumnType> types() {

		return types;
	}

	public int columnCount() {

		return names.size();
	}

	@Override
	public boolean equals(Object o) {

		if (!(o instanceof ArrayFormat))
			return false;

		ArrayFormat other = (ArrayFormat) o;

		return names.equals(other.names) && types.equals(other.types);
	}

	@Override
	public int hashCode() {

		return 31 * names.hashCode() + types.hashCode();
	}

	@Override
	public String toString() {

		return "ArrayFormat" + names + types;
	}
}
