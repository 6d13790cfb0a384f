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

/**
 * The line conventions of the two colon separated header formats.
 *
 * @author Barry DeZonia
 */
public enum HeaderDialect {

	/**
	 * Headers appended to CASCADE detector dumps (.pad, .tof): sections
	 * start with {@code ###name}.
	 */
	CASCADE("###", 0, false),

	/**
	 * NICOS ASCII scan files (.dat): every header line starts with one
	 * {@code #} that is dropped, sections then start with {@code ##name}.
	 */
	ASCII("##", 1, true);

	private final String sectionMarker;
	private final int prefixLength;
	private final boolean commentedHeader;

	HeaderDialect(String sectionMarker, int prefixLength, boolean commentedHeader) {

		this.sectionMarker = sectionMarker;
		this.prefixLength = prefixLength;
		this.commentedHeader = commentedHeader;
	}

	public String sectionMarker() {

		return sectionMarker;
	}

	/**
	 * @return Number of leading characters removed from each line before
	 *   it is tokenized.
	 */
	public int prefixLength() {

		return prefixLength;
	}

	/**
	 * @return True when only {@code #} lines belong to the header and the
	 *   {@code Scan data} section lists column names and units.
	 */
	public boolean commentedHeader() {

		return commentedHeader;
	}
}
