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
 * The header document and the point table of one IN12 scan file.
 *
 * @author Barry DeZonia
 */
public final class In12Scan {

	private final MetadataDocument metadata;

	private final NeutronDataTable table;

	public In12Scan(MetadataDocument metadata, NeutronDataTable table) {

		this.metadata = metadata;
		this.table = table;
	}

	public MetadataDocument metadata() {

		return metadata;
	}

	public NeutronDataTable table() {

		return table;
	}

	/**
	 * Looks a name up as a whole section first and then as a key inside
	 * any section.
	 *
	 * @param key
	 * @return The section as an entries value, the key's value, or
	 *   {@link MetadataValue#NONE} when neither exists.
	 */
	public MetadataValue lookup(String key) {

		if (metadata.hasSection(key))
			return MetadataValue.ofEntries(metadata.section(key));

		return metadata.find(key).orElse(MetadataValue.NONE);
	}
}
