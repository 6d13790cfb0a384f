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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Names the header keys a loader keeps, per section, and optionally the
 * alias each kept key is stored under.
 *
 * @author Barry DeZonia
 */
public final class MetadataFilter {

	private final Map<String, List<Selection>> selections;

	private MetadataFilter(Map<String, List<Selection>> selections) {

		Map<String, List<Selection>> copy = new LinkedHashMap<>();

		for (Map.Entry<String, List<Selection>> e : selections.entrySet()) {

			copy.put(e.getKey(), List.copyOf(e.getValue()));
		}

		this.selections = Collections.unmodifiableMap(copy);
	}

	public static Builder builder() {

		return new Builder();
	}

	public Set<String> sectionNames() {

		return selections.keySet();
	}

	public List<Selection> selections(String section) {

		List<Selection> list = selections.get(section);

		return list == null ? List.of() : list;
	}

	public boolean isEmpty() {

		return selections.isEmpty();
	}

	@Override
	public boolean equals(Object o) {

		return o instanceof MetadataFilter && selections.equals(((MetadataFilter) o).selections);
	}

	@Override
	public int hashCode() {

		return selections.hashCode();
	}

	@Override
	public String toString() {

		return selections.toString();
	}

	/**
	 * One kept key and the name it is stored under.
	 */
	public static final class Selection {

		private final String key;
		private final String alias;

		public Selection(String key, String alias) {

			this.key = Objects.requireNonNull(key, "key");

			this.alias = alias;
		}

		public String key() {

			return key;
		}

		/**
		 * @return The alias, or null when the key keeps its own name.
		 */
		public String alias() {

			return alias;
		}

		public String targetName() {

			return alias == null ? key : alias;
		}

		@Override
		public boolean equals(Object o) {

			if (!(o instanceof Selection))
				return false;

			Selection other = (Selection) o;

			return key.equals(other.key) && Objects.equals(alias, other.alias);
		}

		@Override
		public int hashCode() {

			return Objects.hash(key, alias);
		}

		@Override
		public String toString() {

			return "[" + key + ", " + alias + "]";
		}
	}

	public static final class Builder {

		private final Map<String, List<Selection>> selections = new LinkedHashMap<>();

		private Builder() { }

		public Builder keep(String section, String key) {

			return keep(section, key, null);
		}

		public Builder keep(String section, String key, String alias) {

			selections.computeIfAbsent(section, k -> new ArrayList<>()).add(new Selection(key, alias));

			return this;
		}

		public MetadataFilter build() {

			return new MetadataFilter(selections);
		}
	}
}
