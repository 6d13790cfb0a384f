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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The header of one instrument file: an ordered mapping from section name
 * to an ordered mapping from key to {@link MetadataValue}. Documents are
 * immutable once built.
 *
 * @author Barry DeZonia
 */
public final class MetadataDocument {

	private static final Logger logger = LoggerFactory.getLogger(MetadataDocument.class);

	private final Map<String, Map<String, MetadataValue>> sections;

	private MetadataDocument(Map<String, Map<String, MetadataValue>> sections) {

		Map<String, Map<String, MetadataValue>> copy = new LinkedHashMap<>();

		for (Map.Entry<String, Map<String, MetadataValue>> e : sections.entrySet()) {

			copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
		}

		this.sections = Collections.unmodifiableMap(copy);
	}

	public static Builder builder() {

		return new Builder();
	}

	public Set<String> sectionNames() {

		return sections.keySet();
	}

	public boolean hasSection(String name) {

		return sections.containsKey(name);
	}

	/**
	 * @return The entries of a section, empty if there is no such section.
	 */
	public Map<String, MetadataValue> section(String name) {

		Map<String, MetadataValue> section = sections.get(name);

		return section == null ? Collections.emptyMap() : section;
	}

	public Optional<MetadataValue> get(String section, String key) {

		return Optional.ofNullable(section(section).get(key));
	}

	/**
	 * Searches every section, in document order, for the given key.
	 *
	 * @param key
	 * @return The first value stored under the key.
	 */
	public Optional<MetadataValue> find(String key) {

		for (Map<String, MetadataValue> section : sections.values()) {

			MetadataValue value = section.get(key);

			if (value != null)
				return Optional.of(value);
		}

		return Optional.empty();
	}

	/**
	 * Builds a reduced document holding only the keys named by the filter,
	 * renamed to their aliases where the filter gives one. Requested keys
	 * that are not present are reported and left out.
	 *
	 * @param filter
	 * @return A new document.
	 */
	public MetadataDocument filter(MetadataFilter filter) {

		Builder builder = builder();

		for (String sectionName : filter.sectionNames()) {

			builder.openSection(sectionName);

			for (MetadataFilter.Selection selection : filter.selections(sectionName)) {

				MetadataValue value = section(sectionName).get(selection.key());

				if (value == null) {

					logger.warn("metadata filter asks for missing key '{}' in section '{}'", selection.key(), sectionName);

					continue;
				}

				builder.put(sectionName, selection.targetName(), value);
			}
		}

		return builder.build();
	}

	public int size() {

		return sections.size();
	}

	@Override
	public boolean equals(Object o) {

		if (this == o)
			return true;

		if (!(o instanceof MetadataDocument))
			return false;

		return sections.equals(((MetadataDocument) o).sections);
	}

	@Override
	public int hashCode() {

		return sections.hashCode();
	}

	@Override
	public String toString() {

		return sections.toString();
	}

	/**
	 * Mutable accumulator used by the header parsers while they walk a file.
	 */
	public static final class Builder {

		private final Map<String, Map<String, MetadataValue>> sections = new LinkedHashMap<>();

		private Builder() { }

		/**
		 * Starts a new empty section, replacing any earlier section of the
		 * same name.
		 */
		public Builder openSection(String name) {

			sections.put(name, new LinkedHashMap<>());

			return this;
		}

		/**
		 * Opens the section only when it does not exist yet.
		 */
		public Builder ensureSection(String name) {

			sections.computeIfAbsent(name, k -> new LinkedHashMap<>());

			return this;
		}

		public Builder put(String section, String key, MetadataValue value) {

			ensureSection(section);

			sections.get(section).put(key, value);

			return this;
		}

		public Builder putAll(String section, Map<String, MetadataValue> values) {

			ensureSection(section);

			sections.get(section).putAll(values);

			return this;
		}

		public int sectionSize(String section) {

			Map<String, MetadataValue> entries = sections.get(section);

			return entries == null ? 0 : entries.size();
		}

		public Builder removeSection(String name) {

			sections.remove(name);

			return this;
		}

		public MetadataDocument build() {

			return new MetadataDocument(sections);
		}
	}
}
