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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads instrument defaults from YAML. Each top level key names an
 * instrument:
 * <pre>
 * RESEDA:
 *   modes: [TOF, PAD, SANS, DAT]
 *   foils: [7, 6, 5, 0, 1, 2]
 *   echotime_key: echotime
 *   metadata:
 *     Sample:
 *       - [temperature, T]
 *   array_format:
 *     names: [timestamp, counts]
 *     types: [f8, i8]
 *   constants:
 *     distance_SD: {value: 2.25, error: 0.001, unit: m}
 *     wavelength: {value: 6.0, relative_error: 10.0, unit: A-1}
 * </pre>
 * A relative error is a percentage of the value.
 *
 * @author Barry DeZonia
 */
public class InstrumentSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(InstrumentSettingsLoader.class);

	public static final String BUNDLED_RESOURCE = "instruments.yml";

	private final Map<String, Map<String, Object>> instruments;

	InstrumentSettingsLoader(Map<String, Map<String, Object>> instruments) {

		this.instruments = Collections.unmodifiableMap(instruments);
	}

	/**
	 * @return The defaults shipped with this library (RESEDA, MIRA, PANDA).
	 */
	public static

		InstrumentSettingsLoader

			bundled()
	{
		try (InputStream in = InstrumentSettingsLoader.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {

			if (in == null)
				throw new ConfigurationException("resource " + BUNDLED_RESOURCE + " is missing from the classpath");

			return read(new InputStreamReader(in, StandardCharsets.UTF_8), BUNDLED_RESOURCE);

		} catch (IOException e) {

			throw new ConfigurationException("cannot read " + BUNDLED_RESOURCE, e);
		}
	}

	public static

		InstrumentSettingsLoader

			fromFile(Path path) throws IOException
	{
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {

			return read(reader, path.toString());
		}
	}

	@SuppressWarnings("unchecked")
	static

		InstrumentSettingsLoader

			read(Reader reader, String source)
	{
		Object loaded;

		try {

			loaded = new Yaml().load(reader);

		} catch (YAMLException e) {

			throw new ConfigurationException("cannot parse instrument settings in " + source, e);
		}

		if (!(loaded instanceof Map))
			throw new ConfigurationException("YAML root is not a map: " + source);

		Map<String, Map<String, Object>> instruments = new LinkedHashMap<>();

		for (Map.Entry<String, Object> e : ((Map<String, Object>) loaded).entrySet()) {

			if (!(e.getValue() instanceof Map))
				throw new ConfigurationException("instrument '" + e.getKey() + "' in " + source + " is not a map");

			instruments.put(e.getKey().toUpperCase(Locale.ROOT), (Map<String, Object>) e.getValue());
		}

		logger.debug("read settings of {} from {}", instruments.keySet(), source);

		return new InstrumentSettingsLoader(instruments);
	}

	public Set<String> instruments() {

		return instruments.keySet();
	}

	/**
	 *
	 * @param instrument Instrument name, any case.
	 * @param modeName Acquisition mode name, any case.
	 * @return
	 * @throws ConfigurationException if the instrument is unknown, does not
	 *   offer the mode, or its entry is malformed.
	 */
	public InstrumentSettings load(String instrument, String modeName) {

		String name = instrument.toUpperCase(Locale.ROOT);

		Map<String, Object> entry = instruments.get(name);

		if (entry == null)
			throw new ConfigurationException("unknown instrument '" + instrument + "', known are " + instruments.keySet());

		AcquisitionMode mode = AcquisitionMode.fromName(modeName);

		List<String> modes = strings(entry.get("modes"), name + ".modes");

		if (!modes.isEmpty() && !modes.contains(mode.name()))
			throw new ConfigurationException("The " + modeName + "-mode is not recognized as a valid option for " + name);

		InstrumentSettings settings = InstrumentSettings.of(name, mode);

		if (entry.containsKey("foils"))
			settings = settings.withFoils(integers(entry.get("foils"), name + ".foils"));

		if (entry.containsKey("echotime_key"))
			settings = settings.withEchoTimeKey(String.valueOf(entry.get("echotime_key")));

		if (entry.containsKey("metadata"))
			settings = settings.withMetadataFilter(filter(entry.get("metadata"), name + ".metadata"));

		if (entry.containsKey("array_format") && !mode.isBinary())
			settings = settings.withArrayFormat(arrayFormat(entry.get("array_format"), name + ".array_format"));

		for (Map.Entry<String, Object> c : map(entry.getOrDefault("constants", Map.of()), name + ".constants").entrySet()) {

			settings = settings.withConstant(c.getKey(), constant(c.getValue(), name + ".constants." + c.getKey()));
		}

		return settings;
	}

	@SuppressWarnings("unchecked")
	private static

		Map<String, Object>

			map(Object o, String where)
	{
		if (!(o instanceof Map))
			throw new ConfigurationException(where + " must be a map");

		return (Map<String, Object>) o;
	}

	private static

		List<?>

			list(Object o, String where)
	{
		if (o == null)
			return List.of();

		if (!(o instanceof List))
			throw new ConfigurationException(where + " must be a list");

		return (List<?>) o;
	}

	private static

		List<String>

			strings(Object o, String where)
	{
		List<String> result = new ArrayList<>();

		for (Object v : list(o, where)) {

			result.add(String.valueOf(v).toUpperCase(Locale.ROOT));
		}

		return result;
	}

	private static

		List<Integer>

			integers(Object o, String where)
	{
		List<Integer> result = new ArrayList<>();

		for (Object v : list(o, where)) {

			if (!(v instanceof Integer))
				throw new ConfigurationException(where + " must hold integers, found '" + v + "'");

			result.add((Integer) v);
		}

		return result;
	}

	private static

		double

			number(Object o, String where)
	{
		if (!(o instanceof Number))
			throw new ConfigurationException(where + " must be a number, found '" + o + "'");

		return ((Number) o).doubleValue();
	}

	private static

		MetadataFilter

			filter(Object o, String where)
	{
		MetadataFilter.Builder builder = MetadataFilter.builder();

		for (Map.Entry<String, Object> section : map(o, where).entrySet()) {

			for (Object selection : list(section.getValue(), where + "." + section.getKey())) {

				if (selection instanceof List) {

					List<?> pair = (List<?>) selection;

					if (pair.isEmpty() || pair.size() > 2)
						throw new ConfigurationException(where + "." + section.getKey() + " entries are [key] or [key, alias]");

					Object alias = pair.size() == 2 ? pair.get(1) : null;

					builder.keep(section.getKey(), String.valueOf(pair.get(0)), alias == null ? null : String.valueOf(alias));
				}
				else {

					builder.keep(section.getKey(), String.valueOf(selection));
				}
			}
		}

		return builder.build();
	}

	private static

		ArrayFormat

			arrayFormat(Object o, String where)
	{
		Map<String, Object> m = map(o, where);

		List<String> names = new ArrayList<>();

		for (Object n : list(m.get("names"), where + ".names")) {

			names.add(String.valueOf(n));
		}

		List<ColumnType> types = new ArrayList<>();

		for (Object t : list(m.get("types"), where + ".types")) {

			types.add(ColumnType.from(String.valueOf(t)));
		}

		return new ArrayFormat(names, types);
	}

	private static

		InstrumentConstant

			constant(Object o, String where)
	{
		Map<String, Object> m = map(o, where);

		double value = number(m.get("value"), where + ".value");

		String unit = m.containsKey("unit") ? String.valueOf(m.get("unit")) : "";

		if (m.containsKey("relative_error"))
			return InstrumentConstant.withRelativeError(value, number(m.get("relative_error"), where + ".relative_error"), unit);

		double error = m.containsKey("error") ? number(m.get("error"), where + ".error") : 0.0;

		return new InstrumentConstant(value, error, unit);
	}
}
