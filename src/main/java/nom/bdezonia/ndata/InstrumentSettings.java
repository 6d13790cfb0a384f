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
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a loader needs to know about the instrument that wrote a file: the
 * acquisition mode and so the array layout, which detector foils carry
 * signal, which header keys to keep, and the instrument's physical
 * constants. Settings are immutable; the {@code with} methods return
 * modified copies.
 *
 * @author Barry DeZonia
 */
public final class InstrumentSettings {

	public static final String DEFAULT_ECHO_TIME_KEY = "echotime";

	private final String instrument;

	private final AcquisitionMode mode;

	private final List<Integer> foils;

	private final boolean metadata;

	private final MetadataFilter metadataFilter;

	private final boolean rawdata;

	private final ArrayFormat arrayFormat;

	private final String echoTimeKey;

	private final Map<String, InstrumentConstant> constants;

	private InstrumentSettings(String instrument, AcquisitionMode mode, List<Integer> foils, boolean metadata,
			MetadataFilter metadataFilter, boolean rawdata, ArrayFormat arrayFormat, String echoTimeKey,
			Map<String, InstrumentConstant> constants)
	{
		this.instrument = Objects.requireNonNull(instrument, "instrument");
		this.mode = Objects.requireNonNull(mode, "mode");
		this.foils = List.copyOf(foils);
		this.metadata = metadata;
		this.metadataFilter = metadataFilter;
		this.rawdata = rawdata;
		this.arrayFormat = arrayFormat;
		this.echoTimeKey = Objects.requireNonNull(echoTimeKey, "echoTimeKey");
		this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
	}

	/**
	 * Settings that read everything a file holds and select no foils.
	 *
	 * @param instrument
	 * @param mode
	 * @return
	 */
	public static InstrumentSettings of(String instrument, AcquisitionMode mode) {

		return new InstrumentSettings(instrument, mode, List.of(), true, null, true, null,
				DEFAULT_ECHO_TIME_KEY, Map.of());
	}

	public String instrument() {

		return instrument;
	}

	public AcquisitionMode mode() {

		return mode;
	}

	/**
	 * @return The array layout of detector files, null in DAT mode.
	 */
	public DetectorShape rawShape() {

		return mode.shape();
	}

	public List<Integer> foils() {

		return foils;
	}

	public int[] foilIndices() {

		int[] idx = new int[foils.size()];

		for (int i = 0; i < idx.length; i++) {

			idx[i] = foils.get(i);
		}

		return idx;
	}

	public boolean readsMetadata() {

		return metadata;
	}

	/**
	 * @return The keys to keep from file headers, null to keep all of them.
	 */
	public MetadataFilter metadataFilter() {

		return metadataFilter;
	}

	public boolean readsRawdata() {

		return rawdata;
	}

	/**
	 * @return The column layout forced onto ASCII scan tables, or null.
	 */
	public ArrayFormat arrayFormat() {

		return arrayFormat;
	}

	public String echoTimeKey() {

		return echoTimeKey;
	}

	public Map<String, InstrumentConstant> constants() {

		return constants;
	}

	public InstrumentConstant constant(String name) {

		InstrumentConstant c = constants.get(name);

		if (c == null)
			throw new ConfigurationException(instrument + " has no constant named '" + name + "'");

		return c;
	}

	/**
	 * Answers a setting by the name collaborators ask for it.
	 *
	 * @param key One of foils, metadata, rawdata, array_format, mode,
	 *   instrument or echotime_key.
	 * @return For metadata the filter when one is set, else whether
	 *   headers are read. For array_format the detector dimensions in
	 *   binary modes and the column layout (possibly null) in DAT mode.
	 */
	public Object setting(String key) {

		switch (key) {
			case "foils":
				return foils;
			case "metadata":
				return metadataFilter != null ? metadataFilter : metadata;
			case "rawdata":
				return rawdata;
			case "array_format":
				return mode.isBinary() ? mode.shape().dims() : arrayFormat;
			case "mode":
				return mode.name();
			case "instrument":
				return instrument;
			case "echotime_key":
				return echoTimeKey;
			default:
				throw new ConfigurationException("No value can be found for key: '" + key + "'");
		}
	}

	public InstrumentSettings withMode(AcquisitionMode newMode) {

		return new InstrumentSettings(instrument, newMode, foils, metadata, metadataFilter, rawdata, arrayFormat,
				echoTimeKey, constants);
	}

	public InstrumentSettings withFoils(List<Integer> newFoils) {

		for (Integer f : newFoils) {

			if (f == null || f < 0)
				throw new ConfigurationException("foil indices must be non negative: " + newFoils);
		}

		return new InstrumentSettings(instrument, mode, newFoils, metadata, metadataFilter, rawdata, arrayFormat,
				echoTimeKey, constants);
	}

	public InstrumentSettings withMetadata(boolean read) {

		return new InstrumentSettings(instrument, mode, foils, read, metadataFilter, rawdata, arrayFormat,
				echoTimeKey, constants);
	}

	/**
	 * @param filter The keys to keep, or null to keep every key.
	 */
	public InstrumentSettings withMetadataFilter(MetadataFilter filter) {

		return new InstrumentSettings(instrument, mode, foils, true, filter, rawdata, arrayFormat,
				echoTimeKey, constants);
	}

	public InstrumentSettings withRawdata(boolean read) {

		return new InstrumentSettings(instrument, mode, foils, metadata, metadataFilter, read, arrayFormat,
				echoTimeKey, constants);
	}

	public InstrumentSettings withArrayFormat(ArrayFormat format) {

		return new InstrumentSettings(instrument, mode, foils, metadata, metadataFilter, rawdata, format,
				echoTimeKey, constants);
	}

	public InstrumentSettings withEchoTimeKey(String key) {

		return new InstrumentSettings(instrument, mode, foils, metadata, metadataFilter, rawdata, arrayFormat,
				key, constants);
	}

	public InstrumentSettings withConstant(String name, InstrumentConstant constant) {

		Map<String, InstrumentConstant> map = new LinkedHashMap<>(constants);

		map.put(name, constant);

		return new InstrumentSettings(instrument, mode, foils, metadata, metadataFilter, rawdata, arrayFormat,
				echoTimeKey, map);
	}

	@Override
	public String toString() {

		return instrument + " " + mode + " foils=" + foils;
	}
}
