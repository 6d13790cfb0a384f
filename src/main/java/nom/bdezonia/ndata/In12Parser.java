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

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads ILL triple axis data files (IN12 style): a header of lines that
 * start with a five character keyword, a {@code DATA_} marker, a line of
 * column names and a whitespace delimited numeric table.
 * <p>
 * Each keyword is handled by its own line parser and becomes one section of
 * the returned document. Lines with an unknown keyword are ignored and a
 * line its parser cannot read is skipped.
 *
 * @author Barry DeZonia
 */
public class In12Parser {

	private static final Logger logger = LoggerFactory.getLogger(In12Parser.class);

	static final String DATA_MARKER = "DATA_";

	private static final int KEYWORD_LENGTH = 5;

	private static final Map<String, LineParser> PARSERS = parsers();

	/**
	 * Turns the fields of one header line (split at colons, keyword removed)
	 * into entries of the keyword's section.
	 */
	interface LineParser {

		Map<String, MetadataValue> parse(String keyword, List<String> fields);
	}

	private static

		Map<String, LineParser>

			parsers()
	{
		Map<String, LineParser> map = new LinkedHashMap<>();

		LineParser pass = new PassParser();

		LineParser params = new ParamParser();

		map.put("INSTR", new InstrParser());
		map.put("EXPNO", pass);
		map.put("USER_", pass);
		map.put("LOCAL", pass);
		map.put("FILE_", new FileNrParser());
		map.put("DATE_", new DateParser());
		map.put("TITLE", pass);
		map.put("TYPE_", pass);
		map.put("COMND", new CommandParser());
		map.put("POSQE", params);
		map.put("CURVE", pass);
		map.put("STEPS", params);
		map.put("PARAM", params);
		map.put("VARIA", params);
		map.put("ZEROS", params);
		map.put("ELSE_", pass);

		return Collections.unmodifiableMap(map);
	}

	/**
	 *
	 * @param path
	 * @return
	 * @throws EOFException when the file has no {@code DATA_} marker.
	 * @throws IOException
	 */
	public In12Scan parse(Path path) throws IOException {

		MetadataDocument.Builder doc = MetadataDocument.builder();

		List<String> columnNames = null;

		int lineCounter = 0;

		try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {

			while (columnNames == null) {

				String line = br.readLine();

				if (line == null)
					throw new EOFException("no " + DATA_MARKER + " marker in " + path);

				lineCounter++;

				List<String> fields = new ArrayList<>(Arrays.asList(line.split(":", -1)));

				String keyword = fields.remove(0);

				if (keyword.length() != KEYWORD_LENGTH)
					continue;

				if (keyword.equals(DATA_MARKER)) {

					String descr = br.readLine();

					columnNames = descr == null ? List.of() : splitWords(descr);
				}
				else if (PARSERS.containsKey(keyword)) {

					try {

						doc.putAll(keyword, PARSERS.get(keyword).parse(keyword, fields));

					} catch (RuntimeException e) {

						logger.debug("cannot read {} line {} of {}: {}", keyword, lineCounter, path, e.getMessage());
					}
				}
			}
		}

		NeutronDataTable table = new NeutronDataTable(
				WhitespaceTableReader.read(path, lineCounter + 1),
				columnNames,
				Collections.nCopies(columnNames.size(), ""));

		return new In12Scan(doc.build(), table);
	}

	static

		List<String>

			splitWords(String line)
	{
		List<String> words = new ArrayList<>();

		for (String w : line.trim().split("\\s+")) {

			if (!w.isEmpty())
				words.add(w);
		}

		return words;
	}

	private static

		String

			joinStripped(List<String> fields)
	{
		List<String> parts = new ArrayList<>();

		for (String f : fields) {

			parts.add(f.strip());
		}

		return String.join(" ", parts);
	}

	private static

		String

			single(String keyword, List<String> fields)
	{
		if (fields.size() != 1)
			throw new IllegalArgumentException(keyword + " expects one value field, got " + fields.size());

		return fields.get(0);
	}

	/**
	 * Reads a number the way a literal is read: integral values become
	 * integers, other numbers floats, anything else stays text.
	 */
	static

		MetadataValue

			literal(String token)
	{
		try {

			return MetadataValue.ofInteger(Long.parseLong(token));

		} catch (NumberFormatException e) {

			if (!ValueClassifier.isDouble(token))
				return MetadataValue.ofString(token);

			double d = Double.parseDouble(token);

			if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < Long.MAX_VALUE)
				return MetadataValue.ofInteger((long) d);

			return MetadataValue.ofFloat(d);
		}
	}

	static final class PassParser implements LineParser {

		@Override
		public Map<String, MetadataValue> parse(String keyword, List<String> fields) {

			return Map.of(keyword.strip().toUpperCase(Locale.ROOT), MetadataValue.ofString(joinStripped(fields)));
		}
	}

	static final class InstrParser implements LineParser {

		@Override
		public Map<String, MetadataValue> parse(String keyword, List<String> fields) {

			return Map.of("INSTRUMENT", MetadataValue.ofString(joinStripped(fields)));
		}
	}

	static final class FileNrParser implements LineParser {

		@Override
		public Map<String, MetadataValue> parse(String keyword, List<String> fields) {

			String value = single(keyword, fields).strip();

			try {

				return Map.of("FILENUMBER", MetadataValue.ofInteger(Long.parseLong(value)));

			} catch (NumberFormatException e) {

				return Map.of("FILENUMBER", MetadataValue.ofString(value));
			}
		}
	}

	/**
	 * {@code DATE_: 27-OCT-17 14:23:11} becomes {@code 17/10/27 14:23:11}.
	 */
	static final class DateParser implements LineParser {

		private static final List<String> MONTHS =
				List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC");

		@Override
		public Map<String, MetadataValue> parse(String keyword, List<String> fields) {

			if (fields.size() != 3)
				throw new IllegalArgumentException("date needs hours, minutes and seconds, got " + fields);

			String[] dateHours = fields.get(0).strip().split("\\s+");

			if (dateHours.length != 2)
				throw new IllegalArgumentException("cannot split date and hour in '" + fields.get(0) + "'");

			String[] dmy = dateHours[0].split("-");

			if (dmy.length != 3)
				throw new IllegalArgumentException("date is not day-month-year: " + dateHours[0]);

			int month = MONTHS.indexOf(dmy[1].toUpperCase(Locale.ROOT));

			if (month < 0)
				throw new IllegalArgumentException("unknown month " + dmy[1]);

			String date = dmy[2] + "/" + String.format("%02d", month + 1) + "/" + dmy[0];

			String time = dateHours[1] + ":" + fields.get(1).strip() + ":" + fields.get(2).strip();

			return Map.of("DATE-TIME", MetadataValue.ofString(date + " " + time));
		}
	}

	/**
	 * Splits a scan command such as {@code sc qh 1 0 0 0 dqh 0 0 .05 0 np 21 mn 2000}
	 * into its device, start position, step, point count and counter.
	 * Every text token after the device moves to the next indicator slot and
	 * the numbers that follow it fill the value slot after it.
	 */
	static final class CommandParser implements LineParser {

		private static final String[] SLOTS = {
			"device_state",
			"step_indicator",
			"step",
			"numpoints_indicator",
			"numpoints",
			"counter_device",
			"counter_threshold"
		};

		@Override
		public Map<String, MetadataValue> parse(String keyword, List<String> fields) {

			List<String> bits = splitWords(single(keyword, fields));

			if (bits.size() < 2)
				throw new IllegalArgumentException("command names no device: " + bits);

			List<Double> deviceState = new ArrayList<>();

			List<Double> step = new ArrayList<>();

			Map<String, MetadataValue> slots = new LinkedHashMap<>();

			slots.put("command", MetadataValue.ofString(bits.get(0)));
			slots.put("device", MetadataValue.ofString(bits.get(1)));
			slots.put("device_state", null);
			slots.put("step_indicator", MetadataValue.NONE);
			slots.put("step", null);
			slots.put("numpoints_indicator", MetadataValue.NONE);
			slots.put("numpoints", MetadataValue.ofInteger(0));
			slots.put("counter_device", MetadataValue.NONE);
			slots.put("counter_threshold", MetadataValue.ofInteger(0));

			int a = 0;

			for (String element : bits.subList(2, bits.size())) {

				MetadataValue value = literal(element);

				if (value.kind() == MetadataValue.Kind.STRING) {

					a++;

					slots.put(slot(a), value);

					a++;
				}
				else if (slot(a).equals("device_state")) {

					deviceState.add(value.asDouble());
				}
				else if (slot(a).equals("step")) {

					step.add(value.asDouble());
				}
				else if (slots.get(slot(a)).kind() == MetadataValue.Kind.INTEGER) {

					slots.put(slot(a), value);
				}
			}

			slots.put("device_state", MetadataValue.ofNumbers(toArray(deviceState)));

			slots.put("step", MetadataValue.ofNumbers(toArray(step)));

			return slots;
		}

		private static String slot(int index) {

			if (index >= SLOTS.length)
				throw new IllegalArgumentException("too many command tokens");

			return SLOTS[index];
		}

		private static double[] toArray(List<Double> list) {

			double[] values = new double[list.size()];

			for (int i = 0; i < values.length; i++) {

				values[i] = list.get(i);
			}

			return values;
		}
	}

	/**
	 * {@code PARAM: DM=3.355, DA=3.355, SS=1} becomes entries DM, DA, SS.
	 * Values are floats when they read as numbers, trimmed text otherwise.
	 */
	static final class ParamParser implements LineParser {

		@Override
		public Map<String, MetadataValue> parse(String keyword, List<String> fields) {

			Map<String, MetadataValue> entries = new LinkedHashMap<>();

			for (String item : single(keyword, fields).split(",")) {

				if (item.isBlank())
					continue;

				String[] varVal = item.strip().split("=", -1);

				if (varVal.length < 2)
					throw new IllegalArgumentException("parameter without value: " + item);

				String value = varVal[1].strip();

				entries.put(varVal[0].strip(), ValueClassifier.isDouble(value)
						? MetadataValue.ofFloat(Double.parseDouble(value))
						: MetadataValue.ofString(value));
			}

			return entries;
		}
	}
}
