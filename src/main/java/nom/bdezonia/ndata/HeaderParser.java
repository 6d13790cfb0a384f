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
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the colon separated headers of CASCADE detector files and NICOS
 * ASCII scan files into a {@link MetadataDocument}.
 * <p>
 * The parser walks the file once, line by line, remembering the section it
 * is in. It is lenient: a line that is not valid UTF-8, has an unexpected
 * number of fields, or holds a number that cannot be read is skipped and the
 * parse continues.
 *
 * @author Barry DeZonia
 */
public class HeaderParser {

	private static final Logger logger = LoggerFactory.getLogger(HeaderParser.class);

	// newline can never survive line splitting, so no real section can use this name

	static final String PREAMBLE = "\n<preamble>";

	static final String SCAN_DATA = "Scan data";

	static final String NAMES = "names";

	static final String UNITS = "units";

	private final HeaderDialect dialect;

	public HeaderParser(HeaderDialect dialect) {

		this.dialect = dialect;
	}

	public HeaderDialect dialect() {

		return dialect;
	}

	/**
	 *
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public MetadataDocument parse(Path path) throws IOException {

		try (InputStream is = Files.newInputStream(path)) {

			return parse(is);
		}
	}

	/**
	 * Reads the stream to its end. The caller owns and closes the stream.
	 *
	 * @param is
	 * @return
	 * @throws IOException
	 */
	public MetadataDocument parse(InputStream is) throws IOException {

		return parse(is.readAllBytes());
	}

	/**
	 *
	 * @param content
	 * @return
	 */
	public MetadataDocument parse(byte[] content) {

		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);

		List<String> lines = new ArrayList<>();

		int start = 0;

		int lineNumber = 0;

		for (int i = 0; i <= content.length; i++) {

			if (i == content.length || content[i] == '\n') {

				if (i == content.length && start == i)
					break;

				lineNumber++;

				try {

					lines.add(decoder.decode(ByteBuffer.wrap(content, start, i - start)).toString());

				} catch (CharacterCodingException e) {

					logger.debug("line {} is not text, skipped", lineNumber);
				}

				start = i + 1;
			}
		}

		return parseLines(lines);
	}

	/**
	 * Parses already decoded lines.
	 *
	 * @param lines
	 * @return
	 */
	public MetadataDocument parseLines(List<String> lines) {

		MetadataDocument.Builder doc = MetadataDocument.builder();

		String section = PREAMBLE;

		doc.openSection(section);

		for (String rawLine : lines) {

			if (dialect.commentedHeader() && !rawLine.startsWith("#"))
				continue;

			String line = rawLine.length() >= dialect.prefixLength()
					? rawLine.substring(dialect.prefixLength()).strip()
					: "";

			String[] fields = line.split(":", -1);

			if (fields.length == 1 && fields[0].startsWith(dialect.sectionMarker())) {

				section = fields[0].substring(dialect.sectionMarker().length()).strip();

				doc.openSection(section);
			}
			else if (fields.length == 1 && dialect.commentedHeader() && SCAN_DATA.equals(section)) {

				List<String> tokens = ValueClassifier.columnTokens(fields[0]);

				MetadataValue value = MetadataValue.ofStrings(tokens.toArray(new String[0]));

				if (doc.sectionSize(section) == 0)
					doc.put(section, NAMES, value);
				else if (doc.sectionSize(section) == 1)
					doc.put(section, UNITS, value);
			}
			else if (fields.length == 2) {

				try {

					doc.put(section, fields[0].strip(), ValueClassifier.classify(fields[1]));

				} catch (NumberFormatException e) {

					logger.debug("unreadable value in header line '{}', skipped", line);
				}
			}
			else if (fields.length == 3) {

				String second = fields[1].strip();

				if (second.equals("http") || second.equals("https")) {

					doc.put(section, fields[0].strip(), MetadataValue.ofString((fields[1] + ":" + fields[2]).strip()));
				}
				else {

					doc.put(section, fields[0].strip(), MetadataValue.ofStrings(second, fields[2].strip()));
				}
			}
			else if (fields.length == 4) {

				String joined = fields[2].strip() + " : " + fields[3].strip();

				doc.put(section, fields[0].strip(), MetadataValue.ofStrings(fields[1].strip(), joined));
			}
		}

		doc.removeSection(PREAMBLE);

		return doc.build();
	}
}
