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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class In12ParserTest {

	@TempDir
	Path dir;

	private Path writeScan() throws IOException {

		Path file = dir.resolve("012345");

		Files.writeString(file, String.join("\n",
				"RRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRRR",
				"INSTR: IN12",
				"EXPNO: 4-01-1234",
				"FILE_: 012345",
				"DATE_: garbage",
				"DATE_: 27-OCT-17 14:23:11",
				"TITLE: phonon scan: near zone center",
				"COMND: sc qh 1 0 0 0 dqh 0 0 .05 0 np 21 mn 2000",
				"FOOBA: ignored",
				"LONGKEYWORD: ignored too",
				"PARAM: DM=3.355, DA=3.355, SS=1,",
				"PARAM: TT=1.5, SAMPLE=quartz",
				"VARIA: A1=-21.5, A2=-43.0",
				"ZEROS: A1=0.1",
				"POSQE: QH=1.0, QK=0, QL=0, EN=2.0, UN=meV",
				"DATA_:",
				"  PNT   QH    EN    M1",
				"  1   1.0   2.0   100",
				"  2   1.05  x     110",
				"  3   1.1   2.0   120",
				""));

		return file;
	}

	@Test
	void headerSectionsAreKeyedByKeyword() throws IOException {

		In12Scan scan = new In12Parser().parse(writeScan());

		MetadataDocument doc = scan.metadata();

		assertThat(doc.sectionNames()).containsExactly(
				"INSTR", "EXPNO", "FILE_", "DATE_", "TITLE", "COMND", "PARAM", "VARIA", "ZEROS", "POSQE");

		assertThat(doc.get("INSTR", "INSTRUMENT")).contains(MetadataValue.ofString("IN12"));
		assertThat(doc.get("EXPNO", "EXPNO")).contains(MetadataValue.ofString("4-01-1234"));
		assertThat(doc.get("FILE_", "FILENUMBER")).contains(MetadataValue.ofInteger(12345));
		assertThat(doc.get("DATE_", "DATE-TIME")).contains(MetadataValue.ofString("17/10/27 14:23:11"));
		assertThat(doc.get("TITLE", "TITLE")).contains(MetadataValue.ofString("phonon scan near zone center"));
	}

	@Test
	void commandIsSplitIntoSlots() throws IOException {

		Map<String, MetadataValue> cmd = new In12Parser().parse(writeScan()).metadata().section("COMND");

		assertThat(cmd.get("command")).isEqualTo(MetadataValue.ofString("sc"));
		assertThat(cmd.get("device")).isEqualTo(MetadataValue.ofString("qh"));
		assertThat(cmd.get("device_state")).isEqualTo(MetadataValue.ofNumbers(1, 0, 0, 0));
		assertThat(cmd.get("step_indicator")).isEqualTo(MetadataValue.ofString("dqh"));
		assertThat(cmd.get("step")).isEqualTo(MetadataValue.ofNumbers(0, 0, 0.05, 0));
		assertThat(cmd.get("numpoints_indicator")).isEqualTo(MetadataValue.ofString("np"));
		assertThat(cmd.get("numpoints")).isEqualTo(MetadataValue.ofInteger(21));
		assertThat(cmd.get("counter_device")).isEqualTo(MetadataValue.ofString("mn"));
		assertThat(cmd.get("counter_threshold")).isEqualTo(MetadataValue.ofInteger(2000));
	}

	@Test
	void repeatedParameterLinesMerge() throws IOException {

		In12Scan scan = new In12Parser().parse(writeScan());

		Map<String, MetadataValue> param = scan.metadata().section("PARAM");

		assertThat(param).containsOnlyKeys("DM", "DA", "SS", "TT", "SAMPLE");
		assertThat(param.get("SS")).isEqualTo(MetadataValue.ofFloat(1.0));
		assertThat(param.get("SAMPLE")).isEqualTo(MetadataValue.ofString("quartz"));

		assertThat(scan.lookup("VARIA").entries()).containsEntry("A1", MetadataValue.ofFloat(-21.5));
		assertThat(scan.lookup("UN")).isEqualTo(MetadataValue.ofString("meV"));
		assertThat(scan.lookup("DM")).isEqualTo(MetadataValue.ofFloat(3.355));
		assertThat(scan.lookup("nothing")).isEqualTo(MetadataValue.NONE);
	}

	@Test
	void tableFollowsTheDataMarker() throws IOException {

		NeutronDataTable table = new In12Parser().parse(writeScan()).table();

		assertThat(table.names()).containsExactly("PNT", "QH", "EN", "M1");
		assertThat(table.units()).containsExactly("", "", "", "");
		assertThat(table.rowCount()).isEqualTo(3);
		assertThat(table.column("M1")).containsExactly(100, 110, 120);
		assertThat(table.column("EN")[1]).isNaN();
		assertThat(table.value(2, 1)).isEqualTo(1.1);

		NeutronDataTable picked = table.select(List.of(0), List.of("M1"));

		assertThat(picked.names()).containsExactly("PNT", "M1");
		assertThat(picked.column(1)).containsExactly(100, 110, 120);
	}

	@Test
	void fileWithoutDataMarker() throws IOException {

		Path file = dir.resolve("broken");

		Files.writeString(file, "INSTR: IN12\nPARAM: DM=3.355\n");

		assertThatThrownBy(() -> new In12Parser().parse(file)).isInstanceOf(EOFException.class);
	}

	@Test
	void literalsKeepIntegralNumbersIntegral() {

		assertThat(In12Parser.literal("21")).isEqualTo(MetadataValue.ofInteger(21));
		assertThat(In12Parser.literal("2.0")).isEqualTo(MetadataValue.ofInteger(2));
		assertThat(In12Parser.literal(".05")).isEqualTo(MetadataValue.ofFloat(0.05));
		assertThat(In12Parser.literal("np")).isEqualTo(MetadataValue.ofString("np"));
	}
}
