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

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RawArrayExtractorTest {

	@TempDir
	Path dir;

	@Test
	void timeResolvedFile() throws IOException {

		Path file = dir.resolve("00000001.tof");

		DetectorFileFixtures.writeCascade(file, DetectorFileFixtures.tofCounts(), DetectorFileFixtures.HEADER);

		RawDataArray data = RawArrayExtractor.read(file);

		assertThat(data.shape()).containsExactly(8, 16, 128, 128);
		assertThat(data.sum()).isEqualTo(DetectorFileFixtures.TOF_SUM);
		assertThat(data.get(0, 0, 0, 0)).isEqualTo(-1);
		assertThat(data.dataSource().numDimensions()).isEqualTo(4);
		assertThat(data.dataSource().dimension(0)).isEqualTo(128);
		assertThat(data.dataSource().dimension(3)).isEqualTo(8);
		assertThat(data.dataSource().getSource()).isEqualTo(file.toString());
	}

	@Test
	void singleFrameFileFallsBack() throws IOException {

		Path file = dir.resolve("00000002.pad");

		DetectorFileFixtures.writeCascade(file, DetectorFileFixtures.padCounts(), DetectorFileFixtures.HEADER);

		RawDataArray data = RawArrayExtractor.read(file);

		assertThat(data.shape()).containsExactly(128, 128);
		assertThat(data.sum()).isEqualTo(DetectorFileFixtures.PAD_SUM);
	}

	@Test
	void headerlessTimeResolvedFileKeepsEveryFrame() throws IOException {

		Path file = dir.resolve("00000003.tof");

		DetectorFileFixtures.writeCascade(file, DetectorFileFixtures.tofCounts(), "");

		RawDataArray data = RawArrayExtractor.read(file);

		assertThat(data.shape()).containsExactly(8, 16, 128, 128);
		assertThat(data.sum()).isEqualTo(DetectorFileFixtures.TOF_SUM);
	}

	@Test
	void tooSmallPayloadIsRejected() {

		assertThatThrownBy(() -> RawArrayExtractor.decode(new byte[400]))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("100 values");
	}
}
