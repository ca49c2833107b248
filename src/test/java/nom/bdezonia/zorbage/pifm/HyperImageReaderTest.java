/*
 * zorbage-pifm: code for populating PiFM hyperspectral data into zorbage structures for further processing
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
package nom.bdezonia.zorbage.pifm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.misc.DataBundle;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

class HyperImageReaderTest {

	private static final double[] AXIS = { 1800.7, 1790.2, 1780.9 };

	@TempDir
	Path dir;

	@Test
	void cubeIsIndexedByRowColumnPlane() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 3, 4, AXIS, "Topography", "PiFM");

		HyperImage image = HyperImageReader.read(paramFile.toString());

		assertThat(image.rows()).isEqualTo(3);
		assertThat(image.columns()).isEqualTo(4);
		assertThat(image.wavenumberCount()).isEqualTo(3);
		assertThat(image.wavenumber(1)).isEqualTo(1790.2);

		ThreeDView<Float64Member> cube = new ThreeDView<>(image.hyperImage());

		Float64Member value = G.DBL.construct();

		for (int row = 0; row < 3; row++) {

			for (int col = 0; col < 4; col++) {

				for (int k = 0; k < AXIS.length; k++) {

					cube.get(row, col, k, value);

					assertThat(value.v()).isEqualTo(0.5 * PifmTestFiles.hyperRaw(row, col, k));
				}
			}
		}
	}

	@Test
	void channelStackFollowsDeclarationOrder() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 3, 4, AXIS, "Topography", "PiFM");

		HyperImage image = HyperImageReader.read(paramFile.toString());

		assertThat(image.channelNames()).containsExactly("Topography", "PiFM");
		assertThat(image.channelCount()).isEqualTo(2);
		assertThat(image.channelDescriptors()).hasSize(3);

		DimensionedDataSource<Float64Member> stack = image.channelData();

		assertThat(stack.dimension(0)).isEqualTo(3);
		assertThat(stack.dimension(1)).isEqualTo(4);
		assertThat(stack.dimension(2)).isEqualTo(2);

		ThreeDView<Float64Member> vw = new ThreeDView<>(stack);

		Float64Member value = G.DBL.construct();

		for (int ch = 0; ch < 2; ch++) {

			for (int row = 0; row < 3; row++) {

				for (int col = 0; col < 4; col++) {

					vw.get(row, col, ch, value);

					assertThat(value.v()).isEqualTo((ch + 2.0) * PifmTestFiles.channelRaw(ch, row, col));
				}
			}
		}

		TwoDView<Float64Member> pifm = new TwoDView<>(image.channel("PiFM"));

		pifm.get(2, 3, value);

		assertThat(value.v()).isEqualTo(3.0 * PifmTestFiles.channelRaw(1, 2, 3));

		assertThatThrownBy(() -> image.channel("Phase"))
			.isInstanceOf(MissingParameterException.class);
	}

	@Test
	void spectrumOfOnePixel() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS);

		HyperImage image = HyperImageReader.read(paramFile.toString());

		IndexedDataSource<Float64Member> spectrum = image.spectrum(1, 0);

		Float64Member value = G.DBL.construct();

		assertThat(spectrum.size()).isEqualTo(3);

		for (int k = 0; k < 3; k++) {

			spectrum.get(k, value);

			assertThat(value.v()).isEqualTo(0.5 * PifmTestFiles.hyperRaw(1, 0, k));
		}
	}

	@Test
	void readingTwiceGivesTheSameImage() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 3, AXIS, "Topography");

		HyperImage first = HyperImageReader.read(paramFile.toString());

		HyperImage second = HyperImageReader.read(paramFile.toString());

		ThreeDView<Float64Member> a = new ThreeDView<>(first.hyperImage());

		ThreeDView<Float64Member> b = new ThreeDView<>(second.hyperImage());

		assertThat(b.d0()).isEqualTo(a.d0());
		assertThat(b.d1()).isEqualTo(a.d1());

		Float64Member va = G.DBL.construct();

		Float64Member vb = G.DBL.construct();

		for (long i = 0; i < a.d0(); i++)
			for (long j = 0; j < a.d1(); j++)
				for (long k = 0; k < a.d2(); k++) {
					a.get(i, j, k, va);
					b.get(i, j, k, vb);
					assertThat(vb.v()).isEqualTo(va.v());
				}
	}

	@Test
	void scanWithoutImageChannelsHasNoStack() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS);

		HyperImage image = HyperImageReader.read(paramFile.toString());

		assertThat(image.channelCount()).isZero();
		assertThat(image.channelNames()).isEmpty();
		assertThat(image.channelData()).isNull();

		DataBundle bundle = HyperImageReader.readAllDatasets(paramFile.toString());

		assertThat(bundle.dbls).hasSize(1);
	}

	@Test
	void bundleHoldsCubeAndStack() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS, "Topography");

		DataBundle bundle = HyperImageReader.readAllDatasets(paramFile.toString());

		assertThat(bundle.dbls).hasSize(2);
		assertThat(bundle.dbls.get(0).numDimensions()).isEqualTo(3);
		assertThat(bundle.dbls.get(0).dimension(2)).isEqualTo(3);
		assertThat(bundle.dbls.get(1).dimension(2)).isEqualTo(1);
		assertThat(bundle.dbls.get(0).metadata().getString("xPixel")).isEqualTo("2");
	}

	@Test
	void missingPixelCountIsFatal() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS, "Topography");

		String text = new String(Files.readAllBytes(paramFile), "ISO-8859-1").replace("yPixel : 2\r\n", "");

		PifmTestFiles.writeText(paramFile, text);

		assertThatThrownBy(() -> HyperImageReader.read(paramFile.toString()))
			.isInstanceOfSatisfying(MissingParameterException.class,
				e -> assertThat(e.parameter()).isEqualTo("yPixel"));
	}

	@Test
	void missingScaleIsFatal() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS, "Topography");

		String text = new String(Files.readAllBytes(paramFile), "ISO-8859-1").replace("  Scale : 2\r\n", "");

		PifmTestFiles.writeText(paramFile, text);

		assertThatThrownBy(() -> HyperImageReader.read(paramFile.toString()))
			.isInstanceOfSatisfying(MissingParameterException.class,
				e -> assertThat(e.parameter()).isEqualTo("Scale"))
			.hasMessageContaining("Topography");
	}

	@Test
	void missingWavelengthFileNameIsFatal() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS);

		String text = new String(Files.readAllBytes(paramFile), "ISO-8859-1")
				.replace("  FileNameWavelengths : scan_wavelengths.txt\r\n", "");

		PifmTestFiles.writeText(paramFile, text);

		assertThatThrownBy(() -> HyperImageReader.read(paramFile.toString()))
			.isInstanceOfSatisfying(MissingParameterException.class,
				e -> assertThat(e.parameter()).isEqualTo("FileNameWavelengths"));
	}

	@Test
	void parameterFileWithoutChannelsIsFatal() throws Exception {

		Path paramFile = PifmTestFiles.writeText(dir.resolve("empty.txt"), "xPixel : 2", "yPixel : 2");

		assertThatThrownBy(() -> HyperImageReader.read(paramFile.toString()))
			.isInstanceOf(MissingParameterException.class);
	}

	@Test
	void wavelengthCountMustMatchHyperspectralData() throws Exception {

		Path paramFile = PifmTestFiles.writeScan(dir, 2, 2, AXIS, "Topography");

		PifmTestFiles.writeText(dir.resolve("scan_wavelengths.txt"), "1800.1", "1790.2");

		assertThatThrownBy(() -> HyperImageReader.read(paramFile.toString()))
			.isInstanceOf(TruncatedDataException.class)
			.hasMessageContaining("scan_hyPIRFwd.int");
	}
}
