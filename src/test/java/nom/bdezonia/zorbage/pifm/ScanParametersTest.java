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

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ScanParametersTest {

	@Test
	void lookups() {

		Map<String,String> values = new LinkedHashMap<>();

		values.put("yPixel", "128");
		values.put("xPixel", "256");
		values.put("XScanRange", "2.5");

		ScanParameters params = new ScanParameters(values);

		values.put("Angle", "90");

		assertThat(params.size()).isEqualTo(3);
		assertThat(params.keys()).containsExactly("yPixel", "xPixel", "XScanRange");
		assertThat(params.xPixels()).isEqualTo(256);
		assertThat(params.requireDouble("XScanRange")).isEqualTo(2.5);
		assertThat(params.get("Angle")).isNull();
		assertThatThrownBy(() -> params.asMap().put("Angle", "0"))
			.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void missingAndUnparsableValues() {

		ScanParameters params = new ScanParameters(Map.of("xPixel", "wide"));

		assertThatThrownBy(params::yPixels)
			.isInstanceOf(MissingParameterException.class)
			.hasMessageContaining("yPixel")
			.hasMessageContaining("scan parameters");

		assertThatThrownBy(params::xPixels)
			.isInstanceOf(PifmFormatException.class)
			.hasMessageContaining("not an integer");
	}

	@Test
	void descriptorsCompareByContent() {

		ChannelDescriptor a = new ChannelDescriptor(Map.of("Caption", "Topography"));

		ChannelDescriptor b = new ChannelDescriptor(Map.of("Caption", "Topography"));

		assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
		assertThat(a).isNotEqualTo(new SpectrumDescriptor(Map.of("Caption", "Topography")));
		assertThatThrownBy(a::scale)
			.isInstanceOf(MissingParameterException.class)
			.hasMessageContaining("'Topography'");
	}
}
