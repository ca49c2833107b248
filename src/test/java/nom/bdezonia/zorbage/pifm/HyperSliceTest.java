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

import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.Test;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.storage.Storage;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

class HyperSliceTest {

	// 2 rows, 3 columns; value = 100 row + 10 col + plane + 1
	private static HyperImage image(double... wavenumbers) {

		IndexedDataSource<Float64Member> axis = Storage.allocate(G.DBL.construct(), wavenumbers.length);

		Float64Member value = G.DBL.construct();

		for (int i = 0; i < wavenumbers.length; i++) {

			value.setV(wavenumbers[i]);

			axis.set(i, value);
		}

		DimensionedDataSource<Float64Member> cube =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {2, 3, wavenumbers.length});

		ThreeDView<Float64Member> vw = new ThreeDView<>(cube);

		for (long r = 0; r < 2; r++)
			for (long c = 0; c < 3; c++)
				for (long k = 0; k < wavenumbers.length; k++) {
					value.setV(100 * r + 10 * c + k + 1);
					vw.set(r, c, k, value);
				}

		return new HyperImage(new ScanParameters(Map.of()), Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), axis, cube, null);
	}

	private static double at(DimensionedDataSource<Float64Member> data, long r, long c) {

		Float64Member value = G.DBL.construct();

		new TwoDView<>(data).get(r, c, value);

		return value.v();
	}

	@Test
	void sumsEveryPlaneBetweenTheEndpoints() {

		HyperImage hyper = image(300.2, 305.9, 310.1);

		DimensionedDataSource<Float64Member> slice = HyperSlice.sum(hyper, 300, 310);

		assertThat(slice.dimension(0)).isEqualTo(2);
		assertThat(slice.dimension(1)).isEqualTo(3);

		for (long r = 0; r < 2; r++)
			for (long c = 0; c < 3; c++)
				assertThat(at(slice, r, c)).isEqualTo(3 * (100 * r + 10 * c) + 1 + 2 + 3);
	}

	@Test
	void endpointOrderDoesNotMatter() {

		HyperImage hyper = image(310.1, 305.9, 300.2);

		DimensionedDataSource<Float64Member> forward = HyperSlice.sum(hyper, 300, 310);

		DimensionedDataSource<Float64Member> reversed = HyperSlice.sum(hyper, 310, 300);

		for (long r = 0; r < 2; r++)
			for (long c = 0; c < 3; c++) {
				assertThat(at(forward, r, c)).isEqualTo(3 * (100 * r + 10 * c) + 6);
				assertThat(at(reversed, r, c)).isEqualTo(at(forward, r, c));
			}
	}

	@Test
	void singleWavenumberIsOnePlane() {

		HyperImage hyper = image(1800.9, 1790.5, 1780.0, 1770.3);

		DimensionedDataSource<Float64Member> slice = HyperSlice.sum(hyper, 1790, 1790);

		DimensionedDataSource<Float64Member> plane = HyperSlice.plane(hyper, 1, null, null);

		for (long r = 0; r < 2; r++)
			for (long c = 0; c < 3; c++)
				assertThat(at(slice, r, c)).isEqualTo(at(plane, r, c)).isEqualTo(100 * r + 10 * c + 2);
	}

	@Test
	void firstMatchWinsOnAnUnsortedAxis() {

		HyperImage hyper = image(1500.2, 1400.8, 1500.9, 1600.0);

		assertThat(HyperSlice.indexOf(hyper.wavelengths(), 1500)).isZero();
		assertThat(HyperSlice.indexOf(hyper.wavelengths(), 1600)).isEqualTo(3);

		// planes 0..1
		DimensionedDataSource<Float64Member> slice = HyperSlice.sum(hyper, 1400, 1500);

		assertThat(at(slice, 0, 0)).isEqualTo(1 + 2);
	}

	@Test
	void negativeWavenumbersTruncateTowardZero() {

		HyperImage hyper = image(-5.7, 3.2);

		assertThat(HyperSlice.indexOf(hyper.wavelengths(), -5)).isZero();
	}

	@Test
	void absentWavenumberIsReported() {

		HyperImage hyper = image(300.2, 305.9, 310.1);

		assertThatThrownBy(() -> HyperSlice.sum(hyper, 300, 311))
			.isInstanceOfSatisfying(WavenumberNotFoundException.class,
				e -> assertThat(e.wavenumber()).isEqualTo(311));

		assertThatThrownBy(() -> HyperSlice.sum(image(42.0), 41, 42))
			.isInstanceOf(WavenumberNotFoundException.class);
	}

	@Test
	void windowSelectsRowsAndColumns() {

		HyperImage hyper = image(300.2, 305.9, 310.1);

		DimensionedDataSource<Float64Member> slice =
				HyperSlice.sum(hyper, 305, 310, new long[] {1, 2}, new long[] {1, 3});

		assertThat(slice.dimension(0)).isEqualTo(1);
		assertThat(slice.dimension(1)).isEqualTo(2);
		assertThat(at(slice, 0, 0)).isEqualTo(2 * 110 + 2 + 3);
		assertThat(at(slice, 0, 1)).isEqualTo(2 * 120 + 2 + 3);
	}

	@Test
	void badWindowsAreRejected() {

		HyperImage hyper = image(300.2, 305.9, 310.1);

		assertThatThrownBy(() -> HyperSlice.sum(hyper, 300, 310, new long[] {1, 1}, null))
			.isInstanceOf(EmptyRangeException.class);

		assertThatThrownBy(() -> HyperSlice.sum(hyper, 300, 310, null, new long[] {0, 4}))
			.isInstanceOf(IllegalArgumentException.class)
			.isNotInstanceOf(EmptyRangeException.class);

		assertThatThrownBy(() -> HyperSlice.plane(hyper, 3, null, null))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
