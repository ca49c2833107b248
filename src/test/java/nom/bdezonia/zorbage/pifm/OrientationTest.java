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

import org.junit.jupiter.api.Test;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

class OrientationTest {

	// value = 100 i + 10 j + k
	private static DimensionedDataSource<Float64Member> numbered(long d0, long d1, long d2) {

		DimensionedDataSource<Float64Member> data =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {d0, d1, d2});

		ThreeDView<Float64Member> vw = new ThreeDView<>(data);

		Float64Member value = G.DBL.construct();

		for (long i = 0; i < d0; i++)
			for (long j = 0; j < d1; j++)
				for (long k = 0; k < d2; k++) {
					value.setV(100 * i + 10 * j + k);
					vw.set(i, j, k, value);
				}

		return data;
	}

	private static double at(DimensionedDataSource<Float64Member> data, long i, long j, long k) {

		Float64Member value = G.DBL.construct();

		new ThreeDView<>(data).get(i, j, k, value);

		return value.v();
	}

	@Test
	void clockwiseTurn() {

		DimensionedDataSource<Float64Member> in = numbered(3, 2, 2);

		DimensionedDataSource<Float64Member> out = Orientation.rotateClockwise(G.DBL, in);

		assertThat(out.dimension(0)).isEqualTo(2);
		assertThat(out.dimension(1)).isEqualTo(3);
		assertThat(out.dimension(2)).isEqualTo(2);

		// the left column of the input becomes the top row, read bottom up
		assertThat(at(out, 0, 0, 0)).isEqualTo(at(in, 2, 0, 0));
		assertThat(at(out, 0, 2, 1)).isEqualTo(at(in, 0, 0, 1));
		assertThat(at(out, 1, 0, 1)).isEqualTo(at(in, 2, 1, 1));
	}

	@Test
	void counterClockwiseUndoesClockwise() {

		DimensionedDataSource<Float64Member> in = numbered(3, 4, 2);

		DimensionedDataSource<Float64Member> back =
				Orientation.rotateCounterClockwise(G.DBL, Orientation.rotateClockwise(G.DBL, in));

		for (long i = 0; i < 3; i++)
			for (long j = 0; j < 4; j++)
				for (long k = 0; k < 2; k++)
					assertThat(at(back, i, j, k)).isEqualTo(at(in, i, j, k));
	}

	@Test
	void mirrorReversesColumnsInPlace() {

		DimensionedDataSource<Float64Member> data = numbered(2, 5, 1);

		Orientation.mirrorColumns(G.DBL, data);

		for (long i = 0; i < 2; i++)
			for (long j = 0; j < 5; j++)
				assertThat(at(data, i, j, 0)).isEqualTo(100 * i + 10 * (4 - j));
	}

	@Test
	void normalizeSwapsTheImageAxes() {

		DimensionedDataSource<Float64Member> in = numbered(4, 3, 2);

		DimensionedDataSource<Float64Member> out = Orientation.normalize(G.DBL, in);

		assertThat(out.dimension(0)).isEqualTo(3);
		assertThat(out.dimension(1)).isEqualTo(4);

		for (long r = 0; r < 3; r++)
			for (long c = 0; c < 4; c++)
				for (long k = 0; k < 2; k++)
					assertThat(at(out, r, c, k)).isEqualTo(at(in, c, r, k));
	}
}
