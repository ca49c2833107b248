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

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Sums a hyperspectral image over a range of wavenumbers.
 * <p>
 * Wavenumbers are matched against the wavelength axis after truncating the axis
 * values to integers. The first axis entry that matches wins; the axis is not
 * searched for the nearest value and is not assumed to be sorted. The planes
 * between the two matched indices are summed inclusively whichever of the two
 * wavenumbers is larger, so sum(img, 1000, 1200) and sum(img, 1200, 1000) agree.
 *
 * @author Barry DeZonia
 *
 */
public class HyperSlice {

	// do not instantiate

	private HyperSlice() { }

	/**
	 * Sum over the whole image.
	 *
	 * @param hyper
	 * @param start
	 * @param stop
	 * @return a rows by columns image
	 */
	public static

		DimensionedDataSource<Float64Member>

			sum(HyperImage hyper, long start, long stop)
	{
		return sum(hyper, start, stop, null, null);
	}

	/**
	 *
	 * @param hyper
	 * @param start
	 * @param stop
	 * @param rows {first, last + 1} or null for all rows
	 * @param cols {first, last + 1} or null for all columns
	 * @return
	 */
	public static

		DimensionedDataSource<Float64Member>

			sum(HyperImage hyper, long start, long stop, long[] rows, long[] cols)
	{
		long[] r = window(rows, hyper.rows(), "row");

		long[] c = window(cols, hyper.columns(), "column");

		// instrument axes usually run from high wavenumber to low

		long first = indexOf(hyper.wavelengths(), stop);

		long last = indexOf(hyper.wavelengths(), start);

		long from = Math.min(first, last);

		long to = Math.max(first, last);

		DimensionedDataSource<Float64Member> result =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {r[1] - r[0], c[1] - c[0]});

		ThreeDView<Float64Member> cube = new ThreeDView<>(hyper.hyperImage());

		TwoDView<Float64Member> out = new TwoDView<>(result);

		Float64Member value = G.DBL.construct();

		Float64Member total = G.DBL.construct();

		for (long j = c[0]; j < c[1]; j++) {

			for (long i = r[0]; i < r[1]; i++) {

				double sum = 0;

				for (long k = from; k <= to; k++) {

					cube.get(i, j, k, value);

					sum += value.v();
				}

				total.setV(sum);

				out.set(i - r[0], j - c[0], total);
			}
		}

		result.setName("sum of wavenumbers " + start + " to " + stop);

		return result;
	}

	/**
	 * A copy of a single spectral plane.
	 *
	 * @param hyper
	 * @param index position on the wavelength axis
	 * @param rows {first, last + 1} or null for all rows
	 * @param cols {first, last + 1} or null for all columns
	 * @return
	 */
	public static

		DimensionedDataSource<Float64Member>

			plane(HyperImage hyper, long index, long[] rows, long[] cols)
	{
		if (index < 0 || index >= hyper.wavenumberCount())
			throw new IllegalArgumentException("wavenumber index " + index + " outside 0.." + (hyper.wavenumberCount() - 1));

		long[] r = window(rows, hyper.rows(), "row");

		long[] c = window(cols, hyper.columns(), "column");

		DimensionedDataSource<Float64Member> result =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {r[1] - r[0], c[1] - c[0]});

		ThreeDView<Float64Member> cube = new ThreeDView<>(hyper.hyperImage());

		TwoDView<Float64Member> out = new TwoDView<>(result);

		Float64Member value = G.DBL.construct();

		for (long j = c[0]; j < c[1]; j++) {

			for (long i = r[0]; i < r[1]; i++) {

				cube.get(i, j, index, value);

				out.set(i - r[0], j - c[0], value);
			}
		}

		return result;
	}

	/**
	 *
	 * @param axis
	 * @param wavenumber
	 * @return the first index whose truncated value equals wavenumber
	 * @throws WavenumberNotFoundException
	 */
	public static long indexOf(IndexedDataSource<Float64Member> axis, long wavenumber) {

		Float64Member value = G.DBL.construct();

		for (long i = 0; i < axis.size(); i++) {

			axis.get(i, value);

			if ((long) value.v() == wavenumber)
				return i;
		}

		throw new WavenumberNotFoundException(wavenumber);
	}

	private static long[] window(long[] bounds, long extent, String what) {

		if (bounds == null)
			return new long[] {0, extent};

		if (bounds.length != 2)
			throw new IllegalArgumentException(what + " bounds must be {first, last + 1}");

		if (bounds[0] < 0 || bounds[1] > extent)
			throw new IllegalArgumentException(what + " bounds [" + bounds[0] + ", " + bounds[1] + ") outside 0.." + extent);

		if (bounds[1] <= bounds[0])
			throw new EmptyRangeException("empty " + what + " range [" + bounds[0] + ", " + bounds[1] + ")");

		return bounds;
	}
}
