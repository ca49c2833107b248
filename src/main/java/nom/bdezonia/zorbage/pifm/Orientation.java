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

import nom.bdezonia.zorbage.algebra.Algebra;
import nom.bdezonia.zorbage.algebra.Allocatable;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.sampling.IntegerIndex;
import nom.bdezonia.zorbage.sampling.SamplingCartesianIntegerGrid;
import nom.bdezonia.zorbage.sampling.SamplingIterator;

/**
 * Spatial rearrangements of three dimensional data. Axes 0 and 1 form the image
 * plane and axis 2 (spectral planes or channels) is carried along unchanged.
 *
 * @author Barry DeZonia
 *
 */
public class Orientation {

	// do not instantiate

	private Orientation() { }

	/**
	 * Turn the instrument's [column, row, plane] order into [row, column, plane]
	 * with row 0 at the top and column 0 at the left: a clockwise quarter turn
	 * followed by a mirror of the column axis.
	 *
	 * @param algebra
	 * @param data
	 * @return a newly allocated source
	 */
	public static

		<T extends Algebra<T,U>, U extends Allocatable<U>>

			DimensionedDataSource<U> normalize(T algebra, DimensionedDataSource<U> data)
	{
		DimensionedDataSource<U> rotated = rotateClockwise(algebra, data);

		mirrorColumns(algebra, rotated);

		return rotated;
	}

	/**
	 * out[i, j, k] = in[d0 - 1 - j, i, k]
	 *
	 * @param algebra
	 * @param data
	 * @return a newly allocated source of dims {d1, d0, d2}
	 */
	public static

		<T extends Algebra<T,U>, U extends Allocatable<U>>

			DimensionedDataSource<U> rotateClockwise(T algebra, DimensionedDataSource<U> data)
	{
		ThreeDView<U> in = new ThreeDView<>(data);

		long d0 = in.d0();

		DimensionedDataSource<U> result =
				DimensionedStorage.allocate(algebra.construct(), new long[] {in.d1(), d0, in.d2()});

		ThreeDView<U> out = new ThreeDView<>(result);

		U value = algebra.construct();

		for (long k = 0; k < out.d2(); k++) {

			for (long j = 0; j < out.d1(); j++) {

				for (long i = 0; i < out.d0(); i++) {

					in.get(d0 - 1 - j, i, k, value);

					out.set(i, j, k, value);
				}
			}
		}

		return result;
	}

	/**
	 * out[i, j, k] = in[j, d1 - 1 - i, k]
	 *
	 * @param algebra
	 * @param data
	 * @return a newly allocated source of dims {d1, d0, d2}
	 */
	public static

		<T extends Algebra<T,U>, U extends Allocatable<U>>

			DimensionedDataSource<U> rotateCounterClockwise(T algebra, DimensionedDataSource<U> data)
	{
		ThreeDView<U> in = new ThreeDView<>(data);

		long d1 = in.d1();

		DimensionedDataSource<U> result =
				DimensionedStorage.allocate(algebra.construct(), new long[] {d1, in.d0(), in.d2()});

		ThreeDView<U> out = new ThreeDView<>(result);

		U value = algebra.construct();

		for (long k = 0; k < out.d2(); k++) {

			for (long j = 0; j < out.d1(); j++) {

				for (long i = 0; i < out.d0(); i++) {

					in.get(j, d1 - 1 - i, k, value);

					out.set(i, j, k, value);
				}
			}
		}

		return result;
	}

	/**
	 * Reverse axis 1 in place.
	 *
	 * @param algebra
	 * @param data
	 */
	public static

		<T extends Algebra<T,U>, U>

			void mirrorColumns(T algebra, DimensionedDataSource<U> data)
	{
		int numD = data.numDimensions();

		if (numD < 2)
			return;

		long[] dims = new long[numD];

		for (int i = 0; i < numD; i++) {

			dims[i] = data.dimension(i);
		}

		long mid = dims[1] / 2;

		if (mid == 0)
			return;

		long[] halfDims = dims.clone();

		halfDims[1] = mid;

		U firstVal = algebra.construct();

		U secondVal = algebra.construct();

		IntegerIndex index1 = new IntegerIndex(numD);

		IntegerIndex index2 = new IntegerIndex(numD);

		SamplingCartesianIntegerGrid sampling =

			new SamplingCartesianIntegerGrid(halfDims);

		SamplingIterator<IntegerIndex> iter = sampling.iterator();

		while (iter.hasNext()) {

			iter.next(index1);

			index2.set(index1);

			index2.set(1, dims[1] - index1.get(1) - 1);

			data.get(index1, firstVal);

			data.get(index2, secondVal);

			data.set(index2, firstVal);

			data.set(index1, secondVal);
		}
	}
}
