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
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Flattens a hyperspectral cube into an observation matrix for statistical work:
 * one row per pixel, one column per wavenumber.
 *
 * @author Barry DeZonia
 *
 */
public class FeatureMatrix {

	// do not instantiate

	private FeatureMatrix() { }

	/**
	 * Reshape a d0 x d1 x S cube into a (d0 * d1) x S matrix, dividing every
	 * spectrum by the laser power it was recorded at. Pixel (i, j) becomes row
	 * i * d1 + j.
	 *
	 * @param cube
	 * @param laserPower
	 * @return
	 */
	public static

		DimensionedDataSource<Float64Member>

			toTwoD(DimensionedDataSource<Float64Member> cube, double laserPower)
	{
		if (laserPower == 0 || Double.isNaN(laserPower) || Double.isInfinite(laserPower))
			throw new IllegalArgumentException("laser power must be a finite nonzero number: " + laserPower);

		if (cube.numDimensions() != 3)
			throw new IllegalArgumentException("expected a three dimensional cube but found " + cube.numDimensions() + " dimensions");

		ThreeDView<Float64Member> in = new ThreeDView<>(cube);

		DimensionedDataSource<Float64Member> matrix =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {in.d0() * in.d1(), in.d2()});

		TwoDView<Float64Member> out = new TwoDView<>(matrix);

		Float64Member value = G.DBL.construct();

		long row = 0;

		for (long i = 0; i < in.d0(); i++) {

			for (long j = 0; j < in.d1(); j++) {

				for (long k = 0; k < in.d2(); k++) {

					in.get(i, j, k, value);

					value.setV(value.v() / laserPower);

					out.set(row, k, value);
				}

				row++;
			}
		}

		matrix.setName("feature matrix");

		return matrix;
	}
}
