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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Loads PiFM images that were exported as Igor binary waves. Plane 0 of such a
 * wave holds topography, which can optionally be flattened by removing its
 * linear trend.
 *
 * @author Barry DeZonia
 *
 */
public class IgorWaveLoader {

	private static final Logger LOGGER = LoggerFactory.getLogger(IgorWaveLoader.class);

	// do not instantiate

	private IgorWaveLoader() { }

	/**
	 *
	 * @param decoder
	 * @param filename
	 * @return the flattened and rotated wave
	 */
	public static

		DimensionedDataSource<Float64Member>

			load(BinaryWaveDecoder decoder, String filename)
	{
		return load(decoder, new LinearDetrender(), filename, true);
	}

	/**
	 * Decode a wave, detrend its topography plane along axis 0 when asked to,
	 * then give it a counterclockwise quarter turn in the image plane. The
	 * decoder's result is not modified.
	 *
	 * @param decoder
	 * @param detrender
	 * @param filename
	 * @param flatten
	 * @return
	 */
	public static

		DimensionedDataSource<Float64Member>

			load(BinaryWaveDecoder decoder, Detrender detrender, String filename, boolean flatten)
	{
		DimensionedDataSource<Float64Member> wave = decoder.load(filename);

		if (wave == null || wave.numDimensions() != 3)
			throw new IllegalArgumentException("binary wave " + filename + " does not hold three dimensional data");

		DimensionedDataSource<Float64Member> data = wave;

		if (flatten) {

			data = copy(wave);

			flattenTopography(detrender, data);

			LOGGER.debug("flattened topography of {}", filename);
		}

		DimensionedDataSource<Float64Member> result = Orientation.rotateCounterClockwise(G.DBL, data);

		result.setSource(filename);

		return result;
	}

	private static void flattenTopography(Detrender detrender, DimensionedDataSource<Float64Member> data) {

		ThreeDView<Float64Member> vw = new ThreeDView<>(data);

		Float64Member value = G.DBL.construct();

		double[] series = new double[(int) vw.d0()];

		for (long j = 0; j < vw.d1(); j++) {

			for (int i = 0; i < series.length; i++) {

				vw.get(i, j, 0, value);

				series[i] = value.v();
			}

			double[] flat = detrender.detrend(series);

			for (int i = 0; i < flat.length; i++) {

				value.setV(flat[i]);

				vw.set(i, j, 0, value);
			}
		}
	}

	private static DimensionedDataSource<Float64Member> copy(DimensionedDataSource<Float64Member> data) {

		ThreeDView<Float64Member> in = new ThreeDView<>(data);

		DimensionedDataSource<Float64Member> result =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {in.d0(), in.d1(), in.d2()});

		ThreeDView<Float64Member> out = new ThreeDView<>(result);

		Float64Member value = G.DBL.construct();

		for (long k = 0; k < in.d2(); k++) {

			for (long j = 0; j < in.d1(); j++) {

				for (long i = 0; i < in.d0(); i++) {

					in.get(i, j, k, value);

					out.set(i, j, k, value);
				}
			}
		}

		return result;
	}
}
