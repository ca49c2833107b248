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
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Prints a summary of a PiFM scan. Usage: {@code Main <parameter file> [start stop]}
 *
 * @author Barry DeZonia
 */
public class Main {

	public static void main(String[] args) {

		if (args.length != 1 && args.length != 3) {

			System.err.println("usage: Main <anfatec parameter file> [start wavenumber] [stop wavenumber]");

			System.exit(1);
		}

		try {

			System.out.println(run(args));

		} catch (IllegalArgumentException e) {

			System.err.println(e.getMessage());

			System.exit(1);
		}
	}

	static String run(String[] args) {

		String filename = args[0];

		HyperImage image = HyperImageReader.read(filename);

		StringBuilder report = new StringBuilder();

		report.append("scan file = ").append(filename).append('\n');

		report.append("image size = ").append(image.rows()).append(" rows x ").append(image.columns()).append(" columns\n");

		report.append("wavenumbers = ").append(image.wavenumberCount());

		if (image.wavenumberCount() > 0)
			report.append(" (").append(image.wavenumber(0)).append(" to ").append(image.wavenumber(image.wavenumberCount() - 1)).append(")");

		report.append('\n');

		report.append("channels = ").append(image.channelNames()).append('\n');

		report.append("spectrum descriptions = ").append(image.spectrumDescriptors().size());

		if (args.length == 3) {

			long start = Long.parseLong(args[1]);

			long stop = Long.parseLong(args[2]);

			DimensionedDataSource<Float64Member> slice = HyperSlice.sum(image, start, stop);

			report.append('\n').append("total intensity from ").append(start).append(" to ").append(stop)
				.append(" = ").append(total(slice));
		}

		return report.toString();
	}

	private static double total(DimensionedDataSource<Float64Member> slice) {

		TwoDView<Float64Member> vw = new TwoDView<>(slice);

		Float64Member value = G.DBL.construct();

		double sum = 0;

		for (long y = 0; y < vw.d1(); y++) {

			for (long x = 0; x < vw.d0(); x++) {

				vw.get(x, y, value);

				sum += value.v();
			}
		}

		return sum;
	}
}
