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

/**
 * Subtracts the least squares straight line from a series.
 *
 * @author Barry DeZonia
 *
 */
public class LinearDetrender implements Detrender {

	@Override
	public double[] detrend(double[] series) {

		int n = series.length;

		double[] result = new double[n];

		if (n == 0)
			return result;

		double meanX = (n - 1) / 2.0;

		double meanY = 0;

		for (double v : series) {

			meanY += v;
		}

		meanY /= n;

		double sxy = 0;

		double sxx = 0;

		for (int i = 0; i < n; i++) {

			double dx = i - meanX;

			sxy += dx * (series[i] - meanY);

			sxx += dx * dx;
		}

		double slope = sxx == 0 ? 0 : sxy / sxx;

		for (int i = 0; i < n; i++) {

			result[i] = series[i] - (meanY + slope * (i - meanX));
		}

		return result;
	}
}
