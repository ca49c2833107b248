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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.storage.Storage;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Reads the wavelength file that accompanies a hyperspectral channel. Each
 * row holds one or more whitespace separated numbers; the first is the
 * wavenumber of that spectral plane. Blank rows and rows starting with '#' are
 * ignored. The values are kept in file order and are not assumed to be sorted.
 *
 * @author Barry DeZonia
 *
 */
public class WavelengthAxisReader {

	// do not instantiate

	private WavelengthAxisReader() { }

	/**
	 *
	 * @param filename
	 * @return
	 */
	public static IndexedDataSource<Float64Member> read(String filename) {

		List<Double> wavenumbers = new ArrayList<>();

		try (BufferedReader br = Files.newBufferedReader(Paths.get(filename), StandardCharsets.ISO_8859_1)) {

			int lineNumber = 0;

			String line;

			while ((line = br.readLine()) != null) {

				lineNumber++;

				String trimmed = line.trim();

				if (trimmed.isEmpty() || trimmed.startsWith("#"))
					continue;

				String[] terms = trimmed.split("\\s+");

				try {

					wavenumbers.add(Double.parseDouble(terms[0]));

				} catch (NumberFormatException e) {

					throw new MalformedLineException(filename, lineNumber, "bad number in wavelength file: '" + terms[0] + "'");
				}
			}

		} catch (IOException e) {

			throw new IllegalArgumentException("IOException reading wavelength file " + filename + ": " + e.getMessage(), e);
		}

		if (wavenumbers.isEmpty())
			throw new MissingParameterException("wavenumber", "wavelength file " + filename);

		IndexedDataSource<Float64Member> axis = Storage.allocate(G.DBL.construct(), wavenumbers.size());

		Float64Member value = G.DBL.construct();

		for (int i = 0; i < wavenumbers.size(); i++) {

			value.setV(wavenumbers.get(i));

			axis.set(i, value);
		}

		return axis;
	}
}
