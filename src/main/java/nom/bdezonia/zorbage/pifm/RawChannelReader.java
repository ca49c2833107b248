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

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Reads the headerless channel files a PiFM scan is saved as. A file is a run of
 * 32 bit little endian signed integers: yPixel scan lines, each of xPixel pixels,
 * each pixel being one sample (an image channel) or S consecutive samples (the
 * hyperspectral channel). Samples are multiplied by the channel's scale factor.
 * <p>
 * Results are indexed [column, row] or [column, row, plane]. This is transposed
 * relative to the file order; the orientation step of {@link HyperImageReader}
 * depends on it.
 *
 * @author Barry DeZonia
 *
 */
public class RawChannelReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(RawChannelReader.class);

	private static final int BYTES_PER_SAMPLE = 4;

	// do not instantiate

	private RawChannelReader() { }

	/**
	 *
	 * @param filename
	 * @param yPixels number of scan lines
	 * @param xPixels number of pixels per scan line
	 * @param scale
	 * @return an xPixels by yPixels grid
	 */
	public static

		DimensionedDataSource<Float64Member>

			readChannel(String filename, int yPixels, int xPixels, double scale)
	{
		checkGeometry(yPixels, xPixels, 1);

		DimensionedDataSource<Float64Member> data =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {xPixels, yPixels});

		TwoDView<Float64Member> vw = new TwoDView<>(data);

		Float64Member value = G.DBL.construct();

		try (DataInputStream dis = open(filename, (long) yPixels * xPixels)) {

			for (long row = 0; row < yPixels; row++) {

				for (long col = 0; col < xPixels; col++) {

					value.setV(scale * readInt(dis));

					vw.set(col, row, value);
				}
			}

		} catch (IOException e) {

			throw new IllegalArgumentException("IOException during channel read of " + filename + ": " + e.getMessage(), e);
		}

		data.setSource(filename);

		LOGGER.debug("read channel {} as {} x {} (scale {})", filename, xPixels, yPixels, scale);

		return data;
	}

	/**
	 *
	 * @param filename
	 * @param yPixels number of scan lines
	 * @param xPixels number of pixels per scan line
	 * @param planes number of samples stored per pixel
	 * @param scale
	 * @return an xPixels by yPixels by planes cube
	 */
	public static

		DimensionedDataSource<Float64Member>

			readHyperChannel(String filename, int yPixels, int xPixels, int planes, double scale)
	{
		checkGeometry(yPixels, xPixels, planes);

		DimensionedDataSource<Float64Member> data =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {xPixels, yPixels, planes});

		ThreeDView<Float64Member> vw = new ThreeDView<>(data);

		Float64Member value = G.DBL.construct();

		try (DataInputStream dis = open(filename, (long) yPixels * xPixels * planes)) {

			for (long row = 0; row < yPixels; row++) {

				for (long col = 0; col < xPixels; col++) {

					for (long plane = 0; plane < planes; plane++) {

						value.setV(scale * readInt(dis));

						vw.set(col, row, plane, value);
					}
				}
			}

		} catch (IOException e) {

			throw new IllegalArgumentException("IOException during hyperspectral read of " + filename + ": " + e.getMessage(), e);
		}

		data.setSource(filename);

		LOGGER.debug("read hyperspectral channel {} as {} x {} x {} (scale {})", filename, xPixels, yPixels, planes, scale);

		return data;
	}

	private static void checkGeometry(int yPixels, int xPixels, int planes) {

		if (yPixels <= 0 || xPixels <= 0 || planes <= 0)
			throw new IllegalArgumentException("channel dimensions must be positive: xPixel = " +
					xPixels + " yPixel = " + yPixels + " planes = " + planes);
	}

	// validate the size before handing back a stream positioned at the first sample

	private static DataInputStream open(String filename, long samples) throws IOException {

		Path path = Paths.get(filename);

		long expected = samples * BYTES_PER_SAMPLE;

		long actual = Files.size(path);

		if (actual != expected)
			throw new TruncatedDataException(filename, expected, actual);

		return new DataInputStream(new BufferedInputStream(Files.newInputStream(path)));
	}

	private static int readInt(DataInputStream dis) throws IOException {

		return Integer.reverseBytes(dis.readInt());
	}
}
