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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.misc.DataBundle;
import nom.bdezonia.zorbage.tuple.Tuple3;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * Loads a PiFM scan from its ANFATEC parameter file. The channel files and the
 * wavelength file named in the parameter file are looked up in the parameter
 * file's directory.
 *
 * @author Barry DeZonia
 *
 */
public class HyperImageReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(HyperImageReader.class);

	// do not instantiate

	private HyperImageReader() { }

	// --- PUBLIC API ---

	/**
	 *
	 * @param filename
	 * @return
	 */
	public static

		DataBundle

			readAllDatasets(String filename)
	{
		HyperImage image = read(filename);

		DataBundle bundle = new DataBundle();

		bundle.dbls.add(image.hyperImage());

		if (image.channelData() != null)
			bundle.dbls.add(image.channelData());

		return bundle;
	}

	/**
	 *
	 * @param filename the ANFATEC parameter file
	 * @return
	 */
	public static HyperImage read(String filename) {

		return read(filename, ParamFileOptions.defaults());
	}

	/**
	 *
	 * @param filename the ANFATEC parameter file
	 * @param options
	 * @return
	 */
	public static HyperImage read(String filename, ParamFileOptions options) {

		Path paramFile = Paths.get(filename).toAbsolutePath().normalize();

		Path directory = paramFile.getParent();

		Tuple3<ScanParameters, List<ChannelDescriptor>, List<SpectrumDescriptor>> parsed =
				AnfatecParamReader.read(paramFile.toString(), options);

		ScanParameters params = parsed.a();

		List<ChannelDescriptor> channels = parsed.b();

		validate(paramFile, params, channels);

		int xPixels = params.xPixels();

		int yPixels = params.yPixels();

		ChannelDescriptor hyper = channels.get(0);

		IndexedDataSource<Float64Member> wavelengths =
				WavelengthAxisReader.read(directory.resolve(hyper.wavelengthFileName()).toString());

		int wavenumberCount = (int) wavelengths.size();

		DimensionedDataSource<Float64Member> rawCube =
				RawChannelReader.readHyperChannel(directory.resolve(hyper.fileName()).toString(),
						yPixels, xPixels, wavenumberCount, hyper.scale());

		List<ChannelDescriptor> imageChannels = channels.subList(1, channels.size());

		List<String> channelNames = new ArrayList<>();

		DimensionedDataSource<Float64Member> rawStack = null;

		if (!imageChannels.isEmpty()) {

			rawStack = DimensionedStorage.allocate(G.DBL.construct(),
					new long[] {xPixels, yPixels, imageChannels.size()});

			for (int ch = 0; ch < imageChannels.size(); ch++) {

				ChannelDescriptor channel = imageChannels.get(ch);

				channelNames.add(channel.caption());

				DimensionedDataSource<Float64Member> plane =
						RawChannelReader.readChannel(directory.resolve(channel.fileName()).toString(),
								yPixels, xPixels, channel.scale());

				copyPlane(plane, rawStack, ch);
			}
		}

		DimensionedDataSource<Float64Member> cube = Orientation.normalize(G.DBL, rawCube);

		DimensionedDataSource<Float64Member> stack =
				rawStack == null ? null : Orientation.normalize(G.DBL, rawStack);

		describe(cube, "hyperspectral image", "wavenumber", "cm-1", hyper, params, paramFile);

		if (stack != null)
			describe(stack, "channel images", "channel", "", null, params, paramFile);

		LOGGER.info("read PiFM scan {}: {} x {} pixels, {} wavenumbers, channels {}",
				paramFile, xPixels, yPixels, wavenumberCount, channelNames);

		return new HyperImage(params, channels, parsed.c(), channelNames, wavelengths, cube, stack);
	}

	// --- PRIVATE API ---

	// fail on missing keys before any channel data is read

	private static void validate(Path paramFile, ScanParameters params, List<ChannelDescriptor> channels) {

		if (channels.isEmpty())
			throw new MissingParameterException("FileDescBegin", "parameter file " + paramFile);

		params.xPixels();

		params.yPixels();

		ChannelDescriptor hyper = channels.get(0);

		hyper.fileName();

		hyper.scale();

		hyper.wavelengthFileName();

		for (ChannelDescriptor channel : channels.subList(1, channels.size())) {

			channel.caption();

			channel.fileName();

			channel.scale();
		}
	}

	private static void copyPlane(DimensionedDataSource<Float64Member> plane,
									DimensionedDataSource<Float64Member> stack, long index)
	{
		TwoDView<Float64Member> in = new TwoDView<>(plane);

		ThreeDView<Float64Member> out = new ThreeDView<>(stack);

		Float64Member value = G.DBL.construct();

		for (long y = 0; y < in.d1(); y++) {

			for (long x = 0; x < in.d0(); x++) {

				in.get(x, y, value);

				out.set(x, y, index, value);
			}
		}
	}

	private static void describe(DimensionedDataSource<Float64Member> data, String name,
									String planeAxis, String planeUnit, ChannelDescriptor channel,
									ScanParameters params, Path paramFile)
	{
		data.setName(name);

		data.setSource(paramFile.toString());

		data.setAxisType(0, "y");
		data.setAxisUnit(0, "px");
		data.setAxisType(1, "x");
		data.setAxisUnit(1, "px");
		data.setAxisType(2, planeAxis);
		data.setAxisUnit(2, planeUnit);

		if (channel != null) {

			data.setValueType(channel.get(ChannelDescriptor.CAPTION) == null ? "Intensity" : channel.get(ChannelDescriptor.CAPTION));

			data.setValueUnit(channel.get("PhysUnit") == null ? "" : channel.get("PhysUnit"));
		}

		for (String key : params.keys()) {

			data.metadata().putString(key, params.get(key));
		}
	}
}
