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

import java.util.List;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.datasource.IndexedDataSource;
import nom.bdezonia.zorbage.dataview.ThreeDView;
import nom.bdezonia.zorbage.dataview.TwoDView;
import nom.bdezonia.zorbage.storage.Storage;
import nom.bdezonia.zorbage.type.real.float64.Float64Member;

/**
 * One PiFM scan held in memory: the hyperspectral cube, the stack of ordinary
 * channel images and the parameters they were read with. Built by
 * {@link HyperImageReader}.
 * <p>
 * The cube is indexed [row, column, wavenumber index] and the channel stack
 * [row, column, channel index]. Row 0 is the top of the image and column 0 its
 * left edge.
 *
 * @author Barry DeZonia
 *
 */
public final class HyperImage {

	private final ScanParameters parameters;

	private final List<ChannelDescriptor> channels;

	private final List<SpectrumDescriptor> spectra;

	private final List<String> channelNames;

	private final IndexedDataSource<Float64Member> wavelengths;

	private final DimensionedDataSource<Float64Member> hyperImage;

	private final DimensionedDataSource<Float64Member> channelData;

	HyperImage(ScanParameters parameters,
				List<ChannelDescriptor> channels,
				List<SpectrumDescriptor> spectra,
				List<String> channelNames,
				IndexedDataSource<Float64Member> wavelengths,
				DimensionedDataSource<Float64Member> hyperImage,
				DimensionedDataSource<Float64Member> channelData)
	{
		this.parameters = parameters;
		this.channels = List.copyOf(channels);
		this.spectra = List.copyOf(spectra);
		this.channelNames = List.copyOf(channelNames);
		this.wavelengths = wavelengths;
		this.hyperImage = hyperImage;
		this.channelData = channelData;
	}

	public ScanParameters parameters() {

		return parameters;
	}

	/**
	 * All file descriptions in file order. The first one is the hyperspectral channel.
	 */
	public List<ChannelDescriptor> channelDescriptors() {

		return channels;
	}

	public List<SpectrumDescriptor> spectrumDescriptors() {

		return spectra;
	}

	/**
	 * Captions of the channel stack planes, in plane order.
	 */
	public List<String> channelNames() {

		return channelNames;
	}

	public IndexedDataSource<Float64Member> wavelengths() {

		return wavelengths;
	}

	public DimensionedDataSource<Float64Member> hyperImage() {

		return hyperImage;
	}

	/**
	 *
	 * @return the channel stack or null if the scan recorded no image channels
	 */
	public DimensionedDataSource<Float64Member> channelData() {

		return channelData;
	}

	public long rows() {

		return hyperImage.dimension(0);
	}

	public long columns() {

		return hyperImage.dimension(1);
	}

	public long wavenumberCount() {

		return wavelengths.size();
	}

	public int channelCount() {

		return channelNames.size();
	}

	public double wavenumber(long index) {

		Float64Member value = G.DBL.construct();

		wavelengths.get(index, value);

		return value.v();
	}

	/**
	 * A copy of one plane of the channel stack.
	 *
	 * @param caption
	 * @return a rows by columns image
	 */
	public DimensionedDataSource<Float64Member> channel(String caption) {

		int ch = channelNames.indexOf(caption);

		if (ch < 0)
			throw new MissingParameterException(caption, "channel captions " + channelNames);

		ThreeDView<Float64Member> stack = new ThreeDView<>(channelData);

		DimensionedDataSource<Float64Member> image =
				DimensionedStorage.allocate(G.DBL.construct(), new long[] {rows(), columns()});

		TwoDView<Float64Member> vw = new TwoDView<>(image);

		Float64Member value = G.DBL.construct();

		for (long c = 0; c < columns(); c++) {

			for (long r = 0; r < rows(); r++) {

				stack.get(r, c, ch, value);

				vw.set(r, c, value);
			}
		}

		image.setName(caption);

		return image;
	}

	/**
	 * A copy of the spectrum recorded at one pixel.
	 *
	 * @param row
	 * @param column
	 * @return
	 */
	public IndexedDataSource<Float64Member> spectrum(long row, long column) {

		ThreeDView<Float64Member> cube = new ThreeDView<>(hyperImage);

		IndexedDataSource<Float64Member> spectrum = Storage.allocate(G.DBL.construct(), cube.d2());

		Float64Member value = G.DBL.construct();

		for (long k = 0; k < cube.d2(); k++) {

			cube.get(row, column, k, value);

			spectrum.set(k, value);
		}

		return spectrum;
	}
}
