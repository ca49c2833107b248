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

import java.util.Map;

/**
 * The contents of one {@code FileDescBegin} / {@code FileDescEnd} block. The
 * first block of a parameter file describes the hyperspectral channel and
 * names the wavelength file; the others describe one image each.
 * 
 * @author Barry DeZonia
 *
 */
public final class ChannelDescriptor extends ParameterBlock {

	public static final String CAPTION = "Caption";
	
	public static final String FILE_NAME = "FileName";
	
	public static final String SCALE = "Scale";
	
	public static final String FILE_NAME_WAVELENGTHS = "FileNameWavelengths";
	
	public ChannelDescriptor(Map<String,String> values) {
		
		super(values);
	}

	@Override
	protected String scope() {
		
		String caption = get(CAPTION);
		
		return caption == null ? "file description" : "file description '" + caption + "'";
	}
	
	public String caption() {
		
		return require(CAPTION);
	}
	
	public String fileName() {
		
		return require(FILE_NAME);
	}
	
	public double scale() {
		
		return requireDouble(SCALE);
	}
	
	public String wavelengthFileName() {
		
		return require(FILE_NAME_WAVELENGTHS);
	}
}
