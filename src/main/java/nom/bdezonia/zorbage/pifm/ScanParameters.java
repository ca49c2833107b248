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
 * The scan wide values of an ANFATEC parameter file: everything that is not
 * inside a file or spectrum description block (pixel counts, scan size, etc.).
 * 
 * @author Barry DeZonia
 *
 */
public final class ScanParameters extends ParameterBlock {

	public static final String X_PIXEL = "xPixel";
	
	public static final String Y_PIXEL = "yPixel";
	
	public ScanParameters(Map<String,String> values) {
		
		super(values);
	}

	@Override
	protected String scope() {
		
		return "scan parameters";
	}
	
	public int xPixels() {
		
		return requireInt(X_PIXEL);
	}
	
	public int yPixels() {
		
		return requireInt(Y_PIXEL);
	}
}
