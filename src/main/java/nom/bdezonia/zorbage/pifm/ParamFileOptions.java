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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Settings for reading an ANFATEC parameter file.
 * 
 * @author Barry DeZonia
 *
 */
public final class ParamFileOptions {

	private static final ParamFileOptions DEFAULTS =
			new ParamFileOptions(StandardCharsets.ISO_8859_1, true);
	
	private final Charset encoding;
	
	private final boolean closingLineCaptured;
	
	private ParamFileOptions(Charset encoding, boolean closingLineCaptured) {
		
		this.encoding = Objects.requireNonNull(encoding, "encoding");
		
		this.closingLineCaptured = closingLineCaptured;
	}
	
	/**
	 * ISO-8859-1 text. A {@code key : value} pair on a block's closing line
	 * is stored in that block.
	 */
	public static ParamFileOptions defaults() {
		
		return DEFAULTS;
	}
	
	public ParamFileOptions withEncoding(Charset encoding) {
		
		return new ParamFileOptions(encoding, closingLineCaptured);
	}
	
	/**
	 * 
	 * @param captured when false a pair found on a block's closing line is dropped
	 * @return
	 */
	public ParamFileOptions withClosingLineCaptured(boolean captured) {
		
		return new ParamFileOptions(encoding, captured);
	}
	
	public Charset encoding() {
		
		return encoding;
	}
	
	public boolean closingLineCaptured() {
		
		return closingLineCaptured;
	}
}
