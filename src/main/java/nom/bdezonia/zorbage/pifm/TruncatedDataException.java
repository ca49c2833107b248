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
 * A raw channel file whose size does not match the declared scan geometry.
 * 
 * @author Barry DeZonia
 *
 */
public class TruncatedDataException extends PifmFormatException {

	private static final long serialVersionUID = 1L;

	private final long expectedBytes;
	
	private final long actualBytes;
	
	public TruncatedDataException(String filename, long expectedBytes, long actualBytes) {
		
		super(filename + ": expected " + expectedBytes + " bytes of channel data but found " + actualBytes);
		
		this.expectedBytes = expectedBytes;
		
		this.actualBytes = actualBytes;
	}

	public long expectedBytes() {
		
		return expectedBytes;
	}

	public long actualBytes() {
		
		return actualBytes;
	}
}
