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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable group of {@code key : value} pairs read from an ANFATEC
 * parameter file. Keys keep the order they appeared in within the file.
 * 
 * @author Barry DeZonia
 *
 */
public abstract class ParameterBlock {

	private final Map<String,String> values;
	
	protected ParameterBlock(Map<String,String> values) {
		
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}
	
	/**
	 * A short description of where these values came from. Used in error messages.
	 */
	protected abstract String scope();

	/**
	 * 
	 * @param key
	 * @return the raw value or null if the key is not present
	 */
	public String get(String key) {
		
		return values.get(key);
	}
	
	public boolean containsKey(String key) {
		
		return values.containsKey(key);
	}

	/**
	 * 
	 * @param key
	 * @return the raw value
	 * @throws MissingParameterException if the key is not present
	 */
	public String require(String key) {
		
		String value = values.get(key);
		
		if (value == null)
			throw new MissingParameterException(key, scope());
		
		return value;
	}
	
	public int requireInt(String key) {
		
		String value = require(key);
		
		try {
			
			return Integer.parseInt(value);
			
		} catch (NumberFormatException e) {
			
			throw new PifmFormatException("parameter '" + key + "' in " + scope() + " is not an integer: " + value, e);
		}
	}
	
	public double requireDouble(String key) {
		
		String value = require(key);
		
		try {
			
			return Double.parseDouble(value);
			
		} catch (NumberFormatException e) {
			
			throw new PifmFormatException("parameter '" + key + "' in " + scope() + " is not a number: " + value, e);
		}
	}
	
	/**
	 * 
	 * @return the keys in file order
	 */
	public List<String> keys() {
		
		return List.copyOf(values.keySet());
	}
	
	public int size() {
		
		return values.size();
	}
	
	public Map<String,String> asMap() {
		
		return values;
	}
	
	@Override
	public boolean equals(Object o) {
		
		if (this == o) return true;
		
		if (o == null || o.getClass() != getClass()) return false;
		
		return values.equals(((ParameterBlock) o).values);
	}
	
	@Override
	public int hashCode() {
		
		return values.hashCode();
	}
	
	@Override
	public String toString() {
		
		return getClass().getSimpleName() + values;
	}
}
