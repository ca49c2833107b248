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
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.bdezonia.zorbage.tuple.Tuple3;

/**
 * Reads the ANFATEC parameter file written by the Molecular Vista PiFM system.
 * The file is a list of {@code key : value} lines. Lines between
 * {@code FileDescBegin} and {@code FileDescEnd} describe one recorded channel,
 * lines between {@code SpectrumDescBegin} and {@code SpectrumDescEnd} describe
 * one spectrum and every other line is a scan wide parameter. Lines starting
 * with ';' are comments.
 *
 * @author Barry DeZonia
 *
 */
public class AnfatecParamReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(AnfatecParamReader.class);

	private enum State { SCANNING, IN_CHANNEL_BLOCK, IN_SPECTRUM_BLOCK }

	// do not instantiate

	private AnfatecParamReader() { }

	/**
	 * Read a parameter file using {@link ParamFileOptions#defaults()}.
	 *
	 * @param filename
	 * @return the scan parameters, the file descriptions in file order, and
	 *           the spectrum descriptions in file order
	 */
	public static

		Tuple3<ScanParameters, List<ChannelDescriptor>, List<SpectrumDescriptor>>

			read(String filename)
	{
		return read(filename, ParamFileOptions.defaults());
	}

	/**
	 *
	 * @param filename
	 * @param options
	 * @return
	 */
	public static

		Tuple3<ScanParameters, List<ChannelDescriptor>, List<SpectrumDescriptor>>

			read(String filename, ParamFileOptions options)
	{
		Parse parse = new Parse(filename, options);

		try (BufferedReader reader = Files.newBufferedReader(Paths.get(filename), options.encoding())) {

			String line;

			while ((line = reader.readLine()) != null) {

				parse.accept(line);
			}

		} catch (CharacterCodingException e) {

			throw new EncodingException(filename, options.encoding(), e);

		} catch (IOException e) {

			throw new IllegalArgumentException("IOException reading parameter file " + filename + ": " + e.getMessage(), e);
		}

		parse.finish();

		LOGGER.debug("{}: {} scan parameters, {} file descriptions, {} spectrum descriptions",
				filename, parse.scanParams.size(), parse.channels.size(), parse.spectra.size());

		return new Tuple3<>(new ScanParameters(parse.scanParams), parse.channels, parse.spectra);
	}

	/**
	 * The state of one pass over a parameter file.
	 */
	private static class Parse {

		private final String filename;

		private final boolean closingLineCaptured;

		private final Map<String,String> scanParams = new LinkedHashMap<>();

		private final List<ChannelDescriptor> channels = new ArrayList<>();

		private final List<SpectrumDescriptor> spectra = new ArrayList<>();

		private State state = State.SCANNING;

		private Map<String,String> block = new LinkedHashMap<>();

		private int lineNumber = 0;

		Parse(String filename, ParamFileOptions options) {

			this.filename = filename;

			this.closingLineCaptured = options.closingLineCaptured();
		}

		void accept(String rawLine) {

			lineNumber++;

			String row = rawLine.trim();

			if (row.isEmpty() || row.charAt(0) == ';')
				return;

			if (row.startsWith("File") && row.endsWith("Begin")) {

				open(State.IN_CHANNEL_BLOCK, row);
			}
			else if (row.endsWith("SpectrumDescBegin")) {

				open(State.IN_SPECTRUM_BLOCK, row);
			}
			else if (row.startsWith("File") && row.endsWith("End")) {

				close(State.IN_CHANNEL_BLOCK, row);

				channels.add(new ChannelDescriptor(block));

				block = new LinkedHashMap<>();
			}
			else if (row.endsWith("SpectrumDescEnd")) {

				close(State.IN_SPECTRUM_BLOCK, row);

				spectra.add(new SpectrumDescriptor(block));

				block = new LinkedHashMap<>();
			}
			else {

				String[] pair = split(row);

				if (pair == null)
					throw new MalformedLineException(filename, lineNumber, "expected 'key : value' but found '" + row + "'");

				if (state == State.SCANNING)
					scanParams.put(pair[0], pair[1]);
				else
					block.put(pair[0], pair[1]);
			}
		}

		void finish() {

			if (state != State.SCANNING)
				throw new MalformedLineException(filename, lineNumber, "end of file inside an unterminated " +
						(state == State.IN_CHANNEL_BLOCK ? "file" : "spectrum") + " description");
		}

		private void open(State blockState, String row) {

			if (state != State.SCANNING)
				throw new MalformedLineException(filename, lineNumber, "'" + row + "' opens a description inside another description");

			state = blockState;

			block = new LinkedHashMap<>();
		}

		private void close(State blockState, String row) {

			if (state != blockState)
				throw new MalformedLineException(filename, lineNumber, "'" + row + "' does not close an open description");

			// a closing line may carry a pair of its own

			if (closingLineCaptured) {

				String[] pair = split(row);

				if (pair != null)
					block.put(pair[0], pair[1]);
			}

			state = State.SCANNING;
		}
	}

	/**
	 * Split a line on its colons. The key is the first piece and the value the
	 * last one, so "Date : 10:30" yields the pair (Date, 30).
	 *
	 * @param row
	 * @return a {key, value} pair or null when the line has no colon
	 */
	static String[] split(String row) {

		if (row.indexOf(':') < 0)
			return null;

		String[] pieces = row.split(":", -1);

		return new String[] { pieces[0].trim(), pieces[pieces.length - 1].trim() };
	}
}
