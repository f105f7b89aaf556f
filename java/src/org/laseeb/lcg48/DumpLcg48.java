/*
 * Copyright (c) 2015, Nuno Fachada
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   * Redistributions of source code must retain the above copyright
 *     notice, this list of conditions and the following disclaimer.
 *   * Redistributions in binary form must reproduce the above copyright
 *     notice, this list of conditions and the following disclaimer in the
 *     documentation and/or other materials provided with the distribution.
 *   * Neither the name of the Instituto Superior Técnico nor the
 *     names of its contributors may be used to endorse or promote products
 *     derived from this software without specific prior written permission.
 *     
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.laseeb.lcg48;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;

import org.uncommons.maths.random.SeedException;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Prints draws from a {@link Lcg48RNG}, one per line, or writes its raw
 * byte stream to stdout. The text output for a given seed can be compared
 * with what {@link java.util.Random} produces; the raw output can be piped
 * into a statistical test suite.
 * 
 * Usage: java -cp target/classes:lib/* org.laseeb.lcg48.DumpLcg48 -r 42 -t gaussian --bits
 * 
 * Usage: java -cp target/classes:lib/* org.laseeb.lcg48.DumpLcg48 --raw -n 0 | dieharder -g 200 -a
 * 
 * @author Nuno Fachada
 */
public class DumpLcg48 {

	/**
	 *  Enumeration containing program errors. 
	 * */
	public enum Errors {
		
		/** No error, successful program termination. */
		NONE(0),
		/** Error related with the specified command-line arguments. */
		ARGS(-1), 
		/** Other errors. */
		OTHER(-4);
		
		/* Error code. */
		private int value;
		
		/* Enumeration constructor. */
		private Errors(int value) { this.value = value; }
		
		/**
		 * Return code for specified error.
		 *  
		 * @return Code for specified error.
		 */
		public int getValue() { return this.value; }
	}

	/* Bytes drawn and written at a time in raw mode. */
	static final int RAW_BUFFER_SIZE = 4096;

	/* Seed for random number generator. */
	@Parameter(names = "-r", description = "Seed, decimal or 0x hex, signed or unsigned 64-bit (defaults to System.nanoTime())", 
			converter = SeedConverter.class)
	private Long seed = null;

	/* Worker ID. */
	@Parameter(names = "-w", description = "Worker ID; other than 0 derives a per-worker seed from the given seed, 0 uses it as is")
	private int workerId = 0;

	/* Kind of draw. */
	@Parameter(names = "-t", description = "Draw type (INT, UINT, LONG, BOOLEAN, BOUNDED, FLOAT, DOUBLE, GAUSSIAN or BYTES)", 
			converter = DrawTypeConverter.class)
	private DrawType drawType = DrawType.INT;

	/* Bound for bounded draws. */
	@Parameter(names = "-b", description = "Upper bound (exclusive) for BOUNDED draws, must be positive")
	private int bound = 10;

	/* Number of draws. */
	@Parameter(names = "-n", description = "Number of draws (with --raw, 0 streams until the output is closed)")
	private long count = 10;

	/* Print floating point values as bit patterns. */
	@Parameter(names = "--bits", description = "Print FLOAT, DOUBLE and GAUSSIAN draws as hex bit patterns")
	private boolean bits = false;

	/* Raw output. */
	@Parameter(names = "--raw", description = "Write raw bytes from nextBytes() instead of text")
	private boolean raw = false;

	/* Debug mode. */
	@Parameter(names = "-d", description = "Debug mode (show stack trace on error)", hidden = true)
	private boolean debug = false;

	/* Help option. */
	@Parameter(names = {"--help", "-h", "-?"}, description = "Show options", help = true)
	private boolean help;

	/**
	 * Main method.
	 * 
	 * @param args Command-line arguments.
	 */
	public static void main(String[] args) {
		System.exit(new DumpLcg48().doMain(args, System.out, System.err));
	}

	/**
	 * Parse the options, create the generator and write the draws.
	 * 
	 * @param args Command-line arguments.
	 * @param out Where to write the draws.
	 * @param err Where to write errors and usage.
	 * @return Program exit code, see {@link Errors}.
	 */
	public int doMain(String[] args, PrintStream out, PrintStream err) {

		/* Setup command line options parser. */
		JCommander parser = new JCommander(this);
		parser.setProgramName("java -cp target/classes" + java.io.File.pathSeparator + "lib" 
				+ java.io.File.separator + "* " + DumpLcg48.class.getName());

		/* Parse command line options. */
		try {
			parser.parse(args);
			if (this.count < 0 || (this.count == 0 && !this.raw)) {
				throw new ParameterException("Number of draws must be positive (0 is only allowed with --raw)");
			}
			if (this.bound <= 0) {
				throw new ParameterException("Bound must be positive, got " + this.bound);
			}
		} catch (ParameterException pe) {
			/* On parsing error, show usage and return. */
			err.println(errMessage(pe));
			usage(parser, err);
			return Errors.ARGS.getValue();
		}

		/* If help option was passed, show help and quit. */
		if (this.help) {
			usage(parser, out);
			return Errors.NONE.getValue();
		}

		/* Setup seed for random number generator. */
		if (this.seed == null)
			this.seed = System.nanoTime();

		/* Create random number generator. */
		Lcg48RNG rng;
		try {
			rng = this.createRNG();
		} catch (SeedException se) {
			err.println(errMessage(se));
			return Errors.OTHER.getValue();
		}

		if (this.raw) {
			return writeRaw(rng, out, err);
		}

		for (long i = 0; i < this.count; i++) {
			out.println(this.drawType.draw(rng, this.bound, this.bits));
		}
		out.flush();
		return Errors.NONE.getValue();
	}

	/**
	 * Create the random number generator for the selected worker.
	 * 
	 * @return A random number generator.
	 * @throws SeedException If the per-worker seed can't be derived.
	 */
	private Lcg48RNG createRNG() throws SeedException {
		return new WorkerSeedGenerator(this.seed, this.workerId).createRNG();
	}

	/**
	 * Write {@link #count} blocks of four random bytes, or blocks until the
	 * output fails if {@link #count} is zero. Bytes are drawn and written
	 * {@link #RAW_BUFFER_SIZE} at a time; since that is a multiple of four,
	 * the stream is the same as with one {@code nextBytes} call per block.
	 * 
	 * @param rng Generator to draw from.
	 * @param out Where to write.
	 * @param err Where to report errors.
	 * @return Program exit code.
	 */
	private int writeRaw(Lcg48RNG rng, PrintStream out, PrintStream err) {
		byte[] buffer = new byte[RAW_BUFFER_SIZE];
		long remaining = this.count * 4;
		while (this.count == 0 || remaining > 0) {
			int length = this.count == 0 
					? buffer.length 
					: (int) Math.min(remaining, buffer.length);
			byte[] bytes = length == buffer.length ? buffer : new byte[length];
			rng.nextBytes(bytes);
			out.write(bytes, 0, length);
			remaining -= length;
			if (out.checkError()) {
				/* Closing the pipe is how an unlimited stream ends. */
				if (this.count == 0) {
					return Errors.NONE.getValue();
				}
				err.println("Unable to write random bytes to output.");
				return Errors.OTHER.getValue();
			}
		}
		out.flush();
		return Errors.NONE.getValue();
	}

	/* Print usage to the given stream. */
	private static void usage(JCommander parser, PrintStream stream) {
		StringBuilder sb = new StringBuilder();
		parser.getUsageFormatter().usage(sb);
		stream.print(sb);
		stream.flush();
	}

	/**
	 * Show error message or stack trace, depending on debug parameter.
	 * 
	 * @param t Exception which caused the error.
	 * @return The error message.
	 */
	private String errMessage(Throwable t) {
		
		String errMessage;
		
		if (this.debug) {
			StringWriter sw = new StringWriter();
			t.printStackTrace(new PrintWriter(sw));
			errMessage = sw.toString();
		} else {
			errMessage = t.getMessage();
		}
		
		return errMessage;
	}

}
