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

import java.math.BigInteger;

import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.BaseConverter;

/**
 * This class provides a String to 64-bit seed converter for JCommander. 
 * Seeds are given in decimal or, with a {@code 0x} prefix, in hex, and may
 * be signed or unsigned 64-bit values, i.e. in [-2^63, 2^64). Unsigned 
 * values above {@link Long#MAX_VALUE} keep their 64 bits.
 * 
 * @author Nuno Fachada
 */
public class SeedConverter extends BaseConverter<Long> {

	/* Smallest accepted seed, -2^63. */
	private static final BigInteger MIN = BigInteger.valueOf(Long.MIN_VALUE);

	/* First seed too large to accept, 2^64. */
	private static final BigInteger LIMIT = BigInteger.ONE.shiftLeft(64);

	/**
	 * Create a new seed converter.
	 * 
	 * @param optionName Name of command-line option which accepts a seed.
	 */
	public SeedConverter(String optionName) {
		super(optionName);
	}

	/**
	 * @see com.beust.jcommander.converters.BaseConverter#convert(String)
	 */
	@Override
	public Long convert(String value) {
		BigInteger seed;
		try {
			String digits = value.trim();
			boolean negative = digits.startsWith("-");
			if (negative) {
				digits = digits.substring(1);
			}
			if (digits.startsWith("-") || digits.startsWith("+")) {
				throw new NumberFormatException("Repeated sign in " + value);
			}
			if (digits.startsWith("0x") || digits.startsWith("0X")) {
				seed = new BigInteger(digits.substring(2), 16);
			} else {
				seed = new BigInteger(digits);
			}
			if (negative) {
				seed = seed.negate();
			}
		} catch (NumberFormatException nfe) {
			throw new ParameterException(this.getErrorString(value, "a 64-bit seed"));
		}

		if (seed.compareTo(MIN) < 0 || seed.compareTo(LIMIT) >= 0) {
			throw new ParameterException(this.getErrorString(value, "a 64-bit seed"));
		}

		return seed.longValue();
	}

}
