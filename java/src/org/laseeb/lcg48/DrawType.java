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

import org.uncommons.maths.binary.BinaryUtils;

/**
 * Kinds of draws the {@link DumpLcg48} tool can print. Each type performs
 * one draw and formats it as a line of text.
 * 
 * @author Nuno Fachada
 */
public enum DrawType {
	
	/** @see Lcg48RNG#nextInt() */
	INT {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return Integer.toString(rng.nextInt());
		}
	},
	/** @see Lcg48RNG#nextUnsignedInt() */
	UINT {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return Long.toString(rng.nextUnsignedInt());
		}
	},
	/** @see Lcg48RNG#nextLong() */
	LONG {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return Long.toString(rng.nextLong());
		}
	},
	/** @see Lcg48RNG#nextBoolean() */
	BOOLEAN {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return Boolean.toString(rng.nextBoolean());
		}
	},
	/** @see Lcg48RNG#nextInt(int) */
	BOUNDED {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return Integer.toString(rng.nextInt(bound));
		}
	},
	/** @see Lcg48RNG#nextFloat() */
	FLOAT {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			float value = rng.nextFloat();
			return bits 
					? String.format("%08x", Float.floatToRawIntBits(value)) 
					: Float.toString(value);
		}
	},
	/** @see Lcg48RNG#nextDouble() */
	DOUBLE {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return formatDouble(rng.nextDouble(), bits);
		}
	},
	/** @see Lcg48RNG#nextGaussian() */
	GAUSSIAN {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			return formatDouble(rng.nextGaussian(), bits);
		}
	},
	/** Four bytes from {@link Lcg48RNG#nextBytes(byte[])}, as hex. */
	BYTES {
		@Override
		public String draw(Lcg48RNG rng, int bound, boolean bits) {
			byte[] bytes = new byte[4];
			rng.nextBytes(bytes);
			return BinaryUtils.convertBytesToHexString(bytes);
		}
	};
	
	/**
	 * Perform one draw of this type and format it.
	 * 
	 * @param rng Generator to draw from.
	 * @param bound Upper bound, only used by {@link #BOUNDED}.
	 * @param bits Print floating point values as their IEEE-754 bit 
	 * patterns in hex instead of decimal.
	 * @return The formatted draw.
	 */
	public abstract String draw(Lcg48RNG rng, int bound, boolean bits);

	/* Decimal or raw bits of a double. */
	private static String formatDouble(double value, boolean bits) {
		return bits 
				? String.format("%016x", Double.doubleToRawLongBits(value)) 
				: Double.toString(value);
	}

}
