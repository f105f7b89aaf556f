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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.beust.jcommander.ParameterException;

public class ConvertersTest {

	private final SeedConverter seeds = new SeedConverter("-r");

	private final DrawTypeConverter drawTypes = new DrawTypeConverter();

	@Test
	public void decimalAndHexSeeds() {
		Assertions.assertEquals(42L, seeds.convert("42"));
		Assertions.assertEquals(42L, seeds.convert("0x2A"));
		Assertions.assertEquals(42L, seeds.convert("0X2a"));
		Assertions.assertEquals(-42L, seeds.convert("-0x2a"));
		Assertions.assertEquals(Long.MIN_VALUE, seeds.convert("-9223372036854775808"));
		Assertions.assertEquals(Long.MAX_VALUE, seeds.convert("9223372036854775807"));
	}

	@Test
	public void unsignedSeedsKeepTheirBits() {
		Assertions.assertEquals(-1L, seeds.convert("18446744073709551615"));
		Assertions.assertEquals(-1L, seeds.convert("0xFFFFFFFFFFFFFFFF"));
		Assertions.assertEquals(Long.MIN_VALUE, seeds.convert("9223372036854775808"));
	}

	@Test
	public void invalidSeeds() {
		Assertions.assertThrows(ParameterException.class, () -> seeds.convert("18446744073709551616"));
		Assertions.assertThrows(ParameterException.class, () -> seeds.convert("-9223372036854775809"));
		Assertions.assertThrows(ParameterException.class, () -> seeds.convert("forty-two"));
		Assertions.assertThrows(ParameterException.class, () -> seeds.convert("0x"));
		Assertions.assertThrows(ParameterException.class, () -> seeds.convert("--5"));
		Assertions.assertThrows(ParameterException.class, () -> seeds.convert(""));
	}

	@Test
	public void drawTypesIgnoreCase() {
		Assertions.assertEquals(DrawType.GAUSSIAN, drawTypes.convert("gaussian"));
		Assertions.assertEquals(DrawType.BYTES, drawTypes.convert("Bytes"));
		Assertions.assertEquals(DrawType.UINT, drawTypes.convert("UINT"));
		Assertions.assertThrows(ParameterException.class, () -> drawTypes.convert("short"));
	}
}
