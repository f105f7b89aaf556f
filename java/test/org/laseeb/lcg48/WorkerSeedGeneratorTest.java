/*
 * Copyright (c) 2014, 2015, Nuno Fachada
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 * 
 * 1. Redistributions of source code must retain the above copyright notice, 
 *    this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 *    this list of conditions and the following disclaimer in the documentation
 *    and/or other materials provided with the distribution.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" 
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE 
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE 
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT OWNER OR CONTRIBUTORS BE 
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR 
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF 
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS 
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN 
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) 
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE 
 * POSSIBILITY OF SUCH DAMAGE.
 */

package org.laseeb.lcg48;

import java.util.Random;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.uncommons.maths.random.SeedException;

public class WorkerSeedGeneratorTest {

	@Test
	public void workerZeroKeepsTheBaseSeed() throws SeedException {
		WorkerSeedGenerator seedGen = new WorkerSeedGenerator(42L, 0);
		Assertions.assertEquals(42L, seedGen.getWorkerSeed());
		Assertions.assertArrayEquals(new byte[] {0, 0, 0, 0, 0, 0, 0, 42}, seedGen.generateSeed(8));

		Lcg48RNG rng = seedGen.createRNG();
		Random reference = new Random(42L);
		for (int i = 0; i < 10; i++) {
			Assertions.assertEquals(reference.nextInt(), rng.nextInt());
		}
	}

	@Test
	public void derivedSeeds() throws SeedException {
		Assertions.assertEquals(-1773699978215331409L, new WorkerSeedGenerator(42L, 1).getWorkerSeed());
		Assertions.assertEquals(3060499553634416279L, new WorkerSeedGenerator(42L, 2).getWorkerSeed());
		Assertions.assertEquals(3757075087710752605L, new WorkerSeedGenerator(0L, 1).getWorkerSeed());
	}

	@Test
	public void deterministic() throws SeedException {
		for (int wId = -2; wId < 4; wId++) {
			byte[] a = new WorkerSeedGenerator(123456789L, wId).generateSeed(8);
			byte[] b = new WorkerSeedGenerator(123456789L, wId).generateSeed(8);
			Assertions.assertArrayEquals(a, b);
		}
	}

	@Test
	public void workersGetDifferentStreams() throws SeedException {
		Lcg48RNG rng0 = new WorkerSeedGenerator(42L, 0).createRNG();
		Lcg48RNG rng1 = new WorkerSeedGenerator(42L, 1).createRNG();
		Lcg48RNG rng2 = new WorkerSeedGenerator(42L, 2).createRNG();
		long first0 = rng0.nextLong();
		long first1 = rng1.nextLong();
		long first2 = rng2.nextLong();
		Assertions.assertNotEquals(first0, first1);
		Assertions.assertNotEquals(first1, first2);
		Assertions.assertNotEquals(first0, first2);
	}

	@Test
	public void seedBytesMatchWorkerSeed() throws SeedException {
		WorkerSeedGenerator seedGen = new WorkerSeedGenerator(7L, 9);
		Lcg48RNG fromBytes = new Lcg48RNG(seedGen.generateSeed(Lcg48RNG.SEED_SIZE_BYTES));
		Lcg48RNG fromLong = new Lcg48RNG(seedGen.getWorkerSeed());
		Assertions.assertEquals(fromLong.nextLong(), fromBytes.nextLong());
	}

	@Test
	public void onlyLcg48SeedLength() {
		WorkerSeedGenerator seedGen = new WorkerSeedGenerator(42L, 1);
		Assertions.assertThrows(SeedException.class, () -> seedGen.generateSeed(4));
		Assertions.assertThrows(SeedException.class, () -> seedGen.generateSeed(16));
	}
}
