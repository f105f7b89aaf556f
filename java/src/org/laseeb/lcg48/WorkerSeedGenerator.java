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

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.uncommons.maths.random.SeedException;
import org.uncommons.maths.random.SeedGenerator;

/**
 * Deterministic seeds for one {@link Lcg48RNG} per worker, all derived from
 * a single base seed. Worker 0 gets the base seed itself, so its generator
 * produces the same sequence as {@code new java.util.Random(baseSeed)}. Any
 * other worker gets the first 64 bits of the SHA-256 digest of the base 
 * seed (8 bytes, big-endian) followed by the worker ID (4 bytes, 
 * big-endian).
 * 
 * @author Nuno Fachada
 */
public class WorkerSeedGenerator implements SeedGenerator {

	/* Seed shared by all workers. */
	private final long baseSeed;

	/* Worker this generator derives seeds for. */
	private final int workerId;

	/**
	 * Create a seed generator for the given worker.
	 * 
	 * @param baseSeed Seed shared by all workers.
	 * @param workerId Worker ID; 0 keeps the base seed.
	 */
	public WorkerSeedGenerator(long baseSeed, int workerId) {
		this.baseSeed = baseSeed;
		this.workerId = workerId;
	}

	/**
	 * @return The seed shared by all workers.
	 */
	public long getBaseSeed() {
		return baseSeed;
	}

	/**
	 * @return The worker ID.
	 */
	public int getWorkerId() {
		return workerId;
	}

	/**
	 * The 64-bit seed of this worker's generator.
	 * 
	 * @return The worker seed.
	 * @throws SeedException If SHA-256 is not available.
	 */
	public long getWorkerSeed() throws SeedException {
		if (workerId == 0) {
			return baseSeed;
		}

		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		} catch (NoSuchAlgorithmException e) {
			throw new SeedException(e.getMessage(), e);
		}
		digest.update(ByteBuffer.allocate(12).putLong(baseSeed).putInt(workerId).array());
		return ByteBuffer.wrap(digest.digest()).getLong();
	}

	/**
	 * Create this worker's generator.
	 * 
	 * @return A generator seeded with {@link #getWorkerSeed()}.
	 * @throws SeedException If SHA-256 is not available.
	 */
	public Lcg48RNG createRNG() throws SeedException {
		return new Lcg48RNG(getWorkerSeed());
	}

	/**
	 * Returns the worker seed as 8 big-endian bytes, the format
	 * {@link Lcg48RNG#Lcg48RNG(byte[])} reads.
	 * 
	 * @param length Must be {@link Lcg48RNG#SEED_SIZE_BYTES}.
	 * @throws SeedException If another length is requested, or SHA-256 is
	 * not available.
	 */
	@Override
	public byte[] generateSeed(int length) throws SeedException {
		if (length != Lcg48RNG.SEED_SIZE_BYTES) {
			throw new SeedException("Worker seeds are " + Lcg48RNG.SEED_SIZE_BYTES 
					+ " bytes long, " + length + " requested.");
		}
		return ByteBuffer.allocate(Lcg48RNG.SEED_SIZE_BYTES).putLong(getWorkerSeed()).array();
	}

}
