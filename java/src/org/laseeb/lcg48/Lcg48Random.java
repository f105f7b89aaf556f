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

import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

import org.uncommons.maths.random.DefaultSeedGenerator;
import org.uncommons.maths.random.RepeatableRNG;
import org.uncommons.maths.random.SeedException;
import org.uncommons.maths.random.SeedGenerator;

/**
 * A {@link java.util.Random} backed by a {@link Lcg48RNG}, for code that
 * expects a {@code Random}. All draws are delegated to the wrapped generator
 * under a lock, so instances may be shared between threads.
 *
 * @author Nuno Fachada
 */
public class Lcg48Random extends Random implements RepeatableRNG {

	/* Generated serial version UID. */
	private static final long serialVersionUID = -2270463615436802968L;

	/* The wrapped generator. Must not have an initializer. */
	private Lcg48RNG rng;

	/* Lock to prevent concurrent modification of the RNG's internal state. */
	private final ReentrantLock lock = new ReentrantLock();

	/**
	 * Creates a new RNG and seeds it using the default seeding strategy.
	 */
	public Lcg48Random() {
		this(DefaultSeedGenerator.getInstance().generateSeed(Lcg48RNG.SEED_SIZE_BYTES));
	}

	/**
	 * Seed the RNG using the provided seed generation strategy.
	 * 
	 * @param seedGenerator The seed generation strategy that will provide
	 * the seed value for this RNG.
	 * @throws SeedException If there is a problem generating a seed.
	 */
	public Lcg48Random(SeedGenerator seedGenerator) throws SeedException {
		this(seedGenerator.generateSeed(Lcg48RNG.SEED_SIZE_BYTES));
	}

	/**
	 * Creates an RNG and seeds it with the specified seed data.
	 * 
	 * @param seed The seed data used to initialize the RNG.
	 */
	public Lcg48Random(byte[] seed) {
		this(new Lcg48RNG(seed));
	}

	/**
	 * Creates an RNG with the given seed, producing the same sequence as
	 * {@code new java.util.Random(seed)}.
	 * 
	 * @param seed The seed.
	 */
	public Lcg48Random(long seed) {
		this(new Lcg48RNG(seed));
	}

	/**
	 * Wraps an existing generator. Draws made through this object advance
	 * {@code rng}.
	 * 
	 * @param rng The generator to wrap.
	 */
	public Lcg48Random(Lcg48RNG rng) {
		super(0L);
		if (rng == null) {
			throw new IllegalArgumentException("Wrapped generator cannot be null.");
		}
		this.rng = rng;
	}

	/**
	 * Returns the wrapped generator.
	 * 
	 * @return The wrapped generator.
	 */
	public Lcg48RNG getGenerator() {
		return rng;
	}

	/**
	 * @see org.uncommons.maths.random.RepeatableRNG#getSeed()
	 */
	@Override
	public byte[] getSeed() {
		try {
			lock.lock();
			return rng.getSeed();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#setSeed(long)
	 */
	@Override
	public void setSeed(long seed) {
		/* Called by the superclass constructor, before the generator and
		 * the lock exist. The generator is set by our own constructor. */
		if (this.rng == null) {
			return;
		}
		try {
			lock.lock();
			rng.setSeed(seed);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#next(int)
	 */
	@Override
	protected int next(int bits) {
		try {
			lock.lock();
			return (int) rng.next(bits);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextInt()
	 */
	@Override
	public int nextInt() {
		try {
			lock.lock();
			return rng.nextInt();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextInt(int)
	 */
	@Override
	public int nextInt(int bound) {
		try {
			lock.lock();
			return rng.nextInt(bound);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextLong()
	 */
	@Override
	public long nextLong() {
		try {
			lock.lock();
			return rng.nextLong();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextBoolean()
	 */
	@Override
	public boolean nextBoolean() {
		try {
			lock.lock();
			return rng.nextBoolean();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextFloat()
	 */
	@Override
	public float nextFloat() {
		try {
			lock.lock();
			return rng.nextFloat();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextDouble()
	 */
	@Override
	public double nextDouble() {
		try {
			lock.lock();
			return rng.nextDouble();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextGaussian()
	 */
	@Override
	public double nextGaussian() {
		try {
			lock.lock();
			return rng.nextGaussian();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @see java.util.Random#nextBytes(byte[])
	 */
	@Override
	public void nextBytes(byte[] bytes) {
		try {
			lock.lock();
			rng.nextBytes(bytes);
		} finally {
			lock.unlock();
		}
	}
}
