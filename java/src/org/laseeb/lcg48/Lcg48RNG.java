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

import java.io.Serializable;
import java.nio.ByteBuffer;

import org.uncommons.maths.random.DefaultSeedGenerator;
import org.uncommons.maths.random.RepeatableRNG;
import org.uncommons.maths.random.SeedException;
import org.uncommons.maths.random.SeedGenerator;

/**
 * The 48-bit linear congruential generator of {@link java.util.Random},
 * reimplemented so that every derived value (bits, integers, bounded 
 * integers, booleans, floats, Gaussian deviates and byte streams) is
 * bit-identical to the one produced by {@link java.util.Random} for the same
 * seed and call sequence.
 * 
 * Instances are not thread-safe. Use one instance per thread (see 
 * {@link WorkerSeedGenerator}) or the lock-guarded {@link Lcg48Random}.
 *
 * @author Nuno Fachada
 */
public final class Lcg48RNG implements RepeatableRNG, Serializable {

	/* Generated serial version UID. */
	private static final long serialVersionUID = 3317645871902743415L;

	/** Seed size in bytes. */
	public static final int SEED_SIZE_BYTES = 8;

	/** LCG multiplier, also used to scramble the seed. */
	public static final long MULTIPLIER = 0x5DEECE66DL;

	/** LCG increment. */
	public static final long ADDEND = 0xBL;

	/** Mask keeping the low 48 bits of the state. */
	public static final long MASK = (1L << 48) - 1;

	/* Float divisor, 2^24. */
	private static final float FLOAT_UNIT = (float) (1 << 24);

	/* Double divisor, 2^53. */
	private static final double DOUBLE_UNIT = (double) (1L << 53);

	/* RNG seed. */
	private byte[] seed;

	/* The RNG state, only the low 48 bits are used. */
	private long state;

	/* Second value of the last Gaussian pair, if not yet consumed. */
	private double pendingGaussian;

	/* Is there a pending Gaussian value? */
	private boolean hasPendingGaussian;

	/**
	 * Creates a new LCG48 RNG and seeds it using the default seeding strategy.
	 */
	public Lcg48RNG() {
		this(DefaultSeedGenerator.getInstance().generateSeed(SEED_SIZE_BYTES));
	}

	/**
	 * Seed the LCG48 RNG using the provided seed generation strategy.
	 * 
	 * @param seedGenerator The seed generation strategy that will provide
	 * the seed value for this RNG.
	 * @throws SeedException If there is a problem generating a seed.
	 */
	public Lcg48RNG(SeedGenerator seedGenerator) throws SeedException {
		this(seedGenerator.generateSeed(SEED_SIZE_BYTES));
	}

	/**
	 * Creates an RNG and seeds it with the specified seed data.
	 * 
	 * @param seed The seed data used to initialize the RNG, a big-endian
	 * 64-bit value.
	 */
	public Lcg48RNG(byte[] seed) {
		if (seed == null || seed.length != SEED_SIZE_BYTES) {
			throw new IllegalArgumentException("LCG48 RNG requires 64 bits of seed data.");
		}
		this.setSeed(ByteBuffer.wrap(seed).getLong());
	}

	/**
	 * Creates an RNG with the given seed. Equivalent to 
	 * {@code new java.util.Random(seed)}.
	 * 
	 * @param seed The seed.
	 */
	public Lcg48RNG(long seed) {
		this.setSeed(seed);
	}

	/**
	 * Creates a copy of another RNG. Both instances produce the same
	 * sequence from this point onwards, independently of each other.
	 * 
	 * @param other The RNG to copy.
	 */
	public Lcg48RNG(Lcg48RNG other) {
		this.seed = other.seed.clone();
		this.state = other.state;
		this.pendingGaussian = other.pendingGaussian;
		this.hasPendingGaussian = other.hasPendingGaussian;
	}

	/**
	 * Returns an independent copy of this RNG.
	 * 
	 * @return A copy of this RNG.
	 * @see #Lcg48RNG(Lcg48RNG)
	 */
	public Lcg48RNG copy() {
		return new Lcg48RNG(this);
	}

	/**
	 * Reseeds this RNG. The result is indistinguishable from a new RNG
	 * created with the same seed; a pending Gaussian value is discarded.
	 * 
	 * @param seed The new seed.
	 */
	public void setSeed(long seed) {
		this.seed = ByteBuffer.allocate(SEED_SIZE_BYTES).putLong(seed).array();
		this.state = (seed ^ MULTIPLIER) & MASK;
		this.hasPendingGaussian = false;
		this.pendingGaussian = 0.0;
	}

	/**
	 * @see org.uncommons.maths.random.RepeatableRNG#getSeed()
	 */
	@Override
	public byte[] getSeed() {
		return seed.clone();
	}

	/**
	 * Current 48-bit state, after scrambling and all draws so far.
	 * 
	 * @return The current state.
	 */
	public long getState() {
		return state;
	}

	/**
	 * Is the second value of a Gaussian pair waiting to be returned by
	 * {@link #nextGaussian()}?
	 * 
	 * @return True if the next Gaussian draw will not advance the state.
	 */
	public boolean hasPendingGaussian() {
		return hasPendingGaussian;
	}

	/**
	 * Advances the state and returns its top {@code bits} bits.
	 * 
	 * @param bits Number of bits to return, between 1 and 48.
	 * @return A non-negative value lower than 2^bits.
	 * @throws IllegalArgumentException If {@code bits} is outside [1, 48].
	 */
	public long next(int bits) {
		if (bits < 1 || bits > 48) {
			throw new IllegalArgumentException("Number of bits must be between 1 and 48, got " + bits + ".");
		}
		this.state = (this.state * MULTIPLIER + ADDEND) & MASK;
		return this.state >>> (48 - bits);
	}

	/**
	 * @return A uniformly distributed int.
	 * @see java.util.Random#nextInt()
	 */
	public int nextInt() {
		return (int) next(32);
	}

	/**
	 * Same draw as {@link #nextInt()}, read as an unsigned 32-bit value.
	 * 
	 * @return A value in [0, 2^32).
	 */
	public long nextUnsignedInt() {
		return next(32);
	}

	/**
	 * Returns a value uniformly distributed in [0, bound). Powers of two
	 * scale a single 31-bit draw; other bounds reject draws from the biased
	 * tail of {@code bits % bound} and draw again.
	 * 
	 * @param bound Upper bound (exclusive), must be positive.
	 * @return A value in [0, bound).
	 * @throws IllegalArgumentException If {@code bound} is not positive.
	 * @see java.util.Random#nextInt(int)
	 */
	public int nextInt(int bound) {
		if (bound <= 0) {
			throw new IllegalArgumentException("Bound must be positive, got " + bound + ".");
		}

		if ((bound & -bound) == bound) {
			return (int) ((bound * next(31)) >> 31);
		}

		int bits;
		int val;
		do {
			bits = (int) next(31);
			val = bits % bound;
		} while (bits - val + (bound - 1) < 0);

		return val;
	}

	/**
	 * Unsigned variant of {@link #nextInt(int)}, taking the same draws. Only
	 * bounds in [1, 2^31) are supported.
	 * 
	 * @param bound Upper bound (exclusive).
	 * @return A value in [0, bound).
	 * @throws IllegalArgumentException If {@code bound} is outside [1, 2^31).
	 */
	public long nextUnsignedInt(long bound) {
		if (bound < 1 || bound > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("Unsigned bound must be in [1, 2^31), got " + bound + ".");
		}
		return nextInt((int) bound);
	}

	/**
	 * Two 32-bit draws, high word first. The low word is added as a signed
	 * int, exactly as {@link java.util.Random#nextLong()} does.
	 * 
	 * @return A uniformly distributed long (only 2^48 distinct values are
	 * reachable).
	 */
	public long nextLong() {
		return ((long) nextInt() << 32) + nextInt();
	}

	/**
	 * @return True or false with equal probability.
	 */
	public boolean nextBoolean() {
		return next(1) == 1;
	}

	/**
	 * Fills {@code bytes} four at a time from successive {@link #nextInt()}
	 * draws, least significant byte first. Unused bytes of the last draw are
	 * discarded.
	 * 
	 * @param bytes Array to fill.
	 */
	public void nextBytes(byte[] bytes) {
		for (int i = 0, len = bytes.length; i < len; ) {
			for (int rnd = nextInt(), n = Math.min(len - i, 4); n-- > 0; rnd >>= 8) {
				bytes[i++] = (byte) rnd;
			}
		}
	}

	/**
	 * @return A float in [0, 1), with 24 random bits.
	 */
	public float nextFloat() {
		return next(24) / FLOAT_UNIT;
	}

	/**
	 * A 26-bit draw followed by a 27-bit draw, combined into 53 bits.
	 * 
	 * @return A double in [0, 1).
	 */
	public double nextDouble() {
		return ((next(26) << 27) + next(27)) / DOUBLE_UNIT;
	}

	/**
	 * Returns a normally distributed value with mean 0 and standard deviation
	 * 1, using the polar Box-Muller method. Each accepted pair yields two
	 * values; the second one is kept and returned by the following call
	 * without advancing the state. {@link StrictMath} keeps results identical
	 * to {@link java.util.Random#nextGaussian()} on every platform.
	 * 
	 * @return A Gaussian deviate.
	 */
	public double nextGaussian() {
		if (hasPendingGaussian) {
			hasPendingGaussian = false;
			return pendingGaussian;
		}

		double x, y, s;
		do {
			x = 2 * nextDouble() - 1;
			y = 2 * nextDouble() - 1;
			s = x * x + y * y;
		} while (s >= 1 || s == 0);

		double multiplier = StrictMath.sqrt(-2 * StrictMath.log(s) / s);
		pendingGaussian = y * multiplier;
		hasPendingGaussian = true;
		return x * multiplier;
	}
}
