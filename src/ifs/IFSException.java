/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
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
package ifs;

/**
 * the root of every error this package raises on purpose.  it remembers which lenslet,
 * which wavelength and which patch of detector it was working on when things went wrong,
 * so that the failure can be reproduced.  any of those may be unknown.
 */
public class IFSException extends RuntimeException {
	/** the lenslet id, or -1 if this isn't about a particular lenslet */
	private final int lenslet;
	/** the wavelength in nm, or NaN if this isn't about a particular wavelength */
	private final double wavelength;
	/** the bounding box involved, or null */
	private final Box bounds;

	public IFSException(String message) {
		this(message, -1, Double.NaN, null);
	}

	public IFSException(String message, int lenslet, double wavelength, Box bounds) {
		super(describe(message, lenslet, wavelength, bounds));
		this.lenslet = lenslet;
		this.wavelength = wavelength;
		this.bounds = bounds;
	}

	public IFSException(String message, Throwable cause) {
		super(message, cause);
		this.lenslet = -1;
		this.wavelength = Double.NaN;
		this.bounds = null;
	}

	public int getLenslet() {
		return lenslet;
	}

	public double getWavelength() {
		return wavelength;
	}

	public Box getBounds() {
		return bounds;
	}

	private static String describe(String message, int lenslet, double wavelength, Box bounds) {
		StringBuilder s = new StringBuilder(message);
		if (lenslet >= 0)
			s.append(" (lenslet ").append(lenslet).append(")");
		if (!Double.isNaN(wavelength))
			s.append(String.format(" (λ = %.3f nm)", wavelength));
		if (bounds != null)
			s.append(" (bounds ").append(bounds).append(")");
		return s.toString();
	}
}
