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
 * how to reduce a cutout to a spectrum.  there are exactly two kinds: {@link #OPTIMAL}
 * extraction, and a {@link LeastSquares} fit in one of the {@link FitMode}s.  each one carries
 * out its own contract, so the caller just picks one and calls {@link #extract}.
 */
public abstract class ExtractionMode {

	public static final ExtractionMode OPTIMAL = new Optimal();

	private ExtractionMode() {}

	public static ExtractionMode leastSquares(FitMode mode) {
		return new LeastSquares(mode);
	}

	/**
	 * @param name one of "optimal", "lstsq", "ext", or "apphot"
	 * @throws ConfigurationException if it's none of those
	 */
	public static ExtractionMode parse(String name) {
		if (name.trim().equalsIgnoreCase("optimal"))
			return OPTIMAL;
		for (FitMode mode: FitMode.values())
			if (mode.label.equalsIgnoreCase(name.trim()))
				return leastSquares(mode);
		throw new ConfigurationException("the requested extraction mode '" + name + "' is not one of optimal, lstsq, ext, or apphot");
	}

	/**
	 * extract one lenslet's spectrum
	 * @param cutout the lenslet's cutout
	 * @param profile the shape of its PSF-lets
	 * @param variance the variance map of the whole image, or null for unit variance
	 * @param mask the good-pixel mask of the cutout
	 */
	public abstract SpectrumResult extract(Cutout cutout, ProfileModel profile, DetectorImage variance, PixelMask mask);

	public static final class Optimal extends ExtractionMode {
		private Optimal() {}

		@Override
		public SpectrumResult extract(Cutout cutout, ProfileModel profile, DetectorImage variance, PixelMask mask) {
			return OptimalExtractor.optimalExtract(cutout, profile, variance, mask);
		}

		@Override
		public String toString() {
			return "optimal";
		}
	}

	public static final class LeastSquares extends ExtractionMode {
		public final FitMode mode;

		private LeastSquares(FitMode mode) {
			if (mode == null)
				throw new IllegalArgumentException("a least-squares extraction needs a fit mode");
			this.mode = mode;
		}

		@Override
		public SpectrumResult extract(Cutout cutout, ProfileModel profile, DetectorImage variance, PixelMask mask) {
			return CutoutExtractor.fitCutout(cutout, profile, variance, mask, mode);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof LeastSquares && ((LeastSquares) o).mode == this.mode;
		}

		@Override
		public int hashCode() {
			return mode.hashCode();
		}

		@Override
		public String toString() {
			return mode.label;
		}
	}
}
