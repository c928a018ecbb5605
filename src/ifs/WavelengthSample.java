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
 * one spectral channel: its central wavelength and half its width, both in nm.
 */
public final class WavelengthSample {
	public final double wavelength;
	public final double halfWidth;

	public WavelengthSample(double wavelength, double halfWidth) {
		this.wavelength = wavelength;
		this.halfWidth = halfWidth;
	}

	public double blueEdge() {
		return wavelength - halfWidth;
	}

	public double redEdge() {
		return wavelength + halfWidth;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof WavelengthSample))
			return false;
		WavelengthSample that = (WavelengthSample) o;
		return Double.compare(this.wavelength, that.wavelength) == 0 &&
		       Double.compare(this.halfWidth, that.halfWidth) == 0;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(wavelength)*31 + Double.hashCode(halfWidth);
	}

	@Override
	public String toString() {
		return String.format("%.3f±%.3f nm", wavelength, halfWidth);
	}
}
