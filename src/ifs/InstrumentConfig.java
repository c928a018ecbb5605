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

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Properties;

/**
 * the fixed parameters of the spectrograph and of the reduction.  the defaults describe the
 * WFIRST/CGI IFS.  everything is validated up front, so a bad value fails before any lenslet
 * is touched.
 */
public final class InstrumentConfig {
	/** the most lenslets allowed along each side of the array */
	public static final int MAX_LENSLETS = 10_000;

	/** spectral resolving power λ/Δλ */
	public final double resolvingPower;
	/** number of wavelength channels, or 0 to pick it from the resolving power */
	public final int numChannels;
	/** short-wavelength end of the bandpass (nm) */
	public final double blue;
	/** long-wavelength end of the bandpass (nm) */
	public final double red;
	/** number of lenslets along each side of the (square) lenslet array */
	public final int numLenslets;
	/** distance between adjacent lenslet centres (μm) */
	public final double lensletPitch;
	/** detector pixel size (μm) */
	public final double pixelSize;
	public final int detectorRows;
	public final int detectorCols;
	/** degree of the polynomial in wavelength used to interpolate the calibration */
	public final int interpolationOrder;
	/** half the extent of a PSF-let footprint across the dispersion direction (pixels) */
	public final double psfletHalfWidth;
	/** half the extent of a PSF-let footprint along the dispersion direction (pixels) */
	public final double psfletHalfHeight;
	/** how far to grow each cutout beyond the footprints, to catch the PSF wings (pixels) */
	public final int cutoutMargin;
	/** Gaussian width of the PSF-let profile across the dispersion direction (pixels) */
	public final double profileSigmaX;
	/** Gaussian width of the PSF-let profile along the dispersion direction (pixels) */
	public final double profileSigmaY;

	public InstrumentConfig(double resolvingPower, int numChannels, double blue, double red,
	                        int numLenslets, double lensletPitch, double pixelSize,
	                        int detectorRows, int detectorCols, int interpolationOrder,
	                        double psfletHalfWidth, double psfletHalfHeight, int cutoutMargin,
	                        double profileSigmaX, double profileSigmaY) {
		require(resolvingPower > 0 && Double.isFinite(resolvingPower), "resolving.power", resolvingPower);
		require(numChannels >= 0 && numChannels <= WavelengthGrid.MAX_CHANNELS, "channels", numChannels);
		require(blue > 0 && Double.isFinite(blue), "bandpass.blue", blue);
		require(red > blue && Double.isFinite(red), "bandpass.red", red);
		require(numLenslets > 0 && numLenslets <= MAX_LENSLETS, "lenslet.count", numLenslets);
		require(lensletPitch > 0 && Double.isFinite(lensletPitch), "lenslet.pitch", lensletPitch);
		require(pixelSize > 0 && Double.isFinite(pixelSize), "pixel.size", pixelSize);
		require(detectorRows > 0, "detector.rows", detectorRows);
		require(detectorCols > 0, "detector.cols", detectorCols);
		require(interpolationOrder >= 0, "interpolation.order", interpolationOrder);
		require(psfletHalfWidth >= 0 && Double.isFinite(psfletHalfWidth), "psflet.halfwidth", psfletHalfWidth);
		require(psfletHalfHeight >= 0 && Double.isFinite(psfletHalfHeight), "psflet.halfheight", psfletHalfHeight);
		require(cutoutMargin >= 0, "cutout.margin", cutoutMargin);
		require(profileSigmaX > 0 && Double.isFinite(profileSigmaX), "profile.sigma.x", profileSigmaX);
		require(profileSigmaY > 0 && Double.isFinite(profileSigmaY), "profile.sigma.y", profileSigmaY);
		this.resolvingPower = resolvingPower;
		this.numChannels = numChannels;
		this.blue = blue;
		this.red = red;
		this.numLenslets = numLenslets;
		this.lensletPitch = lensletPitch;
		this.pixelSize = pixelSize;
		this.detectorRows = detectorRows;
		this.detectorCols = detectorCols;
		this.interpolationOrder = interpolationOrder;
		this.psfletHalfWidth = psfletHalfWidth;
		this.psfletHalfHeight = psfletHalfHeight;
		this.cutoutMargin = cutoutMargin;
		this.profileSigmaX = profileSigmaX;
		this.profileSigmaY = profileSigmaY;
	}

	/**
	 * the configuration you get from an empty properties file
	 */
	public static InstrumentConfig defaults() {
		return fromProperties(new Properties());
	}

	/**
	 * read the configuration out of a properties file.
	 * @throws IOException if the file can't be read
	 * @throws ConfigurationException if any of the values are missing or bad
	 */
	public static InstrumentConfig load(File file) throws IOException {
		Properties properties = new Properties();
		try (Reader in = new FileReader(file)) {
			properties.load(in);
		}
		return fromProperties(properties);
	}

	/**
	 * pull the configuration out of a set of properties, using the WFIRST values for anything
	 * that isn't specified.
	 * @throws ConfigurationException if any of the values are unparseable or out of range
	 */
	public static InstrumentConfig fromProperties(Properties properties) {
		return new InstrumentConfig(
				getDouble(properties, "resolving.power", 50),
				getInt(properties, "channels", 0),
				getDouble(properties, "bandpass.blue", 600),
				getDouble(properties, "bandpass.red", 720),
				getInt(properties, "lenslet.count", 108),
				getDouble(properties, "lenslet.pitch", 174),
				getDouble(properties, "pixel.size", 13),
				getInt(properties, "detector.rows", 1024),
				getInt(properties, "detector.cols", 1024),
				getInt(properties, "interpolation.order", 3),
				getDouble(properties, "psflet.halfwidth", 1.5),
				getDouble(properties, "psflet.halfheight", 1.5),
				getInt(properties, "cutout.margin", 2),
				getDouble(properties, "profile.sigma.x", 0.7),
				getDouble(properties, "profile.sigma.y", 0.7));
	}

	/**
	 * the wavelength channels this configuration calls for
	 */
	public WavelengthGrid wavelengthGrid() {
		int n = (numChannels > 0) ?
		        numChannels :
		        WavelengthGrid.naturalChannelCount(resolvingPower, blue, red);
		return WavelengthGrid.build(resolvingPower, n, blue, red);
	}

	/**
	 * the Gaussian PSF-let profile this configuration describes
	 */
	public GaussianProfile profile() {
		return new GaussianProfile(profileSigmaX, profileSigmaY);
	}

	static double getDouble(Properties properties, String key, double fallback) {
		String value = properties.getProperty(key);
		if (value == null || value.isBlank())
			return fallback;
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("`" + key + "` should be a number, not '" + value + "'", e);
		}
	}

	static int getInt(Properties properties, String key, int fallback) {
		String value = properties.getProperty(key);
		if (value == null || value.isBlank())
			return fallback;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("`" + key + "` should be an integer, not '" + value + "'", e);
		}
	}

	private static void require(boolean condition, String key, double value) {
		if (!condition)
			throw new ConfigurationException("`" + key + "` can't be " + value);
	}

	@Override
	public String toString() {
		return String.format("R=%.1f, %s channels on [%.1f, %.1f] nm, %d×%d lenslets at %.1f μm, " +
		                     "%d×%d pixels at %.1f μm, interpolation order %d",
		                     resolvingPower, (numChannels > 0) ? numChannels : "natural", blue, red,
		                     numLenslets, numLenslets, lensletPitch,
		                     detectorRows, detectorCols, pixelSize, interpolationOrder);
	}
}
