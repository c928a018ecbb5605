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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * the ordered, immutable set of spectral channels onto which every lenslet's spectrum gets
 * extracted.  it's built once per run.
 */
public final class WavelengthGrid {
	/** the most channels a grid can have */
	public static final int MAX_CHANNELS = 1_000_000;

	/** the N+1 channel edges (nm) */
	private final double[] edges;
	/** the N channels */
	private final List<WavelengthSample> samples;

	private WavelengthGrid(double[] edges) {
		this.edges = edges;
		List<WavelengthSample> samples = new ArrayList<>(edges.length - 1);
		for (int i = 0; i < edges.length - 1; i ++)
			samples.add(new WavelengthSample((edges[i] + edges[i+1])/2,
			                                 (edges[i+1] - edges[i])/2));
		this.samples = Collections.unmodifiableList(samples);
	}

	/**
	 * lay out channels at constant resolving power, so that each edge is (1 + 1/R) times the
	 * one before it, starting at the blue end of the bandpass.  the accumulated edges won't land
	 * exactly on the red end, so the whole grid is then stretched linearly about the blue edge
	 * until the last edge is exactly the red limit.
	 * @param resolvingPower R, the wavelength over the channel width
	 * @param numChannels N, the number of channels
	 * @param blue the short-wavelength limit of the bandpass (nm)
	 * @param red the long-wavelength limit of the bandpass (nm)
	 * @return the grid
	 * @throws ConfigurationException if any of the parameters are out of range or the edges
	 *                                come out non-monotonic
	 */
	public static WavelengthGrid build(double resolvingPower, int numChannels, double blue, double red) {
		if (numChannels <= 0 || numChannels > MAX_CHANNELS)
			throw new ConfigurationException(String.format(
					"the number of channels must be between 1 and %d, not %d", MAX_CHANNELS, numChannels));
		if (!(resolvingPower > 0) || Double.isInfinite(resolvingPower))
			throw new ConfigurationException("the resolving power must be positive and finite, not " + resolvingPower);
		if (!(blue > 0) || !(red > blue) || Double.isInfinite(red))
			throw new ConfigurationException(String.format("[%s, %s] nm is not a valid bandpass", blue, red));

		double step = 1 + 1/resolvingPower;
		double[] edges = new double[numChannels + 1];
		edges[0] = blue;
		for (int i = 1; i <= numChannels; i ++)
			edges[i] = edges[i-1]*step;

		double stretch = (red - blue)/(edges[numChannels] - blue);
		for (int i = 1; i < numChannels; i ++)
			edges[i] = blue + (edges[i] - blue)*stretch;
		edges[numChannels] = red;

		for (int i = 1; i <= numChannels; i ++)
			if (!(edges[i] > edges[i-1]))
				throw new ConfigurationException(String.format(
						"the channel edges are not monotonic at index %d (%s ≤ %s); is R = %s too large?",
						i, edges[i], edges[i-1], resolvingPower));

		return new WavelengthGrid(edges);
	}

	/**
	 * the number of channels that fit into the bandpass at this resolving power without much
	 * stretching.  it's what you get when nobody asks for a particular number.
	 */
	public static int naturalChannelCount(double resolvingPower, double blue, double red) {
		if (!(resolvingPower > 0))
			throw new ConfigurationException("the resolving power must be positive, not " + resolvingPower);
		if (!(blue > 0) || !(red > blue))
			throw new ConfigurationException(String.format("[%s, %s] nm is not a valid bandpass", blue, red));
		double n = Math.rint(Math.log(red/blue)/Math.log1p(1/resolvingPower));
		if (!(n <= MAX_CHANNELS))
			throw new ConfigurationException(String.format(
					"R = %s would put %.0f channels in [%s, %s] nm; the most allowed is %d",
					resolvingPower, n, blue, red, MAX_CHANNELS));
		return (int) Math.max(1, n);
	}

	public int size() {
		return samples.size();
	}

	public WavelengthSample get(int k) {
		return samples.get(k);
	}

	public List<WavelengthSample> getSamples() {
		return samples;
	}

	public double[] getEdges() {
		return edges.clone();
	}

	public double[] getMidpoints() {
		double[] midpoints = new double[samples.size()];
		for (int k = 0; k < midpoints.length; k ++)
			midpoints[k] = samples.get(k).wavelength;
		return midpoints;
	}

	public double getBlue() {
		return edges[0];
	}

	public double getRed() {
		return edges[edges.length - 1];
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof WavelengthGrid && Arrays.equals(this.edges, ((WavelengthGrid) o).edges);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(edges);
	}

	@Override
	public String toString() {
		return String.format("%d channels on [%.2f, %.2f] nm", size(), getBlue(), getRed());
	}
}
