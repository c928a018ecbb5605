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
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * the footprint of every lenslet at every wavelength channel.  lenslets are numberd in
 * row-major order of their place in the lattice, so lenslet (ix, iy) has id iy·n + ix, and
 * each lenslet's footprints are kept in channel order.  the table carries a key that
 * identifies the calibration, wavelength grid and geometry it came from, so a saved copy can
 * be checked before it's reused.  read-only once built.
 */
public final class PixelSolution {
	/** the number of values stored per footprint */
	private static final int FIELDS_PER_CHANNEL = 6;
	/** the number of values stored per lenslet ahead of the footprints */
	private static final int LEADING_FIELDS = 3;

	/** the number of lenslets on each side of the lattice */
	public final int numLenslets;
	public final int detectorRows;
	public final int detectorCols;
	private final WavelengthGrid grid;
	private final String key;
	private final Footprint[][] footprints;

	PixelSolution(int numLenslets, int detectorRows, int detectorCols,
	              WavelengthGrid grid, String key, Footprint[][] footprints) {
		if (footprints.length != numLenslets*numLenslets)
			throw new IllegalArgumentException("there should be " + numLenslets*numLenslets + " lenslets, not " + footprints.length);
		for (Footprint[] row: footprints)
			if (row.length != grid.size())
				throw new IllegalArgumentException("every lenslet needs one footprint per channel");
		this.numLenslets = numLenslets;
		this.detectorRows = detectorRows;
		this.detectorCols = detectorCols;
		this.grid = grid;
		this.key = key;
		this.footprints = footprints;
	}

	/**
	 * compute the version key of the pixel solution that these inputs would produce.  it's a
	 * SHA-256 digest of the channel edges, the interpolation polynomials (which are determined
	 * by the calibration table and the interpolation order), and the geometry.
	 */
	public static String key(WavelengthGrid grid, PSFLetModel model, InstrumentConfig config) {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		} catch (NoSuchAlgorithmException e) {
			throw new RuntimeException(e);
		}
		ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES);
		for (double edge: grid.getEdges())
			digest.update(buffer.clear().putDouble(edge).array());
		InterpolationArray interpolation = model.getInterpolation();
		digest.update(buffer.clear().putDouble(interpolation.getMinWavelength()).array());
		digest.update(buffer.clear().putDouble(interpolation.getMaxWavelength()).array());
		for (double[] row: interpolation.getValues())
			for (double value: row)
				digest.update(buffer.clear().putDouble(value).array());
		for (double parameter: new double[] {
				config.numLenslets, config.lensletPitch, config.pixelSize,
				config.detectorRows, config.detectorCols,
				config.psfletHalfWidth, config.psfletHalfHeight})
			digest.update(buffer.clear().putDouble(parameter).array());

		StringBuilder hex = new StringBuilder();
		for (byte b: digest.digest())
			hex.append(String.format("%02x", b));
		return hex.toString();
	}

	public int lensletCount() {
		return footprints.length;
	}

	public int id(int ix, int iy) {
		if (ix < 0 || ix >= numLenslets || iy < 0 || iy >= numLenslets)
			throw new IndexOutOfBoundsException(String.format("(%d, %d) is not in the %d×%d lattice", ix, iy, numLenslets, numLenslets));
		return iy*numLenslets + ix;
	}

	public int ix(int lenslet) {
		return lenslet%numLenslets;
	}

	public int iy(int lenslet) {
		return lenslet/numLenslets;
	}

	public Footprint getFootprint(int lenslet, int k) {
		return footprints[lenslet][k];
	}

	public List<Footprint> getFootprints(int lenslet) {
		return List.of(footprints[lenslet]);
	}

	/**
	 * @return the smallest box containing every footprint of this lenslet, or null if all of
	 * them are null footprints
	 */
	public Box union(int lenslet) {
		Box union = null;
		for (Footprint footprint: footprints[lenslet])
			if (!footprint.isNull())
				union = (union == null) ? footprint.getBox() : union.union(footprint.getBox());
		return union;
	}

	public boolean isOffDetector(int lenslet) {
		return union(lenslet) == null;
	}

	/**
	 * @return whether this lenslet's footprint centroids move steadily in one direction along
	 * the dispersion axis as the wavelength increases (null footprints are ignored)
	 */
	public boolean isMonotonic(int lenslet) {
		double[] cy = new double[grid.size()];
		for (int k = 0; k < cy.length; k ++)
			cy[k] = footprints[lenslet][k].isNull() ? Double.NaN : footprints[lenslet][k].cy;
		return Math2.isMonotonic(cy);
	}

	public WavelengthGrid getGrid() {
		return grid;
	}

	public String getKey() {
		return key;
	}

	/**
	 * lay the whole thing out as one row per lenslet: the lenslet id, ix, and iy, followed by
	 * centroid_x, centroid_y, bbox_xmin, bbox_xmax, bbox_ymin, bbox_ymax for each channel.  the
	 * bbox bounds are inclusive, and NaN for a null footprint.
	 */
	public double[][] toTable() {
		double[][] table = new double[footprints.length][LEADING_FIELDS + FIELDS_PER_CHANNEL*grid.size()];
		for (int id = 0; id < footprints.length; id ++) {
			table[id][0] = id;
			table[id][1] = ix(id);
			table[id][2] = iy(id);
			for (int k = 0; k < grid.size(); k ++) {
				Footprint footprint = footprints[id][k];
				int j = LEADING_FIELDS + FIELDS_PER_CHANNEL*k;
				table[id][j] = footprint.cx;
				table[id][j + 1] = footprint.cy;
				if (footprint.isNull()) {
					Arrays.fill(table[id], j + 2, j + FIELDS_PER_CHANNEL, Double.NaN);
				}
				else {
					Box box = footprint.getBox();
					table[id][j + 2] = box.x0;
					table[id][j + 3] = box.x1 - 1;
					table[id][j + 4] = box.y0;
					table[id][j + 5] = box.y1 - 1;
				}
			}
		}
		return table;
	}

	/**
	 * save this table as a CSV file: a line of metadata, a line of column names, then the
	 * rows of {@link #toTable()}.
	 * @param file where to save it
	 * @throws IOException if the file can't be written
	 */
	public void savepixsol(File file) throws IOException {
		String[] metadata = {
				"key=" + key,
				"nlens=" + numLenslets,
				"rows=" + detectorRows,
				"cols=" + detectorCols,
				"nlam=" + grid.size()};
		String[] columns = new String[LEADING_FIELDS + FIELDS_PER_CHANNEL*grid.size()];
		columns[0] = "lenslet";
		columns[1] = "ix";
		columns[2] = "iy";
		String[] fields = {"centroid_x", "centroid_y", "bbox_xmin", "bbox_xmax", "bbox_ymin", "bbox_ymax"};
		for (int k = 0; k < grid.size(); k ++)
			for (int f = 0; f < FIELDS_PER_CHANNEL; f ++)
				columns[LEADING_FIELDS + FIELDS_PER_CHANNEL*k + f] = fields[f] + "_" + k;
		CSV.write(toTable(), file, ',', metadata, columns);
	}

	/**
	 * read back a table saved by {@link #savepixsol(File)}.
	 * @param file the saved table
	 * @param grid the wavelength channels it was made for
	 * @return the pixel solution, with the key it was saved with
	 * @throws IOException if the file can't be read or its layout is wrong for this grid
	 */
	public static PixelSolution loadpixsol(File file, WavelengthGrid grid) throws IOException {
		Map<String, String> metadata = new HashMap<>();
		for (String entry: CSV.readHeader(file, ',', 1)[0]) {
			String[] pair = entry.split("=", 2);
			if (pair.length == 2)
				metadata.put(pair[0].trim(), pair[1].trim());
		}
		String key = metadata.get("key");
		int numLenslets, rows, cols, numChannels;
		try {
			numLenslets = Integer.parseInt(metadata.get("nlens"));
			rows = Integer.parseInt(metadata.get("rows"));
			cols = Integer.parseInt(metadata.get("cols"));
			numChannels = Integer.parseInt(metadata.get("nlam"));
		} catch (NumberFormatException e) {
			throw new IOException(file + " does not start with a valid pixel solution header", e);
		}
		if (key == null)
			throw new IOException(file + " has no key");
		if (numChannels != grid.size())
			throw new IOException(String.format("%s has %d channels but the grid has %d", file, numChannels, grid.size()));

		double[][] table;
		try {
			table = CSV.read(file, ',', 2);
		} catch (NumberFormatException e) {
			throw new IOException("could not parse " + file, e);
		}
		if (table.length != numLenslets*numLenslets)
			throw new IOException(String.format("%s should have %d lenslets but has %d", file, numLenslets*numLenslets, table.length));

		Footprint[][] footprints = new Footprint[table.length][numChannels];
		for (int id = 0; id < table.length; id ++) {
			double[] row = table[id];
			if (row.length != LEADING_FIELDS + FIELDS_PER_CHANNEL*numChannels || row[0] != id)
				throw new IOException(String.format("row %d of %s is malformed", id, file));
			for (int k = 0; k < numChannels; k ++) {
				int j = LEADING_FIELDS + FIELDS_PER_CHANNEL*k;
				if (Double.isNaN(row[j + 2]))
					footprints[id][k] = Footprint.none(row[j], row[j + 1]);
				else
					footprints[id][k] = new Footprint(row[j], row[j + 1], new Box(
							(int) row[j + 2], (int) row[j + 3] + 1,
							(int) row[j + 4], (int) row[j + 5] + 1));
			}
		}
		return new PixelSolution(numLenslets, rows, cols, grid, key, footprints);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof PixelSolution))
			return false;
		PixelSolution that = (PixelSolution) o;
		return this.numLenslets == that.numLenslets &&
		       this.detectorRows == that.detectorRows &&
		       this.detectorCols == that.detectorCols &&
		       this.grid.equals(that.grid) &&
		       this.key.equals(that.key) &&
		       Arrays.deepEquals(this.footprints, that.footprints);
	}

	@Override
	public int hashCode() {
		return key.hashCode()*31 + Arrays.deepHashCode(footprints);
	}

	@Override
	public String toString() {
		return String.format("PixelSolution %d×%d lenslets × %d channels (key %.12s…)",
		                     numLenslets, numLenslets, grid.size(), key);
	}
}
