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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * the whole reduction: from a calibration table, a detector frame and a configuration file to a
 * spectrum for every lenslet.
 */
public class SpectralExtraction {

	private static final Logger logger = Logger.getLogger(Logging.LOGGER_NAME);

	/**
	 * extract the spectrum of every lenslet in the pixel solution.  each lenslet is its own task
	 * on a fixed pool of threads, and an {@link IFSException} in one of them is recorded in its
	 * outcome rather than passed on, so a bad lenslet never costs you the others.  anything else
	 * that goes wrong is a bug, and is rethrown once every task has finished.
	 * @param image the detector frame
	 * @param variance its variance map, or null for unit variance
	 * @param pixsol the pixel solution
	 * @param profile the PSF-let profile
	 * @param mode how to reduce each cutout
	 * @param margin how far to grow each cutout beyond its footprints
	 * @param numThreads how many lenslets to work on at once
	 * @return the outcome of every lenslet, in order of lenslet id
	 */
	public static SortedMap<Integer, LensletOutcome> extractAll(
			DetectorImage image, DetectorImage variance, PixelSolution pixsol,
			ProfileModel profile, ExtractionMode mode, int margin, int numThreads) {
		if (numThreads <= 0)
			throw new IllegalArgumentException("there must be at least one thread, not " + numThreads);
		if (variance == null)
			variance = DetectorImage.constant(image.rows(), image.cols(), 1);
		else if (!variance.sameShapeAs(image))
			throw new IllegalArgumentException(String.format(
					"the variance map is %d×%d but the image is %d×%d",
					variance.rows(), variance.cols(), image.rows(), image.cols()));
		final DetectorImage σ2 = variance;

		ExecutorService threads = Executors.newFixedThreadPool(numThreads);
		List<Future<LensletOutcome>> futures = new ArrayList<>(pixsol.lensletCount());
		for (int lenslet_task = 0; lenslet_task < pixsol.lensletCount(); lenslet_task ++) {
			final int lenslet = lenslet_task;
			Callable<LensletOutcome> task = () -> {
				try {
					Cutout cutout = CutoutExtractor.extractCutout(image, pixsol, lenslet, margin);
					PixelMask mask = PixelMask.compute(cutout, σ2);
					return LensletOutcome.success(lenslet, mode.extract(cutout, profile, σ2, mask));
				} catch (IFSException e) {
					logger.fine(e.getMessage());
					return LensletOutcome.failure(lenslet, e);
				}
			};
			futures.add(threads.submit(task));
		}

		// let the threads do their thing
		threads.shutdown();
		try {
			if (!threads.awaitTermination(24, TimeUnit.HOURS))
				throw new RuntimeException("the extraction timed out");
		} catch (InterruptedException e) {
			threads.shutdownNow();
			Thread.currentThread().interrupt();
			throw new RuntimeException("the extraction was interrupted", e);
		}

		SortedMap<Integer, LensletOutcome> outcomes = new TreeMap<>();
		for (Future<LensletOutcome> future: futures) {
			try {
				LensletOutcome outcome = future.get();
				outcomes.put(outcome.lenslet, outcome);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new RuntimeException(e);
			} catch (ExecutionException e) {
				if (e.getCause() instanceof RuntimeException)
					throw (RuntimeException) e.getCause();
				else if (e.getCause() instanceof Error)
					throw (Error) e.getCause();
				else
					throw new RuntimeException(e.getCause());
			}
		}

		int numFailures = 0;
		for (LensletOutcome outcome: outcomes.values())
			if (!outcome.isSuccess())
				numFailures ++;
		String summary = String.format("extracted %d of %d lenslets with %s (%d failed)",
		                               outcomes.size() - numFailures, outcomes.size(), mode, numFailures);
		if (numFailures > 0)
			logger.warning(summary);
		else
			logger.info(summary);
		return outcomes;
	}

	/**
	 * count the failed lenslets by the kind of exception that stopped them
	 */
	public static Map<String, Integer> summarizeFailures(Map<Integer, LensletOutcome> outcomes) {
		Map<String, Integer> counts = new TreeMap<>();
		for (LensletOutcome outcome: outcomes.values())
			if (!outcome.isSuccess())
				counts.merge(outcome.getError().getClass().getSimpleName(), 1, Integer::sum);
		return counts;
	}

	/**
	 * lay out every successful spectrum as one row per lenslet per channel: lenslet, ix, iy,
	 * wavelength, flux, variance.
	 */
	public static double[][] spectraTable(Map<Integer, LensletOutcome> outcomes, PixelSolution pixsol) {
		List<double[]> rows = new ArrayList<>();
		for (LensletOutcome outcome: outcomes.values()) {
			if (!outcome.isSuccess())
				continue;
			SpectrumResult spectrum = outcome.getSpectrum();
			for (int k = 0; k < spectrum.size(); k ++)
				rows.add(new double[] {
						outcome.lenslet, pixsol.ix(outcome.lenslet), pixsol.iy(outcome.lenslet),
						spectrum.getWavelength(k), spectrum.getFlux(k), spectrum.getVariance(k)});
		}
		return rows.toArray(new double[0][]);
	}

	/**
	 * reuse the pixel solution saved in the given file if it was made from the same inputs, or
	 * else make a new one and save it there.
	 */
	static PixelSolution loadOrGenerate(File file, PSFLetModel model, WavelengthGrid grid,
	                                    InstrumentConfig config) throws IOException {
		String key = PixelSolution.key(grid, model, config);
		if (file.exists()) {
			try {
				PixelSolution saved = PixelSolution.loadpixsol(file, grid);
				if (saved.getKey().equals(key)) {
					logger.info("reusing the pixel solution in `" + file + "`");
					return saved;
				}
				logger.info("the pixel solution in `" + file + "` is out of date");
			} catch (IOException e) {
				logger.log(Level.WARNING, "could not reuse `" + file + "`", e);
			}
		}
		PixelSolution pixsol = Rasterizer.genpixsol(model, grid, config);
		File parent = file.getAbsoluteFile().getParentFile();
		if (!parent.isDirectory() && !parent.mkdirs())
			throw new IOException("could not create " + parent);
		pixsol.savepixsol(file);
		logger.info("saved the pixel solution to `" + file + "`");
		return pixsol;
	}

	private static File requireFile(Properties properties, String key) {
		String path = properties.getProperty(key);
		if (path == null || path.isBlank())
			throw new ConfigurationException("the configuration must specify `" + key + "`");
		return new File(path.trim());
	}

	/**
	 * run the full reduction.
	 * @param args the zeroth argument is the path to a properties file containing the instrument
	 *             configuration and the run paths: calibration.file, image.file, variance.file
	 *             (optional), pixsol.file, and output.dir.
	 * @throws IOException if any of the inputs can't be read or any of the outputs written
	 */
	public static void main(String[] args) throws IOException {
		if (args.length == 0)
			throw new IllegalArgumentException("please specify the configuration file.");
		Properties properties = new Properties();
		try (Reader in = new FileReader(args[0])) {
			properties.load(in);
		}

		File outputDirectory = new File(properties.getProperty("output.dir", "out").trim());
		Logging.configureLogger(logger, outputDirectory, "extraction");
		logger.info("starting...");

		InstrumentConfig config = InstrumentConfig.fromProperties(properties);
		ExtractionMode mode = ExtractionMode.parse(properties.getProperty("extraction.mode", "optimal"));
		int numThreads = InstrumentConfig.getInt(properties, "threads", Runtime.getRuntime().availableProcessors());
		if (numThreads <= 0)
			throw new ConfigurationException("`threads` can't be " + numThreads);
		logger.info("configuration: " + config);

		WavelengthGrid grid = config.wavelengthGrid();
		logger.info(String.format("using %d channels from %.1f to %.1f nm", grid.size(), grid.getBlue(), grid.getRed()));
		CalibrationTable calibration = CalibrationTable.load(requireFile(properties, "calibration.file"));
		PSFLetModel model = PSFLetModel.buildInterpolation(calibration, config.interpolationOrder);

		String pixsolPath = properties.getProperty("pixsol.file");
		File pixsolFile = (pixsolPath == null || pixsolPath.isBlank()) ?
		                  new File(outputDirectory, "pixsol.csv") :
		                  new File(pixsolPath.trim());
		PixelSolution pixsol = loadOrGenerate(pixsolFile, model, grid, config);

		DetectorImage image = DetectorImage.load(requireFile(properties, "image.file"));
		String variancePath = properties.getProperty("variance.file");
		DetectorImage variance = null;
		if (variancePath != null && !variancePath.isBlank())
			variance = DetectorImage.load(new File(variancePath.trim()));
		else
			logger.info("no variance map was given, so every pixel gets unit variance");
		if (image.rows() != config.detectorRows || image.cols() != config.detectorCols)
			logger.warning(String.format("the image is %d×%d but the detector is supposedly %d×%d",
			                             image.rows(), image.cols(), config.detectorRows, config.detectorCols));

		SortedMap<Integer, LensletOutcome> outcomes = extractAll(
				image, variance, pixsol, config.profile(), mode, config.cutoutMargin, numThreads);

		CSV.write(spectraTable(outcomes, pixsol), new File(outputDirectory, "spectra.csv"), ',',
		          new String[] {"lenslet", "ix", "iy", "wavelength", "flux", "variance"});
		SpectralCube.assemble(outcomes, pixsol).writeSlices(outputDirectory);

		Map<String, Integer> failures = summarizeFailures(outcomes);
		if (failures.isEmpty())
			logger.info("every lenslet was extracted successfully");
		else
			for (Map.Entry<String, Integer> entry: failures.entrySet())
				logger.warning(String.format("%d lenslets failed with %s", entry.getValue(), entry.getKey()));
		logger.info("done!");
	}

	/**
	 * what became of one lenslet: either its spectrum or the exception that stopped it.
	 */
	public static final class LensletOutcome {
		public final int lenslet;
		private final SpectrumResult spectrum;
		private final IFSException error;

		private LensletOutcome(int lenslet, SpectrumResult spectrum, IFSException error) {
			this.lenslet = lenslet;
			this.spectrum = spectrum;
			this.error = error;
		}

		public static LensletOutcome success(int lenslet, SpectrumResult spectrum) {
			return new LensletOutcome(lenslet, spectrum, null);
		}

		public static LensletOutcome failure(int lenslet, IFSException error) {
			return new LensletOutcome(lenslet, null, error);
		}

		public boolean isSuccess() {
			return error == null;
		}

		/**
		 * @return the spectrum, or null if this lenslet failed
		 */
		public SpectrumResult getSpectrum() {
			return spectrum;
		}

		/**
		 * @return the exception, or null if this lenslet succeeded
		 */
		public IFSException getError() {
			return error;
		}

		@Override
		public String toString() {
			return "lenslet " + lenslet + ": " + (isSuccess() ? "ok" : error.getMessage());
		}
	}
}
