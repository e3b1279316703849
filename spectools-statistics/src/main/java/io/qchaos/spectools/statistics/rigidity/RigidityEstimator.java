package io.qchaos.spectools.statistics.rigidity;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.qchaos.spectools.statistics.exceptions.ComputationException;
import io.qchaos.spectools.statistics.exceptions.InvalidWindowCountException;
import io.qchaos.spectools.statistics.exceptions.WindowTooLargeException;
import io.qchaos.spectools.statistics.spectrum.AbstractSpectrum;
import io.qchaos.spectools.statistics.spectrum.Bounds;
import io.qchaos.spectools.statistics.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Estimates the spectral rigidity Δ3(L) of a spectrum.
 *
 * <h2>Definition</h2>
 *
 * <p>Δ3(L) is the mean, over windows of length L, of the squared deviation of
 * the staircase N(ε) from its best straight-line fit inside the window:
 *
 * <pre>{@code
 *   Δ3(L) = < (1/L) min_{a,b} ∫_{E-L/2}^{E+L/2} (N(ε) - a - bε)² dε >_E
 * }</pre>
 *
 * See H.-J. Stöckmann, <i>Quantum Chaos: An Introduction</i> (2006), p. 112.
 *
 * <h2>Procedure</h2>
 *
 * <pre>{@code
 * ┌───────────────────────────────────────────────────────────────────────┐
 * │ numCenters centers E, evenly spaced over [min + L/2, max - L/2]        │
 * └───────────────────────────────────────────────────────────────────────┘
 *          ↓ per center (independent, parallel when configured)
 * ┌───────────────────────────────────────────────────────────────────────┐
 * │ numPoints abscissae t over [E - L/2, E + L/2], y = N(t)                │
 * │ closed-form fit a + b·t, r = (y - a - b·t)²                            │
 * │ trapezoidal ∫ r dt, divided by L                                       │
 * └───────────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌───────────────────────────────────────────────────────────────────────┐
 * │ Δ3(L) = mean of the per-center contributions, summed in center order   │
 * └───────────────────────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>Contributions are always summed in center order, so the result is
 * bit-identical with and without parallelism.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (RigidityEstimator estimator = RigidityEstimator.builder()
 *         .numCenters(500)
 *         .numPoints(50)
 *         .parallelism(8)
 *         .build()) {
 *     RigidityCurve curve = estimator.curve(spectrum, LengthGrid.linspace(0, 20, 50));
 * }
 * }</pre>
 */
public final class RigidityEstimator implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(RigidityEstimator.class);

    /** Default number of window centers per length */
    public static final int DEFAULT_NUM_CENTERS = 500;

    /** Default number of staircase samples per window */
    public static final int DEFAULT_NUM_POINTS = 50;

    /** Smallest usable center or point count; two points determine a line */
    public static final int MIN_WINDOW_COUNT = 2;

    private final int numCenters;
    private final int numPoints;
    private final ForkJoinPool pool;
    private final boolean ownsPool;

    /**
     * Creates a sequential estimator with the default window counts.
     */
    public RigidityEstimator() {
        this(DEFAULT_NUM_CENTERS, DEFAULT_NUM_POINTS, null, false);
    }

    /**
     * Creates a sequential estimator.
     *
     * @param numCenters the number of window centers, at least 2
     * @param numPoints the number of samples per window, at least 2
     */
    public RigidityEstimator(int numCenters, int numPoints) {
        this(numCenters, numPoints, null, false);
    }

    private RigidityEstimator(int numCenters, int numPoints, ForkJoinPool pool, boolean ownsPool) {
        if (numCenters < MIN_WINDOW_COUNT) {
            throw new InvalidWindowCountException("numCenters", numCenters, MIN_WINDOW_COUNT);
        }
        if (numPoints < MIN_WINDOW_COUNT) {
            throw new InvalidWindowCountException("numPoints", numPoints, MIN_WINDOW_COUNT);
        }
        this.numCenters = numCenters;
        this.numPoints = numPoints;
        this.pool = pool;
        this.ownsPool = ownsPool;
    }

    /**
     * Returns a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int numCenters() {
        return numCenters;
    }

    public int numPoints() {
        return numPoints;
    }

    /**
     * Checks whether window work is spread over a worker pool.
     */
    public boolean isParallel() {
        return pool != null;
    }

    /**
     * Estimates Δ3 for one window length.
     *
     * @param spectrum the spectrum, empirical or reference
     * @param length the window length L, finite and non-negative
     * @return Δ3(L); exactly 0 for L = 0
     * @throws WindowTooLargeException if L exceeds the span of the spectrum
     * @throws ComputationException if a local fit fails
     */
    public double estimate(Spectrum spectrum, double length) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        checkLength(spectrum, length);
        if (length == 0.0) {
            return 0.0;
        }

        double[] centers = centers(spectrum.bounds(), length);
        double[] contributions = new double[numCenters];
        if (pool != null) {
            runInPool(() -> IntStream.range(0, numCenters).parallel()
                .forEach(i -> contributions[i] = windowContribution(spectrum, centers[i], length)));
        } else {
            for (int i = 0; i < numCenters; i++) {
                contributions[i] = windowContribution(spectrum, centers[i], length);
            }
        }
        return mean(contributions, length);
    }

    /**
     * Estimates Δ3 for every length of a grid.
     *
     * <p>All lengths are validated before any work starts, so an oversized
     * window fails fast with the first offending length in grid order. With a
     * pool, lengths are processed in parallel and each length's centers
     * sequentially.
     *
     * @param spectrum the spectrum, empirical or reference
     * @param lengths the window lengths, in the order they should appear on the curve
     * @return the curve, labelled with the spectrum kind
     */
    public RigidityCurve curve(Spectrum spectrum, double[] lengths) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(lengths, "lengths cannot be null");
        for (double length : lengths) {
            checkLength(spectrum, length);
        }

        long start = System.nanoTime();
        double[] values = new double[lengths.length];
        if (pool != null) {
            runInPool(() -> IntStream.range(0, lengths.length).parallel()
                .forEach(i -> values[i] = estimateSequential(spectrum, lengths[i])));
        } else {
            for (int i = 0; i < lengths.length; i++) {
                values[i] = estimateSequential(spectrum, lengths[i]);
            }
        }
        logger.debug("Computed {} rigidity points for {} in {} ms", lengths.length, spectrum,
            (System.nanoTime() - start) / 1_000_000);
        return new RigidityCurve(labelOf(spectrum), lengths, values);
    }

    /**
     * Computes the contribution of a single window: the trapezoidal integral
     * of the squared residuals of the local linear fit, divided by L. A window
     * whose edges coincide in double precision has zero width and contributes 0.
     *
     * @param spectrum the spectrum to sample
     * @param center the window center E
     * @param length the window length L
     * @return (1/L) ∫ (N(t) - a - b·t)² dt over [E - L/2, E + L/2]
     */
    public double windowContribution(Spectrum spectrum, double center, double length) {
        if (length == 0.0) {
            return 0.0;
        }
        double half = length / 2.0;
        if (center - half == center + half) {
            // window narrower than the spacing of doubles at the center
            return 0.0;
        }
        double[] t = LengthGrid.linspace(center - half, center + half, numPoints);
        double[] y = new double[numPoints];
        for (int i = 0; i < numPoints; i++) {
            y[i] = spectrum.query(t[i]);
        }

        LinearFit fit = LinearFit.fit(t, y, numPoints);

        double[] residuals = new double[numPoints];
        for (int i = 0; i < numPoints; i++) {
            double r = y[i] - fit.intercept() - fit.slope() * t[i];
            residuals[i] = r * r;
        }
        return TrapezoidRule.integrate(t, residuals, numPoints) / length;
    }

    private double estimateSequential(Spectrum spectrum, double length) {
        if (length == 0.0) {
            return 0.0;
        }
        double[] centers = centers(spectrum.bounds(), length);
        double[] contributions = new double[numCenters];
        for (int i = 0; i < numCenters; i++) {
            contributions[i] = windowContribution(spectrum, centers[i], length);
        }
        return mean(contributions, length);
    }

    private double[] centers(Bounds bounds, double length) {
        double half = length / 2.0;
        return LengthGrid.linspace(bounds.min() + half, bounds.max() - half, numCenters);
    }

    private static double mean(double[] contributions, double length) {
        double sum = 0.0;
        for (double c : contributions) {
            sum += c;
        }
        double mean = sum / contributions.length;
        if (!Double.isFinite(mean)) {
            throw new ComputationException("Rigidity at L=" + length + " is not finite: " + mean);
        }
        return mean;
    }

    private static void checkLength(Spectrum spectrum, double length) {
        if (!Double.isFinite(length) || length < 0) {
            throw new IllegalArgumentException("Window length must be finite and non-negative: " + length);
        }
        double span = spectrum.bounds().span();
        if (length / 2.0 > span / 2.0) {
            throw new WindowTooLargeException(length, span);
        }
    }

    private static String labelOf(Spectrum spectrum) {
        if (spectrum instanceof AbstractSpectrum) {
            return ((AbstractSpectrum) spectrum).kind();
        }
        return spectrum.getClass().getSimpleName();
    }

    private void runInPool(Runnable work) {
        try {
            pool.submit(work).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException("Interrupted while estimating rigidity", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ComputationException("Rigidity estimation failed", cause);
        }
    }

    /**
     * Shuts down the worker pool if this estimator created it.
     */
    @Override
    public void close() {
        if (ownsPool && pool != null) {
            pool.shutdown();
        }
    }

    @Override
    public String toString() {
        return String.format("RigidityEstimator{numCenters=%d, numPoints=%d, parallelism=%d}",
            numCenters, numPoints, pool != null ? pool.getParallelism() : 1);
    }

    /**
     * Builder for {@link RigidityEstimator}.
     */
    public static final class Builder {
        private int numCenters = DEFAULT_NUM_CENTERS;
        private int numPoints = DEFAULT_NUM_POINTS;
        private int parallelism = 1;
        private ForkJoinPool pool;

        private Builder() {
        }

        /**
         * Sets the number of window centers per length.
         */
        public Builder numCenters(int numCenters) {
            this.numCenters = numCenters;
            return this;
        }

        /**
         * Sets the number of staircase samples per window.
         */
        public Builder numPoints(int numPoints) {
            this.numPoints = numPoints;
            return this;
        }

        /**
         * Sets the number of worker threads; 1 computes on the calling thread.
         * A dedicated pool is created for values above 1 and released by {@link #close()}.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Uses an existing pool instead of creating one. The pool is not shut
         * down when the estimator is closed.
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = Objects.requireNonNull(pool, "pool cannot be null");
            return this;
        }

        /**
         * Builds the estimator.
         *
         * @throws InvalidWindowCountException if either window count is below 2
         */
        public RigidityEstimator build() {
            if (pool != null) {
                return new RigidityEstimator(numCenters, numPoints, pool, false);
            }
            if (parallelism > 1) {
                // validate before creating threads that would otherwise leak
                if (numCenters < MIN_WINDOW_COUNT) {
                    throw new InvalidWindowCountException("numCenters", numCenters, MIN_WINDOW_COUNT);
                }
                if (numPoints < MIN_WINDOW_COUNT) {
                    throw new InvalidWindowCountException("numPoints", numPoints, MIN_WINDOW_COUNT);
                }
                logger.debug("Creating rigidity worker pool with {} threads", parallelism);
                return new RigidityEstimator(numCenters, numPoints, new ForkJoinPool(parallelism), true);
            }
            return new RigidityEstimator(numCenters, numPoints, null, false);
        }
    }
}
