/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
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

package com.github.tinemuz.meeus.series;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table of periodic terms loaded from a classpath resource.
 *
 * <p>Each row holds a few small integer multipliers of the fundamental
 * arguments of a theory, followed by its real amplitude coefficients. The
 * table is read on first use and is immutable afterwards; call
 * {@link #preload()} at startup to detect a missing or malformed resource
 * early.</p>
 *
 * <p>Resource format: whitespace separated columns, one term per line.
 * Blank lines and lines starting with {@code #} are ignored. A header line
 * <code>columns: &lt;multipliers&gt; &lt;coefficients&gt;</code> must precede
 * the first row.</p>
 */
public final class SeriesTable {
    private static final Logger log = LoggerFactory.getLogger(SeriesTable.class);
    private static final String HEADER = "columns:";

    private final String resource;
    private volatile boolean loaded = false;
    private int[][] multipliers; // multipliers[row][argument]
    private double[][] coefficients; // coefficients[row][column]

    /**
     * A table backed by the given classpath resource. Nothing is read until
     * the first access.
     *
     * @param resource classpath resource name, e.g. {@code series/nutation.txt}
     */
    public SeriesTable(String resource) {
        this.resource = resource;
    }

    /** Name of the backing classpath resource. */
    public String resource() {
        return resource;
    }

    /**
     * Load the table now.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public void preload() {
        ensureLoaded();
    }

    /** Number of terms. */
    public int rowCount() {
        ensureLoaded();
        return multipliers.length;
    }

    /** Number of integer multiplier columns per term. */
    public int multiplierCount() {
        ensureLoaded();
        return multipliers.length == 0 ? 0 : multipliers[0].length;
    }

    /** Number of real coefficient columns per term. */
    public int coefficientCount() {
        ensureLoaded();
        return coefficients.length == 0 ? 0 : coefficients[0].length;
    }

    /** Integer multiplier of argument {@code column} in term {@code row}. */
    public int multiplier(int row, int column) {
        ensureLoaded();
        return multipliers[row][column];
    }

    /** Real coefficient {@code column} of term {@code row}. */
    public double coefficient(int row, int column) {
        ensureLoaded();
        return coefficients[row][column];
    }

    /**
     * Argument of term {@code row}: the sum of its multipliers times the
     * given fundamental arguments, in the units of those arguments.
     *
     * @param row       term index
     * @param arguments fundamental arguments, one per multiplier column
     * @return Σ k<sub>i</sub>·arguments[i]
     */
    public double argument(int row, double... arguments) {
        ensureLoaded();
        int[] k = multipliers[row];
        if (arguments.length != k.length) {
            throw new IllegalArgumentException(
                    "Expected " + k.length + " fundamental arguments for " + resource
                            + ", got " + arguments.length);
        }
        double sum = 0.0;
        for (int i = 0; i < k.length; i++) {
            if (k[i] != 0) sum += k[i] * arguments[i];
        }
        return sum;
    }

    private synchronized void ensureLoaded() {
        if (loaded) return;
        loadFromResource();
        loaded = true;
    }

    /**
     * Parse the backing resource into the multiplier and coefficient arrays.
     * Any problem reading or parsing the file throws an
     * IllegalStateException.
     */
    private void loadFromResource() {
        InputStream in = SeriesTable.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Series table '{}' not found on classpath", resource);
            throw new IllegalStateException("Series table '" + resource + "' not found on classpath");
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            int intColumns = -1;
            int realColumns = -1;
            List<int[]> intRows = new ArrayList<>();
            List<double[]> realRows = new ArrayList<>();
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks[0].equals(HEADER)) {
                    if (toks.length != 3) {
                        throw new IllegalArgumentException("Malformed header at line " + lineNo);
                    }
                    intColumns = Integer.parseInt(toks[1]);
                    realColumns = Integer.parseInt(toks[2]);
                    continue;
                }
                if (intColumns < 0) {
                    throw new IllegalArgumentException("Data before '" + HEADER + "' header at line " + lineNo);
                }
                if (toks.length != intColumns + realColumns) {
                    throw new IllegalArgumentException(
                            "Expected " + (intColumns + realColumns) + " columns at line " + lineNo
                                    + ", found " + toks.length);
                }
                int[] k = new int[intColumns];
                for (int i = 0; i < intColumns; i++) k[i] = Integer.parseInt(toks[i]);
                double[] c = new double[realColumns];
                for (int i = 0; i < realColumns; i++) c[i] = Double.parseDouble(toks[intColumns + i]);
                intRows.add(k);
                realRows.add(c);
            }
            if (intRows.isEmpty()) {
                throw new IllegalArgumentException("No terms found");
            }
            multipliers = intRows.toArray(new int[0][]);
            coefficients = realRows.toArray(new double[0][]);
            log.debug("Loaded {} terms from {}", multipliers.length, resource);
        } catch (IOException e) {
            log.error("Failed to read series table '{}'", resource, e);
            throw new IllegalStateException("Failed to read series table '" + resource + "'", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse series table '{}'", resource, e);
            throw new IllegalStateException("Failed to parse series table '" + resource + "'", e);
        }
    }
}
