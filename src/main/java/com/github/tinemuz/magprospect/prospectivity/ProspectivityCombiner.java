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
package com.github.tinemuz.magprospect.prospectivity;

import com.github.tinemuz.magprospect.field.Extent;
import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fuses a magnetic-derived layer with surface indicator layers.
 *
 * <p>All layers are sampled on a regular grid over the intersection of their
 * extents and min-max normalized one by one. The indicators are averaged into
 * one component and {@code wMag * magnetic + wInd * indicator} is normalized
 * again. A node is invalid in the result when the magnetic layer or any used
 * indicator is invalid there.</p>
 */
public final class ProspectivityCombiner {
    private static final Logger log = LoggerFactory.getLogger(ProspectivityCombiner.class);

    private ProspectivityCombiner() {}

    public static ProspectivityGrid combine(Layer magnetic, List<? extends Layer> indicators) {
        return combine(magnetic, indicators, CombinerSettings.defaults());
    }

    /**
     * @throws IllegalArgumentException if there are no indicators, the extents
     *     do not overlap, or the magnetic layer or every indicator has no valid
     *     sample on the common grid
     */
    public static ProspectivityGrid combine(
            Layer magnetic, List<? extends Layer> indicators, CombinerSettings settings) {
        if (indicators.isEmpty()) {
            throw new IllegalArgumentException("at least one indicator layer is required");
        }
        Extent common = magnetic.extent();
        for (Layer layer : indicators) common = common.intersect(layer.extent());
        if (common.isEmpty()) {
            throw new IllegalArgumentException("layer extents do not overlap: common extent is " + common);
        }
        GridGeometry grid = GridGeometry.spanning(common, settings.nx(), settings.ny());
        log.debug("Common prospectivity grid {}x{} over {}", grid.nx(), grid.ny(), common);

        double[] mag = Normalization.minMax(sample(magnetic, grid));
        if (allNaN(mag)) {
            throw new IllegalArgumentException(
                    "magnetic layer '" + magnetic.name() + "' has no valid samples on the common grid");
        }

        Map<String, FieldGrid> normalized = new LinkedHashMap<>();
        double[] indicator = new double[grid.size()];
        for (Layer layer : indicators) {
            double[] values = Normalization.minMax(sample(layer, grid));
            if (allNaN(values)) {
                log.warn("Indicator layer '{}' has no valid samples on the common grid, skipped", layer.name());
                continue;
            }
            normalized.put(layer.name(), FieldGrid.of(grid, values));
            for (int i = 0; i < indicator.length; i++) indicator[i] += values[i];
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("no indicator layer has valid samples on the common grid");
        }
        for (int i = 0; i < indicator.length; i++) indicator[i] /= normalized.size();

        double wm = settings.magneticWeight();
        double wi = settings.indicatorWeight();
        double[] sum = new double[grid.size()];
        for (int i = 0; i < sum.length; i++) sum[i] = wm * mag[i] + wi * indicator[i];
        double[] prospectivity = Normalization.minMax(sum);

        log.info("Combined magnetic layer '{}' with {} indicator layers (weights {}/{})",
                magnetic.name(), normalized.size(), wm, wi);
        return new ProspectivityGrid(
                FieldGrid.of(grid, prospectivity),
                FieldGrid.of(grid, mag),
                FieldGrid.of(grid, indicator),
                normalized);
    }

    private static double[] sample(Layer layer, GridGeometry grid) {
        double[] out = new double[grid.size()];
        for (int r = 0; r < grid.ny(); r++) {
            for (int c = 0; c < grid.nx(); c++) {
                out[grid.index(r, c)] = layer.sample(grid.x(c), grid.y(r));
            }
        }
        return out;
    }

    private static boolean allNaN(double[] values) {
        for (double v : values) {
            if (!Double.isNaN(v)) return false;
        }
        return true;
    }
}
