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

import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combined prospectivity in {@code [0, 1]} on the common grid, with the
 * normalized components it was built from.
 */
public final class ProspectivityGrid {
    private final FieldGrid prospectivity;
    private final FieldGrid magnetic;
    private final FieldGrid indicator;
    private final Map<String, FieldGrid> indicators;

    ProspectivityGrid(
            FieldGrid prospectivity, FieldGrid magnetic, FieldGrid indicator, Map<String, FieldGrid> indicators) {
        this.prospectivity = prospectivity;
        this.magnetic = magnetic;
        this.indicator = indicator;
        this.indicators = Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
    }

    public GridGeometry geometry() {
        return prospectivity.geometry();
    }

    public FieldGrid prospectivity() {
        return prospectivity;
    }

    /** Normalized magnetic layer. */
    public FieldGrid magnetic() {
        return magnetic;
    }

    /** Mean of the normalized indicator layers. */
    public FieldGrid indicator() {
        return indicator;
    }

    /** Each normalized indicator by layer name, in input order; skipped layers are absent. */
    public Map<String, FieldGrid> indicators() {
        return indicators;
    }
}
