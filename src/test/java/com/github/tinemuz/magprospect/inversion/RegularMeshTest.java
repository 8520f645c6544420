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
package com.github.tinemuz.magprospect.inversion;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.magprospect.field.ObservationSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RegularMeshTest {

    private static RegularMesh mesh(int nx, int ny, int nz) {
        ObservationSeries series = ObservationSeries.of(
                new double[] {0, 300}, new double[] {40, 40}, new double[] {1, 1});
        InversionConfig config = InversionConfig.builder()
                .cells(nx, ny, nz)
                .cellSize(100, 50, 20)
                .zTop(10)
                .build();
        return RegularMesh.over(series, config);
    }

    @Test
    @DisplayName("Centres span the observations and layers start at zTop")
    void centres() {
        RegularMesh mesh = mesh(4, 1, 2);

        assertArrayEquals(new double[] {0, 100, 200, 300}, mesh.xCenters(), 1e-12);
        assertArrayEquals(new double[] {40}, mesh.yCenters(), 0.0);
        assertArrayEquals(new double[] {20, 40}, mesh.zCenters(), 1e-12);
        assertEquals(8, mesh.cellCount());
        assertEquals(100 * 50 * 20, mesh.cellVolume(), 0.0);
    }

    @Test
    @DisplayName("Flat index runs z fastest, then y, then x")
    void flatIndex() {
        RegularMesh mesh = mesh(3, 2, 4);

        assertEquals(0, mesh.index(0, 0, 0));
        assertEquals(1, mesh.index(0, 0, 1));
        assertEquals(4, mesh.index(0, 1, 0));
        assertEquals(8, mesh.index(1, 0, 0));
        assertEquals(23, mesh.index(2, 1, 3));

        int cell = mesh.index(2, 1, 3);
        assertEquals(mesh.xCenters()[2], mesh.xCenter(cell), 0.0);
        assertEquals(mesh.yCenters()[1], mesh.yCenter(cell), 0.0);
        assertEquals(mesh.zCenters()[3], mesh.zCenter(cell), 0.0);
    }

    @Test
    @DisplayName("Linspace hits both ends and the midpoint for one sample")
    void linspace() {
        assertArrayEquals(new double[] {-1, -0.5, 0, 0.5, 1}, RegularMesh.linspace(-1, 1, 5), 1e-15);
        assertArrayEquals(new double[] {2.5}, RegularMesh.linspace(0, 5, 1), 0.0);
        assertEquals(0.7, RegularMesh.linspace(0.1, 0.7, 7)[6], 0.0);
    }
}
