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

package com.github.tinemuz.meeus.moon;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.orbit.NodeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoonOrbitTest {

    private static final double JDE = 2448724.5;

    @Test
    @DisplayName("Mean ascending node, 1992 April 12")
    void meanNode() {
        assertEquals(274.400656, Math.toDegrees(MoonOrbit.meanAscendingNode(JDE)), 1e-5);
    }

    @Test
    @DisplayName("True node oscillates around the mean node")
    void trueNode() {
        for (double jd = JDE; jd < JDE + 400.0; jd += 3.3) {
            double diff = Math.toDegrees(MoonOrbit.trueAscendingNode(jd) - MoonOrbit.meanAscendingNode(jd));
            diff = ((diff + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
            assertTrue(Math.abs(diff) < 2.0, "difference " + diff);
        }
    }

    @Test
    @DisplayName("Mean perigee advances about 40.7° per year")
    void perigee() {
        double p0 = MoonOrbit.meanPerigee(2451545.0);
        assertEquals(83.3532465, Math.toDegrees(p0), 1e-7);
        double p1 = MoonOrbit.meanPerigee(2451545.0 + 365.25);
        assertEquals(40.68, Math.toDegrees(p1 - p0), 0.05);
    }

    @Test
    @DisplayName("Passage through the ascending node, 1987 May")
    void nodePassage() {
        assertEquals(2446938.76803, MoonOrbit.passageThroughNode(NodeKind.ASCENDING, 1987.37), 1e-5);
        assertEquals(2446938.76803, MoonOrbit.passageThroughNode(-170.0), 1e-5);
    }

    @Test
    @DisplayName("Descending node falls between two ascending ones")
    void descending() {
        double asc = MoonOrbit.passageThroughNode(-170.0);
        double desc = MoonOrbit.passageThroughNode(NodeKind.DESCENDING, 1987.40);
        double next = MoonOrbit.passageThroughNode(-169.0);
        assertTrue(desc > asc && desc < next);
    }
}
