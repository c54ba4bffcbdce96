/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.lattice;

import com.vmware.ipmatrix.InfeasibleRelaxationException;
import com.vmware.ipmatrix.linalg.HermiteNormalForm;
import com.vmware.ipmatrix.linalg.IntegerMatrices;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatticeTest {

    @Test
    public void kernelOfTwoRowSystem() {
        final long[][] a = {{1, 1, 0}, {0, 1, 1}};
        final Lattice lattice = Lattice.of(a, 3);
        assertEquals(2, lattice.rank());
        assertEquals(1, lattice.dimension());
        final long[][] basis = lattice.basis();
        assertEquals(1, basis.length);
        assertArrayEquals(new long[]{1, -1, 1}, basis[0]);
        assertTrue(Lattice.inKernel(a, basis[0]));

        final long[] x = lattice.fiberSolution(new long[]{1, 1});
        assertArrayEquals(new long[]{1, 1}, IntegerMatrices.multiply(a, x));
    }

    @Test
    public void kernelOfSingleRow() {
        final long[][] a = {{2, 3, 5}};
        final Lattice lattice = Lattice.of(a, 3);
        assertEquals(1, lattice.rank());
        final long[][] basis = lattice.basis();
        assertEquals(2, basis.length);
        for (final long[] row : basis) {
            assertTrue(Lattice.inKernel(a, row));
        }
        assertEquals(2, IntegerMatrices.rank(basis));
        final long[] x = lattice.fiberSolution(new long[]{7});
        assertArrayEquals(new long[]{7}, IntegerMatrices.multiply(a, x));
    }

    @Test
    public void noRows() {
        final Lattice lattice = Lattice.of(new long[0][], 2);
        assertEquals(0, lattice.rank());
        assertEquals(2, lattice.basis().length);
        assertArrayEquals(new long[2], lattice.fiberSolution(new long[0]));
    }

    @Test
    public void noIntegerSolution() {
        final Lattice lattice = Lattice.of(new long[][]{{2}}, 1);
        assertFalse(lattice.solve(new long[]{1}).isPresent());
        assertEquals(0, lattice.basis().length);
        assertThrows(InfeasibleRelaxationException.class, () -> lattice.fiberSolution(new long[]{1}));
    }

    @Test
    public void inconsistentSystem() {
        final Lattice lattice = Lattice.of(new long[][]{{1, 1}, {1, 1}}, 2);
        assertEquals(1, lattice.rank());
        final Optional<long[]> x = lattice.solve(new long[]{1, 2});
        assertFalse(x.isPresent());
        assertTrue(lattice.solve(new long[]{3, 3}).isPresent());
    }

    @Test
    public void normalizedHnf() {
        final long[][] h = Lattice.toNormalizedHnf(new long[][]{{1, 3}, {0, 2}}, 2);
        assertArrayEquals(new long[]{1, -1}, h[0]);
        assertArrayEquals(new long[]{0, 2}, h[1]);
        assertTrue(HermiteNormalForm.isNormalized(h));
    }

    @Test
    public void lift() {
        final long[][] latticeBasis = {{1, -1, 1}};
        final long[][] projected = {{1}};
        assertArrayEquals(new long[]{3, -3, 3}, Lattice.liftVector(new long[]{3}, projected, latticeBasis));
        assertThrows(IllegalArgumentException.class,
                     () -> Lattice.liftVector(new long[]{1}, new long[][]{{2}}, new long[][]{{2, 0}}));
    }
}
