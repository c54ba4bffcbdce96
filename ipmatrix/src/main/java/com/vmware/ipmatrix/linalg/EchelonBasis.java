/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.linalg;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Incrementally maintained set of linearly independent integer rows. Rows are reduced fraction-free against
 * the rows already accepted and divided by their content, which keeps entries small.
 */
final class EchelonBasis {
    private final int width;
    private final List<BigInteger[]> rows = new ArrayList<>();
    private final List<Integer> pivots = new ArrayList<>();

    EchelonBasis(final int width) {
        this.width = width;
    }

    /**
     * Adds the row if it is linearly independent of the rows added so far.
     *
     * @return true iff the row increased the rank
     */
    boolean add(final long[] row) {
        final BigInteger[] v = new BigInteger[width];
        for (int j = 0; j < width; j++) {
            v[j] = BigInteger.valueOf(row[j]);
        }
        return add(v);
    }

    boolean add(final BigInteger[] row) {
        final BigInteger[] v = reduce(row);
        int pivot = -1;
        for (int j = 0; j < width; j++) {
            if (v[j].signum() != 0) {
                pivot = j;
                break;
            }
        }
        if (pivot < 0) {
            return false;
        }
        rows.add(v);
        pivots.add(pivot);
        return true;
    }

    int rank() {
        return rows.size();
    }

    private BigInteger[] reduce(final BigInteger[] row) {
        BigInteger[] v = row.clone();
        for (int k = 0; k < rows.size(); k++) {
            final int p = pivots.get(k);
            if (v[p].signum() == 0) {
                continue;
            }
            final BigInteger[] r = rows.get(k);
            final BigInteger g = v[p].gcd(r[p]);
            final BigInteger scaleV = r[p].divide(g);
            final BigInteger scaleR = v[p].divide(g);
            final BigInteger[] next = new BigInteger[width];
            for (int j = 0; j < width; j++) {
                next[j] = v[j].multiply(scaleV).subtract(r[j].multiply(scaleR));
            }
            v = divideByContent(next);
        }
        return v;
    }

    private static BigInteger[] divideByContent(final BigInteger[] v) {
        BigInteger content = BigInteger.ZERO;
        for (final BigInteger x : v) {
            content = content.gcd(x);
        }
        if (content.signum() == 0 || content.equals(BigInteger.ONE)) {
            return v;
        }
        final BigInteger[] out = new BigInteger[v.length];
        for (int j = 0; j < v.length; j++) {
            out[j] = v[j].divide(content);
        }
        return out;
    }
}
