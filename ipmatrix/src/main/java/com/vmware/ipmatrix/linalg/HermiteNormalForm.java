/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.ipmatrix.linalg;

import com.google.common.base.Preconditions;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Upper row Hermite Normal Form of an integer matrix, obtained with unimodular row operations only.
 *
 * The result H is in row echelon form, every pivot is positive and every entry strictly above a pivot lies
 * in [0, pivot). {@link #normalize(long[][])} turns this into the alternative canonical form where entries
 * above a pivot lie in (-pivot, 0].
 */
public final class HermiteNormalForm {
    private final BigInteger[][] h;
    private final int columns;
    private final int[] pivotColumns;

    private HermiteNormalForm(final BigInteger[][] h, final int columns, final int[] pivotColumns) {
        this.h = h;
        this.columns = columns;
        this.pivotColumns = pivotColumns;
    }

    public static HermiteNormalForm of(final long[][] a, final int columns) {
        return compute(IntegerMatrices.toBig(a, columns), columns);
    }

    static HermiteNormalForm compute(final BigInteger[][] m, final int columns) {
        final int rows = m.length;
        final List<Integer> pivots = new ArrayList<>();
        int row = 0;
        for (int col = 0; col < columns && row < rows; col++) {
            // Combine every lower row into the pivot row so that only the pivot row is non-zero in col.
            for (int i = row + 1; i < rows; i++) {
                if (m[i][col].signum() == 0) {
                    continue;
                }
                final BigInteger a = m[row][col];
                final BigInteger b = m[i][col];
                final BigInteger[] gst = extendedGcd(a, b);
                final BigInteger g = gst[0];
                final BigInteger s = gst[1];
                final BigInteger t = gst[2];
                final BigInteger aOverG = a.divide(g);
                final BigInteger bOverG = b.divide(g);
                for (int j = col; j < columns; j++) {
                    final BigInteger x = m[row][j];
                    final BigInteger y = m[i][j];
                    m[row][j] = s.multiply(x).add(t.multiply(y));
                    m[i][j] = aOverG.multiply(y).subtract(bOverG.multiply(x));
                }
            }
            if (m[row][col].signum() == 0) {
                continue;
            }
            if (m[row][col].signum() < 0) {
                for (int j = col; j < columns; j++) {
                    m[row][j] = m[row][j].negate();
                }
            }
            final BigInteger pivot = m[row][col];
            for (int k = 0; k < row; k++) {
                final BigInteger q = floorDiv(m[k][col], pivot);
                if (q.signum() == 0) {
                    continue;
                }
                for (int j = col; j < columns; j++) {
                    m[k][j] = m[k][j].subtract(q.multiply(m[row][j]));
                }
            }
            pivots.add(col);
            row++;
        }
        return new HermiteNormalForm(m, columns, pivots.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Number of non-zero rows of H, which is the rank of the input.
     */
    public int rank() {
        return pivotColumns.length;
    }

    /**
     * Number of pivots lying in the first endColumn columns.
     */
    public int rankOfLeadingColumns(final int endColumn) {
        int count = 0;
        for (final int p : pivotColumns) {
            if (p < endColumn) {
                count++;
            }
        }
        return count;
    }

    public int pivotColumn(final int row) {
        return pivotColumns[row];
    }

    public BigInteger entry(final int row, final int column) {
        return h[row][column];
    }

    public int rows() {
        return h.length;
    }

    public int columns() {
        return columns;
    }

    /**
     * @throws ArithmeticException if an entry does not fit in a long
     */
    public long[][] toLongMatrix() {
        return IntegerMatrices.toLong(h);
    }

    /**
     * Returns the block H[fromRow:toRow, fromColumn:toColumn] as longs.
     */
    public long[][] block(final int fromRow, final int toRow, final int fromColumn, final int toColumn) {
        Preconditions.checkArgument(0 <= fromRow && fromRow <= toRow && toRow <= h.length);
        Preconditions.checkArgument(0 <= fromColumn && fromColumn <= toColumn && toColumn <= columns);
        final long[][] out = new long[toRow - fromRow][toColumn - fromColumn];
        for (int i = fromRow; i < toRow; i++) {
            for (int j = fromColumn; j < toColumn; j++) {
                out[i - fromRow][j - fromColumn] = h[i][j].longValueExact();
            }
        }
        return out;
    }

    /**
     * Rewrites an upper row HNF so that every entry above a pivot is non-positive and of smaller magnitude
     * than the pivot. Positive entries above a pivot have the pivot row subtracted once.
     *
     * @param hnf a matrix in the form produced by this class
     * @return a new matrix; the argument is left untouched
     */
    public static long[][] normalize(final long[][] hnf) {
        final long[][] out = IntegerMatrices.copy(hnf);
        for (int i = 0; i < out.length; i++) {
            final int j = firstNonZero(out[i]);
            if (j < 0) {
                break;
            }
            for (int k = 0; k < i; k++) {
                if (out[k][j] > 0) {
                    for (int c = 0; c < out[k].length; c++) {
                        out[k][c] = Math.subtractExact(out[k][c], out[i][c]);
                    }
                }
            }
        }
        return out;
    }

    /**
     * Returns true iff every entry above a pivot is in (-pivot, 0].
     */
    public static boolean isNormalized(final long[][] h) {
        for (int i = 0; i < h.length; i++) {
            final int j = firstNonZero(h[i]);
            if (j < 0) {
                break;
            }
            for (int k = 0; k < i; k++) {
                if (h[k][j] > 0 || (h[k][j] < 0 && Math.abs(h[k][j]) >= h[i][j])) {
                    return false;
                }
            }
        }
        return true;
    }

    private static int firstNonZero(final long[] row) {
        for (int j = 0; j < row.length; j++) {
            if (row[j] != 0) {
                return j;
            }
        }
        return -1;
    }

    private static BigInteger floorDiv(final BigInteger x, final BigInteger positive) {
        final BigInteger[] qr = x.divideAndRemainder(positive);
        return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
    }

    /**
     * Returns {g, s, t} with s * a + t * b == g == gcd(a, b) and g > 0. Not both a and b may be zero.
     */
    static BigInteger[] extendedGcd(final BigInteger a, final BigInteger b) {
        BigInteger oldR = a;
        BigInteger r = b;
        BigInteger oldS = BigInteger.ONE;
        BigInteger s = BigInteger.ZERO;
        BigInteger oldT = BigInteger.ZERO;
        BigInteger t = BigInteger.ONE;
        while (r.signum() != 0) {
            final BigInteger q = oldR.divide(r);
            BigInteger tmp = r;
            r = oldR.subtract(q.multiply(r));
            oldR = tmp;
            tmp = s;
            s = oldS.subtract(q.multiply(s));
            oldS = tmp;
            tmp = t;
            t = oldT.subtract(q.multiply(t));
            oldT = tmp;
        }
        if (oldR.signum() < 0) {
            return new BigInteger[]{oldR.negate(), oldS.negate(), oldT.negate()};
        }
        return new BigInteger[]{oldR, oldS, oldT};
    }
}
