/* 
 * Copyright (C) 2026 LAPTrack developers
 *
 * This File is part of LAPTrack
 *
 * LAPTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LAPTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LAPTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package laptrack.processing.matching.sparselap.costmatrix;

import laptrack.processing.matching.sparselap.linker.SparseCostMatrix;

import java.util.Collections;
import java.util.List;

/**
 * Admissible links between a list of sources and a list of targets, together with the cost of leaving a source or a target unlinked.
 * {@link #toSparse()} builds the square augmented matrix of Jaqaman et al., Nature Methods 2008:
 * <pre>
 *            targets        | source dummies
 * sources    links          | death (diagonal)
 * target     birth          | transposed link pattern
 * dummies    (diagonal)     | at cost 0
 * </pre>
 * The alternative diagonals guarantee that a perfect matching always exists.
 * @param <S> type of sources
 * @param <T> type of targets
 */
public class LinkingCostMatrix<S, T> {
    final List<S> sources;
    final List<T> targets;
    final int[] sourceIdx;
    final int[] targetIdx;
    final double[] costs;
    final double alternativeCost;

    /**
     *
     * @param sources sources
     * @param targets targets
     * @param sourceIdx source index of each admissible link
     * @param targetIdx target index of each admissible link
     * @param costs cost of each admissible link
     * @param alternativeCost cost of a birth or a death, should be larger than all link costs
     */
    public LinkingCostMatrix(List<S> sources, List<T> targets, int[] sourceIdx, int[] targetIdx, double[] costs, double alternativeCost) {
        if (sourceIdx.length!=targetIdx.length || sourceIdx.length!=costs.length) throw new IllegalArgumentException("link arrays should have the same length");
        if (!(alternativeCost>0) || Double.isInfinite(alternativeCost)) throw new IllegalArgumentException("alternative cost should be finite and positive. Got: "+alternativeCost);
        this.sources = sources;
        this.targets = targets;
        this.sourceIdx = sourceIdx;
        this.targetIdx = targetIdx;
        this.costs = costs;
        this.alternativeCost = alternativeCost;
    }

    public static <S, T> LinkingCostMatrix<S, T> empty(List<S> sources, List<T> targets) {
        return new LinkingCostMatrix<>(sources, targets, new int[0], new int[0], new double[0], 1);
    }

    public List<S> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public List<T> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    public int getLinkCount() {
        return costs.length;
    }

    public int getLinkSource(int link) {
        return sourceIdx[link];
    }

    public int getLinkTarget(int link) {
        return targetIdx[link];
    }

    public double getLinkCost(int link) {
        return costs[link];
    }

    public double getAlternativeCost() {
        return alternativeCost;
    }

    /**
     *
     * @return the augmented (N+M)x(M+N) cost matrix with N sources and M targets
     */
    public SparseCostMatrix toSparse() {
        final int n = sources.size();
        final int m = targets.size();
        final int nLinks = costs.length;
        final int size = 2 * nLinks + n + m;
        int[] rows = new int[size];
        int[] cols = new int[size];
        double[] c = new double[size];
        int k = 0;
        for (int l = 0; l<nLinks; ++l) {
            rows[k] = sourceIdx[l];
            cols[k] = targetIdx[l];
            c[k++] = costs[l];
            rows[k] = n + targetIdx[l];
            cols[k] = m + sourceIdx[l];
            c[k++] = 0;
        }
        for (int i = 0; i<n; ++i) {
            rows[k] = i;
            cols[k] = m + i;
            c[k++] = alternativeCost;
        }
        for (int j = 0; j<m; ++j) {
            rows[k] = n + j;
            cols[k] = j;
            c[k++] = alternativeCost;
        }
        return SparseCostMatrix.fromTriplets(rows, cols, c, n + m, n + m);
    }

    @Override
    public String toString() {
        return "LinkingCostMatrix: sources: "+sources.size()+" targets: "+targets.size()+" links: "+costs.length+" alternative cost: "+alternativeCost;
    }
}
