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
package laptrack.processing.matching;

import laptrack.processing.matching.sparselap.costmatrix.LinkingCostMatrix;

/**
 * Summary of one frame-to-frame linking step
 */
public class LinkingStep {
    final int t0, t1;
    final int links, births, deaths;
    final boolean degraded;
    final LinkingCostMatrix<double[], double[]> costMatrix;

    public LinkingStep(int t0, int t1, int links, int births, int deaths, boolean degraded, LinkingCostMatrix<double[], double[]> costMatrix) {
        this.t0 = t0;
        this.t1 = t1;
        this.links = links;
        this.births = births;
        this.deaths = deaths;
        this.degraded = degraded;
        this.costMatrix = costMatrix;
    }

    public int getT0() {
        return t0;
    }

    public int getT1() {
        return t1;
    }

    public int getLinkCount() {
        return links;
    }

    public int getBirthCount() {
        return births;
    }

    public int getDeathCount() {
        return deaths;
    }

    /**
     * @return true if the assignment failed and all detections at {@link #getT1()} received new labels
     */
    public boolean isDegraded() {
        return degraded;
    }

    public LinkingCostMatrix<double[], double[]> getCostMatrix() {
        return costMatrix;
    }

    @Override
    public String toString() {
        return "LinkingStep["+t0+"->"+t1+"] links: "+links+" births: "+births+" deaths: "+deaths+(degraded?" (degraded)":"");
    }
}
