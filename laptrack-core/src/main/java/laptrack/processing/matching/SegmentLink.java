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

import laptrack.processing.matching.sparselap.costmatrix.SegmentLinkType;

/**
 * Link chosen between two segments during gap closing. Labels are given before relabeling.
 */
public class SegmentLink {
    final SegmentLinkType type;
    final int sourceLabel, targetLabel;
    final int sourceTime, targetTime;
    final double cost;

    public SegmentLink(SegmentLinkType type, int sourceLabel, int sourceTime, int targetLabel, int targetTime, double cost) {
        this.type = type;
        this.sourceLabel = sourceLabel;
        this.targetLabel = targetLabel;
        this.sourceTime = sourceTime;
        this.targetTime = targetTime;
        this.cost = cost;
    }

    public SegmentLinkType getType() {
        return type;
    }

    public int getSourceLabel() {
        return sourceLabel;
    }

    public int getTargetLabel() {
        return targetLabel;
    }

    public int getSourceTime() {
        return sourceTime;
    }

    public int getTargetTime() {
        return targetTime;
    }

    public double getCost() {
        return cost;
    }

    @Override
    public String toString() {
        return type+": "+sourceLabel+"@"+sourceTime+" -> "+targetLabel+"@"+targetTime+" cost="+cost;
    }
}
