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
import laptrack.processing.matching.sparselap.costmatrix.SegmentLinkType;
import laptrack.processing.matching.sparselap.costmatrix.SegmentPoint;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of gap closing: label mapping applied to the table, chosen segment links and the cost matrix that was solved
 */
public class GapClosingResult {
    final LinkingCostMatrix<SegmentPoint, SegmentPoint> costMatrix;
    final Map<Integer, Integer> labelMapping;
    final List<SegmentLink> links;
    final boolean degraded;

    public GapClosingResult(LinkingCostMatrix<SegmentPoint, SegmentPoint> costMatrix, Map<Integer, Integer> labelMapping, List<SegmentLink> links, boolean degraded) {
        this.costMatrix = costMatrix;
        this.labelMapping = labelMapping;
        this.links = links;
        this.degraded = degraded;
    }

    public LinkingCostMatrix<SegmentPoint, SegmentPoint> getCostMatrix() {
        return costMatrix;
    }

    /**
     * @return old label to new label, for each segment
     */
    public Map<Integer, Integer> getLabelMapping() {
        return Collections.unmodifiableMap(labelMapping);
    }

    public List<SegmentLink> getLinks() {
        return Collections.unmodifiableList(links);
    }

    public List<SegmentLink> getLinks(SegmentLinkType type) {
        return links.stream().filter(l -> l.getType().equals(type)).collect(Collectors.toList());
    }

    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public String toString() {
        return "GapClosing: segments: "+labelMapping.size()+" gap-closing links: "+getLinks(SegmentLinkType.GAP_CLOSING).size()+" merge links: "+getLinks(SegmentLinkType.MERGE).size()+" split links: "+getLinks(SegmentLinkType.SPLIT).size()+(degraded?" (degraded)":"");
    }
}
