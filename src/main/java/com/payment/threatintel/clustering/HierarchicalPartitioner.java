package com.payment.threatintel.clustering;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import smile.clustering.HierarchicalClustering;
import smile.clustering.linkage.WardLinkage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ward-linkage agglomerative clustering cut at a fixed distance. Returns one label per sample;
 * {@link #NOISE} marks samples whose group is smaller than the minimum cluster size.
 */
@Slf4j
@Component
public class HierarchicalPartitioner {

    public static final int NOISE = -1;

    private final int minClusterSize;
    private final double distanceThreshold;

    public HierarchicalPartitioner(@Value("${threat-intel.clustering.min-cluster-size:3}") int minClusterSize,
                                   @Value("${threat-intel.clustering.distance-threshold:4.0}") double distanceThreshold) {
        this.minClusterSize = minClusterSize;
        this.distanceThreshold = distanceThreshold;
    }

    public int[] partition(double[][] vectors) {
        int n = vectors.length;
        int[] labels = new int[n];
        if (n < Math.max(minClusterSize, 2)) {
            Arrays.fill(labels, NOISE);
            return labels;
        }

        HierarchicalClustering hc = HierarchicalClustering.fit(WardLinkage.of(vectors));
        double[] heights = hc.getHeight();
        int[] raw;
        if (distanceThreshold > heights[heights.length - 1]) {
            raw = new int[n];
        } else {
            raw = hc.partition(distanceThreshold);
        }

        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(raw[i], k -> new ArrayList<>()).add(i);
        }

        Arrays.fill(labels, NOISE);
        int next = 0;
        for (List<Integer> members : groups.values()) {
            if (members.size() < minClusterSize) continue;
            for (int idx : members) labels[idx] = next;
            next++;
        }
        log.debug("Partitioned {} samples into {} groups (threshold={})", n, next, distanceThreshold);
        return labels;
    }
}
