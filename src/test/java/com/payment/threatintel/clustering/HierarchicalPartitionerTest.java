package com.payment.threatintel.clustering;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HierarchicalPartitionerTest {

    private final HierarchicalPartitioner partitioner = new HierarchicalPartitioner(3, 4.0);

    @Test
    void separatedBlobsGetDistinctLabels() {
        double[][] vectors = {
                {0.00, 0.00}, {0.01, 0.00}, {0.00, 0.01}, {0.01, 0.01},
                {50.00, 50.00}, {50.01, 50.00}, {50.00, 50.01}
        };

        int[] labels = partitioner.partition(vectors);

        assertThat(labels[0]).isNotEqualTo(HierarchicalPartitioner.NOISE);
        assertThat(labels[1]).isEqualTo(labels[0]);
        assertThat(labels[2]).isEqualTo(labels[0]);
        assertThat(labels[3]).isEqualTo(labels[0]);
        assertThat(labels[4]).isNotEqualTo(HierarchicalPartitioner.NOISE).isNotEqualTo(labels[0]);
        assertThat(labels[5]).isEqualTo(labels[4]);
        assertThat(labels[6]).isEqualTo(labels[4]);
    }

    @Test
    void undersizedGroupsAreNoise() {
        double[][] vectors = {
                {0.00, 0.00}, {0.01, 0.00}, {0.00, 0.01},
                {80.00, 0.00}, {80.01, 0.00},
                {0.00, 80.00}
        };

        int[] labels = partitioner.partition(vectors);

        assertThat(labels[0]).isEqualTo(0);
        assertThat(labels[3]).isEqualTo(HierarchicalPartitioner.NOISE);
        assertThat(labels[4]).isEqualTo(HierarchicalPartitioner.NOISE);
        assertThat(labels[5]).isEqualTo(HierarchicalPartitioner.NOISE);
    }

    @Test
    void tooFewSamplesAreAllNoise() {
        int[] labels = partitioner.partition(new double[][]{{1.0, 1.0}, {1.0, 1.0}});

        assertThat(labels).containsOnly(HierarchicalPartitioner.NOISE);
    }

    @Test
    void thresholdAboveTreeHeightYieldsOneGroup() {
        double[][] vectors = {{1.0, 1.0}, {1.0, 1.0}, {1.0, 1.0}, {1.0, 1.0}};

        int[] labels = partitioner.partition(vectors);

        assertThat(labels).containsOnly(0);
    }
}
