package com.payment.threatintel.features;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for FeatureEncoder: vector layout, normalisation and determinism.
 */
class FeatureEncoderTest {

    private static final int DIM = 64;
    private static final int BUCKETS = 128;
    private static final int SLOTS = 8;

    private FeatureEncoder encoder;

    @BeforeEach
    void setUp() {
        encoder = new FeatureEncoder(new HashedTokenEmbeddingModel(DIM), BUCKETS, SLOTS);
    }

    @Test
    void outputLengthIsEmbeddingPlusBucketsPlusSlots() {
        double[] v = encoder.encode("urgent loan verification otp", List.of("loan"), List.of(90.0));

        assertThat(v).hasSize(DIM + BUCKETS + SLOTS);
        assertThat(encoder.dimension()).isEqualTo(DIM + BUCKETS + SLOTS);
    }

    @Test
    void encodingIsDeterministic() {
        double[] a = encoder.encode("pay processing fee for job offer", List.of("job", "fee"), List.of(80.0, 70.0));
        double[] b = encoder.encode("pay processing fee for job offer", List.of("job", "fee"), List.of(80.0, 70.0));

        assertThat(Arrays.equals(a, b)).isTrue();
    }

    @Test
    void semanticPartIsUnitLength() {
        double[] v = encoder.encode("kyc update required immediately", List.of(), List.of());

        double[] semantic = Arrays.copyOfRange(v, 0, DIM);
        assertThat(VectorMath.norm(semantic)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void emptyMessageGivesZeroSemanticPart() {
        double[] v = encoder.encode("", List.of(), List.of());

        assertThat(VectorMath.norm(Arrays.copyOfRange(v, 0, DIM))).isZero();
    }

    @Test
    void keywordFlagSetsItsBucketCaseInsensitively() {
        double[] v = encoder.encode("x", List.of("OTP", " ", "otp"), List.of());

        int bucket = Math.floorMod("otp".hashCode(), BUCKETS);
        double[] keywordPart = Arrays.copyOfRange(v, DIM, DIM + BUCKETS);
        assertThat(keywordPart[bucket]).isEqualTo(1.0);
        assertThat(Arrays.stream(keywordPart).sum()).isEqualTo(1.0);
    }

    @Test
    void agentScoresAreScaledAndExtraAgentsDropped() {
        List<Double> scores = List.of(100.0, 50.0, 0.0, 10.0, 20.0, 30.0, 40.0, 60.0, 99.0, Double.NaN);
        double[] v = encoder.encode("x", List.of(), scores);

        double[] slots = Arrays.copyOfRange(v, DIM + BUCKETS, v.length);
        assertThat(slots).containsExactly(1.0, 0.5, 0.0, 0.1, 0.2, 0.3, 0.4, 0.6);
    }

    @Test
    void missingAgentsAreZeroFilled() {
        double[] v = encoder.encode("x", null, List.of(70.0));

        double[] slots = Arrays.copyOfRange(v, DIM + BUCKETS, v.length);
        assertThat(slots[0]).isEqualTo(0.7);
        assertThat(Arrays.copyOfRange(slots, 1, SLOTS)).containsOnly(0.0);
    }

    @Test
    void wrongEmbeddingLengthIsRejected() {
        EmbeddingModel broken = new EmbeddingModel() {
            @Override
            public double[] embed(String text) {
                return new double[3];
            }

            @Override
            public int dimension() {
                return 4;
            }
        };
        FeatureEncoder e = new FeatureEncoder(broken, BUCKETS, SLOTS);

        assertThatThrownBy(() -> e.encode("x", List.of(), List.of()))
                .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void similarMessagesAreCloserThanUnrelatedOnes() {
        double[] loan1 = encoder.encode("urgent loan approval pay fee", List.of(), List.of());
        double[] loan2 = encoder.encode("urgent loan approval processing fee", List.of(), List.of());
        double[] rent = encoder.encode("monthly rent for apartment", List.of(), List.of());

        assertThat(VectorMath.cosine(loan1, loan2)).isGreaterThan(VectorMath.cosine(loan1, rent));
    }
}
