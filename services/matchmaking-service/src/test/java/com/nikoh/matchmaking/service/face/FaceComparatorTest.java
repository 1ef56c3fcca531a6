package com.nikoh.matchmaking.service.face;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("FaceComparator Tests")
class FaceComparatorTest {

    private final FaceComparator comparator = new FaceComparator();

    static FaceEmbedding randomEmbedding(long seed) {
        Random random = new Random(seed);
        float[] values = new float[FaceEmbedding.DIMENSION];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) random.nextGaussian();
        }
        return FaceEmbedding.of(values);
    }

    static FaceEmbedding constant(float value) {
        float[] values = new float[FaceEmbedding.DIMENSION];
        java.util.Arrays.fill(values, value);
        return FaceEmbedding.of(values);
    }

    @Nested
    @DisplayName("Similarity")
    class Similarity {

        @Test
        @DisplayName("Should score an embedding against itself near one")
        void shouldScoreSelfNearOne() {
            FaceEmbedding embedding = randomEmbedding(7);

            assertThat(comparator.similarity(embedding, embedding)).isGreaterThan(0.99);
        }

        @Test
        @DisplayName("Should be symmetric")
        void shouldBeSymmetric() {
            FaceEmbedding first = randomEmbedding(1);
            FaceEmbedding second = randomEmbedding(2);

            assertThat(comparator.similarity(first, second))
                    .isCloseTo(comparator.similarity(second, first), within(1e-12));
        }

        @Test
        @DisplayName("Should map opposite vectors to zero and unrelated vectors near one half")
        void shouldMapCosineOntoUnitRange() {
            // Given
            FaceEmbedding positive = constant(1.0f);
            FaceEmbedding negative = constant(-1.0f);

            // When / Then
            assertThat(comparator.similarity(positive, negative)).isCloseTo(0.0, within(1e-9));
            assertThat(comparator.similarity(randomEmbedding(3), randomEmbedding(4))).isCloseTo(0.5, within(0.1));
        }

        @Test
        @DisplayName("Should ignore vector magnitude")
        void shouldIgnoreMagnitude() {
            assertThat(comparator.similarity(constant(0.1f), constant(25.0f))).isCloseTo(1.0, within(1e-6));
        }

        @Test
        @DisplayName("Should return zero for missing or zero embeddings")
        void shouldReturnZeroForDegenerateInput() {
            FaceEmbedding embedding = randomEmbedding(5);

            assertThat(comparator.similarity(null, embedding)).isZero();
            assertThat(comparator.similarity(embedding, null)).isZero();
            assertThat(comparator.similarity(constant(0.0f), embedding)).isZero();
        }

        @Test
        @DisplayName("Should match only at or above the threshold")
        void shouldApplyThreshold() {
            FaceEmbedding embedding = randomEmbedding(9);

            assertThat(comparator.matches(embedding, embedding, 0.6)).isTrue();
            assertThat(comparator.matches(constant(1.0f), constant(-1.0f), 0.6)).isFalse();
        }
    }

    @Nested
    @DisplayName("Embedding serialization")
    class Serialization {

        @Test
        @DisplayName("Should store 512 little endian floats")
        void shouldStoreLittleEndianFloats() {
            // Given
            float[] values = new float[FaceEmbedding.DIMENSION];
            values[0] = 1.0f;

            // When
            byte[] bytes = FaceEmbedding.of(values).toBytes();

            // Then
            assertThat(bytes).hasSize(2048);
            // 1.0f is 0x3F800000
            assertThat(bytes[0]).isZero();
            assertThat(bytes[1]).isZero();
            assertThat(bytes[2]).isEqualTo((byte) 0x80);
            assertThat(bytes[3]).isEqualTo((byte) 0x3F);
        }

        @Test
        @DisplayName("Should restore the same values from stored bytes")
        void shouldRestoreValues() {
            FaceEmbedding original = randomEmbedding(11);

            assertThat(FaceEmbedding.fromBytes(original.toBytes())).isEqualTo(original);
        }

        @Test
        @DisplayName("Should reject vectors of the wrong size")
        void shouldRejectWrongSize() {
            assertThatThrownBy(() -> FaceEmbedding.of(new float[128]))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("512");
            assertThatThrownBy(() -> FaceEmbedding.fromBytes(new byte[100]))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should normalise to unit length")
        void shouldNormalise() {
            assertThat(constant(3.0f).normalized().norm()).isCloseTo(1.0, within(1e-5));
            assertThat(constant(0.0f).normalized().norm()).isZero();
        }
    }
}
