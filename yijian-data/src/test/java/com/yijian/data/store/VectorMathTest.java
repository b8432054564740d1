package com.yijian.data.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class VectorMathTest {

    @Test
    void cosineIgnoresMagnitude() {
        assertThat(VectorMath.cosine(new float[]{1f, 1f}, new float[]{5f, 5f})).isEqualTo(1.0, offset(1e-9));
        assertThat(VectorMath.cosine(new float[]{1f, 0f}, new float[]{0f, 3f})).isEqualTo(0.0, offset(1e-9));
        assertThat(VectorMath.cosine(new float[]{0f, 0f}, new float[]{1f, 0f})).isZero();
    }

    @Test
    void cosineRejectsDimensionMismatch() {
        assertThatThrownBy(() -> VectorMath.cosine(new float[]{1f}, new float[]{1f, 2f}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pgvectorTextFormatIsParsedBack() {
        float[] vector = {0.25f, -1.5f, 3f};

        float[] parsed = VectorMath.parseVectorString(VectorMath.toVectorString(vector));

        assertThat(parsed).containsExactly(0.25f, -1.5f, 3f);
        assertThat(VectorMath.parseVectorString("[]")).isEmpty();
    }
}
