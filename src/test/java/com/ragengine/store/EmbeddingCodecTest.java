package com.ragengine.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class EmbeddingCodecTest {

    @Test
    void shouldPreserveFloatBitsExactly() {
        float[] vector = { 0.1f, -0.0f, Float.NaN, Float.MIN_VALUE, Float.MAX_VALUE, Float.NEGATIVE_INFINITY, 1e-38f };

        float[] decoded = EmbeddingCodec.decode(EmbeddingCodec.encode(vector));

        assertEquals(vector.length, decoded.length);
        for (int i = 0; i < vector.length; i++) {
            assertEquals(Float.floatToRawIntBits(vector[i]), Float.floatToRawIntBits(decoded[i]), "index " + i);
        }
    }

    @Test
    void shouldWriteLittleEndianFloat32() {
        assertArrayEquals(new byte[] { 0, 0, (byte) 0x80, 0x3F }, EmbeddingCodec.encode(new float[] { 1.0f }));
        assertEquals(8, EmbeddingCodec.encode(new float[] { 1f, 2f }).length);
    }

    @Test
    void shouldDecodeMalformedBlobsAsEmpty() {
        assertEquals(0, EmbeddingCodec.decode(null).length);
        assertEquals(0, EmbeddingCodec.decode(new byte[0]).length);
        assertEquals(0, EmbeddingCodec.decode(new byte[] { 1, 2, 3 }).length);
    }
}
