package com.privacygraph.common.serialization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingSerializationTest {

    private EmbeddingSerializer serializer;
    private EmbeddingDeserializer deserializer;

    @BeforeEach
    void setUp() {
        serializer = new EmbeddingSerializer();
        deserializer = new EmbeddingDeserializer();
    }

    @Test
    void testRoundTripKeepsVersionAndVector() {
        float[] vector = {0.1f, -0.25f, 3.5f, Float.MIN_VALUE};
        StoredEmbedding embedding = new StoredEmbedding(42L, vector);

        StoredEmbedding restored = deserializer.deserialize(serializer.serialize(embedding));

        assertEquals(42L, restored.entityVersion());
        assertArrayEquals(vector, restored.vector());
    }

    @Test
    void testSerializedSizeMatchesCalculation() {
        StoredEmbedding embedding = new StoredEmbedding(300L, new float[384]);
        Arrays.fill(embedding.vector(), 0.5f);

        byte[] bytes = serializer.serialize(embedding);

        // 300 -> 2 байта varint, 384 -> 2 байта varint
        assertEquals(2 + 2 + 384 * 4, bytes.length);
        assertEquals(bytes.length, serializer.calculateSize(embedding));
    }

    @Test
    void testVarintEncodingOfLargeValues() {
        ByteBuffer buffer = ByteBuffer.allocate(16);
        serializer.writeVarint(buffer, Long.MAX_VALUE);
        buffer.flip();

        assertEquals(Long.MAX_VALUE, deserializer.readVarint(buffer));
    }

    @Test
    void testTruncatedDataIsRejected() {
        byte[] bytes = serializer.serialize(new StoredEmbedding(1L, new float[]{1f, 2f, 3f}));
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 2);

        assertThrows(IllegalArgumentException.class, () -> deserializer.deserialize(truncated));
    }

    @Test
    void testNullInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> serializer.serialize(null));
        assertThrows(IllegalArgumentException.class, () -> deserializer.deserialize(null));
        assertThrows(IllegalArgumentException.class, () -> new StoredEmbedding(1L, new float[0]));
    }
}
