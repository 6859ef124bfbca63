package com.umitunal.sendlater.serialization;

import com.umitunal.sendlater.model.DeliveryPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class PayloadCodecTest {

    @Test
    @DisplayName("Should encode delivery payloads with Kryo")
    void testKryoPayload() {
        // Given
        PayloadCodec<DeliveryPayload> codec = PayloadCodec.named("kryo", DeliveryPayload.class);
        DeliveryPayload original = new DeliveryPayload("2000000001", "Meeting at 10:00 🚀");

        // When
        DeliveryPayload decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(codec).isInstanceOf(KryoCodec.class);
        assertThat(decoded).isEqualTo(original);
    }

    @Test
    @DisplayName("Should write delivery payloads as snake_case JSON")
    void testJsonPayload() {
        // Given
        PayloadCodec<DeliveryPayload> codec = PayloadCodec.named("JSON", DeliveryPayload.class);

        // When
        String json = new String(codec.encode(new DeliveryPayload("7", "hi")), UTF_8);

        // Then
        assertThat(json).contains("\"recipient_id\":\"7\"").contains("\"message\":\"hi\"");
        assertThat(codec.decode(json.getBytes(UTF_8)))
                .isEqualTo(new DeliveryPayload("7", "hi"));
    }

    @Test
    @DisplayName("Should wrap unreadable bytes in CodecException")
    void testCorruptBytes() {
        // Given
        PayloadCodec<DeliveryPayload> json = new JsonCodec<>(DeliveryPayload.class);

        // When / Then
        assertThatThrownBy(() -> json.decode(new byte[]{'{', 'x'}))
                .isInstanceOf(CodecException.class);
    }

    @Test
    @DisplayName("Should name unannotated properties in snake_case and leave out nulls")
    void testMapperConventions() {
        // Given
        PayloadCodec<LinkNote> codec = new JsonCodec<>(LinkNote.class);
        LinkNote note = new LinkNote();
        note.setLinkedAt(1_700_000_000_000L);

        // When
        String json = new String(codec.encode(note), UTF_8);

        // Then
        assertThat(json).isEqualTo("{\"linked_at\":1700000000000}");
        assertThat(codec.decode("{\"linked_at\":5,\"added_later\":true}".getBytes(UTF_8)).getLinkedAt())
                .isEqualTo(5L);
    }

    @Test
    @DisplayName("Should refuse null rows in both directions")
    void testNullRows() {
        // Given
        PayloadCodec<DeliveryPayload> json = new JsonCodec<>(DeliveryPayload.class);

        // When / Then
        assertThatThrownBy(() -> json.encode(null)).isInstanceOf(CodecException.class);
        assertThatThrownBy(() -> json.decode("null".getBytes(UTF_8)))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("DeliveryPayload");
    }

    @Test
    @DisplayName("Should reject unknown codec names")
    void testUnknownCodec() {
        assertThatThrownBy(() -> PayloadCodec.named("xml", DeliveryPayload.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xml");
    }

    public static class LinkNote {
        private long linkedAt;
        private String comment;

        public long getLinkedAt() { return linkedAt; }
        public void setLinkedAt(long linkedAt) { this.linkedAt = linkedAt; }
        public String getComment() { return comment; }
        public void setComment(String comment) { this.comment = comment; }
    }
}
