package com.autolike.infrastructure.stream;

import com.autolike.domain.exception.StreamEventValidationException;
import com.autolike.domain.model.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StreamEventDecoderTest {

    private StreamEventDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new StreamEventDecoder(new ObjectMapper());
    }

    @Test
    void decode_post() {
        String line = "{\"data\":{\"id\":\"1500\",\"text\":\"hello\",\"source\":\"twittbot.net\","
                + "\"edit_history_tweet_ids\":[\"1500\"]},\"matching_rules\":[{\"id\":\"r9\",\"tag\":\"ID filter\"}]}";

        StreamEvent event = decoder.decode(line).orElseThrow();

        assertEquals("1500", event.getId());
        assertEquals("hello", event.getText());
        assertEquals("twittbot.net", event.getSource());
    }

    @Test
    void decode_keepAlive_yieldsNothing() {
        assertEquals(Optional.empty(), decoder.decode(""));
        assertEquals(Optional.empty(), decoder.decode("\r"));
    }

    @Test
    void decode_operationalNotice_yieldsNothing() {
        String notice = "{\"errors\":[{\"title\":\"operational-disconnect\",\"disconnect_type\":\"UpstreamOperationalDisconnect\"}]}";

        assertEquals(Optional.empty(), decoder.decode(notice));
    }

    @Test
    void decode_missingSource_isRejected() {
        assertThrows(StreamEventValidationException.class,
                () -> decoder.decode("{\"data\":{\"id\":\"1\",\"text\":\"t\"}}"));
    }

    @Test
    void decode_numericId_isRejected() {
        assertThrows(StreamEventValidationException.class,
                () -> decoder.decode("{\"data\":{\"id\":1,\"text\":\"t\",\"source\":\"s\"}}"));
    }

    @Test
    void decode_nonObjectData_isRejected() {
        assertThrows(StreamEventValidationException.class, () -> decoder.decode("{\"data\":[1,2]}"));
        assertThrows(StreamEventValidationException.class, () -> decoder.decode("[]"));
    }

    @Test
    void decode_invalidJson_isRejected() {
        assertThrows(StreamEventValidationException.class, () -> decoder.decode("{\"data\":"));
    }
}
