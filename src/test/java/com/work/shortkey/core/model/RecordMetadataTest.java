package com.work.shortkey.core.model;

import com.work.shortkey.core.support.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RecordMetadataTest {

    @Test
    public void tags_are_trimmed_and_deduplicated() {
        RecordMetadata m = RecordMetadata.of(null, Arrays.asList(" cat ", "cat", "dog"));
        assertEquals(Arrays.asList("cat", "dog"), m.getTags());
        assertTrue(m.getAttributes().isEmpty());
    }

    @Test
    public void invalid_entries_are_rejected() {
        Map<String, String> badKey = new HashMap<>();
        badKey.put("1abc", "v");
        assertThrows(IllegalArgumentException.class, () -> RecordMetadata.of(badKey, null));

        Map<String, String> tooMany = new HashMap<>();
        for (int i = 0; i <= RecordMetadata.MAX_ENTRIES; i++) {
            tooMany.put("k" + i, "v");
        }
        assertThrows(IllegalArgumentException.class, () -> RecordMetadata.of(tooMany, null));
        assertThrows(IllegalArgumentException.class, () -> RecordMetadata.of(null, Arrays.asList("ok", " ")));
    }

    @Test
    public void json_column_keeps_structure() {
        Map<String, String> attrs = new HashMap<>();
        attrs.put("camera", "x100");
        RecordMetadata m = RecordMetadata.of(attrs, Arrays.asList("raw"));

        assertEquals(m, JsonSupport.readMetadata(JsonSupport.writeMetadata(m)));
        assertNull(JsonSupport.readMetadata(null));
        assertNull(JsonSupport.writeMetadata(null));
    }
}
