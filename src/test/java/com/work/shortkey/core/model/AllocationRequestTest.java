package com.work.shortkey.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AllocationRequestTest {

    private static final String FP = "0f".repeat(64);

    @Test
    public void extension_is_lowercased_with_leading_dot() {
        assertEquals(".jpg", AllocationRequest.extensionOf("Holiday.JPG"));
        assertEquals(".gz", AllocationRequest.extensionOf("dir/archive.tar.gz"));
        assertEquals("", AllocationRequest.extensionOf("README"));
        assertEquals("", AllocationRequest.extensionOf(".bashrc"));
        assertEquals("", AllocationRequest.extensionOf("trailing."));
    }

    @Test
    public void fingerprint_is_normalized_and_mime_defaults() {
        AllocationRequest request = AllocationRequest.of("  " + FP.toUpperCase() + " ", "a.bin", 0L, " ");
        assertEquals(FP, request.getFingerprint());
        assertEquals("application/octet-stream", request.getMimeType());
        assertNull(request.getMetadata());
    }

    @Test
    public void malformed_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of("abc", "a.png", 1L, null));
        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of(FP + "0", "a.png", 1L, null));
        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of(FP, " ", 1L, null));
        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of(FP, "a.png", -1L, null));
    }

    @Test
    public void values_wider_than_their_columns_are_rejected() {
        String longName = "x".repeat(AllocationRequest.MAX_FILENAME_LENGTH) + ".png";
        String longExtension = "a." + "e".repeat(AllocationRequest.MAX_EXTENSION_LENGTH);
        String longMime = "image/" + "p".repeat(AllocationRequest.MAX_MIME_TYPE_LENGTH);

        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of(FP, longName, 1L, null));
        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of(FP, longExtension, 1L, null));
        assertThrows(IllegalArgumentException.class, () -> AllocationRequest.of(FP, "a.png", 1L, longMime));

        String maxName = "y".repeat(AllocationRequest.MAX_FILENAME_LENGTH - 4) + ".png";
        assertEquals(maxName, AllocationRequest.of(FP, maxName, 1L, "image/png").getOriginalFilename());
    }
}
