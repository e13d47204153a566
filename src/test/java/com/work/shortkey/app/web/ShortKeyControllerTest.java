package com.work.shortkey.app.web;

import com.work.shortkey.core.ShortKeyComponent;
import com.work.shortkey.core.exception.KeyspaceExhaustedException;
import com.work.shortkey.core.exception.TransientStorageException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationRequest;
import com.work.shortkey.core.model.AllocationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ShortKeyControllerTest {

    private static final String FP = "cd".repeat(64);

    private ShortKeyComponent component;
    private MockMvc mvc;

    @BeforeEach
    public void setUp() {
        component = mock(ShortKeyComponent.class);
        mvc = MockMvcBuilders.standaloneSetup(new ShortKeyController(component), new AdminController(component))
                .setControllerAdvice(new ShortKeyExceptionHandler())
                .build();
    }

    private static AllocationRecord record() {
        AllocationRecord r = new AllocationRecord();
        r.setId(1L);
        r.setFingerprint(FP);
        r.setIdentifier("Ab12");
        r.setIdentifierLength(4);
        r.setOriginalFilename("a.png");
        r.setFileExtension(".png");
        r.setMimeType("image/png");
        r.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        return r;
    }

    private static String body(String fingerprint) {
        return "{\"fingerprint\":\"" + fingerprint + "\",\"originalFilename\":\"a.png\",\"fileSize\":10,"
                + "\"mimeType\":\"image/png\",\"tags\":[\"t1\"]}";
    }

    @Test
    public void new_allocation_is_201_and_dedup_hit_is_200() throws Exception {
        when(component.allocate(any(AllocationRequest.class)))
                .thenReturn(AllocationResult.assigned(record()))
                .thenReturn(AllocationResult.dedupHit(record()));

        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(body(FP)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.identifier").value("Ab12"))
                .andExpect(jsonPath("$.dedupHit").value(false));
        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(body(FP)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dedupHit").value(true));

        verify(component, times(2)).allocate(argThat((AllocationRequest r) ->
                r.getMetadata() != null && r.getMetadata().getTags().contains("t1")));
    }

    @Test
    public void malformed_requests_are_400() throws Exception {
        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(body("xyz")))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        verify(component, never()).allocate(any());
    }

    @Test
    public void oversized_file_info_is_400_before_allocation() throws Exception {
        String longName = "{\"fingerprint\":\"" + FP + "\",\"originalFilename\":\""
                + "n".repeat(1100) + ".png\",\"fileSize\":10}";
        String longExtension = "{\"fingerprint\":\"" + FP + "\",\"originalFilename\":\"a."
                + "e".repeat(80) + "\",\"fileSize\":10}";

        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(longName))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(longExtension))
                .andExpect(status().isBadRequest());
        verify(component, never()).allocate(any());
    }

    @Test
    public void exhausted_keyspace_is_507_and_transient_is_503() throws Exception {
        when(component.allocate(any(AllocationRequest.class)))
                .thenThrow(new KeyspaceExhaustedException("full", 12))
                .thenThrow(new TransientStorageException("down"));

        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(body(FP)))
                .andExpect(status().isInsufficientStorage())
                .andExpect(jsonPath("$.code").value("KEYSPACE_EXHAUSTED"));
        mvc.perform(post("/api/v1/short-keys").contentType(MediaType.APPLICATION_JSON).content(body(FP)))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    public void unknown_identifier_is_404() throws Exception {
        when(component.resolve(eq("zzzz"))).thenReturn(Optional.empty());
        when(component.resolve(eq("Ab12"))).thenReturn(Optional.of(record()));

        mvc.perform(get("/api/v1/short-keys/zzzz")).andExpect(status().isNotFound());
        mvc.perform(get("/api/v1/short-keys/Ab12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fingerprint").value(FP));
    }

    @Test
    public void admin_backfill_passes_limit() throws Exception {
        when(component.backfill(eq(50))).thenReturn(3);

        mvc.perform(post("/api/v1/admin/backfill").param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assigned").value(3));
    }
}
