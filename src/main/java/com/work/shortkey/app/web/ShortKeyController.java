package com.work.shortkey.app.web;

import com.work.shortkey.app.web.dto.AllocateRequest;
import com.work.shortkey.app.web.dto.BatchAllocateRequest;
import com.work.shortkey.app.web.dto.BatchItemView;
import com.work.shortkey.app.web.dto.OperationLogView;
import com.work.shortkey.app.web.dto.ShortKeyView;
import com.work.shortkey.app.web.dto.UploadInfoRequest;
import com.work.shortkey.core.ShortKeyComponent;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationRequest;
import com.work.shortkey.core.model.AllocationResult;
import com.work.shortkey.core.model.BatchItemOutcome;
import com.work.shortkey.core.model.OperationLogEntry;
import com.work.shortkey.core.model.RecordMetadata;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 上传流水线使用的短键接口：申请（含去重）、查询、解析、上传回写、状态迁移。
 */
@RestController
@RequestMapping("/api/v1/short-keys")
public class ShortKeyController {

    private final ShortKeyComponent component;

    public ShortKeyController(ShortKeyComponent component) {
        this.component = component;
    }

    /**
     * 新分配返回 201，去重命中返回 200。
     */
    @PostMapping
    public ResponseEntity<ShortKeyView> allocate(@Validated @RequestBody AllocateRequest req) {
        AllocationResult result = component.allocate(toRequest(req));
        ShortKeyView view = ShortKeyViews.toView(result.getRecord(), result.isDedupHit());
        return ResponseEntity.status(result.isDedupHit() ? HttpStatus.OK : HttpStatus.CREATED).body(view);
    }

    @PostMapping("/batch")
    public ResponseEntity<List<BatchItemView>> allocateBatch(@Validated @RequestBody BatchAllocateRequest req) {
        List<AllocationRequest> requests = new ArrayList<>(req.getItems().size());
        for (AllocateRequest item : req.getItems()) {
            requests.add(toRequest(item));
        }
        List<BatchItemView> views = new ArrayList<>(requests.size());
        for (BatchItemOutcome outcome : component.allocateAll(requests)) {
            views.add(ShortKeyViews.toView(outcome));
        }
        return ResponseEntity.ok(views);
    }

    @GetMapping("/by-fingerprint/{fingerprint}")
    public ResponseEntity<ShortKeyView> lookup(@PathVariable String fingerprint) {
        return toResponse(component.lookup(fingerprint));
    }

    /**
     * 解析短键并计一次访问；非 ACTIVE 记录视为不存在。
     */
    @GetMapping("/{identifier}")
    public ResponseEntity<ShortKeyView> resolve(@PathVariable String identifier) {
        return toResponse(component.resolve(identifier));
    }

    @PutMapping("/by-fingerprint/{fingerprint}/upload")
    public ResponseEntity<ShortKeyView> completeUpload(@PathVariable String fingerprint,
                                                       @Validated @RequestBody UploadInfoRequest req) {
        return toResponse(component.completeUpload(fingerprint, req.getStorageKey(), req.getUrl()));
    }

    @DeleteMapping("/by-fingerprint/{fingerprint}")
    public ResponseEntity<ShortKeyView> delete(@PathVariable String fingerprint) {
        return toResponse(component.delete(fingerprint));
    }

    @PostMapping("/by-fingerprint/{fingerprint}/archive")
    public ResponseEntity<ShortKeyView> archive(@PathVariable String fingerprint) {
        return toResponse(component.archive(fingerprint));
    }

    @GetMapping("/by-fingerprint/{fingerprint}/history")
    public ResponseEntity<List<OperationLogView>> history(@PathVariable String fingerprint) {
        List<OperationLogView> views = new ArrayList<>();
        for (OperationLogEntry e : component.history(fingerprint)) {
            views.add(ShortKeyViews.toView(e));
        }
        return ResponseEntity.ok(views);
    }

    private ResponseEntity<ShortKeyView> toResponse(Optional<AllocationRecord> record) {
        return record
                .map(r -> ResponseEntity.ok(ShortKeyViews.toView(r, false)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private AllocationRequest toRequest(AllocateRequest req) {
        RecordMetadata metadata = null;
        if ((req.getAttributes() != null && !req.getAttributes().isEmpty())
                || (req.getTags() != null && !req.getTags().isEmpty())) {
            metadata = RecordMetadata.of(req.getAttributes(), req.getTags());
        }
        return new AllocationRequest(req.getFingerprint(), req.getOriginalFilename(), req.getFileSize(),
                req.getMimeType(), metadata);
    }
}
