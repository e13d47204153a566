package com.work.shortkey.app.web;

import com.work.shortkey.app.web.dto.ReservedKeyRequest;
import com.work.shortkey.app.web.dto.StatisticsView;
import com.work.shortkey.core.ShortKeyComponent;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运维接口：保留短键维护、手动回填、账本统计。
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final ShortKeyComponent component;

    public AdminController(ShortKeyComponent component) {
        this.component = component;
    }

    @PostMapping("/reserved-keys/reload")
    public ResponseEntity<Map<String, Object>> reloadReservedKeys() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", component.reloadReservedKeys());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/reserved-keys")
    public ResponseEntity<Map<String, Object>> addReservedKey(@Validated @RequestBody ReservedKeyRequest req) {
        boolean inserted = component.addReservedKey(req.getValue(), req.getReason());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("value", req.getValue());
        body.put("inserted", inserted);
        return ResponseEntity.status(inserted ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @PostMapping("/backfill")
    public ResponseEntity<Map<String, Object>> backfill(@RequestParam(value = "limit", defaultValue = "200") int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("assigned", component.backfill(limit));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/statistics")
    public ResponseEntity<StatisticsView> statistics() {
        return ResponseEntity.ok(ShortKeyViews.toView(component.statistics()));
    }
}
