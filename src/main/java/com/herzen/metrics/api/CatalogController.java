package com.herzen.metrics.api;

import com.herzen.metrics.domain.ContentModels.ContentItem;
import com.herzen.metrics.domain.ContentModels.RegisterItemsAck;
import com.herzen.metrics.domain.ContentModels.RegisterItemsRequest;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.error.InvalidMetricDefinitionException;
import com.herzen.metrics.service.ContentCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final ContentCatalogService catalogService;

    public CatalogController(ContentCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping("/items")
    public ResponseEntity<RegisterItemsAck> register(@RequestBody RegisterItemsRequest request) {
        return ResponseEntity.ok(catalogService.register(request.items()));
    }

    @GetMapping("/items")
    public ResponseEntity<List<ContentItem>> items(@RequestParam String level) {
        Level parsed;
        try {
            parsed = Level.fromValue(level);
        } catch (IllegalArgumentException e) {
            throw new InvalidMetricDefinitionException(e.getMessage());
        }
        return ResponseEntity.ok(catalogService.itemsAtLevel(parsed));
    }
}
