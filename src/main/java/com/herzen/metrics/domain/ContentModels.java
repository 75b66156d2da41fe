package com.herzen.metrics.domain;

import com.herzen.metrics.domain.MetricModels.Level;

import java.util.List;

public class ContentModels {
    public record ContentItem(String id, Level level, String parentId, String tag) {}

    public record ContentItemIn(String id, String level, String parentId, String tag) {}

    public record RegisterItemsRequest(List<ContentItemIn> items) {}

    public record RegisterItemsAck(int registered, long catalogVersion) {}
}
