package com.herzen.metrics.repository;

import com.herzen.metrics.domain.ContentModels.ContentItem;
import com.herzen.metrics.domain.MetricModels.Level;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class ContentCatalogJdbcRepository {
    private static final RowMapper<ContentItem> ITEM_MAPPER = (rs, n) -> new ContentItem(
            rs.getString(1), Level.fromValue(rs.getString(2)), rs.getString(3), rs.getString(4));

    private final JdbcTemplate jdbcTemplate;

    public ContentCatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsertItems(List<ContentItem> items) {
        items.forEach(i -> jdbcTemplate.update(
                "MERGE INTO content_items(item_id, item_level, parent_id, tag) KEY(item_id) VALUES (?,?,?,?)",
                i.id(), i.level().value(), i.parentId(), i.tag()));
    }

    public List<ContentItem> loadAll() {
        return jdbcTemplate.query("SELECT item_id, item_level, parent_id, tag FROM content_items ORDER BY item_id", ITEM_MAPPER);
    }
}
