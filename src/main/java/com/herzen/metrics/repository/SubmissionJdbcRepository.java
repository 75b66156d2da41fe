package com.herzen.metrics.repository;

import com.herzen.metrics.domain.ScoreModels.Submission;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

@Repository
public class SubmissionJdbcRepository {
    private static final RowMapper<Submission> SUBMISSION_MAPPER = (rs, n) -> new Submission(
            rs.getLong(1), rs.getString(2), rs.getString(3), rs.getDouble(4), rs.getString(5), rs.getLong(6));

    private final JdbcTemplate jdbcTemplate;

    public SubmissionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Submission append(String learnerId, String itemId, double score, String tag, long timestamp) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO submissions(learner_id, item_id, score, tag, ts) VALUES (?,?,?,?,?)", new String[]{"id"});
            ps.setString(1, learnerId);
            ps.setString(2, itemId);
            ps.setDouble(3, score);
            if (tag == null) ps.setNull(4, Types.VARCHAR);
            else ps.setString(4, tag);
            ps.setLong(5, timestamp);
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return new Submission(key == null ? -1L : key.longValue(), learnerId, itemId, score, tag, timestamp);
    }

    public List<Submission> loadForLearner(String learnerId, Collection<String> itemIds) {
        if (itemIds.isEmpty()) return List.of();
        List<Object> args = new ArrayList<>();
        args.add(learnerId);
        args.addAll(itemIds);
        return jdbcTemplate.query(
                "SELECT id, learner_id, item_id, score, tag, ts FROM submissions WHERE learner_id = ? AND item_id IN ("
                        + placeholders(itemIds.size()) + ") ORDER BY id",
                SUBMISSION_MAPPER, args.toArray());
    }

    public List<String> learnersForItems(Collection<String> itemIds) {
        if (itemIds.isEmpty()) return List.of();
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT learner_id FROM submissions WHERE item_id IN (" + placeholders(itemIds.size()) + ") ORDER BY learner_id",
                String.class, itemIds.toArray());
    }

    private String placeholders(int count) {
        return java.util.stream.IntStream.range(0, count).mapToObj(i -> "?").collect(Collectors.joining(","));
    }
}
