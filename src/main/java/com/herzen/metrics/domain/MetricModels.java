package com.herzen.metrics.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public class MetricModels {

    /**
     * Position in the component → lesson → namespace → program hierarchy.
     */
    public enum Level {
        COMPONENT, LESSON, NAMESPACE, PROGRAM;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isBelow(Level other) {
            return ordinal() < other.ordinal();
        }

        public static Level fromValue(String value) {
            if (value == null) throw new IllegalArgumentException("Level is required");
            for (Level level : values()) {
                if (level.value().equals(value.trim().toLowerCase(Locale.ROOT))) return level;
            }
            throw new IllegalArgumentException("Unknown level: " + value);
        }
    }

    public enum MultiplesPolicy {
        LAST("last"), FIRST("first"), MAX("max"), PASS_THROUGH("pass-through");

        private final String value;

        MultiplesPolicy(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static MultiplesPolicy fromValue(String value) {
            if (value == null || value.isBlank()) return LAST;
            for (MultiplesPolicy policy : values()) {
                if (policy.value.equals(value.trim())) return policy;
            }
            throw new IllegalArgumentException("Unknown multiples policy: " + value);
        }
    }

    /**
     * Which content items a metric considers. Serialized as the array form
     * {@code ["all"]}, {@code ["include", id...]} or {@code ["exclude", id...]}.
     */
    public sealed interface Coverage {

        List<String> toArray();

        record All() implements Coverage {
            @Override
            public List<String> toArray() {
                return List.of("all");
            }
        }

        record Include(Set<String> ids) implements Coverage {
            public Include {
                ids = Collections.unmodifiableSet(new TreeSet<>(ids));
            }

            @Override
            public List<String> toArray() {
                List<String> out = new ArrayList<>();
                out.add("include");
                out.addAll(ids);
                return out;
            }
        }

        record Exclude(Set<String> ids) implements Coverage {
            public Exclude {
                ids = Collections.unmodifiableSet(new TreeSet<>(ids));
            }

            @Override
            public List<String> toArray() {
                List<String> out = new ArrayList<>();
                out.add("exclude");
                out.addAll(ids);
                return out;
            }
        }

        static Coverage all() {
            return new All();
        }

        static Coverage fromArray(List<String> array) {
            if (array == null || array.isEmpty()) return new All();
            String kind = array.get(0) == null ? "" : array.get(0).trim().toLowerCase(Locale.ROOT);
            Set<String> ids = new TreeSet<>();
            array.stream().skip(1).filter(id -> id != null && !id.isBlank()).map(String::trim).forEach(ids::add);
            return switch (kind) {
                case "all" -> new All();
                case "include" -> new Include(ids);
                case "exclude" -> new Exclude(ids);
                default -> throw new IllegalArgumentException("Unknown coverage kind: " + array.get(0));
            };
        }
    }

    /**
     * A named scoring rule and its raw parameters, in declaration order.
     */
    public record Rule(String name, List<String> params) {
        public Rule {
            params = params == null ? List.of() : List.copyOf(params);
        }

        public static Rule of(String name, Object... params) {
            List<String> raw = new ArrayList<>();
            for (Object p : params) raw.add(String.valueOf(p));
            return new Rule(name, raw);
        }

        public static Rule fromArray(List<?> array) {
            if (array == null || array.isEmpty() || array.get(0) == null) return new Rule("average", List.of());
            List<String> params = array.stream().skip(1).map(String::valueOf).toList();
            return new Rule(String.valueOf(array.get(0)).trim(), params);
        }

        public List<Object> toArray() {
            List<Object> out = new ArrayList<>();
            out.add(name);
            out.addAll(params);
            return out;
        }
    }

    /**
     * Closed interval of accepted submission times, epoch milliseconds.
     */
    public record TimeFilter(long start, long end) {
        public static final TimeFilter UNBOUNDED = new TimeFilter(0L, 315_360_000_000_000L);

        public boolean contains(long timestamp) {
            return start <= timestamp && timestamp <= end;
        }
    }

    public record MetricDefinition(String id,
                                   String name,
                                   Level level,
                                   Coverage coverage,
                                   Rule rule,
                                   String submetricId,
                                   Map<String, Double> tagWeights,
                                   TimeFilter timeFilter,
                                   MultiplesPolicy multiples,
                                   boolean autoCompute,
                                   boolean visibleToStudent,
                                   Long lastUpdated) {
        public MetricDefinition {
            coverage = coverage == null ? Coverage.all() : coverage;
            rule = rule == null ? new Rule("average", List.of()) : rule;
            tagWeights = tagWeights == null ? null : Map.copyOf(tagWeights);
            timeFilter = timeFilter == null ? TimeFilter.UNBOUNDED : timeFilter;
            multiples = multiples == null ? MultiplesPolicy.LAST : multiples;
            submetricId = submetricId == null || submetricId.isBlank() ? null : submetricId;
        }

        public boolean hasSubmetric() {
            return submetricId != null;
        }

        public MetricDefinition withId(String newId) {
            return new MetricDefinition(newId, name, level, coverage, rule, submetricId, tagWeights,
                    timeFilter, multiples, autoCompute, visibleToStudent, lastUpdated);
        }
    }
}
