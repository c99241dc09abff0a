package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.PatientOutcome;
import com.smurthy.ai.insights.model.PatientStats;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcPatientRepository implements PatientRepository {

    private static final String OVERVIEW_SQL = """
            SELECT COUNT(*) AS total,
                   COALESCE(AVG(age), 0) AS avg_age,
                   COALESCE(AVG(prior_lines), 0) AS avg_prior_lines,
                   SUM(CASE WHEN sex = 'M' THEN 1 ELSE 0 END) AS male_count,
                   SUM(CASE WHEN has_toxicity_30_day THEN 1 ELSE 0 END) AS toxicity_count,
                   SUM(CASE WHEN has_event_12_month THEN 1 ELSE 0 END) AS event_12m_count,
                   SUM(CASE WHEN has_retreatment_18_month THEN 1 ELSE 0 END) AS retreatment_18m_count
            FROM patients
            """;

    private static final String AGE_BUCKET_SQL = """
            SELECT CASE
                       WHEN age >= 80 THEN '80+'
                       WHEN age >= 70 THEN '70-79'
                       WHEN age >= 60 THEN '60-69'
                       ELSE '50-59'
                   END AS bucket,
                   COUNT(*) AS count
            FROM patients
            WHERE age >= 50
            GROUP BY bucket
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcPatientRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM patients", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public long countWithOutcome(PatientOutcome outcome) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM patients WHERE " + outcome.flagColumn() + " = TRUE", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public Optional<PatientStats> loadStats() {
        Map<String, Object> overview = jdbcTemplate.queryForMap(OVERVIEW_SQL);
        long total = asLong(overview.get("total"));
        if (total == 0) {
            return Optional.empty();
        }

        long maleCount = asLong(overview.get("male_count"));
        double avgPriorLines = asDouble(overview.get("avg_prior_lines"));

        return Optional.of(new PatientStats(
                total,
                Math.round(asDouble(overview.get("avg_age"))),
                Math.round(maleCount * 100.0 / total),
                Math.round(avgPriorLines * 10) / 10.0,
                distribution("SELECT payer_type AS label, COUNT(*) AS count FROM patients GROUP BY payer_type"),
                distribution("SELECT region AS label, COUNT(*) AS count FROM patients GROUP BY region"),
                ageBuckets(),
                asLong(overview.get("toxicity_count")),
                asLong(overview.get("event_12m_count")),
                asLong(overview.get("retreatment_18m_count"))
        ));
    }

    private Map<String, Long> distribution(String sql) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.queryForList(sql).forEach(row -> {
            Object label = row.get("label");
            counts.put(label == null ? "Unknown" : label.toString(), asLong(row.get("count")));
        });
        return counts;
    }

    private Map<String, Long> ageBuckets() {
        Map<String, Long> buckets = new LinkedHashMap<>();
        jdbcTemplate.queryForList(AGE_BUCKET_SQL)
                .forEach(row -> buckets.put((String) row.get("bucket"), asLong(row.get("count"))));
        return buckets;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }
}
