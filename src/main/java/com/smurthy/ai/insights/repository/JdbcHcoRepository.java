package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.OrganizationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcHcoRepository implements HcoRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcHcoRepository.class);

    private static final String SELECT_COLUMNS = "SELECT id, name, state, region, treated_patients, ghost_patients, "
            + "address, city, zip_code, address_last_updated FROM hcos ";

    private static final Set<String> UPDATABLE_COLUMNS =
            Set.of(ADDRESS, CITY, STATE, ZIP_CODE, ADDRESS_LAST_UPDATED, UPDATED_AT);

    private static final RowMapper<OrganizationRecord> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp lastUpdated = rs.getTimestamp("address_last_updated");
        return new OrganizationRecord(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("state"),
                rs.getString("region"),
                rs.getInt("treated_patients"),
                rs.getInt("ghost_patients"),
                rs.getString("address"),
                rs.getString("city"),
                rs.getString("zip_code"),
                lastUpdated != null ? lastUpdated.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcHcoRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<OrganizationRecord> findByName(String name) {
        List<OrganizationRecord> exact = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE LOWER(name) = LOWER(?) LIMIT 1", ROW_MAPPER, name);
        if (!exact.isEmpty()) {
            return Optional.of(exact.get(0));
        }

        List<OrganizationRecord> partial = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE LOWER(name) LIKE ? ESCAPE '\\' ORDER BY name LIMIT 1",
                ROW_MAPPER, LikePatterns.contains(name));
        return partial.stream().findFirst();
    }

    @Override
    public List<OrganizationRecord> findTopByGhostPatients(int limit) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + "ORDER BY ghost_patients DESC, name ASC LIMIT ?", ROW_MAPPER, limit);
    }

    @Override
    public boolean updatePartial(String id, Map<String, Object> fields) {
        if (fields.isEmpty()) {
            return false;
        }

        StringBuilder sql = new StringBuilder("UPDATE hcos SET ");
        List<Object> args = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (!UPDATABLE_COLUMNS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Column is not updatable: " + entry.getKey());
            }
            if (!args.isEmpty()) {
                sql.append(", ");
            }
            sql.append(entry.getKey()).append(" = ?");
            Object value = entry.getValue();
            args.add(value instanceof Instant instant ? Timestamp.from(instant) : value);
        }
        sql.append(" WHERE id = ?");
        args.add(id);

        int rows = jdbcTemplate.update(sql.toString(), args.toArray());
        log.debug("Updated {} row(s) for HCO {} with columns {}", rows, id, fields.keySet());
        return rows > 0;
    }
}
