package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.PaperCollection;
import com.smurthy.ai.insights.model.PaperField;
import com.smurthy.ai.insights.model.PaperRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Repository
public class JdbcPaperRepository implements PaperRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPaperRepository.class);

    private static final RowMapper<PaperRecord> ROW_MAPPER = (rs, rowNum) -> new PaperRecord(
            rs.getString("id"),
            rs.getString("title"),
            rs.getString("journal"),
            rs.getString("author_name"),
            rs.getString("affiliation"),
            rs.getString("website"),
            rs.getString("address"),
            rs.getString("email")
    );

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcPaperRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public List<PaperRecord> findByAuthor(PaperCollection collection, String authorName, int limit) {
        String sql = "SELECT id, title, journal, author_name, affiliation, website, address, email FROM "
                + collection.tableName()
                + " WHERE LOWER(author_name) LIKE ? ESCAPE '\\' ORDER BY title LIMIT ?";

        List<PaperRecord> papers = jdbcTemplate.query(sql, ROW_MAPPER, LikePatterns.contains(authorName), limit);
        log.info("Found {} {} papers for author: {}", papers.size(), collection.name().toLowerCase(Locale.ROOT), authorName);
        return papers;
    }

    @Override
    public boolean updateInternal(String id, Map<PaperField, String> fields) {
        if (fields.isEmpty()) {
            return false;
        }

        StringBuilder sql = new StringBuilder("UPDATE " + PaperCollection.INTERNAL.tableName() + " SET ");
        List<Object> args = new ArrayList<>();
        fields.forEach((field, value) -> {
            sql.append(field.column()).append(" = ?, ");
            args.add(value);
        });
        sql.append("updated_at = ? WHERE id = ?");
        args.add(Timestamp.from(clock.instant()));
        args.add(id);

        int rows = jdbcTemplate.update(sql.toString(), args.toArray());
        if (rows > 0) {
            log.info("Successfully updated internal paper {}", id);
        } else {
            log.warn("No changes made to internal paper {}", id);
        }
        return rows > 0;
    }

    @Override
    public boolean insertInternal(PaperRecord paper) {
        Timestamp now = Timestamp.from(clock.instant());
        String id = UUID.randomUUID().toString();

        int rows = jdbcTemplate.update(
                "INSERT INTO " + PaperCollection.INTERNAL.tableName()
                        + " (id, title, journal, author_name, affiliation, website, address, email, created_at, updated_at)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                id, paper.title(), paper.journal(), paper.authorName(), paper.affiliation(),
                paper.website(), paper.address(), paper.email(), now, now);

        if (rows > 0) {
            log.info("Added paper to internal collection: {} ({})", paper.title(), id);
        }
        return rows > 0;
    }
}
