package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.ContractTemplate;
import com.smurthy.ai.insights.model.PatientOutcome;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcContractRepository implements ContractRepository {

    private static final String SELECT_COLUMNS = "SELECT template_id, name, description, outcome_type, "
            + "default_time_window, default_rebate_percent FROM contract_templates ";

    private static final RowMapper<ContractTemplate> ROW_MAPPER = (rs, rowNum) -> {
        String outcomeType = rs.getString("outcome_type");
        return new ContractTemplate(
                rs.getString("template_id"),
                rs.getString("name"),
                rs.getString("description"),
                PatientOutcome.fromCode(outcomeType)
                        .orElseThrow(() -> new IllegalStateException("Unknown outcome type: " + outcomeType)),
                rs.getInt("default_time_window"),
                rs.getInt("default_rebate_percent")
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcContractRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ContractTemplate> findAllTemplates() {
        return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY template_id", ROW_MAPPER);
    }

    @Override
    public Optional<ContractTemplate> findTemplate(String templateId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE template_id = ?", ROW_MAPPER, templateId)
                .stream()
                .findFirst();
    }
}
