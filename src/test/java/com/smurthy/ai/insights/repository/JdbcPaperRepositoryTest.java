package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.PaperField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcPaperRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcPaperRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcPaperRepository(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should overwrite only the given fields of the internal paper")
    void testUpdateInternal() {
        // Given
        Map<PaperField, String> fields = new EnumMap<>(PaperField.class);
        fields.put(PaperField.JOURNAL, "The Lancet");
        fields.put(PaperField.EMAIL, "a@b.com");
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);

        // When
        boolean updated = repository.updateInternal("i1", fields);

        // Then
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).update(sql.capture(), args.capture());
        assertThat(updated).isTrue();
        assertThat(sql.getValue())
                .isEqualTo("UPDATE internal_surgeon_papers SET journal = ?, email = ?, updated_at = ? WHERE id = ?");
        assertThat(args.getValue()).containsExactly("The Lancet", "a@b.com", Timestamp.from(NOW), "i1");
    }

    @Test
    @DisplayName("Should skip the update when there is nothing to change")
    void testUpdateInternalNothing() {
        assertThat(repository.updateInternal("i1", Map.of())).isFalse();
        verifyNoInteractions(jdbcTemplate);
    }
}
