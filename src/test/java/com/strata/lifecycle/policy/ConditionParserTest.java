package com.strata.lifecycle.policy;

import com.strata.domain.QueryCriteria;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConditionParser Tests")
class ConditionParserTest {
    
    @Test
    @DisplayName("Should parse equality with bare and quoted operands")
    void shouldParseEquals() {
        assertThat(ConditionParser.parse("status = deleted")).isEqualTo(QueryCriteria.eq("status", "deleted"));
        assertThat(ConditionParser.parse("status='pending review'"))
            .isEqualTo(QueryCriteria.eq("status", "pending review"));
        assertThat(ConditionParser.parse("region = \"eu-west\"")).isEqualTo(QueryCriteria.eq("region", "eu-west"));
    }
    
    @Test
    @DisplayName("Should type integer and instant operands")
    void shouldTypeOperands() {
        assertThat(ConditionParser.parse("score < 10")).isEqualTo(QueryCriteria.lessThan("score", 10L));
        assertThat(ConditionParser.parse("created_at < 2024-01-01T00:00:00Z"))
            .isEqualTo(QueryCriteria.lessThan("created_at", Instant.parse("2024-01-01T00:00:00Z")));
        assertThat(ConditionParser.parse("code = '42'")).isEqualTo(QueryCriteria.eq("code", "42"));
    }
    
    @Test
    @DisplayName("Should parse between as a range")
    void shouldParseBetween() {
        assertThat(ConditionParser.parse("amount BETWEEN 10 and 100"))
            .isEqualTo(QueryCriteria.range("amount", 10L, 100L));
    }
    
    @Test
    @DisplayName("Should reject unsupported conditions")
    void shouldRejectUnsupported() {
        assertThatThrownBy(() -> ConditionParser.parse("score > 10"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unsupported condition: score > 10");
        assertThatThrownBy(() -> ConditionParser.parse("  "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
