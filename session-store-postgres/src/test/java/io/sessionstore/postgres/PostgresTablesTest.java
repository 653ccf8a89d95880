package io.sessionstore.postgres;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PostgresTablesTest {

    @Test
    void qualifiesAndQuotesNames() {
        PostgresTables tables = new PostgresTables("auth", "sessions", "session_kv");

        assertThat(tables.sessions()).isEqualTo("\"auth\".\"sessions\"");
        assertThat(tables.fields()).isEqualTo("\"auth\".\"session_kv\"");
        assertThat(tables.sessionsPrimaryKey()).isEqualTo("sessions_pkey");
    }

    @Test
    void leavesNamesUnqualifiedWithoutSchema() {
        PostgresTables tables = new PostgresTables(null, "web_sessions", "web_session_kv");

        assertThat(tables.sessions()).isEqualTo("\"web_sessions\"");
        assertThat(tables.schema()).isNull();
    }

    @Test
    void rejectsNamesThatCannotBeInterpolated() {
        assertThatThrownBy(() -> new PostgresTables(null, "sessions; drop table x", "kv"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sessions table");
        assertThatThrownBy(() -> new PostgresTables("a\"b", "sessions", "kv"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("schema");
        assertThatThrownBy(() -> new PostgresTables(null, "1sessions", "kv"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PostgresTables(null, "same", "same"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void schemaStatementsUseConfiguredNames() {
        PostgresTables tables = new PostgresTables("auth", "s", "kv");

        assertThat(PostgresSchema.statements(tables))
                .hasSize(5)
                .first().asString().isEqualTo("create schema if not exists \"auth\"");
        assertThat(PostgresSchema.statements(tables).get(1)).contains("constraint \"s_pkey\" primary key (id)");
        assertThat(PostgresSchema.statements(tables).get(2))
                .contains("references \"auth\".\"s\" (id) on update cascade on delete cascade");
        assertThat(PostgresSchema.statements(new PostgresTables(null, "s", "kv"))).hasSize(4);
    }

    @Test
    void statementsReferenceBothTables() {
        PostgresStatements sql = new PostgresStatements(new PostgresTables("auth", "s", "kv"));

        assertThat(sql.setAndRename).contains("\"auth\".\"s\"").contains("\"auth\".\"kv\"");
        assertThat(sql.get).doesNotContain("sessions");
        assertThat(sql.expire).startsWith("update \"auth\".\"s\"");
    }
}
