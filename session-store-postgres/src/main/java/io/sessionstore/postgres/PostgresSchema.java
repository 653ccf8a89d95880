package io.sessionstore.postgres;

import java.util.ArrayList;
import java.util.List;

/**
 * DDL for the session tables.
 *
 * <p>{@code sessions} holds one row per session and its expiry. {@code session_kv} holds the fields; its
 * foreign key cascades renames and deletes of the session row.
 */
final class PostgresSchema {

    private PostgresSchema() {
    }

    static List<String> statements(PostgresTables t) {
        List<String> ddl = new ArrayList<>();
        if (t.schema() != null) {
            ddl.add("create schema if not exists " + PostgresTables.quote(t.schema()));
        }
        ddl.add("create table if not exists " + t.sessions() + " ("
                + " id text not null,"
                + " expires_at timestamptz,"
                + " created_at timestamptz not null default now(),"
                + " updated_at timestamptz not null default now(),"
                + " constraint " + PostgresTables.quote(t.sessionsPrimaryKey()) + " primary key (id))");
        ddl.add("create table if not exists " + t.fields() + " ("
                + " session_id text not null references " + t.sessions() + " (id)"
                + " on update cascade on delete cascade,"
                + " field_name text not null,"
                + " value bytea not null,"
                + " field_expires_at timestamptz,"
                + " hot_ttl_seconds bigint,"
                + " primary key (session_id, field_name))");
        ddl.add("create index if not exists " + PostgresTables.quote(t.sessionsName() + "_expires_idx")
                + " on " + t.sessions() + " (expires_at)");
        ddl.add("create index if not exists " + PostgresTables.quote(t.fieldsName() + "_expires_idx")
                + " on " + t.fields() + " (field_expires_at)");
        return ddl;
    }
}
