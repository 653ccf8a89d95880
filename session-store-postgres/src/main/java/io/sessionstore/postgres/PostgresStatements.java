package io.sessionstore.postgres;

/**
 * SQL run by {@link PostgresSessionStore}, rendered once per table layout.
 *
 * <p>Every operation is a single statement. Expiry is always compared with the database's {@code now()},
 * and a TTL parameter of {@code null} yields a {@code null} timestamp ("no expiry").
 */
final class PostgresStatements {

    private static final String FROM_NOW = "now() + ?::bigint * interval '1 second'";

    /** Parameters: id, field. */
    final String get;

    /** Parameters: id. */
    final String getAll;

    /**
     * Parameters: id, field (purge); id, session ttl, insert-only flag, field (session row); field, value,
     * field ttl, hot ttl (field row). Returns the number of field rows written.
     */
    final String set;

    /**
     * Parameters: new id, session ttl, old id (rename); new id, session ttl (create); old id, field
     * (existing); old id, field, insert-only flag (displace); field, value, field ttl, hot ttl, insert-only
     * flag (write). Returns the number of field rows written.
     */
    final String setAndRename;

    /** Parameters: new id, session ttl, old id, new id. Returns renamed count and whether new id is taken. */
    final String rename;

    /**
     * Parameters: target id. Deletes the target's session row when it no longer counts as a session (expired,
     * or without live fields) so that a rename may take the identifier.
     */
    final String clearStaleTarget;

    /** Parameters: id, field, id, field, id. Returns whether a live field was removed. */
    final String remove;

    /** Parameters: id. Returns whether a live session was deleted. */
    final String delete;

    /** Parameters: ttl, id. Only a session with a live field is extended. */
    final String expire;

    /** Parameters: grace seconds for empty sessions. Returns the number of sessions removed. */
    final String purgeExpired;

    PostgresStatements(PostgresTables t) {
        String s = t.sessions();
        String k = t.fields();
        String liveSession = "(s.expires_at is null or s.expires_at > now())";
        String liveField = "(k.field_expires_at is null or k.field_expires_at > now())";

        get = "select k.value from " + k + " k join " + s + " s on s.id = k.session_id"
                + " where k.session_id = ? and k.field_name = ? and " + liveSession + " and " + liveField;

        getAll = "select k.field_name, k.value, k.hot_ttl_seconds,"
                + " ceil(extract(epoch from (least(k.field_expires_at, s.expires_at) - now())))::bigint"
                + " as remaining_seconds,"
                + " ceil(extract(epoch from (s.expires_at - now())))::bigint as session_seconds"
                + " from " + k + " k join " + s + " s on s.id = k.session_id"
                + " where k.session_id = ? and " + liveSession + " and " + liveField
                + " order by k.field_name";

        set = "with purge as ("
                + " delete from " + k + " k using " + s + " s"
                + " where s.id = ? and k.session_id = s.id and k.field_name <> ? and s.expires_at <= now()"
                + "), sess as ("
                + " insert into " + s + " as s (id, expires_at, created_at, updated_at)"
                + " values (?, " + FROM_NOW + ", now(), now())"
                + " on conflict (id) do update set"
                + " expires_at = case"
                + " when excluded.expires_at is not null then excluded.expires_at"
                + " when s.expires_at <= now() then null"
                + " else s.expires_at end,"
                + " updated_at = now()"
                + " where not ?::boolean or s.expires_at <= now() or not exists ("
                + " select 1 from " + k + " k where k.session_id = s.id and k.field_name = ? and " + liveField + ")"
                + " returning s.id"
                + "), written as ("
                + " insert into " + k + " (session_id, field_name, value, field_expires_at, hot_ttl_seconds)"
                + " select id, ?, ?, " + FROM_NOW + ", ?::bigint from sess"
                + " on conflict (session_id, field_name) do update set"
                + " value = excluded.value,"
                + " field_expires_at = excluded.field_expires_at,"
                + " hot_ttl_seconds = excluded.hot_ttl_seconds"
                + " returning 1"
                + ") select count(*) from written";

        // The renamed session's field rows still carry the old id until the cascade runs at the end of the
        // statement, so the row for the written field is removed under the old id first.
        setAndRename = "with renamed as ("
                + " update " + s + " s set id = ?,"
                + " expires_at = coalesce(" + FROM_NOW + ", s.expires_at),"
                + " updated_at = now()"
                + " where s.id = ? and " + liveSession
                + " and exists (select 1 from " + k + " k where k.session_id = s.id and " + liveField + ")"
                + " returning s.id"
                + "), created as ("
                + " insert into " + s + " (id, expires_at, created_at, updated_at)"
                + " select ?, " + FROM_NOW + ", now(), now()"
                + " where not exists (select 1 from renamed)"
                + " returning id"
                + "), target as ("
                + " select id from renamed union all select id from created"
                + "), existing as ("
                + " select 1 from " + k + " k"
                + " where k.session_id = ? and k.field_name = ? and " + liveField
                + " and exists (select 1 from renamed)"
                + "), displaced as ("
                + " delete from " + k + " k"
                + " where k.session_id = ? and k.field_name = ?"
                + " and (not ?::boolean or not exists (select 1 from existing))"
                + " and exists (select 1 from target)"
                + " returning 1"
                + "), written as ("
                + " insert into " + k + " (session_id, field_name, value, field_expires_at, hot_ttl_seconds)"
                + " select t.id, ?, ?, " + FROM_NOW + ", ?::bigint from target t"
                + " where not ?::boolean or not exists (select 1 from existing)"
                + " returning 1"
                + ") select count(*) from written";

        rename = "with renamed as ("
                + " update " + s + " s set id = ?,"
                + " expires_at = coalesce(" + FROM_NOW + ", s.expires_at),"
                + " updated_at = now()"
                + " where s.id = ? and " + liveSession
                + " and exists (select 1 from " + k + " k where k.session_id = s.id and " + liveField + ")"
                + " returning s.id"
                + ") select (select count(*) from renamed) as renamed,"
                + " exists (select 1 from " + s + " s where s.id = ? and " + liveSession + ") as taken";

        clearStaleTarget = "delete from " + s + " s where s.id = ? and not (" + liveSession
                + " and exists (select 1 from " + k + " k where k.session_id = s.id and " + liveField + "))";

        remove = "with removed as ("
                + " delete from " + k + " k where k.session_id = ? and k.field_name = ?"
                + " returning " + liveField + " as live"
                + "), dropped as ("
                + " delete from " + s + " s where s.id = ?"
                + " and exists (select 1 from removed)"
                + " and not exists (select 1 from " + k + " k"
                + " where k.session_id = s.id and k.field_name <> ? and " + liveField + ")"
                + " returning 1"
                + ") select coalesce(bool_or(r.live), false)"
                + " and exists (select 1 from " + s + " s where s.id = ? and " + liveSession + ")"
                + " from removed r";

        delete = "with dropped as ("
                + " delete from " + s + " s where s.id = ? returning " + liveSession + " as live"
                + ") select coalesce(bool_or(live), false) from dropped";

        expire = "update " + s + " s set expires_at = " + FROM_NOW + ", updated_at = now()"
                + " where s.id = ? and " + liveSession
                + " and exists (select 1 from " + k + " k where k.session_id = s.id and " + liveField + ")";

        purgeExpired = "with expired_fields as ("
                + " delete from " + k + " k where k.field_expires_at <= now()"
                + " returning 1"
                + "), expired_sessions as ("
                + " delete from " + s + " s where s.expires_at <= now()"
                + " or (s.updated_at < now() - ?::bigint * interval '1 second' and not exists ("
                + " select 1 from " + k + " k where k.session_id = s.id and " + liveField + "))"
                + " returning 1"
                + ") select count(*) from expired_sessions";
    }
}
