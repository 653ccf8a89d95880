package io.sessionstore.postgres;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names of the two session tables, validated and quoted for interpolation into SQL.
 */
final class PostgresTables {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private final String schema;
    private final String sessions;
    private final String fields;

    PostgresTables(String schema, String sessions, String fields) {
        this.schema = schema == null ? null : checkIdentifier(schema, "schema");
        this.sessions = checkIdentifier(sessions, "sessions table");
        this.fields = checkIdentifier(fields, "fields table");
        if (sessions.equals(fields)) {
            throw new IllegalArgumentException("sessions and fields tables must differ");
        }
    }

    String schema() {
        return schema;
    }

    String sessionsName() {
        return sessions;
    }

    String fieldsName() {
        return fields;
    }

    /** Qualified, quoted name of the sessions table. */
    String sessions() {
        return qualify(sessions);
    }

    /** Qualified, quoted name of the fields table. */
    String fields() {
        return qualify(fields);
    }

    /** Primary key constraint of the sessions table; its violation signals an identifier collision. */
    String sessionsPrimaryKey() {
        return sessions + "_pkey";
    }

    static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    private String qualify(String table) {
        return schema == null ? quote(table) : quote(schema) + "." + quote(table);
    }

    private static String checkIdentifier(String name, String what) {
        Objects.requireNonNull(name, what);
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid " + what + " name: " + name);
        }
        return name;
    }
}
