// file: storage/src/main/java/io/fset/storage/UpsertSql.java
package io.fset.storage;

import io.fset.core.reconcile.UpsertPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the MERGE statement behind each {@link UpsertPolicy}.
 * <p>
 * Generated shape (one parameter row per batch entry, in column order):
 * <pre>
 *   merge into FILES T
 *   using (values (cast(? as ...), ...)) as S(C0, C1, ...)
 *   on T.ANCHOR = S.C0
 *   when matched then update set "KEY" = coalesce(S.C1, T."KEY"), ...
 *   when not matched then insert (...) values (S.C0, S.C1, coalesce(S.C2, 0), ...)
 * </pre>
 * A NULL parameter means "attribute absent": the stored value survives on
 * conflict and the column default applies on insert.
 * <p>
 * Text parameters are cast without a length. An over-long value must fail the
 * column check (SQLState 22001), not be cut down before the ON match.
 */
final class UpsertSql {

    record Column(String attribute, String name, String sqlType, String insertDefault) {}

    static final List<Column> FILE_COLUMNS = List.of(
            new Column("anchor", "ANCHOR", "character varying", null),
            new Column("key", "\"KEY\"", "character varying", null),
            new Column("order", "\"ORDER\"", "integer", "0"),
            new Column("project_id", "PROJECT_ID", "bigint", null),
            new Column("inserted_at", "INSERTED_AT", "timestamp", null),
            new Column("updated_at", "UPDATED_AT", "timestamp", null)
    );

    static final List<Column> FMODEL_COLUMNS = List.of(
            new Column("anchor", "ANCHOR", "character varying", null),
            new Column("type", "TYPE", "character varying", null),
            new Column("key", "\"KEY\"", "character varying", null),
            new Column("is_entry", "IS_ENTRY", "boolean", "false"),
            new Column("sch", "SCH", "character large object", null),
            new Column("file_id", "FILE_ID", "bigint", null)
    );

    private UpsertSql() {
        // utility
    }

    static String merge(UpsertPolicy policy) {
        return switch (policy.entity()) {
            case FILE -> merge("FILES", FILE_COLUMNS, policy);
            case FMODEL -> merge("FMODELS", FMODEL_COLUMNS, policy);
        };
    }

    static String merge(String table, List<Column> columns, UpsertPolicy policy) {
        StringJoiner casts = new StringJoiner(", ");
        StringJoiner aliases = new StringJoiner(", ");
        for (int i = 0; i < columns.size(); i++) {
            casts.add("cast(? as " + columns.get(i).sqlType() + ")");
            aliases.add("C" + i);
        }

        StringJoiner on = new StringJoiner(" and ");
        for (String attr : policy.conflictTarget()) {
            int i = indexOf(columns, attr);
            on.add("T." + columns.get(i).name() + " = " + source(i));
        }

        StringJoiner set = new StringJoiner(", ");
        for (String attr : policy.replaceOnConflict()) {
            int i = indexOf(columns, attr);
            String name = columns.get(i).name();
            set.add(name + " = coalesce(" + source(i) + ", T." + name + ")");
        }

        StringJoiner insertCols = new StringJoiner(", ");
        StringJoiner insertVals = new StringJoiner(", ");
        for (int i = 0; i < columns.size(); i++) {
            Column c = columns.get(i);
            insertCols.add(c.name());
            insertVals.add(c.insertDefault() == null
                    ? source(i)
                    : "coalesce(" + source(i) + ", " + c.insertDefault() + ")");
        }

        return "merge into " + table + " T"
                + " using (values (" + casts + ")) as S(" + aliases + ")"
                + " on " + on
                + " when matched then update set " + set
                + " when not matched then insert (" + insertCols + ") values (" + insertVals + ")";
    }

    /** "?, ?, ?" with {@code n} placeholders. */
    static String placeholders(int n) {
        List<String> marks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            marks.add("?");
        }
        return String.join(", ", marks);
    }

    private static String source(int i) {
        return "S.C" + i;
    }

    private static int indexOf(List<Column> columns, String attribute) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).attribute().equals(attribute)) {
                return i;
            }
        }
        throw new IllegalArgumentException("no column for attribute " + attribute);
    }
}
