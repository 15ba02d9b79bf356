// file: storage/src/main/java/io/fset/storage/Schema.java
package io.fset.storage;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Table layout for the document tree.
 * <p>
 * KEY and ORDER are reserved words in H2 and are always quoted.
 * Fmodels cascade with their file; files reference their project.
 */
final class Schema {

    private static final String[] DDL = {
            """
            create table if not exists PROJECTS (
                ID bigint generated by default as identity primary key,
                ANCHOR varchar(255) not null,
                "KEY" varchar(255) not null,
                "ORDER" integer default 0 not null,
                DESCRIPTION varchar(4096),
                INSERTED_AT timestamp,
                UPDATED_AT timestamp,
                constraint PROJECTS_ANCHOR_UNIQUE unique (ANCHOR),
                constraint PROJECTS_KEY_UNIQUE unique ("KEY")
            )
            """,
            """
            create table if not exists FILES (
                ID bigint generated by default as identity primary key,
                ANCHOR varchar(255) not null,
                "KEY" varchar(255),
                "ORDER" integer default 0 not null,
                PROJECT_ID bigint not null,
                INSERTED_AT timestamp,
                UPDATED_AT timestamp,
                constraint FILES_ANCHOR_UNIQUE unique (ANCHOR),
                constraint FILES_KEY_PROJECT_UNIQUE unique ("KEY", PROJECT_ID),
                constraint FILES_PROJECT_FK foreign key (PROJECT_ID) references PROJECTS (ID)
            )
            """,
            """
            create table if not exists FMODELS (
                ID bigint generated by default as identity primary key,
                ANCHOR varchar(255) not null,
                TYPE varchar(255),
                "KEY" varchar(255),
                IS_ENTRY boolean default false not null,
                SCH character large object not null,
                FILE_ID bigint not null,
                constraint FMODELS_ANCHOR_UNIQUE unique (ANCHOR),
                constraint FMODELS_FILE_FK foreign key (FILE_ID) references FILES (ID) on delete cascade
            )
            """
    };

    private Schema() {
        // utility
    }

    static void create(Connection con) throws SQLException {
        try (Statement stmt = con.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        }
    }
}
