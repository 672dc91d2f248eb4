/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JDBC storage for {@linkplain io.crums.dbstream.TableStream}s.
 *
 * <h2>Overview</h2>
 * <p>
 * {@linkplain io.crums.dbstream.sql.SqlStoragePort} appends to and scans an
 * existing table over a single connection. Cursors are ephemeral unless a
 * cursor table is configured, in which case
 * {@linkplain io.crums.dbstream.sql.SqlCursorStore} persists them.
 * {@linkplain io.crums.dbstream.sql.StreamSchema} generates portable DDL for
 * both kinds of table.
 * </p><p>
 * For most uses, load a {@linkplain io.crums.dbstream.sql.StreamConfig} from
 * a properties file and open streams from a pooled
 * {@linkplain io.crums.dbstream.sql.StreamSource}.
 * </p>
 */
package io.crums.dbstream.sql;
