/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.phonepe.tierstore.sqlite.utils;

import com.phonepe.tierstore.core.errors.StorageError;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;

/**
 * JDBC plumbing shared by the SQLite stores
 */
@UtilityClass
@Slf4j
public class SqliteUtils {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    /**
     * Work to be done on an open connection
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Data source for a database file. The file is created on first connection.
     *
     * @param dbFile Database file
     * @return Data source handing out a fresh connection per call
     */
    public static DataSource dataSource(final Path dbFile) {
        final var config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        final var dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
        log.debug("Using SQLite database at {}", dbFile.toAbsolutePath());
        return dataSource;
    }

    /**
     * Runs the work in auto commit mode
     *
     * @throws StorageError IO_FAILURE wrapping any {@link SQLException}
     */
    public static <T> T withConnection(final DataSource dataSource, final SqlWork<T> work) {
        try (var connection = dataSource.getConnection()) {
            return work.apply(connection);
        }
        catch (SQLException e) {
            throw StorageError.ioFailure(e);
        }
    }

    /**
     * Runs the work in a single transaction. Any failure, including a {@link StorageError} raised by the work itself,
     * rolls the transaction back before it is rethrown.
     */
    public static <T> T inTransaction(final DataSource dataSource, final SqlWork<T> work) {
        return withConnection(dataSource, connection -> {
            connection.setAutoCommit(false);
            try {
                final var result = work.apply(connection);
                connection.commit();
                return result;
            }
            catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        });
    }

    /**
     * Runs DDL statements in order
     */
    public static void execute(final DataSource dataSource, final String... statements) {
        withConnection(dataSource, connection -> {
            try (var statement = connection.createStatement()) {
                for (final var sql : statements) {
                    statement.execute(sql);
                }
            }
            return null;
        });
    }

    /**
     * @return "?, ?, ?" with {@code count} placeholders
     */
    public static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
