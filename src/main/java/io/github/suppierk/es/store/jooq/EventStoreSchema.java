/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.store.jooq;

import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Describes the relational layout used by {@link JooqEventStore}.
 *
 * <p>One table keeps all events. {@code global_position} defines the global append order and
 * {@code (stream_id, stream_version)} is unique, which is the database-level guarantee behind
 * optimistic concurrency: two writers can never both append the same version of a stream.
 *
 * <p>Global positions are not an identity column: they are taken from the single row of {@code
 * event_store_position}, which every append updates first. The row lock is held until the append
 * commits, so positions become visible strictly in their order.
 *
 * <p>Projection tables are expected to live elsewhere and be rebuildable from this one.
 */
public final class EventStoreSchema {
  public static final Table<Record> EVENT_STORE = DSL.table(DSL.name("event_store"));

  public static final Field<Long> GLOBAL_POSITION =
      DSL.field(DSL.name("global_position"), SQLDataType.BIGINT);
  public static final Field<String> STREAM_ID =
      DSL.field(DSL.name("stream_id"), SQLDataType.VARCHAR(255));
  public static final Field<Long> STREAM_VERSION =
      DSL.field(DSL.name("stream_version"), SQLDataType.BIGINT);
  public static final Field<UUID> EVENT_ID = DSL.field(DSL.name("event_id"), SQLDataType.UUID);
  public static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(255));
  public static final Field<Integer> SCHEMA_VERSION =
      DSL.field(DSL.name("schema_version"), SQLDataType.INTEGER);
  public static final Field<String> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.CLOB);
  public static final Field<OffsetDateTime> OCCURRED_AT =
      DSL.field(DSL.name("occurred_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  public static final Table<Record> EVENT_STORE_POSITION =
      DSL.table(DSL.name("event_store_position"));

  public static final Field<Integer> POSITION_ID = DSL.field(DSL.name("id"), SQLDataType.INTEGER);
  public static final Field<Long> LAST_POSITION =
      DSL.field(DSL.name("last_position"), SQLDataType.BIGINT);

  static final int POSITION_ROW_ID = 1;

  private EventStoreSchema() {
    // No instance
  }

  /**
   * Creates the event tables and indexes if they do not exist yet.
   *
   * <p>Intended for tests and simple deployments, production databases usually rely on a
   * migration tool instead.
   *
   * @param dsl to execute DDL with
   */
  public static void create(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    dsl.createTableIfNotExists(EVENT_STORE)
        .column(GLOBAL_POSITION, SQLDataType.BIGINT.nullable(false))
        .column(STREAM_ID, SQLDataType.VARCHAR(255).nullable(false))
        .column(STREAM_VERSION, SQLDataType.BIGINT.nullable(false))
        .column(EVENT_ID, SQLDataType.UUID.nullable(false))
        .column(EVENT_TYPE, SQLDataType.VARCHAR(255).nullable(false))
        .column(SCHEMA_VERSION, SQLDataType.INTEGER.nullable(false))
        .column(PAYLOAD, SQLDataType.CLOB.nullable(false))
        .column(OCCURRED_AT, SQLDataType.TIMESTAMPWITHTIMEZONE.nullable(false))
        .constraints(
            DSL.constraint("pk_event_store").primaryKey(GLOBAL_POSITION),
            DSL.constraint("uk_event_store_stream_version").unique(STREAM_ID, STREAM_VERSION),
            DSL.constraint("uk_event_store_event_id").unique(EVENT_ID))
        .execute();

    dsl.createIndexIfNotExists("ix_event_store_event_type")
        .on(EVENT_STORE, EVENT_TYPE)
        .execute();

    dsl.createTableIfNotExists(EVENT_STORE_POSITION)
        .column(POSITION_ID, SQLDataType.INTEGER.nullable(false))
        .column(LAST_POSITION, SQLDataType.BIGINT.nullable(false))
        .constraints(DSL.constraint("pk_event_store_position").primaryKey(POSITION_ID))
        .execute();

    dsl.insertInto(EVENT_STORE_POSITION, POSITION_ID, LAST_POSITION)
        .select(
            DSL.select(DSL.inline(POSITION_ROW_ID), DSL.inline(0L))
                .whereNotExists(
                    DSL.selectOne()
                        .from(EVENT_STORE_POSITION)
                        .where(POSITION_ID.eq(POSITION_ROW_ID))))
        .execute();
  }

  /**
   * Deletes all events and restarts global positions.
   *
   * <p>Intended for tests only.
   *
   * @param dsl to execute statements with
   */
  public static void truncate(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    dsl.transaction(
        trx -> {
          trx.dsl().deleteFrom(EVENT_STORE).execute();
          trx.dsl()
              .update(EVENT_STORE_POSITION)
              .set(LAST_POSITION, 0L)
              .where(POSITION_ID.eq(POSITION_ROW_ID))
              .execute();
        });
  }
}
