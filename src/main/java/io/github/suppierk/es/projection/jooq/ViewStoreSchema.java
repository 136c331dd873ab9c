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

package io.github.suppierk.es.projection.jooq;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Describes the relational layout used by {@link JooqViewStore}.
 *
 * <p>Views of all projections share one table keyed by {@code (projection_name, view_id)}, each
 * projection has one checkpoint row. Both can be dropped and rebuilt from the event table at any
 * time.
 */
public final class ViewStoreSchema {
  public static final Table<Record> PROJECTION_VIEW = DSL.table(DSL.name("projection_view"));
  public static final Table<Record> PROJECTION_CHECKPOINT =
      DSL.table(DSL.name("projection_checkpoint"));

  public static final Field<String> PROJECTION_NAME =
      DSL.field(DSL.name("projection_name"), SQLDataType.VARCHAR(255));
  public static final Field<String> VIEW_ID =
      DSL.field(DSL.name("view_id"), SQLDataType.VARCHAR(255));
  public static final Field<String> VIEW_PAYLOAD =
      DSL.field(DSL.name("view_payload"), SQLDataType.CLOB);
  public static final Field<Long> CHECKPOINT_POSITION =
      DSL.field(DSL.name("checkpoint_position"), SQLDataType.BIGINT);

  private ViewStoreSchema() {
    // No instance
  }

  /**
   * Creates the projection tables if they do not exist yet.
   *
   * @param dsl to execute DDL with
   */
  public static void create(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    dsl.createTableIfNotExists(PROJECTION_VIEW)
        .column(PROJECTION_NAME, SQLDataType.VARCHAR(255).nullable(false))
        .column(VIEW_ID, SQLDataType.VARCHAR(255).nullable(false))
        .column(VIEW_PAYLOAD, SQLDataType.CLOB.nullable(false))
        .constraints(
            DSL.constraint("pk_projection_view").primaryKey(PROJECTION_NAME, VIEW_ID))
        .execute();

    dsl.createTableIfNotExists(PROJECTION_CHECKPOINT)
        .column(PROJECTION_NAME, SQLDataType.VARCHAR(255).nullable(false))
        .column(CHECKPOINT_POSITION, SQLDataType.BIGINT.nullable(false))
        .constraints(DSL.constraint("pk_projection_checkpoint").primaryKey(PROJECTION_NAME))
        .execute();
  }
}
