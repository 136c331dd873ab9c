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

import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.CHECKPOINT_POSITION;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_CHECKPOINT;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_NAME;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_VIEW;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.VIEW_ID;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.VIEW_PAYLOAD;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.es.internal.Suspicious;
import io.github.suppierk.es.projection.ViewStore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record2;

/**
 * {@link ViewStore} keeping views of one projection as JSON in a relational database.
 *
 * <p>A view and the checkpoint are saved in one transaction. The checkpoint only moves forward:
 * saving at a position which is not after the stored checkpoint fails, so two writers can never
 * both apply the same event.
 *
 * <p>Database failures surface as jOOQ's {@link org.jooq.exception.DataAccessException}.
 *
 * @param <V> the type of views, must be serializable by the given {@link ObjectMapper}
 */
public final class JooqViewStore<V> extends Suspicious implements ViewStore<V> {
  private final DSLContext dsl;
  private final String projectionName;
  private final Class<V> viewClass;
  private final ObjectMapper objectMapper;

  /**
   * @param dsl to execute queries with
   * @param projectionName owning the views
   * @param viewClass to deserialize views into
   * @param objectMapper to convert views with
   */
  public JooqViewStore(
      final DSLContext dsl,
      final String projectionName,
      final Class<V> viewClass,
      final ObjectMapper objectMapper) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSLContext");
    this.projectionName = throwIllegalArgumentIfBlank(projectionName, "Projection name");
    this.viewClass = throwIllegalArgumentIfNull(viewClass, "View class");
    this.objectMapper = throwIllegalArgumentIfNull(objectMapper, "Object mapper");
  }

  public String getProjectionName() {
    return projectionName;
  }

  /**
   * @param context to execute queries with, e.g. an ongoing transaction
   * @return a store of the same views working through the given context
   */
  public JooqViewStore<V> using(final DSLContext context) {
    return new JooqViewStore<>(context, projectionName, viewClass, objectMapper);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<V> find(final String viewId) {
    final String nonNullViewId = throwIllegalArgumentIfNull(viewId, "View ID");

    return dsl.select(VIEW_PAYLOAD)
        .from(PROJECTION_VIEW)
        .where(PROJECTION_NAME.eq(projectionName).and(VIEW_ID.eq(nonNullViewId)))
        .fetchOptional(VIEW_PAYLOAD)
        .map(this::read);
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, V> all() {
    final Map<String, V> views = new LinkedHashMap<>();

    for (Record2<String, String> view :
        dsl.select(VIEW_ID, VIEW_PAYLOAD)
            .from(PROJECTION_VIEW)
            .where(PROJECTION_NAME.eq(projectionName))
            .orderBy(VIEW_ID.asc())
            .fetch()) {
      views.put(view.value1(), read(view.value2()));
    }

    return Collections.unmodifiableMap(views);
  }

  /** {@inheritDoc} */
  @Override
  public void save(final String viewId, final V view, final long position) {
    final String nonNullViewId = throwIllegalArgumentIfNull(viewId, "View ID");
    final String payload = write(throwIllegalArgumentIfNull(view, "View"));

    dsl.transaction(
        (final Configuration trx) -> {
          moveCheckpoint(trx.dsl(), position);

          final int updated =
              trx.dsl()
                  .update(PROJECTION_VIEW)
                  .set(VIEW_PAYLOAD, payload)
                  .where(PROJECTION_NAME.eq(projectionName).and(VIEW_ID.eq(nonNullViewId)))
                  .execute();

          if (updated == 0) {
            trx.dsl()
                .insertInto(PROJECTION_VIEW, PROJECTION_NAME, VIEW_ID, VIEW_PAYLOAD)
                .values(projectionName, nonNullViewId, payload)
                .execute();
          }
        });
  }

  private void moveCheckpoint(final DSLContext trx, final long position) {
    final int moved =
        trx.update(PROJECTION_CHECKPOINT)
            .set(CHECKPOINT_POSITION, position)
            .where(PROJECTION_NAME.eq(projectionName).and(CHECKPOINT_POSITION.lt(position)))
            .execute();

    if (moved == 1) {
      return;
    }

    if (trx.fetchExists(PROJECTION_CHECKPOINT, PROJECTION_NAME.eq(projectionName))) {
      throw new IllegalArgumentException(
          "Position %d is not after checkpoint %d".formatted(position, checkpoint(trx)));
    }

    // A concurrent first save is caught by the primary key
    trx.insertInto(PROJECTION_CHECKPOINT, PROJECTION_NAME, CHECKPOINT_POSITION)
        .values(projectionName, position)
        .execute();
  }

  /** {@inheritDoc} */
  @Override
  public long checkpoint() {
    return checkpoint(dsl);
  }

  private long checkpoint(final DSLContext context) {
    return context
        .select(CHECKPOINT_POSITION)
        .from(PROJECTION_CHECKPOINT)
        .where(PROJECTION_NAME.eq(projectionName))
        .fetchOptional(CHECKPOINT_POSITION)
        .orElse(0L);
  }

  /** {@inheritDoc} */
  @Override
  public void reset() {
    dsl.transaction(
        (final Configuration trx) -> {
          trx.dsl().deleteFrom(PROJECTION_VIEW).where(PROJECTION_NAME.eq(projectionName)).execute();
          trx.dsl()
              .deleteFrom(PROJECTION_CHECKPOINT)
              .where(PROJECTION_NAME.eq(projectionName))
              .execute();
        });
  }

  private String write(final V view) {
    try {
      return objectMapper.writeValueAsString(view);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to serialize view of projection '%s'".formatted(projectionName), e);
    }
  }

  private V read(final String payload) {
    try {
      return objectMapper.readValue(payload, viewClass);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to deserialize view of projection '%s'".formatted(projectionName), e);
    }
  }
}
