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

import static io.github.suppierk.es.store.jooq.EventStoreSchema.EVENT_ID;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.EVENT_STORE;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.EVENT_STORE_POSITION;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.EVENT_TYPE;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.GLOBAL_POSITION;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.LAST_POSITION;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.OCCURRED_AT;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.PAYLOAD;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.POSITION_ID;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.SCHEMA_VERSION;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.STREAM_ID;
import static io.github.suppierk.es.store.jooq.EventStoreSchema.STREAM_VERSION;

import io.github.suppierk.es.event.NewEvent;
import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.internal.Suspicious;
import io.github.suppierk.es.serialization.EventSerializer;
import io.github.suppierk.es.store.AppendResult;
import io.github.suppierk.es.store.ConcurrencyConflictException;
import io.github.suppierk.es.store.EventFilter;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.EventStoreException;
import io.github.suppierk.es.store.ExpectedVersion;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;

/**
 * {@link EventStore} on top of any relational database supported by jOOQ.
 *
 * <p>Append runs in a single transaction: the global position counter is locked, the current
 * version is read and compared with the expected one, and the events are inserted in one
 * statement. A concurrent writer which slipped in between is caught by the unique {@code
 * (stream_id, stream_version)} constraint, which is translated into a {@link
 * ConcurrencyConflictException} as well.
 *
 * <p>Holding the counter lock until commit serializes appends across streams. In exchange a
 * position is never committed after a higher one, so readers of {@link #readAll(EventFilter)}
 * relying on checkpoints cannot skip events.
 *
 * <p>{@link TransactionalAppendListener}s run inside the append transaction, after the events are
 * inserted.
 */
public final class JooqEventStore extends Suspicious implements EventStore {
  private final DSLContext dsl;
  private final EventSerializer serializer;
  private final List<TransactionalAppendListener> listeners;

  /**
   * Default constructor.
   *
   * @param dsl to execute queries with
   * @param serializer to convert payloads with
   */
  public JooqEventStore(final DSLContext dsl, final EventSerializer serializer) {
    this(dsl, serializer, List.of());
  }

  /**
   * @param dsl to execute queries with
   * @param serializer to convert payloads with
   * @param listeners to run inside every append transaction, in the given order
   */
  public JooqEventStore(
      final DSLContext dsl,
      final EventSerializer serializer,
      final List<TransactionalAppendListener> listeners) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSLContext");
    this.serializer = throwIllegalArgumentIfNull(serializer, "Event serializer");
    this.listeners = List.copyOf(throwIllegalArgumentIfNull(listeners, "Listeners"));
  }

  /** {@inheritDoc} */
  @Override
  public AppendResult append(
      final String streamId, final long expectedVersion, final List<NewEvent> events) {
    final String nonBlankStreamId = throwIllegalArgumentIfBlank(streamId, "Stream ID");
    final List<NewEvent> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");

    if (nonNullEvents.isEmpty()) {
      throw new IllegalArgumentException("Events cannot be empty");
    }

    if (expectedVersion < ExpectedVersion.ANY) {
      throw new IllegalArgumentException(
          "Expected version %d is invalid".formatted(expectedVersion));
    }

    // Serialization failures must surface before any statement is executed
    final List<String> payloads = new ArrayList<>(nonNullEvents.size());
    for (NewEvent event : nonNullEvents) {
      payloads.add(serializer.serialize(throwIllegalArgumentIfNull(event, "Event").payload()));
    }

    try {
      return dsl.transactionResult(
          (final Configuration trx) ->
              appendInTransaction(
                  trx.dsl(), nonBlankStreamId, expectedVersion, nonNullEvents, payloads));
    } catch (ConcurrencyConflictException e) {
      throw e;
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw new ConcurrencyConflictException(
            nonBlankStreamId, expectedVersion, currentVersion(nonBlankStreamId));
      }

      throw new EventStoreException(
          "Failed to append to stream '%s'".formatted(nonBlankStreamId), e);
    }
  }

  private AppendResult appendInTransaction(
      final DSLContext trx,
      final String streamId,
      final long expectedVersion,
      final List<NewEvent> events,
      final List<String> payloads) {
    final long lastPosition = reservePositions(trx, events.size());
    final long currentVersion = currentVersion(trx, streamId);

    if (expectedVersion != ExpectedVersion.ANY && expectedVersion != currentVersion) {
      throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion);
    }

    var insert =
        trx.insertInto(
            EVENT_STORE,
            GLOBAL_POSITION,
            STREAM_ID,
            STREAM_VERSION,
            EVENT_ID,
            EVENT_TYPE,
            SCHEMA_VERSION,
            PAYLOAD,
            OCCURRED_AT);

    final long firstPosition = lastPosition - events.size() + 1;
    final List<RecordedEvent> recorded = new ArrayList<>(events.size());

    for (int i = 0; i < events.size(); i++) {
      final NewEvent event = events.get(i);
      final long version = currentVersion + i + 1;

      insert =
          insert.values(
              firstPosition + i,
              streamId,
              version,
              event.eventId(),
              event.eventType(),
              event.schemaVersion(),
              payloads.get(i),
              event.occurredAt().atOffset(ZoneOffset.UTC));

      recorded.add(RecordedEvent.of(firstPosition + i, streamId, version, event));
    }

    insert.execute();

    if (!listeners.isEmpty()) {
      final JooqEventStore transactionalStore = new JooqEventStore(trx, serializer);
      for (TransactionalAppendListener listener : listeners) {
        listener.onAppend(trx, transactionalStore, recorded);
      }
    }

    return new AppendResult(streamId, currentVersion + events.size(), recorded);
  }

  /**
   * Moves the position counter forward, locking it until the transaction ends.
   *
   * @return the last reserved position
   */
  private long reservePositions(final DSLContext trx, final int amount) {
    final int updated =
        trx.update(EVENT_STORE_POSITION)
            .set(LAST_POSITION, LAST_POSITION.plus(amount))
            .where(POSITION_ID.eq(EventStoreSchema.POSITION_ROW_ID))
            .execute();

    if (updated != 1) {
      throw new IllegalStateException("Position counter is missing, was the schema created?");
    }

    return trx.select(LAST_POSITION)
        .from(EVENT_STORE_POSITION)
        .where(POSITION_ID.eq(EventStoreSchema.POSITION_ROW_ID))
        .fetchSingle(LAST_POSITION);
  }

  /** {@inheritDoc} */
  @Override
  public Stream<RecordedEvent> readStream(final String streamId, final long fromVersion) {
    final String nonBlankStreamId = throwIllegalArgumentIfBlank(streamId, "Stream ID");

    if (fromVersion < 0) {
      throw new IllegalArgumentException("Version cannot be negative");
    }

    try {
      return dsl.selectFrom(EVENT_STORE)
          .where(STREAM_ID.eq(nonBlankStreamId).and(STREAM_VERSION.gt(fromVersion)))
          .orderBy(STREAM_VERSION.asc())
          .fetchStream()
          .map(this::toRecordedEvent);
    } catch (DataAccessException e) {
      throw new EventStoreException(
          "Failed to read stream '%s'".formatted(nonBlankStreamId), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Stream<RecordedEvent> readAll(final EventFilter filter) {
    final EventFilter nonNullFilter = throwIllegalArgumentIfNull(filter, "Filter");

    Condition condition = GLOBAL_POSITION.gt(nonNullFilter.afterPosition());

    if (!nonNullFilter.eventTypes().isEmpty()) {
      condition = condition.and(EVENT_TYPE.in(nonNullFilter.eventTypes()));
    }

    if (nonNullFilter.streamIdPrefix() != null) {
      condition = condition.and(STREAM_ID.startsWith(nonNullFilter.streamIdPrefix()));
    }

    try {
      final var query =
          dsl.selectFrom(EVENT_STORE).where(condition).orderBy(GLOBAL_POSITION.asc());

      final Stream<Record> records =
          nonNullFilter.limit() > 0
              ? query.limit(nonNullFilter.limit()).fetchStream()
              : query.fetchStream();

      return records.map(this::toRecordedEvent);
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to read events", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String streamId) {
    final String nonBlankStreamId = throwIllegalArgumentIfBlank(streamId, "Stream ID");

    try {
      return currentVersion(dsl, nonBlankStreamId);
    } catch (DataAccessException e) {
      throw new EventStoreException(
          "Failed to read version of stream '%s'".formatted(nonBlankStreamId), e);
    }
  }

  private long currentVersion(final DSLContext context, final String streamId) {
    final Long version =
        context.fetchValue(
            DSL.select(DSL.max(STREAM_VERSION)).from(EVENT_STORE).where(STREAM_ID.eq(streamId)));
    return version == null ? 0L : version;
  }

  private RecordedEvent toRecordedEvent(final Record dbRecord) {
    final String eventType = dbRecord.get(EVENT_TYPE);
    final int schemaVersion = dbRecord.get(SCHEMA_VERSION);

    return new RecordedEvent(
        dbRecord.get(GLOBAL_POSITION),
        dbRecord.get(STREAM_ID),
        dbRecord.get(STREAM_VERSION),
        dbRecord.get(EVENT_ID),
        eventType,
        schemaVersion,
        serializer.deserialize(eventType, schemaVersion, dbRecord.get(PAYLOAD)),
        dbRecord.get(OCCURRED_AT).toInstant());
  }
}
