package io.github.suppierk.test;

import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.projection.ConsistencyMode;
import io.github.suppierk.es.projection.Projection;
import io.github.suppierk.es.store.EventFilter;
import java.util.concurrent.atomic.AtomicLong;

/** Counts events per stream, optionally failing on a given global position. */
public final class CountingProjection implements Projection<Long> {
  private final String name;
  private final ConsistencyMode consistency;
  private final boolean multiStream;
  private final AtomicLong failAtPosition;

  public CountingProjection(
      final String name, final ConsistencyMode consistency, final boolean multiStream) {
    this.name = name;
    this.consistency = consistency;
    this.multiStream = multiStream;
    this.failAtPosition = new AtomicLong(-1L);
  }

  public void failAt(final long position) {
    failAtPosition.set(position);
  }

  public void recover() {
    failAtPosition.set(-1L);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ConsistencyMode consistency() {
    return consistency;
  }

  @Override
  public boolean multiStream() {
    return multiStream;
  }

  @Override
  public EventFilter filter() {
    return EventFilter.all();
  }

  @Override
  public String viewId(final RecordedEvent event) {
    return event.streamId();
  }

  @Override
  public Long create(final RecordedEvent event) {
    return apply(event, 0L);
  }

  @Override
  public Long apply(final RecordedEvent event, final Long view) {
    if (event.globalPosition() == failAtPosition.get()) {
      throw new IllegalStateException("Cannot count event at " + event.globalPosition());
    }

    return view + 1;
  }
}
