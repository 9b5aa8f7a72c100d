package ca.gc.cra.warden.application.isolation;

import ca.gc.cra.warden.domain.isolation.ActivityRecord;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Bounded, sequence-numbered ring of one project's recorded accesses. */
final class ActivityLog {
  private final int capacity;
  private final Deque<Entry> entries = new ArrayDeque<>();
  private long nextSequence;

  ActivityLog(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  synchronized long append(ActivityRecord record) {
    long sequence = nextSequence++;
    entries.addLast(new Entry(sequence, record));
    while (entries.size() > capacity) {
      entries.removeFirst();
    }
    return sequence;
  }

  /**
   * Records appended at or after {@code cursor}.
   *
   * @param cursor first sequence number of interest
   * @return batch plus the cursor to pass next time
   */
  synchronized Batch since(long cursor) {
    List<ActivityRecord> records = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.sequence() >= cursor) {
        records.add(entry.record());
      }
    }
    return new Batch(List.copyOf(records), nextSequence);
  }

  synchronized int countSince(Instant from) {
    int count = 0;
    for (Entry entry : entries) {
      if (!entry.record().timestamp().isBefore(from)) {
        count++;
      }
    }
    return count;
  }

  synchronized List<ActivityRecord> recent(int limit) {
    List<ActivityRecord> result = new ArrayList<>();
    var iterator = entries.descendingIterator();
    while (iterator.hasNext() && result.size() < limit) {
      result.add(iterator.next().record());
    }
    return result;
  }

  private record Entry(long sequence, ActivityRecord record) {}

  record Batch(List<ActivityRecord> records, long nextCursor) {}
}
