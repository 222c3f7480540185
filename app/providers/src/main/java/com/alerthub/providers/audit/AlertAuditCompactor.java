/*
 * どこで: アラート監査履歴
 * 何を: 連続する同一 (user_id, action, description) の監査イベントを 1 件に畳み込む
 * なぜ: 同じ操作の繰り返しで履歴画面が埋まらないようにするため
 */
package com.alerthub.providers.audit;

import com.alerthub.providers.model.AlertAuditEvent;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.StreamSupport;
import org.springframework.stereotype.Component;

/**
 * 畳み込みは隣接するイベント同士だけに適用し、並び順は変えない。残るのは連続区間の先頭イベントで、2 件以上を
 * 畳んだ場合のみ description に {@code " x{count}"} を付ける。
 */
@Component
public class AlertAuditCompactor {

  /** 入力を一度だけ走査する遅延シーケンスを返す。{@code iterator()} の度に先頭からやり直す。 */
  public Iterable<AlertAuditEvent> compact(Iterable<AlertAuditEvent> events) {
    Objects.requireNonNull(events, "events");
    return () -> new CompactingIterator(events.iterator());
  }

  public List<AlertAuditEvent> compactToList(Iterable<AlertAuditEvent> events) {
    return StreamSupport.stream(compact(events).spliterator(), false).toList();
  }

  static boolean isSameOccurrence(AlertAuditEvent left, AlertAuditEvent right) {
    return Objects.equals(left.userId(), right.userId())
        && Objects.equals(left.action(), right.action())
        && Objects.equals(left.description(), right.description());
  }

  private static final class CompactingIterator implements Iterator<AlertAuditEvent> {

    private final Iterator<AlertAuditEvent> source;
    private AlertAuditEvent pending;

    private CompactingIterator(Iterator<AlertAuditEvent> source) {
      this.source = source;
      this.pending = source.hasNext() ? source.next() : null;
    }

    @Override
    public boolean hasNext() {
      return pending != null;
    }

    @Override
    public AlertAuditEvent next() {
      if (pending == null) {
        throw new NoSuchElementException();
      }
      final AlertAuditEvent retained = pending;
      pending = null;
      int count = 1;
      while (source.hasNext()) {
        final AlertAuditEvent candidate = source.next();
        if (isSameOccurrence(retained, candidate)) {
          count++;
        } else {
          pending = candidate;
          break;
        }
      }
      if (count == 1) {
        return retained;
      }
      return retained.withDescription(retained.description() + " x" + count);
    }
  }
}
