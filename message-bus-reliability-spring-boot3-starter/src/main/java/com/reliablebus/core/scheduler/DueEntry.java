package com.reliablebus.core.scheduler;

/**
 * 工作队列条目 (到期时间, 消息id, 代数)
 * 同一到期时间按入队顺序
 */
final class DueEntry implements Comparable<DueEntry> {

    final long dueMillis;

    final long seq;

    final String messageId;

    final long generation;

    DueEntry(long dueMillis, long seq, String messageId, long generation) {
        this.dueMillis = dueMillis;
        this.seq = seq;
        this.messageId = messageId;
        this.generation = generation;
    }

    @Override
    public int compareTo(DueEntry o) {
        int c = Long.compare(dueMillis, o.dueMillis);
        return c != 0 ? c : Long.compare(seq, o.seq);
    }
}
