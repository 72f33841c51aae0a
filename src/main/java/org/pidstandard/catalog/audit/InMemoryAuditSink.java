package org.pidstandard.catalog.audit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 内存版审计存储（单进程）。
 * <p>
 * 新记录追加到队尾；查询时从队尾向前遍历，时间戳相同的记录保持“后写入的在前”。
 */
public class InMemoryAuditSink implements AuditSink {

    private final ConcurrentLinkedDeque<AuditLogEntry> entries = new ConcurrentLinkedDeque<>();

    @Override
    public void record(AuditLogEntry entry) {
        entries.addLast(Objects.requireNonNull(entry, "entry"));
    }

    @Override
    public void recordAll(List<AuditLogEntry> batch) {
        // 先整体校验，再一次性追加：要么全部写入，要么一条都不写
        List<AuditLogEntry> copy = List.copyOf(batch);
        entries.addAll(copy);
    }

    @Override
    public List<AuditLogEntry> query(String projectId, AuditQuery query) {
        AuditQuery q = query == null ? AuditQuery.all() : query;
        List<AuditLogEntry> result = new ArrayList<>();
        Iterator<AuditLogEntry> it = entries.descendingIterator();
        while (it.hasNext()) {
            AuditLogEntry e = it.next();
            if (q.matches(projectId, e)) {
                result.add(e);
            }
        }
        // List.sort 是稳定排序
        result.sort(Comparator.comparing(AuditLogEntry::timestampUtc).reversed());
        if (q.limit() > 0 && result.size() > q.limit()) {
            return List.copyOf(result.subList(0, q.limit()));
        }
        return List.copyOf(result);
    }

    public int size() {
        return entries.size();
    }
}
