package org.pidstandard.catalog.renumber;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 待确认的重编号预览（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code pid_prepare_renumber}：生成预览与冲突报告，预览按 token 暂存。</li>
 *   <li>{@code pid_confirm_renumber}：调用方明确 {@code confirm=true} 后，用 token 取出同一份预览应用，
 *   保证预览与应用之间的候选顺序和新标签完全一致。</li>
 * </ol>
 * 每个 token 有 TTL，过期自动失效；一个 token 只能被取走一次。仅用于单实例场景。
 */
public class RenumberSessionStore {

    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, PendingRenumber> store = new ConcurrentHashMap<>();

    public RenumberSessionStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public PendingRenumber create(String projectId, RenumberPreview preview, ConflictReport report) {
        cleanupExpired();
        String token = UUID.randomUUID().toString();
        Instant now = clock.instant();
        PendingRenumber pending = new PendingRenumber(token, projectId, preview, report, now, now.plus(ttl));
        store.put(token, pending);
        return pending;
    }

    public PendingRenumber get(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingRenumber pending = store.get(token);
        if (pending == null) {
            return null;
        }
        if (pending.isExpired(clock.instant())) {
            store.remove(token);
            return null;
        }
        return pending;
    }

    public PendingRenumber remove(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingRenumber pending = store.remove(token);
        if (pending == null) {
            return null;
        }
        return pending.isExpired(clock.instant()) ? null : pending;
    }

    public int size() {
        return store.size();
    }

    private void cleanupExpired() {
        Instant now = clock.instant();
        for (Map.Entry<String, PendingRenumber> entry : store.entrySet()) {
            if (entry.getValue().isExpired(now)) {
                store.remove(entry.getKey());
            }
        }
    }

    public record PendingRenumber(
            String token,
            String projectId,
            RenumberPreview preview,
            ConflictReport conflicts,
            Instant createdAt,
            Instant expiresAt
    ) {
        public boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
