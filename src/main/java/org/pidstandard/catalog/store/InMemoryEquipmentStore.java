package org.pidstandard.catalog.store;

import org.pidstandard.catalog.model.Drawing;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Line;
import org.pidstandard.catalog.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * 设备目录的内存版存储。
 * <p>
 * 并发模型：
 * <ul>
 *   <li>{@code writerLock}：写事务从 begin 到 commit/rollback 全程持有，保证同一时刻只有一个写事务（串行化）。
 *   自动提交的单条写入同样先拿这把锁。</li>
 *   <li>{@code dataLock}：读写锁，只在读取或发布修改的瞬间持有；提交时在写锁内一次性替换全部暂存记录，
 *   读方不会看到“提交了一半”的批次。</li>
 * </ul>
 * <p>
 * 注意：仅适用于单进程；写事务必须在开启它的线程上结束（{@link ReentrantLock} 的要求）。
 */
public class InMemoryEquipmentStore implements EquipmentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEquipmentStore.class);

    private final ReentrantLock writerLock = new ReentrantLock(true);
    private final ReentrantReadWriteLock dataLock = new ReentrantReadWriteLock();

    private final Map<String, Equipment> equipment = new LinkedHashMap<>();
    private final Map<String, Project> projects = new LinkedHashMap<>();
    private final Map<String, Drawing> drawings = new LinkedHashMap<>();
    private final Map<String, Line> lines = new LinkedHashMap<>();

    @Override
    public List<Equipment> findByProject(String projectId, Predicate<Equipment> predicate) {
        Predicate<Equipment> filter = predicate == null ? e -> true : predicate;
        dataLock.readLock().lock();
        try {
            List<Equipment> result = new ArrayList<>();
            for (Equipment e : equipment.values()) {
                if (Objects.equals(e.projectId(), projectId) && filter.test(e)) {
                    result.add(e);
                }
            }
            return result;
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public Optional<Equipment> getById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        dataLock.readLock().lock();
        try {
            return Optional.ofNullable(equipment.get(id));
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public void insert(Equipment item) {
        Objects.requireNonNull(item, "equipment");
        writerLock.lock();
        try {
            dataLock.writeLock().lock();
            try {
                if (equipment.containsKey(item.id())) {
                    throw new EquipmentStoreException("设备已存在：" + item.id());
                }
                equipment.put(item.id(), item);
            } finally {
                dataLock.writeLock().unlock();
            }
        } finally {
            writerLock.unlock();
        }
    }

    @Override
    public void update(Equipment item) {
        Objects.requireNonNull(item, "equipment");
        writerLock.lock();
        try {
            dataLock.writeLock().lock();
            try {
                if (!equipment.containsKey(item.id())) {
                    throw new EquipmentStoreException("设备不存在：" + item.id());
                }
                equipment.put(item.id(), item);
            } finally {
                dataLock.writeLock().unlock();
            }
        } finally {
            writerLock.unlock();
        }
    }

    @Override
    public EquipmentTransaction beginTransaction() {
        writerLock.lock();
        return new InMemoryTransaction();
    }

    @Override
    public Optional<Project> findProject(String projectId) {
        if (projectId == null) {
            return Optional.empty();
        }
        dataLock.readLock().lock();
        try {
            return Optional.ofNullable(projects.get(projectId));
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public List<Project> findProjects() {
        dataLock.readLock().lock();
        try {
            return List.copyOf(projects.values());
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public void saveProject(Project project) {
        put(projects, project.id(), project);
    }

    @Override
    public List<Drawing> findDrawings(String projectId) {
        dataLock.readLock().lock();
        try {
            return drawings.values().stream().filter(d -> Objects.equals(d.projectId(), projectId)).toList();
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public void saveDrawing(Drawing drawing) {
        put(drawings, drawing.id(), drawing);
    }

    @Override
    public List<Line> findLines(String projectId) {
        dataLock.readLock().lock();
        try {
            return lines.values().stream().filter(l -> Objects.equals(l.projectId(), projectId)).toList();
        } finally {
            dataLock.readLock().unlock();
        }
    }

    @Override
    public void saveLine(Line line) {
        put(lines, line.id(), line);
    }

    private <T> void put(Map<String, T> target, String id, T value) {
        Objects.requireNonNull(id, "id");
        dataLock.writeLock().lock();
        try {
            target.put(id, value);
        } finally {
            dataLock.writeLock().unlock();
        }
    }

    private final class InMemoryTransaction implements EquipmentTransaction {

        // 暂存的修改：提交前只对本事务可见
        private final Map<String, Equipment> staged = new LinkedHashMap<>();
        private boolean active = true;

        @Override
        public Optional<Equipment> getById(String id) {
            ensureActive();
            Equipment pending = staged.get(id);
            if (pending != null) {
                return Optional.of(pending);
            }
            return InMemoryEquipmentStore.this.getById(id);
        }

        @Override
        public List<Equipment> findByProject(String projectId, Predicate<Equipment> predicate) {
            ensureActive();
            Predicate<Equipment> filter = predicate == null ? e -> true : predicate;
            List<Equipment> result = new ArrayList<>();
            for (Equipment e : InMemoryEquipmentStore.this.findByProject(projectId, null)) {
                Equipment current = staged.getOrDefault(e.id(), e);
                if (Objects.equals(current.projectId(), projectId) && filter.test(current)) {
                    result.add(current);
                }
            }
            return result;
        }

        @Override
        public void update(Equipment item) {
            ensureActive();
            Objects.requireNonNull(item, "equipment");
            if (!staged.containsKey(item.id()) && InMemoryEquipmentStore.this.getById(item.id()).isEmpty()) {
                throw new EquipmentStoreException("设备不存在：" + item.id());
            }
            staged.put(item.id(), item);
        }

        @Override
        public void commit() {
            ensureActive();
            dataLock.writeLock().lock();
            try {
                equipment.putAll(staged);
            } finally {
                dataLock.writeLock().unlock();
            }
            log.debug("事务提交：{} 条设备记录", staged.size());
            finish();
        }

        @Override
        public void rollback() {
            if (!active) {
                return;
            }
            log.debug("事务回滚：丢弃 {} 条暂存修改", staged.size());
            finish();
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            rollback();
        }

        private void ensureActive() {
            if (!active) {
                throw new EquipmentStoreException("事务已结束");
            }
        }

        private void finish() {
            staged.clear();
            active = false;
            writerLock.unlock();
        }
    }
}
