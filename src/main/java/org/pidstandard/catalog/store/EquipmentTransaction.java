package org.pidstandard.catalog.store;

import org.pidstandard.catalog.model.Equipment;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 设备存储上的一次写事务。
 * <p>
 * 语义：
 * <ul>
 *   <li>事务内的 {@link #update} 只对本事务可见，{@link #commit()} 时一次性发布。</li>
 *   <li>{@link #rollback()} 丢弃全部暂存修改；{@link #close()} 对未提交的事务等价于回滚。</li>
 *   <li>同一存储上的写事务互斥（串行化），避免两批重编号交错写入。</li>
 * </ul>
 */
public interface EquipmentTransaction extends AutoCloseable {

    /**
     * 读取设备，优先返回本事务内已暂存的版本。
     */
    Optional<Equipment> getById(String id);

    /**
     * 在事务内查询项目设备：已暂存的版本覆盖存储中的版本。
     * 写事务互斥，因此查询结果在提交前不会被其他写入方改变。
     */
    List<Equipment> findByProject(String projectId, Predicate<Equipment> predicate);

    /**
     * 暂存一条更新；设备必须已存在。
     *
     * @throws EquipmentStoreException 设备不存在或事务已结束
     */
    void update(Equipment equipment);

    void commit();

    void rollback();

    boolean isActive();

    @Override
    void close();
}
