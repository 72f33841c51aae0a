package org.pidstandard.catalog.store;

import org.pidstandard.catalog.model.Drawing;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Line;
import org.pidstandard.catalog.model.Project;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 设备目录的抽象存储。
 * <p>
 * 核心逻辑（重编号、层级视图、审计）只依赖这个接口；持久化技术由实现类决定。
 * 单条的 {@link #insert}/{@link #update} 为自动提交，批量修改必须走 {@link #beginTransaction()}。
 */
public interface EquipmentStore {

    /**
     * 查询某项目下满足条件的设备（包含软删除设备，由 predicate 自行过滤 {@code active}）。
     */
    List<Equipment> findByProject(String projectId, Predicate<Equipment> predicate);

    Optional<Equipment> getById(String id);

    void insert(Equipment equipment);

    void update(Equipment equipment);

    EquipmentTransaction beginTransaction();

    Optional<Project> findProject(String projectId);

    List<Project> findProjects();

    void saveProject(Project project);

    List<Drawing> findDrawings(String projectId);

    void saveDrawing(Drawing drawing);

    List<Line> findLines(String projectId);

    void saveLine(Line line);
}
