package org.pidstandard.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pidstandard.catalog.model.Drawing;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Line;
import org.pidstandard.catalog.model.Project;
import org.pidstandard.catalog.store.EquipmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从 JSON 种子文件加载项目、图纸、管线与设备到存储中（启动时执行一次）。
 * <p>
 * 文件结构：
 * <pre>
 * {
 *   "projects":  [ { "id": "...", "name": "...", "taggingMode": "CUSTOM" } ],
 *   "drawings":  [ { "id": "...", "projectId": "...", "drawingNumber": "..." } ],
 *   "lines":     [ { "id": "...", "projectId": "...", "lineNumber": "...", "fromEquipmentId": "..." } ],
 *   "equipment": [ { "id": "...", "projectId": "...", "tag": "P-001", "equipmentType": "Pump" } ]
 * }
 * </pre>
 * 项目与设备未写 {@code active} 时按有效处理。
 */
public class CatalogSeedLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeedLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogSeedLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SeedSummary load(Path file, EquipmentStore store) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("种子文件不存在：" + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            SeedSummary summary = load(in, store);
            log.info("已加载种子文件 {}：{}", file, summary);
            return summary;
        } catch (IOException e) {
            throw new IllegalStateException("读取种子文件失败：" + file, e);
        }
    }

    public SeedSummary load(InputStream in, EquipmentStore store) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("种子文件必须是 JSON 对象");
        }

        int projects = 0;
        for (JsonNode node : root.path("projects")) {
            store.saveProject(objectMapper.treeToValue(defaultActive(node), Project.class));
            projects++;
        }
        int drawings = 0;
        for (JsonNode node : root.path("drawings")) {
            store.saveDrawing(objectMapper.treeToValue(node, Drawing.class));
            drawings++;
        }
        int lines = 0;
        for (JsonNode node : root.path("lines")) {
            store.saveLine(objectMapper.treeToValue(node, Line.class));
            lines++;
        }
        int equipment = 0;
        for (JsonNode node : root.path("equipment")) {
            Equipment e = objectMapper.treeToValue(defaultActive(node), Equipment.class);
            if (store.findProject(e.projectId()).isEmpty()) {
                throw new IllegalArgumentException("设备 " + e.tag() + " 引用了不存在的项目：" + e.projectId());
            }
            store.insert(e);
            equipment++;
        }
        return new SeedSummary(projects, drawings, lines, equipment);
    }

    private static JsonNode defaultActive(JsonNode node) {
        if (node instanceof ObjectNode obj && !obj.has("active")) {
            ObjectNode copy = obj.deepCopy();
            copy.put("active", true);
            return copy;
        }
        return node;
    }

    public record SeedSummary(int projects, int drawings, int lines, int equipment) {
    }
}
