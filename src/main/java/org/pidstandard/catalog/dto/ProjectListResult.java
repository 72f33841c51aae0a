package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.model.Project;

import java.util.List;

/**
 * {@code pid_list_projects} 的返回结果。
 *
 * @param projects 项目列表
 */
public record ProjectListResult(List<Project> projects) {
}
