package org.pidstandard.catalog;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 设备目录 MCP Server 的业务配置（{@code app.pid.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #typeCodes}：设备类型 -> 标签类型代码，叠加在内置默认表之上。</li>
 *   <li>{@link #renumberSessionTtl}：重编号“预览 -> 确认”两段式之间 token 的有效期。</li>
 *   <li>{@link #identity}：写入审计记录的执行人与来源，未配置时使用系统用户名与主机名。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.pid")
public class PidCatalogProperties {

    /**
     * 设备类型代码覆盖表，例如 {@code Pump: P}、{@code Agitator: AG}（类型名不区分大小写）。
     */
    @NotNull
    private Map<String, String> typeCodes = new LinkedHashMap<>();

    /**
     * 单次批量重编号允许选中的最大设备数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int renumberMaxBatchSize = 10_000;

    /**
     * 重编号预览 token 的有效期（超过则失效，需要重新 prepare）。
     */
    @NotNull
    private Duration renumberSessionTtl = Duration.ofMinutes(30);

    /**
     * 审计查询默认返回条数。
     */
    @Min(1)
    @Max(100_000)
    private int auditQueryDefaultLimit = 100;

    /**
     * 审计查询允许的最大返回条数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int auditQueryMaxLimit = 1_000;

    /**
     * 启动时加载的种子数据文件（JSON，可选）。
     */
    private String seedFile;

    @Valid
    @NotNull
    private Identity identity = new Identity();

    public Map<String, String> getTypeCodes() {
        return typeCodes;
    }

    public void setTypeCodes(Map<String, String> typeCodes) {
        this.typeCodes = typeCodes;
    }

    public int getRenumberMaxBatchSize() {
        return renumberMaxBatchSize;
    }

    public void setRenumberMaxBatchSize(int renumberMaxBatchSize) {
        this.renumberMaxBatchSize = renumberMaxBatchSize;
    }

    public Duration getRenumberSessionTtl() {
        return renumberSessionTtl;
    }

    public void setRenumberSessionTtl(Duration renumberSessionTtl) {
        this.renumberSessionTtl = renumberSessionTtl;
    }

    public int getAuditQueryDefaultLimit() {
        return auditQueryDefaultLimit;
    }

    public void setAuditQueryDefaultLimit(int auditQueryDefaultLimit) {
        this.auditQueryDefaultLimit = auditQueryDefaultLimit;
    }

    public int getAuditQueryMaxLimit() {
        return auditQueryMaxLimit;
    }

    public void setAuditQueryMaxLimit(int auditQueryMaxLimit) {
        this.auditQueryMaxLimit = auditQueryMaxLimit;
    }

    public String getSeedFile() {
        return seedFile;
    }

    public void setSeedFile(String seedFile) {
        this.seedFile = seedFile;
    }

    public Identity getIdentity() {
        return identity;
    }

    public void setIdentity(Identity identity) {
        this.identity = identity;
    }

    /**
     * 审计身份配置（{@code app.pid.identity.*}）。
     */
    public static class Identity {

        /**
         * 执行人；为空时使用系统属性 {@code user.name}。
         */
        private String performedBy;

        /**
         * 来源标识；为空时使用本机主机名。
         */
        private String source;

        public String getPerformedBy() {
            return performedBy;
        }

        public void setPerformedBy(String performedBy) {
            this.performedBy = performedBy;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }
    }
}
