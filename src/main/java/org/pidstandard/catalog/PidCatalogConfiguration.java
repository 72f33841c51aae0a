package org.pidstandard.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.pidstandard.catalog.audit.AuditSink;
import org.pidstandard.catalog.audit.AuditTrailRecorder;
import org.pidstandard.catalog.audit.ConfiguredIdentitySource;
import org.pidstandard.catalog.audit.IdentitySource;
import org.pidstandard.catalog.audit.InMemoryAuditSink;
import org.pidstandard.catalog.renumber.BatchRenumberCoordinator;
import org.pidstandard.catalog.renumber.RenumberSessionStore;
import org.pidstandard.catalog.store.EquipmentStore;
import org.pidstandard.catalog.store.InMemoryEquipmentStore;
import org.pidstandard.catalog.tagging.TagValidationService;
import org.pidstandard.catalog.tagging.TypeCodeLookup;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 设备目录 MCP 服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>核心类（重编号、层级、审计）不依赖 Spring，这里统一把 {@link PidCatalogProperties} 注入进去。</li>
 *   <li>存储与审计默认使用内存实现；替换为持久化实现时只需提供同类型的 Bean。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class PidCatalogConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        // 与 Spring Boot 默认一致：忽略未知字段，时间按 ISO-8601 字符串输出
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public CatalogSeedLoader catalogSeedLoader(ObjectMapper objectMapper) {
        return new CatalogSeedLoader(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public EquipmentStore equipmentStore(PidCatalogProperties properties, CatalogSeedLoader seedLoader) {
        InMemoryEquipmentStore store = new InMemoryEquipmentStore();
        String seedFile = properties.getSeedFile();
        if (seedFile != null && !seedFile.isBlank()) {
            seedLoader.load(Path.of(seedFile.trim()), store);
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new InMemoryAuditSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentitySource identitySource(PidCatalogProperties properties) {
        PidCatalogProperties.Identity identity = properties.getIdentity();
        return new ConfiguredIdentitySource(identity.getPerformedBy(), identity.getSource());
    }

    @Bean
    public TypeCodeLookup typeCodeLookup(PidCatalogProperties properties) {
        return TypeCodeLookup.withOverrides(properties.getTypeCodes());
    }

    @Bean
    public AuditTrailRecorder auditTrailRecorder(
            AuditSink sink,
            IdentitySource identity,
            ObjectMapper objectMapper,
            Clock clock,
            PidCatalogProperties properties
    ) {
        return new AuditTrailRecorder(
                sink,
                identity,
                objectMapper,
                clock,
                properties.getAuditQueryDefaultLimit(),
                properties.getAuditQueryMaxLimit()
        );
    }

    @Bean
    public TagValidationService tagValidationService(EquipmentStore store) {
        return new TagValidationService(store);
    }

    @Bean
    public BatchRenumberCoordinator batchRenumberCoordinator(
            EquipmentStore store,
            AuditTrailRecorder audit,
            TypeCodeLookup typeCodes,
            PidCatalogProperties properties
    ) {
        return new BatchRenumberCoordinator(store, audit, typeCodes, properties.getRenumberMaxBatchSize());
    }

    @Bean
    public RenumberSessionStore renumberSessionStore(PidCatalogProperties properties, Clock clock) {
        return new RenumberSessionStore(properties.getRenumberSessionTtl(), clock);
    }

    @Bean
    public EquipmentCatalogService equipmentCatalogService(
            EquipmentStore store,
            TagValidationService tagValidation,
            AuditTrailRecorder audit
    ) {
        return new EquipmentCatalogService(store, tagValidation, audit);
    }
}
