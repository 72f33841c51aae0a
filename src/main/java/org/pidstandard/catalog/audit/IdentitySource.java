package org.pidstandard.catalog.audit;

/**
 * 提供审计记录里的执行人与来源。核心逻辑把两者都当作不透明字符串。
 */
public interface IdentitySource {

    String performedBy();

    String source();
}
