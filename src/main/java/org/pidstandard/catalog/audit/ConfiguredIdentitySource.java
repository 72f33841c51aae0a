package org.pidstandard.catalog.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 默认身份来源：优先使用配置（{@code app.pid.identity.*}），否则退回操作系统用户名与主机名。
 */
public class ConfiguredIdentitySource implements IdentitySource {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredIdentitySource.class);

    private final String performedBy;
    private final String source;

    public ConfiguredIdentitySource(String performedBy, String source) {
        this.performedBy = isBlank(performedBy) ? systemUser() : performedBy.trim();
        this.source = isBlank(source) ? hostName() : source.trim();
    }

    @Override
    public String performedBy() {
        return performedBy;
    }

    @Override
    public String source() {
        return source;
    }

    private static String systemUser() {
        String user = System.getProperty("user.name");
        return isBlank(user) ? "unknown" : user;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("无法解析本机主机名，改用环境变量：{}", e.getMessage());
            String env = System.getenv("HOSTNAME");
            if (isBlank(env)) {
                env = System.getenv("COMPUTERNAME");
            }
            return isBlank(env) ? "unknown-host" : env;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
