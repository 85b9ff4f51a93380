package io.github.yok.csvimporter.util;

import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads the JDBC driver class of a connection entry when one is configured.
 *
 * <p>
 * A blank class name leaves driver discovery to JDBC 4 service loading.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcDriverLoader {

    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the driver class only when its name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @return {@code true} if a class was loaded
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    public static boolean loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (StringUtils.isBlank(driverClass)) {
            return false;
        }
        Class.forName(driverClass.trim());
        return true;
    }
}
