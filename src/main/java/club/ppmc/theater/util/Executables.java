/**
 * Executables.java
 *
 * 外部程序路径的启动前校验。
 * 配置值中带有路径分隔符时，要求该文件存在；只有程序名时交给操作系统在 PATH 中查找。
 */
package club.ppmc.theater.util;

import club.ppmc.theater.exception.EnvironmentConfigurationException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

public final class Executables {

    private Executables() {}

    /**
     * @param component 组件名称，例如 "ffmpeg"。
     * @param configured 配置中的可执行文件路径。
     * @throws EnvironmentConfigurationException 未配置，或者配置的路径不存在。
     */
    public static void requirePresent(String component, String configured) {
        if (configured == null || configured.isBlank()) {
            throw new EnvironmentConfigurationException(
                    component + " 路径未配置，请在 application.properties 中设置 theater.programs." + component,
                    component, configured);
        }
        if (!hasPathSeparator(configured)) {
            return;
        }
        try {
            if (!Files.isRegularFile(Path.of(configured))) {
                throw new EnvironmentConfigurationException(
                        String.format("找不到 %s: %s", component, configured), component, configured);
            }
        } catch (InvalidPathException e) {
            throw new EnvironmentConfigurationException(
                    String.format("%s 路径 '%s' 无效", component, configured), component, configured);
        }
    }

    public static boolean hasPathSeparator(String configured) {
        return configured.indexOf('/') >= 0 || configured.indexOf('\\') >= 0;
    }
}
