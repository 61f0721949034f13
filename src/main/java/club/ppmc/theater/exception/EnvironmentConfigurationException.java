/**
 * EnvironmentConfigurationException.java
 *
 * 一个自定义的运行时异常，用于表示放映室依赖的外部程序（ffmpeg、nginx、mpv）未正确配置。
 * 当 HostSessionService 或 ViewerSessionService 在启动前进行环境校验失败时，会抛出此异常。
 * 它携带了缺失组件的名称，以便 Controller 层可以将其转换为对前端友好的响应。
 */
package club.ppmc.theater.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class EnvironmentConfigurationException extends TheaterException {

    /** 缺失或无效的组件名称 ("ffmpeg", "nginx", "mpv")。 */
    private final String missingComponent;

    /** 配置中给出的可执行文件路径。 */
    private final String configuredPath;

    /**
     * 构造函数。
     * @param message 详细的错误信息，将展示给用户。
     * @param missingComponent 问题组件的标识符。
     * @param configuredPath 配置的路径。
     */
    public EnvironmentConfigurationException(
            String message, String missingComponent, String configuredPath) {
        super(ErrorKind.PROCESS_LAUNCH_FAILED, message);
        this.missingComponent = missingComponent;
        this.configuredPath = configuredPath;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    @Override
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "ENVIRONMENT_ERROR",
                "message", getMessage(),
                "missing", getMissingComponent(),
                "configuredPath", getConfiguredPath() != null ? getConfiguredPath() : ""
        );
    }
}
