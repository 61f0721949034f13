/**
 * HostStartRequest.java
 *
 * 房主开启放映室的请求。除验证码外的字段都可以省略，省略时使用配置中的默认值。
 */
package club.ppmc.theater.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param nickname         房主昵称，为空时随机选择。
 * @param verificationCode 观众加入时需要输入的验证码。
 * @param srtInputPort     接收推流的 SRT 端口。
 * @param bindAddress      SRT 绑定地址。
 * @param enableLocalPlay  是否在本机打开预览播放器。
 */
public record HostStartRequest(
        String nickname,
        @NotBlank String verificationCode,
        @Min(1) @Max(65535) Integer srtInputPort,
        String bindAddress,
        Boolean enableLocalPlay) {}
