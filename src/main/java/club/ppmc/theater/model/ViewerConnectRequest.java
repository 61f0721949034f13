/**
 * ViewerConnectRequest.java
 *
 * 观众加入放映室的请求。
 */
package club.ppmc.theater.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param serverAddress    服务端地址，支持 "host"、"host:port"、"[v6]:port"，省略端口时使用默认信令端口。
 * @param nickname         期望的昵称，为空时随机选择。
 * @param verificationCode 验证码。
 */
public record ViewerConnectRequest(
        @NotBlank String serverAddress, String nickname, @NotBlank String verificationCode) {}
