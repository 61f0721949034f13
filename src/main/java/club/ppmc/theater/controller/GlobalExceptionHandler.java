/**
 * GlobalExceptionHandler.java
 *
 * 将服务层抛出的异常转换为结构化的 JSON 错误响应。
 * 响应中只包含面向用户的提示文本，原始异常信息写入日志。
 */
package club.ppmc.theater.controller;

import club.ppmc.theater.exception.EnvironmentConfigurationException;
import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.exception.TheaterException;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EnvironmentConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleEnvironment(EnvironmentConfigurationException e) {
        log.warn("环境配置错误: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.PRECONDITION_FAILED).body(e.toErrorData());
    }

    @ExceptionHandler(ProcessNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ProcessNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("type", "NOT_FOUND", "message", e.getMessage()));
    }

    @ExceptionHandler(TheaterException.class)
    public ResponseEntity<Map<String, Object>> handleTheater(TheaterException e) {
        log.error("请求处理失败 [{}]: {}", e.getKind(), e.getMessage(), e);
        HttpStatus status = switch (e.getKind()) {
            case AUTHENTICATION_FAILED -> HttpStatus.UNAUTHORIZED;
            case TRANSPORT_DISCONNECTED, NICKNAME_COLLISION -> HttpStatus.CONFLICT;
            case PROTOCOL_VIOLATION -> HttpStatus.BAD_REQUEST;
            case PORT_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(e.toErrorData());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("type", "CONFLICT", "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("type", "BAD_REQUEST", "message", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Map.of("type", "VALIDATION_ERROR", "message", details));
    }
}
