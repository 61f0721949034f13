/**
 * HostController.java
 *
 * 房主端的控制接口：开启和关闭放映室、查询状态与成员、发送聊天消息。
 */
package club.ppmc.theater.controller;

import club.ppmc.theater.model.ChatRequest;
import club.ppmc.theater.model.HostStartRequest;
import club.ppmc.theater.model.HostStatus;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.service.HostSessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/host")
public class HostController {

    private final HostSessionService hostSessionService;

    public HostController(HostSessionService hostSessionService) {
        this.hostSessionService = hostSessionService;
    }

    @PostMapping("/start")
    public ResponseEntity<HostStatus> start(@Valid @RequestBody HostStartRequest request) {
        return ResponseEntity.ok(hostSessionService.start(request));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        hostSessionService.stop();
        return ResponseEntity.ok(Map.of("message", "放映室已关闭。"));
    }

    @GetMapping("/status")
    public ResponseEntity<HostStatus> status() {
        return ResponseEntity.ok(hostSessionService.status());
    }

    @GetMapping("/members")
    public ResponseEntity<List<Member>> members() {
        return ResponseEntity.ok(hostSessionService.members());
    }

    /**
     * 以房主身份发送聊天消息。放映室未开启时返回 409。
     */
    @PostMapping("/chat")
    public ResponseEntity<Map<String, String>> chat(@Valid @RequestBody ChatRequest request) {
        if (!hostSessionService.chat(request.message())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", "放映室尚未开启"));
        }
        return ResponseEntity.ok(Map.of("message", "已发送"));
    }
}
