/**
 * ViewerController.java
 *
 * 观众端的控制接口。连接是异步的，connect 返回时通常还处于连接或认证阶段，结果通过 status 查询。
 */
package club.ppmc.theater.controller;

import club.ppmc.theater.model.ChatRequest;
import club.ppmc.theater.model.ViewerConnectRequest;
import club.ppmc.theater.model.ViewerStatus;
import club.ppmc.theater.service.ViewerSessionService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/viewer")
public class ViewerController {

    private final ViewerSessionService viewerSessionService;

    public ViewerController(ViewerSessionService viewerSessionService) {
        this.viewerSessionService = viewerSessionService;
    }

    @PostMapping("/connect")
    public ResponseEntity<ViewerStatus> connect(@Valid @RequestBody ViewerConnectRequest request) {
        return ResponseEntity.accepted().body(viewerSessionService.connect(request));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, String>> disconnect() {
        viewerSessionService.disconnect();
        return ResponseEntity.ok(Map.of("message", "已断开连接。"));
    }

    @GetMapping("/status")
    public ResponseEntity<ViewerStatus> status() {
        return ResponseEntity.ok(viewerSessionService.status());
    }

    @PostMapping("/chat")
    public ResponseEntity<Map<String, String>> chat(@Valid @RequestBody ChatRequest request) {
        viewerSessionService.chat(request.message());
        return ResponseEntity.ok(Map.of("message", "已发送"));
    }
}
