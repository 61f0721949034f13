/**
 * ProcessController.java
 *
 * 查询被监管的外部进程。
 */
package club.ppmc.theater.controller;

import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.model.ProcessInfo;
import club.ppmc.theater.service.ProcessSupervisor;
import java.util.List;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/processes")
public class ProcessController {

    private final ProcessSupervisor supervisor;

    public ProcessController(ProcessSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping
    public ResponseEntity<List<ProcessInfo>> list() {
        List<ProcessInfo> infos = supervisor.getProcessNames().stream()
                .map(supervisor::getProcessInfo)
                .flatMap(Optional::stream)
                .toList();
        return ResponseEntity.ok(infos);
    }

    @GetMapping("/{name}")
    public ResponseEntity<ProcessInfo> get(@PathVariable String name) {
        return ResponseEntity.ok(supervisor.getProcessInfo(name)
                .orElseThrow(() -> new ProcessNotFoundException(name)));
    }
}
