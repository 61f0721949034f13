/**
 * HostControllerTest.java
 *
 * 控制接口的请求校验和异常到 HTTP 状态码的映射。
 */
package club.ppmc.theater.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.theater.exception.EnvironmentConfigurationException;
import club.ppmc.theater.model.HostStatus;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.service.HostSessionService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HostController.class)
class HostControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HostSessionService hostSessionService;

    @Test
    void startReturnsStatus() throws Exception {
        when(hostSessionService.start(any())).thenReturn(new HostStatus(
                true, "Host", "203.0.113.7", 9001, 10086, true, true, false,
                List.of(new Member("Host", Role.SENDER))));

        mockMvc.perform(post("/api/host/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nickname\":\"Host\",\"verificationCode\":\"114514\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.open").value(true))
                .andExpect(jsonPath("$.members[0].nickname").value("Host"));
    }

    @Test
    void rejectsInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/host/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verificationCode\":\"\",\"srtInputPort\":70000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"));
    }

    @Test
    void environmentErrorNamesMissingComponent() throws Exception {
        when(hostSessionService.start(any())).thenThrow(
                new EnvironmentConfigurationException("找不到 nginx: rtmp/nginx", "nginx", "rtmp/nginx"));

        mockMvc.perform(post("/api/host/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verificationCode\":\"114514\"}"))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.type").value("ENVIRONMENT_ERROR"))
                .andExpect(jsonPath("$.missing").value("nginx"));
    }

    @Test
    void secondStartIsAConflict() throws Exception {
        when(hostSessionService.start(any())).thenThrow(new IllegalStateException("放映室已开启"));

        mockMvc.perform(post("/api/host/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verificationCode\":\"114514\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void chatWhileClosedIsAConflict() throws Exception {
        when(hostSessionService.chat("hi")).thenReturn(false);

        mockMvc.perform(post("/api/host/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hi\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void listsMembers() throws Exception {
        when(hostSessionService.members()).thenReturn(List.of(
                new Member("Host", Role.SENDER), new Member("Saber", Role.RECEIVER)));

        mockMvc.perform(get("/api/host/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].nickname").value("Saber"))
                .andExpect(jsonPath("$[1].role").value("RECEIVER"));
    }
}
