/**
 * SignalCodec.java
 *
 * 信令消息与 JSON 文本之间的编解码器。
 * 编码时 "type" 字段总是排在第一位；解码时逐字段校验，
 * 任何无法识别的内容都会变成 {@link ProtocolViolationException}，而不是在业务代码中以 null 的形式出现。
 */
package club.ppmc.theater.protocol;

import club.ppmc.theater.exception.ProtocolViolationException;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.model.Role;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class SignalCodec {

    private final Gson gson;

    public SignalCodec(Gson gson) {
        this.gson = gson;
    }

    /**
     * 将消息编码为一帧 JSON 文本。值为 null 的字段不会出现在输出中。
     */
    public String encode(SignalMessage message) {
        var out = new JsonObject();
        out.addProperty("type", message.type().wireName());
        JsonElement body = gson.toJsonTree(message);
        if (body.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : body.getAsJsonObject().entrySet()) {
                out.add(entry.getKey(), entry.getValue());
            }
        }
        return gson.toJson(out);
    }

    /**
     * 解析一帧 JSON 文本。
     *
     * @param text 收到的原始文本。
     * @return 对应的消息记录。
     * @throws ProtocolViolationException 文本不是 JSON 对象、type 未知或缺少必需字段时。
     */
    public SignalMessage decode(String text) {
        JsonObject json = parseObject(text);
        String typeName = requireString(json, "type");
        MessageType type = MessageType.fromWireName(typeName)
                .orElseThrow(() -> new ProtocolViolationException("未知的消息类型: " + typeName));

        return switch (type) {
            case AUTH -> new SignalMessage.Auth(requireString(json, "code"), requireString(json, "nickname"));
            case AUTH_SUCCESS -> new SignalMessage.AuthSuccess(
                    requireString(json, "nickname"),
                    requirePort(json, "srt_port"),
                    optionalString(json, "server_ip"));
            case AUTH_FAILED -> new SignalMessage.AuthFailed(optionalString(json, "message"));
            case CHAT -> new SignalMessage.Chat(
                    optionalString(json, "nickname"),
                    requireString(json, "message"),
                    optionalString(json, "timestamp"));
            case JOIN -> new SignalMessage.Join(requireString(json, "nickname"), optionalString(json, "message"));
            case LEAVE -> new SignalMessage.Leave(requireString(json, "nickname"), optionalString(json, "message"));
            case MEMBERS -> new SignalMessage.Members(readMembers(json));
            case SRT_PORT -> new SignalMessage.SrtPort(
                    requirePort(json, "srt_port"),
                    optionalString(json, "server_ip"));
            case ERROR -> new SignalMessage.ServerError(optionalString(json, "message"));
            case HEARTBEAT -> new SignalMessage.Heartbeat();
        };
    }

    private JsonObject parseObject(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolViolationException("空消息");
        }
        JsonElement element;
        try {
            element = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new ProtocolViolationException("无效的JSON消息", e);
        }
        if (!element.isJsonObject()) {
            throw new ProtocolViolationException("消息必须是JSON对象");
        }
        return element.getAsJsonObject();
    }

    private List<Member> readMembers(JsonObject json) {
        JsonElement element = json.get("members");
        if (element == null || !element.isJsonArray()) {
            throw new ProtocolViolationException("members 字段缺失或不是数组");
        }
        JsonArray array = element.getAsJsonArray();
        List<Member> members = new ArrayList<>(array.size());
        for (JsonElement item : array) {
            if (!item.isJsonObject()) {
                throw new ProtocolViolationException("members 中的成员必须是对象");
            }
            JsonObject obj = item.getAsJsonObject();
            String roleName = requireString(obj, "role");
            Role role = Role.fromWireName(roleName);
            if (role == null) {
                throw new ProtocolViolationException("未知的成员角色: " + roleName);
            }
            members.add(new Member(requireString(obj, "nickname"), role));
        }
        return members;
    }

    private static String requireString(JsonObject json, String field) {
        String value = optionalString(json, field);
        if (value == null) {
            throw new ProtocolViolationException("缺少字段: " + field);
        }
        return value;
    }

    private static String optionalString(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ProtocolViolationException("字段 " + field + " 必须是字符串");
        }
        return element.getAsString();
    }

    private static int requirePort(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            throw new ProtocolViolationException("缺少字段: " + field);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        try {
            int port = primitive.isNumber() ? primitive.getAsInt() : Integer.parseInt(primitive.getAsString());
            if (port < 1 || port > 65535) {
                throw new ProtocolViolationException("端口超出范围: " + port);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ProtocolViolationException("字段 " + field + " 不是有效的端口", e);
        }
    }
}
