/**
 * Role.java
 *
 * 放映室中成员的角色：发送端（房主）或接收端（观众）。
 * 线上格式使用小写名称，通过 Gson 的 {@link SerializedName} 映射。
 */
package club.ppmc.theater.model;

import com.google.gson.annotations.SerializedName;

public enum Role {
    @SerializedName("sender")
    SENDER("sender"),

    @SerializedName("receiver")
    RECEIVER("receiver");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 根据线上名称查找角色。
     *
     * @param wireName "sender" 或 "receiver"。
     * @return 对应的角色；无法识别时返回 null。
     */
    public static Role fromWireName(String wireName) {
        for (Role role : values()) {
            if (role.wireName.equals(wireName)) {
                return role;
            }
        }
        return null;
    }
}
