/**
 * MembersChangedEvent.java
 *
 * 成员列表发生变化时发布。房主总是排在第一位，观众按连接顺序排列。
 */
package club.ppmc.theater.model.event;

import club.ppmc.theater.model.Member;
import java.util.List;

public record MembersChangedEvent(List<Member> members) {

    public MembersChangedEvent {
        members = List.copyOf(members);
    }
}
