/**
 * Member.java
 *
 * 成员列表中的一项，既用于 members 信令消息，也用于 MembersChangedEvent。
 */
package club.ppmc.theater.model;

/**
 * @param nickname 成员昵称（服务端最终分配的昵称）。
 * @param role     成员角色。
 */
public record Member(String nickname, Role role) {}
