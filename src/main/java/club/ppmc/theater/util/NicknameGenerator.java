/**
 * NicknameGenerator.java
 *
 * 用户没有填写昵称时，从角色名称池中随机挑选一个。稀有名称只有很小的概率出现。
 */
package club.ppmc.theater.util;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public final class NicknameGenerator {

    private static final List<String> ROLE_NAMES =
            List.of("Archer", "Saber", "Caster", "Assassin", "Rider", "Lancer", "Berserker");
    private static final List<String> RARE_ROLE_NAMES = List.of("Ruler", "Avenger");
    private static final double RARE_PROBABILITY = 0.02;

    private NicknameGenerator() {}

    public static String randomNickname() {
        var random = ThreadLocalRandom.current();
        List<String> pool = random.nextDouble() < RARE_PROBABILITY ? RARE_ROLE_NAMES : ROLE_NAMES;
        return pool.get(random.nextInt(pool.size()));
    }
}
