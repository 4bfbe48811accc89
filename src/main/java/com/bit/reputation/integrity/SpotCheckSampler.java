package com.bit.reputation.integrity;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * 抽检位置采样：[0, count) 内的去重升序位置
 */
@Component
public class SpotCheckSampler {

    private final Random random;

    public SpotCheckSampler() {
        this(new SecureRandom());
    }

    public SpotCheckSampler(Random random) {
        this.random = random;
    }

    /**
     * @param count           链上事件数（索引器声称）
     * @param spotChecks      边界之外额外抽取的随机位置数
     * @param checkBoundaries 是否固定包含首尾位置
     */
    public List<Long> sample(long count, int spotChecks, boolean checkBoundaries) {
        TreeSet<Long> positions = new TreeSet<>();
        if (count <= 0) {
            return new ArrayList<>(positions);
        }
        if (checkBoundaries) {
            positions.add(0L);
            positions.add(count - 1);
        }
        long remaining = count - positions.size();
        int extra = (int) Math.min(Math.max(spotChecks, 0), remaining);
        if (extra == remaining) {
            // 位置不够挑，全部抽检
            for (long i = 0; i < count; i++) {
                positions.add(i);
            }
        } else {
            int target = positions.size() + extra;
            while (positions.size() < target) {
                positions.add(nextPosition(count));
            }
        }
        return new ArrayList<>(positions);
    }

    private long nextPosition(long count) {
        if (count <= Integer.MAX_VALUE) {
            return random.nextInt((int) count);
        }
        return Math.floorMod(random.nextLong(), count);
    }
}
