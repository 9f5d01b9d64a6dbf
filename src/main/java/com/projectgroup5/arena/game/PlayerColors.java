package com.projectgroup5.arena.game;

/**
 * 根据玩家 id 生成固定颜色（同一个 id 永远得到同一个颜色）
 */
public final class PlayerColors {

    /** 每个通道的最低亮度，保证在深色背景上可见 */
    public static final int MIN_BRIGHTNESS = 100;

    private PlayerColors() {
    }

    public static int[] forId(String playerId) {
        int hash = playerId.hashCode();
        int r = (hash & 0xFF0000) >> 16;
        int g = (hash & 0x00FF00) >> 8;
        int b = hash & 0x0000FF;
        return new int[] {
                Math.max(MIN_BRIGHTNESS, r),
                Math.max(MIN_BRIGHTNESS, g),
                Math.max(MIN_BRIGHTNESS, b)
        };
    }
}
