package com.projectgroup5.arena.game;

import com.projectgroup5.arena.dto.InputMessage;

/**
 * 一帧内某个玩家的输入意图（不可变，整条替换）
 */
public final class PlayerInput {

    /** 没有输入时使用：不移动、不射击 */
    public static final PlayerInput NEUTRAL = new PlayerInput(false, false, false, false, false, 0, 0);

    private final boolean moveLeft;
    private final boolean moveRight;
    private final boolean moveUp;
    private final boolean moveDown;
    private final boolean fire;
    private final double fireDirX;
    private final double fireDirY;

    public PlayerInput(boolean moveLeft, boolean moveRight, boolean moveUp, boolean moveDown,
                       boolean fire, double fireDirX, double fireDirY) {
        this.moveLeft = moveLeft;
        this.moveRight = moveRight;
        this.moveUp = moveUp;
        this.moveDown = moveDown;
        this.fire = fire;
        this.fireDirX = fireDirX;
        this.fireDirY = fireDirY;
    }

    /**
     * 把线路上的 INPUT 转成规整的输入；缺失或格式不对的字段都按中性值处理，
     * 保证 tick 线程不会因为客户端数据而抛异常。
     */
    public static PlayerInput from(InputMessage message) {
        if (message == null) {
            return NEUTRAL;
        }
        InputMessage.Keys keys = message.getKeys();
        boolean left = keys != null && keys.isLeft();
        boolean right = keys != null && keys.isRight();
        boolean up = keys != null && keys.isUp();
        boolean down = keys != null && keys.isDown();

        double dx = 0;
        double dy = 0;
        double[] dir = message.getShootDir();
        if (dir != null && dir.length == 2 && Double.isFinite(dir[0]) && Double.isFinite(dir[1])) {
            dx = dir[0];
            dy = dir[1];
        }
        return new PlayerInput(left, right, up, down, message.isShoot(), dx, dy);
    }

    public boolean isMoveLeft() { return moveLeft; }
    public boolean isMoveRight() { return moveRight; }
    public boolean isMoveUp() { return moveUp; }
    public boolean isMoveDown() { return moveDown; }
    public boolean isFire() { return fire; }
    public double getFireDirX() { return fireDirX; }
    public double getFireDirY() { return fireDirY; }

    /** shoot=true 但方向是零向量时不开火 */
    public boolean wantsToFire() {
        return fire && (fireDirX != 0 || fireDirY != 0);
    }
}
