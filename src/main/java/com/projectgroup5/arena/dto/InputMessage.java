package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * 客户端每帧发送的输入意图
 * 缺失字段一律按中性值处理（不移动、不射击）
 */
@JsonTypeName(InputMessage.TYPE)
public class InputMessage extends GameMessage {
    public static final String TYPE = "INPUT";

    private Keys keys;
    private boolean shoot;
    @JsonProperty("shoot_dir")
    private double[] shootDir;

    public InputMessage() {
    }

    public InputMessage(Keys keys, boolean shoot, double[] shootDir) {
        this.keys = keys;
        this.shoot = shoot;
        this.shootDir = shootDir;
    }

    public Keys getKeys() { return keys; }
    public void setKeys(Keys keys) { this.keys = keys; }

    public boolean isShoot() { return shoot; }
    public void setShoot(boolean shoot) { this.shoot = shoot; }

    public double[] getShootDir() { return shootDir; }
    public void setShootDir(double[] shootDir) { this.shootDir = shootDir; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Keys {
        private boolean left;
        private boolean right;
        private boolean up;
        private boolean down;

        public Keys() {
        }

        public Keys(boolean left, boolean right, boolean up, boolean down) {
            this.left = left;
            this.right = right;
            this.up = up;
            this.down = down;
        }

        public boolean isLeft() { return left; }
        public void setLeft(boolean left) { this.left = left; }

        public boolean isRight() { return right; }
        public void setRight(boolean right) { this.right = right; }

        public boolean isUp() { return up; }
        public void setUp(boolean up) { this.up = up; }

        public boolean isDown() { return down; }
        public void setDown(boolean down) { this.down = down; }
    }
}
