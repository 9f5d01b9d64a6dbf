package com.projectgroup5.arena.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 竞技场配置（application.yml 中 arena.* 前缀）
 * 默认值与编译期常量一致，测试里可以直接 new 出来用
 */
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    private double width = 800;
    private double height = 600;

    private final Player player = new Player();
    private final Bullet bullet = new Bullet();
    private final AmmoBox ammoBox = new AmmoBox();
    private final Tick tick = new Tick();
    private final Server server = new Server();

    public double getWidth() { return width; }
    public void setWidth(double width) { this.width = width; }

    public double getHeight() { return height; }
    public void setHeight(double height) { this.height = height; }

    public Player getPlayer() { return player; }
    public Bullet getBullet() { return bullet; }
    public AmmoBox getAmmoBox() { return ammoBox; }
    public Tick getTick() { return tick; }
    public Server getServer() { return server; }

    public static class Player {
        private double radius = 20;
        private double speed = 200;       // pixels/second
        private int maxAmmo = 10;
        private double respawnSeconds = 3.0;

        public double getRadius() { return radius; }
        public void setRadius(double radius) { this.radius = radius; }

        public double getSpeed() { return speed; }
        public void setSpeed(double speed) { this.speed = speed; }

        public int getMaxAmmo() { return maxAmmo; }
        public void setMaxAmmo(int maxAmmo) { this.maxAmmo = maxAmmo; }

        public double getRespawnSeconds() { return respawnSeconds; }
        public void setRespawnSeconds(double respawnSeconds) { this.respawnSeconds = respawnSeconds; }
    }

    public static class Bullet {
        private double radius = 5;
        private double speed = 400;       // pixels/second
        private double lifetimeSeconds = 3.0;

        public double getRadius() { return radius; }
        public void setRadius(double radius) { this.radius = radius; }

        public double getSpeed() { return speed; }
        public void setSpeed(double speed) { this.speed = speed; }

        public double getLifetimeSeconds() { return lifetimeSeconds; }
        public void setLifetimeSeconds(double lifetimeSeconds) { this.lifetimeSeconds = lifetimeSeconds; }
    }

    public static class AmmoBox {
        private double radius = 12;
        private double lifetimeSeconds = 15.0;
        private double spawnIntervalMinSeconds = 5.0;
        private double spawnIntervalMaxSeconds = 10.0;

        public double getRadius() { return radius; }
        public void setRadius(double radius) { this.radius = radius; }

        public double getLifetimeSeconds() { return lifetimeSeconds; }
        public void setLifetimeSeconds(double lifetimeSeconds) { this.lifetimeSeconds = lifetimeSeconds; }

        public double getSpawnIntervalMinSeconds() { return spawnIntervalMinSeconds; }
        public void setSpawnIntervalMinSeconds(double v) { this.spawnIntervalMinSeconds = v; }

        public double getSpawnIntervalMaxSeconds() { return spawnIntervalMaxSeconds; }
        public void setSpawnIntervalMaxSeconds(double v) { this.spawnIntervalMaxSeconds = v; }
    }

    public static class Tick {
        private int rate = 30;            // ticks/second

        public int getRate() { return rate; }
        public void setRate(int rate) { this.rate = rate; }

        public double getIntervalSeconds() {
            return 1.0 / rate;
        }
    }

    public static class Server {
        private String host = "0.0.0.0";
        private int port = 5555;
        private int acceptPollMillis = 100;
        private int maxFrameBytes = 64 * 1024;
        private int maxStateFrameBytes = 8 * 1024 * 1024;
        private int outboundQueueCapacity = 64;
        private int idleTimeoutMillis = 30_000;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getAcceptPollMillis() { return acceptPollMillis; }
        public void setAcceptPollMillis(int acceptPollMillis) { this.acceptPollMillis = acceptPollMillis; }

        public int getMaxFrameBytes() { return maxFrameBytes; }
        public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }

        public int getMaxStateFrameBytes() { return maxStateFrameBytes; }
        public void setMaxStateFrameBytes(int maxStateFrameBytes) { this.maxStateFrameBytes = maxStateFrameBytes; }

        public int getOutboundQueueCapacity() { return outboundQueueCapacity; }
        public void setOutboundQueueCapacity(int capacity) { this.outboundQueueCapacity = capacity; }

        public int getIdleTimeoutMillis() { return idleTimeoutMillis; }
        public void setIdleTimeoutMillis(int idleTimeoutMillis) { this.idleTimeoutMillis = idleTimeoutMillis; }
    }
}
