package com.projectgroup5.arena.dto;

public class ServerStatusDto {
    private long tick;
    private int players;
    private int bullets;
    private int ammoBoxes;
    private int connections;
    private int tickRate;

    public ServerStatusDto() {
    }

    public ServerStatusDto(long tick, int players, int bullets, int ammoBoxes,
                           int connections, int tickRate) {
        this.tick = tick;
        this.players = players;
        this.bullets = bullets;
        this.ammoBoxes = ammoBoxes;
        this.connections = connections;
        this.tickRate = tickRate;
    }

    public long getTick() { return tick; }
    public void setTick(long tick) { this.tick = tick; }

    public int getPlayers() { return players; }
    public void setPlayers(int players) { this.players = players; }

    public int getBullets() { return bullets; }
    public void setBullets(int bullets) { this.bullets = bullets; }

    public int getAmmoBoxes() { return ammoBoxes; }
    public void setAmmoBoxes(int ammoBoxes) { this.ammoBoxes = ammoBoxes; }

    public int getConnections() { return connections; }
    public void setConnections(int connections) { this.connections = connections; }

    public int getTickRate() { return tickRate; }
    public void setTickRate(int tickRate) { this.tickRate = tickRate; }
}
