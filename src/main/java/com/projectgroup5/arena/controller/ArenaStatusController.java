package com.projectgroup5.arena.controller;

import com.projectgroup5.arena.dto.GameSnapshot;
import com.projectgroup5.arena.dto.ServerStatusDto;
import com.projectgroup5.arena.game.GameTickScheduler;
import com.projectgroup5.arena.net.ClientRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 只读的服务器状态接口，数据全部来自最近一帧的不可变快照
 */
@RestController
@RequestMapping("/api/arena")
@CrossOrigin(origins = "*")
public class ArenaStatusController {

    private final GameTickScheduler tickScheduler;
    private final ClientRegistry clientRegistry;

    public ArenaStatusController(GameTickScheduler tickScheduler,
                                 ClientRegistry clientRegistry) {
        this.tickScheduler = tickScheduler;
        this.clientRegistry = clientRegistry;
    }

    @GetMapping("/status")
    public ResponseEntity<ServerStatusDto> getStatus() {
        GameSnapshot snapshot = tickScheduler.getLatestSnapshot();
        return ResponseEntity.ok(new ServerStatusDto(
                snapshot.getTick(),
                snapshot.getPlayers().size(),
                snapshot.getBullets().size(),
                snapshot.getAmmoBoxes().size(),
                clientRegistry.size(),
                tickScheduler.getTickRate()
        ));
    }

    /**
     * 当前完整快照（和广播给客户端的 STATE 内容一致）
     */
    @GetMapping("/snapshot")
    public ResponseEntity<GameSnapshot> getSnapshot() {
        return ResponseEntity.ok(tickScheduler.getLatestSnapshot());
    }
}
