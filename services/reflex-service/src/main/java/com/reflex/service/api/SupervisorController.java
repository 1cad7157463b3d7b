package com.reflex.service.api;

import com.reflex.supervisor.ConnectionSupervisor;
import com.reflex.supervisor.Session;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Session status and the operator reset for a supervisor that gave up reconnecting. */
@RestController
@RequestMapping("/api/v1/supervisor")
public class SupervisorController {

    private final ConnectionSupervisor supervisor;

    public SupervisorController(ConnectionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping
    public Session session() {
        return supervisor.session();
    }

    @PostMapping("/reset")
    public Map<String, Object> reset() {
        boolean reset = supervisor.reset();
        return Map.of("reset", reset, "state", supervisor.currentState().name());
    }
}
