package com.hivemind.dispatch.api;

import com.hivemind.core.coordinator.SwarmCoordinator;
import com.hivemind.core.coordinator.SwarmStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the coordinator's agent health view.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final SwarmCoordinator coordinator;

    public AgentController(SwarmCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping
    public SwarmStats agents() {
        return coordinator.getSwarmStats();
    }
}
