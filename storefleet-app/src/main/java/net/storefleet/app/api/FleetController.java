package net.storefleet.app.api;

import net.storefleet.core.fleet.FleetHealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/fleet")
public class FleetController {
    private final FleetHealthService health;

    public FleetController(FleetHealthService health) {
        this.health = health;
    }

    @GetMapping("/health")
    public FleetHealthService.FleetReport health() throws Exception {
        return health.report();
    }
}
