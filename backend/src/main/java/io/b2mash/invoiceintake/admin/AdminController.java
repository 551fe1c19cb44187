package io.b2mash.invoiceintake.admin;

import io.b2mash.invoiceintake.sync.StartWatchResult;
import io.b2mash.invoiceintake.sync.SyncCoordinator;
import io.b2mash.invoiceintake.sync.SyncSummary;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator triggers. Every endpoint requires the {@value AdminTokenGuard#HEADER} header. */
@RestController
@RequestMapping("/admin")
public class AdminController {

  private final AdminTokenGuard tokenGuard;
  private final SyncCoordinator syncCoordinator;

  public AdminController(AdminTokenGuard tokenGuard, SyncCoordinator syncCoordinator) {
    this.tokenGuard = tokenGuard;
    this.syncCoordinator = syncCoordinator;
  }

  @PostMapping("/start-watch")
  public ResponseEntity<StartWatchResult> startWatch(
      @RequestHeader(value = AdminTokenGuard.HEADER, required = false) String adminToken) {
    tokenGuard.check(adminToken);
    return ResponseEntity.ok(syncCoordinator.startWatch());
  }

  @PostMapping("/full-sync")
  public ResponseEntity<SyncSummary> fullSync(
      @RequestHeader(value = AdminTokenGuard.HEADER, required = false) String adminToken,
      @RequestParam(name = "max_cycles", defaultValue = "${intake.sync.max-cycles:20}") @Min(1)
          int maxCycles) {
    tokenGuard.check(adminToken);
    return ResponseEntity.ok(syncCoordinator.fullSync(maxCycles));
  }

  @GetMapping("/state")
  public ResponseEntity<WatchStateView> state(
      @RequestHeader(value = AdminTokenGuard.HEADER, required = false) String adminToken) {
    tokenGuard.check(adminToken);
    return ResponseEntity.ok(WatchStateView.from(syncCoordinator.currentState()));
  }

  @PostMapping("/state/reset")
  public ResponseEntity<WatchStateView> resetState(
      @RequestHeader(value = AdminTokenGuard.HEADER, required = false) String adminToken) {
    tokenGuard.check(adminToken);
    return ResponseEntity.ok(WatchStateView.from(syncCoordinator.resetState()));
  }
}
