package io.b2mash.invoiceintake.admin;

import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness probe for the container platform. Unauthenticated. */
@RestController
public class HealthController {

  @GetMapping("/healthz")
  public Map<String, Boolean> health() {
    return Map.of("ok", true);
  }
}
