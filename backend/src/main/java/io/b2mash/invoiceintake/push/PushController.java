package io.b2mash.invoiceintake.push;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/pubsub")
public class PushController {

  private static final Logger log = LoggerFactory.getLogger(PushController.class);

  private final PushIngestService pushIngestService;

  public PushController(PushIngestService pushIngestService) {
    this.pushIngestService = pushIngestService;
  }

  @PostMapping("/push")
  public ResponseEntity<PushResponse> push(
      @RequestBody(required = false) String payload,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestParam(value = "token", required = false) String token) {
    try {
      return ResponseEntity.ok(pushIngestService.ingest(payload, authorization, token));
    } catch (PushAuthenticationException e) {
      log.warn("Push authentication failed: {}", e.getMessage());
      return ResponseEntity.status(401).build();
    }
  }
}
