package com.dealtracker.bot.config;

import com.dealtracker.bot.model.CategoryTarget;
import com.dealtracker.bot.model.RunConfig;
import com.dealtracker.bot.scheduler.DealScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/bot")
@Slf4j
@RequiredArgsConstructor
public class BotController {

    private final DealScheduler dealScheduler;
    private final RunConfig runConfig;

    /**
     * Ask the polling loop for an extra pass on its next tick.
     *
     * POST /bot/trigger
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (!dealScheduler.requestPass()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "not-running"));
        }
        log.info("Manual pass requested");
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "deal-bot");
        body.put("running", dealScheduler.isRunning());
        body.put("categories", runConfig.getCategories().stream().map(CategoryTarget::name).toList());
        body.put("pollIntervalMinutes", runConfig.getPollIntervalMinutes());
        body.put("priceBand", runConfig.getPriceBand().toString());
        body.put("megaDiscountBand", runConfig.getMegaDiscountBand().toString());
        body.put("lastPass", dealScheduler.getLastPass().orElse(null));
        return ResponseEntity.ok(body);
    }
}
