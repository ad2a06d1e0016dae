package com.radoncal.server.controller;

import com.radoncal.server.pipeline.HostStatus;
import com.radoncal.server.service.PipelineLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
public class PipelineControlController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineControlController.class);
    private final PipelineLifecycleService lifecycleService;

    public PipelineControlController(PipelineLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    public static class ControlRequest {
        public String action;
    }

    @PostMapping("/control")
    public ResponseEntity<Map<String, String>> control(@RequestBody(required = false) ControlRequest request) {
        if (request == null || !"stop".equals(request.action)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid action"));
        }

        logger.info("Received stop request.");
        lifecycleService.requestStop();
        return ResponseEntity.ok(Map.of("message", "Successfully set stop-script flag"));
    }

    @GetMapping("/status")
    public ResponseEntity<HostStatus> status() {
        return ResponseEntity.ok(lifecycleService.getStatus());
    }
}
