package com.polarroute.route.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the mesh directory for new manifests, every 10 minutes by default.
 * Failures propagate to the scheduler's error handler, which logs them; the next run retries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeshImportScheduler {

    private final MeshImportService meshImportService;

    @Scheduled(cron = "${route.mesh.import-cron:0 */10 * * * *}", zone = "UTC")
    public void importNewMeshes() {
        log.debug("Scheduled mesh import starting");
        meshImportService.importNewMeshes();
    }
}
