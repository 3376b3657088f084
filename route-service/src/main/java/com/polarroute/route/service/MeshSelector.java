package com.polarroute.route.service;

import com.polarroute.route.entity.Mesh;
import com.polarroute.route.repository.MeshRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Chooses candidate meshes for a pair of waypoints.
 *
 * Selection:
 *  1. Keep meshes whose closed bounding box contains both the start and the end point
 *  2. Find the latest creation date (calendar day in the clock's zone) among them
 *  3. Keep only meshes created on that day
 *  4. Order by extent ascending (most specific first), then by id
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeshSelector {

    static final Comparator<Mesh> MOST_SPECIFIC_FIRST =
            Comparator.comparingDouble(Mesh::getSize).thenComparing(Mesh::getId);

    private final MeshRepository meshRepository;
    private final Clock clock;

    public List<Mesh> selectMesh(double startLat, double startLon, double endLat, double endLon) {
        List<Mesh> containing = meshRepository.findContainingBoth(startLat, startLon, endLat, endLon);
        if (containing.isEmpty()) {
            log.info("No mesh contains both ({}, {}) and ({}, {})", startLat, startLon, endLat, endLon);
            return List.of();
        }

        LocalDate latest = containing.stream()
                .map(this::creationDate)
                .max(Comparator.naturalOrder())
                .orElseThrow();

        List<Mesh> selected = containing.stream()
                .filter(m -> creationDate(m).equals(latest))
                .sorted(MOST_SPECIFIC_FIRST)
                .toList();

        log.debug("Selected {} of {} containing mesh(es) created on {}", selected.size(), containing.size(), latest);
        return selected;
    }

    private LocalDate creationDate(Mesh mesh) {
        return LocalDate.ofInstant(mesh.getCreatedAt(), clock.getZone());
    }
}
