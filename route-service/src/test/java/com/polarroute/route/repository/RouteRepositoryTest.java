package com.polarroute.route.repository;

import com.polarroute.route.entity.Job;
import com.polarroute.route.entity.Mesh;
import com.polarroute.route.entity.Route;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class RouteRepositoryTest {

    @Autowired private TestEntityManager em;
    @Autowired private RouteRepository routeRepository;
    @Autowired private JobRepository jobRepository;

    @Test
    @DisplayName("Routes are listed per mesh in id order")
    void routesPerMesh() {
        Mesh a = em.persist(mesh("a"));
        Mesh b = em.persist(mesh("b"));
        Route first = routeRepository.save(route(a));
        Route second = routeRepository.save(route(a));
        routeRepository.save(route(b));

        assertThat(routeRepository.findByMeshIdOrderByIdAsc(a.getId())).containsExactly(first, second);
    }

    @Test
    @DisplayName("A checkpointed route keeps its unsmoothed geometry with no final geometry")
    void checkpointPersisted() {
        Route route = route(em.persist(mesh("c")));
        route.setJsonUnsmoothed(Map.of("type", "FeatureCollection", "features", List.of()));
        route.setCalculatedAt(Instant.parse("2024-01-02T10:00:00Z"));
        route.setInfo("smoothing diverged");
        Long id = routeRepository.saveAndFlush(route).getId();
        em.clear();

        Route loaded = routeRepository.findById(id).orElseThrow();

        assertThat(loaded.isCheckpoint()).isTrue();
        assertThat(loaded.isResolved()).isFalse();
        assertThat(loaded.getJsonUnsmoothed()).containsEntry("type", "FeatureCollection");
        assertThat(loaded.getInfo()).isEqualTo("smoothing diverged");
        assertThat(loaded.getRequestedAt()).isNotNull();
    }

    @Test
    @DisplayName("Routes are found by request time window")
    void requestedWindow() {
        Route route = routeRepository.saveAndFlush(route(em.persist(mesh("d"))));
        Instant requested = route.getRequestedAt();

        assertThat(routeRepository.findByRequestedAtGreaterThanEqualAndRequestedAtLessThanOrderByIdAsc(
                requested.minusSeconds(60), requested.plusSeconds(60))).containsExactly(route);
        assertThat(routeRepository.findByRequestedAtGreaterThanEqualAndRequestedAtLessThanOrderByIdAsc(
                requested.plusSeconds(60), requested.plusSeconds(120))).isEmpty();
    }

    @Test
    @DisplayName("Jobs are stored under the task id and found per route")
    void jobPerRoute() {
        Route route = routeRepository.save(route(em.persist(mesh("e"))));
        UUID taskId = UUID.randomUUID();
        jobRepository.saveAndFlush(Job.builder().id(taskId).route(route).build());

        assertThat(jobRepository.findFirstByRouteIdOrderByCreatedAtDesc(route.getId()))
                .get()
                .extracting(Job::getId)
                .isEqualTo(taskId);
    }

    private static Mesh mesh(String name) {
        return Mesh.builder()
                .checksum("md5-" + name)
                .name(name)
                .createdAt(Instant.parse("2024-01-02T00:00:00Z"))
                .latMin(-80).latMax(-50).lonMin(-80).lonMax(-50)
                .size(900)
                .json(Map.of())
                .build();
    }

    private static Route route(Mesh mesh) {
        return Route.builder()
                .mesh(mesh)
                .startLat(-65).startLon(-65)
                .endLat(-61).endLon(-61)
                .build();
    }
}
