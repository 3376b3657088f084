package com.polarroute.route.service;

import com.polarroute.route.entity.Mesh;
import com.polarroute.route.entity.Route;
import com.polarroute.route.repository.RouteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.polarroute.route.service.ToleranceRankerTest.route;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RouteMatcherTest {

    @Mock private RouteRepository routeRepository;

    private RouteMatcher matcher;

    private final Mesh meshA = MeshSelectorTest.mesh(1L, "2024-01-02T00:00:00Z", -70, -60, -70, -60);
    private final Mesh meshB = MeshSelectorTest.mesh(2L, "2024-01-02T00:00:00Z", -80, -50, -80, -50);
    private final Mesh meshC = MeshSelectorTest.mesh(3L, "2024-01-02T00:00:00Z", -85, -45, -85, -45);

    @BeforeEach
    void setUp() {
        matcher = new RouteMatcher(routeRepository, new ToleranceRanker(5.0));
    }

    @Test
    @DisplayName("Exact endpoint match returns the lowest id when several routes are identical")
    void exactMatchLowestId() {
        Route r7 = route(7L, -65, -65, -61, -61);
        Route r3 = route(3L, -65, -65, -61, -61);
        when(routeRepository.findByMeshIdOrderByIdAsc(1L)).thenReturn(List.of(r7, r3));

        Optional<Route> match = matcher.findExistingRoute(List.of(meshA), -65, -65, -61, -61);

        assertThat(match).contains(r3);
    }

    @Test
    @DisplayName("Exact match is preferred over a closer-ranked tolerance candidate")
    void exactBeatsTolerance() {
        Route nearby = route(1L, -65.001, -65, -61, -61);
        Route exact = route(2L, -65, -65, -61, -61);
        when(routeRepository.findByMeshIdOrderByIdAsc(1L)).thenReturn(List.of(nearby, exact));

        assertThat(matcher.findExistingRoute(List.of(meshA), -65, -65, -61, -61)).contains(exact);
    }

    @Test
    @DisplayName("Falls back to tolerance matching within the first mesh that has routes")
    void toleranceFallback() {
        Route nearby = route(5L, -65.01, -64.99, -61.02, -61);
        when(routeRepository.findByMeshIdOrderByIdAsc(1L)).thenReturn(List.of());
        when(routeRepository.findByMeshIdOrderByIdAsc(2L)).thenReturn(List.of(nearby));

        assertThat(matcher.findExistingRoute(List.of(meshA, meshB), -65, -65, -61, -61)).contains(nearby);
    }

    @Test
    @DisplayName("The first mesh with routes decides even when a later mesh has an exact match")
    void firstMeshWithRoutesDecides() {
        Route unrelated = route(1L, -55, -55, -52, -52);
        when(routeRepository.findByMeshIdOrderByIdAsc(1L)).thenReturn(List.of());
        when(routeRepository.findByMeshIdOrderByIdAsc(2L)).thenReturn(List.of(unrelated));

        Optional<Route> match = matcher.findExistingRoute(List.of(meshA, meshB, meshC), -65, -65, -61, -61);

        assertThat(match).isEmpty();
        verify(routeRepository, never()).findByMeshIdOrderByIdAsc(3L);
    }

    @Test
    @DisplayName("No mesh with stored routes gives no match")
    void noRoutesAnywhere() {
        when(routeRepository.findByMeshIdOrderByIdAsc(1L)).thenReturn(List.of());
        when(routeRepository.findByMeshIdOrderByIdAsc(2L)).thenReturn(List.of());

        assertThat(matcher.findExistingRoute(List.of(meshA, meshB), -65, -65, -61, -61)).isEmpty();
    }

    @Test
    @DisplayName("Repeated lookups over the same data return the same route")
    void deterministic() {
        Route a = route(4L, -65.01, -65, -61, -61);
        Route b = route(2L, -65, -65.01, -61, -61);
        when(routeRepository.findByMeshIdOrderByIdAsc(1L)).thenReturn(List.of(a, b));

        Optional<Route> first = matcher.findExistingRoute(List.of(meshA), -65, -65, -61, -61);
        Optional<Route> second = matcher.findExistingRoute(List.of(meshA), -65, -65, -61, -61);

        assertThat(first).isPresent();
        assertThat(second).isEqualTo(first);
    }
}
