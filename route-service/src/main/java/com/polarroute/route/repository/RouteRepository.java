package com.polarroute.route.repository;

import com.polarroute.route.entity.Route;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RouteRepository extends JpaRepository<Route, Long> {

    List<Route> findByMeshIdOrderByIdAsc(Long meshId);

    List<Route> findByRequestedAtGreaterThanEqualAndRequestedAtLessThanOrderByIdAsc(Instant from, Instant to);
}
