package com.polarroute.route.repository;

import com.polarroute.route.entity.Mesh;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MeshRepository extends JpaRepository<Mesh, Long> {

    boolean existsByChecksum(String checksum);

    /** Meshes whose closed bounding box holds both points. */
    @Query("SELECT m FROM Mesh m " +
           "WHERE m.latMin <= :startLat AND m.latMax >= :startLat " +
           "AND m.lonMin <= :startLon AND m.lonMax >= :startLon " +
           "AND m.latMin <= :endLat AND m.latMax >= :endLat " +
           "AND m.lonMin <= :endLon AND m.lonMax >= :endLon")
    List<Mesh> findContainingBoth(@Param("startLat") double startLat,
                                  @Param("startLon") double startLon,
                                  @Param("endLat") double endLat,
                                  @Param("endLon") double endLon);
}
