package com.polarroute.route.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Navigable mesh for a geographic region. Written once by the mesh import job, never updated.
 */
@Entity
@Table(name = "meshes",
        indexes = {
                @Index(name = "idx_mesh_checksum", columnList = "checksum", unique = true),
                @Index(name = "idx_mesh_created", columnList = "created_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Mesh {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** md5 of the source artifact. */
    @Column(nullable = false, unique = true, length = 64)
    private String checksum;

    private String name;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "lat_min", nullable = false)
    private double latMin;

    @Column(name = "lat_max", nullable = false)
    private double latMax;

    @Column(name = "lon_min", nullable = false)
    private double lonMin;

    @Column(name = "lon_max", nullable = false)
    private double lonMax;

    /** Bounding-box area in square degrees. Smaller means more specific. */
    @Column(nullable = false)
    private double size;

    @Column(name = "meshiphi_version")
    private String meshiphiVersion;

    @ToString.Exclude
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "mesh_json")
    private Map<String, Object> json;

    public static double extentOf(double latMin, double latMax, double lonMin, double lonMax) {
        return (latMax - latMin) * (lonMax - lonMin);
    }
}
