package com.polarroute.route.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polarroute.route.entity.Mesh;
import com.polarroute.route.exception.MeshIngestionException;
import com.polarroute.route.metrics.RouteMetrics;
import com.polarroute.route.model.ImportedMesh;
import com.polarroute.route.repository.MeshRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Registers new meshes published to the mesh directory.
 *
 * Import flow:
 *  1. Find the newest {@code upload_metadata_*.yaml.gz} manifest by modification time
 *  2. Gunzip + parse its {@code records} list
 *  3. Skip records that are not vessel meshes ({@code *.vessel.json})
 *  4. Skip checksums already stored; otherwise load {@code <mesh-dir>/<file>.gz} and insert
 *
 * Insertion is keyed by checksum, so repeated runs over the same manifest add nothing. A missing
 * manifest is an operational fault and is raised, not ignored.
 */
@Slf4j
@Service
public class MeshImportService {

    static final String MANIFEST_PREFIX = "upload_metadata_";
    static final String MANIFEST_SUFFIX = ".yaml.gz";
    static final String VESSEL_MESH_SUFFIX = ".vessel.json";
    static final DateTimeFormatter CREATED_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final MeshRepository meshRepository;
    private final ObjectMapper objectMapper;
    private final RouteMetrics metrics;
    private final Path meshDir;

    public MeshImportService(MeshRepository meshRepository,
                             ObjectMapper objectMapper,
                             RouteMetrics metrics,
                             @Value("${route.mesh.dir:/data/mesh}") String meshDir) {
        this.meshRepository = meshRepository;
        this.objectMapper   = objectMapper;
        this.metrics        = metrics;
        this.meshDir        = Path.of(meshDir);
    }

    public List<ImportedMesh> importNewMeshes() {
        Path manifest = latestManifest();
        log.info("Importing meshes from manifest {}", manifest.getFileName());

        List<ImportedMesh> added = new ArrayList<>();
        for (Map<String, Object> record : readRecords(manifest)) {
            String filepath = String.valueOf(record.get("filepath"));
            if (!filepath.endsWith(VESSEL_MESH_SUFFIX)) {
                continue;
            }

            String checksum = String.valueOf(record.get("md5"));
            if (meshRepository.existsByChecksum(checksum)) {
                log.debug("Mesh {} already stored, skipping", checksum);
                continue;
            }

            Mesh mesh = toMesh(record, filepath, checksum);
            try {
                mesh = meshRepository.save(mesh);
            } catch (DataIntegrityViolationException e) {
                log.info("Mesh {} inserted concurrently, skipping", checksum);
                continue;
            }

            log.info("Adding new mesh to database: {} {} {}", mesh.getId(), mesh.getName(), mesh.getCreatedAt());
            added.add(new ImportedMesh(mesh.getId(), checksum, mesh.getName()));
        }

        metrics.recordMeshesImported(added.size());
        log.info("Mesh import finished, {} new mesh(es)", added.size());
        return added;
    }

    Path latestManifest() {
        if (!Files.isDirectory(meshDir)) {
            throw new MeshIngestionException("Mesh directory " + meshDir + " does not exist.");
        }
        try (Stream<Path> files = Files.list(meshDir)) {
            Optional<Path> latest = files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(MANIFEST_PREFIX) && name.endsWith(MANIFEST_SUFFIX);
                    })
                    .max(Comparator.comparing(this::modifiedTime));
            return latest.orElseThrow(() -> {
                log.error("Upload metadata file not found in {}", meshDir);
                return new MeshIngestionException("Upload metadata file not found.");
            });
        } catch (IOException | UncheckedIOException e) {
            throw new MeshIngestionException("Could not list mesh directory " + meshDir, e);
        }
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> readRecords(Path manifest) {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(manifest))) {
            Object loaded = new Yaml().load(in);
            if (!(loaded instanceof Map) || !(((Map<String, Object>) loaded).get("records") instanceof List)) {
                throw new MeshIngestionException("Manifest " + manifest.getFileName() + " has no records list");
            }
            return (List<Map<String, Object>>) ((Map<String, Object>) loaded).get("records");
        } catch (IOException e) {
            throw new MeshIngestionException("Could not read manifest " + manifest.getFileName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Mesh toMesh(Map<String, Object> record, String filepath, String checksum) {
        String name = filepath.substring(filepath.lastIndexOf('/') + 1);
        Map<String, Object> bounds = (Map<String, Object>) record.get("latlong");
        double latMin = number(bounds, "latmin");
        double latMax = number(bounds, "latmax");
        double lonMin = number(bounds, "lonmin");
        double lonMax = number(bounds, "lonmax");

        return Mesh.builder()
                .checksum(checksum)
                .name(name)
                .createdAt(parseCreated(String.valueOf(record.get("created"))))
                .meshiphiVersion(record.get("meshiphi") != null ? String.valueOf(record.get("meshiphi")) : null)
                .latMin(latMin)
                .latMax(latMax)
                .lonMin(lonMin)
                .lonMax(lonMax)
                .size(Mesh.extentOf(latMin, latMax, lonMin, lonMax))
                .json(readMeshJson(name))
                .build();
    }

    private Map<String, Object> readMeshJson(String name) {
        Path file = meshDir.resolve(name + ".gz");
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return objectMapper.readValue(in, JSON_OBJECT);
        } catch (IOException e) {
            throw new MeshIngestionException("Could not load mesh file " + file.getFileName(), e);
        }
    }

    static Instant parseCreated(String created) {
        return LocalDateTime.parse(created, CREATED_FORMAT).toInstant(ZoneOffset.UTC);
    }

    private static double number(Map<String, Object> bounds, String key) {
        Object value = bounds == null ? null : bounds.get(key);
        if (!(value instanceof Number)) {
            throw new MeshIngestionException("Manifest record bounding box is missing '" + key + "'");
        }
        return ((Number) value).doubleValue();
    }

    private FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
