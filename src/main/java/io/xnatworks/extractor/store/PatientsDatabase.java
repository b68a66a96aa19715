/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.extractor.dicom.DicomTag;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.PatientRecord;
import io.xnatworks.extractor.model.RecordEntry;
import io.xnatworks.extractor.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical patient store kept in a single SQLite file.
 *
 * <p>The file holds a tree of nodes addressed by slash-separated paths:</p>
 * <ul>
 *   <li>{@code /<patient>} group, one per patient record</li>
 *   <li>{@code /<patient>/<criterion>} image dataset, float32</li>
 *   <li>{@code /<patient>/<criterion>/<organ>} mask dataset, int8, same shape as the image</li>
 * </ul>
 *
 * <p>Array data is little-endian in C order of the recorded shape. Attributes are text;
 * geometry attributes are JSON arrays. Nothing time-dependent is written, so the same
 * records always give the same content.</p>
 */
public class PatientsDatabase {
    private static final Logger log = LoggerFactory.getLogger(PatientsDatabase.class);

    public static final String GROUP = "group";
    public static final String DATASET = "dataset";
    public static final String FLOAT32 = "float32";
    public static final String INT8 = "int8";

    public static final String PATIENT_FOLDER_ATTRIBUTE = "PatientFolder";
    public static final String TRANSFORMS_ATTRIBUTE_PREFIX = "Transforms_";

    private static final String[] SIDE_FILES = {"-journal", "-wal", "-shm"};

    private final Path path;
    private final StoreOptions options;
    private final ObjectMapper mapper = new ObjectMapper();

    public PatientsDatabase(Path path) {
        this(path, new StoreOptions());
    }

    public PatientsDatabase(Path path, StoreOptions options) {
        this.path = path;
        this.options = options;
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    // ========================================================================
    // Writing
    // ========================================================================

    /**
     * Write every record the iterator yields. Each patient is committed before the next
     * record is requested.
     *
     * @param overwrite replace an existing store; when false an existing store is an error
     * @return number of patients written
     * @throws FileAlreadyExistsException when the store exists and {@code overwrite} is false;
     *                                    nothing has been touched in that case
     */
    public int create(Iterator<PatientRecord> records, boolean overwrite) throws IOException {
        if (exists()) {
            if (!overwrite) {
                throw new FileAlreadyExistsException(path.toString(), null,
                        "Store already exists, use overwrite to replace it");
            }
            log.info("Overwriting store: {}", path);
            delete();
        } else {
            log.info("Writing store: {}", path);
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        int written = 0;
        try (Connection connection = open()) {
            createTables(connection);
            connection.setAutoCommit(false);
            while (records.hasNext()) {
                PatientRecord record = records.next();
                try {
                    if (writePatient(connection, record)) {
                        written++;
                    }
                    connection.commit();
                } catch (SQLException e) {
                    connection.rollback();
                    throw e;
                }
            }
        } catch (SQLException e) {
            log.error("Failed to write store {}: {}", path, e.getMessage(), e);
            throw new IOException("Failed to write store " + path + ": " + e.getMessage(), e);
        }
        log.info("Store {} written with {} patients", path, written);
        return written;
    }

    private void delete() throws IOException {
        Files.deleteIfExists(path);
        for (String suffix : SIDE_FILES) {
            Files.deleteIfExists(path.resolveSibling(path.getFileName() + suffix));
        }
    }

    private Connection open() throws SQLException, IOException {
        try {
            Class.forName("org.sqlite.JDBC");
        } catch (ClassNotFoundException e) {
            throw new IOException("SQLite JDBC driver not available", e);
        }
        return DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
    }

    private void createTables(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS nodes (" +
                "    path TEXT PRIMARY KEY," +
                "    parent TEXT," +
                "    name TEXT NOT NULL," +
                "    kind TEXT NOT NULL," +     // group or dataset
                "    dtype TEXT," +
                "    shape TEXT," +             // JSON array
                "    data BLOB" +
                ")");
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS attributes (" +
                "    path TEXT NOT NULL," +
                "    name TEXT NOT NULL," +
                "    value TEXT," +
                "    PRIMARY KEY (path, name)" +
                ")");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_nodes_parent ON nodes(parent)");
        }
    }

    /**
     * @return false when a patient with the same id was already written and this one was skipped
     */
    private boolean writePatient(Connection connection, PatientRecord record) throws SQLException {
        String patientPath = pathOf(record.getPatientId());
        if (nodeExists(connection, patientPath)) {
            log.warn("Patient {} from folder {} already in the store, skipped",
                    record.getPatientId(), record.getPatientName());
            return false;
        }

        insertNode(connection, patientPath, "/", GROUP, null, null, null);
        insertAttribute(connection, patientPath, PATIENT_FOLDER_ATTRIBUTE, record.getPatientName());
        List<String> transforms = record.getTransforms();
        for (int i = 0; i < transforms.size(); i++) {
            insertAttribute(connection, patientPath, TRANSFORMS_ATTRIBUTE_PREFIX + i, transforms.get(i));
        }

        int masks = 0;
        for (RecordEntry entry : record.getEntries().values()) {
            String imagePath = pathOf(record.getPatientId(), entry.getCriterion());
            Volume image = entry.getImage();
            ImageGeometry geometry = image.getGeometry();
            insertNode(connection, imagePath, patientPath, DATASET, FLOAT32, shapeOf(geometry),
                    encode(image.getData(), geometry));
            writeImageAttributes(connection, imagePath, entry);

            for (Map.Entry<String, Mask> organ : entry.getMasks().entrySet()) {
                if (!options.keepsOrgan(organ.getKey())) {
                    continue;
                }
                Mask mask = organ.getValue();
                insertNode(connection, pathOf(record.getPatientId(), entry.getCriterion(), organ.getKey()),
                        imagePath, DATASET, INT8, shapeOf(mask.getGeometry()), encode(mask.getData(), mask.getGeometry()));
                masks++;
            }
        }
        log.debug("Patient {}: {} images and {} masks written", record.getPatientId(), record.getEntries().size(), masks);
        return true;
    }

    private void writeImageAttributes(Connection connection, String imagePath, RecordEntry entry) throws SQLException {
        for (String spec : options.getAttributes()) {
            int tag = DicomTag.parse(spec);
            String value = entry.getSeries().getAttribute(spec);
            if (tag < 0 || value == null) {
                log.debug("{}: attribute {} not present, not written", imagePath, spec);
                continue;
            }
            insertAttribute(connection, imagePath, DicomTag.nameOf(tag), value);
        }
        if (options.isGeometryAttributes()) {
            ImageGeometry geometry = entry.getImage().getGeometry();
            insertAttribute(connection, imagePath, "Size", toJson(geometry.getSize()));
            insertAttribute(connection, imagePath, "Origin", toJson(geometry.getOrigin()));
            insertAttribute(connection, imagePath, "Spacing", toJson(geometry.getSpacing()));
            insertAttribute(connection, imagePath, "Direction", toJson(geometry.getDirection()));
        }
    }

    private boolean nodeExists(Connection connection, String nodePath) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT 1 FROM nodes WHERE path = ?")) {
            ps.setString(1, nodePath);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void insertNode(Connection connection, String nodePath, String parent, String kind,
                            String dtype, int[] shape, byte[] data) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO nodes (path, parent, name, kind, dtype, shape, data) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, nodePath);
            ps.setString(2, parent);
            ps.setString(3, nodePath.substring(nodePath.lastIndexOf('/') + 1));
            ps.setString(4, kind);
            ps.setString(5, dtype);
            ps.setString(6, shape != null ? toJson(shape) : null);
            ps.setBytes(7, data);
            ps.executeUpdate();
        }
    }

    private void insertAttribute(Connection connection, String nodePath, String name, String value) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR REPLACE INTO attributes (path, name, value) VALUES (?, ?, ?)")) {
            ps.setString(1, nodePath);
            ps.setString(2, name);
            ps.setString(3, value);
            ps.executeUpdate();
        }
    }

    // ========================================================================
    // Array layout
    // ========================================================================

    /**
     * Stored shape: rows, columns, slices when transposing, otherwise slices, rows, columns.
     */
    int[] shapeOf(ImageGeometry geometry) {
        if (options.isTranspose()) {
            return new int[]{geometry.getRows(), geometry.getColumns(), geometry.getSlices()};
        }
        return geometry.getShape();
    }

    private byte[] encode(float[] voxels, ImageGeometry geometry) {
        ByteBuffer buffer = ByteBuffer.allocate(voxels.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int n = 0; n < voxels.length; n++) {
            buffer.putFloat(voxels[sourceIndex(n, geometry)]);
        }
        return buffer.array();
    }

    private byte[] encode(byte[] voxels, ImageGeometry geometry) {
        if (!options.isTranspose()) {
            return voxels.clone();
        }
        byte[] out = new byte[voxels.length];
        for (int n = 0; n < voxels.length; n++) {
            out[n] = voxels[sourceIndex(n, geometry)];
        }
        return out;
    }

    /**
     * Index into the column-fastest volume of the n-th element in stored order.
     */
    private int sourceIndex(int n, ImageGeometry geometry) {
        if (!options.isTranspose()) {
            return n;
        }
        int slices = geometry.getSlices();
        int columns = geometry.getColumns();
        int k = n % slices;
        int i = (n / slices) % columns;
        int j = n / (slices * columns);
        return geometry.index(i, j, k);
    }

    // ========================================================================
    // Reading
    // ========================================================================

    /**
     * Patient ids in the order they were written.
     */
    public List<String> listPatients() throws IOException {
        return childNames("/");
    }

    public List<String> listImages(String patientId) throws IOException {
        return childNames(pathOf(patientId));
    }

    public List<String> listOrgans(String patientId, String criterion) throws IOException {
        return childNames(pathOf(patientId, criterion));
    }

    public int[] getShape(String nodePath) throws IOException {
        String shape = queryNodeColumn(nodePath, "shape");
        if (shape == null) {
            return null;
        }
        try {
            return mapper.readValue(shape, int[].class);
        } catch (JsonProcessingException e) {
            throw new IOException("Corrupt shape for " + nodePath + ": " + shape, e);
        }
    }

    public String getDtype(String nodePath) throws IOException {
        return queryNodeColumn(nodePath, "dtype");
    }

    public float[] readImage(String patientId, String criterion) throws IOException {
        byte[] data = readData(pathOf(patientId, criterion));
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        float[] values = new float[data.length / 4];
        buffer.asFloatBuffer().get(values);
        return values;
    }

    public byte[] readMask(String patientId, String criterion, String organ) throws IOException {
        return readData(pathOf(patientId, criterion, organ));
    }

    /**
     * Attributes of a node, in name order.
     */
    public Map<String, String> getAttributes(String nodePath) throws IOException {
        requireStore();
        Map<String, String> attributes = new LinkedHashMap<>();
        try (Connection connection = open();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT name, value FROM attributes WHERE path = ? ORDER BY name")) {
            ps.setString(1, nodePath);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    attributes.put(rs.getString("name"), rs.getString("value"));
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read attributes of " + nodePath + ": " + e.getMessage(), e);
        }
        return attributes;
    }

    /**
     * A geometry attribute (Size, Origin, Spacing, Direction) decoded from its JSON form.
     */
    public double[] getVectorAttribute(String nodePath, String name) throws IOException {
        String value = getAttributes(nodePath).get(name);
        if (value == null) {
            return null;
        }
        return mapper.readValue(value, double[].class);
    }

    private List<String> childNames(String parent) throws IOException {
        requireStore();
        List<String> names = new ArrayList<>();
        try (Connection connection = open();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT name FROM nodes WHERE parent = ? ORDER BY rowid")) {
            ps.setString(1, parent);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString("name"));
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list " + parent + ": " + e.getMessage(), e);
        }
        return names;
    }

    private String queryNodeColumn(String nodePath, String column) throws IOException {
        requireStore();
        try (Connection connection = open();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT " + column + " FROM nodes WHERE path = ?")) {
            ps.setString(1, nodePath);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NoSuchFileException(path + ":" + nodePath);
                }
                return rs.getString(1);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read " + nodePath + ": " + e.getMessage(), e);
        }
    }

    private byte[] readData(String nodePath) throws IOException {
        requireStore();
        try (Connection connection = open();
             PreparedStatement ps = connection.prepareStatement("SELECT data FROM nodes WHERE path = ?")) {
            ps.setString(1, nodePath);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getBytes(1) == null) {
                    throw new NoSuchFileException(path + ":" + nodePath);
                }
                return rs.getBytes(1);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read " + nodePath + ": " + e.getMessage(), e);
        }
    }

    private void requireStore() throws IOException {
        if (!exists()) {
            throw new NoSuchFileException(path.toString(), null, "Store does not exist, create it first");
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + value, e);
        }
    }

    // ========================================================================
    // Paths
    // ========================================================================

    /**
     * Node path for the given names. Slashes inside a name are replaced by underscores.
     */
    public static String pathOf(String... names) {
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            sb.append('/').append(sanitize(name));
        }
        return sb.length() > 0 ? sb.toString() : "/";
    }

    static String sanitize(String name) {
        return name.replace('/', '_');
    }
}
