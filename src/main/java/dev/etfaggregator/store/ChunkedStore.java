package dev.etfaggregator.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Flat-file key/value store for datasets identified by {@code (collection, kind)}.
 * <p>
 * Layout under the root directory:
 * <pre>
 * &lt;collection&gt;/&lt;kind&gt;.&lt;ext&gt;            single segment
 * &lt;collection&gt;/&lt;kind&gt;_part&lt;N&gt;.&lt;ext&gt;     chunked, N = 0..k-1
 * &lt;collection&gt;/&lt;kind&gt;_metadata.json    manifest
 * </pre>
 * No segment written by a multi-record group exceeds {@code maxSegmentBytes}; a single record
 * larger than the ceiling is stored alone in an oversized segment.
 * <p>
 * A save stages every segment and the manifest as temporary siblings before anything is
 * moved into place. Segments are then committed first and the manifest last, and segments
 * the new manifest no longer references are deleted. Each segment's MD5 is recorded in the
 * manifest, so a load never returns segments from two different saves.
 * Readers and writers of the same dataset in this process are serialized by a
 * per-dataset read/write lock.
 */
@Slf4j
public class ChunkedStore {

    private static final String MANIFEST_SUFFIX = "_metadata.json";
    private static final String PART_INFIX = "_part";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path root;
    private final long maxSegmentBytes;
    private final RecordSerializer serializer;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public ChunkedStore(Path root, long maxSegmentBytes, RecordSerializer serializer, Clock clock) {
        if (maxSegmentBytes <= 0) {
            throw new IllegalArgumentException("maxSegmentBytes must be positive: " + maxSegmentBytes);
        }
        this.root = root.toAbsolutePath().normalize();
        this.maxSegmentBytes = maxSegmentBytes;
        this.serializer = serializer;
        this.clock = clock;
    }

    public Path getRoot() {
        return root;
    }

    public long getMaxSegmentBytes() {
        return maxSegmentBytes;
    }

    /**
     * Persist {@code records} as the complete new content of the dataset, replacing any
     * previous version.
     *
     * @return the manifest that was written
     * @throws InvalidDatasetNameException if either name fails validation
     * @throws StorageException            if a file cannot be written
     */
    public <T> DatasetManifest save(String collection, String kind, List<T> records, SerializationFormat format) {
        String safeCollection = DatasetNames.sanitize(collection);
        String safeKind = DatasetNames.sanitizeKind(kind);
        Path dir = DatasetNames.resolveWithin(root, safeCollection);

        ReadWriteLock lock = lockFor(safeCollection, safeKind);
        lock.writeLock().lock();
        try {
            Files.createDirectories(dir);

            byte[] serialized = serializer.writeArray(records, format);
            DatasetManifest.DatasetManifestBuilder manifest = DatasetManifest.builder()
                    .collection(safeCollection)
                    .kind(safeKind)
                    .updatedAt(clock.instant())
                    .recordCount(records.size())
                    .totalBytes(serialized.length)
                    .format(format);

            // Nothing is moved into place until every file has been staged
            List<Path> staged = new ArrayList<>();
            Set<String> written = new HashSet<>();
            DatasetManifest result;
            try {
                if (serialized.length <= maxSegmentBytes) {
                    String file = segmentFileName(safeKind, format, -1);
                    staged.add(stage(dir.resolve(file), serialized));
                    written.add(file);
                    manifest.chunked(false).file(file).md5(DigestUtils.md5DigestAsHex(serialized));
                } else {
                    List<List<T>> groups = split(records, format);
                    List<SegmentInfo> chunks = new ArrayList<>(groups.size());
                    for (int i = 0; i < groups.size(); i++) {
                        List<T> group = groups.get(i);
                        byte[] bytes = serializer.writeArray(group, format);
                        String file = segmentFileName(safeKind, format, i);
                        staged.add(stage(dir.resolve(file), bytes));
                        written.add(file);
                        chunks.add(new SegmentInfo(file, group.size(), bytes.length, DigestUtils.md5DigestAsHex(bytes)));
                    }
                    manifest.chunked(true).chunkCount(chunks.size()).chunks(chunks);
                }
                result = manifest.build();
                staged.add(stage(dir.resolve(manifestFileName(safeKind)), serializer.writeManifest(result)));
            } catch (IOException e) {
                discard(staged, e);
                throw e;
            }

            // Manifest is last in the list and commits the new version
            for (int i = 0; i < staged.size(); i++) {
                try {
                    commit(staged.get(i));
                } catch (IOException e) {
                    discard(staged.subList(i, staged.size()), e);
                    throw e;
                }
            }
            purgeOrphans(dir, safeKind, written);

            log.debug("Saved {}/{}: {} records, {} bytes, {} segment(s)",
                    safeCollection, safeKind, result.getRecordCount(), result.getTotalBytes(), result.segmentCount());
            return result;
        } catch (IOException e) {
            throw new StorageException("Failed to save dataset " + safeCollection + "/" + safeKind, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Read a dataset back in its original order. A dataset that was never written loads as
     * an empty list.
     *
     * @throws InvalidDatasetNameException if either name fails validation
     * @throws StorageException            if the manifest or a segment is unreadable or missing
     */
    public <T> List<T> load(String collection, String kind, Class<T> type) {
        String safeCollection = DatasetNames.sanitize(collection);
        String safeKind = DatasetNames.sanitizeKind(kind);
        Path dir = DatasetNames.resolveWithin(root, safeCollection);

        ReadWriteLock lock = lockFor(safeCollection, safeKind);
        lock.readLock().lock();
        try {
            Optional<DatasetManifest> found = readManifest(dir, safeKind);
            if (found.isEmpty()) {
                return List.of();
            }
            DatasetManifest manifest = found.get();
            SerializationFormat format = manifest.getFormat() != null ? manifest.getFormat() : SerializationFormat.JSON;

            List<T> records = new ArrayList<>(manifest.getRecordCount());
            if (!manifest.isChunked()) {
                String file = manifest.getFile() != null ? manifest.getFile() : segmentFileName(safeKind, format, -1);
                records.addAll(readSegment(dir, safeKind, file, manifest.getMd5(), type, format));
            } else {
                for (SegmentInfo chunk : manifest.getChunks()) {
                    List<T> part = readSegment(dir, safeKind, chunk.file(), chunk.md5(), type, format);
                    if (part.size() != chunk.count()) {
                        throw new StorageException("Segment " + chunk.file() + " holds " + part.size()
                                + " records but its manifest entry declares " + chunk.count());
                    }
                    records.addAll(part);
                }
            }

            if (records.size() != manifest.getRecordCount()) {
                throw new StorageException("Dataset " + safeCollection + "/" + safeKind + " holds "
                        + records.size() + " records but its manifest declares " + manifest.getRecordCount());
            }
            return records;
        } catch (IOException e) {
            throw new StorageException("Failed to load dataset " + safeCollection + "/" + safeKind, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Read only the manifest, without decoding any segment.
     *
     * @return the manifest, or empty if the dataset was never written
     * @throws StorageException if the manifest exists but cannot be read or parsed
     */
    public Optional<DatasetManifest> manifest(String collection, String kind) {
        String safeCollection = DatasetNames.sanitize(collection);
        String safeKind = DatasetNames.sanitizeKind(kind);
        Path dir = DatasetNames.resolveWithin(root, safeCollection);

        ReadWriteLock lock = lockFor(safeCollection, safeKind);
        lock.readLock().lock();
        try {
            return readManifest(dir, safeKind);
        } catch (IOException e) {
            throw new StorageException("Failed to read manifest of " + safeCollection + "/" + safeKind, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Greedy split: keep adding records to the current group until the next one would push
     * the serialized group over the ceiling.
     */
    <T> List<List<T>> split(List<T> records, SerializationFormat format) throws IOException {
        List<List<T>> groups = new ArrayList<>();
        List<T> current = new ArrayList<>();
        long currentElementBytes = 0;

        for (T record : records) {
            long size = serializer.writeElement(record, format).length;
            long candidate = format.arrayBytes(current.size() + 1, currentElementBytes + size);
            if (candidate > maxSegmentBytes && !current.isEmpty()) {
                groups.add(current);
                current = new ArrayList<>();
                currentElementBytes = 0;
            }
            current.add(record);
            currentElementBytes += size;
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private Optional<DatasetManifest> readManifest(Path dir, String safeKind) throws IOException {
        Path path = dir.resolve(manifestFileName(safeKind));
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        DatasetManifest manifest = serializer.readManifest(Files.readAllBytes(path));
        validate(manifest, path, safeKind);
        return Optional.of(manifest);
    }

    private static void validate(DatasetManifest manifest, Path path, String safeKind) {
        if (manifest.getRecordCount() < 0) {
            throw new StorageException("Manifest " + path + " declares a negative record count");
        }
        if (manifest.isChunked()) {
            List<SegmentInfo> chunks = manifest.getChunks();
            if (chunks == null || chunks.isEmpty()) {
                throw new StorageException("Manifest " + path + " is chunked but lists no segments");
            }
            if (manifest.getChunkCount() != null && manifest.getChunkCount() != chunks.size()) {
                throw new StorageException("Manifest " + path + " declares " + manifest.getChunkCount()
                        + " segments but lists " + chunks.size());
            }
            for (SegmentInfo chunk : chunks) {
                if (chunk == null || chunk.count() < 0 || !isSegmentOf(safeKind, chunk.file())) {
                    throw new StorageException("Manifest " + path + " has an invalid segment entry: " + chunk);
                }
            }
        } else if (manifest.getFile() != null && !isSegmentOf(safeKind, manifest.getFile())) {
            throw new StorageException("Manifest " + path + " references a foreign file: " + manifest.getFile());
        }
    }

    private <T> List<T> readSegment(Path dir, String safeKind, String file, String md5,
                                    Class<T> type, SerializationFormat format) throws IOException {
        Path path = dir.resolve(file);
        if (!Files.exists(path)) {
            throw new StorageException("Segment " + path + " referenced by manifest is missing");
        }
        byte[] bytes = Files.readAllBytes(path);
        if (md5 != null && !md5.equals(DigestUtils.md5DigestAsHex(bytes))) {
            throw new StorageException("Segment " + path + " does not match the checksum recorded for "
                    + safeKind + " in its manifest");
        }
        return serializer.readArray(bytes, type, format);
    }

    private void purgeOrphans(Path dir, String safeKind, Set<String> keep) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (isSegmentOf(safeKind, name) && !keep.contains(name)) {
                    Files.deleteIfExists(path);
                    log.debug("Removed orphan segment {}", path);
                }
            }
        }
    }

    private static boolean isSegmentOf(String safeKind, String file) {
        return file != null && Pattern.matches(
                Pattern.quote(safeKind) + "(" + PART_INFIX + "\\d+)?\\.(json|msgpack)", file);
    }

    private static Path stage(Path target, byte[] bytes) throws IOException {
        Path tmp = tempFor(target);
        try {
            Files.write(tmp, bytes);
        } catch (IOException e) {
            discard(List.of(tmp), e);
            throw e;
        }
        return tmp;
    }

    private static void commit(Path tmp) throws IOException {
        String name = tmp.getFileName().toString();
        Path target = tmp.resolveSibling(name.substring(0, name.length() - TMP_SUFFIX.length()));
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(List<Path> tmps, IOException cause) {
        for (Path tmp : tmps) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
    }

    private static Path tempFor(Path target) {
        return target.resolveSibling(target.getFileName() + TMP_SUFFIX);
    }

    static String segmentFileName(String safeKind, SerializationFormat format, int index) {
        if (index < 0) {
            return safeKind + "." + format.extension();
        }
        return safeKind + PART_INFIX + index + "." + format.extension();
    }

    static String manifestFileName(String safeKind) {
        return safeKind + MANIFEST_SUFFIX;
    }

    private ReadWriteLock lockFor(String safeCollection, String safeKind) {
        return locks.computeIfAbsent(safeCollection + "/" + safeKind, key -> new ReentrantReadWriteLock());
    }
}
