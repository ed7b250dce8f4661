package io.github.pierce.gdelt.source;

import io.github.pierce.gdelt.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads GDELT v2 file sets from a local directory laid out like the public archive:
 * {@code <ts>.gkg.csv}, {@code <ts>.mentions.CSV}, {@code <ts>.export.CSV}, each optionally
 * zipped with a {@code .zip} suffix.
 */
public class LocalArchiveTableProvider implements SourceTableProvider {

    private static final Map<SourceRole, String> SUFFIXES = new EnumMap<>(Map.of(
            SourceRole.PRIMARY, ".gkg.csv",
            SourceRole.SECONDARY, ".mentions.CSV",
            SourceRole.TERTIARY, ".export.CSV"));

    private final Path directory;
    private final HeaderDictionary dictionary;
    private final DelimitedTableReader reader;
    private final Logger log;

    public LocalArchiveTableProvider(Path directory, HeaderDictionary dictionary) {
        this(directory, dictionary, new DelimitedTableReader(), LoggerFactory.getLogger(LocalArchiveTableProvider.class));
    }

    public LocalArchiveTableProvider(Path directory, HeaderDictionary dictionary,
                                     DelimitedTableReader reader, Logger log) {
        this.directory = directory;
        this.dictionary = dictionary;
        this.reader = reader;
        this.log = log;
    }

    @Override
    public SourceTables fetch(String timestamp, Set<SourceRole> roles) throws IOException {
        Map<SourceRole, Table> tables = new EnumMap<>(SourceRole.class);
        for (SourceRole role : roles) {
            tables.put(role, load(timestamp, role));
        }
        log.info("Successfully loaded {} file(s) for timestamp {}", tables.size(), timestamp);
        return new SourceTables(tables.get(SourceRole.PRIMARY), tables.get(SourceRole.SECONDARY),
                tables.get(SourceRole.TERTIARY));
    }

    private Table load(String timestamp, SourceRole role) throws IOException {
        String name = timestamp + SUFFIXES.get(role);
        Path plain = directory.resolve(name);
        Path zipped = directory.resolve(name + ".zip");
        if (Files.isRegularFile(plain)) {
            log.info("Reading {} from {}", role.fileKey(), plain);
            try (InputStream in = Files.newInputStream(plain)) {
                return reader.read(in, role.fileKey(), dictionary.headers(role));
            }
        }
        if (Files.isRegularFile(zipped)) {
            log.info("Reading {} from {}", role.fileKey(), zipped);
            try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(zipped))) {
                ZipEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    if (!entry.isDirectory() && entry.getName().endsWith(SUFFIXES.get(role))) {
                        return reader.read(zip, role.fileKey(), dictionary.headers(role));
                    }
                }
            }
            throw new IOException("No " + SUFFIXES.get(role) + " entry in " + zipped);
        }
        throw new FileNotFoundException("No " + role.fileKey() + " file for timestamp " + timestamp + " in " + directory);
    }
}
