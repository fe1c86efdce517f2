package com.linlay.capability.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks one search root for definition files and decodes their metadata. Malformed entries are
 * logged and skipped; a missing root yields nothing.
 */
public class DirectoryScanner<R extends CapabilityResource> {

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    private final ResourceKind<R> kind;
    private final FrontmatterCodec codec;

    public DirectoryScanner(ResourceKind<R> kind, FrontmatterCodec codec) {
        this.kind = kind;
        this.codec = codec;
    }

    /**
     * @param seenNames names already claimed by higher-priority roots; updated in place
     * @param catalog   shared name to resource map; every resource this root contributes
     *                  is put here, replacing any entry already stored under its name
     * @return the resources this root contributed, in path order
     */
    public List<R> scan(SearchRoot root, Set<String> seenNames, Map<String, R> catalog) {
        Path dir = root.path();
        if (!Files.isDirectory(dir)) {
            log.debug("Skip missing {} root: {}", kind.name(), dir);
            return List.of();
        }

        List<R> found = new ArrayList<>();
        Set<String> rootNames = new HashSet<>();
        for (Path definitionFile : findDefinitionFiles(dir)) {
            R resource = readMetadata(definitionFile);
            if (resource == null) {
                continue;
            }
            if (!seenNames.add(resource.getName())) {
                if (rootNames.contains(resource.getName())) {
                    log.warn("Skip duplicate {} '{}' at {}", kind.name(), resource.getName(), definitionFile);
                } else {
                    log.debug("Skip {} '{}' from {}, already provided by a higher priority entry",
                            kind.name(), resource.getName(), definitionFile);
                }
                continue;
            }
            rootNames.add(resource.getName());
            Path resourceDir = definitionFile.getParent();
            resource.locate(
                    root.sourceType(),
                    resourceDir.toString(),
                    resourceDir.toAbsolutePath().normalize().toString()
            );
            catalog.put(resource.getName(), resource);
            found.add(resource);
        }
        return found;
    }

    private R readMetadata(Path definitionFile) {
        try {
            String content = Files.readString(definitionFile);
            R resource = codec.decodeMetadataOnly(codec.split(content).yaml(), kind);
            resource.validate();
            Path parent = definitionFile.getParent();
            String dirName = parent == null || parent.getFileName() == null ? "" : parent.getFileName().toString();
            if (!dirName.equals(resource.getName())) {
                log.warn("Skip {} '{}' at {}: directory name '{}' does not match",
                        kind.name(), resource.getName(), definitionFile, dirName);
                return null;
            }
            return resource;
        } catch (IOException | CatalogException ex) {
            log.warn("Skip invalid {} file {}: {}", kind.name(), definitionFile, ex.getMessage());
            return null;
        }
    }

    private List<Path> findDefinitionFiles(Path dir) {
        List<Path> definitionFiles = new ArrayList<>();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || !kind.definitionFileName().equals(String.valueOf(file.getFileName()))) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (dir.equals(file.getParent())) {
                        log.warn("Invalid {} layout entry '{}'. {} files must be placed at <root>/<name>/{}",
                                kind.name(), file, kind.definitionFileName(), kind.definitionFileName());
                        return FileVisitResult.CONTINUE;
                    }
                    definitionFiles.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException ex) {
                    log.warn("Cannot read {} entry {}: {}", kind.name(), file, ex.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            log.warn("Cannot walk {} root {}", kind.name(), dir, ex);
        }
        definitionFiles.sort(Comparator.comparing(Path::toString));
        return definitionFiles;
    }
}
