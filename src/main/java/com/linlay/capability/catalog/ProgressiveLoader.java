package com.linlay.capability.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * Second phase of progressive disclosure: reads the full definition file for one resource
 * and merges the body into the cataloged instance instead of replacing it.
 */
public class ProgressiveLoader<R extends CapabilityResource> {

    private static final Logger log = LoggerFactory.getLogger(ProgressiveLoader.class);

    private final ResourceKind<R> kind;
    private final FrontmatterCodec codec;
    private final Lock mergeLock;
    private final Function<String, R> catalogLookup;

    /**
     * @param catalogLookup returns the current catalog entry for a name; only called while
     *                      {@code mergeLock} is held
     */
    public ProgressiveLoader(ResourceKind<R> kind, FrontmatterCodec codec, Lock mergeLock,
                             Function<String, R> catalogLookup) {
        this.kind = kind;
        this.codec = codec;
        this.mergeLock = mergeLock;
        this.catalogLookup = catalogLookup;
    }

    /**
     * @param name   an already validated resource name
     * @param cached the catalog entry for {@code name} as last seen by the caller, or null when
     *               the name was never discovered
     * @return the catalog entry with its body filled in, or a detached fully decoded resource
     *         when nothing was cached
     */
    public R load(String name, R cached, List<SearchRoot> roots) {
        if (cached != null && cached.isBodyLoaded()) {
            log.debug("{} '{}' body already loaded", kind.name(), name);
            return cached;
        }

        if (cached == null || cached.getDirectoryPath().isEmpty()) {
            return loadDetached(name, roots);
        }

        R full = readFull(Path.of(cached.getDirectoryPath()).resolve(kind.definitionFileName()), name);
        mergeLock.lock();
        try {
            // a rediscovery may have replaced the entry since the caller looked it up
            R current = catalogLookup.apply(name);
            R target = current != null && current.getDirectoryPath().equals(cached.getDirectoryPath())
                    ? current
                    : cached;
            if (!target.isBodyLoaded()) {
                target.fillBody(full.getRawFrontmatter(), full.getBody());
            }
            return target;
        } finally {
            mergeLock.unlock();
        }
    }

    private R loadDetached(String name, List<SearchRoot> roots) {
        SearchRoot root = findRoot(name, roots);
        if (root == null) {
            throw new ResourceFileNotFoundException(kind.definitionFileName(), name);
        }
        Path dir = root.path().resolve(name);
        R full = readFull(dir.resolve(kind.definitionFileName()), name);
        full.locate(root.sourceType(), dir.toString(), dir.toAbsolutePath().normalize().toString());
        return full;
    }

    private SearchRoot findRoot(String name, List<SearchRoot> roots) {
        for (SearchRoot root : roots) {
            if (Files.isRegularFile(root.path().resolve(name).resolve(kind.definitionFileName()))) {
                return root;
            }
        }
        return null;
    }

    private R readFull(Path definitionFile, String name) {
        String content;
        try {
            content = Files.readString(definitionFile);
        } catch (NoSuchFileException ex) {
            throw new ResourceFileNotFoundException(kind.definitionFileName(), name);
        } catch (IOException ex) {
            throw new CatalogException("failed to read " + definitionFile, ex);
        }

        R full = codec.decodeFull(content, kind);
        if (!name.equals(full.getName())) {
            throw new InvalidResourceException(
                    kind.name() + " name '" + full.getName() + "' in " + definitionFile + " does not match '" + name + "'"
            );
        }
        return full;
    }
}
