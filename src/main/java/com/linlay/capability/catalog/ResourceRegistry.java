package com.linlay.capability.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mutable catalog for one resource kind: discovered resources by name, the set of activated
 * names, and programmatically registered resources. One read/write lock guards all three.
 * <p>
 * Rediscovery rebuilds the discovered map from disk. Activation is tracked by name and
 * survives it; an active entry that no root yields any more is kept as it was.
 */
public class ResourceRegistry<R extends CapabilityResource> {

    private static final Logger log = LoggerFactory.getLogger(ResourceRegistry.class);

    private final ResourceKind<R> kind;
    private final List<SearchRoot> roots;
    private final PriorityResolver<R> resolver;
    private final ProgressiveLoader<R> loader;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, R> discovered = new HashMap<>();
    private final Set<String> active = new HashSet<>();
    private final Map<String, R> programmatic = new HashMap<>();

    public ResourceRegistry(ResourceKind<R> kind, List<SearchRoot> roots) {
        FrontmatterCodec codec = new FrontmatterCodec();
        this.kind = kind;
        this.roots = List.copyOf(roots);
        this.resolver = new PriorityResolver<>(new DirectoryScanner<>(kind, codec));
        this.loader = new ProgressiveLoader<>(kind, codec, lock.writeLock(), name -> discovered.get(name));
    }

    public List<SearchRoot> roots() {
        return roots;
    }

    public DiscoveryResult discover() {
        lock.writeLock().lock();
        try {
            Map<String, R> catalog = new HashMap<>();
            PriorityResolver.Resolution<R> resolution = resolver.resolve(roots, catalog);
            for (String name : active) {
                R previous = discovered.get(name);
                if (previous != null && !catalog.containsKey(name)) {
                    log.debug("Keep active {} '{}' whose file is no longer found", kind.name(), name);
                    catalog.put(name, previous);
                }
            }
            discovered = catalog;

            List<ResourceInfo> infos = new ArrayList<>();
            int activeCount = 0;
            for (R resource : resolution.resources()) {
                boolean isActive = active.contains(resource.getName());
                if (isActive) {
                    activeCount++;
                }
                infos.add(resource.snapshot(isActive));
            }
            log.debug("Discovered {} {} resources from {} roots, catalog size={}",
                    infos.size(), kind.name(), roots.size(), catalog.size());
            return new DiscoveryResult(infos, resolution.rootsSearched(), infos.size(), activeCount);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the resource with its body loaded, reading the definition file only when needed.
     * A name that was never discovered is looked up across the search roots and returned
     * without being added to the catalog.
     */
    public R loadFull(String name) {
        ResourceNames.validate(name);
        R cached;
        lock.readLock().lock();
        try {
            R registered = programmatic.get(name);
            if (registered != null) {
                return registered;
            }
            cached = discovered.get(name);
        } finally {
            lock.readLock().unlock();
        }
        return loader.load(name, cached, roots);
    }

    public boolean activate(String name) {
        setActive(name, true);
        return true;
    }

    /**
     * @return true whenever the resource is known, whether or not it was active
     */
    public boolean deactivate(String name) {
        setActive(name, false);
        return true;
    }

    /**
     * Sets the activation state of a discovered resource.
     *
     * @return whether the state actually changed
     */
    public boolean setActive(String name, boolean enabled) {
        ResourceNames.validate(name);
        lock.writeLock().lock();
        try {
            if (!discovered.containsKey(name)) {
                throw new ResourceNotFoundException(kind.name(), name);
            }
            boolean changed = enabled ? active.add(name) : active.remove(name);
            if (changed) {
                log.info("{} {} '{}'", enabled ? "Activated" : "Deactivated", kind.name(), name);
            }
            return changed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void register(R resource) {
        if (resource == null) {
            throw new InvalidResourceException("invalid " + kind.name() + ": cannot be null");
        }
        if (resource.getSourceType() != SourceType.PROGRAMMATIC) {
            throw new InvalidResourceException(
                    kind.name() + " '" + resource.getName() + "' is loaded from "
                            + resource.getSourceType().value() + " and cannot be registered"
            );
        }
        resource.validate();
        lock.writeLock().lock();
        try {
            if (programmatic.containsKey(resource.getName())) {
                throw new ResourceAlreadyRegisteredException(kind.name(), resource.getName());
            }
            programmatic.put(resource.getName(), resource);
            log.info("Registered {} '{}'", kind.name(), resource.getName());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void unregister(String name) {
        ResourceNames.validate(name);
        lock.writeLock().lock();
        try {
            if (programmatic.remove(name) == null) {
                throw new ResourceNotFoundException(kind.name(), name);
            }
            log.info("Unregistered {} '{}'", kind.name(), name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ResourceInfo getByName(String name) {
        lock.readLock().lock();
        try {
            R registered = programmatic.get(name);
            if (registered != null) {
                return registered.snapshot(true);
            }
            R resource = discovered.get(name);
            if (resource == null) {
                throw new ResourceNotFoundException(kind.name(), name);
            }
            return resource.snapshot(active.contains(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Activated discovered resources plus every programmatic one, sorted by name.
     */
    public List<ResourceInfo> listActive() {
        lock.readLock().lock();
        try {
            Map<String, ResourceInfo> infos = new LinkedHashMap<>();
            for (String name : active) {
                R resource = discovered.get(name);
                if (resource != null) {
                    infos.put(name, resource.snapshot(true));
                }
            }
            programmatic.forEach((name, resource) -> infos.put(name, resource.snapshot(true)));
            return sorted(infos);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ResourceInfo> listAll() {
        lock.readLock().lock();
        try {
            Map<String, ResourceInfo> infos = new LinkedHashMap<>();
            discovered.forEach((name, resource) -> infos.put(name, resource.snapshot(active.contains(name))));
            programmatic.forEach((name, resource) -> infos.put(name, resource.snapshot(true)));
            return sorted(infos);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Re-runs entity validation over the whole catalog; never throws for individual entries.
     */
    public Map<String, CatalogException> validateAll() {
        lock.readLock().lock();
        try {
            Map<String, CatalogException> failures = new LinkedHashMap<>();
            List<R> resources = new ArrayList<>(discovered.values());
            resources.addAll(programmatic.values());
            resources.sort(Comparator.comparing(CapabilityResource::getName));
            for (R resource : resources) {
                try {
                    resource.validate();
                } catch (CatalogException ex) {
                    failures.put(resource.getName(), ex);
                }
            }
            return failures;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<ResourceInfo> sorted(Map<String, ResourceInfo> infos) {
        return infos.values().stream()
                .sorted(Comparator.comparing(ResourceInfo::name))
                .toList();
    }
}
