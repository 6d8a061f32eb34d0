package com.dataflow.sdg.persistence;

import com.dataflow.sdg.model.ProductNotFoundException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * {@link Technology#IN_MEMORY} persistence: files and containers are maps
 * held for the lifetime of the instance.
 *
 * <p>
 * All operations are synchronized on the instance.
 */
@Log4j2
public final class InMemoryPersistence implements Persistence {

    private static final class MemoryFile {
        final String name;
        final Technology technology;
        final Map<String, String> settings;
        final Map<String, Container> containers = new LinkedHashMap<>();

        MemoryFile(String name, Technology technology, Map<String, String> settings) {
            this.name = name;
            this.technology = technology;
            this.settings = settings;
        }
    }

    private static final class Container {
        final String type;
        final Map<String, Object> committed = new LinkedHashMap<>();

        Container(String type) {
            this.type = type;
        }
    }

    private record PendingWrite(String label, Object data) {
    }

    private OutputItemConfig items = new OutputItemConfig();
    private TechSettingConfig settings = new TechSettingConfig();
    private final Map<String, MemoryFile> files = new LinkedHashMap<>();
    private final Map<String, Container> containers = new HashMap<>();
    private final Map<String, List<PendingWrite>> pending = new HashMap<>();

    @Override
    public synchronized void configureOutputItems(OutputItemConfig items) {
        this.items = items;
    }

    @Override
    public synchronized void configureTechSettings(TechSettingConfig settings) {
        this.settings = settings;
    }

    /**
     * @throws UnconfiguredProductException if a label has no output item
     * @throws TechnologyMismatchException  if the label's file is not in-memory
     * @throws IllegalArgumentException     if an existing container holds
     *                                      another type
     */
    @Override
    public synchronized void createContainers(String creator, Map<String, String> products) {
        for (Map.Entry<String, String> e : products.entrySet()) {
            String label = e.getKey();
            String containerName = containerName(creator, label);
            Container existing = containers.get(containerName);
            if (existing != null) {
                if (!existing.type.equals(e.getValue()))
                    throw new IllegalArgumentException("Container " + containerName + " holds " + existing.type
                            + ", not " + e.getValue());
                continue;
            }
            PersistenceItem item = items.findItem(label).orElseThrow(() -> new UnconfiguredProductException(label));
            MemoryFile file = attach(item);
            Container container = new Container(e.getValue());
            file.containers.put(containerName, container);
            containers.put(containerName, container);
            log.debug("Created container {} ({}) in {}", containerName, e.getValue(), file.name);
        }
    }

    private MemoryFile attach(PersistenceItem item) {
        MemoryFile file = files.get(item.getFileName());
        if (file != null) {
            if (file.technology != item.getTechnology())
                throw new TechnologyMismatchException("File " + file.name + " uses " + file.technology
                        + " but product " + item.getProductName() + " is configured for " + item.getTechnology());
            return file;
        }
        if (item.getTechnology() != Technology.IN_MEMORY)
            throw new TechnologyMismatchException("In-memory persistence cannot write " + item.getTechnology()
                    + " file " + item.getFileName());
        file = new MemoryFile(item.getFileName(), item.getTechnology(),
                settings.fileSettings(item.getTechnology(), item.getFileName()));
        files.put(file.name, file);
        if (!file.settings.isEmpty())
            log.debug("Opened file {} with settings {}", file.name, file.settings);
        return file;
    }

    @Override
    public synchronized void registerWrite(String creator, String label, Object data, String type) {
        Container container = container(creator, label, type);
        if (container == null)
            throw new IllegalStateException("No container for " + containerName(creator, label)
                    + "; createContainers must be called first");
        pending.computeIfAbsent(creator, k -> new ArrayList<>()).add(new PendingWrite(label, data));
    }

    /**
     * Stores every staged write of the creator under {@code id}, all or none.
     * The staged writes are dropped either way.
     *
     * @throws IllegalStateException if a value was already committed for the id
     */
    @Override
    public synchronized void commitOutput(String creator, String id) {
        List<PendingWrite> writes = pending.remove(creator);
        if (writes == null)
            return;
        // Nothing is stored unless the whole batch fits
        Set<String> labels = new HashSet<>();
        for (PendingWrite write : writes) {
            Container container = containers.get(containerName(creator, write.label()));
            if (!labels.add(write.label()) || container.committed.containsKey(id))
                throw new IllegalStateException("Product " + containerName(creator, write.label())
                        + " already committed for " + id);
        }
        for (PendingWrite write : writes)
            containers.get(containerName(creator, write.label())).committed.put(id, write.data());
    }

    /**
     * @throws ProductNotFoundException if nothing was committed for the id
     * @throws IllegalArgumentException if the container holds another type
     */
    @Override
    public synchronized Object read(String creator, String label, String id, String type) {
        String containerName = containerName(creator, label);
        Container container = container(creator, label, type);
        if (container == null)
            throw new ProductNotFoundException(containerName, "");
        Object value = container.committed.get(id);
        if (value == null)
            throw new ProductNotFoundException(containerName, " for id " + id);
        return value;
    }

    /** Names of the files opened so far. */
    public synchronized Set<String> fileNames() {
        return Set.copyOf(files.keySet());
    }

    /** Names of the containers in one file; empty for an unknown file. */
    public synchronized Set<String> containerNames(String fileName) {
        MemoryFile file = files.get(fileName);
        return file == null ? Set.of() : Set.copyOf(file.containers.keySet());
    }

    /** Number of ids committed to one container. */
    public synchronized int committedCount(String creator, String label) {
        Container container = containers.get(containerName(creator, label));
        return container == null ? 0 : container.committed.size();
    }

    private Container container(String creator, String label, String type) {
        Container container = containers.get(containerName(creator, label));
        if (container != null && !container.type.equals(type))
            throw new IllegalArgumentException("Container " + containerName(creator, label) + " holds "
                    + container.type + ", not " + type);
        return container;
    }

    static String containerName(String creator, String label) {
        return creator + "/" + label;
    }
}
