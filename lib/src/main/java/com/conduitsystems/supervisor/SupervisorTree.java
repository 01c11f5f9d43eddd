package com.conduitsystems.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * A hierarchy of {@link SupervisorNode}s. A node created under a parent runs as one of the
 * parent's children, so a failure escalated from it is handled by the parent's strategy
 * with the whole subtree restarted as a unit.
 */
public class SupervisorTree {

    private static final Logger logger = LoggerFactory.getLogger(SupervisorTree.class);

    private record TreeEntry(SupervisorNode node, SupervisorId parentId, ChildId childIdInParent) {

        boolean isRoot() {
            return parentId == null;
        }
    }

    private final Map<SupervisorId, TreeEntry> entries = new ConcurrentHashMap<>();
    // guards structural changes; lookups go straight to the map
    private final Object lock = new Object();

    /**
     * Creates a supervisor. A root when {@code parentId} is null, otherwise started as a
     * permanent child of the parent.
     *
     * @throws TreeIntegrityException if the parent does not exist
     */
    public SupervisorId createSupervisor(SupervisorId parentId, SupervisorConfig config) {
        synchronized (lock) {
            TreeEntry parent = null;
            if (parentId != null) {
                parent = entries.get(parentId);
                if (parent == null) {
                    throw new TreeIntegrityException("Parent supervisor " + parentId + " does not exist");
                }
            }

            SupervisorId id = SupervisorId.random();
            SupervisorNode node = new SupervisorNode(config);
            ChildId childIdInParent = null;
            if (parent != null) {
                // the parent starts the very same node again after a restart
                Supplier<SupervisorNode> self = () -> node;
                ChildSpec spec = ChildSpec.builder(config.getName(), self)
                        .restartPolicy(RestartPolicy.PERMANENT)
                        .build();
                try {
                    childIdInParent = parent.node().startChild(spec);
                } catch (SupervisorException e) {
                    node.shutdown();
                    throw e;
                }
            }
            entries.put(id, new TreeEntry(node, parentId, childIdInParent));
            logger.debug("Created supervisor {} ({}) under {}", config.getName(), id,
                    parentId == null ? "root" : parentId);
            return id;
        }
    }

    /**
     * Shuts the supervisor and all of its descendants down, deepest first, and detaches it
     * from its parent.
     *
     * @throws TreeIntegrityException if no such supervisor exists
     */
    public void removeSupervisor(SupervisorId id) {
        synchronized (lock) {
            TreeEntry entry = entries.get(id);
            if (entry == null) {
                throw new TreeIntegrityException("Supervisor " + id + " does not exist");
            }
            List<SupervisorException> errors = new ArrayList<>();
            if (!entry.isRoot()) {
                TreeEntry parent = entries.get(entry.parentId());
                if (parent != null && parent.node().state() == SupervisorState.RUNNING) {
                    try {
                        parent.node().stopChild(entry.childIdInParent());
                    } catch (SupervisorException e) {
                        errors.add(e);
                    }
                }
            }
            removeSubtree(id, errors);
            if (!errors.isEmpty()) {
                SupervisorException first = errors.get(0);
                errors.subList(1, errors.size()).forEach(first::addSuppressed);
                throw first;
            }
        }
    }

    private void removeSubtree(SupervisorId id, List<SupervisorException> errors) {
        for (SupervisorId child : children(id)) {
            removeSubtree(child, errors);
        }
        TreeEntry entry = entries.remove(id);
        try {
            entry.node().shutdown();
        } catch (SupervisorException e) {
            errors.add(e);
        }
        logger.debug("Removed supervisor {} ({})", entry.node().name(), id);
    }

    /**
     * Hands a failure of {@code id} to its parent, which applies its own strategy to the
     * subtree rooted at {@code id}.
     *
     * @throws TreeIntegrityException if {@code id} is unknown or a root
     */
    public SupervisionDecision escalate(SupervisorId id, Throwable error) {
        TreeEntry entry = entries.get(id);
        if (entry == null) {
            throw new TreeIntegrityException("Supervisor " + id + " does not exist");
        }
        if (entry.isRoot()) {
            throw new TreeIntegrityException("Cannot escalate from root supervisor " + entry.node().name());
        }
        TreeEntry parent = entries.get(entry.parentId());
        if (parent == null) {
            throw new TreeIntegrityException("Parent of supervisor " + entry.node().name() + " is gone");
        }
        logger.info("Escalating failure of supervisor {} to {}", entry.node().name(), parent.node().name());
        return parent.node().handleChildFailure(entry.childIdInParent(), error);
    }

    public Optional<SupervisorNode> supervisor(SupervisorId id) {
        return Optional.ofNullable(entries.get(id)).map(TreeEntry::node);
    }

    public Optional<SupervisorId> parent(SupervisorId id) {
        return Optional.ofNullable(entries.get(id)).map(TreeEntry::parentId);
    }

    public List<SupervisorId> children(SupervisorId id) {
        List<SupervisorId> result = new ArrayList<>();
        entries.forEach((childId, entry) -> {
            if (id.equals(entry.parentId())) {
                result.add(childId);
            }
        });
        return result;
    }

    public List<SupervisorId> roots() {
        List<SupervisorId> result = new ArrayList<>();
        entries.forEach((id, entry) -> {
            if (entry.isRoot()) {
                result.add(id);
            }
        });
        return result;
    }

    /**
     * Removes every root and with it the whole tree.
     */
    public void shutdown() {
        synchronized (lock) {
            for (SupervisorId root : roots()) {
                try {
                    removeSupervisor(root);
                } catch (SupervisorException e) {
                    logger.warn("Error shutting down supervisor tree: {}", e.getMessage());
                }
            }
        }
    }

    public int supervisorCount() {
        return entries.size();
    }

    public int rootCount() {
        return roots().size();
    }
}
