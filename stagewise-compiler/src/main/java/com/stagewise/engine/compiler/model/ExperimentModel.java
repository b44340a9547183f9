package com.stagewise.engine.compiler.model;

import com.stagewise.engine.compiler.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled experiment: the immutable node tree, an id index and the
 * dependency graph. Produced by
 * {@link com.stagewise.engine.compiler.DefinitionCompiler} and shared by all
 * sessions of the experiment.
 */
public final class ExperimentModel {

    private final String experimentId;
    private final int version;
    private final String name;
    private final ExperimentNode root;
    private final Map<String, ExperimentNode> nodesById;
    private final List<ExperimentNode> leaves;
    private final DependencyGraph dependencyGraph;

    public ExperimentModel(String experimentId, int version, String name, ExperimentNode root) {
        this.experimentId = experimentId;
        this.version = version;
        this.name = name;
        this.root = root;
        Map<String, ExperimentNode> index = new LinkedHashMap<>();
        List<ExperimentNode> leafList = new ArrayList<>();
        indexTree(root, index, leafList);
        this.nodesById = Collections.unmodifiableMap(index);
        this.leaves = List.copyOf(leafList);
        this.dependencyGraph = DependencyGraph.build(index.values());
    }

    private static void indexTree(ExperimentNode node, Map<String, ExperimentNode> index,
                                  List<ExperimentNode> leaves) {
        index.put(node.id(), node);
        if (node.isLeaf() && node.level() != NodeLevel.EXPERIMENT) {
            leaves.add(node);
        }
        for (ExperimentNode child : node.children()) {
            indexTree(child, index, leaves);
        }
    }

    public String experimentId() {
        return experimentId;
    }

    public int version() {
        return version;
    }

    public String name() {
        return name;
    }

    public ExperimentNode root() {
        return root;
    }

    public DependencyGraph dependencyGraph() {
        return dependencyGraph;
    }

    public Optional<ExperimentNode> findNode(String id) {
        return Optional.ofNullable(id == null ? null : nodesById.get(id));
    }

    /**
     * @throws IllegalArgumentException if no node has this id
     */
    public ExperimentNode getNode(String id) {
        ExperimentNode node = id == null ? null : nodesById.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    public boolean isLeafUnit(String id) {
        ExperimentNode node = id == null ? null : nodesById.get(id);
        return node != null && node.isLeaf() && node.level() != NodeLevel.EXPERIMENT;
    }

    public Collection<ExperimentNode> nodes() {
        return nodesById.values();
    }

    public List<ExperimentNode> leaves() {
        return leaves;
    }

    /**
     * Ancestors of {@code id} from the nearest parent upwards, excluding the
     * experiment root.
     */
    public List<ExperimentNode> ancestorsOf(String id) {
        List<ExperimentNode> ancestors = new ArrayList<>();
        String parentId = getNode(id).parentId();
        while (parentId != null) {
            ExperimentNode parent = nodesById.get(parentId);
            if (parent == null || parent.level() == NodeLevel.EXPERIMENT) {
                break;
            }
            ancestors.add(parent);
            parentId = parent.parentId();
        }
        return ancestors;
    }

    /**
     * The chain of nodes from the outermost phase down to {@code id} itself.
     */
    public List<ExperimentNode> chainTo(String id) {
        List<ExperimentNode> chain = new ArrayList<>(ancestorsOf(id));
        Collections.reverse(chain);
        chain.add(getNode(id));
        return chain;
    }

    @Override
    public String toString() {
        return "ExperimentModel[" + experimentId + " v" + version + ", " + nodesById.size()
                + " nodes, " + leaves.size() + " units]";
    }
}
