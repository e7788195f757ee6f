package im.arun.copybook.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Hierarchy of copybook entries under a synthetic level-0 root.
 * Owns every {@link TreeNode}; parent links are indices into this arena.
 */
public class NodeTree {
    public static final String ROOT_NAME = "Root";

    private final List<TreeNode> arena = new ArrayList<>();
    private boolean sealed;

    public NodeTree() {
        arena.add(new TreeNode(0, TreeNode.NO_PARENT,
            Node.builder().name(ROOT_NAME).level(0).type(NodeType.RECORD).build()));
    }

    public TreeNode getRoot() {
        return arena.get(0);
    }

    public TreeNode get(int index) {
        return arena.get(index);
    }

    public Optional<TreeNode> parentOf(TreeNode treeNode) {
        if (treeNode.isRoot()) {
            return Optional.empty();
        }
        return Optional.of(arena.get(treeNode.getParentIndex()));
    }

    /**
     * Append a node as the last child of the given parent.
     */
    public TreeNode attach(TreeNode parent, Node node) {
        if (sealed) {
            throw new IllegalStateException("Tree is sealed");
        }
        TreeNode child = new TreeNode(arena.size(), parent.getIndex(), node);
        arena.add(child);
        parent.addChild(child);
        return child;
    }

    /**
     * Reject further {@link #attach} calls.
     */
    public NodeTree seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Number of tree nodes including the root.
     */
    public int size() {
        return arena.size();
    }

    public List<TreeNode> getNodes() {
        return Collections.unmodifiableList(arena);
    }
}
