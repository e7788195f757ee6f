package im.arun.copybook.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@link Node} placed in a {@link NodeTree}.
 * The parent is held as an arena index and resolved through the owning tree.
 */
public class TreeNode {
    static final int NO_PARENT = -1;

    private final int index;
    private final int parentIndex;
    private final Node node;
    private final List<TreeNode> children = new ArrayList<>();
    private final List<TreeNode> childrenView = Collections.unmodifiableList(children);

    TreeNode(int index, int parentIndex, Node node) {
        this.index = index;
        this.parentIndex = parentIndex;
        this.node = node;
    }

    public int getIndex() {
        return index;
    }

    public int getParentIndex() {
        return parentIndex;
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    public Node getNode() {
        return node;
    }

    public int getLevel() {
        return node.getLevel();
    }

    public List<TreeNode> getChildren() {
        return childrenView;
    }

    void addChild(TreeNode child) {
        children.add(child);
    }

    @Override
    public String toString() {
        return "TreeNode: " + node.getName() + " (" + node.getLevel() + ")";
    }
}
