package im.arun.copybook.util;

import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeTree;
import im.arun.copybook.model.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Traversal helpers for {@link NodeTree}.
 */
public class TreeUtils {

    private TreeUtils() {
    }

    /**
     * Entries in pre-order, excluding the synthetic root.
     * For a tree built from a parsed list this returns that list in its original order.
     */
    public static List<Node> preOrder(NodeTree tree) {
        List<Node> result = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        pushChildren(stack, tree.getRoot());

        while (!stack.isEmpty()) {
            TreeNode current = stack.pop();
            result.add(current.getNode());
            pushChildren(stack, current);
        }
        return result;
    }

    private static void pushChildren(Deque<TreeNode> stack, TreeNode parent) {
        List<TreeNode> children = parent.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /**
     * First entry with the given name in pre-order. Names are compared case-insensitively.
     */
    public static Optional<TreeNode> findByName(NodeTree tree, String name) {
        return tree.getNodes().stream()
            .filter(treeNode -> !treeNode.isRoot())
            .filter(treeNode -> treeNode.getNode().getName().equalsIgnoreCase(name))
            .min((a, b) -> Integer.compare(a.getIndex(), b.getIndex()));
    }

    /**
     * Number of nesting levels below the root; 0 for an empty tree.
     */
    public static int depth(NodeTree tree) {
        return depth(tree.getRoot());
    }

    private static int depth(TreeNode treeNode) {
        int max = 0;
        for (TreeNode child : treeNode.getChildren()) {
            max = Math.max(max, 1 + depth(child));
        }
        return max;
    }

    /**
     * Names from the root's first child down to the given entry, e.g. {@code REC.ADDRESS.CITY}.
     */
    public static String qualifiedName(NodeTree tree, TreeNode treeNode) {
        Deque<String> names = new ArrayDeque<>();
        TreeNode current = treeNode;
        while (!current.isRoot()) {
            names.push(current.getNode().getName());
            current = tree.parentOf(current).orElseThrow();
        }
        return String.join(".", names);
    }
}
