package im.arun.copybook.tree;

import im.arun.copybook.exception.StructureException;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeTree;
import im.arun.copybook.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rebuilds the record hierarchy from the flat entry list using level numbers.
 *
 * <p>Levels only express nesting by relative magnitude: children may use any level
 * greater than their parent's and intermediate levels may be skipped. When a lower
 * level arrives, the builder walks up the ancestor chain looking for an entry with
 * exactly that level and attaches the new entry as its sibling.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    /**
     * Build the tree for the given entries.
     *
     * @param nodes entries in declaration order
     * @return sealed tree rooted at a synthetic level-0 record
     * @throws StructureException if an entry has no ancestor with a matching level
     */
    public NodeTree build(List<Node> nodes) {
        NodeTree tree = new NodeTree();
        TreeNode cursor = tree.getRoot();

        for (Node node : nodes) {
            if (node.getLevel() <= 0) {
                throw new StructureException("Level must be positive: " + node);
            }

            if (node.getLevel() > cursor.getLevel()) {
                // child of cursor
                cursor = tree.attach(cursor, node);
            } else if (node.getLevel() == cursor.getLevel()) {
                // sibling of cursor
                cursor = tree.attach(parentOf(tree, cursor), node);
            } else {
                // search up the chain for the matching level, then attach next to it
                TreeNode search = parentOf(tree, cursor);
                while (!search.isRoot() && search.getLevel() != node.getLevel()) {
                    search = parentOf(tree, search);
                }
                if (search.isRoot()) {
                    throw new StructureException(String.format("Could not find parent: %s, cursor: %s",
                        node, cursor.getNode()));
                }
                cursor = tree.attach(parentOf(tree, search), node);
            }
        }

        logger.debug("Built tree with {} entries", tree.size() - 1);
        return tree.seal();
    }

    private static TreeNode parentOf(NodeTree tree, TreeNode treeNode) {
        return tree.parentOf(treeNode)
            .orElseThrow(() -> new StructureException("Entry has no parent: " + treeNode));
    }
}
