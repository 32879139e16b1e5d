package com.jsonvaluate.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the nested tree representation into the flat chain representation.
 * The converted chain evaluates to the same result as the tree for every data record.
 */
public final class ConditionConverter {

    private ConditionConverter() {
    }

    /**
     * Convert a condition tree to a chain.
     * <ul>
     *   <li>A leaf becomes a single-link chain.</li>
     *   <li>A group becomes one link per child, each carrying the group's logic except the last.</li>
     *   <li>A degenerate node becomes the empty chain (both evaluate to true).</li>
     * </ul>
     *
     * @param node condition tree
     * @return equivalent condition chain
     */
    public static ConditionGroup toChain(ConditionNode node) {
        if (node == null) {
            return ConditionGroup.empty();
        }

        if (node.isGroup()) {
            List<ConditionNode> children = node.children();
            List<ConditionLink> links = new ArrayList<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Logic nextLogic = i < children.size() - 1 ? node.logic() : null;
                links.add(toLink(children.get(i), nextLogic));
            }
            return new ConditionGroup(links);
        }

        if (node.isLeaf()) {
            return ConditionGroup.of(ConditionLink.leaf(node.key(), node.operator(), node.value()));
        }

        return ConditionGroup.empty();
    }

    private static ConditionLink toLink(ConditionNode child, Logic nextLogic) {
        // Classification order matches the tree evaluator: group before leaf
        if (!child.isGroup() && child.isLeaf()) {
            return ConditionLink.leaf(child.key(), child.operator(), child.value(), nextLogic);
        }
        return ConditionLink.group(toChain(child), nextLogic);
    }
}
