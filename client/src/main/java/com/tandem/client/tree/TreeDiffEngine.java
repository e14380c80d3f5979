package com.tandem.client.tree;

import com.tandem.protocol.NodeKind;
import com.tandem.protocol.ResourceNode;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies the difference between two snapshots of a domain tree.
 *
 * <p>Both snapshots are flattened to {@code id -> (name, parent, revision)}.
 * Ids only in the next tree are {@code CREATED}; ids only in the previous
 * tree are {@code DELETED}, with a path taken from the previous tree since
 * the node can no longer be located in the next one. For ids in both, a
 * changed name or parent is {@code MOVED_OR_RENAMED}; otherwise a changed
 * revision is {@code CONTENT_UPDATED}. Everything else is dropped.
 *
 * <p>Deletions come first, in previous-tree order, followed by the rest in
 * next-tree order. Neither input is modified.
 */
@Singleton
public class TreeDiffEngine {

    private static final String PATH_SEPARATOR = "/";

    record FlatNode(String id, String name, @Nullable String parentId, @Nullable String revision, NodeKind kind) {}

    private record Frame(ResourceNode node, @Nullable String enclosingId) {}

    public List<ChangeRecord> classify(List<ResourceNode> previous, List<ResourceNode> next) {
        Map<String, FlatNode> before = flatten(previous);
        Map<String, FlatNode> after = flatten(next);
        List<ChangeRecord> changes = new ArrayList<>();

        for (FlatNode old : before.values()) {
            if (!after.containsKey(old.id())) {
                changes.add(new ChangeRecord(old.id(), ChangeKind.DELETED, old.name(), old.kind(), pathOf(old, before)));
            }
        }

        for (FlatNode now : after.values()) {
            FlatNode old = before.get(now.id());
            if (old == null) {
                changes.add(record(now, ChangeKind.CREATED));
            } else if (!Objects.equals(old.name(), now.name()) || !Objects.equals(old.parentId(), now.parentId())) {
                changes.add(record(now, ChangeKind.MOVED_OR_RENAMED));
            } else if (!Objects.equals(old.revision(), now.revision())) {
                changes.add(record(now, ChangeKind.CONTENT_UPDATED));
            }
        }
        return changes;
    }

    /**
     * Pre-order flattening. A nested child without its own parent id takes
     * the id of the node it is nested in.
     */
    static Map<String, FlatNode> flatten(List<ResourceNode> roots) {
        Map<String, FlatNode> flat = new LinkedHashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(new Frame(roots.get(i), null));
        }
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            ResourceNode node = frame.node();
            String parentId = node.parentId() != null ? node.parentId() : frame.enclosingId();
            flat.putIfAbsent(node.id(), new FlatNode(node.id(), node.name(), parentId, node.revision(), node.kind()));
            List<ResourceNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), node.id()));
            }
        }
        return flat;
    }

    static String pathOf(FlatNode node, Map<String, FlatNode> tree) {
        Deque<String> names = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        FlatNode current = node;
        while (current != null && seen.add(current.id())) {
            names.addFirst(current.name());
            current = current.parentId() == null ? null : tree.get(current.parentId());
        }
        return String.join(PATH_SEPARATOR, names);
    }

    private static ChangeRecord record(FlatNode node, ChangeKind kind) {
        return new ChangeRecord(node.id(), kind, node.name(), node.kind(), null);
    }
}
