package com.libragraph.evidence.core.build;

import com.libragraph.evidence.core.entry.Entry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registered entries arranged by resolved parent, with siblings in registration order.
 */
public final class EntryTree {

    private final Map<String, Entry> byId;
    private final Map<String, String> parentOf;
    private final Map<String, List<Entry>> childrenOf;
    private final List<Entry> roots;
    private final List<Entry> depthFirst;

    private EntryTree(Map<String, Entry> byId, Map<String, String> parentOf,
                      Map<String, List<Entry>> childrenOf, List<Entry> roots) {
        this.byId = byId;
        this.parentOf = parentOf;
        this.childrenOf = childrenOf;
        this.roots = roots;
        this.depthFirst = walk();
    }

    /**
     * Resolves every parent reference against ids first, then natural keys.
     *
     * @param entries     registered entries, in registration order
     * @param naturalKeys natural key to entry id
     * @throws DanglingParentReferenceException if a reference resolves to nothing
     * @throws CyclicParentReferenceException   if an entry is its own ancestor
     */
    public static EntryTree resolve(Collection<Entry> entries, Map<String, String> naturalKeys) {
        Map<String, Entry> byId = new LinkedHashMap<>();
        for (Entry entry : entries) {
            byId.put(entry.id(), entry);
        }

        Map<String, String> parentOf = new HashMap<>();
        Map<String, List<Entry>> childrenOf = new HashMap<>();
        List<Entry> roots = new ArrayList<>();
        for (Entry entry : entries) {
            String reference = entry.parentId();
            if (reference == null) {
                roots.add(entry);
                continue;
            }
            String parentId = byId.containsKey(reference) ? reference : naturalKeys.get(reference);
            if (parentId == null) {
                throw new DanglingParentReferenceException(entry.id(), reference);
            }
            if (parentId.equals(entry.id())) {
                throw new CyclicParentReferenceException(List.of(entry.id(), entry.id()));
            }
            parentOf.put(entry.id(), parentId);
            childrenOf.computeIfAbsent(parentId, k -> new ArrayList<>()).add(entry);
        }

        checkAcyclic(byId, parentOf, childrenOf, roots);
        return new EntryTree(byId, parentOf, childrenOf, roots);
    }

    // Entries on a cycle are unreachable from the roots.
    private static void checkAcyclic(Map<String, Entry> byId, Map<String, String> parentOf,
                                     Map<String, List<Entry>> childrenOf, List<Entry> roots) {
        Set<String> reachable = new HashSet<>();
        Deque<Entry> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            Entry entry = stack.pop();
            if (reachable.add(entry.id())) {
                stack.addAll(childrenOf.getOrDefault(entry.id(), List.of()));
            }
        }
        if (reachable.size() == byId.size()) {
            return;
        }
        for (String id : byId.keySet()) {
            if (!reachable.contains(id)) {
                throw new CyclicParentReferenceException(cycleFrom(id, parentOf));
            }
        }
    }

    private static List<String> cycleFrom(String start, Map<String, String> parentOf) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> seenAt = new HashMap<>();
        String current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, path.size());
            path.add(current);
            current = parentOf.get(current);
        }
        List<String> cycle = new ArrayList<>(path.subList(seenAt.get(current), path.size()));
        cycle.add(current);
        return cycle;
    }

    private List<Entry> walk() {
        List<Entry> order = new ArrayList<>(byId.size());
        Deque<Entry> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            Entry entry = stack.pop();
            order.add(entry);
            List<Entry> children = children(entry);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Collections.unmodifiableList(order);
    }

    public List<Entry> roots() {
        return Collections.unmodifiableList(roots);
    }

    public List<Entry> children(Entry entry) {
        return Collections.unmodifiableList(childrenOf.getOrDefault(entry.id(), List.of()));
    }

    public boolean hasChildren(Entry entry) {
        return childrenOf.containsKey(entry.id());
    }

    public Optional<Entry> parent(Entry entry) {
        String parentId = parentOf.get(entry.id());
        return parentId == null ? Optional.empty() : Optional.of(byId.get(parentId));
    }

    /**
     * Every entry, parents before children, siblings in registration order.
     */
    public List<Entry> depthFirst() {
        return depthFirst;
    }

    public int size() {
        return byId.size();
    }

    /**
     * Path of {@code entry} below the container root, built from its ancestors'
     * {@link Entry#addAsParentPath(String)} contributions and its own effective name.
     */
    public String relativePath(Entry entry) {
        String path = entry.name();
        Optional<Entry> ancestor = parent(entry);
        while (ancestor.isPresent()) {
            path = ancestor.get().addAsParentPath(path);
            ancestor = parent(ancestor.get());
        }
        return path;
    }
}
