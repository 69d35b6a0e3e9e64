package com.herzen.completion.domain;

import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.exception.MalformedTreeException;

import java.util.*;

public final class ContentTree {
    private final String courseId;
    private final String rootId;
    private final Map<String, ContentNode> nodes;

    private ContentTree(String courseId, String rootId, Map<String, ContentNode> nodes) {
        this.courseId = courseId;
        this.rootId = rootId;
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static ContentTree of(String courseId, String rootId, Collection<ContentNode> nodes) {
        Map<String, ContentNode> index = new LinkedHashMap<>();
        for (ContentNode node : nodes) {
            if (index.putIfAbsent(node.id(), node) != null) {
                throw new MalformedTreeException(courseId, "duplicate block " + node.id());
            }
        }
        if (!index.containsKey(rootId)) {
            throw new MalformedTreeException(courseId, "root block " + rootId + " is missing");
        }
        checkParentLinks(courseId, rootId, index);
        return new ContentTree(courseId, rootId, index);
    }

    // Children absent from the index are left for the aggregator to report as dangling.
    private static void checkParentLinks(String courseId, String rootId, Map<String, ContentNode> index) {
        for (ContentNode node : index.values()) {
            if (node.id().equals(rootId)) {
                if (node.parentId() != null) {
                    throw new MalformedTreeException(courseId, "root block " + rootId + " has parent " + node.parentId());
                }
            } else {
                ContentNode parent = node.parentId() == null ? null : index.get(node.parentId());
                if (parent == null || !parent.children().contains(node.id())) {
                    throw new MalformedTreeException(courseId, "block " + node.id() + " is not listed by its parent " + node.parentId());
                }
            }
            for (String childId : node.children()) {
                ContentNode child = index.get(childId);
                if (child != null && !node.id().equals(child.parentId())) {
                    throw new MalformedTreeException(courseId, "block " + node.id() + " lists " + childId
                            + " whose parent is " + child.parentId());
                }
            }
        }
    }

    // children are ordered as the links are given
    public static ContentTree fromParentLinks(String courseId, List<ParentLink> links) {
        Map<String, List<String>> children = new LinkedHashMap<>();
        List<String> roots = new ArrayList<>();
        for (ParentLink link : links) {
            children.putIfAbsent(link.id(), new ArrayList<>());
            if (link.parentId() == null) {
                roots.add(link.id());
            } else {
                children.computeIfAbsent(link.parentId(), k -> new ArrayList<>()).add(link.id());
            }
        }
        if (roots.size() != 1) {
            throw new MalformedTreeException(courseId, "expected exactly one root block, found " + roots.size());
        }
        List<ContentNode> nodes = new ArrayList<>();
        Set<String> known = new HashSet<>();
        for (ParentLink link : links) {
            known.add(link.id());
            nodes.add(new ContentNode(link.id(), link.blockType(), children.get(link.id()), link.parentId()));
        }
        for (ParentLink link : links) {
            if (link.parentId() != null && !known.contains(link.parentId())) {
                throw new MalformedTreeException(courseId, "block " + link.id() + " references missing parent " + link.parentId());
            }
        }
        return of(courseId, roots.get(0), nodes);
    }

    public String courseId() {
        return courseId;
    }

    public String rootId() {
        return rootId;
    }

    public boolean contains(String blockId) {
        return nodes.containsKey(blockId);
    }

    public Optional<ContentNode> node(String blockId) {
        return Optional.ofNullable(nodes.get(blockId));
    }

    public List<String> children(String blockId) {
        ContentNode node = nodes.get(blockId);
        return node == null ? List.of() : node.children();
    }

    // the block itself, then each ancestor up to the root
    public List<String> pathToRoot(String blockId) {
        if (!nodes.containsKey(blockId)) return List.of();
        List<String> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = blockId;
        while (current != null) {
            if (!seen.add(current)) {
                throw new MalformedTreeException(courseId, "cycle in parent links at " + current);
            }
            path.add(current);
            ContentNode node = nodes.get(current);
            current = node == null ? null : node.parentId();
        }
        return path;
    }

    public Set<String> blockIds() {
        return nodes.keySet();
    }

    public record ParentLink(String id, String blockType, String parentId) {}
}
