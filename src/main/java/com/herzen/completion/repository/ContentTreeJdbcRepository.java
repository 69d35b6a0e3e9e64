package com.herzen.completion.repository;

import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.domain.ContentTree.ParentLink;
import com.herzen.completion.exception.CourseNotFoundException;
import com.herzen.completion.source.ContentTreeProvider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Repository
public class ContentTreeJdbcRepository implements ContentTreeProvider {
    private final JdbcTemplate jdbcTemplate;

    public ContentTreeJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public ContentTree getTree(String courseId) {
        List<ParentLink> links = jdbcTemplate.query(
                "SELECT block_key, block_type, parent_key FROM course_blocks WHERE course_id = ? ORDER BY child_index, block_key",
                (rs, rowNum) -> new ParentLink(rs.getString(1), rs.getString(2), rs.getString(3)),
                courseId);
        if (links.isEmpty()) {
            throw new CourseNotFoundException(courseId);
        }
        return ContentTree.fromParentLinks(courseId, links);
    }

    @Transactional
    public void replaceCourseBlocks(ContentTree tree) {
        jdbcTemplate.update("DELETE FROM course_blocks WHERE course_id = ?", tree.courseId());

        Deque<String> pending = new ArrayDeque<>(List.of(tree.rootId()));
        Set<String> written = new HashSet<>();
        while (!pending.isEmpty()) {
            String blockId = pending.poll();
            if (!written.add(blockId)) continue;
            ContentNode node = tree.node(blockId).orElseThrow();
            String parent = node.parentId();
            int index = parent == null ? 0 : tree.children(parent).indexOf(blockId);
            jdbcTemplate.update(
                    "INSERT INTO course_blocks(course_id, block_key, block_type, parent_key, child_index) VALUES (?,?,?,?,?)",
                    tree.courseId(), blockId, node.blockType(), parent, index);
            node.children().stream().filter(tree::contains).forEach(pending::add);
        }
    }
}
