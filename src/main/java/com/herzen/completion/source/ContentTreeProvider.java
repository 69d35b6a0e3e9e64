package com.herzen.completion.source;

import com.herzen.completion.domain.ContentTree;

public interface ContentTreeProvider {

    ContentTree getTree(String courseId);
}
